package io.github.jbellis.apiguard.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The files parsed by a {@link DeclarationFrontEnd} together with their symbol tables. Answers the two questions
 * the serializer asks: what does a module export, and what does an alias stand for.
 */
public final class Program {
    private static final Logger logger = LogManager.getLogger(Program.class);

    private final Map<Path, ModuleSymbols> modules;
    private final Map<Path, Map<String, Path>> resolvedModules;

    Program(Map<Path, ModuleSymbols> modules, Map<Path, Map<String, Path>> resolvedModules) {
        this.modules = new LinkedHashMap<>(modules);
        this.resolvedModules = Map.copyOf(resolvedModules);
    }

    /** Parsed files in load order; root files come first. */
    public List<SourceFile> sourceFiles() {
        return modules.values().stream().map(ModuleSymbols::sourceFile).toList();
    }

    public Optional<SourceFile> sourceFile(Path path) {
        return Optional.ofNullable(modules.get(path.normalize())).map(ModuleSymbols::sourceFile);
    }

    public ModuleSymbols moduleSymbols(SourceFile file) {
        var symbols = modules.get(file.path());
        if (symbols == null) {
            throw new IllegalArgumentException(file + " is not part of this program");
        }
        return symbols;
    }

    /** The file a module specifier written in {@code from} refers to, if it was resolved and loaded. */
    public Optional<SourceFile> resolvedModule(String specifier, SourceFile from) {
        var path = resolvedModules.getOrDefault(from.path(), Map.of()).get(specifier);
        return path == null ? Optional.empty() : sourceFile(path);
    }

    /**
     * All names a module exports, including names re-exported through {@code export * from}. Local exports win
     * over re-exported ones and {@code default} is never re-exported. Scripts export nothing.
     */
    public Map<String, Symbol> exportsOfModule(SourceFile file) {
        var result = new LinkedHashMap<String, Symbol>();
        if (file.isExternalModule()) {
            var visiting = new HashSet<Path>();
            visiting.add(file.path());
            collectExports(file, result, visiting, true);
        }
        return result;
    }

    private void collectExports(SourceFile file, Map<String, Symbol> result, Set<Path> visiting, boolean withDefault) {
        var symbols = moduleSymbols(file);
        symbols.exports().forEach((name, symbol) -> {
            if (withDefault || !ModuleBinder.DEFAULT_EXPORT.equals(name)) {
                result.putIfAbsent(name, symbol);
            }
        });
        for (var specifier : symbols.exportStarSpecifiers()) {
            var target = resolvedModule(specifier, file);
            if (target.isEmpty()) {
                logger.debug("export * from '{}' in {} not followed", specifier, file);
                continue;
            }
            if (visiting.add(target.get().path()) && target.get().isExternalModule()) {
                collectExports(target.get(), result, visiting, false);
            }
        }
    }

    /**
     * Follows an alias to the symbol it finally stands for. Empty when the chain leads out of the program, to an
     * unknown name, or around a cycle.
     */
    public Optional<Symbol> aliasedSymbol(Symbol.Alias alias) {
        var visited = new HashSet<Symbol.Alias>();
        Symbol.Alias current = alias;
        while (visited.add(current)) {
            var target = immediateTarget(current);
            if (target.isEmpty() || !(target.get() instanceof Symbol.Alias next)) {
                return target;
            }
            current = next;
        }
        logger.debug("Alias cycle through {}", alias.name());
        return Optional.empty();
    }

    private Optional<Symbol> immediateTarget(Symbol.Alias alias) {
        var file = alias.containingFile();
        var specifier = alias.moduleSpecifier();
        if (specifier == null) {
            var targetName = alias.targetName();
            // qualified names (import x = a.b) would need member lookup in namespaces
            if (targetName == null || targetName.contains(".")) {
                return Optional.empty();
            }
            var local = moduleSymbols(file).locals().get(targetName);
            return local == alias ? Optional.empty() : Optional.ofNullable(local);
        }

        var module = resolvedModule(specifier, file);
        if (module.isEmpty()) {
            return Optional.empty();
        }
        var targetName = alias.targetName();
        if (targetName == null) {
            return Optional.of(moduleSymbol(specifier, module.get()));
        }
        return Optional.ofNullable(exportsOfModule(module.get()).get(targetName));
    }

    private static Symbol moduleSymbol(String specifier, SourceFile module) {
        var root = module.root();
        return new Symbol.Direct('"' + specifier + '"', root, List.of(root));
    }
}
