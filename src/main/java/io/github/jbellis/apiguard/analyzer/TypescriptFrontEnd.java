package io.github.jbellis.apiguard.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterTypescript;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tree-sitter based front end for TypeScript declaration files.
 */
public final class TypescriptFrontEnd implements DeclarationFrontEnd {
    private static final Logger logger = LogManager.getLogger(TypescriptFrontEnd.class);
    private static final TSLanguage TS_LANGUAGE = new TreeSitterTypescript();

    private final CompilerHost host;

    public TypescriptFrontEnd(CompilerHost host) {
        this.host = host;
    }

    @Override
    public Program createProgram(List<Path> rootNames, FrontEndConfig config) {
        var parser = new TSParser();
        parser.setLanguage(TS_LANGUAGE);
        var resolver = new ModuleResolver(host, config);

        var modules = new LinkedHashMap<Path, ModuleSymbols>();
        var resolutions = new HashMap<Path, Map<String, Path>>();
        var pending = new ArrayDeque<Path>();
        rootNames.forEach(p -> pending.add(p.normalize()));

        while (!pending.isEmpty()) {
            var path = pending.poll();
            if (modules.containsKey(path)) {
                continue;
            }
            var text = host.readFile(path);
            if (text.isEmpty()) {
                logger.warn("Source file {} could not be read; leaving it out of the program", path);
                continue;
            }

            var sourceFile = parse(parser, path, text.get());
            var symbols = ModuleBinder.bind(sourceFile);
            modules.put(path, symbols);

            var resolved = new LinkedHashMap<String, Path>();
            for (var specifier : symbols.moduleSpecifiers()) {
                resolver.resolve(specifier, path).ifPresent(target -> {
                    resolved.put(specifier, target);
                    pending.add(target);
                });
            }
            resolutions.put(path, resolved);
        }

        logger.debug("Loaded {} source files for roots {}", modules.size(), rootNames);
        return new Program(modules, resolutions);
    }

    private static SourceFile parse(TSParser parser, Path path, String text) {
        var content = SourceContent.of(text);
        var tree = parser.parseString(null, content.text());
        var root = tree.getRootNode();
        if (root.hasError()) {
            logger.warn("Syntax errors in {}; output for the affected declarations may be incomplete", path);
        }
        return SyntaxTreeBuilder.build(path, content, root);
    }
}
