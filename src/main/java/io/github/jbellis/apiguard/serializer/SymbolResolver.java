package io.github.jbellis.apiguard.serializer;

import io.github.jbellis.apiguard.analyzer.Program;
import io.github.jbellis.apiguard.analyzer.SourceFile;
import io.github.jbellis.apiguard.analyzer.Symbol;
import io.github.jbellis.apiguard.serializer.ApiSerializationException.AliasRenamedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the exports of a module into the symbols whose declarations should be rendered.
 */
public final class SymbolResolver {
    private static final Logger logger = LogManager.getLogger(SymbolResolver.class);

    private final Program program;

    public SymbolResolver(Program program) {
        this.program = program;
    }

    /**
     * Returns one symbol per exported name. Aliases are replaced by what they resolve to; an alias whose target
     * is unknown or has no declaration (a re-export of an external package, say) is returned as is.
     *
     * @throws AliasRenamedException if an export resolves to a declaration of a different name
     */
    public List<Symbol> resolveExports(SourceFile sourceFile) {
        var result = new ArrayList<Symbol>();
        for (var symbol : program.exportsOfModule(sourceFile).values()) {
            result.add(resolve(symbol));
        }
        return result;
    }

    Symbol resolve(Symbol symbol) {
        if (!(symbol instanceof Symbol.Alias alias)) {
            return symbol;
        }
        var target = program.aliasedSymbol(alias);
        if (target.isEmpty() || !target.get().hasDeclaration()) {
            logger.debug("Alias {} could not be resolved; keeping it", alias.name());
            return alias;
        }
        var resolved = target.get();
        if (!resolved.name().equals(alias.name())) {
            throw new AliasRenamedException(alias.name(), resolved.name());
        }
        return resolved;
    }
}
