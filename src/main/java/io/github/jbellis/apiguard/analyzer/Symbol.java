package io.github.jbellis.apiguard.analyzer;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A named entity of a module. Either a {@link Direct} symbol backed by its own declarations, or an {@link Alias}
 * that names another symbol (an import, or an export list entry) and must be resolved through the
 * {@link Program}.
 */
public sealed interface Symbol permits Symbol.Direct, Symbol.Alias {

    String name();

    List<SyntaxNode> declarations();

    /** The declaration that defines the symbol's value, if it has one. */
    @Nullable SyntaxNode primaryDeclaration();

    /** The primary declaration, falling back to the first declaration. */
    default @Nullable SyntaxNode firstDeclaration() {
        var primary = primaryDeclaration();
        if (primary != null) {
            return primary;
        }
        return declarations().isEmpty() ? null : declarations().get(0);
    }

    default boolean hasDeclaration() {
        return firstDeclaration() != null;
    }

    record Direct(String name, @Nullable SyntaxNode primaryDeclaration, List<SyntaxNode> declarations)
            implements Symbol
    {
        public Direct {
            Objects.requireNonNull(name, "name cannot be null");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Symbol name cannot be empty");
            }
            declarations = List.copyOf(declarations);
        }
    }

    /**
     * @param targetName      the name the alias refers to inside the target module (or the local scope when
     *                        {@code moduleSpecifier} is null); null when the alias names the whole module
     * @param moduleSpecifier the module the alias reads from, as written in the source, or null for local names
     */
    record Alias(String name,
                 @Nullable String targetName,
                 @Nullable String moduleSpecifier,
                 List<SyntaxNode> declarations)
            implements Symbol
    {
        public Alias {
            Objects.requireNonNull(name, "name cannot be null");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Symbol name cannot be empty");
            }
            if (targetName == null && moduleSpecifier == null) {
                throw new IllegalArgumentException("Alias " + name + " must name a symbol or a module");
            }
            if (declarations.isEmpty()) {
                throw new IllegalArgumentException("Alias " + name + " must have the clause that declares it");
            }
            declarations = List.copyOf(declarations);
        }

        @Override
        public @Nullable SyntaxNode primaryDeclaration() {
            return null;
        }

        /** The file the alias is written in. */
        public SourceFile containingFile() {
            return declarations.get(0).sourceFile();
        }
    }
}
