package io.github.jbellis.apiguard.serializer;

import io.github.jbellis.apiguard.analyzer.NodeFlag;
import io.github.jbellis.apiguard.analyzer.Symbol;
import io.github.jbellis.apiguard.analyzer.SyntaxNode;

import java.util.Optional;

/**
 * Finds the statement to render for a symbol. A variable's declaration is only the declarator, so the walk goes
 * up to the enclosing {@code export} statement.
 */
public final class DeclarationLocator {
    private DeclarationLocator() {
    }

    public static Optional<SyntaxNode> locateExportStatement(Symbol symbol) {
        var node = symbol.firstDeclaration();
        while (node != null && !node.hasFlag(NodeFlag.EXPORTED)) {
            node = node.parent();
        }
        return Optional.ofNullable(node);
    }
}
