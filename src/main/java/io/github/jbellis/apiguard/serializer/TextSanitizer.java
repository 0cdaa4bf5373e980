package io.github.jbellis.apiguard.serializer;

import io.github.jbellis.apiguard.analyzer.NodeFlag;
import io.github.jbellis.apiguard.analyzer.SyntaxKind;
import io.github.jbellis.apiguard.analyzer.SyntaxNode;
import io.github.jbellis.apiguard.serializer.ApiSerializationException.UnlistedModuleIdentifierException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a syntax tree back to text without comments and private members, with class and interface members in
 * canonical order.
 */
public final class TextSanitizer {
    private final SerializationOptions options;

    public TextSanitizer(SerializationOptions options) {
        this.options = options;
    }

    /**
     * @throws UnlistedModuleIdentifierException if the node refers to a namespace qualifier that is not allowed
     */
    public String sanitize(SyntaxNode node) {
        var out = new StringBuilder();
        append(node, out);
        return out.toString();
    }

    private void append(SyntaxNode node, StringBuilder out) {
        if (isPruned(node)) {
            return;
        }

        var qualifier = firstQualifier(node);
        if (qualifier != null && !options.isModuleIdentifierAllowed(qualifier.text())) {
            var file = qualifier.sourceFile();
            var position = file.positionOf(qualifier.start());
            throw new UnlistedModuleIdentifierException(file.fileName(), position.line(), position.column(),
                                                        qualifier.text());
        }

        if (node.isLeaf()) {
            out.append(leafText(node));
            return;
        }
        for (var child : renderOrder(node)) {
            append(child, out);
        }
    }

    static boolean isPruned(SyntaxNode node) {
        return node.hasFlag(NodeFlag.PRIVATE);
    }

    /**
     * The leftmost identifier of a dotted reference: {@code ns} for the expression {@code ns.a.B} or the type
     * {@code ns.a.B}. Null for anything else, including dotted names that are not references (namespace names,
     * {@code typeof} queries) and chains rooted in something other than an identifier, like {@code this.a}.
     */
    static @Nullable SyntaxNode firstQualifier(SyntaxNode node) {
        SyntaxNode lhs;
        if (node.kind() == SyntaxKind.PROPERTY_ACCESS_EXPRESSION) {
            lhs = node.childByField("object");
        } else if (node.kind() == SyntaxKind.QUALIFIED_TYPE_NAME) {
            lhs = node.childByField("module");
        } else {
            return null;
        }

        while (lhs != null && lhs.kind() != SyntaxKind.IDENTIFIER) {
            lhs = switch (lhs.type()) {
                case "member_expression", "nested_identifier" -> {
                    var object = lhs.childByField("object");
                    yield object != null || lhs.namedChildren().isEmpty() ? object : lhs.namedChildren().get(0);
                }
                case "call_expression" -> lhs.childByField("function");
                default -> null;
            };
        }
        return lhs;
    }

    /** Children in render order; members of a class or interface are sorted when every one of them has a rank. */
    static List<SyntaxNode> renderOrder(SyntaxNode node) {
        var children = node.children();
        if (node.kind() != SyntaxKind.MEMBER_LIST || !isClassOrInterfaceBody(node.parent())) {
            return children;
        }
        if (!children.stream().allMatch(MemberOrder::isRanked)) {
            return children;
        }
        var sorted = new ArrayList<>(children);
        sorted.sort(MemberOrder.COMPARATOR);
        return sorted;
    }

    private static boolean isClassOrInterfaceBody(@Nullable SyntaxNode body) {
        if (body == null || body.parent() == null) {
            return false;
        }
        var owner = body.parent().kind();
        return owner == SyntaxKind.CLASS_DECLARATION || owner == SyntaxKind.INTERFACE_DECLARATION;
    }

    /** Leaf text including leading whitespace, minus everything up to the end of the last leading comment. */
    static String leafText(SyntaxNode leaf) {
        var file = leaf.sourceFile();
        int tail = leaf.fullStart();
        for (var comment : file.commentsWithin(leaf.fullStart(), leaf.start())) {
            tail = Math.max(tail, comment.end());
        }
        return file.text().substring(tail, leaf.end());
    }
}
