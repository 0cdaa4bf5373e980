package io.github.jbellis.apiguard.analyzer;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable node of a parsed declaration file.
 *
 * <p>Offsets are String indexes into {@link SourceFile#text()}. {@link #fullStart()} is where the node's leading
 * trivia (whitespace and comments) begins, i.e. the end of the previous token; {@link #start()} is where the node
 * itself begins. The parent reference is for lookup only.
 */
public final class SyntaxNode {
    private final SourceFile sourceFile;
    private final @Nullable SyntaxNode parent;
    private final SyntaxKind kind;
    private final String type;
    private final @Nullable String field;
    private final Set<NodeFlag> flags;
    private int fullStart;
    private final int start;
    private int end;
    private List<SyntaxNode> children = List.of();
    private boolean sealed;

    SyntaxNode(SourceFile sourceFile,
               @Nullable SyntaxNode parent,
               SyntaxKind kind,
               String type,
               @Nullable String field,
               Set<NodeFlag> flags,
               int start,
               int end)
    {
        this.sourceFile = sourceFile;
        this.parent = parent;
        this.kind = kind;
        this.type = type;
        this.field = field;
        this.flags = flags.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(flags));
        this.fullStart = start;
        this.start = start;
        this.end = end;
    }

    /**
     * Completes construction. Called exactly once by the tree builder after the children are known; the full
     * start becomes that of the first child (or the given token full start for leaves) and the end may grow to
     * cover separators absorbed into the node.
     */
    void seal(List<SyntaxNode> children, int fullStart, int end) {
        if (sealed) {
            throw new IllegalStateException("Node already sealed: " + this);
        }
        this.children = List.copyOf(children);
        this.fullStart = fullStart;
        this.end = end;
        this.sealed = true;
    }

    public SourceFile sourceFile() {
        return sourceFile;
    }

    public @Nullable SyntaxNode parent() {
        return parent;
    }

    public SyntaxKind kind() {
        return kind;
    }

    /** The tree-sitter grammar type this node was built from, e.g. {@code class_declaration} or {@code ;}. */
    public String type() {
        return type;
    }

    /** The grammar field this node occupies in its parent, e.g. {@code name}, or null. */
    public @Nullable String field() {
        return field;
    }

    public Set<NodeFlag> flags() {
        return flags;
    }

    public boolean hasFlag(NodeFlag flag) {
        return flags.contains(flag);
    }

    public int fullStart() {
        return fullStart;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    public List<SyntaxNode> children() {
        return children;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** First child occupying the given grammar field, or null. */
    public @Nullable SyntaxNode childByField(String fieldName) {
        for (var child : children) {
            if (fieldName.equals(child.field)) {
                return child;
            }
        }
        return null;
    }

    /** First child of the given grammar type, or null. */
    public @Nullable SyntaxNode childOfType(String childType) {
        for (var child : children) {
            if (childType.equals(child.type)) {
                return child;
            }
        }
        return null;
    }

    public List<SyntaxNode> namedChildren() {
        return children.stream().filter(c -> c.kind != SyntaxKind.TOKEN).toList();
    }

    /** Source text of the node without its leading trivia. */
    public String text() {
        return sourceFile.text().substring(start, end);
    }

    @Override
    public String toString() {
        return "%s[%s %d..%d]".formatted(kind, type, start, end);
    }
}
