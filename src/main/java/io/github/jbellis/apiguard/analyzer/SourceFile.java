package io.github.jbellis.apiguard.analyzer;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A parsed source file: its text, the comments found in it and the root of its syntax tree.
 */
public final class SourceFile {
    private final Path path;
    private final String text;
    private final List<CommentRange> comments;
    private final int[] lineStarts;
    private @Nullable SyntaxNode root;
    private boolean externalModule;

    SourceFile(Path path, String text, List<CommentRange> comments) {
        this.path = path;
        this.text = text;
        this.comments = comments.stream()
                .sorted((a, b) -> Integer.compare(a.start(), b.start()))
                .toList();
        this.lineStarts = computeLineStarts(text);
    }

    void attachRoot(SyntaxNode root, boolean externalModule) {
        if (this.root != null) {
            throw new IllegalStateException("Root already attached for " + path);
        }
        this.root = root;
        this.externalModule = externalModule;
    }

    private static int[] computeLineStarts(String text) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                i++;
                starts.add(i + 1);
            } else if (c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public Path path() {
        return path;
    }

    public String fileName() {
        return path.toString();
    }

    public String text() {
        return text;
    }

    public SyntaxNode root() {
        if (root == null) {
            throw new IllegalStateException("Syntax tree not built for " + path);
        }
        return root;
    }

    /** True when the file has a top-level import or export, i.e. it is a module rather than a global script. */
    public boolean isExternalModule() {
        return externalModule;
    }

    public List<CommentRange> comments() {
        return comments;
    }

    /** Comments lying entirely within [from, to). */
    public List<CommentRange> commentsWithin(int from, int to) {
        var result = new ArrayList<CommentRange>();
        for (var comment : comments) {
            if (comment.start() >= to) {
                break;
            }
            if (comment.start() >= from && comment.end() <= to) {
                result.add(comment);
            }
        }
        return result;
    }

    /** 1-based line and column of a character offset. */
    public Position positionOf(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        int line = idx >= 0 ? idx : -idx - 2;
        return new Position(line + 1, offset - lineStarts[line] + 1);
    }

    public record Position(int line, int column) {
    }

    @Override
    public String toString() {
        return "SourceFile[" + path + ']';
    }
}
