package io.github.jbellis.apiguard.analyzer;

/**
 * Character range [start, end) of a comment in a source file. Comments are trivia: they are not part of the
 * syntax tree, only recorded here so that callers can skip over them.
 */
public record CommentRange(int start, int end) {
    public CommentRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid comment range [%d, %d)".formatted(start, end));
        }
    }
}
