package io.github.jbellis.apiguard.serializer;

/**
 * Receives non-fatal problems found while rendering an API.
 */
@FunctionalInterface
public interface DiagnosticSink {
    void warn(String message);
}
