package io.github.jbellis.apiguard.analyzer;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Source text provider for the front end. Implementations decide where files come from (disk, memory).
 */
public interface CompilerHost {

    /** Returns the text of the file, or empty if it does not exist or cannot be read. */
    Optional<String> readFile(Path path);

    default boolean fileExists(Path path) {
        return readFile(path).isPresent();
    }
}
