package io.github.jbellis.apiguard.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads UTF-8 source files from the local file system.
 */
public final class DiskCompilerHost implements CompilerHost {
    private static final Logger logger = LogManager.getLogger(DiskCompilerHost.class);

    @Override
    public Optional<String> readFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            logger.warn("Unable to read source file {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean fileExists(Path path) {
        return Files.isRegularFile(path);
    }
}
