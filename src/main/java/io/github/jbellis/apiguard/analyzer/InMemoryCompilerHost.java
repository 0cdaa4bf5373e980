package io.github.jbellis.apiguard.analyzer;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Serves source files from memory. Paths are normalized on the way in and on lookup.
 */
public final class InMemoryCompilerHost implements CompilerHost {
    private final Map<Path, String> files = new LinkedHashMap<>();

    public InMemoryCompilerHost add(String path, String content) {
        return add(Path.of(path), content);
    }

    public InMemoryCompilerHost add(Path path, String content) {
        files.put(path.normalize(), content);
        return this;
    }

    @Override
    public Optional<String> readFile(Path path) {
        return Optional.ofNullable(files.get(path.normalize()));
    }

    @Override
    public boolean fileExists(Path path) {
        return files.containsKey(path.normalize());
    }
}
