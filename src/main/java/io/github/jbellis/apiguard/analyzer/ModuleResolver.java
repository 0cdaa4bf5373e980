package io.github.jbellis.apiguard.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Maps module specifiers to files. Only relative specifiers are resolved; package names are deliberately left
 * alone so that their symbols never enter the program.
 */
final class ModuleResolver {
    private static final Logger logger = LogManager.getLogger(ModuleResolver.class);

    // Same precedence as the TypeScript compiler's classic resolution
    private static final List<String> EXTENSIONS = List.of(".ts", ".tsx", ".d.ts");

    private final CompilerHost host;
    private final FrontEndConfig config;

    ModuleResolver(CompilerHost host, FrontEndConfig config) {
        this.host = host;
        this.config = config;
    }

    Optional<Path> resolve(String specifier, Path containingFile) {
        if (config.moduleResolution() == ModuleResolution.NONE) {
            return Optional.empty();
        }
        if (!isRelative(specifier)) {
            logger.debug("Not resolving non-relative module '{}' imported from {}", specifier, containingFile);
            return Optional.empty();
        }

        var base = containingFile.resolveSibling(specifier).normalize();
        if (specifier.endsWith(".ts") && host.fileExists(base)) {
            return Optional.of(base);
        }
        for (var extension : EXTENSIONS) {
            var candidate = base.resolveSibling(base.getFileName() + extension);
            if (host.fileExists(candidate)) {
                return Optional.of(candidate);
            }
        }
        logger.debug("Module '{}' imported from {} not found", specifier, containingFile);
        return Optional.empty();
    }

    static boolean isRelative(String specifier) {
        return specifier.startsWith("./")
                || specifier.startsWith("../")
                || specifier.equals(".")
                || specifier.equals("..");
    }
}
