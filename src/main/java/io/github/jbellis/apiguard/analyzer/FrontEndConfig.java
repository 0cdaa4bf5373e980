package io.github.jbellis.apiguard.analyzer;

import java.util.Objects;

/**
 * Front end settings that affect which files end up in a {@link Program}.
 */
public record FrontEndConfig(ModuleResolution moduleResolution) {
    public FrontEndConfig {
        Objects.requireNonNull(moduleResolution, "moduleResolution cannot be null");
    }

    /** Resolves only local, relative references, so that symbols of external packages stay unresolved. */
    public static FrontEndConfig localOnly() {
        return new FrontEndConfig(ModuleResolution.LOCAL_ONLY);
    }
}
