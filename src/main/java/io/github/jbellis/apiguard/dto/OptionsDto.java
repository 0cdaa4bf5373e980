package io.github.jbellis.apiguard.dto;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * DTO record for the JSON options file, e.g.
 * <pre>{@code
 * { "stripExportPattern": "^__", "allowModuleIdentifiers": ["angular"] }
 * }</pre>
 */
public record OptionsDto(@Nullable String stripExportPattern, List<String> allowModuleIdentifiers) {
    public OptionsDto {
        allowModuleIdentifiers = allowModuleIdentifiers != null ? List.copyOf(allowModuleIdentifiers) : List.of();
    }
}
