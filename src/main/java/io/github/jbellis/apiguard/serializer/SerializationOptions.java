package io.github.jbellis.apiguard.serializer;

import io.github.jbellis.apiguard.dto.OptionsDto;
import io.github.jbellis.apiguard.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Caller-supplied rendering settings.
 *
 * @param stripExportPattern     exports whose name contains a match are left out of the output
 * @param allowModuleIdentifiers namespace qualifiers that exported declarations may refer to, e.g. {@code angular}
 *                               to permit {@code class Foo extends angular.Bar}
 */
public record SerializationOptions(@Nullable Pattern stripExportPattern, Set<String> allowModuleIdentifiers) {
    public SerializationOptions {
        allowModuleIdentifiers = allowModuleIdentifiers != null
                                 ? Collections.unmodifiableSet(new TreeSet<>(allowModuleIdentifiers))
                                 : Set.of();
    }

    public static SerializationOptions defaults() {
        return new SerializationOptions(null, Set.of());
    }

    public SerializationOptions withStripExportPattern(@Nullable String regex) {
        return new SerializationOptions(regex == null ? null : Pattern.compile(regex), allowModuleIdentifiers);
    }

    public SerializationOptions withAllowModuleIdentifiers(Collection<String> identifiers) {
        return new SerializationOptions(stripExportPattern, Set.copyOf(identifiers));
    }

    /** Partial match, so {@code ^_} strips every name that starts with an underscore. */
    public boolean excludes(String exportName) {
        return stripExportPattern != null && stripExportPattern.matcher(exportName).find();
    }

    public boolean isModuleIdentifierAllowed(String identifier) {
        return allowModuleIdentifiers.contains(identifier);
    }

    public static SerializationOptions fromDto(OptionsDto dto) {
        return defaults()
                .withStripExportPattern(dto.stripExportPattern())
                .withAllowModuleIdentifiers(dto.allowModuleIdentifiers());
    }

    public OptionsDto toDto() {
        return new OptionsDto(stripExportPattern == null ? null : stripExportPattern.pattern(),
                              List.copyOf(allowModuleIdentifiers));
    }

    /**
     * Reads options from a JSON file shaped like {@link OptionsDto}.
     *
     * @throws IOException if the file cannot be read or is not valid JSON for the DTO
     */
    public static SerializationOptions load(Path optionsFile) throws IOException {
        return fromDto(Json.mapper.readValue(optionsFile.toFile(), OptionsDto.class));
    }
}
