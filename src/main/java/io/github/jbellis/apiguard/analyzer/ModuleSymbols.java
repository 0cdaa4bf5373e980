package io.github.jbellis.apiguard.analyzer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binding result for one file.
 *
 * @param locals               top-level names in scope: declarations (exported or not) and imports
 * @param exports              names the file exports itself, in source order; re-exports through
 *                             {@code export * from} are not included
 * @param exportStarSpecifiers module specifiers of {@code export * from} statements
 * @param moduleSpecifiers     every module specifier the file refers to
 */
public record ModuleSymbols(SourceFile sourceFile,
                            Map<String, Symbol> locals,
                            Map<String, Symbol> exports,
                            List<String> exportStarSpecifiers,
                            List<String> moduleSpecifiers)
{
    public ModuleSymbols {
        locals = Map.copyOf(locals);
        // keep source order for exports
        exports = Collections.unmodifiableMap(new LinkedHashMap<>(exports));
        exportStarSpecifiers = List.copyOf(exportStarSpecifiers);
        moduleSpecifiers = List.copyOf(moduleSpecifiers);
    }
}
