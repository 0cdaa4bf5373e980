package io.github.jbellis.apiguard.analyzer;

public enum ModuleResolution {
    /** Follow relative module specifiers ({@code ./x}, {@code ../x}); never look up packages. */
    LOCAL_ONLY,
    /** Follow no module specifiers; every import and re-export stays unresolved. */
    NONE
}
