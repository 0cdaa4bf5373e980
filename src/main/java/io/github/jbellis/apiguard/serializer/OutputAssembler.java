package io.github.jbellis.apiguard.serializer;

import io.github.jbellis.apiguard.analyzer.Symbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders resolved symbols into the final API text: one entry per export, sorted by name, separated by a blank
 * line.
 */
public final class OutputAssembler {
    private static final Logger logger = LogManager.getLogger(OutputAssembler.class);

    /** Reports problems as log warnings. */
    public static final DiagnosticSink LOGGING_SINK = logger::warn;

    private final SerializationOptions options;
    private final DiagnosticSink diagnostics;
    private final TextSanitizer sanitizer;

    public OutputAssembler(SerializationOptions options) {
        this(options, LOGGING_SINK);
    }

    public OutputAssembler(SerializationOptions options, DiagnosticSink diagnostics) {
        this.options = options;
        this.diagnostics = diagnostics;
        this.sanitizer = new TextSanitizer(options);
    }

    public String assemble(Collection<? extends Symbol> symbols) {
        var sorted = new ArrayList<Symbol>(symbols);
        sorted.sort(byName());

        var output = new StringBuilder();
        for (var symbol : sorted) {
            if (options.excludes(symbol.name())) {
                continue;
            }
            if (!symbol.hasDeclaration()) {
                diagnostics.warn("No declaration found for symbol \"%s\"".formatted(symbol.name()));
                continue;
            }
            var statement = DeclarationLocator.locateExportStatement(symbol);
            if (statement.isEmpty()) {
                // re-exports of external modules end up here
                diagnostics.warn("No export declaration found for symbol \"%s\"".formatted(symbol.name()));
                continue;
            }
            if (output.length() > 0) {
                output.append('\n');
            }
            output.append(stripEmptyLines(sanitizer.sanitize(statement.get()))).append('\n');
        }
        return output.toString();
    }

    /** Locale-aware order on symbol names, with plain code unit order breaking ties the collator leaves. */
    static Comparator<Symbol> byName() {
        var collator = Collator.getInstance(Locale.ROOT);
        return Comparator.comparing(Symbol::name, collator).thenComparing(Symbol::name);
    }

    static String stripEmptyLines(String text) {
        return Arrays.stream(text.split("\\r?\\n"))
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
    }
}
