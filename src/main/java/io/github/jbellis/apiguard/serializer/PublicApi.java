package io.github.jbellis.apiguard.serializer;

import io.github.jbellis.apiguard.analyzer.DeclarationFrontEnd;
import io.github.jbellis.apiguard.analyzer.DiskCompilerHost;
import io.github.jbellis.apiguard.analyzer.FrontEndConfig;
import io.github.jbellis.apiguard.analyzer.TypescriptFrontEnd;
import io.github.jbellis.apiguard.serializer.ApiSerializationException.EntryFileNotFoundException;
import io.github.jbellis.apiguard.serializer.ApiSerializationException.NotADeclarationFileException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Entry points for rendering the public API of a declaration file.
 */
public final class PublicApi {
    private static final Logger logger = LogManager.getLogger(PublicApi.class);
    private static final Pattern DECLARATION_FILE = Pattern.compile("\\.d\\.ts$");

    private PublicApi() {
    }

    public static String publicApi(Path fileName) {
        return publicApi(fileName, SerializationOptions.defaults());
    }

    /**
     * Renders the API of a {@code .d.ts} file on disk. Relative imports are followed; package imports are not,
     * so symbols re-exported from other packages are reported and skipped.
     */
    public static String publicApi(Path fileName, SerializationOptions options) {
        return publicApiInternal(new TypescriptFrontEnd(new DiskCompilerHost()), fileName,
                                 FrontEndConfig.localOnly(), options);
    }

    public static String publicApiInternal(DeclarationFrontEnd frontEnd,
                                           Path fileName,
                                           FrontEndConfig config,
                                           SerializationOptions options)
    {
        return publicApiInternal(frontEnd, fileName, config, options, OutputAssembler.LOGGING_SINK);
    }

    /**
     * @throws NotADeclarationFileException if the file name does not end in {@code .d.ts}
     * @throws EntryFileNotFoundException   if the front end could not load the file
     * @throws ApiSerializationException    for aliased exports and unlisted module identifiers
     */
    public static String publicApiInternal(DeclarationFrontEnd frontEnd,
                                           Path fileName,
                                           FrontEndConfig config,
                                           SerializationOptions options,
                                           DiagnosticSink diagnostics)
    {
        var entrypoint = fileName.normalize();
        if (!DECLARATION_FILE.matcher(entrypoint.toString()).find()) {
            throw new NotADeclarationFileException(fileName.toString());
        }

        var program = frontEnd.createProgram(List.of(entrypoint), config);
        var sourceFile = program.sourceFile(entrypoint)
                .orElseThrow(() -> new EntryFileNotFoundException(entrypoint));

        var symbols = new SymbolResolver(program).resolveExports(sourceFile);
        logger.debug("{} exports {} symbols", entrypoint, symbols.size());
        return new OutputAssembler(options, diagnostics).assemble(symbols);
    }
}
