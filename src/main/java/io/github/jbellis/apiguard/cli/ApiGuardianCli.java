package io.github.jbellis.apiguard.cli;

import io.github.jbellis.apiguard.serializer.ApiSerializationException;
import io.github.jbellis.apiguard.serializer.GoldenFiles;
import io.github.jbellis.apiguard.serializer.SerializationOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

@CommandLine.Command(
        name = "api-guardian",
        mixinStandardHelpOptions = true,
        description = "Renders the public API of TypeScript declaration files into golden files, or verifies them.")
public final class ApiGuardianCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(ApiGuardianCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_MISMATCH = 1;
    static final int EXIT_ERROR = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--out", description = "Write the API of the single entrypoint to this file.")
    @Nullable
    private Path out;

    @CommandLine.Option(names = "--outDir", description = "Write the API of each entrypoint below this directory.")
    @Nullable
    private Path outDir;

    @CommandLine.Option(names = "--verify", description = "Compare the API of the single entrypoint with this file.")
    @Nullable
    private Path verify;

    @CommandLine.Option(
            names = "--verifyDir",
            description = "Compare the API of each entrypoint with the golden file below this directory.")
    @Nullable
    private Path verifyDir;

    @CommandLine.Option(
            names = "--rootDir",
            description = "Directory entrypoints are made relative to under --outDir and --verifyDir. "
                    + "Defaults to the working directory.")
    @Nullable
    private Path rootDir;

    @CommandLine.Option(names = "--stripExportPattern", description = "Leave out exports whose name matches.")
    @Nullable
    private String stripExportPattern;

    @CommandLine.Option(
            names = "--allowModuleIdentifiers",
            split = ",",
            description = "Namespace identifiers allowed in the API, e.g. angular. Can be repeated.")
    private List<String> allowModuleIdentifiers = new ArrayList<>();

    @CommandLine.Option(names = "--config", description = "JSON options file; command line options override it.")
    @Nullable
    private Path config;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "ENTRYPOINT", description = "Declaration files (.d.ts).")
    private List<Path> entrypoints = new ArrayList<>();

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ApiGuardianCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        long modes = Stream.of(out, outDir, verify, verifyDir).filter(p -> p != null).count();
        if (modes != 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Exactly one of --out, --outDir, --verify or --verifyDir is required.");
        }
        if ((out != null || verify != null) && entrypoints.size() != 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--out and --verify take exactly one entrypoint, got " + entrypoints.size() + '.');
        }

        var err = spec.commandLine().getErr();
        try {
            var options = buildOptions();
            if (out != null) {
                GoldenFiles.generate(entrypoints.get(0), out, options);
                return EXIT_OK;
            }
            if (outDir != null) {
                for (var entrypoint : entrypoints) {
                    GoldenFiles.generate(entrypoint, goldenFileFor(outDir, entrypoint), options);
                }
                return EXIT_OK;
            }
            if (verify != null) {
                return report(verify, GoldenFiles.verify(entrypoints.get(0), verify, options));
            }
            int exitCode = EXIT_OK;
            for (var entrypoint : entrypoints) {
                var goldenFile = goldenFileFor(verifyDir, entrypoint);
                exitCode = Math.max(exitCode, report(goldenFile, GoldenFiles.verify(entrypoint, goldenFile, options)));
            }
            return exitCode;
        } catch (ApiSerializationException | PatternSyntaxException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.debug("I/O failure", e);
            err.println("Error: " + e);
            return EXIT_ERROR;
        }
    }

    SerializationOptions buildOptions() throws IOException {
        var options = config == null ? SerializationOptions.defaults() : SerializationOptions.load(config);
        if (stripExportPattern != null) {
            options = options.withStripExportPattern(stripExportPattern);
        }
        if (!allowModuleIdentifiers.isEmpty()) {
            var identifiers = allowModuleIdentifiers.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
            options = options.withAllowModuleIdentifiers(identifiers);
        }
        return options;
    }

    /** {@code dir/<entrypoint relative to rootDir>} */
    Path goldenFileFor(Path dir, Path entrypoint) {
        var root = (rootDir == null ? Path.of("") : rootDir).toAbsolutePath().normalize();
        var relative = root.relativize(entrypoint.toAbsolutePath().normalize());
        return dir.resolve(relative);
    }

    private int report(Path goldenFile, String diff) {
        if (diff.isEmpty()) {
            return EXIT_OK;
        }
        PrintWriter stdout = spec.commandLine().getOut();
        stdout.print(diff);
        stdout.flush();
        spec.commandLine().getErr().println("Public API differs from " + goldenFile);
        return EXIT_MISMATCH;
    }
}
