package io.github.jbellis.apiguard.serializer;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes rendered APIs to golden files and checks them against the current declarations.
 */
public final class GoldenFiles {
    private static final Logger logger = LogManager.getLogger(GoldenFiles.class);

    static final String GOLDEN_HEADER = "Golden file";
    static final String GENERATED_HEADER = "Generated API";

    private GoldenFiles() {
    }

    public static void generate(Path entrypoint, Path goldenFile, SerializationOptions options) throws IOException {
        var api = PublicApi.publicApi(entrypoint, options);
        var parent = goldenFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(goldenFile, api, StandardCharsets.UTF_8);
        logger.info("Wrote API of {} to {}", entrypoint, goldenFile);
    }

    /**
     * Compares the golden file with the API rendered now.
     *
     * @return an empty string if they match, otherwise a unified diff from the golden file to the rendered API
     */
    public static String verify(Path entrypoint, Path goldenFile, SerializationOptions options) throws IOException {
        var actual = PublicApi.publicApi(entrypoint, options);
        var expected = Files.readString(goldenFile, StandardCharsets.UTF_8);
        var diff = diff(expected, actual);
        if (!diff.isEmpty()) {
            logger.debug("API of {} differs from {}", entrypoint, goldenFile);
        }
        return diff;
    }

    /** Line-based unified diff; line terminators do not count as differences. */
    static String diff(String golden, String generated) {
        var goldenLines = lines(golden);
        var generatedLines = lines(generated);
        if (goldenLines.equals(generatedLines)) {
            return "";
        }
        var patch = DiffUtils.diff(goldenLines, generatedLines);
        var unified = UnifiedDiffUtils.generateUnifiedDiff(GOLDEN_HEADER, GENERATED_HEADER, goldenLines, patch, 3);
        return String.join("\n", unified) + "\n";
    }

    private static List<String> lines(String text) {
        return text.lines().toList();
    }
}
