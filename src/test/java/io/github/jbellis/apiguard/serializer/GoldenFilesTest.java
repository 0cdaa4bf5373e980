package io.github.jbellis.apiguard.serializer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class GoldenFilesTest {

    private static final Path SIMPLE = Path.of("src/test/resources/testcode-dts/simple.d.ts");
    private static final Path SIMPLE_GOLDEN = Path.of("src/test/resources/testcode-dts/simple.api.d.ts");

    @Test
    void testGenerateCreatesParentDirectories(@TempDir Path tempDir) throws IOException {
        var golden = tempDir.resolve("nested/dir/simple.d.ts");
        GoldenFiles.generate(SIMPLE, golden, SerializationOptions.defaults());
        assertEquals(Files.readString(SIMPLE_GOLDEN), Files.readString(golden));
    }

    @Test
    void testVerifyMatchingGolden() throws IOException {
        assertEquals("", GoldenFiles.verify(SIMPLE, SIMPLE_GOLDEN, SerializationOptions.defaults()));
    }

    @Test
    void testVerifyIgnoresLineEndings(@TempDir Path tempDir) throws IOException {
        var golden = tempDir.resolve("crlf.d.ts");
        Files.writeString(golden, Files.readString(SIMPLE_GOLDEN).replace("\n", "\r\n"));
        assertEquals("", GoldenFiles.verify(SIMPLE, golden, SerializationOptions.defaults()));
    }

    @Test
    void testVerifyReportsDiff(@TempDir Path tempDir) throws IOException {
        var golden = tempDir.resolve("simple.d.ts");
        GoldenFiles.generate(SIMPLE, golden, SerializationOptions.defaults().withStripExportPattern("^PRIVATE_"));

        var diff = GoldenFiles.verify(SIMPLE, golden, SerializationOptions.defaults());
        assertTrue(diff.startsWith("--- Golden file\n+++ Generated API\n"), diff);
        assertTrue(diff.contains("\n+export declare const PRIVATE_registry: Map<string, Widget>;\n"), diff);
    }

    @Test
    void testDiffOfEqualTextIsEmpty() {
        assertEquals("", GoldenFiles.diff("a\nb\n", "a\nb\n"));
        assertEquals("--- Golden file\n+++ Generated API\n@@ -1,2 +1,2 @@\n a\n-b\n+c\n",
                     GoldenFiles.diff("a\nb\n", "a\nc\n"));
    }
}
