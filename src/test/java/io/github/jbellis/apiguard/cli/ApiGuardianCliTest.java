package io.github.jbellis.apiguard.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ApiGuardianCliTest {

    private static final Path TESTCODE = Path.of("src/test/resources/testcode-dts");
    private static final Path SIMPLE = TESTCODE.resolve("simple.d.ts");

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        var cmd = new CommandLine(new ApiGuardianCli());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    @Test
    void testModeIsRequired() {
        assertEquals(ApiGuardianCli.EXIT_ERROR, run(SIMPLE.toString()));
        assertTrue(err.toString().contains("Exactly one of"), err.toString());
    }

    @Test
    void testOnlyOneModeAllowed(@TempDir Path tempDir) {
        assertEquals(ApiGuardianCli.EXIT_ERROR, run("--out", tempDir.resolve("a").toString(),
                                                    "--verify", tempDir.resolve("b").toString(),
                                                    SIMPLE.toString()));
    }

    @Test
    void testOutTakesOneEntrypoint(@TempDir Path tempDir) {
        assertEquals(ApiGuardianCli.EXIT_ERROR, run("--out", tempDir.resolve("a").toString(),
                                                    SIMPLE.toString(), SIMPLE.toString()));
    }

    @Test
    void testOutThenVerify(@TempDir Path tempDir) throws IOException {
        var golden = tempDir.resolve("simple.d.ts");
        assertEquals(ApiGuardianCli.EXIT_OK, run("--out", golden.toString(), SIMPLE.toString()));
        assertEquals(Files.readString(TESTCODE.resolve("simple.api.d.ts")), Files.readString(golden));

        assertEquals(ApiGuardianCli.EXIT_OK, run("--verify", golden.toString(), SIMPLE.toString()));
        assertEquals("", out.toString());
    }

    @Test
    void testVerifyMismatch(@TempDir Path tempDir) throws IOException {
        var golden = tempDir.resolve("simple.d.ts");
        Files.writeString(golden, "export declare const stale: number;\n");
        assertEquals(ApiGuardianCli.EXIT_MISMATCH, run("--verify", golden.toString(), SIMPLE.toString()));
        assertTrue(out.toString().contains("+++ Generated API"), out.toString());
        assertTrue(out.toString().contains("-export declare const stale: number;"), out.toString());
        assertTrue(err.toString().contains("Public API differs from"), err.toString());
    }

    @Test
    void testStripExportPatternOption(@TempDir Path tempDir) throws IOException {
        var golden = tempDir.resolve("stripped.d.ts");
        assertEquals(ApiGuardianCli.EXIT_OK,
                     run("--out", golden.toString(), "--stripExportPattern", "^PRIVATE_", SIMPLE.toString()));
        assertFalse(Files.readString(golden).contains("PRIVATE_registry"));
    }

    @Test
    void testOutDirMirrorsRootDir(@TempDir Path tempDir) {
        var outDir = tempDir.resolve("golden");
        assertEquals(ApiGuardianCli.EXIT_OK, run("--outDir", outDir.toString(), "--rootDir", TESTCODE.toString(),
                                                 SIMPLE.toString(), TESTCODE.resolve("reexport/index.d.ts").toString()));
        assertTrue(Files.isRegularFile(outDir.resolve("simple.d.ts")));
        assertTrue(Files.isRegularFile(outDir.resolve("reexport/index.d.ts")));

        assertEquals(ApiGuardianCli.EXIT_OK, run("--verifyDir", outDir.toString(), "--rootDir", TESTCODE.toString(),
                                                 SIMPLE.toString(), TESTCODE.resolve("reexport/index.d.ts").toString()));
    }

    @Test
    void testModuleIdentifiers(@TempDir Path tempDir) throws IOException {
        var entry = TESTCODE.resolve("namespaced.d.ts");
        var golden = tempDir.resolve("namespaced.d.ts");
        assertEquals(ApiGuardianCli.EXIT_ERROR, run("--out", golden.toString(), entry.toString()));
        assertTrue(err.toString().contains("Module identifier \"angular\" is not allowed"), err.toString());

        assertEquals(ApiGuardianCli.EXIT_OK,
                     run("--out", golden.toString(), "--allowModuleIdentifiers", "ng,angular", entry.toString()));
        assertEquals("""
                export declare class Directive extends angular.Base {
                    scope: angular.Scope;
                }
                """, Files.readString(golden));
    }

    @Test
    void testConfigFile(@TempDir Path tempDir) throws IOException {
        var config = tempDir.resolve("options.json");
        Files.writeString(config, "{ \"allowModuleIdentifiers\": [\"angular\"] }");
        var golden = tempDir.resolve("namespaced.d.ts");
        assertEquals(ApiGuardianCli.EXIT_OK, run("--out", golden.toString(), "--config", config.toString(),
                                                 TESTCODE.resolve("namespaced.d.ts").toString()));
    }

    @Test
    void testNotADeclarationFile(@TempDir Path tempDir) {
        assertEquals(ApiGuardianCli.EXIT_ERROR, run("--out", tempDir.resolve("x").toString(), "index.ts"));
        assertTrue(err.toString().contains("is not a declaration file"), err.toString());
    }

    @Test
    void testMissingGoldenFile(@TempDir Path tempDir) {
        assertEquals(ApiGuardianCli.EXIT_ERROR,
                     run("--verify", tempDir.resolve("missing.d.ts").toString(), SIMPLE.toString()));
    }
}
