package io.github.jbellis.apiguard.serializer;

import io.github.jbellis.apiguard.analyzer.FrontEndConfig;
import io.github.jbellis.apiguard.analyzer.InMemoryCompilerHost;
import io.github.jbellis.apiguard.analyzer.TypescriptFrontEnd;
import io.github.jbellis.apiguard.serializer.ApiSerializationException.AliasRenamedException;
import io.github.jbellis.apiguard.serializer.ApiSerializationException.EntryFileNotFoundException;
import io.github.jbellis.apiguard.serializer.ApiSerializationException.NotADeclarationFileException;
import io.github.jbellis.apiguard.serializer.ApiSerializationException.UnlistedModuleIdentifierException;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PublicApiTest {

    private static final Path ENTRY = Path.of("/src/index.d.ts");
    private static final Path TESTCODE = Path.of("src/test/resources/testcode-dts");

    private final List<String> warnings = new ArrayList<>();

    private String render(InMemoryCompilerHost host, SerializationOptions options) {
        return PublicApi.publicApiInternal(new TypescriptFrontEnd(host), ENTRY, FrontEndConfig.localOnly(),
                                           options, warnings::add);
    }

    private String render(String source) {
        return render(source, SerializationOptions.defaults());
    }

    private String render(String source, SerializationOptions options) {
        return render(new InMemoryCompilerHost().add(ENTRY, source), options);
    }

    @Test
    void testEntriesAreSortedAndSeparatedByBlankLines() {
        var api = render("""
                export declare const gamma: number;
                export declare const Beta: number;
                export declare const alpha: number;
                """);
        assertEquals("""
                export declare const alpha: number;

                export declare const Beta: number;

                export declare const gamma: number;
                """, api);
    }

    @Test
    void testRenderingIsDeterministic() {
        var source = """
                export declare class B { b(): void; a: string; }
                export interface A { z: number; y: string; }
                """;
        assertEquals(render(source), render(source));
    }

    @Test
    void testPrivateMembersAndCommentsAreRemoved() {
        var api = render("""
                /**
                 * A class.
                 */
                export declare class A {
                    // the value
                    value: string;
                    private secret;
                    /* gone */ private other: number;
                }
                """);
        assertEquals("""
                export declare class A {
                    value: string;
                }
                """, api);
    }

    @Test
    void testMembersAreReordered() {
        var api = render("""
                export declare class Foo {
                    zeta(): void;
                    alpha: string;
                    constructor();
                }
                """);
        assertEquals("""
                export declare class Foo {
                    alpha: string;
                    constructor();
                    zeta(): void;
                }
                """, api);
    }

    @Test
    void testStaticMembersComeFirst() {
        var api = render("""
                export declare class S {
                    b: string;
                    static create(): S;
                    static a: string;
                }
                """);
        assertEquals("""
                export declare class S {
                    static a: string;
                    static create(): S;
                    b: string;
                }
                """, api);
    }

    @Test
    void testInterfaceMembersAreReordered() {
        var api = render("""
                export interface Handler {
                    handle(event: string): void;
                    [key: string]: unknown;
                    name: string;
                }
                """);
        assertEquals("""
                export interface Handler {
                    name: string;
                    [key: string]: unknown;
                    handle(event: string): void;
                }
                """, api);
    }

    @Test
    void testStraySemicolonKeepsSourceOrder() {
        var api = render("""
                export declare class K {
                    b(): void;
                    ;
                    a: string;
                }
                """);
        assertEquals("""
                export declare class K {
                    b(): void;
                    ;
                    a: string;
                }
                """, api);
    }

    @Test
    void testStripExportPattern() {
        var api = render("""
                export declare const PRIVATE_x: number;
                export declare const y: number;
                """, SerializationOptions.defaults().withStripExportPattern("^PRIVATE_"));
        assertEquals("export declare const y: number;\n", api);
    }

    @Test
    void testVariableStatementRendersOncePerName() {
        var api = render("export declare const a: number, b: string;\n");
        assertEquals("""
                export declare const a: number, b: string;

                export declare const a: number, b: string;
                """, api);
    }

    @Test
    void testUnlistedModuleIdentifierFails() {
        var source = """
                import * as ns from 'ns';
                export declare class C extends ns.Base {}
                """;
        var e = assertThrows(UnlistedModuleIdentifierException.class, () -> render(source));
        assertEquals("ns", e.identifier());
        assertEquals(2, e.line());
        assertEquals(32, e.column());
        assertEquals("/src/index.d.ts(2,32): error: Module identifier \"ns\" is not allowed. "
                     + "Remove it from source or whitelist it via --allowModuleIdentifiers.", e.getMessage());

        var api = render(source, SerializationOptions.defaults().withAllowModuleIdentifiers(List.of("ns")));
        assertEquals("export declare class C extends ns.Base {}\n", api);
    }

    @Test
    void testQualifiedTypeNamesAreChecked() {
        var source = "export declare function f(): ns.T;\n";
        assertThrows(UnlistedModuleIdentifierException.class, () -> render(source));
        assertEquals("export declare function f(): ns.T;\n",
                     render(source, SerializationOptions.defaults().withAllowModuleIdentifiers(List.of("ns"))));
    }

    @Test
    void testTypeQueriesAreNotChecked() {
        assertEquals("export declare const y: typeof ns.value;\n",
                     render("export declare const y: typeof ns.value;\n"));
    }

    @Test
    void testReexportsRenderTheOriginalStatement() {
        var host = new InMemoryCompilerHost()
                .add(ENTRY, "export { A } from './a';\n")
                .add("/src/a.d.ts", "// a\nexport declare class A {}\nexport declare class Unused {}\n");
        assertEquals("export declare class A {}\n", render(host, SerializationOptions.defaults()));
    }

    @Test
    void testRenamedAliasFails() {
        var host = new InMemoryCompilerHost()
                .add(ENTRY, "export { A as B } from './a';\n")
                .add("/src/a.d.ts", "export declare class A {}\n");
        var e = assertThrows(AliasRenamedException.class, () -> render(host, SerializationOptions.defaults()));
        assertEquals("B", e.aliasName());
        assertEquals("A", e.targetName());
        assertEquals("Symbol \"A\" was aliased as \"B\". Aliases are not supported.", e.getMessage());
    }

    @Test
    void testDefaultExportOfNamedDeclarationFails() {
        var e = assertThrows(AliasRenamedException.class, () -> render("declare class Foo {}\nexport default Foo;\n"));
        assertEquals("Symbol \"Foo\" was aliased as \"default\". Aliases are not supported.", e.getMessage());
    }

    @Test
    void testUnresolvedReexportIsSkippedWithWarning() {
        var api = render("""
                export { External } from 'external-package';
                export declare const local: number;
                """);
        assertEquals("export declare const local: number;\n", api);
        assertEquals(List.of("No export declaration found for symbol \"External\""), warnings);
    }

    @Test
    void testExportListOfLocalDeclarationHasNoExportStatement() {
        assertEquals("", render("declare class A {}\nexport { A };\n"));
        assertEquals(List.of("No export declaration found for symbol \"A\""), warnings);
    }

    @Test
    void testScriptRendersNothing() {
        assertEquals("", render("declare class A {}\n"));
        assertTrue(warnings.isEmpty());
    }

    @Test
    void testNonDeclarationFileIsRejectedBeforeParsing() {
        var e = assertThrows(NotADeclarationFileException.class, () -> PublicApi.publicApiInternal(
                (roots, config) -> fail("front end must not be called"),
                Path.of("/src/index.ts"), FrontEndConfig.localOnly(), SerializationOptions.defaults()));
        assertEquals("Source file \"/src/index.ts\" is not a declaration file", e.getMessage());
    }

    @Test
    void testMissingEntryFile() {
        var e = assertThrows(EntryFileNotFoundException.class,
                             () -> render(new InMemoryCompilerHost(), SerializationOptions.defaults()));
        assertEquals("Source file \"/src/index.d.ts\" not found", e.getMessage());
    }

    @Test
    void testFileOnDisk() throws Exception {
        var expected = Files.readString(TESTCODE.resolve("simple.api.d.ts"));
        assertEquals(expected, PublicApi.publicApi(TESTCODE.resolve("simple.d.ts")));
    }

    @Test
    void testReexportsOnDisk() {
        var api = PublicApi.publicApi(TESTCODE.resolve("reexport/index.d.ts"));
        assertEquals("""
                export declare function more(): void;

                export declare type MoreKind = 'a' | 'b';

                export declare class Thing {
                    name: string;
                }
                """, api);
    }
}
