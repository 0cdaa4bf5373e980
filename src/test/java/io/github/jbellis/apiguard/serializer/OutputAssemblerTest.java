package io.github.jbellis.apiguard.serializer;

import io.github.jbellis.apiguard.analyzer.FrontEndConfig;
import io.github.jbellis.apiguard.analyzer.InMemoryCompilerHost;
import io.github.jbellis.apiguard.analyzer.Symbol;
import io.github.jbellis.apiguard.analyzer.TypescriptFrontEnd;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OutputAssemblerTest {

    private final List<String> warnings = new ArrayList<>();

    @Test
    void testStripEmptyLines() {
        assertEquals("a\n  \nb", OutputAssembler.stripEmptyLines("\n\na\n  \n\nb\n"));
        assertEquals("a\nb", OutputAssembler.stripEmptyLines("a\r\n\r\nb"));
        assertEquals("", OutputAssembler.stripEmptyLines("\n\n"));
    }

    @Test
    void testSortOrderIsCaseInsensitiveFirst() {
        var names = new ArrayList<>(List.of("gamma", "Beta", "alpha", "beta"));
        var symbols = new ArrayList<Symbol>();
        names.forEach(n -> symbols.add(new Symbol.Direct(n, null, List.of())));
        symbols.sort(OutputAssembler.byName());
        var sorted = symbols.stream().map(Symbol::name).toList();
        assertEquals("alpha", sorted.get(0));
        assertEquals("gamma", sorted.get(3));
        assertEquals(List.of("Beta", "beta"),
                     sorted.subList(1, 3).stream().sorted().toList(),
                     "Both spellings of beta sort between alpha and gamma");
    }

    @Test
    void testSymbolWithoutDeclarationIsSkipped() {
        var assembler = new OutputAssembler(SerializationOptions.defaults(), warnings::add);
        assertEquals("", assembler.assemble(List.of(new Symbol.Direct("ghost", null, List.of()))));
        assertEquals(List.of("No declaration found for symbol \"ghost\""), warnings);
    }

    @Test
    void testExcludedSymbolsAreNotReported() {
        var assembler = new OutputAssembler(SerializationOptions.defaults().withStripExportPattern("^gh"),
                                            warnings::add);
        assertEquals("", assembler.assemble(List.of(new Symbol.Direct("ghost", null, List.of()))));
        assertTrue(warnings.isEmpty());
    }

    @Test
    void testEveryEntryEndsWithNewline() {
        var entry = Path.of("/lib/api.d.ts");
        var host = new InMemoryCompilerHost().add(entry, """
                export declare function b(): void;


                export declare function a(): void;
                """);
        var program = new TypescriptFrontEnd(host).createProgram(List.of(entry), FrontEndConfig.localOnly());
        var symbols = new SymbolResolver(program).resolveExports(program.sourceFile(entry).orElseThrow());

        var output = new OutputAssembler(SerializationOptions.defaults(), warnings::add).assemble(symbols);
        assertEquals("export declare function a(): void;\n\nexport declare function b(): void;\n", output);
        assertTrue(warnings.isEmpty());
    }
}
