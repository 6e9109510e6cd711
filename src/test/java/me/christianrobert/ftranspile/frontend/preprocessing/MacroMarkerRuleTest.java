package me.christianrobert.ftranspile.frontend.preprocessing;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.codegen.fortran.FortranCodegen;
import me.christianrobert.ftranspile.frontend.builder.IrBuilder;
import me.christianrobert.ftranspile.frontend.builder.SourceText;
import me.christianrobert.ftranspile.frontend.context.FrontendConfig;
import me.christianrobert.ftranspile.frontend.parser.AntlrParser;
import me.christianrobert.ftranspile.frontend.parser.ParseResult;
import me.christianrobert.ftranspile.ir.FindNodes;
import me.christianrobert.ftranspile.ir.PreprocessorDirective;
import me.christianrobert.ftranspile.ir.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for protecting bare macro lines from the parser.
 */
class MacroMarkerRuleTest {

    private MacroMarkerRule rule;

    @BeforeEach
    void setUp() {
        rule = new MacroMarkerRule();
    }

    @Test
    void macroLineBecomesMarkerComment() {
        // Given
        List<PreprocessingInfo> info = new ArrayList<>();

        // When
        String result = rule.filter("x = 1\n  DR_HOOK_BEGIN\ny = 2", info);

        // Then
        assertEquals("x = 1\n  !__macro__ DR_HOOK_BEGIN\ny = 2", result);
        assertEquals(1, info.size());
        assertEquals(2, info.get(0).getLine());
        assertEquals("DR_HOOK_BEGIN", info.get(0).getText());
    }

    @Test
    void macroWithArgumentsIsKeptWhole() {
        List<PreprocessingInfo> info = new ArrayList<>();

        rule.filter("SWAP_ENDIAN(buf, n)", info);

        assertEquals("SWAP_ENDIAN(buf, n)", info.get(0).getText());
    }

    @Test
    void ordinaryStatementsAreUntouched() {
        List<PreprocessingInfo> info = new ArrayList<>();
        String source = "CALL FOO_BAR(x)\nNLEV = 3\nfoo_bar\n";

        String result = rule.filter(source, info);

        assertEquals(source, result);
        assertTrue(info.isEmpty());
    }

    @Test
    void continuationLinesAreNeverMacros() {
        // Given a call whose second line looks like a macro invocation
        List<PreprocessingInfo> info = new ArrayList<>();
        String source = """
                x = MAX(x, &  ! clamp
                    ! lower bound follows
                    MY_CONST(1))
                """;

        // When
        String result = rule.filter(source, info);

        // Then
        assertEquals(source, result);
        assertTrue(info.isEmpty());
    }

    @Test
    void unbalancedArgumentListIsNotAMacro() {
        List<PreprocessingInfo> info = new ArrayList<>();

        String result = rule.filter("MY_CONST(1))\nMY_CONST((1)", info);

        assertEquals("MY_CONST(1))\nMY_CONST((1)", result);
        assertTrue(info.isEmpty());
    }

    @Test
    void macroAfterCompletedContinuationIsStillProtected() {
        List<PreprocessingInfo> info = new ArrayList<>();

        rule.filter("y = a + &\n    b\nDR_HOOK_END", info);

        assertEquals(1, info.size());
        assertEquals(3, info.get(0).getLine());
    }

    @Test
    void markerIsRestoredAsDirectiveAfterLowering() {
        // Given
        String source = """
                subroutine foo(x)
                  integer :: x
                  x = 1
                  DR_HOOK_END
                end subroutine foo
                """;
        List<PreprocessingInfo> info = new ArrayList<>();
        String filtered = rule.filter(source, info);
        ParseResult parsed = new AntlrParser().parseProgram(filtered);
        assertFalse(parsed.hasErrors(), parsed::getErrorMessage);
        SourceFile ir = new IrBuilder(new SourceText(parsed.getOriginalSource(), parsed.getTokens()),
                FrontendConfig.lenient(), Map.of()).build((FortranParser.ProgramContext) parsed.getTree(), null);

        // When
        rule.postprocess(ir, info);

        // Then
        List<PreprocessorDirective> directives = FindNodes.find(ir, PreprocessorDirective.class);
        assertEquals(1, directives.size());
        assertEquals("DR_HOOK_END", directives.get(0).getText());
        assertTrue(FortranCodegen.fgen(ir).contains("\n  DR_HOOK_END\n"), "Restored macro keeps the block indentation");
    }
}
