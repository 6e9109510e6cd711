package me.christianrobert.ftranspile.service;

import me.christianrobert.ftranspile.config.service.ConfigService;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.Scalar;
import me.christianrobert.ftranspile.expression.Sum;
import me.christianrobert.ftranspile.frontend.context.LoweringException;
import me.christianrobert.ftranspile.frontend.context.UnsupportedConstructException;
import me.christianrobert.ftranspile.frontend.parser.AntlrParser;
import me.christianrobert.ftranspile.ir.FindNodes;
import me.christianrobert.ftranspile.ir.Module;
import me.christianrobert.ftranspile.ir.PreprocessorDirective;
import me.christianrobert.ftranspile.ir.SourceFile;
import me.christianrobert.ftranspile.ir.Subroutine;
import me.christianrobert.ftranspile.scope.BasicType;
import me.christianrobert.ftranspile.scope.Scope;
import me.christianrobert.ftranspile.scope.SymbolAttributes;
import me.christianrobert.ftranspile.scope.TypeTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the front end pipeline: preprocessing, parsing, lowering and clean-up.
 */
class FortranFrontendTest {

    private FortranFrontend frontend;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        frontend = new FortranFrontend();
        frontend.parser = new AntlrParser();
        frontend.configService = configService;
    }

    @Test
    void macroLinesSurviveAsDirectives() {
        // Given
        String source = """
                subroutine foo(x)
                  integer :: x
                  DR_HOOK_BEGIN
                  x = 1
                end subroutine foo
                """;

        // When
        SourceFile ir = frontend.parseSource(source, Map.of());

        // Then
        assertEquals(1, ir.getSubroutines().size());
        assertEquals(1, FindNodes.find(ir, PreprocessorDirective.class).size());
        assertEquals("DR_HOOK_BEGIN", FindNodes.find(ir, PreprocessorDirective.class).get(0).getText());
    }

    @Test
    void continuedStatementEndingInMacroLikeNameStillParses() {
        // Given
        String source = """
                subroutine foo(x)
                  real :: x
                  x = MAX(x, &
                      MY_CONST(1))
                end subroutine foo
                """;

        // When
        SourceFile ir = frontend.parseSource(source, Map.of());

        // Then
        assertEquals(1, ir.getSubroutines().size());
        assertTrue(FindNodes.find(ir, PreprocessorDirective.class).isEmpty());
    }

    @Test
    void macroLinesFailToParseWithoutTheRule() {
        configService.setConfigValue(ConfigService.PREPROCESSING_RULES, "");

        assertThrows(LoweringException.class, () -> frontend.parseSource("""
                subroutine foo()
                  DR_HOOK_BEGIN
                end subroutine foo
                """, Map.of()));
    }

    @Test
    void definitionsFromEarlierFilesResolveUse() {
        // Given
        Map<String, Module> definitions = new HashMap<>();
        SourceFile first = frontend.parseSource("""
                module constants
                  integer, parameter :: nlev = 3
                end module constants
                """, definitions);
        definitions.put("constants", first.getModules().get(0));

        // When
        Subroutine foo = frontend.parseSource("""
                subroutine foo()
                  use constants, only: nlev
                end subroutine foo
                """, definitions).getSubroutines().get(0);

        // Then
        SymbolAttributes nlev = foo.getScope().lookupLocal("nlev");
        assertEquals(TypeTag.INTEGER, nlev.getTag());
        assertTrue(nlev.isImported());
    }

    @Test
    void strictModeComesFromConfiguration() {
        configService.setConfigValue(ConfigService.STRICT_MODE, true);

        assertThrows(UnsupportedConstructException.class, () -> frontend.parseSource("""
                subroutine foo(a)
                  integer :: a(10), i
                  forall (i = 1:10) a(i) = i
                end subroutine foo
                """, Map.of()));
    }

    @Test
    void nullSourceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> frontend.parseSource(null, Map.of()));
    }

    // ========== EXPRESSIONS ==========

    @Test
    void expressionIsLoweredAgainstGivenScope() {
        // Given
        Scope scope = new Scope();
        scope.define("a", SymbolAttributes.builder().dtype(BasicType.INTEGER).build());

        // When
        Expression expression = frontend.parseExpression("a + 1", scope);

        // Then
        Sum sum = assertInstanceOf(Sum.class, expression);
        Scalar a = assertInstanceOf(Scalar.class, sum.getChildren().get(0));
        assertEquals("a", a.getName());
    }

    @Test
    void malformedExpressionIsRejected() {
        assertThrows(LoweringException.class, () -> frontend.parseExpression("a + * 1", new Scope()));
    }
}
