package me.christianrobert.ftranspile.frontend.parser;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.frontend.context.LoweringException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the two-stage parser wrapper.
 */
class AntlrParserTest {

    private AntlrParser parser;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
    }

    @Test
    void parsesSubroutine() {
        ParseResult result = parser.parseProgram("""
                subroutine foo(x)
                  integer, intent(in) :: x
                  call bar(x)
                end subroutine foo
                """);

        assertTrue(result.isSuccess(), result::getErrorMessage);
        assertInstanceOf(FortranParser.ProgramContext.class, result.getTree());
        assertNull(result.getErrorMessage());
    }

    @Test
    void keywordsAreCaseInsensitive() {
        ParseResult result = parser.parseProgram("""
                SUBROUTINE Foo(X)
                  INTEGER :: X
                  X = X + 1
                END SUBROUTINE Foo
                """);

        assertFalse(result.hasErrors(), result::getErrorMessage);
    }

    @Test
    void continuationLinesAreJoined() {
        ParseResult result = parser.parseProgram("""
                subroutine foo(x)
                  integer :: x
                  x = 1 + &
                      2
                end subroutine foo
                """);

        assertFalse(result.hasErrors(), result::getErrorMessage);
    }

    @Test
    void missingTrailingNewlineIsTolerated() {
        ParseResult result = parser.parseProgram("subroutine foo()\nend subroutine foo");

        assertFalse(result.hasErrors(), result::getErrorMessage);
        assertTrue(result.getOriginalSource().endsWith("\n"));
    }

    @Test
    void labelledDoTerminationParses() {
        ParseResult result = parser.parseProgram("""
                subroutine foo(n)
                  integer :: n, i, s
                  do 10 i = 1, n
                    s = s + i
                10 continue
                end subroutine foo
                """);

        assertFalse(result.hasErrors(), result::getErrorMessage);
    }

    @Test
    void syntaxErrorsAreCollectedWithPosition() {
        ParseResult result = parser.parseProgram("""
                subroutine foo(
                end subroutine foo
                """);

        assertTrue(result.hasErrors());
        assertTrue(result.getErrorMessage().startsWith("Line "), result.getErrorMessage());
        assertTrue(result.toString().contains("success=false"));
    }

    @Test
    void nullSourceIsRejected() {
        assertThrows(LoweringException.class, () -> parser.parseProgram(null));
    }

    // ========== EXPRESSIONS ==========

    @Test
    void parsesStandaloneExpression() {
        ParseResult result = parser.parseExpression("a(i, 1:n) ** 2 .and. .not. flag");

        assertFalse(result.hasErrors(), result::getErrorMessage);
        assertInstanceOf(FortranParser.SingleExpressionContext.class, result.getTree());
    }

    @Test
    void blankExpressionIsRejected() {
        assertThrows(LoweringException.class, () -> parser.parseExpression("   "));
    }
}
