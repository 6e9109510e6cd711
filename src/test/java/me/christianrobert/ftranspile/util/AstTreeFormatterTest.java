package me.christianrobert.ftranspile.util;

import me.christianrobert.ftranspile.antlr.FortranLexer;
import me.christianrobert.ftranspile.frontend.parser.AntlrParser;
import me.christianrobert.ftranspile.frontend.parser.ParseResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AstTreeFormatterTest {

    private final AntlrParser parser = new AntlrParser();

    @Test
    void nullTree() {
        assertEquals("(null tree)", AstTreeFormatter.format(null));
    }

    @Test
    void rulesAndTokensAreIndented() {
        // Given
        ParseResult result = parser.parseProgram("subroutine foo()\nend subroutine foo\n");

        // When
        String formatted = AstTreeFormatter.format(result.getTree(), FortranLexer.VOCABULARY);

        // Then
        assertTrue(formatted.startsWith("program\n"), formatted);
        assertTrue(formatted.contains("\"subroutine\" (SUBROUTINE)"), formatted);
        assertTrue(formatted.contains("\"\\n\" (NEWLINE)"), formatted);
        assertTrue(formatted.contains("(EOF)"), formatted);
        assertTrue(formatted.contains("\n  programItem"), formatted);
    }

    @Test
    void tokenNamesAreOmittedWithoutVocabulary() {
        ParseResult result = parser.parseProgram("subroutine foo()\nend subroutine foo\n");

        String formatted = AstTreeFormatter.format(result.getTree());

        assertTrue(formatted.contains("\"subroutine\"\n"), formatted);
        assertFalse(formatted.contains("(SUBROUTINE)"));
    }

    @Test
    void longTextIsTruncated() {
        String text = AstTreeFormatter.escapeAndTruncate("a".repeat(60) + "\t");

        assertEquals("a".repeat(50) + "...", text);
        assertEquals("x\\ty", AstTreeFormatter.escapeAndTruncate("x\ty"));
    }
}
