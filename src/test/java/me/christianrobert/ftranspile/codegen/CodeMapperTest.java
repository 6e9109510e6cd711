package me.christianrobert.ftranspile.codegen;

import me.christianrobert.ftranspile.codegen.fortran.FortranCodeMapper;
import me.christianrobert.ftranspile.expression.Array;
import me.christianrobert.ftranspile.expression.ArraySubscript;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.ExpressionFactory;
import me.christianrobert.ftranspile.expression.IntLiteral;
import me.christianrobert.ftranspile.expression.LogicLiteral;
import me.christianrobert.ftranspile.expression.Power;
import me.christianrobert.ftranspile.expression.Quotient;
import me.christianrobert.ftranspile.expression.RangeIndex;
import me.christianrobert.ftranspile.expression.Scalar;
import me.christianrobert.ftranspile.expression.StringLiteral;
import me.christianrobert.ftranspile.expression.Sum;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for precedence-driven expression rendering, using the Fortran spelling.
 */
class CodeMapperTest {

    private final CodeMapper mapper = new FortranCodeMapper();

    private final Scalar a = new Scalar("a", null);
    private final Scalar b = new Scalar("b", null);
    private final Scalar c = new Scalar("c", null);

    private static Expression op(String operator, Expression... operands) {
        return ExpressionFactory.createOperation(operator, List.of(operands));
    }

    // ========== NEGATION ==========

    @Test
    void chainedSubtractionRendersAsWritten() {
        Expression expr = op("-", op("-", a, b), new IntLiteral(1));

        assertEquals("a - b - 1", mapper.map(expr));
    }

    @Test
    void leadingNegationRendersAsUnaryMinus() {
        assertEquals("-a + b", mapper.map(op("+", op("-", a), b)));
        assertEquals("-a*b", mapper.map(op("-", op("*", a, b))));
    }

    @Test
    void negatedFactorIsParenthesised() {
        assertEquals("a*(-b)", mapper.map(op("*", a, op("-", b))));
    }

    @Test
    void negativeLiteralIsParenthesisedInProduct() {
        assertEquals("a*(-2)", mapper.map(op("*", a, new IntLiteral(-2))));
    }

    // ========== PARENTHESES ==========

    @Test
    void sumInsideProductGetsParentheses() {
        Expression expr = op("*", a, new Sum(List.of(b, c)));

        assertEquals("a*(b + c)", mapper.map(expr));
    }

    @Test
    void parenthesisedMarkersAlwaysPrintParentheses() {
        Expression expr = op("+", a, ExpressionFactory.parenthesise(op("*", b, c)));

        assertEquals("a + (b*c)", mapper.map(expr));
    }

    @Test
    void parenthesisedSumAsFactor() {
        Expression expr = op("*", ExpressionFactory.parenthesise(op("+", a, b)), c);

        assertEquals("(a + b)*c", mapper.map(expr));
    }

    @Test
    void explicitParenthesesAroundNonArithmeticKindsArePreserved() {
        // Given (a .and. b) .or. c, (a == 1) and (a // b) // c
        Expression logical = op(".or.", ExpressionFactory.parenthesise(op(".and.", a, b)), c);
        Expression comparison = ExpressionFactory.parenthesise(op("==", a, new IntLiteral(1)));
        Expression concat = op("//", ExpressionFactory.parenthesise(op("//", a, b)), c);

        // When / Then
        assertEquals("(a .and. b) .or. c", mapper.map(logical));
        assertEquals("(a == 1)", mapper.map(comparison));
        assertEquals("(a // b) // c", mapper.map(concat));
        assertEquals("(a)", mapper.map(ExpressionFactory.parenthesise(a)));
    }

    @Test
    void powerIsRightAssociative() {
        assertEquals("a**b**c", mapper.map(new Power(a, new Power(b, c))));
        assertEquals("(a**b)**c", mapper.map(new Power(new Power(a, b), c)));
    }

    @Test
    void quotientDenominatorBindsTightly() {
        assertEquals("a / (b*c)", mapper.map(new Quotient(a, op("*", b, c))));
        assertEquals("a*b / c", mapper.map(new Quotient(op("*", a, b), c)));
    }

    @Test
    void logicalOperatorsRespectPrecedence() {
        Expression expr = op(".and.", op(".or.", a, b), op(".not.", c));

        assertEquals("(a .or. b) .and. .not. c", mapper.map(expr));
    }

    // ========== FORTRAN SPELLING ==========

    @Test
    void inequalityUsesFortranOperator() {
        assertEquals("a /= b", mapper.map(op(".ne.", a, b)));
    }

    @Test
    void literalsKeepKindsAndQuotes() {
        assertEquals(".true._lk", mapper.map(new LogicLiteral(true, "lk")));
        assertEquals("8_jpim", mapper.map(new IntLiteral(8, "jpim")));
        assertEquals("'it''s'", mapper.map(new StringLiteral("it's")));
    }

    @Test
    void subscriptsAndComponents() {
        Scalar base = new Scalar("state", null);
        Array field = new Array("state%field", base, null, new ArraySubscript(List.of(
                new Scalar("i", null),
                new RangeIndex(new IntLiteral(1), new Scalar("n", null), null))));

        assertEquals("state%field(i, 1:n)", mapper.map(field));
    }

    @Test
    void nullRendersAsNull() {
        assertNull(mapper.map(null));
    }
}
