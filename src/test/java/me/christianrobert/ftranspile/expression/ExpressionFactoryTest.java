package me.christianrobert.ftranspile.expression;

import me.christianrobert.ftranspile.frontend.context.MalformedOperatorException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for operator canonicalization in {@link ExpressionFactory}.
 */
class ExpressionFactoryTest {

    private final Scalar a = new Scalar("a", null);
    private final Scalar b = new Scalar("b", null);
    private final Scalar c = new Scalar("c", null);

    @Test
    void subtractionBecomesSumWithNegatedTerm() {
        Expression result = ExpressionFactory.createOperation("-", List.of(a, b));

        assertTrue(result instanceof Sum);
        List<Expression> terms = result.getChildren();
        assertEquals(2, terms.size());
        assertSame(a, terms.get(0));
        assertTrue(terms.get(1) instanceof Product);
        Product negated = (Product) terms.get(1);
        assertTrue(negated.isNegation());
        assertEquals(List.of(b), negated.getNegatedFactors());
    }

    @Test
    void nestedSumsAreSpliced() {
        Expression ab = ExpressionFactory.createOperation("+", List.of(a, b));
        Expression abc = ExpressionFactory.createOperation("-", List.of(ab, c));

        assertTrue(abc instanceof Sum);
        assertEquals(3, abc.getChildren().size(), "a + b - c is one flat sum");
    }

    @Test
    void parenthesisedSumsAreNotSpliced() {
        Expression inner = ExpressionFactory.parenthesise(ExpressionFactory.createOperation("+", List.of(a, b)));
        Expression outer = ExpressionFactory.createOperation("+", List.of(inner, c));

        assertEquals(2, outer.getChildren().size());
        assertTrue(outer.getChildren().get(0) instanceof ParenthesisedAdd);
    }

    @Test
    void unaryPlusIsIdentity() {
        assertSame(a, ExpressionFactory.createOperation("+", List.of(a)));
    }

    @Test
    void negatingProductSplicesFactors() {
        Expression ab = ExpressionFactory.createOperation("*", List.of(a, b));
        Product negated = (Product) ExpressionFactory.negate(ab);

        assertTrue(negated.isNegation());
        assertEquals(3, negated.getChildren().size());
    }

    @Test
    void negationInsideProductKeepsItsShape() {
        Expression result = ExpressionFactory.createOperation("*", List.of(a, ExpressionFactory.negate(b)));

        assertEquals(2, result.getChildren().size(), "a*-b must not become -1*a*b");
        assertFalse(((Product) result).isNegation());
    }

    @Test
    void dottedAndSymbolicComparisonsShareOneForm() {
        Comparison dotted = (Comparison) ExpressionFactory.createOperation(".NE.", List.of(a, b));
        Comparison symbolic = (Comparison) ExpressionFactory.createOperation("/=", List.of(a, b));

        assertEquals("!=", dotted.getOperator());
        assertEquals("!=", symbolic.getOperator());
        assertEquals(">=", ((Comparison) ExpressionFactory.createOperation(".ge.", List.of(a, b))).getOperator());
    }

    @Test
    void equivalenceIsExpandedIntoAndOrNot() {
        Expression result = ExpressionFactory.createOperation(".eqv.", List.of(a, b));

        assertTrue(result instanceof LogicalOr);
        assertTrue(result.getChildren().get(0) instanceof LogicalAnd);
        assertTrue(result.getChildren().get(1) instanceof LogicalNot);
    }

    @Test
    void nonEquivalenceIsExpandedIntoAndOrNot() {
        Expression result = ExpressionFactory.createOperation(".neqv.", List.of(a, b));

        assertTrue(result instanceof LogicalAnd);
        assertTrue(result.getChildren().get(0) instanceof LogicalNot);
        assertTrue(result.getChildren().get(1) instanceof LogicalOr);
    }

    @Test
    void unknownOperatorIsRejected() {
        assertThrows(MalformedOperatorException.class,
                () -> ExpressionFactory.createOperation(".xor.", List.of(a, b)));
        assertThrows(IllegalArgumentException.class,
                () -> ExpressionFactory.createOperation("+", List.of()));
    }

    @Test
    void parenthesiseIsIdempotent() {
        Expression once = ExpressionFactory.parenthesise(ExpressionFactory.createOperation("*", List.of(a, b)));
        Expression twice = ExpressionFactory.parenthesise(once);

        assertTrue(once instanceof ParenthesisedMul);
        assertSame(once, twice);
    }

    @Test
    void nonArithmeticKindsAreWrappedInGenericMarker() {
        Expression and = ExpressionFactory.createOperation(".and.", List.of(a, b));

        Expression wrapped = ExpressionFactory.parenthesise(and);
        Expression symbol = ExpressionFactory.parenthesise(a);

        assertTrue(wrapped instanceof ParenthesisedExpression);
        assertSame(and, ((ParenthesisedExpression) wrapped).getChild());
        assertTrue(symbol instanceof ParenthesisedExpression);
        assertSame(wrapped, ExpressionFactory.parenthesise(wrapped));
    }
}
