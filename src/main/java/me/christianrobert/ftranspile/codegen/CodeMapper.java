package me.christianrobert.ftranspile.codegen;

import me.christianrobert.ftranspile.expression.Array;
import me.christianrobert.ftranspile.expression.ArraySubscript;
import me.christianrobert.ftranspile.expression.Cast;
import me.christianrobert.ftranspile.expression.Comparison;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.ExpressionVisitor;
import me.christianrobert.ftranspile.expression.FloatLiteral;
import me.christianrobert.ftranspile.expression.InlineCall;
import me.christianrobert.ftranspile.expression.IntLiteral;
import me.christianrobert.ftranspile.expression.IntrinsicLiteral;
import me.christianrobert.ftranspile.expression.LiteralList;
import me.christianrobert.ftranspile.expression.LogicLiteral;
import me.christianrobert.ftranspile.expression.LogicalAnd;
import me.christianrobert.ftranspile.expression.LogicalNot;
import me.christianrobert.ftranspile.expression.LogicalOr;
import me.christianrobert.ftranspile.expression.LoopRange;
import me.christianrobert.ftranspile.expression.ParenthesisedAdd;
import me.christianrobert.ftranspile.expression.ParenthesisedDiv;
import me.christianrobert.ftranspile.expression.ParenthesisedExpression;
import me.christianrobert.ftranspile.expression.ParenthesisedMul;
import me.christianrobert.ftranspile.expression.ParenthesisedPow;
import me.christianrobert.ftranspile.expression.Power;
import me.christianrobert.ftranspile.expression.Product;
import me.christianrobert.ftranspile.expression.Quotient;
import me.christianrobert.ftranspile.expression.RangeIndex;
import me.christianrobert.ftranspile.expression.Scalar;
import me.christianrobert.ftranspile.expression.StringConcat;
import me.christianrobert.ftranspile.expression.StringLiteral;
import me.christianrobert.ftranspile.expression.Sum;
import me.christianrobert.ftranspile.expression.TypedSymbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders expression trees as text, threading the enclosing {@link Precedence}
 * through the traversal.
 *
 * <h3>Negation:</h3>
 * <p>Subtraction and unary minus are stored as products with a leading {@code -1}
 * factor. Sums print such terms as {@code a - b}; a standalone negation prints as
 * {@code -b}. The {@code -1} is never rendered as a multiplication.</p>
 *
 * <h3>Parentheses:</h3>
 * <p>Derived from precedence, except for the parenthesis-marker variants
 * ({@code ParenthesisedAdd}, {@code ParenthesisedExpression} etc.) which always print them. Re-emitting parsed
 * source is therefore idempotent.</p>
 *
 * <p>Subclasses override the hooks for the target's spelling of literals,
 * operators, subscripts and component access.</p>
 */
public abstract class CodeMapper implements ExpressionVisitor<String, Precedence> {

    /**
     * Renders an expression at the weakest context precedence; null renders as null.
     */
    public String map(Expression expr) {
        return expr == null ? null : expr.accept(this, Precedence.NONE);
    }

    /**
     * Renders a list of expressions, each at the weakest context precedence.
     */
    public List<String> mapAll(List<? extends Expression> exprs) {
        List<String> result = new ArrayList<>();
        for (Expression expr : exprs) {
            result.add(map(expr));
        }
        return result;
    }

    protected String rec(Expression expr, Precedence enclosing) {
        return expr.accept(this, enclosing);
    }

    protected static String parenthesize(String text) {
        return "(" + text + ")";
    }

    protected static String parenthesizeIfNeeded(String text, Precedence enclosing, Precedence own) {
        return enclosing.bindsTighterThan(own) ? parenthesize(text) : text;
    }

    // ---------------------------------------------------------------------
    // Target hooks
    // ---------------------------------------------------------------------

    /** Separator between a derived-type instance and its component. */
    protected String componentSeparator() {
        return "%";
    }

    /** Subscript text for already rendered (non-empty) index expressions. */
    protected String subscript(List<String> indices) {
        return "(" + String.join(", ", indices) + ")";
    }

    protected String logicLiteral(boolean value, String kind) {
        return value ? "true" : "false";
    }

    protected String stringLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    protected String literalList(List<String> elements) {
        return "[" + String.join(", ", elements) + "]";
    }

    protected String comparisonOperator(String operator) {
        return operator;
    }

    protected String andOperator() {
        return " .and. ";
    }

    protected String orOperator() {
        return " .or. ";
    }

    protected String notPrefix() {
        return ".not. ";
    }

    protected String concatOperator() {
        return " // ";
    }

    /** Suffix for a literal with an explicit kind; empty when the target has no kinds. */
    protected String kindSuffix(String kind) {
        return kind == null ? "" : "_" + kind;
    }

    protected String callName(String name) {
        return name;
    }

    // ---------------------------------------------------------------------
    // Symbols
    // ---------------------------------------------------------------------

    protected String symbolName(TypedSymbol symbol) {
        if (symbol.getParent() != null) {
            return rec(symbol.getParent(), Precedence.CALL) + componentSeparator() + symbol.getBasename();
        }
        return symbol.getName();
    }

    @Override
    public String visitScalar(Scalar expr, Precedence enclosing) {
        return symbolName(expr);
    }

    @Override
    public String visitArray(Array expr, Precedence enclosing) {
        String dims = expr.getDimensions() != null ? rec(expr.getDimensions(), Precedence.NONE) : "";
        return symbolName(expr) + dims;
    }

    @Override
    public String visitArraySubscript(ArraySubscript expr, Precedence enclosing) {
        List<String> indices = new ArrayList<>();
        for (Expression index : expr.getIndex()) {
            String rendered = rec(index, Precedence.NONE);
            if (!rendered.isEmpty()) {
                indices.add(rendered);
            }
        }
        return indices.isEmpty() ? "" : subscript(indices);
    }

    @Override
    public String visitRangeIndex(RangeIndex expr, Precedence enclosing) {
        StringBuilder result = new StringBuilder();
        if (expr.getLower() != null) {
            result.append(rec(expr.getLower(), Precedence.NONE));
        }
        result.append(':');
        if (expr.getUpper() != null) {
            result.append(rec(expr.getUpper(), Precedence.NONE));
        }
        if (expr.getStep() != null) {
            result.append(':').append(rec(expr.getStep(), Precedence.NONE));
        }
        return result.toString();
    }

    @Override
    public String visitLoopRange(LoopRange expr, Precedence enclosing) {
        String bounds = rec(expr.getLower(), Precedence.NONE) + ", " + rec(expr.getUpper(), Precedence.NONE);
        if (expr.getStep() != null) {
            bounds += ", " + rec(expr.getStep(), Precedence.NONE);
        }
        return bounds;
    }

    // ---------------------------------------------------------------------
    // Literals
    // ---------------------------------------------------------------------

    @Override
    public String visitIntLiteral(IntLiteral expr, Precedence enclosing) {
        String text = expr.getValue() + kindSuffix(expr.getKind());
        return expr.getValue() < 0 ? parenthesizeIfNeeded(text, enclosing, Precedence.SUM) : text;
    }

    @Override
    public String visitFloatLiteral(FloatLiteral expr, Precedence enclosing) {
        String text = expr.getValue() + kindSuffix(expr.getKind());
        return expr.getValue().startsWith("-") ? parenthesizeIfNeeded(text, enclosing, Precedence.SUM) : text;
    }

    @Override
    public String visitLogicLiteral(LogicLiteral expr, Precedence enclosing) {
        return logicLiteral(expr.getValue(), expr.getKind());
    }

    @Override
    public String visitStringLiteral(StringLiteral expr, Precedence enclosing) {
        return stringLiteral(expr.getValue());
    }

    @Override
    public String visitIntrinsicLiteral(IntrinsicLiteral expr, Precedence enclosing) {
        return expr.getValue();
    }

    @Override
    public String visitLiteralList(LiteralList expr, Precedence enclosing) {
        List<String> elements = new ArrayList<>();
        for (Expression element : expr.getElements()) {
            elements.add(rec(element, Precedence.NONE));
        }
        return literalList(elements);
    }

    // ---------------------------------------------------------------------
    // Arithmetic
    // ---------------------------------------------------------------------

    /**
     * Factors of a negation as one printable expression text at product precedence.
     */
    private String negatedTerm(Product negation) {
        return renderFactors(negation.getNegatedFactors(), Precedence.PRODUCT);
    }

    private String renderFactors(List<Expression> factors, Precedence enclosing) {
        List<String> parts = new ArrayList<>();
        for (Expression factor : factors) {
            parts.add(rec(factor, enclosing));
        }
        return String.join("*", parts);
    }

    private static boolean isNegation(Expression expr) {
        return expr instanceof Product && !(expr instanceof ParenthesisedMul) && ((Product) expr).isNegation();
    }

    @Override
    public String visitSum(Sum expr, Precedence enclosing) {
        StringBuilder result = new StringBuilder();
        List<Expression> terms = expr.getChildren();
        for (int i = 0; i < terms.size(); i++) {
            Expression term = terms.get(i);
            boolean negative = isNegation(term);
            if (i == 0) {
                result.append(negative ? "-" + negatedTerm((Product) term) : rec(term, Precedence.SUM));
            } else if (negative) {
                result.append(" - ").append(negatedTerm((Product) term));
            } else {
                result.append(" + ").append(rec(term, Precedence.SUM));
            }
        }
        return parenthesizeIfNeeded(result.toString(), enclosing, Precedence.SUM);
    }

    @Override
    public String visitProduct(Product expr, Precedence enclosing) {
        if (isNegation(expr)) {
            // unary minus binds like a sum: "a*(-b)", "-a*b"
            return parenthesizeIfNeeded("-" + negatedTerm(expr), enclosing, Precedence.SUM);
        }
        return parenthesizeIfNeeded(renderFactors(expr.getChildren(), Precedence.PRODUCT),
                enclosing, Precedence.PRODUCT);
    }

    @Override
    public String visitQuotient(Quotient expr, Precedence enclosing) {
        String text = rec(expr.getNumerator(), Precedence.PRODUCT) + " / "
                + rec(expr.getDenominator(), Precedence.POWER);
        return parenthesizeIfNeeded(text, enclosing, Precedence.PRODUCT);
    }

    @Override
    public String visitPower(Power expr, Precedence enclosing) {
        // right-associative: a**b**c is a**(b**c)
        String text = rec(expr.getBase(), Precedence.CALL) + "**" + rec(expr.getExponent(), Precedence.POWER);
        return parenthesizeIfNeeded(text, enclosing, Precedence.POWER);
    }

    @Override
    public String visitParenthesisedAdd(ParenthesisedAdd expr, Precedence enclosing) {
        return parenthesize(visitSum(expr, Precedence.NONE));
    }

    @Override
    public String visitParenthesisedMul(ParenthesisedMul expr, Precedence enclosing) {
        if (expr.isNegation()) {
            return parenthesize("-" + negatedTerm(expr));
        }
        return parenthesize(renderFactors(expr.getChildren(), Precedence.PRODUCT));
    }

    @Override
    public String visitParenthesisedDiv(ParenthesisedDiv expr, Precedence enclosing) {
        return parenthesize(visitQuotient(expr, Precedence.NONE));
    }

    @Override
    public String visitParenthesisedPow(ParenthesisedPow expr, Precedence enclosing) {
        return parenthesize(visitPower(expr, Precedence.NONE));
    }

    @Override
    public String visitParenthesisedExpression(ParenthesisedExpression expr, Precedence enclosing) {
        return parenthesize(rec(expr.getChild(), Precedence.NONE));
    }

    // ---------------------------------------------------------------------
    // Logic, comparison and strings
    // ---------------------------------------------------------------------

    @Override
    public String visitComparison(Comparison expr, Precedence enclosing) {
        String text = rec(expr.getLeft(), Precedence.COMPARISON) + " "
                + comparisonOperator(expr.getOperator()) + " "
                + rec(expr.getRight(), Precedence.COMPARISON);
        return parenthesizeIfNeeded(text, enclosing, Precedence.COMPARISON);
    }

    private String join(List<Expression> children, String operator, Precedence own) {
        List<String> parts = new ArrayList<>();
        for (Expression child : children) {
            parts.add(rec(child, own));
        }
        return String.join(operator, parts);
    }

    @Override
    public String visitLogicalAnd(LogicalAnd expr, Precedence enclosing) {
        return parenthesizeIfNeeded(join(expr.getChildren(), andOperator(), Precedence.LOGICAL_AND),
                enclosing, Precedence.LOGICAL_AND);
    }

    @Override
    public String visitLogicalOr(LogicalOr expr, Precedence enclosing) {
        return parenthesizeIfNeeded(join(expr.getChildren(), orOperator(), Precedence.LOGICAL_OR),
                enclosing, Precedence.LOGICAL_OR);
    }

    @Override
    public String visitLogicalNot(LogicalNot expr, Precedence enclosing) {
        return parenthesizeIfNeeded(notPrefix() + rec(expr.getChild(), Precedence.LOGICAL_NOT),
                enclosing, Precedence.LOGICAL_NOT);
    }

    @Override
    public String visitStringConcat(StringConcat expr, Precedence enclosing) {
        return parenthesizeIfNeeded(join(expr.getChildren(), concatOperator(), Precedence.CONCAT),
                enclosing, Precedence.CONCAT);
    }

    // ---------------------------------------------------------------------
    // Calls
    // ---------------------------------------------------------------------

    @Override
    public String visitCast(Cast expr, Precedence enclosing) {
        String text = callName(expr.getName()) + "(" + rec(expr.getExpression(), Precedence.NONE);
        if (expr.getKind() != null) {
            text += ", kind=" + rec(expr.getKind(), Precedence.NONE);
        }
        return text + ")";
    }

    @Override
    public String visitInlineCall(InlineCall expr, Precedence enclosing) {
        List<String> args = new ArrayList<>();
        for (Expression param : expr.getParameters()) {
            args.add(rec(param, Precedence.NONE));
        }
        for (Map.Entry<String, Expression> kw : expr.getKwArguments().entrySet()) {
            args.add(kw.getKey() + "=" + rec(kw.getValue(), Precedence.NONE));
        }
        return callName(expr.getName()) + "(" + String.join(", ", args) + ")";
    }
}
