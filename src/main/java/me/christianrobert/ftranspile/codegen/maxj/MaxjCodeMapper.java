package me.christianrobert.ftranspile.codegen.maxj;

import me.christianrobert.ftranspile.codegen.CodeMapper;
import me.christianrobert.ftranspile.codegen.Precedence;
import me.christianrobert.ftranspile.expression.Cast;
import me.christianrobert.ftranspile.expression.Comparison;
import me.christianrobert.ftranspile.expression.Power;
import me.christianrobert.ftranspile.expression.RangeIndex;
import me.christianrobert.ftranspile.scope.TypeTag;

import java.util.List;

/**
 * Java/MaxJ spelling of expressions.
 *
 * <ul>
 *   <li>{@code a%b} becomes {@code a.b}, {@code a(i, j)} becomes {@code a[i][j]}</li>
 *   <li>equality tests become {@code a.eq(b)} and {@code a.neq(b)} so they work on dataflow variables</li>
 *   <li>{@code a**b} becomes {@code KernelMath.pow(a, b)}</li>
 *   <li>casts become {@code x.cast(dfeType)}</li>
 *   <li>a range subscript keeps only its upper bound</li>
 * </ul>
 */
public class MaxjCodeMapper extends CodeMapper {

    @Override
    protected String componentSeparator() {
        return ".";
    }

    @Override
    protected String subscript(List<String> indices) {
        StringBuilder result = new StringBuilder();
        for (String index : indices) {
            result.append('[').append(index).append(']');
        }
        return result.toString();
    }

    @Override
    protected String logicLiteral(boolean value, String kind) {
        return value ? "true" : "false";
    }

    @Override
    protected String stringLiteral(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    @Override
    protected String literalList(List<String> elements) {
        return "{" + String.join(", ", elements) + "}";
    }

    @Override
    protected String kindSuffix(String kind) {
        return "";
    }

    @Override
    protected String andOperator() {
        return " & ";
    }

    @Override
    protected String orOperator() {
        return " | ";
    }

    @Override
    protected String notPrefix() {
        return "~";
    }

    @Override
    protected String concatOperator() {
        return " + ";
    }

    @Override
    public String visitRangeIndex(RangeIndex expr, Precedence enclosing) {
        return expr.getUpper() != null ? rec(expr.getUpper(), enclosing) : "";
    }

    @Override
    public String visitComparison(Comparison expr, Precedence enclosing) {
        String operator = expr.getOperator();
        if (operator.equals("==") || operator.equals("!=")) {
            String text = rec(expr.getLeft(), Precedence.CALL) + (operator.equals("==") ? ".eq(" : ".neq(")
                    + rec(expr.getRight(), Precedence.NONE) + ")";
            return parenthesizeIfNeeded(text, enclosing, Precedence.COMPARISON);
        }
        return super.visitComparison(expr, enclosing);
    }

    @Override
    public String visitPower(Power expr, Precedence enclosing) {
        return "KernelMath.pow(" + rec(expr.getBase(), Precedence.NONE) + ", "
                + rec(expr.getExponent(), Precedence.NONE) + ")";
    }

    @Override
    public String visitCast(Cast expr, Precedence enclosing) {
        TypeTag tag = switch (expr.getName()) {
            case "int", "nint" -> TypeTag.INTEGER;
            case "logical" -> TypeTag.LOGICAL;
            default -> TypeTag.REAL;
        };
        return rec(expr.getExpression(), Precedence.CALL) + ".cast(" + MaxjTypes.dfeType(tag, expr.getKind()) + ")";
    }
}
