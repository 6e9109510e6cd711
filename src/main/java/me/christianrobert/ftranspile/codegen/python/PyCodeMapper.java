package me.christianrobert.ftranspile.codegen.python;

import me.christianrobert.ftranspile.codegen.CodeMapper;
import me.christianrobert.ftranspile.codegen.Precedence;
import me.christianrobert.ftranspile.expression.Cast;

import java.util.List;

/**
 * Python/NumPy spelling of expressions: {@code a[i, j]} indexing, {@code True}/{@code False},
 * word operators for logic and {@code np.array} for array constructors. Literal kinds are dropped.
 */
public class PyCodeMapper extends CodeMapper {

    @Override
    protected String componentSeparator() {
        return ".";
    }

    @Override
    protected String subscript(List<String> indices) {
        return "[" + String.join(", ", indices) + "]";
    }

    @Override
    protected String logicLiteral(boolean value, String kind) {
        return value ? "True" : "False";
    }

    @Override
    protected String stringLiteral(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    protected String literalList(List<String> elements) {
        return "np.array([" + String.join(", ", elements) + "])";
    }

    @Override
    protected String kindSuffix(String kind) {
        return "";
    }

    @Override
    protected String andOperator() {
        return " and ";
    }

    @Override
    protected String orOperator() {
        return " or ";
    }

    @Override
    protected String notPrefix() {
        return "not ";
    }

    @Override
    protected String concatOperator() {
        return " + ";
    }

    @Override
    public String visitCast(Cast expr, Precedence enclosing) {
        String function = switch (expr.getName()) {
            case "int", "nint" -> "int";
            case "logical" -> "bool";
            default -> "float";
        };
        return function + "(" + rec(expr.getExpression(), Precedence.NONE) + ")";
    }
}
