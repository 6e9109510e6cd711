package me.christianrobert.ftranspile.expression;

import me.christianrobert.ftranspile.frontend.context.MalformedOperatorException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds canonical expression nodes from operator tokens.
 *
 * <h3>Canonicalization rules:</h3>
 * <pre>
 * a + b + c      Sum(a, b, c)                     nested unparenthesised sums are spliced
 * a - b          Sum(a, Product(-1, b))
 * -a             Product(-1, a)
 * a * b * c      Product(a, b, c)                 nested unparenthesised products are spliced
 * a .eqv. b      (a .and. b) .or. .not. (a .or. b)
 * a .neqv. b     .not. (a .and. b) .and. (a .or. b)
 * a .ne. b       Comparison(a, "!=", b)           dotted and symbolic spellings share one form
 * </pre>
 */
public final class ExpressionFactory {

    private static final IntLiteral MINUS_ONE = new IntLiteral(-1);

    private ExpressionFactory() {
    }

    /**
     * Creates the expression node for an operator applied to its operands.
     *
     * @param op operator token as written in source, any case
     * @param operands one operand for unary operators, two (or more for n-ary ones) otherwise
     * @return canonical expression
     * @throws MalformedOperatorException if the operator is not known
     */
    public static Expression createOperation(String op, List<Expression> operands) {
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException("Operation '" + op + "' requires operands");
        }
        String operator = op == null ? "" : op.trim().toLowerCase(Locale.ROOT);

        return switch (operator) {
            case "+" -> operands.size() == 1 ? operands.get(0) : new Sum(flattenSum(operands));
            case "-" -> operands.size() == 1
                    ? negate(operands.get(0))
                    : new Sum(flattenSum(List.of(operands.get(0), negate(operands.get(1)))));
            case "*" -> new Product(flattenProduct(operands));
            case "/" -> new Quotient(operands.get(0), operands.get(1));
            case "**" -> new Power(operands.get(0), operands.get(1));
            case ".and." -> new LogicalAnd(operands);
            case ".or." -> new LogicalOr(operands);
            case ".not." -> new LogicalNot(operands.get(0));
            case ".eqv." -> new LogicalOr(List.of(
                    new LogicalAnd(operands),
                    new LogicalNot(new LogicalOr(operands))));
            case ".neqv." -> new LogicalAnd(List.of(
                    new LogicalNot(new LogicalAnd(operands)),
                    new LogicalOr(operands)));
            case "==", ".eq." -> new Comparison(operands.get(0), "==", operands.get(1));
            case "/=", "!=", ".ne." -> new Comparison(operands.get(0), "!=", operands.get(1));
            case ">", ".gt." -> new Comparison(operands.get(0), ">", operands.get(1));
            case "<", ".lt." -> new Comparison(operands.get(0), "<", operands.get(1));
            case ">=", ".ge." -> new Comparison(operands.get(0), ">=", operands.get(1));
            case "<=", ".le." -> new Comparison(operands.get(0), "<=", operands.get(1));
            case "//" -> new StringConcat(operands);
            default -> throw new MalformedOperatorException(op);
        };
    }

    /**
     * Canonical negation: {@code Product(-1, expr)}, splicing the factors of an
     * unparenthesised product.
     */
    public static Expression negate(Expression expr) {
        List<Expression> factors = new ArrayList<>();
        factors.add(MINUS_ONE);
        if (isPlainProduct(expr) && !((Product) expr).isNegation()) {
            factors.addAll(expr.getChildren());
        } else {
            factors.add(expr);
        }
        return new Product(factors);
    }

    /**
     * Wraps an arithmetic node into its parenthesis-marker variant and any other kind
     * into a {@link ParenthesisedExpression}. Redundant double parentheses collapse.
     */
    public static Expression parenthesise(Expression expr) {
        if (expr instanceof ParenthesisedAdd || expr instanceof ParenthesisedMul
                || expr instanceof ParenthesisedDiv || expr instanceof ParenthesisedPow
                || expr instanceof ParenthesisedExpression) {
            return expr;
        }
        if (expr instanceof Sum) {
            return new ParenthesisedAdd(expr.getChildren());
        }
        if (expr instanceof Product) {
            return new ParenthesisedMul(expr.getChildren());
        }
        if (expr instanceof Quotient) {
            Quotient q = (Quotient) expr;
            return new ParenthesisedDiv(q.getNumerator(), q.getDenominator());
        }
        if (expr instanceof Power) {
            Power p = (Power) expr;
            return new ParenthesisedPow(p.getBase(), p.getExponent());
        }
        return new ParenthesisedExpression(expr);
    }

    private static List<Expression> flattenSum(List<Expression> operands) {
        List<Expression> result = new ArrayList<>();
        for (Expression operand : operands) {
            if (operand instanceof Sum && !(operand instanceof ParenthesisedAdd)) {
                result.addAll(operand.getChildren());
            } else {
                result.add(operand);
            }
        }
        return result;
    }

    private static List<Expression> flattenProduct(List<Expression> operands) {
        List<Expression> result = new ArrayList<>();
        for (int i = 0; i < operands.size(); i++) {
            Expression operand = operands.get(i);
            // a negation is only spliced in leading position, "a*-b" keeps its shape
            boolean splice = isPlainProduct(operand) && (i == 0 || !((Product) operand).isNegation());
            if (splice) {
                result.addAll(operand.getChildren());
            } else {
                result.add(operand);
            }
        }
        return result;
    }

    private static boolean isPlainProduct(Expression expr) {
        return expr instanceof Product && !(expr instanceof ParenthesisedMul);
    }
}
