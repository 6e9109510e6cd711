package me.christianrobert.ftranspile.expression;

import java.util.List;
import java.util.Set;

/**
 * Relational comparison. The operator is one of {@code == != < <= > >=}, independent
 * of the spelling used in source ({@code .eq.}, {@code /=}, ...).
 */
public class Comparison extends Expression {

    public static final Set<String> OPERATORS = Set.of("==", "!=", "<", "<=", ">", ">=");

    private final Expression left;
    private final String operator;
    private final Expression right;

    public Comparison(Expression left, String operator, Expression right) {
        if (!OPERATORS.contains(operator)) {
            throw new IllegalArgumentException("Unknown comparison operator: " + operator);
        }
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public String getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitComparison(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return "Comparison{" + left + " " + operator + " " + right + "}";
    }
}
