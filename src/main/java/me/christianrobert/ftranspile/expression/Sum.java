package me.christianrobert.ftranspile.expression;

import java.util.List;

/**
 * N-ary sum. Subtracted terms appear as a {@link Product} led by {@code IntLiteral(-1)}.
 */
public class Sum extends Expression {

    private final List<Expression> children;

    public Sum(List<Expression> children) {
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("Sum requires at least one operand");
        }
        this.children = List.copyOf(children);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitSum(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{children=" + children + "}";
    }
}
