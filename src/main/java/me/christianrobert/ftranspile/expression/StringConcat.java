package me.christianrobert.ftranspile.expression;

import java.util.List;

/**
 * Character concatenation {@code a // b // c}.
 */
public class StringConcat extends Expression {

    private final List<Expression> children;

    public StringConcat(List<Expression> children) {
        this.children = List.copyOf(children);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitStringConcat(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return "StringConcat{children=" + children + "}";
    }
}
