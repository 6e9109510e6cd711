package me.christianrobert.ftranspile.expression;

import java.util.List;

public class LogicalOr extends Expression {

    private final List<Expression> children;

    public LogicalOr(List<Expression> children) {
        this.children = List.copyOf(children);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitLogicalOr(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return "LogicalOr{children=" + children + "}";
    }
}
