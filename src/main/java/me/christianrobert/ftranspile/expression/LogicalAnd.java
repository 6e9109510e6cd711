package me.christianrobert.ftranspile.expression;

import java.util.List;

public class LogicalAnd extends Expression {

    private final List<Expression> children;

    public LogicalAnd(List<Expression> children) {
        this.children = List.copyOf(children);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitLogicalAnd(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return "LogicalAnd{children=" + children + "}";
    }
}
