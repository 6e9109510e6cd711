package me.christianrobert.ftranspile.expression;

import java.util.List;

public class LogicalNot extends Expression {

    private final Expression child;

    public LogicalNot(Expression child) {
        this.child = child;
    }

    public Expression getChild() {
        return child;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitLogicalNot(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(child);
    }

    @Override
    public String toString() {
        return "LogicalNot{child=" + child + "}";
    }
}
