package me.christianrobert.ftranspile.expression;

import java.util.List;

/**
 * Explicit source parentheses around any non-arithmetic expression: logical and
 * relational operations, concatenations, symbols and calls. Arithmetic nodes use the
 * marker subclasses ({@link ParenthesisedAdd} etc.) instead.
 */
public class ParenthesisedExpression extends Expression {

    private final Expression child;

    public ParenthesisedExpression(Expression child) {
        this.child = child;
    }

    public Expression getChild() {
        return child;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitParenthesisedExpression(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(child);
    }

    @Override
    public String toString() {
        return "ParenthesisedExpression{child=" + child + "}";
    }
}
