package me.christianrobert.ftranspile.expression;

import java.util.List;

/**
 * A {@link Product} that was written inside explicit parentheses.
 */
public class ParenthesisedMul extends Product {

    public ParenthesisedMul(List<Expression> children) {
        super(children);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitParenthesisedMul(this, arg);
    }
}
