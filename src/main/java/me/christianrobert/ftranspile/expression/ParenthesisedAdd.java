package me.christianrobert.ftranspile.expression;

import java.util.List;

/**
 * A {@link Sum} that was written inside explicit parentheses.
 */
public class ParenthesisedAdd extends Sum {

    public ParenthesisedAdd(List<Expression> children) {
        super(children);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitParenthesisedAdd(this, arg);
    }
}
