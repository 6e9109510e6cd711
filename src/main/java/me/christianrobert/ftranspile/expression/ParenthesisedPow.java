package me.christianrobert.ftranspile.expression;

/**
 * A {@link Power} that was written inside explicit parentheses.
 */
public class ParenthesisedPow extends Power {

    public ParenthesisedPow(Expression base, Expression exponent) {
        super(base, exponent);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitParenthesisedPow(this, arg);
    }
}
