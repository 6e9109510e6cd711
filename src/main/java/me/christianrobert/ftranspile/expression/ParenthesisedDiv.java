package me.christianrobert.ftranspile.expression;

/**
 * A {@link Quotient} that was written inside explicit parentheses.
 */
public class ParenthesisedDiv extends Quotient {

    public ParenthesisedDiv(Expression numerator, Expression denominator) {
        super(numerator, denominator);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitParenthesisedDiv(this, arg);
    }
}
