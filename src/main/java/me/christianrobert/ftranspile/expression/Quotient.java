package me.christianrobert.ftranspile.expression;

import java.util.List;

public class Quotient extends Expression {

    private final Expression numerator;
    private final Expression denominator;

    public Quotient(Expression numerator, Expression denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public Expression getNumerator() {
        return numerator;
    }

    public Expression getDenominator() {
        return denominator;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitQuotient(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(numerator, denominator);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{numerator=" + numerator + ", denominator=" + denominator + "}";
    }
}
