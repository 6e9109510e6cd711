package me.christianrobert.ftranspile.expression;

import java.util.List;

/**
 * Exponentiation {@code base**exponent}; right-associative.
 */
public class Power extends Expression {

    private final Expression base;
    private final Expression exponent;

    public Power(Expression base, Expression exponent) {
        this.base = base;
        this.exponent = exponent;
    }

    public Expression getBase() {
        return base;
    }

    public Expression getExponent() {
        return exponent;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitPower(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(base, exponent);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{base=" + base + ", exponent=" + exponent + "}";
    }
}
