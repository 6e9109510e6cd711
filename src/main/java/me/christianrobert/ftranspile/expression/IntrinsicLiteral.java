package me.christianrobert.ftranspile.expression;

import java.util.Collections;
import java.util.List;

/**
 * Opaque literal text that the algebra does not model (complex constants, repeat
 * counts in DATA statements, passthrough of unsupported expression syntax).
 * Printers emit the text unchanged.
 */
public class IntrinsicLiteral extends Expression {

    private final String value;

    public IntrinsicLiteral(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitIntrinsicLiteral(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "IntrinsicLiteral{value=" + value + "}";
    }
}
