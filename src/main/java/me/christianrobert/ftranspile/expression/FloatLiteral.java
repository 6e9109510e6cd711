package me.christianrobert.ftranspile.expression;

import java.util.Collections;
import java.util.List;

/**
 * Real literal, kept as its source spelling ({@code 1.5d0}, {@code .5e-3}) so that
 * no precision is lost on re-emission.
 */
public class FloatLiteral extends Expression {

    private final String value;
    private final String kind;

    public FloatLiteral(String value) {
        this(value, null);
    }

    public FloatLiteral(String value, String kind) {
        this.value = value;
        this.kind = kind;
    }

    public String getValue() {
        return value;
    }

    public String getKind() {
        return kind;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitFloatLiteral(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "FloatLiteral{value=" + value + (kind != null ? ", kind=" + kind : "") + "}";
    }
}
