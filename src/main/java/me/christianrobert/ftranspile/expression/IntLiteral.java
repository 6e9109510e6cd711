package me.christianrobert.ftranspile.expression;

import java.util.Collections;
import java.util.List;

/**
 * Integer literal with optional kind suffix ({@code 8_jpim}).
 */
public class IntLiteral extends Expression {

    private final long value;
    private final String kind;

    public IntLiteral(long value) {
        this(value, null);
    }

    public IntLiteral(long value, String kind) {
        this.value = value;
        this.kind = kind;
    }

    public long getValue() {
        return value;
    }

    public String getKind() {
        return kind;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitIntLiteral(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "IntLiteral{value=" + value + (kind != null ? ", kind=" + kind : "") + "}";
    }
}
