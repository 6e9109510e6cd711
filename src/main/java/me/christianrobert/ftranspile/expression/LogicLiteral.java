package me.christianrobert.ftranspile.expression;

import java.util.Collections;
import java.util.List;

public class LogicLiteral extends Expression {

    private final boolean value;
    private final String kind;

    public LogicLiteral(boolean value) {
        this(value, null);
    }

    public LogicLiteral(boolean value, String kind) {
        this.value = value;
        this.kind = kind;
    }

    public boolean getValue() {
        return value;
    }

    public String getKind() {
        return kind;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitLogicLiteral(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "LogicLiteral{value=" + value + "}";
    }
}
