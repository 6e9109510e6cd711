package me.christianrobert.ftranspile.expression;

import java.util.Collections;
import java.util.List;

/**
 * Character literal. The value is stored unquoted with doubled quotes collapsed.
 */
public class StringLiteral extends Expression {

    private final String value;

    public StringLiteral(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitStringLiteral(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "StringLiteral{value='" + value + "'}";
    }
}
