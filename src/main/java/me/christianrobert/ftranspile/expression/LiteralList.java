package me.christianrobert.ftranspile.expression;

import java.util.List;

/**
 * Array constructor {@code (/ a, b, c /)} or {@code [a, b, c]}.
 */
public class LiteralList extends Expression {

    private final List<Expression> elements;

    public LiteralList(List<Expression> elements) {
        this.elements = List.copyOf(elements);
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitLiteralList(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return elements;
    }

    @Override
    public String toString() {
        return "LiteralList{elements=" + elements + "}";
    }
}
