package me.christianrobert.ftranspile.expression;

import java.util.List;

/**
 * Ordered list of indices (expressions or {@link RangeIndex} sections) of an array reference.
 */
public class ArraySubscript extends Expression {

    private final List<Expression> index;

    public ArraySubscript(List<Expression> index) {
        this.index = List.copyOf(index);
    }

    public List<Expression> getIndex() {
        return index;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitArraySubscript(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return index;
    }

    @Override
    public String toString() {
        return "ArraySubscript{index=" + index + "}";
    }
}
