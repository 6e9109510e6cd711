package me.christianrobert.ftranspile.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Index triplet {@code lower:upper:step}; any part may be null (e.g. {@code :} or {@code :n}).
 */
public class RangeIndex extends Expression {

    private final Expression lower;
    private final Expression upper;
    private final Expression step;

    public RangeIndex(Expression lower, Expression upper, Expression step) {
        this.lower = lower;
        this.upper = upper;
        this.step = step;
    }

    public Expression getLower() {
        return lower;
    }

    public Expression getUpper() {
        return upper;
    }

    public Expression getStep() {
        return step;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitRangeIndex(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        List<Expression> children = new ArrayList<>();
        if (lower != null) {
            children.add(lower);
        }
        if (upper != null) {
            children.add(upper);
        }
        if (step != null) {
            children.add(step);
        }
        return children;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{lower=" + lower + ", upper=" + upper + ", step=" + step + "}";
    }
}
