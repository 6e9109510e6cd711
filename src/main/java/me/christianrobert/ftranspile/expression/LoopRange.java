package me.christianrobert.ftranspile.expression;

/**
 * Bounds of a counted DO loop: {@code start, end[, step]}.
 */
public class LoopRange extends RangeIndex {

    public LoopRange(Expression start, Expression end, Expression step) {
        super(start, end, step);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitLoopRange(this, arg);
    }
}
