package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.Expression;

/**
 * Assignment {@code lhs = rhs}, or pointer assignment {@code lhs => rhs} when {@code ptr} is set.
 */
public class Assignment extends Node {

    private final Expression lhs;
    private final Expression rhs;
    private final boolean ptr;
    private final String comment;

    public Assignment(Expression lhs, Expression rhs, boolean ptr, String comment, Source source, String label) {
        super(source, label);
        this.lhs = lhs;
        this.rhs = rhs;
        this.ptr = ptr;
        this.comment = comment;
    }

    public Expression getLhs() {
        return lhs;
    }

    public Expression getRhs() {
        return rhs;
    }

    public boolean isPtr() {
        return ptr;
    }

    /**
     * Trailing comment on the same line, including the {@code !}, or null.
     */
    public String getComment() {
        return comment;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }

    @Override
    public String toString() {
        return "Assignment{lhs=" + lhs + ", ptr=" + ptr + "}";
    }
}
