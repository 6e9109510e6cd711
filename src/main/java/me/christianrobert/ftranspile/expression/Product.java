package me.christianrobert.ftranspile.expression;

import java.util.List;

/**
 * N-ary product. A leading {@code IntLiteral(-1)} factor encodes negation.
 */
public class Product extends Expression {

    private final List<Expression> children;

    public Product(List<Expression> children) {
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("Product requires at least one operand");
        }
        this.children = List.copyOf(children);
    }

    /**
     * True if this product is the canonical form of a negation ({@code -x}).
     */
    public boolean isNegation() {
        Expression first = children.get(0);
        return children.size() > 1
                && first instanceof IntLiteral
                && ((IntLiteral) first).getValue() == -1
                && ((IntLiteral) first).getKind() == null;
    }

    /**
     * The factors after the leading -1, for a negation.
     */
    public List<Expression> getNegatedFactors() {
        return children.subList(1, children.size());
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitProduct(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{children=" + children + "}";
    }
}
