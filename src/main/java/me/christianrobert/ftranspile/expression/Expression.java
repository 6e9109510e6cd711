package me.christianrobert.ftranspile.expression;

import java.util.List;

/**
 * Base class for all nodes of the symbolic expression algebra.
 *
 * <p>The set of expression kinds is closed: every concrete subclass dispatches to its
 * own method of {@link ExpressionVisitor}, so introducing a new kind breaks every
 * consumer at compile time until it is handled.</p>
 *
 * <p>Canonical form:</p>
 * <ul>
 *   <li>{@link Sum} and {@link Product} hold flattened operand lists</li>
 *   <li>subtraction and unary minus are a {@link Product} with a leading {@code IntLiteral(-1)}</li>
 *   <li>explicit source parentheses survive as the Parenthesised* variants</li>
 * </ul>
 */
public abstract class Expression {

    /**
     * Dispatches to the visitor method for this expression kind.
     */
    public abstract <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg);

    /**
     * Direct sub-expressions in evaluation order. Leaves return an empty list.
     */
    public abstract List<Expression> getChildren();
}
