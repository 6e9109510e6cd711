package me.christianrobert.ftranspile.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Walks an expression tree and collects every sub-expression matching a predicate.
 *
 * <p>Matches are collected in post-order (operands before the node using them).
 * A retriever is single-use: its result is materialized once and a second
 * {@link #retrieve} call is rejected.</p>
 */
public class ExpressionRetriever {

    private final Predicate<Expression> query;
    private final List<Expression> matches = new ArrayList<>();
    private boolean consumed;

    public ExpressionRetriever(Predicate<Expression> query) {
        if (query == null) {
            throw new IllegalArgumentException("Query predicate cannot be null");
        }
        this.query = query;
    }

    /**
     * Collects all matching sub-expressions of {@code expr}, including {@code expr} itself.
     *
     * @return unmodifiable list of matches
     * @throws IllegalStateException if this retriever was already used
     */
    public List<Expression> retrieve(Expression expr) {
        if (consumed) {
            throw new IllegalStateException("ExpressionRetriever can only be used once");
        }
        consumed = true;
        if (expr != null) {
            walk(expr);
        }
        return Collections.unmodifiableList(matches);
    }

    private void walk(Expression expr) {
        for (Expression child : expr.getChildren()) {
            walk(child);
        }
        if (query.test(expr)) {
            matches.add(expr);
        }
    }
}
