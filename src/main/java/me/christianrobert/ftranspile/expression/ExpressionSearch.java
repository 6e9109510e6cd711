package me.christianrobert.ftranspile.expression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

/**
 * Common {@link ExpressionRetriever} queries.
 */
public final class ExpressionSearch {

    private ExpressionSearch() {
    }

    public static List<Expression> retrieveExpressions(Expression expr) {
        return new ExpressionRetriever(e -> true).retrieve(expr);
    }

    public static List<TypedSymbol> retrieveVariables(Expression expr) {
        List<TypedSymbol> result = new ArrayList<>();
        for (Expression e : new ExpressionRetriever(e -> e instanceof TypedSymbol).retrieve(expr)) {
            result.add((TypedSymbol) e);
        }
        return result;
    }

    public static List<InlineCall> retrieveInlineCalls(Expression expr) {
        List<InlineCall> result = new ArrayList<>();
        for (Expression e : new ExpressionRetriever(e -> e instanceof InlineCall).retrieve(expr)) {
            result.add((InlineCall) e);
        }
        return result;
    }

    /**
     * Runs a query over several root expressions (null entries skipped).
     */
    public static List<Expression> retrieve(Collection<? extends Expression> roots, Predicate<Expression> query) {
        List<Expression> result = new ArrayList<>();
        for (Expression root : roots) {
            if (root != null) {
                result.addAll(new ExpressionRetriever(query).retrieve(root));
            }
        }
        return result;
    }
}
