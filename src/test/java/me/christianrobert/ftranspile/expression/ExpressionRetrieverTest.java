package me.christianrobert.ftranspile.expression;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionRetrieverTest {

    @Test
    void collectsMatchesInPostOrder() {
        Scalar a = new Scalar("a", null);
        Scalar b = new Scalar("b", null);
        Expression expr = ExpressionFactory.createOperation("-", List.of(a, b));

        List<Expression> all = ExpressionSearch.retrieveExpressions(expr);

        assertSame(expr, all.get(all.size() - 1), "The root comes last");
        assertEquals(List.of(a, b), ExpressionSearch.retrieveVariables(expr));
    }

    @Test
    void findsCallsInsideSubscripts() {
        InlineCall size = new InlineCall("size", List.of(new Scalar("v", null)), Map.of());
        Array element = new Array("v", null, new ArraySubscript(List.of(size)));

        List<InlineCall> calls = ExpressionSearch.retrieveInlineCalls(element);

        assertEquals(1, calls.size());
        assertEquals("size", calls.get(0).getName());
    }

    @Test
    void retrieverIsSingleUse() {
        ExpressionRetriever retriever = new ExpressionRetriever(e -> e instanceof IntLiteral);
        assertEquals(1, retriever.retrieve(new IntLiteral(3)).size());

        assertThrows(IllegalStateException.class, () -> retriever.retrieve(new IntLiteral(4)));
    }

    @Test
    void severalRootsSkipNulls() {
        List<Expression> roots = new ArrayList<>();
        roots.add(new IntLiteral(1));
        roots.add(null);
        roots.add(new IntLiteral(2));

        assertEquals(2, ExpressionSearch.retrieve(roots, e -> true).size());
    }
}
