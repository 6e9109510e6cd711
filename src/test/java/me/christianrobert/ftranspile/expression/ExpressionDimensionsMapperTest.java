package me.christianrobert.ftranspile.expression;

import me.christianrobert.ftranspile.scope.BasicType;
import me.christianrobert.ftranspile.scope.Scope;
import me.christianrobert.ftranspile.scope.SymbolAttributes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for shape inference.
 */
class ExpressionDimensionsMapperTest {

    private Scope scope;
    private ExpressionDimensionsMapper mapper;

    @BeforeEach
    void setUp() {
        scope = new Scope();
        scope.define("n", SymbolAttributes.of(BasicType.INTEGER));
        scope.define("x", SymbolAttributes.of(BasicType.REAL));
        scope.define("field", SymbolAttributes.of(BasicType.REAL)
                .withShape(List.of(new IntLiteral(10), new IntLiteral(20))));
        scope.define("vec", SymbolAttributes.of(BasicType.REAL)
                .withShape(List.of(new RangeIndex(new IntLiteral(1), new Scalar("n", scope), null))));
        mapper = new ExpressionDimensionsMapper();
    }

    @Test
    void scalarHasUnitShape() {
        assertTrue(ExpressionDimensionsMapper.isScalarShape(mapper.map(new Scalar("x", scope))));
        assertTrue(ExpressionDimensionsMapper.isScalarShape(mapper.map(new StringLiteral("abc"))));
    }

    @Test
    void wholeArrayHasDeclaredShape() {
        List<Expression> shape = mapper.map(new Array("field", scope, null));

        assertEquals(2, shape.size());
        assertEquals(10, ((IntLiteral) shape.get(0)).getValue());
        assertEquals(20, ((IntLiteral) shape.get(1)).getValue());
    }

    @Test
    void rangeStartingAtOneHasItsUpperBoundAsExtent() {
        List<Expression> shape = mapper.map(new Array("vec", scope, null));

        assertEquals(1, shape.size());
        assertEquals("n", ((Scalar) shape.get(0)).getName());
    }

    @Test
    void sectionKeepsOnlyRangeDimensions() {
        ArraySubscript sub = new ArraySubscript(List.of(
                new RangeIndex(null, null, null),
                new IntLiteral(3)));

        List<Expression> shape = mapper.map(new Array("field", scope, sub));

        assertEquals(1, shape.size(), "Element index drops its dimension");
        assertEquals(10, ((IntLiteral) shape.get(0)).getValue(), "Open range takes the declared extent");
    }

    @Test
    void literalBoundsAreFolded() {
        Expression extent = ExpressionDimensionsMapper.extent(new RangeIndex(new IntLiteral(2), new IntLiteral(5), null));

        assertEquals(4, ((IntLiteral) extent).getValue());
    }

    @Test
    void compositeTakesFirstNonScalarOperand() {
        Expression expr = ExpressionFactory.createOperation("*",
                List.of(new Scalar("x", scope), new Array("field", scope, null)));

        assertEquals(2, mapper.map(expr).size());
    }

    @Test
    void literalListHasItsLength() {
        LiteralList list = new LiteralList(List.of(new IntLiteral(1), new IntLiteral(2), new IntLiteral(3)));

        assertEquals(3, ((IntLiteral) mapper.map(list).get(0)).getValue());
    }
}
