package me.christianrobert.ftranspile.expression;

import me.christianrobert.ftranspile.scope.SymbolAttributes;

import java.util.ArrayList;
import java.util.List;

/**
 * Infers the shape of an expression from the shapes of its operands.
 *
 * <ul>
 *   <li>scalars and literals have shape {@code (1)}</li>
 *   <li>an unsubscripted array has its declared shape</li>
 *   <li>a subscripted array keeps one extent per range index; element indices drop the dimension</li>
 *   <li>composite expressions take the shape of their first non-scalar operand</li>
 * </ul>
 *
 * <p>Used when an associate name is bound to a selector expression.</p>
 */
public class ExpressionDimensionsMapper implements ExpressionVisitor<List<Expression>, Void> {

    private static List<Expression> scalarShape() {
        return List.of(new IntLiteral(1));
    }

    /**
     * Shape of {@code expr}; never null.
     */
    public List<Expression> map(Expression expr) {
        return expr.accept(this, null);
    }

    /**
     * True if the shape is the scalar shape {@code (1)}.
     */
    public static boolean isScalarShape(List<Expression> shape) {
        return shape.size() == 1
                && shape.get(0) instanceof IntLiteral
                && ((IntLiteral) shape.get(0)).getValue() == 1;
    }

    /**
     * Number of elements along one dimension spec ({@code n}, {@code 1:n}, {@code lo:hi}).
     */
    public static Expression extent(Expression dim) {
        if (!(dim instanceof RangeIndex)) {
            return dim;
        }
        RangeIndex range = (RangeIndex) dim;
        Expression lower = range.getLower();
        Expression upper = range.getUpper();
        if (upper == null) {
            return null;
        }
        if (lower == null || (lower instanceof IntLiteral && ((IntLiteral) lower).getValue() == 1)) {
            return upper;
        }
        if (lower instanceof IntLiteral && upper instanceof IntLiteral) {
            return new IntLiteral(((IntLiteral) upper).getValue() - ((IntLiteral) lower).getValue() + 1);
        }
        return ExpressionFactory.createOperation("+", List.of(
                ExpressionFactory.createOperation("-", List.of(upper, lower)),
                new IntLiteral(1)));
    }

    private List<Expression> declaredShape(TypedSymbol symbol) {
        SymbolAttributes attrs = symbol.getType();
        if (!attrs.isArray()) {
            return scalarShape();
        }
        List<Expression> shape = new ArrayList<>();
        for (Expression dim : attrs.getShape()) {
            Expression ext = extent(dim);
            shape.add(ext != null ? ext : dim);
        }
        return shape;
    }

    private List<Expression> firstNonScalar(List<Expression> operands) {
        for (Expression operand : operands) {
            List<Expression> shape = map(operand);
            if (!isScalarShape(shape)) {
                return shape;
            }
        }
        return scalarShape();
    }

    @Override
    public List<Expression> visitScalar(Scalar expr, Void arg) {
        return declaredShape(expr);
    }

    @Override
    public List<Expression> visitArray(Array expr, Void arg) {
        if (expr.getDimensions() == null) {
            return declaredShape(expr);
        }
        List<Expression> declared = expr.getType().getShape();
        List<Expression> index = expr.getDimensions().getIndex();
        List<Expression> shape = new ArrayList<>();
        for (int i = 0; i < index.size(); i++) {
            Expression idx = index.get(i);
            if (!(idx instanceof RangeIndex)) {
                continue;
            }
            Expression ext = extent(idx);
            if (ext == null && declared != null && i < declared.size()) {
                ext = extent(declared.get(i));
            }
            shape.add(ext != null ? ext : idx);
        }
        return shape.isEmpty() ? scalarShape() : shape;
    }

    @Override
    public List<Expression> visitArraySubscript(ArraySubscript expr, Void arg) {
        return scalarShape();
    }

    @Override
    public List<Expression> visitRangeIndex(RangeIndex expr, Void arg) {
        Expression ext = extent(expr);
        return ext != null ? List.of(ext) : scalarShape();
    }

    @Override
    public List<Expression> visitLoopRange(LoopRange expr, Void arg) {
        return visitRangeIndex(expr, arg);
    }

    @Override
    public List<Expression> visitIntLiteral(IntLiteral expr, Void arg) {
        return scalarShape();
    }

    @Override
    public List<Expression> visitFloatLiteral(FloatLiteral expr, Void arg) {
        return scalarShape();
    }

    @Override
    public List<Expression> visitLogicLiteral(LogicLiteral expr, Void arg) {
        return scalarShape();
    }

    @Override
    public List<Expression> visitStringLiteral(StringLiteral expr, Void arg) {
        return scalarShape();
    }

    @Override
    public List<Expression> visitIntrinsicLiteral(IntrinsicLiteral expr, Void arg) {
        return scalarShape();
    }

    @Override
    public List<Expression> visitLiteralList(LiteralList expr, Void arg) {
        return List.of(new IntLiteral(expr.getElements().size()));
    }

    @Override
    public List<Expression> visitSum(Sum expr, Void arg) {
        return firstNonScalar(expr.getChildren());
    }

    @Override
    public List<Expression> visitProduct(Product expr, Void arg) {
        return firstNonScalar(expr.getChildren());
    }

    @Override
    public List<Expression> visitQuotient(Quotient expr, Void arg) {
        return firstNonScalar(expr.getChildren());
    }

    @Override
    public List<Expression> visitPower(Power expr, Void arg) {
        return firstNonScalar(expr.getChildren());
    }

    @Override
    public List<Expression> visitComparison(Comparison expr, Void arg) {
        return firstNonScalar(expr.getChildren());
    }

    @Override
    public List<Expression> visitLogicalAnd(LogicalAnd expr, Void arg) {
        return firstNonScalar(expr.getChildren());
    }

    @Override
    public List<Expression> visitLogicalOr(LogicalOr expr, Void arg) {
        return firstNonScalar(expr.getChildren());
    }

    @Override
    public List<Expression> visitLogicalNot(LogicalNot expr, Void arg) {
        return map(expr.getChild());
    }

    @Override
    public List<Expression> visitStringConcat(StringConcat expr, Void arg) {
        return scalarShape();
    }

    @Override
    public List<Expression> visitCast(Cast expr, Void arg) {
        return map(expr.getExpression());
    }

    @Override
    public List<Expression> visitInlineCall(InlineCall expr, Void arg) {
        // elemental intrinsics keep the shape of their arguments, anything else is unknown
        return firstNonScalar(expr.getParameters());
    }

    @Override
    public List<Expression> visitParenthesisedAdd(ParenthesisedAdd expr, Void arg) {
        return visitSum(expr, arg);
    }

    @Override
    public List<Expression> visitParenthesisedMul(ParenthesisedMul expr, Void arg) {
        return visitProduct(expr, arg);
    }

    @Override
    public List<Expression> visitParenthesisedDiv(ParenthesisedDiv expr, Void arg) {
        return visitQuotient(expr, arg);
    }

    @Override
    public List<Expression> visitParenthesisedPow(ParenthesisedPow expr, Void arg) {
        return visitPower(expr, arg);
    }

    @Override
    public List<Expression> visitParenthesisedExpression(ParenthesisedExpression expr, Void arg) {
        return map(expr.getChild());
    }
}
