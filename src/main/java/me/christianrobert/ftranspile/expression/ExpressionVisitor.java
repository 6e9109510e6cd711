package me.christianrobert.ftranspile.expression;

/**
 * Visitor over the closed set of expression kinds.
 *
 * @param <R> result type
 * @param <A> argument type threaded through the traversal (e.g. enclosing precedence)
 */
public interface ExpressionVisitor<R, A> {

    R visitScalar(Scalar expr, A arg);

    R visitArray(Array expr, A arg);

    R visitArraySubscript(ArraySubscript expr, A arg);

    R visitRangeIndex(RangeIndex expr, A arg);

    R visitLoopRange(LoopRange expr, A arg);

    R visitIntLiteral(IntLiteral expr, A arg);

    R visitFloatLiteral(FloatLiteral expr, A arg);

    R visitLogicLiteral(LogicLiteral expr, A arg);

    R visitStringLiteral(StringLiteral expr, A arg);

    R visitIntrinsicLiteral(IntrinsicLiteral expr, A arg);

    R visitLiteralList(LiteralList expr, A arg);

    R visitSum(Sum expr, A arg);

    R visitProduct(Product expr, A arg);

    R visitQuotient(Quotient expr, A arg);

    R visitPower(Power expr, A arg);

    R visitComparison(Comparison expr, A arg);

    R visitLogicalAnd(LogicalAnd expr, A arg);

    R visitLogicalOr(LogicalOr expr, A arg);

    R visitLogicalNot(LogicalNot expr, A arg);

    R visitStringConcat(StringConcat expr, A arg);

    R visitCast(Cast expr, A arg);

    R visitInlineCall(InlineCall expr, A arg);

    R visitParenthesisedAdd(ParenthesisedAdd expr, A arg);

    R visitParenthesisedMul(ParenthesisedMul expr, A arg);

    R visitParenthesisedDiv(ParenthesisedDiv expr, A arg);

    R visitParenthesisedPow(ParenthesisedPow expr, A arg);

    R visitParenthesisedExpression(ParenthesisedExpression expr, A arg);
}
