package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.antlr.FortranParserBaseVisitor;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.ExpressionFactory;
import me.christianrobert.ftranspile.expression.IntrinsicLiteral;
import me.christianrobert.ftranspile.expression.LiteralList;
import me.christianrobert.ftranspile.frontend.context.FrontendConfig;
import me.christianrobert.ftranspile.frontend.context.UnsupportedConstructException;
import me.christianrobert.ftranspile.scope.Scope;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.RuleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Lowers expression parse trees into the expression algebra.
 *
 * <p>Operators are routed through {@link ExpressionFactory#createOperation} so that sums and
 * products come out flattened and subtraction comes out as addition of a negation. Names are
 * resolved against the scope returned by the scope supplier at the time the expression is
 * visited, so the enclosing lowering pass controls which scope applies.</p>
 */
public class ExpressionBuilder extends FortranParserBaseVisitor<Expression> {

    private static final Logger log = LoggerFactory.getLogger(ExpressionBuilder.class);

    private final Supplier<Scope> scope;
    private final SourceText text;
    private final FrontendConfig config;

    public ExpressionBuilder(Supplier<Scope> scope, SourceText text, FrontendConfig config) {
        this.scope = scope;
        this.text = text;
        this.config = config;
    }

    Scope currentScope() {
        return scope.get();
    }

    SourceText getText() {
        return text;
    }

    FrontendConfig getConfig() {
        return config;
    }

    /**
     * Lowers a list of expressions, preserving order.
     */
    public List<Expression> visitAll(List<FortranParser.ExprContext> ctxs) {
        List<Expression> result = new ArrayList<>();
        for (FortranParser.ExprContext ctx : ctxs) {
            result.add(visit(ctx));
        }
        return result;
    }

    // ========== Entry points ==========

    @Override
    public Expression visitSingleExpression(FortranParser.SingleExpressionContext ctx) {
        return visit(ctx.expr());
    }

    // ========== Operators ==========

    @Override
    public Expression visitPrimaryExpr(FortranParser.PrimaryExprContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public Expression visitPowerExpr(FortranParser.PowerExprContext ctx) {
        return binary("**", ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expression visitMultExpr(FortranParser.MultExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expression visitUnaryExpr(FortranParser.UnaryExprContext ctx) {
        Expression operand = visit(ctx.expr());
        if (ctx.op.getType() == FortranParser.PLUS) {
            return operand;
        }
        return ExpressionFactory.createOperation("-", List.of(operand));
    }

    @Override
    public Expression visitAddExpr(FortranParser.AddExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expression visitConcatExpr(FortranParser.ConcatExprContext ctx) {
        return binary("//", ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expression visitRelExpr(FortranParser.RelExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expression visitNotExpr(FortranParser.NotExprContext ctx) {
        return ExpressionFactory.createOperation(".not.", List.of(visit(ctx.expr())));
    }

    @Override
    public Expression visitAndExpr(FortranParser.AndExprContext ctx) {
        return binary(".and.", ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expression visitOrExpr(FortranParser.OrExprContext ctx) {
        return binary(".or.", ctx.expr(0), ctx.expr(1));
    }

    @Override
    public Expression visitEqvExpr(FortranParser.EqvExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expr(0), ctx.expr(1));
    }

    private Expression binary(String op, FortranParser.ExprContext left, FortranParser.ExprContext right) {
        return ExpressionFactory.createOperation(op, List.of(visit(left), visit(right)));
    }

    // ========== Primaries ==========

    @Override
    public Expression visitLiteralPrimary(FortranParser.LiteralPrimaryContext ctx) {
        return visit(ctx.literalConstant());
    }

    @Override
    public Expression visitLiteralConstant(FortranParser.LiteralConstantContext ctx) {
        return VisitLiteralConstant.v(ctx);
    }

    @Override
    public Expression visitArrayConstructorPrimary(FortranParser.ArrayConstructorPrimaryContext ctx) {
        return visit(ctx.arrayConstructor());
    }

    @Override
    public Expression visitArrayConstructor(FortranParser.ArrayConstructorContext ctx) {
        return new LiteralList(visitAll(ctx.expr()));
    }

    @Override
    public Expression visitConversionPrimary(FortranParser.ConversionPrimaryContext ctx) {
        return visit(ctx.typeConversion());
    }

    @Override
    public Expression visitTypeConversion(FortranParser.TypeConversionContext ctx) {
        return VisitDesignator.conversion(ctx, this);
    }

    @Override
    public Expression visitDesignatorPrimary(FortranParser.DesignatorPrimaryContext ctx) {
        return visit(ctx.designator());
    }

    @Override
    public Expression visitDesignator(FortranParser.DesignatorContext ctx) {
        return VisitDesignator.v(ctx, this);
    }

    @Override
    public Expression visitComplexPrimary(FortranParser.ComplexPrimaryContext ctx) {
        // (re, im) complex constants have no dedicated node
        return new IntrinsicLiteral(text.text(ctx));
    }

    @Override
    public Expression visitParenthesisPrimary(FortranParser.ParenthesisPrimaryContext ctx) {
        return ExpressionFactory.parenthesise(visit(ctx.expr()));
    }

    // ========== Fallback ==========

    /**
     * Any rule without an explicit override ends up here.
     */
    @Override
    public Expression visitChildren(RuleNode node) {
        ParserRuleContext ctx = (ParserRuleContext) node;
        String construct = ConstructLayout.constructName(ctx);
        if (config.isStrictMode()) {
            log.error("No expression lowering for {} (line {})", construct, ctx.start.getLine());
            throw new UnsupportedConstructException("No expression lowering for " + construct,
                    construct, text.source(ctx));
        }
        log.warn("No expression lowering for {} (line {}), kept verbatim", construct, ctx.start.getLine());
        return new IntrinsicLiteral(text.text(ctx));
    }
}
