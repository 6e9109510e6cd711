package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.ir.Assignment;
import me.christianrobert.ftranspile.ir.CallStatement;
import me.christianrobert.ftranspile.ir.Node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Static helper for assignments, pointer assignments and CALL statements.
 *
 * <p>All three keep a trailing {@code ! comment} of their line.</p>
 */
public class VisitAssignment {

    public static List<Node> v(FortranParser.AssignmentStmtContext ctx, IrBuilder b) {
        Expression lhs = b.expressions().visit(ctx.designator());
        Expression rhs = b.expr(ctx.expr());
        return List.of(new Assignment(lhs, rhs, false, b.text().inlineComment(ctx),
                b.text().source(ctx), b.text().label(ctx)));
    }

    public static List<Node> pointer(FortranParser.PointerAssignmentStmtContext ctx, IrBuilder b) {
        Expression lhs = b.expressions().visit(ctx.designator());
        Expression rhs = b.expr(ctx.expr());
        return List.of(new Assignment(lhs, rhs, true, b.text().inlineComment(ctx),
                b.text().source(ctx), b.text().label(ctx)));
    }

    public static List<Node> call(FortranParser.CallStmtContext ctx, IrBuilder b) {
        // type-bound calls keep the full obj%proc name
        String name = ctx.name().stream().map(IrBuilder::name).collect(Collectors.joining("%"));

        List<Expression> arguments = new ArrayList<>();
        Map<String, Expression> kwArguments = new LinkedHashMap<>();
        VisitDesignator.arguments(ctx.actualArgList(), arguments, kwArguments, b.expressions());

        return List.of(new CallStatement(name, arguments, kwArguments, b.text().inlineComment(ctx),
                b.text().source(ctx), b.text().label(ctx)));
    }
}
