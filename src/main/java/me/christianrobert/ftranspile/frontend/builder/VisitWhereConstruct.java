package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.ir.MaskedStatement;
import me.christianrobert.ftranspile.ir.Node;

import java.util.List;

/**
 * Static helper for lowering WHERE constructs and WHERE statements into masked statements.
 */
public class VisitWhereConstruct {

    public static List<Node> v(FortranParser.WhereConstructContext ctx, IrBuilder b) {
        ConstructLayout layout = ConstructLayout.of(ctx, FortranParser.WhereConstructStmtContext.class,
                List.of(FortranParser.EndWhereStmtContext.class),
                List.of(FortranParser.ElseWhereStmtContext.class), b.text());

        FortranParser.WhereConstructStmtContext stmt =
                (FortranParser.WhereConstructStmtContext) layout.getFirst().getMarker();
        List<Node> body = b.items(layout.getFirst().getItems());
        List<Node> defaultBody = layout.getBranches().size() > 1
                ? b.items(layout.getBranches().get(1).getItems())
                : List.of();

        return List.of(new MaskedStatement(b.expr(stmt.expr()), body, defaultBody, false,
                b.text().source(ctx), b.text().label(stmt)));
    }

    public static List<Node> inline(FortranParser.WhereStmtContext ctx, IrBuilder b) {
        List<Node> body = b.visit(ctx.assignmentStmt());
        return List.of(new MaskedStatement(b.expr(ctx.expr()), body, List.of(), true,
                b.text().source(ctx), b.text().label(ctx)));
    }
}
