package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.ir.Allocation;
import me.christianrobert.ftranspile.ir.Deallocation;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.Nullify;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for ALLOCATE, DEALLOCATE and NULLIFY.
 *
 * <p>{@code SOURCE=} and {@code MOLD=} become the allocation's data source. Status options
 * ({@code STAT=}, {@code ERRMSG=}) have no IR counterpart and go through the unsupported
 * construct policy.</p>
 */
public class VisitAllocateStmt {

    public static List<Node> allocate(FortranParser.AllocateStmtContext ctx, IrBuilder b) {
        List<Expression> variables = new ArrayList<>();
        Expression dataSource = null;
        for (FortranParser.AllocateItemContext item : ctx.allocateItem()) {
            if (item.designator() != null) {
                variables.add(b.expressions().visit(item.designator()));
                continue;
            }
            String option = IrBuilder.name(item.name());
            if (option.equals("source") || option.equals("mold")) {
                dataSource = b.expr(item.expr());
            } else {
                b.warnOrFail("ALLOCATE option " + option + " is dropped", ctx);
            }
        }
        return List.of(new Allocation(variables, dataSource, b.text().source(ctx), b.text().label(ctx)));
    }

    public static List<Node> deallocate(FortranParser.DeallocateStmtContext ctx, IrBuilder b) {
        List<Expression> variables = new ArrayList<>();
        for (FortranParser.AllocateItemContext item : ctx.allocateItem()) {
            if (item.designator() != null) {
                variables.add(b.expressions().visit(item.designator()));
            } else {
                b.warnOrFail("DEALLOCATE option " + IrBuilder.name(item.name()) + " is dropped", ctx);
            }
        }
        return List.of(new Deallocation(variables, b.text().source(ctx), b.text().label(ctx)));
    }

    public static List<Node> nullify(FortranParser.NullifyStmtContext ctx, IrBuilder b) {
        List<Expression> variables = new ArrayList<>();
        for (FortranParser.DesignatorContext designator : ctx.designator()) {
            variables.add(b.expressions().visit(designator));
        }
        return List.of(new Nullify(variables, b.text().source(ctx), b.text().label(ctx)));
    }
}
