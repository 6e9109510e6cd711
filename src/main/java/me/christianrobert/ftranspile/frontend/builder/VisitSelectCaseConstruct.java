package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.RangeIndex;
import me.christianrobert.ftranspile.ir.MultiConditional;
import me.christianrobert.ftranspile.ir.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for lowering SELECT CASE constructs.
 *
 * <h3>Mapping:</h3>
 * <pre>
 * SELECT CASE (expr)
 * CASE (1, 3:5)     values [1, RangeIndex(3, 5)] and their body
 * CASE DEFAULT      else body
 * END SELECT
 * </pre>
 * <p>Comment lines between SELECT CASE and the first CASE are emitted before the node.</p>
 */
public class VisitSelectCaseConstruct {

    public static List<Node> v(FortranParser.SelectCaseConstructContext ctx, IrBuilder b) {
        ConstructLayout layout = ConstructLayout.of(ctx, FortranParser.SelectCaseStmtContext.class,
                List.of(FortranParser.EndSelectStmtContext.class),
                List.of(FortranParser.CaseStmtContext.class), b.text());

        FortranParser.SelectCaseStmtContext stmt = (FortranParser.SelectCaseStmtContext) layout.getFirst().getMarker();
        List<Node> result = new ArrayList<>(b.items(layout.getFirst().getItems()));

        List<List<Expression>> values = new ArrayList<>();
        List<List<Node>> bodies = new ArrayList<>();
        List<Node> elseBody = new ArrayList<>();

        List<ConstructLayout.Branch> branches = layout.getBranches();
        for (ConstructLayout.Branch branch : branches.subList(1, branches.size())) {
            FortranParser.CaseStmtContext caseStmt = (FortranParser.CaseStmtContext) branch.getMarker();
            List<Node> body = b.items(branch.getItems());
            if (caseStmt.DEFAULT() != null) {
                elseBody = body;
                continue;
            }
            List<Expression> caseValues = new ArrayList<>();
            for (FortranParser.CaseValueRangeContext range : caseStmt.caseValueRange()) {
                caseValues.add(value(range, b));
            }
            values.add(caseValues);
            bodies.add(body);
        }

        result.add(new MultiConditional(b.expr(stmt.expr()), values, bodies, elseBody,
                IrBuilder.name(stmt.name()), b.text().source(ctx), b.text().label(stmt)));
        return result;
    }

    private static Expression value(FortranParser.CaseValueRangeContext range, IrBuilder b) {
        if (range.COLON() == null) {
            return b.expr(range.expr(0));
        }
        return new RangeIndex(b.expr(range.lower), b.expr(range.upper), null);
    }
}
