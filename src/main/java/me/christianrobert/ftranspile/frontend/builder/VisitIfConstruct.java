package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.ir.Conditional;
import me.christianrobert.ftranspile.ir.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for lowering IF constructs and logical IF statements.
 *
 * <h3>Fortran structure (flat in the parse tree):</h3>
 * <pre>
 * IF (c1) THEN     items
 * ELSE IF (c2) THEN items      0..n
 * ELSE             items       0..1
 * END IF
 * </pre>
 *
 * <h3>IR:</h3>
 * <pre>
 * Conditional(c1, body1, else=[Conditional(c2, body2, else=body3)], hasElseif=true)
 * </pre>
 * <p>The chain is built from the last branch backwards so each ELSE IF becomes the single
 * node of its predecessor's else body; {@code hasElseif} tells printers to fold it back
 * into an ELSE IF line.</p>
 */
public class VisitIfConstruct {

    public static List<Node> v(FortranParser.IfConstructContext ctx, IrBuilder b) {
        ConstructLayout layout = ConstructLayout.of(ctx, FortranParser.IfThenStmtContext.class,
                List.of(FortranParser.EndIfStmtContext.class),
                List.of(FortranParser.ElseIfStmtContext.class, FortranParser.ElseStmtContext.class), b.text());

        // STEP 1: split off the ELSE branch
        List<ConstructLayout.Branch> branches = new ArrayList<>(layout.getBranches());
        List<Node> elseBody = new ArrayList<>();
        ConstructLayout.Branch last = branches.get(branches.size() - 1);
        if (last.getMarker() instanceof FortranParser.ElseStmtContext) {
            elseBody = b.items(last.getItems());
            branches.remove(branches.size() - 1);
        }

        // STEP 2: build the chain backwards
        boolean elseIsElseif = false;
        Conditional conditional = null;
        for (int i = branches.size() - 1; i >= 0; i--) {
            ConstructLayout.Branch branch = branches.get(i);
            List<Node> body = b.items(branch.getItems());
            if (i == 0) {
                FortranParser.IfThenStmtContext stmt = (FortranParser.IfThenStmtContext) branch.getMarker();
                conditional = new Conditional(b.expr(stmt.expr()), body, elseBody, false, elseIsElseif,
                        IrBuilder.name(stmt.name()), b.text().source(ctx), b.text().label(stmt));
            } else {
                FortranParser.ElseIfStmtContext stmt = (FortranParser.ElseIfStmtContext) branch.getMarker();
                Expression condition = b.expr(stmt.expr());
                conditional = new Conditional(condition, body, elseBody, false, elseIsElseif,
                        null, b.text().source(stmt), b.text().label(stmt));
            }
            elseBody = List.of(conditional);
            elseIsElseif = true;
        }
        return List.of(conditional);
    }

    /**
     * {@code IF (cond) action}: a single-statement conditional printed on one line.
     */
    public static List<Node> inline(FortranParser.IfStmtContext ctx, IrBuilder b) {
        Expression condition = b.expr(ctx.expr());
        List<Node> body = b.visit(ctx.actionStmt());
        return List.of(new Conditional(condition, body, List.of(), true, false, null,
                b.text().source(ctx), b.text().label(ctx)));
    }
}
