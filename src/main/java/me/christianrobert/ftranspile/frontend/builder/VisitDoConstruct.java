package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.expression.LoopRange;
import me.christianrobert.ftranspile.expression.Scalar;
import me.christianrobert.ftranspile.frontend.context.StructuralViolationException;
import me.christianrobert.ftranspile.ir.Loop;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.WhileLoop;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.List;

/**
 * Static helper for lowering DO constructs.
 *
 * <h3>Forms:</h3>
 * <pre>
 * DO i = a, b[, s] ... END DO      Loop
 * DO WHILE (c) ... END DO          WhileLoop
 * DO ... END DO                    WhileLoop without condition
 * DO 10 i = a, b ... 10 CONTINUE   Loop with loop label "10"
 * </pre>
 *
 * <p>A labelled DO must be closed by a statement carrying the same label, and a CONTINUE
 * may only close a labelled DO.</p>
 */
public class VisitDoConstruct {

    public static List<Node> v(FortranParser.DoConstructContext ctx, IrBuilder b) {
        ConstructLayout layout = ConstructLayout.of(ctx, FortranParser.DoStmtContext.class,
                List.of(FortranParser.EndDoStmtContext.class, FortranParser.ContinueStmtContext.class),
                List.of(), b.text());

        FortranParser.DoStmtContext stmt = (FortranParser.DoStmtContext) layout.getFirst().getMarker();
        String loopLabel = stmt.doLabel != null ? stmt.doLabel.getText() : null;

        // STEP 1: the closing statement must match the DO label
        checkClosingLabel(ctx, loopLabel, layout.getEnd(), b);

        // STEP 2: body
        List<Node> body = b.items(layout.getFirst().getItems());

        // STEP 3: loop control
        String name = IrBuilder.name(stmt.name());
        FortranParser.LoopControlContext control = stmt.loopControl();
        if (control == null) {
            return List.of(new WhileLoop(null, body, name, loopLabel, b.text().source(ctx), b.text().label(stmt)));
        }
        if (control.WHILE() != null) {
            return List.of(new WhileLoop(b.expr(control.expr(0)), body, name, loopLabel,
                    b.text().source(ctx), b.text().label(stmt)));
        }

        Scalar variable = new Scalar(IrBuilder.name(control.name()), b.scope());
        LoopRange bounds = new LoopRange(b.expr(control.expr(0)), b.expr(control.expr(1)),
                control.expr().size() > 2 ? b.expr(control.expr(2)) : null);
        return List.of(new Loop(variable, bounds, body, name, loopLabel, b.text().source(ctx), b.text().label(stmt)));
    }

    private static void checkClosingLabel(FortranParser.DoConstructContext ctx, String loopLabel,
                                          ParserRuleContext end, IrBuilder b) {
        String endLabel = b.text().label(end);
        if (loopLabel == null) {
            if (end instanceof FortranParser.ContinueStmtContext) {
                throw new StructuralViolationException("CONTINUE closes a DO without a loop label",
                        "doConstruct", b.text().source(ctx));
            }
            return;
        }
        if (!loopLabel.equals(endLabel)) {
            throw new StructuralViolationException("DO " + loopLabel + " is closed by a statement labelled "
                    + endLabel, "doConstruct", b.text().source(ctx));
        }
    }
}
