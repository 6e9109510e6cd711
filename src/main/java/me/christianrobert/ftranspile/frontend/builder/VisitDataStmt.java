package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.ExpressionFactory;
import me.christianrobert.ftranspile.expression.IntrinsicLiteral;
import me.christianrobert.ftranspile.expression.Scalar;
import me.christianrobert.ftranspile.ir.DataDeclaration;
import me.christianrobert.ftranspile.ir.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for lowering {@code DATA} statements.
 *
 * <p>Each {@code vars / values /} set becomes its own {@link DataDeclaration}. Repeated values
 * ({@code 3*0.0}) are kept verbatim since they have no expression form; signed values become
 * regular expressions.</p>
 */
public class VisitDataStmt {

    public static List<Node> v(FortranParser.DataStmtContext ctx, IrBuilder b) {
        List<Node> result = new ArrayList<>();
        String label = b.text().label(ctx);
        for (FortranParser.DataSetContext set : ctx.dataSet()) {
            List<Expression> variables = new ArrayList<>();
            for (FortranParser.DesignatorContext designator : set.designator()) {
                variables.add(b.expressions().visit(designator));
            }
            List<Expression> values = new ArrayList<>();
            for (FortranParser.DataValueContext value : set.dataValue()) {
                values.add(value(value, b));
            }
            result.add(new DataDeclaration(variables, values, b.text().source(ctx), label));
            label = null;
        }
        return result;
    }

    private static Expression value(FortranParser.DataValueContext ctx, IrBuilder b) {
        if (ctx.repeat != null) {
            return new IntrinsicLiteral(b.text().text(ctx).replaceAll("\\s+", ""));
        }
        FortranParser.DataConstantContext constant = ctx.dataConstant();
        Expression value = constant.literalConstant() != null
                ? b.expressions().visit(constant.literalConstant())
                : new Scalar(IrBuilder.name(constant.name()), b.scope());
        if (ctx.MINUS() != null) {
            return ExpressionFactory.createOperation("-", List.of(value));
        }
        return value;
    }
}
