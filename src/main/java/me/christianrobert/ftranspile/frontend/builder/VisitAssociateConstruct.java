package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.ExpressionDimensionsMapper;
import me.christianrobert.ftranspile.expression.TypedSymbol;
import me.christianrobert.ftranspile.ir.Associate;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.scope.Scope;
import me.christianrobert.ftranspile.scope.SymbolAttributes;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for lowering ASSOCIATE constructs.
 *
 * <p>Selectors are lowered in the enclosing scope. Each associate name is then defined in a
 * child scope with the selector's type and the shape inferred by
 * {@link ExpressionDimensionsMapper}; a scalar shape leaves the name without a shape.</p>
 */
public class VisitAssociateConstruct {

    public static List<Node> v(FortranParser.AssociateConstructContext ctx, IrBuilder b) {
        ConstructLayout layout = ConstructLayout.of(ctx, FortranParser.AssociateStmtContext.class,
                List.of(FortranParser.EndAssociateStmtContext.class), List.of(), b.text());
        FortranParser.AssociateStmtContext stmt = (FortranParser.AssociateStmtContext) layout.getFirst().getMarker();

        Scope scope = Scope.childOf(b.scope());
        ExpressionDimensionsMapper dimensions = new ExpressionDimensionsMapper();
        List<Associate.Association> associations = new ArrayList<>();

        // STEP 1: selectors, in the outer scope
        for (FortranParser.AssociationContext association : stmt.association()) {
            String name = IrBuilder.name(association.name());
            Expression selector = b.expr(association.expr());

            SymbolAttributes selectorType = selector instanceof TypedSymbol
                    ? ((TypedSymbol) selector).getType()
                    : SymbolAttributes.deferred();
            List<Expression> shape = dimensions.map(selector);
            if (ExpressionDimensionsMapper.isScalarShape(shape)) {
                shape = null;
            }
            scope.define(name, SymbolAttributes.builder()
                    .dtype(selectorType.getDtype())
                    .kind(selectorType.getKind())
                    .length(selectorType.getLength())
                    .shape(shape)
                    .build());
            associations.add(new Associate.Association(VisitDesignator.declared(name, scope), selector));
        }

        // STEP 2: body, in the associate scope
        List<Node> body;
        b.push(scope);
        try {
            body = b.items(layout.getFirst().getItems());
        } finally {
            b.pop();
        }

        return List.of(new Associate(associations, body, scope, IrBuilder.name(stmt.name()),
                b.text().source(ctx), b.text().label(stmt)));
    }
}
