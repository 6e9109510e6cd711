package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.TypeDef;
import me.christianrobert.ftranspile.scope.DerivedType;
import me.christianrobert.ftranspile.scope.Scope;
import me.christianrobert.ftranspile.scope.SymbolAttributes;

import java.util.List;

/**
 * Static helper for lowering derived type definitions.
 *
 * <p>Components are declared in a child scope owned by the resulting {@link TypeDef}; the
 * type name is then defined in the enclosing scope as a {@link DerivedType} pointing back at
 * that definition, which is how component references find their types.</p>
 */
public class VisitDerivedTypeDef {

    public static List<Node> v(FortranParser.DerivedTypeDefContext ctx, IrBuilder b) {
        FortranParser.DerivedTypeStmtContext stmt = ctx.derivedTypeStmt();
        String name = IrBuilder.name(stmt.name());

        String extendsType = null;
        boolean bindC = false;
        for (FortranParser.TypeAttrSpecContext attr : stmt.typeAttrSpec()) {
            if (attr.EXTENDS() != null) {
                extendsType = IrBuilder.name(attr.name());
            } else if (attr.BIND() != null) {
                bindC = true;
            }
        }

        Scope scope = Scope.childOf(b.scope());
        List<Node> body;
        b.push(scope);
        try {
            body = b.items(ctx.typeBodyItem());
        } finally {
            b.pop();
        }

        TypeDef typedef = new TypeDef(name, body, scope, extendsType, bindC, b.text().source(ctx), b.text().label(stmt));
        b.scope().define(name, SymbolAttributes.of(new DerivedType(name, typedef)));
        return List.of(typedef);
    }
}
