package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.expression.Array;
import me.christianrobert.ftranspile.expression.ArraySubscript;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.IntLiteral;
import me.christianrobert.ftranspile.expression.IntrinsicLiteral;
import me.christianrobert.ftranspile.expression.TypedSymbol;
import me.christianrobert.ftranspile.ir.Declaration;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.scope.BasicType;
import me.christianrobert.ftranspile.scope.DerivedType;
import me.christianrobert.ftranspile.scope.ProcedureType;
import me.christianrobert.ftranspile.scope.Scope;
import me.christianrobert.ftranspile.scope.SymbolAttributes;
import me.christianrobert.ftranspile.scope.TypeTag;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for lowering type declaration statements.
 *
 * <p>One statement yields one {@link Declaration} node and defines one symbol per entity
 * in the current scope.</p>
 *
 * <h3>Attribute mapping:</h3>
 * <ul>
 *   <li>{@code DIMENSION(...)} applies to every entity without its own shape and is kept on
 *       the node as the declaration's dimensions</li>
 *   <li>{@code name(...)} gives that entity its own shape</li>
 *   <li>{@code EXTERNAL} makes every entity a function-typed procedure</li>
 *   <li>{@code TYPE(t)} reuses the derived type visible as {@code t} when there is one</li>
 *   <li>{@code = expr} and {@code => expr} become the symbol's initial value</li>
 * </ul>
 */
public class VisitTypeDeclarationStmt {

    public static List<Node> v(FortranParser.TypeDeclarationStmtContext ctx, IrBuilder b) {
        Scope scope = b.scope();

        // STEP 1: base type
        SymbolAttributes.Builder base = typeAttributes(ctx.typeSpec(), b);

        // STEP 2: attributes shared by all entities
        List<Expression> dimensions = null;
        boolean external = false;
        for (FortranParser.AttrSpecContext attr : ctx.attrSpec()) {
            if (attr.PARAMETER() != null) {
                base.parameter(true);
            } else if (attr.ALLOCATABLE() != null) {
                base.allocatable(true);
            } else if (attr.POINTER() != null) {
                base.pointer(true);
            } else if (attr.TARGET() != null) {
                base.target(true);
            } else if (attr.OPTIONAL() != null) {
                base.optional(true);
            } else if (attr.CONTIGUOUS() != null) {
                base.contiguous(true);
            } else if (attr.EXTERNAL() != null) {
                external = true;
                base.external(true);
            } else if (attr.INTENT() != null) {
                base.intent(intent(attr.intentSpec()));
            } else if (attr.DIMENSION() != null) {
                dimensions = shape(attr.arraySpec(), b);
            }
        }

        // STEP 3: one symbol per entity
        List<TypedSymbol> variables = new ArrayList<>();
        for (FortranParser.EntityDeclContext entity : ctx.entityDecl()) {
            String name = IrBuilder.name(entity.name());
            List<Expression> shape = entity.arraySpec() != null ? shape(entity.arraySpec(), b) : dimensions;
            Expression initial = b.expr(entity.expr());

            SymbolAttributes attrs = base.build().toBuilder().shape(shape).initial(initial).build();
            if (external) {
                attrs = attrs.withDtype(new ProcedureType(name, attrs.getDtype()));
            }
            scope.define(name, attrs);

            if (entity.arraySpec() != null) {
                variables.add(new Array(name, scope, new ArraySubscript(shape)));
            } else {
                variables.add(VisitDesignator.declared(name, scope));
            }
        }

        return List.of(new Declaration(variables, dimensions, external, b.text().inlineComment(ctx),
                b.text().source(ctx), b.text().label(ctx)));
    }

    /**
     * Attributes implied by a type specification alone.
     */
    static SymbolAttributes.Builder typeAttributes(FortranParser.TypeSpecContext ctx, IrBuilder b) {
        SymbolAttributes.Builder attrs = SymbolAttributes.builder();

        FortranParser.IntrinsicTypeSpecContext intrinsic = ctx.intrinsicTypeSpec();
        if (intrinsic == null) {
            String typeName = ctx.name() != null ? IrBuilder.name(ctx.name()) : "*";
            SymbolAttributes visible = b.scope().lookup(typeName);
            if (visible != null && visible.getTag() == TypeTag.DERIVED) {
                return attrs.dtype(visible.getDtype());
            }
            return attrs.dtype(new DerivedType(typeName, null));
        }

        if (intrinsic.DOUBLE() != null) {
            return attrs.dtype(BasicType.REAL).kind(new IntLiteral(8));
        }
        attrs.dtype(BasicType.fromString(intrinsic.getChild(0).getText()));

        FortranParser.KindSelectorContext kind = intrinsic.kindSelector();
        if (kind != null) {
            attrs.kind(kind.expr() != null
                    ? b.expr(kind.expr())
                    : new IntLiteral(Long.parseLong(kind.INT_LITERAL().getText())));
        }

        FortranParser.CharSelectorContext chars = intrinsic.charSelector();
        if (chars != null) {
            if (chars.INT_LITERAL() != null) {
                attrs.length(new IntLiteral(Long.parseLong(chars.INT_LITERAL().getText())));
            } else if (chars.typeParam().isEmpty()) {
                attrs.length(new IntrinsicLiteral("*"));
            } else {
                for (int i = 0; i < chars.typeParam().size(); i++) {
                    FortranParser.TypeParamContext param = chars.typeParam(i);
                    String keyword = param.name() != null ? IrBuilder.name(param.name()) : (i == 0 ? "len" : "kind");
                    Expression value = typeParam(param, b);
                    if (keyword.equals("kind")) {
                        attrs.kind(value);
                    } else {
                        attrs.length(value);
                    }
                }
            }
        }
        return attrs;
    }

    private static Expression typeParam(FortranParser.TypeParamContext param, IrBuilder b) {
        if (param.expr() != null) {
            return b.expr(param.expr());
        }
        return new IntrinsicLiteral(param.STAR() != null ? "*" : ":");
    }

    static List<Expression> shape(FortranParser.ArraySpecContext ctx, IrBuilder b) {
        List<Expression> shape = new ArrayList<>();
        for (FortranParser.ShapeSpecContext spec : ctx.shapeSpec()) {
            shape.add(VisitDesignator.shape(spec, b.expressions()));
        }
        return shape;
    }

    private static String intent(FortranParser.IntentSpecContext ctx) {
        if (ctx.INOUT() != null || (ctx.IN() != null && ctx.OUT() != null)) {
            return "inout";
        }
        return ctx.IN() != null ? "in" : "out";
    }
}
