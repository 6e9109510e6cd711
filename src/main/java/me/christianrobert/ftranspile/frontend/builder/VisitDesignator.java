package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.expression.Array;
import me.christianrobert.ftranspile.expression.ArraySubscript;
import me.christianrobert.ftranspile.expression.Cast;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.InlineCall;
import me.christianrobert.ftranspile.expression.IntrinsicLiteral;
import me.christianrobert.ftranspile.expression.RangeIndex;
import me.christianrobert.ftranspile.expression.Scalar;
import me.christianrobert.ftranspile.expression.TypedSymbol;
import me.christianrobert.ftranspile.scope.Scope;
import me.christianrobert.ftranspile.scope.SymbolAttributes;
import me.christianrobert.ftranspile.scope.TypeTag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static helper for lowering designators ({@code a}, {@code a(i, j)}, {@code a%b(1)%c}).
 *
 * <h3>Call versus subscript:</h3>
 * <p>{@code name(args)} is syntactically both a function call and an array reference.
 * The choice is made against the current scope:</p>
 * <ul>
 *   <li>name bound to a PROCEDURE type: {@link InlineCall}</li>
 *   <li>name bound to anything else: {@link Array}</li>
 *   <li>unbound name of an intrinsic conversion ({@code int}, {@code real}, {@code dble}): {@link Cast}</li>
 *   <li>unbound name of another intrinsic, or arguments passed by keyword: {@link InlineCall}</li>
 *   <li>any other unbound name: {@link Array}</li>
 * </ul>
 *
 * <h3>Component chains:</h3>
 * <p>Each part of {@code a%b%c} becomes a symbol whose parent is the previous part and whose
 * name is the combined {@code %}-joined name so far.</p>
 */
public class VisitDesignator {

    public static Expression v(FortranParser.DesignatorContext ctx, ExpressionBuilder b) {
        Scope scope = b.currentScope();
        List<FortranParser.PartRefContext> parts = ctx.partRef();

        // STEP 1: plain name(args) needs call/subscript disambiguation
        if (parts.size() == 1 && parts.get(0).LPAREN() != null) {
            return reference(parts.get(0), scope, b);
        }

        // STEP 2: walk the component chain left to right
        Expression current = null;
        String combined = null;
        for (FortranParser.PartRefContext part : parts) {
            String name = part.name().getText().toLowerCase(Locale.ROOT);
            combined = combined == null ? name : combined + "%" + name;
            current = symbol(combined, current, scope, part, b);
        }
        return current;
    }

    private static Expression symbol(String name, Expression parent, Scope scope,
                                     FortranParser.PartRefContext part, ExpressionBuilder b) {
        if (part.LPAREN() != null) {
            return new Array(name, parent, scope, subscript(part.sectionSubscriptList(), b));
        }
        Scalar candidate = new Scalar(name, parent, scope);
        if (candidate.getType().isArray()) {
            return new Array(name, parent, scope, null);
        }
        return candidate;
    }

    private static Expression reference(FortranParser.PartRefContext part, Scope scope, ExpressionBuilder b) {
        String name = part.name().getText().toLowerCase(Locale.ROOT);
        SymbolAttributes attrs = scope != null ? scope.lookup(name) : null;
        FortranParser.SectionSubscriptListContext subs = part.sectionSubscriptList();

        if (attrs != null) {
            if (attrs.getTag() == TypeTag.PROCEDURE) {
                return call(name, subs, b);
            }
            return new Array(name, scope, subscript(subs, b));
        }

        if (IntrinsicProcedures.isCast(name)) {
            InlineCall call = call(name, subs, b);
            if (!call.getParameters().isEmpty()) {
                Expression kind = call.getParameters().size() > 1
                        ? call.getParameters().get(1)
                        : call.getKwArguments().get("kind");
                return new Cast(name, call.getParameters().get(0), kind);
            }
            return call;
        }
        if (IntrinsicProcedures.isIntrinsic(name) || hasKeywords(subs)) {
            return call(name, subs, b);
        }
        return new Array(name, scope, subscript(subs, b));
    }

    /**
     * Lowers {@code REAL(x[, kind])}, {@code LOGICAL(x[, kind])} and {@code COMPLEX(x, y)}.
     */
    public static Expression conversion(FortranParser.TypeConversionContext ctx, ExpressionBuilder b) {
        String name = ctx.kind.getText().toLowerCase(Locale.ROOT);
        List<Expression> positional = new ArrayList<>();
        Map<String, Expression> keywords = new LinkedHashMap<>();
        arguments(ctx.actualArgList(), positional, keywords, b);

        if (name.equals("complex") || positional.isEmpty()) {
            return new InlineCall(name.equals("complex") ? "cmplx" : name, positional, keywords);
        }
        Expression kind = positional.size() > 1 ? positional.get(1) : keywords.get("kind");
        return new Cast(name, positional.get(0), kind);
    }

    /**
     * Splits call arguments into positional and keyword arguments.
     */
    static void arguments(FortranParser.ActualArgListContext ctx, List<Expression> positional,
                          Map<String, Expression> keywords, ExpressionBuilder b) {
        if (ctx == null) {
            return;
        }
        for (FortranParser.ActualArgContext arg : ctx.actualArg()) {
            Expression value = b.visit(arg.expr());
            if (arg.name() != null) {
                keywords.put(arg.name().getText().toLowerCase(Locale.ROOT), value);
            } else {
                positional.add(value);
            }
        }
    }

    private static InlineCall call(String name, FortranParser.SectionSubscriptListContext subs,
                                   ExpressionBuilder b) {
        List<Expression> positional = new ArrayList<>();
        Map<String, Expression> keywords = new LinkedHashMap<>();
        if (subs != null) {
            for (FortranParser.SectionSubscriptContext sub : subs.sectionSubscript()) {
                if (sub.name() != null) {
                    keywords.put(sub.name().getText().toLowerCase(Locale.ROOT), b.visit(sub.expr(0)));
                } else {
                    positional.add(section(sub, b));
                }
            }
        }
        return new InlineCall(name, positional, keywords);
    }

    private static boolean hasKeywords(FortranParser.SectionSubscriptListContext subs) {
        if (subs == null) {
            return false;
        }
        for (FortranParser.SectionSubscriptContext sub : subs.sectionSubscript()) {
            if (sub.name() != null) {
                return true;
            }
        }
        return false;
    }

    static ArraySubscript subscript(FortranParser.SectionSubscriptListContext subs, ExpressionBuilder b) {
        List<Expression> index = new ArrayList<>();
        if (subs != null) {
            for (FortranParser.SectionSubscriptContext sub : subs.sectionSubscript()) {
                index.add(section(sub, b));
            }
        }
        return new ArraySubscript(index);
    }

    private static Expression section(FortranParser.SectionSubscriptContext sub, ExpressionBuilder b) {
        if (sub.COLON().isEmpty()) {
            return b.visit(sub.expr(0));
        }
        Expression lower = sub.lower != null ? b.visit(sub.lower) : null;
        Expression upper = sub.upper != null ? b.visit(sub.upper) : null;
        Expression step = sub.step != null ? b.visit(sub.step) : null;
        return new RangeIndex(lower, upper, step);
    }

    /**
     * Lowers one dimension of a declared shape ({@code n}, {@code lo:hi}, {@code :}, {@code *}).
     */
    static Expression shape(FortranParser.ShapeSpecContext spec, ExpressionBuilder b) {
        if (spec.COLON() == null) {
            if (spec.STAR() != null) {
                return new IntrinsicLiteral("*");
            }
            return b.visit(spec.expr(0));
        }
        Expression lower = spec.lower != null ? b.visit(spec.lower) : null;
        Expression upper = spec.upper != null ? b.visit(spec.upper)
                : spec.STAR() != null ? new IntrinsicLiteral("*") : null;
        return new RangeIndex(lower, upper, null);
    }

    /**
     * Symbol node for a declared name, typed through {@code scope}.
     */
    static TypedSymbol declared(String name, Scope scope) {
        SymbolAttributes attrs = scope.lookup(name);
        if (attrs != null && attrs.isArray()) {
            return new Array(name, scope, null);
        }
        return new Scalar(name, scope);
    }
}
