package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.Section;
import me.christianrobert.ftranspile.ir.Subroutine;
import me.christianrobert.ftranspile.scope.ProcedureType;
import me.christianrobert.ftranspile.scope.Scope;
import me.christianrobert.ftranspile.scope.SymbolAttributes;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for lowering subroutines and functions.
 *
 * <h3>Steps:</h3>
 * <ol>
 *   <li>register the unit's name as a procedure in the enclosing scope (enables recursion
 *       and calls from siblings)</li>
 *   <li>open a child scope and register contained subprograms</li>
 *   <li>for functions, define the result variable (typed by a type prefix if present)</li>
 *   <li>lower the specification part, the execution part and the contained subprograms</li>
 *   <li>define still-undeclared dummy arguments as DEFERRED</li>
 * </ol>
 */
public class VisitSubprogram {

    public static List<Node> subroutine(FortranParser.SubroutineSubprogramContext ctx, IrBuilder b) {
        FortranParser.SubroutineStmtContext stmt = ctx.subroutineStmt();
        String name = IrBuilder.name(stmt.name());
        VisitModule.checkEndName(name, ctx.endSubroutineStmt().name(), ctx, b);

        return List.of(unit(ctx, stmt, name, arguments(stmt.dummyArgList()), false, null,
                stmt.prefix(), bind(stmt.bindSpec(), b), ctx.specificationPart(), ctx.executionPart(),
                ctx.containsPart(), b));
    }

    public static List<Node> function(FortranParser.FunctionSubprogramContext ctx, IrBuilder b) {
        FortranParser.FunctionStmtContext stmt = ctx.functionStmt();
        String name = IrBuilder.name(stmt.name());
        VisitModule.checkEndName(name, ctx.endFunctionStmt().name(), ctx, b);

        FortranParser.SuffixContext suffix = stmt.suffix();
        String resultName = suffix != null && suffix.name() != null ? IrBuilder.name(suffix.name()) : name;
        String bind = suffix != null ? bind(suffix.bindSpec(), b) : null;

        return List.of(unit(ctx, stmt, name, arguments(stmt.dummyArgList()), true, resultName,
                stmt.prefix(), bind, ctx.specificationPart(), ctx.executionPart(), ctx.containsPart(), b));
    }

    /**
     * Lowers the header and specification part of an interface body. The body and member
     * lists stay empty.
     */
    static Subroutine header(ParserRuleContext ctx, ParserRuleContext stmt, String name, List<String> args,
                             boolean isFunction, String resultName, List<FortranParser.PrefixContext> prefixes,
                             String bind, FortranParser.SpecificationPartContext spec, IrBuilder b) {
        return unit(ctx, stmt, name, args, isFunction, resultName, prefixes, bind, spec, null, null, b);
    }

    private static Subroutine unit(ParserRuleContext ctx, ParserRuleContext stmt, String name, List<String> args,
                                   boolean isFunction, String resultName,
                                   List<FortranParser.PrefixContext> prefixes, String bind,
                                   FortranParser.SpecificationPartContext specCtx,
                                   FortranParser.ExecutionPartContext execCtx,
                                   FortranParser.ContainsPartContext containsCtx, IrBuilder b) {
        // STEP 1: visible to the enclosing scope
        b.scope().define(name, SymbolAttributes.of(new ProcedureType(name, isFunction)));

        Scope scope = Scope.childOf(b.scope());
        List<String> prefix = new ArrayList<>();
        List<Node> spec;
        List<Node> body;
        List<Node> members;

        b.push(scope);
        try {
            // STEP 2: contained subprograms
            VisitModule.registerContained(containsCtx, scope);

            // STEP 3: prefixes, and the result variable of functions
            SymbolAttributes resultType = null;
            for (FortranParser.PrefixContext p : prefixes) {
                if (p.typeSpec() != null) {
                    resultType = VisitTypeDeclarationStmt.typeAttributes(p.typeSpec(), b).build();
                }
                prefix.add(b.text().text(p));
            }
            if (isFunction) {
                scope.define(resultName, resultType != null ? resultType : SymbolAttributes.deferred());
            }

            // STEP 4: specification, execution and contained parts
            spec = b.visit(specCtx);
            body = execCtx != null ? b.visit(execCtx) : List.of();
            members = containsCtx != null ? b.visit(containsCtx) : List.of();

            // STEP 5: implicitly typed dummy arguments
            for (String arg : args) {
                if (!scope.isDefinedLocally(arg)) {
                    scope.define(arg, SymbolAttributes.deferred());
                }
            }
        } finally {
            b.pop();
        }

        return new Subroutine(name, args, new Section(spec), body, members, scope, isFunction,
                isFunction ? resultName : null, prefix, bind, b.text().source(ctx), b.text().label(stmt));
    }

    static List<String> arguments(FortranParser.DummyArgListContext ctx) {
        List<String> args = new ArrayList<>();
        if (ctx != null) {
            for (FortranParser.NameContext n : ctx.name()) {
                args.add(IrBuilder.name(n));
            }
        }
        return args;
    }

    static String bind(FortranParser.BindSpecContext ctx, IrBuilder b) {
        return ctx != null ? b.text().text(ctx) : null;
    }
}
