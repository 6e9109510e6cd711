package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.ir.Interface;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.scope.ProcedureType;
import me.christianrobert.ftranspile.scope.SymbolAttributes;

import java.util.List;

/**
 * Static helper for lowering interface blocks.
 *
 * <p>Each interface body becomes a {@link me.christianrobert.ftranspile.ir.Subroutine} with an
 * empty body whose name is registered as a procedure in the enclosing scope, so calls to it
 * are recognised. A generic interface name is registered the same way.</p>
 */
public class VisitInterfaceBlock {

    public static List<Node> v(FortranParser.InterfaceBlockContext ctx, IrBuilder b) {
        FortranParser.InterfaceStmtContext stmt = ctx.interfaceStmt();
        String spec = IrBuilder.name(stmt.name());
        if (spec != null) {
            b.scope().define(spec, SymbolAttributes.of(new ProcedureType(spec, false)));
        }

        List<Node> body = b.items(ctx.interfaceItem());
        return List.of(new Interface(spec, stmt.ABSTRACT() != null, body, b.text().source(ctx), b.text().label(stmt)));
    }

    public static List<Node> body(FortranParser.InterfaceBodyContext ctx, IrBuilder b) {
        if (ctx.subroutineStmt() != null) {
            FortranParser.SubroutineStmtContext stmt = ctx.subroutineStmt();
            String name = IrBuilder.name(stmt.name());
            VisitModule.checkEndName(name, ctx.endSubroutineStmt().name(), ctx, b);
            return List.of(VisitSubprogram.header(ctx, stmt, name, VisitSubprogram.arguments(stmt.dummyArgList()),
                    false, null, stmt.prefix(), VisitSubprogram.bind(stmt.bindSpec(), b), ctx.specificationPart(), b));
        }

        FortranParser.FunctionStmtContext stmt = ctx.functionStmt();
        String name = IrBuilder.name(stmt.name());
        VisitModule.checkEndName(name, ctx.endFunctionStmt().name(), ctx, b);
        FortranParser.SuffixContext suffix = stmt.suffix();
        String resultName = suffix != null && suffix.name() != null ? IrBuilder.name(suffix.name()) : name;
        String bind = suffix != null ? VisitSubprogram.bind(suffix.bindSpec(), b) : null;
        return List.of(VisitSubprogram.header(ctx, stmt, name, VisitSubprogram.arguments(stmt.dummyArgList()),
                true, resultName, stmt.prefix(), bind, ctx.specificationPart(), b));
    }
}
