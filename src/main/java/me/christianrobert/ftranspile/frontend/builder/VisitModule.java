package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.frontend.context.StructuralViolationException;
import me.christianrobert.ftranspile.ir.Module;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.Section;
import me.christianrobert.ftranspile.scope.ProcedureType;
import me.christianrobert.ftranspile.scope.Scope;
import me.christianrobert.ftranspile.scope.SymbolAttributes;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.List;

/**
 * Static helper for lowering modules.
 *
 * <h3>Structure:</h3>
 * <pre>
 * MODULE name
 *   specification part        lowered into the module scope
 * CONTAINS
 *   subprograms               names registered before any body is lowered
 * END MODULE [name]
 * </pre>
 *
 * <p>The lowered module is registered as a known module so that later program units in the
 * same file can import its symbols.</p>
 */
public class VisitModule {

    public static List<Node> v(FortranParser.ModuleContext ctx, IrBuilder b) {
        String name = IrBuilder.name(ctx.moduleStmt().name());
        checkEndName(name, ctx.endModuleStmt().name(), ctx, b);

        Scope scope = Scope.childOf(b.scope());
        List<Node> spec;
        List<Node> contains;

        b.push(scope);
        try {
            // STEP 1: contained procedures are visible in the whole module
            registerContained(ctx.containsPart(), scope);

            // STEP 2: specification part
            spec = b.visit(ctx.specificationPart());

            // STEP 3: contained subprograms
            contains = ctx.containsPart() != null ? b.visit(ctx.containsPart()) : List.of();
        } finally {
            b.pop();
        }

        Module module = new Module(name, new Section(spec), contains, scope,
                b.text().source(ctx), b.text().label(ctx.moduleStmt()));
        b.registerModule(module);
        return List.of(module);
    }

    /**
     * Pre-registers the names of contained subprograms as procedures in {@code scope}.
     */
    static void registerContained(FortranParser.ContainsPartContext contains, Scope scope) {
        if (contains == null) {
            return;
        }
        for (FortranParser.SubprogramContext sub : contains.subprogram()) {
            if (sub.subroutineSubprogram() != null) {
                String name = IrBuilder.name(sub.subroutineSubprogram().subroutineStmt().name());
                scope.define(name, SymbolAttributes.of(new ProcedureType(name, false)));
            } else {
                String name = IrBuilder.name(sub.functionSubprogram().functionStmt().name());
                scope.define(name, SymbolAttributes.of(new ProcedureType(name, true)));
            }
        }
    }

    /**
     * The optional name on an END statement must repeat the unit's name.
     */
    static void checkEndName(String name, FortranParser.NameContext endName,
                             ParserRuleContext unit, IrBuilder b) {
        if (endName != null && !IrBuilder.name(endName).equals(name)) {
            throw new StructuralViolationException(
                    "END statement names '" + IrBuilder.name(endName) + "' but the unit is '" + name + "'",
                    ConstructLayout.constructName(unit), b.text().source(unit));
        }
    }
}
