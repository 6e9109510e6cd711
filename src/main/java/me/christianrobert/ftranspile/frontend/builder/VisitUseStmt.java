package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.expression.TypedSymbol;
import me.christianrobert.ftranspile.ir.Import;
import me.christianrobert.ftranspile.ir.Module;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.scope.Scope;
import me.christianrobert.ftranspile.scope.SymbolAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static helper for lowering {@code USE} statements.
 *
 * <h3>Symbol import:</h3>
 * <ul>
 *   <li>known module, no ONLY list: every module symbol is copied into the current scope</li>
 *   <li>known module, ONLY list: the listed symbols are copied, under their local names</li>
 *   <li>unknown module, ONLY list: the listed names are defined as DEFERRED</li>
 *   <li>unknown module, no ONLY list: nothing can be imported</li>
 * </ul>
 * <p>Imported attributes are marked as imported from the module. A module nature
 * ({@code INTRINSIC}, {@code NON_INTRINSIC}) and a rename list without ONLY are not supported:
 * strict mode rejects them, lenient mode binds the names and keeps the statement verbatim.</p>
 */
public class VisitUseStmt {

    private static final Logger log = LoggerFactory.getLogger(VisitUseStmt.class);

    public static List<Node> v(FortranParser.UseStmtContext ctx, IrBuilder b) {
        String moduleName = IrBuilder.name(ctx.name());
        Scope scope = b.scope();
        Module module = b.knownModule(moduleName);

        // Unsupported forms bind their names but are kept verbatim
        boolean verbatim = false;
        if (ctx.moduleNature() != null) {
            b.warnOrFail("Module nature on USE is not supported", ctx);
            verbatim = true;
        }

        FortranParser.UseTailContext tail = ctx.useTail();
        if (tail != null && tail.renameList() != null) {
            b.warnOrFail("Rename list on USE is not supported", ctx);
            verbatim = true;
        }

        boolean only = tail != null && tail.ONLY() != null;
        List<TypedSymbol> symbols = new ArrayList<>();
        Map<String, String> renames = new LinkedHashMap<>();

        if (only) {
            // STEP 1: selected names, with local => remote renames
            if (module == null && tail.onlyList() != null) {
                log.warn("Module {} is not available, ONLY names are imported as DEFERRED", moduleName);
            }
            if (tail.onlyList() != null) {
                for (FortranParser.OnlyItemContext item : tail.onlyList().onlyItem()) {
                    String local = IrBuilder.name(item.name(0));
                    String remote = item.ARROW() != null ? IrBuilder.name(item.name(1)) : local;
                    if (!remote.equals(local)) {
                        renames.put(local, remote);
                    }
                    scope.define(local, remoteAttributes(module, remote).withImported(moduleName));
                    symbols.add(VisitDesignator.declared(local, scope));
                }
            }
        } else if (module != null) {
            // STEP 2: the whole module
            for (Map.Entry<String, SymbolAttributes> entry : module.getScope().getSymbols().entrySet()) {
                scope.define(entry.getKey(), entry.getValue().withImported(moduleName));
            }
        } else {
            log.warn("Module {} is not available, its symbols stay unresolved", moduleName);
        }

        if (tail != null && tail.renameList() != null) {
            // STEP 3: renamed names on top of the whole module
            for (FortranParser.RenameContext rename : tail.renameList().rename()) {
                String local = IrBuilder.name(rename.name(0));
                String remote = IrBuilder.name(rename.name(1));
                scope.define(local, remoteAttributes(module, remote).withImported(moduleName));
            }
        }

        if (verbatim) {
            return b.passthrough(ctx);
        }
        return List.of(new Import(moduleName, symbols, renames, only, false, false,
                b.text().source(ctx), b.text().label(ctx)));
    }

    private static SymbolAttributes remoteAttributes(Module module, String remote) {
        if (module != null) {
            SymbolAttributes attrs = module.getScope().lookupLocal(remote);
            if (attrs != null) {
                return attrs;
            }
            log.warn("Symbol {} not found in module {}", remote, module.getName());
        }
        return SymbolAttributes.deferred();
    }
}
