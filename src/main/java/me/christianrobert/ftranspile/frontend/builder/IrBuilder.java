package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.antlr.FortranParserBaseVisitor;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.frontend.context.FrontendConfig;
import me.christianrobert.ftranspile.frontend.context.UnsupportedConstructException;
import me.christianrobert.ftranspile.ir.Intrinsic;
import me.christianrobert.ftranspile.ir.Module;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.SourceFile;
import me.christianrobert.ftranspile.scope.ProcedureType;
import me.christianrobert.ftranspile.scope.Scope;
import me.christianrobert.ftranspile.scope.SymbolAttributes;
import me.christianrobert.ftranspile.scope.TypeTag;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.RuleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lowers a Fortran parse tree into IR nodes.
 *
 * <p>Every statement rule returns a list of nodes so that one statement may lower to zero,
 * one or several nodes. Block constructs and program units are delegated to static
 * {@code Visit*} helpers; simple statements are handled inline.</p>
 *
 * <p>Scopes are kept on a stack. Program units, derived types and ASSOCIATE blocks push a
 * child scope for the duration of their body, and expressions are always resolved against
 * the innermost one.</p>
 *
 * <p>Rules without a dedicated lowering reach {@link #visitChildren(RuleNode)}: in strict mode
 * that raises {@link UnsupportedConstructException}, otherwise the statement is kept verbatim
 * as an {@link Intrinsic} node and a warning is logged.</p>
 *
 * <p>A builder lowers one source file and is not reusable.</p>
 */
public class IrBuilder extends FortranParserBaseVisitor<List<Node>> {

    private static final Logger log = LoggerFactory.getLogger(IrBuilder.class);

    private final SourceText text;
    private final FrontendConfig config;
    private final ExpressionBuilder expressions;
    private final Deque<Scope> scopes = new ArrayDeque<>();

    // Modules usable by USE statements: the supplied definitions plus modules lowered so far
    private final Map<String, Module> knownModules;

    public IrBuilder(SourceText text, FrontendConfig config, Map<String, Module> definitions) {
        this.text = text;
        this.config = config;
        this.knownModules = new LinkedHashMap<>();
        if (definitions != null) {
            definitions.forEach((name, module) -> knownModules.put(name.toLowerCase(Locale.ROOT), module));
        }
        this.expressions = new ExpressionBuilder(this::scope, text, config);
    }

    /**
     * Lowers a whole program into a {@link SourceFile} with a fresh root scope.
     */
    public SourceFile build(FortranParser.ProgramContext ctx, String path) {
        scopes.push(new Scope());
        try {
            return new SourceFile(path, visit(ctx), text.source(ctx));
        } finally {
            scopes.pop();
        }
    }

    // ========== State accessed by the Visit* helpers ==========

    Scope scope() {
        return scopes.peek();
    }

    void push(Scope scope) {
        scopes.push(scope);
    }

    void pop() {
        scopes.pop();
    }

    SourceText text() {
        return text;
    }

    FrontendConfig config() {
        return config;
    }

    ExpressionBuilder expressions() {
        return expressions;
    }

    Expression expr(FortranParser.ExprContext ctx) {
        return ctx == null ? null : expressions.visit(ctx);
    }

    Module knownModule(String name) {
        return knownModules.get(name.toLowerCase(Locale.ROOT));
    }

    void registerModule(Module module) {
        knownModules.put(module.getName().toLowerCase(Locale.ROOT), module);
    }

    /**
     * Lowers each rule child in order and concatenates the results; tokens are skipped.
     */
    List<Node> items(List<? extends ParseTree> children) {
        List<Node> result = new ArrayList<>();
        for (ParseTree child : children) {
            if (child instanceof ParserRuleContext) {
                List<Node> lowered = visit(child);
                if (lowered != null) {
                    result.addAll(lowered);
                }
            }
        }
        return result;
    }

    /**
     * Raises in strict mode, logs a warning in lenient mode.
     */
    void warnOrFail(String message, ParserRuleContext ctx) {
        String construct = ConstructLayout.constructName(ctx);
        if (config.isStrictMode()) {
            log.error("{} (line {}): {}", message, ctx.start.getLine(), text.text(ctx));
            throw new UnsupportedConstructException(message, construct, text.source(ctx));
        }
        log.warn("{} (line {}): {}", message, ctx.start.getLine(), text.text(ctx));
    }

    /**
     * Keeps a statement verbatim as an {@link Intrinsic} node.
     */
    List<Node> passthrough(ParserRuleContext ctx) {
        return List.of(new Intrinsic(text.textWithoutLabel(ctx), text.source(ctx), text.label(ctx)));
    }

    static String name(FortranParser.NameContext ctx) {
        return ctx == null ? null : ctx.getText().toLowerCase(Locale.ROOT);
    }

    // ========== Dispatch rules ==========

    @Override
    public List<Node> visitProgram(FortranParser.ProgramContext ctx) {
        return items(ctx.programItem());
    }

    @Override
    public List<Node> visitProgramItem(FortranParser.ProgramItemContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public List<Node> visitSubprogram(FortranParser.SubprogramContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public List<Node> visitContainsPart(FortranParser.ContainsPartContext ctx) {
        return items(ctx.children.subList(1, ctx.getChildCount()));
    }

    @Override
    public List<Node> visitSpecificationPart(FortranParser.SpecificationPartContext ctx) {
        return items(ctx.specItem());
    }

    @Override
    public List<Node> visitSpecItem(FortranParser.SpecItemContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public List<Node> visitExecutionPart(FortranParser.ExecutionPartContext ctx) {
        return items(ctx.executionItem());
    }

    @Override
    public List<Node> visitExecutionItem(FortranParser.ExecutionItemContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public List<Node> visitActionStmt(FortranParser.ActionStmtContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public List<Node> visitTypeBodyItem(FortranParser.TypeBodyItemContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public List<Node> visitInterfaceItem(FortranParser.InterfaceItemContext ctx) {
        return visit(ctx.getChild(0));
    }

    // ========== Program units ==========

    @Override
    public List<Node> visitModule(FortranParser.ModuleContext ctx) {
        return VisitModule.v(ctx, this);
    }

    @Override
    public List<Node> visitSubroutineSubprogram(FortranParser.SubroutineSubprogramContext ctx) {
        return VisitSubprogram.subroutine(ctx, this);
    }

    @Override
    public List<Node> visitFunctionSubprogram(FortranParser.FunctionSubprogramContext ctx) {
        return VisitSubprogram.function(ctx, this);
    }

    // ========== Specification statements ==========

    @Override
    public List<Node> visitUseStmt(FortranParser.UseStmtContext ctx) {
        return VisitUseStmt.v(ctx, this);
    }

    @Override
    public List<Node> visitTypeDeclarationStmt(FortranParser.TypeDeclarationStmtContext ctx) {
        return VisitTypeDeclarationStmt.v(ctx, this);
    }

    @Override
    public List<Node> visitDerivedTypeDef(FortranParser.DerivedTypeDefContext ctx) {
        return VisitDerivedTypeDef.v(ctx, this);
    }

    @Override
    public List<Node> visitInterfaceBlock(FortranParser.InterfaceBlockContext ctx) {
        return VisitInterfaceBlock.v(ctx, this);
    }

    @Override
    public List<Node> visitInterfaceBody(FortranParser.InterfaceBodyContext ctx) {
        return VisitInterfaceBlock.body(ctx, this);
    }

    @Override
    public List<Node> visitDataStmt(FortranParser.DataStmtContext ctx) {
        return VisitDataStmt.v(ctx, this);
    }

    @Override
    public List<Node> visitExternalStmt(FortranParser.ExternalStmtContext ctx) {
        for (FortranParser.NameContext nameCtx : ctx.name()) {
            String name = name(nameCtx);
            SymbolAttributes existing = scope().lookupLocal(name);
            SymbolAttributes.Builder attrs = existing != null ? existing.toBuilder() : SymbolAttributes.builder();
            scope().define(name, attrs.dtype(procedureType(name, existing)).external(true).build());
        }
        return passthrough(ctx);
    }

    // A preceding type declaration makes the external a function of that type
    private static ProcedureType procedureType(String name, SymbolAttributes existing) {
        if (existing == null || existing.getTag() == TypeTag.DEFERRED) {
            return new ProcedureType(name, false);
        }
        if (existing.getDtype() instanceof ProcedureType) {
            return (ProcedureType) existing.getDtype();
        }
        return new ProcedureType(name, existing.getDtype());
    }

    @Override
    public List<Node> visitParameterStmt(FortranParser.ParameterStmtContext ctx) {
        for (FortranParser.NamedConstantContext constant : ctx.namedConstant()) {
            String name = name(constant.name());
            SymbolAttributes existing = scope().lookupLocal(name);
            SymbolAttributes.Builder attrs = existing != null ? existing.toBuilder() : SymbolAttributes.deferred().toBuilder();
            scope().define(name, attrs.parameter(true).initial(expr(constant.expr())).build());
        }
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitImplicitStmt(FortranParser.ImplicitStmtContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitAccessStmt(FortranParser.AccessStmtContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitSaveStmt(FortranParser.SaveStmtContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitSequenceStmt(FortranParser.SequenceStmtContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitProcedureBinding(FortranParser.ProcedureBindingContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitContainsStmt(FortranParser.ContainsStmtContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitModuleProcedureStmt(FortranParser.ModuleProcedureStmtContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitIncludeStmt(FortranParser.IncludeStmtContext ctx) {
        return VisitDirective.include(ctx, this);
    }

    @Override
    public List<Node> visitCommentStmt(FortranParser.CommentStmtContext ctx) {
        return VisitDirective.comment(ctx, this);
    }

    @Override
    public List<Node> visitPpDirective(FortranParser.PpDirectiveContext ctx) {
        return VisitDirective.preprocessor(ctx, this);
    }

    // ========== Execution statements ==========

    @Override
    public List<Node> visitAssignmentStmt(FortranParser.AssignmentStmtContext ctx) {
        return VisitAssignment.v(ctx, this);
    }

    @Override
    public List<Node> visitPointerAssignmentStmt(FortranParser.PointerAssignmentStmtContext ctx) {
        return VisitAssignment.pointer(ctx, this);
    }

    @Override
    public List<Node> visitCallStmt(FortranParser.CallStmtContext ctx) {
        return VisitAssignment.call(ctx, this);
    }

    @Override
    public List<Node> visitIfConstruct(FortranParser.IfConstructContext ctx) {
        return VisitIfConstruct.v(ctx, this);
    }

    @Override
    public List<Node> visitIfStmt(FortranParser.IfStmtContext ctx) {
        return VisitIfConstruct.inline(ctx, this);
    }

    @Override
    public List<Node> visitDoConstruct(FortranParser.DoConstructContext ctx) {
        return VisitDoConstruct.v(ctx, this);
    }

    @Override
    public List<Node> visitSelectCaseConstruct(FortranParser.SelectCaseConstructContext ctx) {
        return VisitSelectCaseConstruct.v(ctx, this);
    }

    @Override
    public List<Node> visitWhereConstruct(FortranParser.WhereConstructContext ctx) {
        return VisitWhereConstruct.v(ctx, this);
    }

    @Override
    public List<Node> visitWhereStmt(FortranParser.WhereStmtContext ctx) {
        return VisitWhereConstruct.inline(ctx, this);
    }

    @Override
    public List<Node> visitAssociateConstruct(FortranParser.AssociateConstructContext ctx) {
        return VisitAssociateConstruct.v(ctx, this);
    }

    @Override
    public List<Node> visitAllocateStmt(FortranParser.AllocateStmtContext ctx) {
        return VisitAllocateStmt.allocate(ctx, this);
    }

    @Override
    public List<Node> visitDeallocateStmt(FortranParser.DeallocateStmtContext ctx) {
        return VisitAllocateStmt.deallocate(ctx, this);
    }

    @Override
    public List<Node> visitNullifyStmt(FortranParser.NullifyStmtContext ctx) {
        return VisitAllocateStmt.nullify(ctx, this);
    }

    @Override
    public List<Node> visitContinueStmt(FortranParser.ContinueStmtContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitReturnStmt(FortranParser.ReturnStmtContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitCycleStmt(FortranParser.CycleStmtContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitExitStmt(FortranParser.ExitStmtContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitStopStmt(FortranParser.StopStmtContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitGotoStmt(FortranParser.GotoStmtContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitPrintStmt(FortranParser.PrintStmtContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitWriteStmt(FortranParser.WriteStmtContext ctx) {
        return passthrough(ctx);
    }

    @Override
    public List<Node> visitReadStmt(FortranParser.ReadStmtContext ctx) {
        return passthrough(ctx);
    }

    // ========== Fallback ==========

    /**
     * Reached by every rule without an explicit override (FORALL among them).
     */
    @Override
    public List<Node> visitChildren(RuleNode node) {
        ParserRuleContext ctx = (ParserRuleContext) node;
        warnOrFail("No lowering for " + ConstructLayout.constructName(ctx), ctx);
        return passthrough(ctx);
    }
}
