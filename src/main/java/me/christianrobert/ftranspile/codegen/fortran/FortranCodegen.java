package me.christianrobert.ftranspile.codegen.fortran;

import me.christianrobert.ftranspile.codegen.CodegenOptions;
import me.christianrobert.ftranspile.codegen.Stringifier;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.TypedSymbol;
import me.christianrobert.ftranspile.ir.Allocation;
import me.christianrobert.ftranspile.ir.Assignment;
import me.christianrobert.ftranspile.ir.Associate;
import me.christianrobert.ftranspile.ir.CallStatement;
import me.christianrobert.ftranspile.ir.Comment;
import me.christianrobert.ftranspile.ir.Conditional;
import me.christianrobert.ftranspile.ir.DataDeclaration;
import me.christianrobert.ftranspile.ir.Deallocation;
import me.christianrobert.ftranspile.ir.Declaration;
import me.christianrobert.ftranspile.ir.Import;
import me.christianrobert.ftranspile.ir.Interface;
import me.christianrobert.ftranspile.ir.Intrinsic;
import me.christianrobert.ftranspile.ir.Loop;
import me.christianrobert.ftranspile.ir.MaskedStatement;
import me.christianrobert.ftranspile.ir.Module;
import me.christianrobert.ftranspile.ir.MultiConditional;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.Nullify;
import me.christianrobert.ftranspile.ir.Pragma;
import me.christianrobert.ftranspile.ir.PreprocessorDirective;
import me.christianrobert.ftranspile.ir.Subroutine;
import me.christianrobert.ftranspile.ir.TypeDef;
import me.christianrobert.ftranspile.ir.WhileLoop;
import me.christianrobert.ftranspile.scope.ProcedureType;
import me.christianrobert.ftranspile.scope.SymbolAttributes;
import me.christianrobert.ftranspile.scope.TypeTag;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Re-emits the IR as free-form Fortran.
 *
 * <h3>Layout:</h3>
 * <ul>
 *   <li>two blanks of indentation per block level, keywords in upper case</li>
 *   <li>overlong lines continue with {@code &} at the end and {@code &} at the start of the next line</li>
 *   <li>statement labels are printed in front of the statement</li>
 *   <li>unsupported nodes print as {@code ! <NodeRepr>}</li>
 * </ul>
 *
 * <p>In conservative mode, statements that still carry their original source text are
 * printed from that text instead of being regenerated. Container nodes are always
 * regenerated so that changes to their bodies show up.</p>
 */
public class FortranCodegen extends Stringifier {

    private final boolean conservative;

    public FortranCodegen() {
        this(CodegenOptions.defaults());
    }

    public FortranCodegen(CodegenOptions options) {
        super(options, "  ", "!", new FortranCodeMapper());
        this.conservative = options.isConservative();
    }

    /**
     * Convenience entry point with default options.
     */
    public static String fgen(Node node) {
        return new FortranCodegen().generate(node);
    }

    @Override
    public String visit(Node node) {
        if (conservative && node != null && node.getSource() != null && node.getChildren().isEmpty()
                && !(node instanceof Intrinsic)) {
            return indentation() + node.getSource().getString();
        }
        return super.visit(node);
    }

    @Override
    protected String lineEnd() {
        return " &";
    }

    @Override
    protected String continuationPrefix() {
        return indentation() + "& ";
    }

    private static String label(Node node) {
        return node.getLabel() != null ? node.getLabel() + " " : null;
    }

    private static String constructName(String name) {
        return name != null ? name + ": " : null;
    }

    private static String endName(String name) {
        return name != null ? " " + name : null;
    }

    private static String inlineComment(String comment) {
        return comment != null ? "  " + comment : null;
    }

    // ---------------------------------------------------------------------
    // Program units
    // ---------------------------------------------------------------------

    /**
     * <pre>
     * MODULE name
     *   ...spec...
     * CONTAINS
     *   ...routines...
     * END MODULE name
     * </pre>
     */
    @Override
    public String visitModule(Module node) {
        List<String> lines = new ArrayList<>();
        lines.add(formatLine(label(node), "MODULE ", node.getName()));
        depth++;
        lines.add(visit(node.getSpec()));
        depth--;
        if (!node.getContains().isEmpty()) {
            lines.add(formatLine("CONTAINS"));
            lines.add(indentedUnits(node.getContains()));
        }
        lines.add(formatLine("END MODULE ", node.getName()));
        return joinLines(dropEmpty(lines));
    }

    /**
     * <pre>
     * [prefix] SUBROUTINE name(args) [bind]
     *   ...spec...
     *   ...body...
     * CONTAINS
     *   ...members...
     * END SUBROUTINE name
     * </pre>
     */
    @Override
    public String visitSubroutine(Subroutine node) {
        String keyword = node.isFunction() ? "FUNCTION" : "SUBROUTINE";
        List<String> lines = new ArrayList<>();

        // STEP 1: header
        String prefix = node.getPrefix().isEmpty() ? null : String.join(" ", node.getPrefix()) + " ";
        String result = node.isFunction() && node.getResultName() != null
                && !node.getResultName().equals(node.getName()) ? " RESULT(" + node.getResultName() + ")" : null;
        String bind = node.getBind() != null ? " " + node.getBind() : null;
        lines.add(formatLine(label(node), prefix, keyword, " ", node.getName(),
                "(", joinItems(node.getArgnames()), ")", result, bind));

        // STEP 2: spec and body
        depth++;
        lines.add(visit(node.getSpec()));
        lines.add(joinLines(visitAll(node.getBody())));
        depth--;

        // STEP 3: contained procedures
        if (!node.getMembers().isEmpty()) {
            lines.add(formatLine("CONTAINS"));
            lines.add(indentedUnits(node.getMembers()));
        }

        lines.add(formatLine("END ", keyword, " ", node.getName()));
        return joinLines(dropEmpty(lines));
    }

    private String indentedUnits(List<Node> units) {
        depth++;
        try {
            return String.join("\n\n", visitAll(units));
        } finally {
            depth--;
        }
    }

    @Override
    public String visitInterface(Interface node) {
        String header = node.isAbstract() ? "ABSTRACT INTERFACE" : "INTERFACE";
        String spec = node.getSpec() != null ? " " + node.getSpec() : null;
        return joinLines(dropEmpty(List.of(
                formatLine(label(node), header, spec),
                indented(node.getBody()),
                formatLine("END INTERFACE", spec))));
    }

    @Override
    public String visitTypeDef(TypeDef node) {
        String bind = node.isBindC() ? ", BIND(C)" : null;
        String parent = node.getExtendsType() != null ? ", EXTENDS(" + node.getExtendsType() + ")" : null;
        return joinLines(
                formatLine(label(node), "TYPE", bind, parent, " :: ", node.getName()),
                indented(node.getBody()),
                formatLine("END TYPE ", node.getName()));
    }

    // ---------------------------------------------------------------------
    // Comments, pragmas and passthrough text
    // ---------------------------------------------------------------------

    @Override
    public String visitComment(Comment node) {
        return formatLine(true, null, node.getText());
    }

    @Override
    public String visitPragma(Pragma node) {
        String content = node.getContent() == null || node.getContent().isEmpty() ? null : " " + node.getContent();
        return formatLine(true, null, "!$", node.getKeyword(), content);
    }

    @Override
    public String visitPreprocessorDirective(PreprocessorDirective node) {
        // cpp lines stay in column one, restored macro invocations sit in the block
        String text = node.getText();
        return text.startsWith("#") ? text : indentation() + text;
    }

    @Override
    public String visitIntrinsic(Intrinsic node) {
        return formatLine(true, null, label(node), node.getText());
    }

    // ---------------------------------------------------------------------
    // Specification statements
    // ---------------------------------------------------------------------

    @Override
    public String visitImport(Import node) {
        if (node.isCImport()) {
            return "#include \"" + node.getModule() + "\"";
        }
        if (node.isFInclude()) {
            return formatLine(label(node), "INCLUDE '", node.getModule(), "'");
        }
        List<String> items = new ArrayList<>();
        if (node.isOnlyList()) {
            for (TypedSymbol symbol : node.getSymbols()) {
                String remote = node.remoteName(symbol.getName());
                items.add(remote.equals(symbol.getName()) ? remote : symbol.getName() + " => " + remote);
            }
            return formatLine(label(node), "USE ", node.getModule(), ", ONLY: ", joinItems(items));
        }
        for (Map.Entry<String, String> rename : node.getRenames().entrySet()) {
            items.add(rename.getKey() + " => " + rename.getValue());
        }
        return formatLine(label(node), "USE ", node.getModule(), items.isEmpty() ? null : ", " + joinItems(items));
    }

    /**
     * {@code type[, attributes][, DIMENSION(...)] :: var[ = initial], ...}
     */
    @Override
    public String visitDeclaration(Declaration node) {
        List<String> variables = new ArrayList<>();
        for (TypedSymbol variable : node.getVariables()) {
            String text = expr(variable);
            Expression initial = variable.getType().getInitial();
            if (initial != null) {
                text += (variable.getType().isPointer() ? " => " : " = ") + expr(initial);
            }
            variables.add(text);
        }

        SymbolAttributes first = node.getVariables().get(0).getType();
        String type;
        if (!node.isExternal()) {
            type = typeString(first);
        } else if (first.getDtype() instanceof ProcedureType
                && ((ProcedureType) first.getDtype()).getReturnType() != null) {
            type = typeString(first.withDtype(((ProcedureType) first.getDtype()).getReturnType())) + ", EXTERNAL";
        } else {
            type = "EXTERNAL";
        }
        String dimensions = node.getDimensions() != null
                ? ", DIMENSION(" + String.join(", ", getSymgen().mapAll(node.getDimensions())) + ")"
                : null;
        return formatLine(false, inlineComment(node.getComment()),
                label(node), type, dimensions, " :: ", joinItems(variables));
    }

    /**
     * Type specification and attributes of a declared symbol, e.g. {@code REAL(KIND=8), INTENT(IN)}.
     */
    String typeString(SymbolAttributes type) {
        StringBuilder result = new StringBuilder();
        TypeTag tag = type.getTag();
        if (tag == TypeTag.DERIVED) {
            result.append("TYPE(").append(type.getDtype().getName()).append(')');
        } else {
            result.append(type.getDtype().getName());
            List<String> selectors = new ArrayList<>();
            if (type.getLength() != null) {
                selectors.add("LEN=" + expr(type.getLength()));
            }
            if (type.getKind() != null) {
                selectors.add("KIND=" + expr(type.getKind()));
            }
            if (!selectors.isEmpty()) {
                result.append('(').append(String.join(", ", selectors)).append(')');
            }
        }
        if (type.isAllocatable()) {
            result.append(", ALLOCATABLE");
        }
        if (type.isPointer()) {
            result.append(", POINTER");
        }
        if (type.isOptional()) {
            result.append(", OPTIONAL");
        }
        if (type.isParameter()) {
            result.append(", PARAMETER");
        }
        if (type.isTarget()) {
            result.append(", TARGET");
        }
        if (type.isContiguous()) {
            result.append(", CONTIGUOUS");
        }
        if (type.getIntent() != null) {
            result.append(", INTENT(").append(type.getIntent().toUpperCase(Locale.ROOT)).append(')');
        }
        return result.toString();
    }

    @Override
    public String visitDataDeclaration(DataDeclaration node) {
        List<String> variables = getSymgen().mapAll(node.getVariables());
        List<String> values = getSymgen().mapAll(node.getValues());
        return formatLine(label(node), "DATA ", String.join(", ", variables), "/", joinItems(values, 8), "/");
    }

    // ---------------------------------------------------------------------
    // Control flow
    // ---------------------------------------------------------------------

    @Override
    public String visitLoop(Loop node) {
        String loopLabel = node.getLoopLabel() != null ? node.getLoopLabel() + " " : null;
        String header = formatLine(label(node), constructName(node.getName()), "DO ", loopLabel,
                expr(node.getVariable()), "=", expr(node.getBounds()));
        String footer = formatLine(loopLabel, "END DO", endName(node.getName()));
        return joinLines(header, indented(node.getBody()), footer);
    }

    @Override
    public String visitWhileLoop(WhileLoop node) {
        String loopLabel = node.getLoopLabel() != null ? " " + node.getLoopLabel() : null;
        String condition = node.getCondition() != null ? " WHILE (" + expr(node.getCondition()) + ")" : null;
        String header = formatLine(label(node), constructName(node.getName()), "DO", loopLabel, condition);
        String footer = formatLine(node.getLoopLabel() != null ? node.getLoopLabel() + " " : null,
                "END DO", endName(node.getName()));
        return joinLines(header, indented(node.getBody()), footer);
    }

    /**
     * <pre>
     * IF (cond) THEN
     *   ...
     * ELSE IF (cond) THEN
     *   ...
     * ELSE
     *   ...
     * END IF
     * </pre>
     * or {@code IF (cond) stmt} for inline conditionals.
     */
    @Override
    public String visitConditional(Conditional node) {
        if (node.isInline()) {
            return formatLine(label(node), "IF (", expr(node.getCondition()), ") ", inlineBody(node.getBody()));
        }

        List<String> lines = new ArrayList<>();
        lines.add(formatLine(label(node), constructName(node.getName()), "IF (", expr(node.getCondition()), ") THEN"));
        lines.add(indented(node.getBody()));

        Conditional current = node;
        while (current.hasElseif() && current.getElseBody().size() == 1
                && current.getElseBody().get(0) instanceof Conditional) {
            current = (Conditional) current.getElseBody().get(0);
            lines.add(formatLine(label(current), "ELSE IF (", expr(current.getCondition()), ") THEN"));
            lines.add(indented(current.getBody()));
        }
        if (!current.getElseBody().isEmpty()) {
            lines.add(formatLine("ELSE"));
            lines.add(indented(current.getElseBody()));
        }
        lines.add(formatLine("END IF", endName(node.getName())));
        return joinLines(dropEmpty(lines));
    }

    /**
     * The single statement of an inline construct, rendered without indentation.
     */
    private String inlineBody(List<Node> body) {
        int saved = depth;
        depth = 0;
        try {
            return joinLines(visitAll(body)).strip();
        } finally {
            depth = saved;
        }
    }

    @Override
    public String visitMultiConditional(MultiConditional node) {
        List<String> lines = new ArrayList<>();
        lines.add(formatLine(label(node), constructName(node.getName()), "SELECT CASE (", expr(node.getExpr()), ")"));
        for (int i = 0; i < node.getValues().size(); i++) {
            lines.add(formatLine("CASE (", String.join(", ", getSymgen().mapAll(node.getValues().get(i))), ")"));
            lines.add(indented(node.getBodies().get(i)));
        }
        if (!node.getElseBody().isEmpty()) {
            lines.add(formatLine("CASE DEFAULT"));
            lines.add(indented(node.getElseBody()));
        }
        lines.add(formatLine("END SELECT", endName(node.getName())));
        return joinLines(dropEmpty(lines));
    }

    @Override
    public String visitMaskedStatement(MaskedStatement node) {
        if (node.isInline()) {
            return formatLine(label(node), "WHERE (", expr(node.getCondition()), ") ", inlineBody(node.getBody()));
        }
        List<String> lines = new ArrayList<>();
        lines.add(formatLine(label(node), "WHERE (", expr(node.getCondition()), ")"));
        lines.add(indented(node.getBody()));
        if (!node.getDefaultBody().isEmpty()) {
            lines.add(formatLine("ELSEWHERE"));
            lines.add(indented(node.getDefaultBody()));
        }
        lines.add(formatLine("END WHERE"));
        return joinLines(dropEmpty(lines));
    }

    @Override
    public String visitAssociate(Associate node) {
        List<String> associations = new ArrayList<>();
        for (Associate.Association association : node.getAssociations()) {
            associations.add(association.getName().getName() + "=>" + expr(association.getSelector()));
        }
        return joinLines(dropEmpty(List.of(
                formatLine(label(node), constructName(node.getName()), "ASSOCIATE(", joinItems(associations, 3), ")"),
                indented(node.getBody()),
                formatLine("END ASSOCIATE", endName(node.getName())))));
    }

    // ---------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------

    @Override
    public String visitAssignment(Assignment node) {
        return formatLine(false, inlineComment(node.getComment()), label(node),
                expr(node.getLhs()), node.isPtr() ? " => " : " = ", expr(node.getRhs()));
    }

    @Override
    public String visitCallStatement(CallStatement node) {
        List<String> args = new ArrayList<>(getSymgen().mapAll(node.getArguments()));
        for (Map.Entry<String, Expression> kw : node.getKwArguments().entrySet()) {
            args.add(kw.getKey() + "=" + expr(kw.getValue()));
        }
        return formatLine(false, inlineComment(node.getComment()), label(node),
                "CALL ", node.getName(), "(", joinItems(args), ")");
    }

    @Override
    public String visitAllocation(Allocation node) {
        List<String> items = new ArrayList<>(getSymgen().mapAll(node.getVariables()));
        if (node.getDataSource() != null) {
            items.add("source=" + expr(node.getDataSource()));
        }
        return formatLine(label(node), "ALLOCATE(", String.join(", ", items), ")");
    }

    @Override
    public String visitDeallocation(Deallocation node) {
        return formatLine(label(node), "DEALLOCATE(", String.join(", ", getSymgen().mapAll(node.getVariables())), ")");
    }

    @Override
    public String visitNullify(Nullify node) {
        return formatLine(label(node), "NULLIFY(", String.join(", ", getSymgen().mapAll(node.getVariables())), ")");
    }
}
