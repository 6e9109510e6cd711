package me.christianrobert.ftranspile.codegen.python;

import me.christianrobert.ftranspile.codegen.CodegenOptions;
import me.christianrobert.ftranspile.codegen.Stringifier;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.IntLiteral;
import me.christianrobert.ftranspile.expression.RangeIndex;
import me.christianrobert.ftranspile.expression.TypedSymbol;
import me.christianrobert.ftranspile.ir.Assignment;
import me.christianrobert.ftranspile.ir.CallStatement;
import me.christianrobert.ftranspile.ir.Comment;
import me.christianrobert.ftranspile.ir.Conditional;
import me.christianrobert.ftranspile.ir.Declaration;
import me.christianrobert.ftranspile.ir.Import;
import me.christianrobert.ftranspile.ir.Intrinsic;
import me.christianrobert.ftranspile.ir.Loop;
import me.christianrobert.ftranspile.ir.Module;
import me.christianrobert.ftranspile.ir.MultiConditional;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.SourceFile;
import me.christianrobert.ftranspile.ir.Subroutine;
import me.christianrobert.ftranspile.ir.WhileLoop;
import me.christianrobert.ftranspile.scope.SymbolAttributes;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Emits Python code working on NumPy arrays.
 *
 * <ul>
 *   <li>imports are dropped, every top-level routine starts with {@code import numpy as np}</li>
 *   <li>only declarations with an initial value produce code ({@code name = value})</li>
 *   <li>SELECT CASE becomes an {@code if/elif/else} chain of equality tests</li>
 *   <li>empty blocks get a {@code pass}</li>
 * </ul>
 */
public class PyCodegen extends Stringifier {

    private boolean insideModule;

    public PyCodegen() {
        this(CodegenOptions.defaults());
    }

    public PyCodegen(CodegenOptions options) {
        super(options, "    ", "#", new PyCodeMapper());
    }

    public static String pygen(Node node) {
        return new PyCodegen().generate(node);
    }

    @Override
    protected String lineEnd() {
        return " \\";
    }

    @Override
    protected String continuationPrefix() {
        return indentation() + "    ";
    }

    /**
     * Block body one level deeper; {@code pass} if it renders to nothing.
     */
    private String block(List<? extends Node> body) {
        String rendered = indented(body);
        if (!rendered.isBlank()) {
            return rendered;
        }
        depth++;
        try {
            return formatLine("pass");
        } finally {
            depth--;
        }
    }

    private static String pythonComment(String fortranComment) {
        return fortranComment.strip().replaceFirst("!", "#");
    }

    /**
     * NumPy type annotation of an argument.
     */
    static String numpyType(SymbolAttributes type) {
        if (type.isArray()) {
            return "np.ndarray";
        }
        return switch (type.getTag()) {
            case LOGICAL -> "np.bool_";
            case INTEGER -> "np.int32";
            case REAL -> type.getKind() instanceof IntLiteral && ((IntLiteral) type.getKind()).getValue() == 4
                    ? "np.float32" : "np.float64";
            case CHARACTER -> "str";
            default -> type.getDtype().getName();
        };
    }

    // ---------------------------------------------------------------------
    // Program units
    // ---------------------------------------------------------------------

    /**
     * Module variables with initial values, followed by the module's routines.
     */
    @Override
    public String visitModule(Module node) {
        List<String> lines = new ArrayList<>();
        lines.add(formatLine("# module ", node.getName()));
        lines.add(formatLine("import numpy as np"));
        lines.add(visit(node.getSpec()));
        insideModule = true;
        try {
            lines.addAll(visitAll(node.getContains()));
        } finally {
            insideModule = false;
        }
        return String.join("\n\n", dropEmpty(lines));
    }

    /**
     * <pre>
     * import numpy as np
     * def name(arg: type, ...):
     *     ...declarations with initial values...
     *     ...contained routines...
     *     ...body...
     *     return result
     * </pre>
     */
    @Override
    public String visitSubroutine(Subroutine node) {
        List<String> lines = new ArrayList<>();

        // STEP 1: boilerplate import for stand-alone routines
        if (depth == 0 && !insideModule) {
            lines.add(formatLine("import numpy as np"));
        }

        // STEP 2: signature
        List<String> args = new ArrayList<>();
        for (TypedSymbol arg : node.getArguments()) {
            args.add(arg.getName() + ": " + numpyType(arg.getType()));
        }
        lines.add(formatLine("def ", node.getName(), "(", joinItems(args), "):"));

        // STEP 3: spec, members and body
        List<Node> body = new ArrayList<>(node.getSpec().getBody());
        body.addAll(node.getMembers());
        body.addAll(node.getBody());
        lines.add(block(body));
        if (node.isFunction() && node.getResultName() != null) {
            depth++;
            lines.add(formatLine("return ", node.getResultName()));
            depth--;
        }
        return joinLines(lines);
    }

    @Override
    public String visitSourceFile(SourceFile node) {
        return String.join("\n\n", dropEmpty(visitAll(node.getBody())));
    }

    // ---------------------------------------------------------------------
    // Leaf nodes
    // ---------------------------------------------------------------------

    @Override
    public String visitIntrinsic(Intrinsic node) {
        return formatLine(true, null, node.getText().strip());
    }

    @Override
    public String visitComment(Comment node) {
        return formatLine(true, null, pythonComment(node.getText()));
    }

    @Override
    public String visitImport(Import node) {
        return null;
    }

    @Override
    public String visitDeclaration(Declaration node) {
        List<String> lines = new ArrayList<>();
        if (node.getComment() != null) {
            lines.add(formatLine(true, null, pythonComment(node.getComment())));
        }
        for (TypedSymbol variable : node.getVariables()) {
            Expression initial = variable.getType().getInitial();
            if (initial != null) {
                lines.add(formatLine(variable.getName(), " = ", expr(initial)));
            }
        }
        return lines.isEmpty() ? null : joinLines(lines);
    }

    @Override
    public String visitAssignment(Assignment node) {
        String comment = node.getComment() != null ? "  " + pythonComment(node.getComment()) : null;
        return formatLine(false, comment, expr(node.getLhs()), " = ", expr(node.getRhs()));
    }

    @Override
    public String visitCallStatement(CallStatement node) {
        List<String> args = new ArrayList<>(getSymgen().mapAll(node.getArguments()));
        for (Map.Entry<String, Expression> kw : node.getKwArguments().entrySet()) {
            args.add(kw.getKey() + "=" + expr(kw.getValue()));
        }
        String comment = node.getComment() != null ? "  " + pythonComment(node.getComment()) : null;
        return formatLine(false, comment, node.getName(), "(", joinItems(args), ")");
    }

    // ---------------------------------------------------------------------
    // Control flow
    // ---------------------------------------------------------------------

    /**
     * {@code for i in range(start, end + 1):} or {@code range(start, end + step, step)}.
     */
    @Override
    public String visitLoop(Loop node) {
        String start = expr(node.getBounds().getLower());
        String end = expr(node.getBounds().getUpper());
        String control;
        if (node.getBounds().getStep() != null) {
            String step = expr(node.getBounds().getStep());
            control = "range(" + start + ", " + end + " + " + step + ", " + step + ")";
        } else {
            control = "range(" + start + ", " + end + " + 1)";
        }
        return joinLines(formatLine("for ", expr(node.getVariable()), " in ", control, ":"), block(node.getBody()));
    }

    @Override
    public String visitWhileLoop(WhileLoop node) {
        String condition = node.getCondition() != null ? expr(node.getCondition()) : "True";
        return joinLines(formatLine("while ", condition, ":"), block(node.getBody()));
    }

    @Override
    public String visitConditional(Conditional node) {
        List<String> lines = new ArrayList<>();
        lines.add(formatLine("if ", expr(node.getCondition()), ":"));
        lines.add(block(node.getBody()));

        Conditional current = node;
        while (current.hasElseif() && current.getElseBody().size() == 1
                && current.getElseBody().get(0) instanceof Conditional) {
            current = (Conditional) current.getElseBody().get(0);
            lines.add(formatLine("elif ", expr(current.getCondition()), ":"));
            lines.add(block(current.getBody()));
        }
        if (!current.getElseBody().isEmpty()) {
            lines.add(formatLine("else:"));
            lines.add(block(current.getElseBody()));
        }
        return joinLines(lines);
    }

    /**
     * One {@code if}/{@code elif} per CASE, testing the selector against each value
     * ({@code lo <= x <= hi} for ranges); CASE DEFAULT becomes {@code else}.
     */
    @Override
    public String visitMultiConditional(MultiConditional node) {
        String selector = expr(node.getExpr());
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < node.getValues().size(); i++) {
            List<String> tests = new ArrayList<>();
            for (Expression value : node.getValues().get(i)) {
                tests.add(caseTest(selector, value));
            }
            lines.add(formatLine(i == 0 ? "if " : "elif ", String.join(" or ", tests), ":"));
            lines.add(block(node.getBodies().get(i)));
        }
        if (!node.getElseBody().isEmpty()) {
            if (lines.isEmpty()) {
                return joinLines(visitAll(node.getElseBody()));
            }
            lines.add(formatLine("else:"));
            lines.add(block(node.getElseBody()));
        }
        return joinLines(lines);
    }

    private String caseTest(String selector, Expression value) {
        if (!(value instanceof RangeIndex)) {
            return selector + " == " + expr(value);
        }
        RangeIndex range = (RangeIndex) value;
        if (range.getLower() != null && range.getUpper() != null) {
            return expr(range.getLower()) + " <= " + selector + " <= " + expr(range.getUpper());
        }
        if (range.getLower() != null) {
            return selector + " >= " + expr(range.getLower());
        }
        return selector + " <= " + expr(range.getUpper());
    }
}
