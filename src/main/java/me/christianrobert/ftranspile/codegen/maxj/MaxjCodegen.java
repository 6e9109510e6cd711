package me.christianrobert.ftranspile.codegen.maxj;

import me.christianrobert.ftranspile.codegen.CodegenException;
import me.christianrobert.ftranspile.codegen.CodegenOptions;
import me.christianrobert.ftranspile.codegen.Stringifier;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.TypedSymbol;
import me.christianrobert.ftranspile.ir.Assignment;
import me.christianrobert.ftranspile.ir.CallStatement;
import me.christianrobert.ftranspile.ir.Comment;
import me.christianrobert.ftranspile.ir.Conditional;
import me.christianrobert.ftranspile.ir.Declaration;
import me.christianrobert.ftranspile.ir.FindNodes;
import me.christianrobert.ftranspile.ir.Import;
import me.christianrobert.ftranspile.ir.Intrinsic;
import me.christianrobert.ftranspile.ir.Loop;
import me.christianrobert.ftranspile.ir.Module;
import me.christianrobert.ftranspile.ir.MultiConditional;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.Subroutine;
import me.christianrobert.ftranspile.ir.TypeDef;
import me.christianrobert.ftranspile.ir.WhileLoop;
import me.christianrobert.ftranspile.scope.SymbolAttributes;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits Maxeler MaxJ kernel and manager code.
 *
 * <h3>Module naming decides the class shape:</h3>
 * <pre>
 * fooKernel        package foo;  class fooKernel extends Kernel { ... }
 * fooManager       package foo;  public interface fooManager extends ManagerPCIe, ManagerKernel { ... }
 * fooManagerMAX5C  package foo;  public class fooManagerMAX5C extends MAX5CManager implements fooManager { ... }
 * </pre>
 * Suffixes are matched ignoring case; any other module name is rejected.
 *
 * <h3>Statements:</h3>
 * <ul>
 *   <li>declarations of intent-carrying arguments are left out unless they are streams</li>
 *   <li>assignments to non-scalar streams use the connect operator {@code <==}</li>
 *   <li>imports are printed once, in front of the class; inside classes they are dropped</li>
 * </ul>
 */
public class MaxjCodegen extends Stringifier {

    private static final String TARGET = "MaxJ";

    private boolean skipImports;

    public MaxjCodegen() {
        this(CodegenOptions.defaults());
    }

    public MaxjCodegen(CodegenOptions options) {
        super(options, "  ", "//", new MaxjCodeMapper());
    }

    public static String maxjgen(Node node) {
        return new MaxjCodegen().generate(node);
    }

    @Override
    protected String lineEnd() {
        return "";
    }

    @Override
    protected String continuationPrefix() {
        return indentation() + "    ";
    }

    // Lowered names are lower case, so suffixes match in any case
    private static boolean hasSuffix(String name, String suffix) {
        return name.length() > suffix.length()
                && name.regionMatches(true, name.length() - suffix.length(), suffix, 0, suffix.length());
    }

    private static String javaComment(String fortranComment) {
        return fortranComment.strip().replaceFirst("!", "//");
    }

    // ---------------------------------------------------------------------
    // Program units
    // ---------------------------------------------------------------------

    @Override
    public String visitModule(Module node) {
        String name = node.getName();
        String packageName;
        String signature;

        // STEP 1: class shape from the module name
        if (hasSuffix(name, "ManagerMAX5C")) {
            packageName = name.substring(0, name.length() - "ManagerMAX5C".length());
            signature = "public class " + name + " extends MAX5CManager implements "
                    + name.substring(0, name.length() - "MAX5C".length()) + " {";
        } else if (hasSuffix(name, "Manager")) {
            packageName = name.substring(0, name.length() - "Manager".length());
            signature = "public interface " + name + " extends ManagerPCIe, ManagerKernel {";
        } else if (hasSuffix(name, "Kernel")) {
            packageName = name.substring(0, name.length() - "Kernel".length());
            signature = "class " + name + " extends Kernel {";
        } else {
            throw new CodegenException(TARGET, "Module " + name + " is neither a Manager nor a Kernel", node);
        }

        // STEP 2: package and imports
        List<String> lines = new ArrayList<>();
        lines.add(formatLine("package ", packageName, ";"));
        lines.addAll(visitAll(FindNodes.find(node.getSpec(), Import.class)));

        // STEP 3: class body without imports
        lines.add(formatLine(signature));
        depth++;
        boolean saved = skipImports;
        skipImports = true;
        try {
            lines.add(visit(node.getSpec()));
            lines.addAll(visitAll(node.getContains()));
        } finally {
            skipImports = saved;
            depth--;
        }
        lines.add(formatLine("}"));
        return joinLines(dropEmpty(lines));
    }

    /**
     * <pre>
     * name(Type arg, ...) {
     *   ...spec without imports...
     *   ...body...
     * }
     * </pre>
     */
    @Override
    public String visitSubroutine(Subroutine node) {
        List<String> args = new ArrayList<>();
        for (TypedSymbol arg : node.getArguments()) {
            args.add(MaxjTypes.declaredType(arg.getType()) + " " + arg.getName());
        }
        List<String> lines = new ArrayList<>();
        lines.add(formatLine(node.getName(), "(", joinItems(args), ") {"));
        depth++;
        boolean saved = skipImports;
        skipImports = true;
        try {
            lines.add(visit(node.getSpec()));
            lines.add(joinLines(visitAll(node.getBody())));
        } finally {
            skipImports = saved;
            depth--;
        }
        lines.add(formatLine("}"));
        return joinLines(dropEmpty(lines));
    }

    /**
     * {@code DFEStructType name = new DFEStructType(DFEStructType.sft("a", type), ...);}
     */
    @Override
    public String visitTypeDef(TypeDef node) {
        List<String> fields = new ArrayList<>();
        for (Declaration declaration : node.getDeclarations()) {
            for (TypedSymbol variable : declaration.getVariables()) {
                SymbolAttributes type = variable.getType();
                fields.add("DFEStructType.sft(\"" + variable.getBasename() + "\", "
                        + MaxjTypes.dfeType(type.getTag(), type.getKind()) + ")");
            }
        }
        return formatLine("DFEStructType ", node.getName(), " = new DFEStructType(", joinItems(fields), ");");
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
        return formatLine(true, null, javaComment(node.getText()));
    }

    @Override
    public String visitImport(Import node) {
        if (skipImports) {
            return null;
        }
        if (node.getSymbols().isEmpty()) {
            return formatLine("import ", node.getModule(), ";");
        }
        List<String> lines = new ArrayList<>();
        for (TypedSymbol symbol : node.getSymbols()) {
            lines.add(formatLine("import ", node.getModule(), ".", node.remoteName(symbol.getName()), ";"));
        }
        return joinLines(lines);
    }

    /**
     * {@code Type name[ = initial];} per variable.
     */
    @Override
    public String visitDeclaration(Declaration node) {
        List<String> lines = new ArrayList<>();
        if (node.getComment() != null) {
            lines.add(formatLine(true, null, javaComment(node.getComment())));
        }
        for (TypedSymbol variable : node.getVariables()) {
            SymbolAttributes type = variable.getType();
            if (type.getIntent() != null && !type.isStream()) {
                continue;
            }
            Expression initial = type.getInitial();
            lines.add(formatLine(MaxjTypes.declaredType(type), " ", variable.getName(),
                    initial != null ? " = " + expr(initial) : null, ";"));
        }
        return lines.isEmpty() ? null : joinLines(lines);
    }

    @Override
    public String visitAssignment(Assignment node) {
        String comment = node.getComment() != null ? "  " + javaComment(node.getComment()) : null;
        String operator = " = ";
        if (node.getLhs() instanceof TypedSymbol) {
            SymbolAttributes type = ((TypedSymbol) node.getLhs()).getType();
            if (type.isStream() && type.isArray()) {
                operator = " <== ";
            }
        }
        return formatLine(false, comment, expr(node.getLhs()), operator, expr(node.getRhs()), ";");
    }

    @Override
    public String visitCallStatement(CallStatement node) {
        if (!node.getKwArguments().isEmpty()) {
            throw new CodegenException(TARGET, "Keyword arguments cannot be passed to " + node.getName(), node);
        }
        String comment = node.getComment() != null ? "  " + javaComment(node.getComment()) : null;
        return formatLine(false, comment, node.getName(), "(", joinItems(getSymgen().mapAll(node.getArguments())), ");");
    }

    // ---------------------------------------------------------------------
    // Control flow
    // ---------------------------------------------------------------------

    /**
     * {@code for (i = start; i <= end; i += step) { ... }}
     */
    @Override
    public String visitLoop(Loop node) {
        String var = expr(node.getVariable());
        String step = node.getBounds().getStep() != null ? expr(node.getBounds().getStep()) : "1";
        String header = formatLine("for (", var, " = ", expr(node.getBounds().getLower()), "; ",
                var, " <= ", expr(node.getBounds().getUpper()), "; ", var, " += ", step, ") {");
        return joinLines(header, indented(node.getBody()), formatLine("}"));
    }

    @Override
    public String visitWhileLoop(WhileLoop node) {
        String condition = node.getCondition() != null ? expr(node.getCondition()) : "true";
        return joinLines(formatLine("while (", condition, ") {"), indented(node.getBody()), formatLine("}"));
    }

    /**
     * <pre>
     * if (cond) {
     *   ...
     * } else if (cond) {
     *   ...
     * } else {
     *   ...
     * }
     * </pre>
     */
    @Override
    public String visitConditional(Conditional node) {
        List<String> lines = new ArrayList<>();
        lines.add(formatLine("if (", expr(node.getCondition()), ") {"));
        lines.add(indented(node.getBody()));

        Conditional current = node;
        while (current.hasElseif() && current.getElseBody().size() == 1
                && current.getElseBody().get(0) instanceof Conditional) {
            current = (Conditional) current.getElseBody().get(0);
            lines.add(formatLine("} else if (", expr(current.getCondition()), ") {"));
            lines.add(indented(current.getBody()));
        }
        if (!current.getElseBody().isEmpty()) {
            lines.add(formatLine("} else {"));
            lines.add(indented(current.getElseBody()));
        }
        lines.add(formatLine("}"));
        return joinLines(dropEmpty(lines));
    }

    /**
     * <pre>
     * switch (expr) {
     *   case v1:
     *   case v2:
     *     ...
     *     break;
     *   default:
     *     ...
     * }
     * </pre>
     */
    @Override
    public String visitMultiConditional(MultiConditional node) {
        List<String> lines = new ArrayList<>();
        lines.add(formatLine("switch (", expr(node.getExpr()), ") {"));
        depth++;
        for (int i = 0; i < node.getValues().size(); i++) {
            for (Expression value : node.getValues().get(i)) {
                lines.add(formatLine("case ", expr(value), ":"));
            }
            lines.add(indented(node.getBodies().get(i)));
            depth++;
            lines.add(formatLine("break;"));
            depth--;
        }
        if (!node.getElseBody().isEmpty()) {
            lines.add(formatLine("default:"));
            lines.add(indented(node.getElseBody()));
        }
        depth--;
        lines.add(formatLine("}"));
        return joinLines(dropEmpty(lines));
    }
}
