package me.christianrobert.ftranspile.codegen;

import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.ir.Allocation;
import me.christianrobert.ftranspile.ir.Assignment;
import me.christianrobert.ftranspile.ir.Associate;
import me.christianrobert.ftranspile.ir.CallStatement;
import me.christianrobert.ftranspile.ir.Comment;
import me.christianrobert.ftranspile.ir.CommentBlock;
import me.christianrobert.ftranspile.ir.Conditional;
import me.christianrobert.ftranspile.ir.DataDeclaration;
import me.christianrobert.ftranspile.ir.Deallocation;
import me.christianrobert.ftranspile.ir.Declaration;
import me.christianrobert.ftranspile.ir.Import;
import me.christianrobert.ftranspile.ir.Interface;
import me.christianrobert.ftranspile.ir.Intrinsic;
import me.christianrobert.ftranspile.ir.IrVisitor;
import me.christianrobert.ftranspile.ir.Loop;
import me.christianrobert.ftranspile.ir.MaskedStatement;
import me.christianrobert.ftranspile.ir.Module;
import me.christianrobert.ftranspile.ir.MultiConditional;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.Nullify;
import me.christianrobert.ftranspile.ir.Pragma;
import me.christianrobert.ftranspile.ir.PreprocessorDirective;
import me.christianrobert.ftranspile.ir.Section;
import me.christianrobert.ftranspile.ir.SourceFile;
import me.christianrobert.ftranspile.ir.Subroutine;
import me.christianrobert.ftranspile.ir.TypeDef;
import me.christianrobert.ftranspile.ir.WhileLoop;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Base class of the IR pretty printers.
 *
 * <p>Tracks the current block {@code depth} and offers the line-level helpers every
 * target shares. Handlers for all IR kinds default to a visible placeholder line
 * ({@code <comment prefix> <NodeRepr>}) so that a target never drops a node silently.</p>
 *
 * <h3>Line layout:</h3>
 * <pre>
 * formatLine   indentation + items [+ comment], wrapped at token boundaries beyond linewidth
 * joinItems    "a, b, c" with at most {@code chunking} items per physical line
 * joinLines    newline-joined, null entries skipped
 * </pre>
 *
 * <p>Wrapped lines end with {@link #lineEnd()} and the next physical line starts with
 * {@link #continuationPrefix()}. Both are target specific.</p>
 *
 * <p>Instances carry mutable depth state and are single-use per generation run.</p>
 */
public abstract class Stringifier implements IrVisitor<String> {

    private final String indent;
    private final String commentPrefix;
    private final int linewidth;
    private final int chunking;
    private final CodeMapper symgen;

    protected int depth;

    protected Stringifier(CodegenOptions options, String indent, String commentPrefix, CodeMapper symgen) {
        this.indent = indent;
        this.commentPrefix = commentPrefix;
        this.linewidth = options.getLinewidth();
        this.chunking = options.getChunking();
        this.symgen = symgen;
    }

    /**
     * Renders a node and everything below it.
     */
    public String generate(Node node) {
        String result = visit(node);
        return result == null ? "" : result;
    }

    public String visit(Node node) {
        return node == null ? null : node.accept(this);
    }

    /**
     * Renders each node; nodes rendering to nothing are left out.
     */
    protected List<String> visitAll(List<? extends Node> nodes) {
        List<String> result = new ArrayList<>();
        if (nodes == null) {
            return result;
        }
        for (Node node : nodes) {
            String text = visit(node);
            if (text != null) {
                result.add(text);
            }
        }
        return result;
    }

    /**
     * Renders a block body one level deeper than the current depth.
     */
    protected String indented(List<? extends Node> body) {
        depth++;
        try {
            return joinLines(visitAll(body));
        } finally {
            depth--;
        }
    }

    protected String expr(Expression expression) {
        return symgen.map(expression);
    }

    protected CodeMapper getSymgen() {
        return symgen;
    }

    public int getLinewidth() {
        return linewidth;
    }

    public int getChunking() {
        return chunking;
    }

    protected String indentation() {
        return indent.repeat(Math.max(depth, 0));
    }

    protected String getCommentPrefix() {
        return commentPrefix;
    }

    /** Text closing a physical line that continues on the next one. */
    protected abstract String lineEnd();

    /** Text opening a continuation line, including its indentation. */
    protected abstract String continuationPrefix();

    // ---------------------------------------------------------------------
    // Line helpers
    // ---------------------------------------------------------------------

    protected String formatLine(String... items) {
        return formatLine(false, null, items);
    }

    /**
     * Renders one logical line at the current depth.
     *
     * @param noWrap never break the line, whatever its length
     * @param comment trailing comment appended after the wrapped content, may be null
     * @param items line fragments; nulls are skipped
     */
    protected String formatLine(boolean noWrap, String comment, String... items) {
        StringBuilder content = new StringBuilder();
        for (String item : items) {
            if (item != null) {
                content.append(item);
            }
        }
        String line = indentation() + content;
        String suffix = comment == null ? "" : comment;
        if (noWrap || line.length() <= linewidth || content.indexOf("\n") >= 0) {
            return line + suffix;
        }
        return wrap(content.toString()) + suffix;
    }

    private String wrap(String content) {
        List<String> tokens = splitTokens(content);
        int limit = linewidth - lineEnd().length();
        StringBuilder result = new StringBuilder();
        StringBuilder current = new StringBuilder(indentation());
        boolean lineHasToken = false;
        for (String token : tokens) {
            if (lineHasToken && current.length() + token.stripTrailing().length() > limit) {
                result.append(current.toString().stripTrailing()).append(lineEnd()).append('\n');
                current = new StringBuilder(continuationPrefix());
            }
            current.append(token);
            lineHasToken = true;
        }
        return result.append(current.toString().stripTrailing()).toString();
    }

    /**
     * Splits after each blank outside string literals, so joining the tokens gives the input back.
     */
    private static List<String> splitTokens(String content) {
        List<String> tokens = new ArrayList<>();
        StringBuilder token = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            token.append(c);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == ' ' && (i + 1 == content.length() || content.charAt(i + 1) != ' ')) {
                tokens.add(token.toString());
                token.setLength(0);
            }
        }
        if (token.length() > 0) {
            tokens.add(token.toString());
        }
        return tokens;
    }

    protected String joinLines(String... lines) {
        return joinLines(Arrays.asList(lines));
    }

    protected String joinLines(List<String> lines) {
        List<String> kept = new ArrayList<>();
        for (String line : lines) {
            if (line != null) {
                kept.add(line);
            }
        }
        return String.join("\n", kept);
    }

    /**
     * Lines without nulls and empty strings, for templates whose parts may render to nothing.
     */
    protected static List<String> dropEmpty(List<String> lines) {
        List<String> kept = new ArrayList<>();
        for (String line : lines) {
            if (line != null && !line.isEmpty()) {
                kept.add(line);
            }
        }
        return kept;
    }

    protected String joinItems(List<String> items) {
        return joinItems(items, chunking);
    }

    /**
     * Comma-separated items, {@code chunkSize} per physical line.
     */
    protected String joinItems(List<String> items, int chunkSize) {
        if (items.size() <= chunkSize) {
            return String.join(", ", items);
        }
        List<String> chunks = new ArrayList<>();
        for (int i = 0; i < items.size(); i += chunkSize) {
            chunks.add(String.join(", ", items.subList(i, Math.min(i + chunkSize, items.size()))));
        }
        return String.join("," + lineEnd() + "\n" + continuationPrefix(), chunks);
    }

    /**
     * Visible marker for a node kind the target does not render.
     */
    protected String placeholder(Node node) {
        return formatLine(true, null, commentPrefix, " <", String.valueOf(node), ">");
    }

    // ---------------------------------------------------------------------
    // Default handlers
    // ---------------------------------------------------------------------

    @Override
    public String visitSourceFile(SourceFile node) {
        return joinLines(visitAll(node.getBody()));
    }

    @Override
    public String visitSection(Section node) {
        return joinLines(visitAll(node.getBody()));
    }

    @Override
    public String visitCommentBlock(CommentBlock node) {
        return joinLines(visitAll(node.getComments()));
    }

    @Override
    public String visitModule(Module node) {
        return placeholder(node);
    }

    @Override
    public String visitSubroutine(Subroutine node) {
        return placeholder(node);
    }

    @Override
    public String visitComment(Comment node) {
        return placeholder(node);
    }

    @Override
    public String visitPragma(Pragma node) {
        return placeholder(node);
    }

    @Override
    public String visitPreprocessorDirective(PreprocessorDirective node) {
        return placeholder(node);
    }

    @Override
    public String visitIntrinsic(Intrinsic node) {
        return placeholder(node);
    }

    @Override
    public String visitImport(Import node) {
        return placeholder(node);
    }

    @Override
    public String visitDeclaration(Declaration node) {
        return placeholder(node);
    }

    @Override
    public String visitDataDeclaration(DataDeclaration node) {
        return placeholder(node);
    }

    @Override
    public String visitTypeDef(TypeDef node) {
        return placeholder(node);
    }

    @Override
    public String visitInterface(Interface node) {
        return placeholder(node);
    }

    @Override
    public String visitLoop(Loop node) {
        return placeholder(node);
    }

    @Override
    public String visitWhileLoop(WhileLoop node) {
        return placeholder(node);
    }

    @Override
    public String visitConditional(Conditional node) {
        return placeholder(node);
    }

    @Override
    public String visitMultiConditional(MultiConditional node) {
        return placeholder(node);
    }

    @Override
    public String visitMaskedStatement(MaskedStatement node) {
        return placeholder(node);
    }

    @Override
    public String visitAssignment(Assignment node) {
        return placeholder(node);
    }

    @Override
    public String visitCallStatement(CallStatement node) {
        return placeholder(node);
    }

    @Override
    public String visitAllocation(Allocation node) {
        return placeholder(node);
    }

    @Override
    public String visitDeallocation(Deallocation node) {
        return placeholder(node);
    }

    @Override
    public String visitNullify(Nullify node) {
        return placeholder(node);
    }

    @Override
    public String visitAssociate(Associate node) {
        return placeholder(node);
    }
}
