package me.christianrobert.ftranspile.frontend.preprocessing;

import me.christianrobert.ftranspile.ir.Comment;
import me.christianrobert.ftranspile.ir.FindNodes;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.PreprocessorDirective;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Protects full-line macro invocations such as {@code DR_HOOK_BEGIN} or
 * {@code SWAP_ENDIAN(buf)} from the parser.
 *
 * <p>Such a line is an upper-case name containing an underscore, optionally followed by an
 * argument list with balanced parentheses, alone on its line. Continuation lines of a
 * statement never qualify. The filter turns it into a marker comment, which the
 * grammar accepts wherever a statement may appear; post-processing turns the marker comments
 * back into {@link PreprocessorDirective} nodes with the original text.</p>
 */
public class MacroMarkerRule implements PreprocessingRule {

    static final String MARKER = "!__macro__ ";

    private static final Pattern MACRO = Pattern.compile("^(\\s*)([A-Z][A-Z0-9]*_[A-Z0-9_]*(\\s*\\(.*\\))?)\\s*$");

    @Override
    public String getName() {
        return "macro-marker";
    }

    @Override
    public String filter(String source, List<PreprocessingInfo> info) {
        String[] lines = source.split("\n", -1);
        StringBuilder result = new StringBuilder();
        boolean continued = false;
        for (int i = 0; i < lines.length; i++) {
            Matcher matcher = MACRO.matcher(lines[i]);
            if (!continued && matcher.matches() && balanced(matcher.group(2))) {
                info.add(new PreprocessingInfo(i + 1, matcher.group(2)));
                result.append(matcher.group(1)).append(MARKER).append(matcher.group(2));
            } else {
                result.append(lines[i]);
            }
            if (i < lines.length - 1) {
                result.append('\n');
            }
            String code = stripComment(lines[i]).trim();
            // comment and blank lines do not end a continued statement
            if (!code.isEmpty()) {
                continued = code.endsWith("&");
            }
        }
        return result.toString();
    }

    private static boolean balanced(String text) {
        int open = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                open++;
            } else if (c == ')' && --open < 0) {
                return false;
            }
        }
        return open == 0;
    }

    /**
     * Removes a trailing {@code !} comment, ignoring exclamation marks inside string literals.
     */
    private static String stripComment(String line) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '!') {
                return line.substring(0, i);
            }
        }
        return line;
    }

    @Override
    public Node postprocess(Node ir, List<PreprocessingInfo> info) {
        FindNodes.transformAllBodies(ir, body -> {
            List<Node> result = new ArrayList<>(body.size());
            for (Node node : body) {
                result.add(restore(node, info));
            }
            return result;
        });
        return ir;
    }

    private Node restore(Node node, List<PreprocessingInfo> info) {
        if (!(node instanceof Comment) || !((Comment) node).getText().startsWith(MARKER.trim())) {
            return node;
        }
        int line = node.getSource() != null ? node.getSource().getLineStart() : -1;
        for (PreprocessingInfo entry : info) {
            if (entry.getLine() == line) {
                return new PreprocessorDirective(entry.getText(), node.getSource());
            }
        }
        String text = ((Comment) node).getText().substring(MARKER.trim().length()).trim();
        return new PreprocessorDirective(text, node.getSource());
    }
}
