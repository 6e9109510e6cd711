package me.christianrobert.ftranspile.codegen;

import me.christianrobert.ftranspile.ir.Node;

/**
 * Thrown when a target cannot express a node it is asked to render.
 *
 * <p>Nodes a target simply does not know are rendered as placeholders instead; this
 * exception is reserved for nodes whose rendering would produce wrong code.</p>
 */
public class CodegenException extends RuntimeException {

    private final String target;
    private final transient Node node;

    public CodegenException(String target, String message, Node node) {
        super(message);
        this.target = target;
        this.node = node;
    }

    public String getTarget() {
        return target;
    }

    public Node getNode() {
        return node;
    }

    /**
     * Message with target and node, for logs and results.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(target).append(" code generation failed: ").append(getMessage());
        if (node != null) {
            sb.append("\n  Node: ").append(node);
            if (node.getSource() != null) {
                sb.append("\n  Lines: ").append(node.getSource().getLineStart())
                        .append('-').append(node.getSource().getLineEnd());
            }
        }
        return sb.toString();
    }
}
