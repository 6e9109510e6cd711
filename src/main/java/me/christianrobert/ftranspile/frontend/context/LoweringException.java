package me.christianrobert.ftranspile.frontend.context;

import me.christianrobert.ftranspile.ir.Source;

/**
 * Exception thrown while lowering a parse tree into the IR.
 * Captures the offending construct and its source span for diagnostics.
 *
 * <p>Lowering exceptions abort the whole file: no partially built IR is handed on.</p>
 */
public class LoweringException extends RuntimeException {

    private final String construct;
    private final Source source;

    public LoweringException(String message) {
        super(message);
        this.construct = null;
        this.source = null;
    }

    public LoweringException(String message, Throwable cause) {
        super(message, cause);
        this.construct = null;
        this.source = null;
    }

    public LoweringException(String message, String construct, Source source) {
        super(message);
        this.construct = construct;
        this.source = source;
    }

    public LoweringException(String message, String construct, Source source, Throwable cause) {
        super(message, cause);
        this.construct = construct;
        this.source = source;
    }

    /**
     * Name of the parse-tree construct being lowered (e.g. "doConstruct").
     */
    public String getConstruct() {
        return construct;
    }

    public Source getSource() {
        return source;
    }

    /**
     * Gets a detailed error message including construct name and source span.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (construct != null) {
            sb.append("\nConstruct: ").append(construct);
        }
        if (source != null) {
            sb.append("\nLines: ").append(source.getLineStart()).append("-").append(source.getLineEnd());
            if (source.getString() != null) {
                sb.append("\nSource: ").append(source.getString());
            }
        }
        return sb.toString();
    }
}
