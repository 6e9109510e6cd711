package me.christianrobert.ftranspile.ir;

/**
 * Source span of a node: the 1-based line range and the exact source substring.
 */
public class Source {

    private final int lineStart;
    private final int lineEnd;
    private final String string;

    public Source(int lineStart, int lineEnd, String string) {
        this.lineStart = lineStart;
        this.lineEnd = lineEnd;
        this.string = string;
    }

    public int getLineStart() {
        return lineStart;
    }

    public int getLineEnd() {
        return lineEnd;
    }

    public String getString() {
        return string;
    }

    /**
     * True if the given line falls within this span.
     */
    public boolean containsLine(int line) {
        return line >= lineStart && line <= lineEnd;
    }

    @Override
    public String toString() {
        return lineStart == lineEnd ? "Source{line=" + lineStart + "}"
                : "Source{lines=" + lineStart + "-" + lineEnd + "}";
    }
}
