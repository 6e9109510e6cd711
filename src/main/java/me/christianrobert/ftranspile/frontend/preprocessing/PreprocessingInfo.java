package me.christianrobert.ftranspile.frontend.preprocessing;

/**
 * A source line altered by a {@link PreprocessingRule} before parsing, with its original text.
 */
public class PreprocessingInfo {

    private final int line;
    private final String text;

    public PreprocessingInfo(int line, String text) {
        this.line = line;
        this.text = text;
    }

    /**
     * 1-based line number in the source.
     */
    public int getLine() {
        return line;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "PreprocessingInfo{line=" + line + ", text=" + text + "}";
    }
}
