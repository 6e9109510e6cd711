package me.christianrobert.ftranspile.ir;

/**
 * C preprocessor line ({@code #ifdef}, {@code #define}, ...), kept verbatim.
 */
public class PreprocessorDirective extends Node {

    private final String text;

    public PreprocessorDirective(String text, Source source) {
        super(source, null);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitPreprocessorDirective(this);
    }

    @Override
    public String toString() {
        return "PreprocessorDirective{text=" + text + "}";
    }
}
