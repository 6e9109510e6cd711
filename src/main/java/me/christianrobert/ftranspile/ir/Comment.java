package me.christianrobert.ftranspile.ir;

/**
 * A full-line comment or blank-line marker; {@code text} includes the leading {@code !}.
 */
public class Comment extends Node {

    private final String text;

    public Comment(String text, Source source) {
        super(source, null);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitComment(this);
    }

    @Override
    public String toString() {
        return "Comment{text=" + text + "}";
    }
}
