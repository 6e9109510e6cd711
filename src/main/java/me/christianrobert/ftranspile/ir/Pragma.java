package me.christianrobert.ftranspile.ir;

/**
 * Directive comment of the form {@code !$keyword content} (e.g. {@code !$acc parallel}).
 */
public class Pragma extends Node {

    private final String keyword;
    private final String content;

    public Pragma(String keyword, String content, Source source) {
        super(source, null);
        this.keyword = keyword;
        this.content = content;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getContent() {
        return content;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitPragma(this);
    }

    @Override
    public String toString() {
        return "Pragma{keyword=" + keyword + ", content=" + content + "}";
    }
}
