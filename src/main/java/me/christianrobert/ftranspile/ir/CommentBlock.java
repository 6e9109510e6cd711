package me.christianrobert.ftranspile.ir;

import java.util.List;

/**
 * Consecutive comment lines clustered into one node.
 */
public class CommentBlock extends Node {

    private final List<Comment> comments;

    public CommentBlock(List<Comment> comments, Source source) {
        super(source, null);
        this.comments = List.copyOf(comments);
    }

    public List<Comment> getComments() {
        return comments;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitCommentBlock(this);
    }

    @Override
    public String toString() {
        return "CommentBlock{lines=" + comments.size() + "}";
    }
}
