package me.christianrobert.ftranspile.ir;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Plain grouping of nodes, used for the specification part of program units.
 */
public class Section extends Node {

    private List<Node> body;

    public Section(List<Node> body) {
        this(body, null);
    }

    public Section(List<Node> body, Source source) {
        super(source, null);
        this.body = mutableCopy(body);
    }

    public List<Node> getBody() {
        return body;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitSection(this);
    }

    @Override
    public List<Node> getChildren() {
        return body;
    }

    @Override
    public void transformBodies(UnaryOperator<List<Node>> op) {
        body = mutableCopy(op.apply(body));
    }

    @Override
    public String toString() {
        return "Section{nodes=" + body.size() + "}";
    }
}
