package me.christianrobert.ftranspile.ir;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Interface block holding procedure interface bodies and module procedure statements.
 */
public class Interface extends Node {

    private final String spec;
    private final boolean isAbstract;
    private List<Node> body;

    public Interface(String spec, boolean isAbstract, List<Node> body, Source source, String label) {
        super(source, label);
        this.spec = spec;
        this.isAbstract = isAbstract;
        this.body = mutableCopy(body);
    }

    /**
     * Generic name of the interface, or null for a plain interface block.
     */
    public String getSpec() {
        return spec;
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    public List<Node> getBody() {
        return body;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitInterface(this);
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
        return "Interface{spec=" + spec + "}";
    }
}
