package me.christianrobert.ftranspile.ir;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Root of a lowered file: program units and the comments/directives between them.
 */
public class SourceFile extends Node {

    private final String path;
    private List<Node> body;

    public SourceFile(String path, List<Node> body, Source source) {
        super(source, null);
        this.path = path;
        this.body = mutableCopy(body);
    }

    public String getPath() {
        return path;
    }

    public List<Node> getBody() {
        return body;
    }

    public List<Module> getModules() {
        return FindNodes.inList(body, Module.class);
    }

    public List<Subroutine> getSubroutines() {
        return FindNodes.inList(body, Subroutine.class);
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitSourceFile(this);
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
        return "SourceFile{path=" + path + ", units=" + body.size() + "}";
    }
}
