package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.scope.Scope;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Fortran module: specification section plus contained routines.
 * A lowered module also serves as import definition for later {@code USE} statements.
 */
public class Module extends ProgramUnit {

    private List<Node> contains;

    public Module(String name, Section spec, List<Node> contains, Scope scope, Source source, String label) {
        super(name, spec, scope, source, label);
        this.contains = mutableCopy(contains);
    }

    /**
     * Everything after CONTAINS: routines and interleaved comments.
     */
    public List<Node> getContains() {
        return contains;
    }

    public List<Subroutine> getSubroutines() {
        return FindNodes.inList(contains, Subroutine.class);
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitModule(this);
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>();
        children.add(getSpec());
        children.addAll(contains);
        return children;
    }

    @Override
    public void transformBodies(UnaryOperator<List<Node>> op) {
        contains = mutableCopy(op.apply(contains));
    }

    @Override
    public String toString() {
        return "Module{name=" + getName() + "}";
    }
}
