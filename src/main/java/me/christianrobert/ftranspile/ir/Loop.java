package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.LoopRange;
import me.christianrobert.ftranspile.expression.Scalar;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Counted DO loop.
 *
 * <p>{@code loopLabel} is the label of a legacy {@code DO 10 i = ...} loop whose body
 * ends on {@code 10 CONTINUE}; {@code name} is a construct name ({@code outer: DO}).</p>
 */
public class Loop extends Node {

    private final Scalar variable;
    private final LoopRange bounds;
    private final String name;
    private final String loopLabel;
    private List<Node> body;

    public Loop(Scalar variable, LoopRange bounds, List<Node> body, String name, String loopLabel,
                Source source, String label) {
        super(source, label);
        this.variable = variable;
        this.bounds = bounds;
        this.body = mutableCopy(body);
        this.name = name;
        this.loopLabel = loopLabel;
    }

    public Scalar getVariable() {
        return variable;
    }

    public LoopRange getBounds() {
        return bounds;
    }

    public List<Node> getBody() {
        return body;
    }

    public String getName() {
        return name;
    }

    public String getLoopLabel() {
        return loopLabel;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitLoop(this);
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
        return "Loop{variable=" + variable.getName() + (loopLabel != null ? ", label=" + loopLabel : "") + "}";
    }
}
