package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * SELECT CASE construct. {@code values.get(i)} holds the selectors of the branch
 * {@code bodies.get(i)}; range selectors are {@code RangeIndex} nodes.
 * CASE DEFAULT becomes the else body.
 */
public class MultiConditional extends Node {

    private final Expression expr;
    private final List<List<Expression>> values;
    private final String name;
    private final List<List<Node>> bodies;
    private List<Node> elseBody;

    public MultiConditional(Expression expr, List<List<Expression>> values, List<List<Node>> bodies,
                            List<Node> elseBody, String name, Source source, String label) {
        super(source, label);
        if (values.size() != bodies.size()) {
            throw new IllegalArgumentException("MultiConditional needs one body per value list");
        }
        this.expr = expr;
        this.values = List.copyOf(values);
        this.bodies = new ArrayList<>();
        for (List<Node> b : bodies) {
            this.bodies.add(mutableCopy(b));
        }
        this.elseBody = mutableCopy(elseBody);
        this.name = name;
    }

    public Expression getExpr() {
        return expr;
    }

    public List<List<Expression>> getValues() {
        return values;
    }

    public List<List<Node>> getBodies() {
        return bodies;
    }

    public List<Node> getElseBody() {
        return elseBody;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitMultiConditional(this);
    }

    @Override
    public List<Node> getChildren() {
        List<List<Node>> all = new ArrayList<>(bodies);
        all.add(elseBody);
        return concat(all);
    }

    @Override
    public void transformBodies(UnaryOperator<List<Node>> op) {
        for (int i = 0; i < bodies.size(); i++) {
            bodies.set(i, mutableCopy(op.apply(bodies.get(i))));
        }
        elseBody = mutableCopy(op.apply(elseBody));
    }

    @Override
    public String toString() {
        return "MultiConditional{expr=" + expr + ", branches=" + bodies.size() + "}";
    }
}
