package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.Expression;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * {@code DO WHILE} loop, or an unbounded {@code DO} when {@code condition} is null.
 */
public class WhileLoop extends Node {

    private final Expression condition;
    private final String name;
    private final String loopLabel;
    private List<Node> body;

    public WhileLoop(Expression condition, List<Node> body, String name, String loopLabel,
                     Source source, String label) {
        super(source, label);
        this.condition = condition;
        this.body = mutableCopy(body);
        this.name = name;
        this.loopLabel = loopLabel;
    }

    public Expression getCondition() {
        return condition;
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
        return visitor.visitWhileLoop(this);
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
        return "WhileLoop{condition=" + condition + "}";
    }
}
