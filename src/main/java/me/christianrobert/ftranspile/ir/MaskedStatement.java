package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.Expression;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * WHERE construct or statement: masked array assignments with an optional ELSEWHERE body.
 */
public class MaskedStatement extends Node {

    private final Expression condition;
    private final boolean inline;
    private List<Node> body;
    private List<Node> defaultBody;

    public MaskedStatement(Expression condition, List<Node> body, List<Node> defaultBody, boolean inline,
                           Source source, String label) {
        super(source, label);
        this.condition = condition;
        this.body = mutableCopy(body);
        this.defaultBody = mutableCopy(defaultBody);
        this.inline = inline;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Node> getBody() {
        return body;
    }

    public List<Node> getDefaultBody() {
        return defaultBody;
    }

    public boolean isInline() {
        return inline;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitMaskedStatement(this);
    }

    @Override
    public List<Node> getChildren() {
        return concat(List.of(body, defaultBody));
    }

    @Override
    public void transformBodies(UnaryOperator<List<Node>> op) {
        body = mutableCopy(op.apply(body));
        defaultBody = mutableCopy(op.apply(defaultBody));
    }

    @Override
    public String toString() {
        return "MaskedStatement{condition=" + condition + "}";
    }
}
