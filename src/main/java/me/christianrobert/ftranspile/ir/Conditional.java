package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.Expression;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * IF construct or inline IF statement.
 *
 * <p>ELSE IF chains are nested: the else body of the outer node holds exactly one
 * Conditional for the next branch and {@code hasElseif} is set, so a printer can
 * choose between {@code ELSE IF} and a nested {@code IF} inside {@code ELSE}.</p>
 */
public class Conditional extends Node {

    private final Expression condition;
    private final boolean inline;
    private final boolean hasElseif;
    private final String name;
    private List<Node> body;
    private List<Node> elseBody;

    public Conditional(Expression condition, List<Node> body, List<Node> elseBody, boolean inline,
                       boolean hasElseif, String name, Source source, String label) {
        super(source, label);
        this.condition = condition;
        this.body = mutableCopy(body);
        this.elseBody = mutableCopy(elseBody);
        this.inline = inline;
        this.hasElseif = hasElseif;
        this.name = name;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Node> getBody() {
        return body;
    }

    public List<Node> getElseBody() {
        return elseBody;
    }

    public boolean isInline() {
        return inline;
    }

    public boolean hasElseif() {
        return hasElseif;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    @Override
    public List<Node> getChildren() {
        return concat(List.of(body, elseBody));
    }

    @Override
    public void transformBodies(UnaryOperator<List<Node>> op) {
        body = mutableCopy(op.apply(body));
        elseBody = mutableCopy(op.apply(elseBody));
    }

    @Override
    public String toString() {
        return "Conditional{condition=" + condition + (hasElseif ? ", elseif" : "") + "}";
    }
}
