package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.TypedSymbol;
import me.christianrobert.ftranspile.scope.Scope;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * ASSOCIATE block. Each associate name is defined in the block's own scope with
 * the type and inferred shape of its selector.
 */
public class Associate extends Node {

    private final List<Association> associations;
    private final Scope scope;
    private final String name;
    private List<Node> body;

    public Associate(List<Association> associations, List<Node> body, Scope scope, String name,
                     Source source, String label) {
        super(source, label);
        this.associations = List.copyOf(associations);
        this.body = mutableCopy(body);
        this.scope = scope;
        this.name = name;
    }

    public List<Association> getAssociations() {
        return associations;
    }

    public List<Node> getBody() {
        return body;
    }

    public Scope getScope() {
        return scope;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitAssociate(this);
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
        return "Associate{associations=" + associations.size() + "}";
    }

    /**
     * One {@code name => selector} pair.
     */
    public static class Association {
        private final TypedSymbol name;
        private final Expression selector;

        public Association(TypedSymbol name, Expression selector) {
            this.name = name;
            this.selector = selector;
        }

        public TypedSymbol getName() {
            return name;
        }

        public Expression getSelector() {
            return selector;
        }

        @Override
        public String toString() {
            return "Association{" + name.getName() + " => " + selector + "}";
        }
    }
}
