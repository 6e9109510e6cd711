package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.scope.Scope;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Derived type definition. The type owns the scope holding its components; the
 * enclosing scope holds a DERIVED symbol pointing back to this node.
 */
public class TypeDef extends Node {

    private final String name;
    private final Scope scope;
    private final String extendsType;
    private final boolean bindC;
    private List<Node> body;

    public TypeDef(String name, List<Node> body, Scope scope, String extendsType, boolean bindC,
                   Source source, String label) {
        super(source, label);
        this.name = name;
        this.body = mutableCopy(body);
        this.scope = scope;
        this.extendsType = extendsType;
        this.bindC = bindC;
    }

    public String getName() {
        return name;
    }

    public List<Node> getBody() {
        return body;
    }

    public Scope getScope() {
        return scope;
    }

    public String getExtendsType() {
        return extendsType;
    }

    public boolean isBindC() {
        return bindC;
    }

    /**
     * Component declarations in order.
     */
    public List<Declaration> getDeclarations() {
        return FindNodes.inList(body, Declaration.class);
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitTypeDef(this);
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
        return "TypeDef{name=" + name + "}";
    }
}
