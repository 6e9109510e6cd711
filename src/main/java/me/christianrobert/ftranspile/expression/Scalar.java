package me.christianrobert.ftranspile.expression;

import me.christianrobert.ftranspile.scope.Scope;

import java.util.Collections;
import java.util.List;

/**
 * Reference to a variable without subscript.
 */
public class Scalar extends TypedSymbol {

    public Scalar(String name, Scope scope) {
        this(name, null, scope);
    }

    public Scalar(String name, Expression parent, Scope scope) {
        super(name, parent, scope);
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitScalar(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        return getParent() != null ? List.of(getParent()) : Collections.emptyList();
    }

    @Override
    public String toString() {
        return "Scalar{name=" + getName() + "}";
    }
}
