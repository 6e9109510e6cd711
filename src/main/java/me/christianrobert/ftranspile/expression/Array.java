package me.christianrobert.ftranspile.expression;

import me.christianrobert.ftranspile.scope.Scope;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference to an array variable, optionally subscripted.
 *
 * <p>{@code dimensions} is null for a whole-array reference ({@code a}) and holds the
 * subscript for an element or section reference ({@code a(i, 1:n)}).</p>
 */
public class Array extends TypedSymbol {

    private final ArraySubscript dimensions;

    public Array(String name, Scope scope, ArraySubscript dimensions) {
        this(name, null, scope, dimensions);
    }

    public Array(String name, Expression parent, Scope scope, ArraySubscript dimensions) {
        super(name, parent, scope);
        this.dimensions = dimensions;
    }

    public ArraySubscript getDimensions() {
        return dimensions;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitArray(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        List<Expression> children = new ArrayList<>();
        if (getParent() != null) {
            children.add(getParent());
        }
        if (dimensions != null) {
            children.add(dimensions);
        }
        return children;
    }

    @Override
    public String toString() {
        return "Array{name=" + getName() + ", dimensions=" + dimensions + "}";
    }
}
