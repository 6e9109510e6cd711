package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.Expression;

import java.util.List;

/**
 * {@code ALLOCATE(a(n), b(m) [, source=x])}. Other allocate options (stat, errmsg) are not kept.
 */
public class Allocation extends Node {

    private final List<Expression> variables;
    private final Expression dataSource;

    public Allocation(List<Expression> variables, Expression dataSource, Source source, String label) {
        super(source, label);
        this.variables = List.copyOf(variables);
        this.dataSource = dataSource;
    }

    public List<Expression> getVariables() {
        return variables;
    }

    public Expression getDataSource() {
        return dataSource;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitAllocation(this);
    }

    @Override
    public String toString() {
        return "Allocation{variables=" + variables + "}";
    }
}
