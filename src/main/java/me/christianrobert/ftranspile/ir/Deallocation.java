package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.Expression;

import java.util.List;

public class Deallocation extends Node {

    private final List<Expression> variables;

    public Deallocation(List<Expression> variables, Source source, String label) {
        super(source, label);
        this.variables = List.copyOf(variables);
    }

    public List<Expression> getVariables() {
        return variables;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitDeallocation(this);
    }

    @Override
    public String toString() {
        return "Deallocation{variables=" + variables + "}";
    }
}
