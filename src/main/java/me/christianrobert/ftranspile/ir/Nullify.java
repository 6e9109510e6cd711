package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.Expression;

import java.util.List;

public class Nullify extends Node {

    private final List<Expression> variables;

    public Nullify(List<Expression> variables, Source source, String label) {
        super(source, label);
        this.variables = List.copyOf(variables);
    }

    public List<Expression> getVariables() {
        return variables;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitNullify(this);
    }

    @Override
    public String toString() {
        return "Nullify{variables=" + variables + "}";
    }
}
