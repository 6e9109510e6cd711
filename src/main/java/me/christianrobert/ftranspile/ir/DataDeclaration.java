package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.Expression;

import java.util.List;

/**
 * One set of a {@code DATA} statement: {@code variables / values /}.
 */
public class DataDeclaration extends Node {

    private final List<Expression> variables;
    private final List<Expression> values;

    public DataDeclaration(List<Expression> variables, List<Expression> values, Source source, String label) {
        super(source, label);
        this.variables = List.copyOf(variables);
        this.values = List.copyOf(values);
    }

    public List<Expression> getVariables() {
        return variables;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitDataDeclaration(this);
    }

    @Override
    public String toString() {
        return "DataDeclaration{variables=" + variables + "}";
    }
}
