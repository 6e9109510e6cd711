package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.TypedSymbol;

import java.util.List;

/**
 * One type declaration statement declaring one or more variables.
 *
 * <p>The declared types live in the scope; the variables reference them lazily.
 * {@code dimensions} holds the shape given through a {@code DIMENSION} attribute,
 * otherwise each variable carries its own shape.</p>
 */
public class Declaration extends Node {

    private final List<TypedSymbol> variables;
    private final List<Expression> dimensions;
    private final boolean external;
    private final String comment;

    public Declaration(List<TypedSymbol> variables, List<Expression> dimensions, boolean external,
                       String comment, Source source, String label) {
        super(source, label);
        if (variables == null || variables.isEmpty()) {
            throw new IllegalArgumentException("Declaration requires at least one variable");
        }
        this.variables = List.copyOf(variables);
        this.dimensions = dimensions != null ? List.copyOf(dimensions) : null;
        this.external = external;
        this.comment = comment;
    }

    public List<TypedSymbol> getVariables() {
        return variables;
    }

    public List<Expression> getDimensions() {
        return dimensions;
    }

    public boolean isExternal() {
        return external;
    }

    public String getComment() {
        return comment;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitDeclaration(this);
    }

    @Override
    public String toString() {
        StringBuilder names = new StringBuilder();
        for (TypedSymbol v : variables) {
            if (names.length() > 0) {
                names.append(", ");
            }
            names.append(v.getName());
        }
        return "Declaration{variables=" + names + "}";
    }
}
