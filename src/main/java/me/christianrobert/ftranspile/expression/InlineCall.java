package me.christianrobert.ftranspile.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Function call inside an expression, with positional and keyword arguments.
 */
public class InlineCall extends Expression {

    private final String name;
    private final List<Expression> parameters;
    private final Map<String, Expression> kwArguments;

    public InlineCall(String name, List<Expression> parameters) {
        this(name, parameters, Collections.emptyMap());
    }

    public InlineCall(String name, List<Expression> parameters, Map<String, Expression> kwArguments) {
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.kwArguments = Collections.unmodifiableMap(new LinkedHashMap<>(kwArguments));
    }

    public String getName() {
        return name;
    }

    public List<Expression> getParameters() {
        return parameters;
    }

    public Map<String, Expression> getKwArguments() {
        return kwArguments;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitInlineCall(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        List<Expression> children = new ArrayList<>(parameters);
        children.addAll(kwArguments.values());
        return children;
    }

    @Override
    public String toString() {
        return "InlineCall{name=" + name + ", parameters=" + parameters
                + (kwArguments.isEmpty() ? "" : ", kwArguments=" + kwArguments) + "}";
    }
}
