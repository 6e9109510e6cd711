package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.Expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CallStatement extends Node {

    private final String name;
    private final List<Expression> arguments;
    private final Map<String, Expression> kwArguments;
    private final String comment;

    public CallStatement(String name, List<Expression> arguments, Map<String, Expression> kwArguments,
                         String comment, Source source, String label) {
        super(source, label);
        this.name = name;
        this.arguments = List.copyOf(arguments);
        this.kwArguments = Collections.unmodifiableMap(new LinkedHashMap<>(kwArguments));
        this.comment = comment;
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public Map<String, Expression> getKwArguments() {
        return kwArguments;
    }

    public String getComment() {
        return comment;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitCallStatement(this);
    }

    @Override
    public String toString() {
        return "CallStatement{name=" + name + ", arguments=" + arguments.size() + "}";
    }
}
