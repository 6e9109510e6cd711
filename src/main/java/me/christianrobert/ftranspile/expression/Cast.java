package me.christianrobert.ftranspile.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Intrinsic type conversion such as {@code REAL(x, jprb)} or {@code INT(y)}.
 *
 * <p>{@code name} is the lower-case conversion intrinsic ("real", "int", "logical").</p>
 */
public class Cast extends Expression {

    private final String name;
    private final Expression expression;
    private final Expression kind;

    public Cast(String name, Expression expression, Expression kind) {
        this.name = name;
        this.expression = expression;
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public Expression getExpression() {
        return expression;
    }

    public Expression getKind() {
        return kind;
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visitCast(this, arg);
    }

    @Override
    public List<Expression> getChildren() {
        List<Expression> children = new ArrayList<>();
        children.add(expression);
        if (kind != null) {
            children.add(kind);
        }
        return children;
    }

    @Override
    public String toString() {
        return "Cast{name=" + name + ", expression=" + expression + ", kind=" + kind + "}";
    }
}
