package me.christianrobert.ftranspile.ir;

import me.christianrobert.ftranspile.expression.Array;
import me.christianrobert.ftranspile.expression.Scalar;
import me.christianrobert.ftranspile.expression.TypedSymbol;
import me.christianrobert.ftranspile.scope.Scope;
import me.christianrobert.ftranspile.scope.SymbolAttributes;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Subroutine or function with its specification, body and contained members.
 *
 * <p>Interface bodies are represented as subroutines with an empty body.</p>
 */
public class Subroutine extends ProgramUnit {

    private final List<String> argnames;
    private final boolean isFunction;
    private final String resultName;
    private final List<String> prefix;
    private final String bind;
    private List<Node> body;
    private List<Node> members;

    public Subroutine(String name, List<String> argnames, Section spec, List<Node> body, List<Node> members,
                      Scope scope, boolean isFunction, String resultName, List<String> prefix, String bind,
                      Source source, String label) {
        super(name, spec, scope, source, label);
        this.argnames = List.copyOf(argnames);
        this.body = mutableCopy(body);
        this.members = mutableCopy(members);
        this.isFunction = isFunction;
        this.resultName = resultName;
        this.prefix = prefix != null ? List.copyOf(prefix) : List.of();
        this.bind = bind;
    }

    public List<String> getArgnames() {
        return argnames;
    }

    /**
     * Dummy arguments as symbols of this routine's scope; arrays for dimensioned arguments.
     */
    public List<TypedSymbol> getArguments() {
        List<TypedSymbol> args = new ArrayList<>();
        for (String argname : argnames) {
            SymbolAttributes attrs = getScope().lookupLocal(argname);
            if (attrs != null && attrs.isArray()) {
                args.add(new Array(argname, getScope(), null));
            } else {
                args.add(new Scalar(argname, getScope()));
            }
        }
        return args;
    }

    public List<Node> getBody() {
        return body;
    }

    /**
     * Contained subprograms (after CONTAINS) and the comments between them.
     */
    public List<Node> getMembers() {
        return members;
    }

    public List<Subroutine> getSubroutines() {
        return FindNodes.inList(members, Subroutine.class);
    }

    public boolean isFunction() {
        return isFunction;
    }

    /**
     * Explicit RESULT variable name, or null when the function name is the result.
     */
    public String getResultName() {
        return resultName;
    }

    /**
     * Prefix specifiers as written (e.g. "PURE", "RECURSIVE", "REAL(KIND=JPRB)").
     */
    public List<String> getPrefix() {
        return prefix;
    }

    /**
     * Text of the BIND(...) clause, or null.
     */
    public String getBind() {
        return bind;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitSubroutine(this);
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>();
        children.add(getSpec());
        children.addAll(body);
        children.addAll(members);
        return children;
    }

    @Override
    public void transformBodies(UnaryOperator<List<Node>> op) {
        body = mutableCopy(op.apply(body));
        members = mutableCopy(op.apply(members));
    }

    @Override
    public String toString() {
        return (isFunction ? "Function" : "Subroutine") + "{name=" + getName() + ", args=" + argnames + "}";
    }
}
