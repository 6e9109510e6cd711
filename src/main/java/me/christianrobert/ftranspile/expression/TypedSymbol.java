package me.christianrobert.ftranspile.expression;

import me.christianrobert.ftranspile.scope.DerivedType;
import me.christianrobert.ftranspile.scope.Scope;
import me.christianrobert.ftranspile.scope.SymbolAttributes;
import me.christianrobert.ftranspile.scope.TypeTag;

/**
 * A named reference whose type is resolved lazily through the scope it was created in.
 *
 * <p>Component references ({@code a%b}) carry the already-lowered left-hand side as
 * {@code parent} and the combined name {@code "a%b"}. Their type is looked up under
 * the full name first and then as a component of the parent's derived type.</p>
 *
 * <p>The scope is a non-owning back-reference.</p>
 */
public abstract class TypedSymbol extends Expression {

    private final String name;
    private final Expression parent;
    private final Scope scope;

    protected TypedSymbol(String name, Expression parent, Scope scope) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name cannot be null or empty");
        }
        this.name = name;
        this.parent = parent;
        this.scope = scope;
    }

    public String getName() {
        return name;
    }

    /**
     * Last component of the name ("c" for "a%b%c").
     */
    public String getBasename() {
        int idx = name.lastIndexOf('%');
        return idx >= 0 ? name.substring(idx + 1) : name;
    }

    public Expression getParent() {
        return parent;
    }

    public Scope getScope() {
        return scope;
    }

    /**
     * Attributes bound to this name; DEFERRED when nothing resolves.
     */
    public SymbolAttributes getType() {
        if (scope != null) {
            SymbolAttributes attrs = scope.lookup(name);
            if (attrs != null) {
                return attrs;
            }
        }
        if (parent instanceof TypedSymbol) {
            SymbolAttributes parentType = ((TypedSymbol) parent).getType();
            if (parentType.getTag() == TypeTag.DERIVED) {
                Scope components = ((DerivedType) parentType.getDtype()).getComponentScope();
                if (components != null) {
                    SymbolAttributes attrs = components.lookupLocal(getBasename());
                    if (attrs != null) {
                        return attrs;
                    }
                }
            }
        }
        return SymbolAttributes.deferred();
    }
}
