package me.christianrobert.ftranspile.scope;

import me.christianrobert.ftranspile.ir.TypeDef;

/**
 * A user-defined (derived) type.
 *
 * <p>The back-reference to the {@link TypeDef} is only available when the type
 * definition was lowered in a visible scope; types referenced through unknown
 * modules carry a name only.</p>
 */
public class DerivedType implements DataType {

    private final String name;
    private final TypeDef typedef;

    public DerivedType(String name, TypeDef typedef) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Derived type name cannot be null or empty");
        }
        this.name = name;
        this.typedef = typedef;
    }

    @Override
    public TypeTag getTag() {
        return TypeTag.DERIVED;
    }

    @Override
    public String getName() {
        return name;
    }

    public TypeDef getTypedef() {
        return typedef;
    }

    /**
     * Scope of the type's components, or null when the definition is unknown.
     */
    public Scope getComponentScope() {
        return typedef != null ? typedef.getScope() : null;
    }

    @Override
    public String toString() {
        return "DerivedType{name=" + name + ", resolved=" + (typedef != null) + "}";
    }
}
