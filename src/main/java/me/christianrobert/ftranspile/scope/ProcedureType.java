package me.christianrobert.ftranspile.scope;

/**
 * Type of a symbol naming a subroutine or function.
 *
 * <p>A function declared through a typed {@code EXTERNAL} entity keeps its declared
 * return type; kind and length selectors stay on the symbol's attributes.</p>
 */
public class ProcedureType implements DataType {

    private final String name;
    private final boolean function;
    private final DataType returnType;

    public ProcedureType(String name, boolean function) {
        this.name = name;
        this.function = function;
        this.returnType = null;
    }

    /**
     * A function with a known return type.
     */
    public ProcedureType(String name, DataType returnType) {
        if (returnType == null) {
            throw new IllegalArgumentException("Return type of function " + name + " cannot be null");
        }
        this.name = name;
        this.function = true;
        this.returnType = returnType;
    }

    @Override
    public TypeTag getTag() {
        return TypeTag.PROCEDURE;
    }

    @Override
    public String getName() {
        return name;
    }

    public boolean isFunction() {
        return function;
    }

    /**
     * Declared return type, or null for subroutines and functions whose type is not known here.
     */
    public DataType getReturnType() {
        return returnType;
    }

    @Override
    public String toString() {
        return "ProcedureType{name=" + name + ", function=" + function
                + (returnType != null ? ", returns=" + returnType.getName() : "") + "}";
    }
}
