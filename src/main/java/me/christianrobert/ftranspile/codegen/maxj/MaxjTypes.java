package me.christianrobert.ftranspile.codegen.maxj;

import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.IntLiteral;
import me.christianrobert.ftranspile.expression.Scalar;
import me.christianrobert.ftranspile.scope.SymbolAttributes;
import me.christianrobert.ftranspile.scope.TypeTag;

import java.util.List;

/**
 * Mapping from symbol attributes to MaxJ types.
 *
 * <pre>
 * Fortran          local (Java)   dataflow variable
 * LOGICAL          boolean        dfeBool()
 * INTEGER          int            dfeUInt(32)
 * REAL(4|real32)   float          dfeFloat(8, 24)
 * REAL             double         dfeFloat(11, 53)
 * TYPE(t)          DFEStructType t
 * </pre>
 */
final class MaxjTypes {

    private MaxjTypes() {
    }

    static boolean isSinglePrecision(Expression kind) {
        if (kind instanceof IntLiteral) {
            return ((IntLiteral) kind).getValue() == 4;
        }
        return kind instanceof Scalar && ((Scalar) kind).getName().equals("real32");
    }

    /**
     * Java type of a value that lives in kernel-local memory.
     */
    static String localType(SymbolAttributes type) {
        if (type.getTag() == TypeTag.DERIVED) {
            return "DFEStructType " + type.getDtype().getName();
        }
        String base = switch (type.getTag()) {
            case LOGICAL -> "boolean";
            case INTEGER -> "int";
            case REAL -> isSinglePrecision(type.getKind()) ? "float" : "double";
            case CHARACTER -> "String";
            default -> type.getDtype().getName();
        };
        return type.isArray() ? base + "[]".repeat(type.getShape().size()) : base;
    }

    /**
     * Hardware type of a dataflow variable.
     */
    static String dfeType(TypeTag tag, Expression kind) {
        return switch (tag) {
            case LOGICAL -> "dfeBool()";
            case INTEGER -> "dfeUInt(32)";
            case REAL -> isSinglePrecision(kind) ? "dfeFloat(8, 24)" : "dfeFloat(11, 53)";
            default -> throw new IllegalArgumentException("No dataflow type for " + tag);
        };
    }

    /**
     * Declared type of a stream: {@code DFEVar} wrapped in one {@code DFEVector} per dimension.
     */
    static String streamType(SymbolAttributes type) {
        if (type.getTag() == TypeTag.DERIVED) {
            return "DFEStructType " + type.getDtype().getName();
        }
        List<Expression> shape = type.isArray() ? type.getShape() : List.of();
        String result = "DFEVar";
        for (int i = 0; i < shape.size(); i++) {
            result = "DFEVector<" + result + ">";
        }
        return result;
    }

    static String declaredType(SymbolAttributes type) {
        return type.isStream() ? streamType(type) : localType(type);
    }
}
