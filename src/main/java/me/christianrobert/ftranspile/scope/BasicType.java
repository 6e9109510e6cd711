package me.christianrobert.ftranspile.scope;

import java.util.Locale;

/**
 * Fortran intrinsic types.
 *
 * <p>COMPLEX is kept as its own constant so printers can reproduce it, but it is
 * tagged REAL since no target distinguishes it structurally.</p>
 */
public enum BasicType implements DataType {
    LOGICAL(TypeTag.LOGICAL, "LOGICAL"),
    INTEGER(TypeTag.INTEGER, "INTEGER"),
    REAL(TypeTag.REAL, "REAL"),
    COMPLEX(TypeTag.REAL, "COMPLEX"),
    CHARACTER(TypeTag.CHARACTER, "CHARACTER"),
    DEFERRED(TypeTag.DEFERRED, "DEFERRED");

    private final TypeTag tag;
    private final String fortranName;

    BasicType(TypeTag tag, String fortranName) {
        this.tag = tag;
        this.fortranName = fortranName;
    }

    @Override
    public TypeTag getTag() {
        return tag;
    }

    @Override
    public String getName() {
        return fortranName;
    }

    /**
     * Maps an intrinsic type keyword to its type. "DOUBLE PRECISION" maps to REAL;
     * callers attach kind 8 themselves.
     *
     * @param keyword type keyword in any case, whitespace tolerated
     * @return matching type, or DEFERRED for unknown keywords
     */
    public static BasicType fromString(String keyword) {
        if (keyword == null) {
            return DEFERRED;
        }
        String normalized = keyword.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        return switch (normalized) {
            case "LOGICAL" -> LOGICAL;
            case "INTEGER" -> INTEGER;
            case "REAL", "DOUBLE PRECISION" -> REAL;
            case "COMPLEX" -> COMPLEX;
            case "CHARACTER" -> CHARACTER;
            default -> DEFERRED;
        };
    }
}
