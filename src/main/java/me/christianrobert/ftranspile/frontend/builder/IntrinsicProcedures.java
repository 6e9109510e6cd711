package me.christianrobert.ftranspile.frontend.builder;

import java.util.Locale;
import java.util.Set;

/**
 * Names of Fortran intrinsic procedures.
 *
 * <p>Consulted only for names that have no binding in any visible scope: an unresolved
 * {@code name(args)} whose name is listed here is lowered as a call rather than as an
 * array reference.</p>
 */
public final class IntrinsicProcedures {

    private static final Set<String> NUMERIC = Set.of(
            "abs", "aimag", "aint", "anint", "ceiling", "cmplx", "conjg", "dble", "dim", "dprod",
            "floor", "int", "max", "min", "mod", "modulo", "nint", "real", "sign", "float", "sngl",
            "dabs", "dmax1", "dmin1", "amax1", "amin1", "max0", "min0", "dsign", "idint", "ifix");

    private static final Set<String> MATHEMATICAL = Set.of(
            "acos", "asin", "atan", "atan2", "cos", "cosh", "exp", "log", "log10", "sin", "sinh",
            "sqrt", "tan", "tanh", "dsqrt", "dexp", "dlog", "dcos", "dsin", "gamma", "erf", "erfc",
            "hypot");

    private static final Set<String> ARRAY = Set.of(
            "all", "any", "count", "maxval", "minval", "product", "sum", "maxloc", "minloc",
            "dot_product", "matmul", "transpose", "reshape", "spread", "pack", "unpack", "merge",
            "cshift", "eoshift", "size", "shape", "lbound", "ubound", "allocated", "associated",
            "present", "huge", "tiny", "epsilon", "kind", "selected_real_kind", "selected_int_kind",
            "precision", "range", "digits", "radix", "null");

    private static final Set<String> CHARACTER = Set.of(
            "len", "len_trim", "trim", "adjustl", "adjustr", "index", "scan", "verify", "repeat",
            "char", "ichar", "achar", "iachar", "lge", "lgt", "lle", "llt");

    private static final Set<String> BIT = Set.of(
            "iand", "ior", "ieor", "not", "ishft", "ishftc", "btest", "ibset", "ibclr", "transfer");

    /**
     * Conversions lowered as {@code Cast} instead of a generic call.
     */
    private static final Set<String> CASTS = Set.of("int", "real", "dble");

    private IntrinsicProcedures() {
    }

    public static boolean isIntrinsic(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        return NUMERIC.contains(key) || MATHEMATICAL.contains(key) || ARRAY.contains(key)
                || CHARACTER.contains(key) || BIT.contains(key);
    }

    public static boolean isCast(String name) {
        return CASTS.contains(name.toLowerCase(Locale.ROOT));
    }
}
