package me.christianrobert.ftranspile.scope;

/**
 * Data type of a symbol: an intrinsic type, a derived type or a procedure.
 */
public interface DataType {

    TypeTag getTag();

    /**
     * Name of the type as written in Fortran source (e.g. "REAL", "my_type").
     */
    String getName();
}
