package me.christianrobert.ftranspile.scope;

/**
 * Coarse classification of a symbol's data type.
 *
 * <p>DEFERRED marks symbols whose type could not be determined at lowering time,
 * typically names imported from a module whose definition was not supplied.</p>
 */
public enum TypeTag {
    LOGICAL,
    INTEGER,
    REAL,
    CHARACTER,
    DERIVED,
    PROCEDURE,
    DEFERRED
}
