package me.christianrobert.ftranspile.codegen;

/**
 * Binding strength of expression operators, weakest first.
 *
 * <p>A sub-expression is parenthesised when the precedence of its context is
 * stronger than its own.</p>
 */
public enum Precedence {
    NONE,
    LOGICAL_EQUIV,
    LOGICAL_OR,
    LOGICAL_AND,
    LOGICAL_NOT,
    COMPARISON,
    CONCAT,
    SUM,
    PRODUCT,
    POWER,
    CALL;

    public boolean bindsTighterThan(Precedence other) {
        return compareTo(other) > 0;
    }
}
