package me.christianrobert.ftranspile.lint;

/**
 * Rule categories with increasing severity.
 */
public enum RuleType {
    INFO(1),
    WARN(2),
    SERIOUS(3),
    ERROR(4);

    private final int severity;

    RuleType(int severity) {
        this.severity = severity;
    }

    public int getSeverity() {
        return severity;
    }

    public boolean isAtLeast(RuleType other) {
        return severity >= other.severity;
    }
}
