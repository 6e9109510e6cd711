package me.christianrobert.ftranspile.frontend.context;

/**
 * An operator token matches no known arithmetic, logical, relational or string operator.
 */
public class MalformedOperatorException extends LoweringException {

    private final String operator;

    public MalformedOperatorException(String operator) {
        super("Unknown operator: '" + operator + "'");
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
