package me.christianrobert.ftranspile.service;

import me.christianrobert.ftranspile.codegen.CodegenException;
import me.christianrobert.ftranspile.frontend.context.LoweringException;

/**
 * Result of a transpilation.
 * Contains either the generated code or an error message.
 * Optionally includes the lowered IR tree for debugging.
 */
public class TranspileResult {

    private final boolean success;
    private final Target target;
    private final String output;
    private final String errorMessage;
    private final String fortranSource;
    private final String irTree;  // Optional IR tree representation (null by default)

    private TranspileResult(boolean success, Target target, String output, String errorMessage,
                            String fortranSource, String irTree) {
        this.success = success;
        this.target = target;
        this.output = output;
        this.errorMessage = errorMessage;
        this.fortranSource = fortranSource;
        this.irTree = irTree;
    }

    public static TranspileResult success(String fortranSource, Target target, String output) {
        return new TranspileResult(true, target, output, null, fortranSource, null);
    }

    /**
     * Creates a successful result carrying the IR tree.
     */
    public static TranspileResult successWithIr(String fortranSource, Target target, String output, String irTree) {
        return new TranspileResult(true, target, output, null, fortranSource, irTree);
    }

    public static TranspileResult failure(String fortranSource, Target target, String errorMessage) {
        return new TranspileResult(false, target, null, errorMessage, fortranSource, null);
    }

    /**
     * Creates a failed result from a lowering error.
     */
    public static TranspileResult failure(String fortranSource, Target target, LoweringException exception) {
        return new TranspileResult(false, target, null, exception.getDetailedMessage(), fortranSource, null);
    }

    /**
     * Creates a failed result from a code generation error, keeping the IR tree that was built.
     */
    public static TranspileResult failureWithIr(String fortranSource, Target target, CodegenException exception,
                                                String irTree) {
        return new TranspileResult(false, target, null, exception.getDetailedMessage(), fortranSource, irTree);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public Target getTarget() {
        return target;
    }

    public String getOutput() {
        return output;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getFortranSource() {
        return fortranSource;
    }

    public String getIrTree() {
        return irTree;
    }

    public boolean hasIrTree() {
        return irTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "TranspileResult{success=true, target=" + target + ", output='" + output + "'" +
                   (irTree != null ? ", hasIrTree=true" : "") + "}";
        } else {
            return "TranspileResult{success=false, target=" + target + ", error='" + errorMessage + "'" +
                   (irTree != null ? ", hasIrTree=true" : "") + "}";
        }
    }
}
