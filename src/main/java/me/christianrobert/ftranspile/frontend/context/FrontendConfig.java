package me.christianrobert.ftranspile.frontend.context;

/**
 * Settings threaded explicitly through one lowering run.
 *
 * <p>{@code strictMode} decides what happens with constructs that have no lowering
 * handler: fail the whole file (strict) or keep their source text as an opaque
 * passthrough node and log a warning (lenient).</p>
 */
public class FrontendConfig {

    private static final FrontendConfig LENIENT = new FrontendConfig(false);
    private static final FrontendConfig STRICT = new FrontendConfig(true);

    private final boolean strictMode;

    private FrontendConfig(boolean strictMode) {
        this.strictMode = strictMode;
    }

    public static FrontendConfig lenient() {
        return LENIENT;
    }

    public static FrontendConfig strict() {
        return STRICT;
    }

    public static FrontendConfig of(boolean strictMode) {
        return strictMode ? STRICT : LENIENT;
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    @Override
    public String toString() {
        return "FrontendConfig{strictMode=" + strictMode + "}";
    }
}
