package me.christianrobert.ftranspile.frontend.context;

import me.christianrobert.ftranspile.ir.Source;

/**
 * No lowering handler exists for a parse-tree construct, and strict mode is enabled.
 * In lenient mode the same situation degrades to an opaque passthrough node instead.
 */
public class UnsupportedConstructException extends LoweringException {

    public UnsupportedConstructException(String message, String construct, Source source) {
        super(message, construct, source);
    }
}
