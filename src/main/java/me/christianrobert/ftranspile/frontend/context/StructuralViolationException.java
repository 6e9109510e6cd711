package me.christianrobert.ftranspile.frontend.context;

import me.christianrobert.ftranspile.ir.Source;

/**
 * A layout invariant of a block construct does not hold, e.g. siblings remain after the
 * construct's end marker or a labeled DO loop ends on a statement with another label.
 * Always fatal, independent of strict mode.
 */
public class StructuralViolationException extends LoweringException {

    public StructuralViolationException(String message, String construct, Source source) {
        super(message, construct, source);
    }
}
