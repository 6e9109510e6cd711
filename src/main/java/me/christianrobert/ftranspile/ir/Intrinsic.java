package me.christianrobert.ftranspile.ir;

/**
 * Opaque passthrough statement: the source text is kept and re-emitted unchanged.
 *
 * <p>Used for statements without structural meaning to the IR (I/O, jumps,
 * IMPLICIT, access statements) and, in lenient mode, for constructs that have
 * no lowering handler.</p>
 */
public class Intrinsic extends Node {

    private final String text;

    public Intrinsic(String text, Source source, String label) {
        super(source, label);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitIntrinsic(this);
    }

    @Override
    public String toString() {
        return "Intrinsic{text=" + text + "}";
    }
}
