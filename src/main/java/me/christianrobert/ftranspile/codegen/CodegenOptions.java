package me.christianrobert.ftranspile.codegen;

/**
 * Layout options shared by all code generators.
 *
 * <ul>
 *   <li>{@code linewidth} - physical line length after which a logical line is wrapped</li>
 *   <li>{@code chunking} - items per physical line when an item list is segmented</li>
 *   <li>{@code conservative} - re-use the original source text of nodes that carry it
 *       (only honoured by the Fortran generator)</li>
 * </ul>
 */
public class CodegenOptions {

    public static final int DEFAULT_LINEWIDTH = 90;
    public static final int DEFAULT_CHUNKING = 4;

    private final int linewidth;
    private final int chunking;
    private final boolean conservative;

    public CodegenOptions(int linewidth, int chunking, boolean conservative) {
        if (linewidth < 20) {
            throw new IllegalArgumentException("Line width must be at least 20, got " + linewidth);
        }
        if (chunking < 1) {
            throw new IllegalArgumentException("Chunking must be positive, got " + chunking);
        }
        this.linewidth = linewidth;
        this.chunking = chunking;
        this.conservative = conservative;
    }

    public static CodegenOptions defaults() {
        return new CodegenOptions(DEFAULT_LINEWIDTH, DEFAULT_CHUNKING, false);
    }

    public int getLinewidth() {
        return linewidth;
    }

    public int getChunking() {
        return chunking;
    }

    public boolean isConservative() {
        return conservative;
    }

    public CodegenOptions withLinewidth(int newLinewidth) {
        return new CodegenOptions(newLinewidth, chunking, conservative);
    }

    public CodegenOptions withChunking(int newChunking) {
        return new CodegenOptions(linewidth, newChunking, conservative);
    }

    public CodegenOptions withConservative(boolean newConservative) {
        return new CodegenOptions(linewidth, chunking, newConservative);
    }

    @Override
    public String toString() {
        return "CodegenOptions{linewidth=" + linewidth + ", chunking=" + chunking
                + ", conservative=" + conservative + "}";
    }
}
