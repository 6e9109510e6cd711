package me.christianrobert.ftranspile.frontend.preprocessing;

import me.christianrobert.ftranspile.ir.Node;

import java.util.List;

/**
 * A source rewrite applied before parsing, paired with the IR fix-up that undoes it.
 *
 * <p>{@link #filter} may change lines the grammar cannot handle, provided it keeps the
 * number of lines, and records what it changed. After lowering, {@link #postprocess}
 * receives exactly that information and repairs the IR.</p>
 */
public interface PreprocessingRule {

    /**
     * Key under which the rule's information is collected.
     */
    String getName();

    /**
     * Rewrites {@code source}, appending one entry to {@code info} per altered line.
     */
    String filter(String source, List<PreprocessingInfo> info);

    /**
     * Repairs the lowered IR; called only when {@code info} is non-empty. Returns the
     * (possibly same) root node.
     */
    Node postprocess(Node ir, List<PreprocessingInfo> info);
}
