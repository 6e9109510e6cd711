package me.christianrobert.ftranspile.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Base class of all IR nodes.
 *
 * <p>Every node optionally carries its {@link Source} span and a legacy statement label.
 * The node set is closed: each concrete class dispatches to its own method of
 * {@link IrVisitor}, so every consumer handles every kind explicitly.</p>
 *
 * <p>Container nodes own their body lists; post-lowering passes rewrite bodies
 * through {@link #transformBodies(UnaryOperator)}.</p>
 */
public abstract class Node {

    private final Source source;
    private final String label;

    protected Node(Source source, String label) {
        this.source = source;
        this.label = label;
    }

    public Source getSource() {
        return source;
    }

    public String getLabel() {
        return label;
    }

    public abstract <R> R accept(IrVisitor<R> visitor);

    /**
     * Directly nested nodes, in source order. Leaf statements return an empty list.
     */
    public List<Node> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Replaces every body list owned by this node with {@code op} applied to it.
     * Leaf statements own no bodies.
     */
    public void transformBodies(UnaryOperator<List<Node>> op) {
    }

    protected static List<Node> mutableCopy(List<Node> nodes) {
        return nodes != null ? new ArrayList<>(nodes) : new ArrayList<>();
    }

    protected static List<Node> concat(List<List<Node>> lists) {
        List<Node> all = new ArrayList<>();
        for (List<Node> list : lists) {
            all.addAll(list);
        }
        return all;
    }
}
