package me.christianrobert.ftranspile.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Generic traversal helpers over the IR tree.
 */
public final class FindNodes {

    private FindNodes() {
    }

    /**
     * All nodes of the given type below (and including) {@code root}, in pre-order.
     */
    public static <T extends Node> List<T> find(Node root, Class<T> type) {
        List<T> result = new ArrayList<>();
        walk(root, node -> {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        });
        return result;
    }

    /**
     * Direct members of a list that have the given type; no recursion.
     */
    public static <T extends Node> List<T> inList(List<Node> nodes, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Node node : nodes) {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        }
        return result;
    }

    public static void walk(Node root, Consumer<Node> action) {
        if (root == null) {
            return;
        }
        action.accept(root);
        for (Node child : root.getChildren()) {
            walk(child, action);
        }
    }

    /**
     * Applies {@code op} to every body list in the tree, innermost bodies first.
     */
    public static void transformAllBodies(Node root, UnaryOperator<List<Node>> op) {
        for (Node child : root.getChildren()) {
            transformAllBodies(child, op);
        }
        root.transformBodies(op);
    }
}
