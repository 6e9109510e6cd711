package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.frontend.context.StructuralViolationException;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partitions the flat sibling list of a block construct at its marker statements.
 *
 * <p>Block constructs are parsed as a flat list of children:</p>
 * <pre>
 * [pre...] START item* (BRANCH item*)* END [post...]
 * </pre>
 * <p>The layout finds the start marker, splits the items at every branch marker
 * (ELSE IF, ELSE, CASE, ELSEWHERE) and stops at the first end marker. Anything left
 * after the end marker breaks the construct's layout and raises a
 * {@link StructuralViolationException}, as does a missing start or end marker.</p>
 */
public class ConstructLayout {

    private final List<ParseTree> pre;
    private final List<Branch> branches;
    private final ParserRuleContext end;

    private ConstructLayout(List<ParseTree> pre, List<Branch> branches, ParserRuleContext end) {
        this.pre = pre;
        this.branches = branches;
        this.end = end;
    }

    /**
     * Extracts the layout of {@code construct}.
     *
     * @param construct context whose direct children form the flat sibling list
     * @param startType class of the opening statement context
     * @param endTypes classes accepted as closing statement
     * @param branchTypes classes of intermediate markers that open a new branch
     * @param text source helper for diagnostics
     */
    public static ConstructLayout of(ParserRuleContext construct,
                                     Class<? extends ParserRuleContext> startType,
                                     List<Class<? extends ParserRuleContext>> endTypes,
                                     List<Class<? extends ParserRuleContext>> branchTypes,
                                     SourceText text) {
        String constructName = constructName(construct);
        List<ParseTree> pre = new ArrayList<>();
        List<Branch> branches = new ArrayList<>();
        List<ParseTree> post = new ArrayList<>();
        Branch current = null;
        ParserRuleContext end = null;

        for (int i = 0; i < construct.getChildCount(); i++) {
            ParseTree child = construct.getChild(i);
            if (end != null) {
                post.add(child);
            } else if (current == null) {
                if (startType.isInstance(child)) {
                    current = new Branch((ParserRuleContext) child);
                    branches.add(current);
                } else {
                    pre.add(child);
                }
            } else if (isAny(child, endTypes)) {
                end = (ParserRuleContext) child;
            } else if (isAny(child, branchTypes)) {
                current = new Branch((ParserRuleContext) child);
                branches.add(current);
            } else {
                current.items.add(child);
            }
        }

        if (current == null) {
            throw new StructuralViolationException("Start marker " + startType.getSimpleName() + " not found",
                    constructName, text.source(construct));
        }
        if (end == null) {
            throw new StructuralViolationException("End marker not found", constructName, text.source(construct));
        }
        if (!post.isEmpty()) {
            throw new StructuralViolationException(post.size() + " node(s) found after the end marker",
                    constructName, text.source(construct));
        }
        return new ConstructLayout(pre, branches, end);
    }

    private static boolean isAny(ParseTree child, List<Class<? extends ParserRuleContext>> types) {
        for (Class<? extends ParserRuleContext> type : types) {
            if (type.isInstance(child)) {
                return true;
            }
        }
        return false;
    }

    static String constructName(ParserRuleContext ctx) {
        String className = ctx.getClass().getSimpleName();
        if (className.endsWith("Context")) {
            className = className.substring(0, className.length() - "Context".length());
        }
        return Character.toLowerCase(className.charAt(0)) + className.substring(1);
    }

    /**
     * Children preceding the start marker.
     */
    public List<ParseTree> getPre() {
        return Collections.unmodifiableList(pre);
    }

    /**
     * Branches in source order; the first one is opened by the start marker.
     */
    public List<Branch> getBranches() {
        return Collections.unmodifiableList(branches);
    }

    public Branch getFirst() {
        return branches.get(0);
    }

    public ParserRuleContext getEnd() {
        return end;
    }

    /**
     * A marker statement and the items following it up to the next marker.
     */
    public static class Branch {
        private final ParserRuleContext marker;
        private final List<ParseTree> items = new ArrayList<>();

        Branch(ParserRuleContext marker) {
            this.marker = marker;
        }

        public ParserRuleContext getMarker() {
            return marker;
        }

        public List<ParseTree> getItems() {
            return Collections.unmodifiableList(items);
        }

        @Override
        public String toString() {
            return "Branch{marker=" + constructName(marker) + ", items=" + items.size() + "}";
        }
    }
}
