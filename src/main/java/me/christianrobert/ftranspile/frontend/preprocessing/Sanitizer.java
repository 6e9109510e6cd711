package me.christianrobert.ftranspile.frontend.preprocessing;

import me.christianrobert.ftranspile.ir.Comment;
import me.christianrobert.ftranspile.ir.CommentBlock;
import me.christianrobert.ftranspile.ir.FindNodes;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.Pragma;
import me.christianrobert.ftranspile.ir.Source;

import java.util.ArrayList;
import java.util.List;

/**
 * Clean-up passes run on every lowered file.
 *
 * <ul>
 *   <li>{@link #clusterComments}: runs of two or more consecutive comment lines become one
 *       {@link CommentBlock}</li>
 *   <li>{@link #combineMultilinePragmas}: a pragma ending in {@code &} absorbs the following
 *       pragma with the same keyword, e.g. a multi-line {@code !$acc} directive</li>
 * </ul>
 */
public final class Sanitizer {

    private Sanitizer() {
    }

    public static Node sanitize(Node ir) {
        FindNodes.transformAllBodies(ir, Sanitizer::combineMultilinePragmas);
        FindNodes.transformAllBodies(ir, Sanitizer::clusterComments);
        return ir;
    }

    static List<Node> clusterComments(List<Node> body) {
        List<Node> result = new ArrayList<>();
        List<Comment> run = new ArrayList<>();
        for (Node node : body) {
            if (node instanceof Comment && isAdjacent(run, node)) {
                run.add((Comment) node);
                continue;
            }
            flush(run, result);
            if (node instanceof Comment) {
                run.add((Comment) node);
            } else {
                result.add(node);
            }
        }
        flush(run, result);
        return result;
    }

    private static boolean isAdjacent(List<Comment> run, Node next) {
        if (run.isEmpty()) {
            return false;
        }
        Source previous = run.get(run.size() - 1).getSource();
        Source current = next.getSource();
        if (previous == null || current == null) {
            return true;
        }
        return current.getLineStart() == previous.getLineEnd() + 1;
    }

    private static void flush(List<Comment> run, List<Node> result) {
        if (run.size() == 1) {
            result.add(run.get(0));
        } else if (run.size() > 1) {
            Source first = run.get(0).getSource();
            Source last = run.get(run.size() - 1).getSource();
            Source span = first != null && last != null
                    ? new Source(first.getLineStart(), last.getLineEnd(), joinText(run))
                    : null;
            result.add(new CommentBlock(new ArrayList<>(run), span));
        }
        run.clear();
    }

    private static String joinText(List<Comment> run) {
        StringBuilder sb = new StringBuilder();
        for (Comment comment : run) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(comment.getText());
        }
        return sb.toString();
    }

    static List<Node> combineMultilinePragmas(List<Node> body) {
        List<Node> result = new ArrayList<>();
        Pragma pending = null;
        for (Node node : body) {
            if (pending != null && node instanceof Pragma
                    && ((Pragma) node).getKeyword().equals(pending.getKeyword())) {
                pending = merge(pending, (Pragma) node);
            } else {
                if (pending != null) {
                    result.add(pending);
                    pending = null;
                }
                if (!(node instanceof Pragma)) {
                    result.add(node);
                    continue;
                }
                pending = (Pragma) node;
            }
            if (!pending.getContent().endsWith("&")) {
                result.add(pending);
                pending = null;
            }
        }
        if (pending != null) {
            result.add(pending);
        }
        return result;
    }

    private static Pragma merge(Pragma head, Pragma tail) {
        String content = head.getContent().substring(0, head.getContent().length() - 1).trim();
        String continued = tail.getContent();
        if (continued.startsWith("&")) {
            continued = continued.substring(1).trim();
        }
        Source source = null;
        if (head.getSource() != null && tail.getSource() != null) {
            source = new Source(head.getSource().getLineStart(), tail.getSource().getLineEnd(),
                    head.getSource().getString() + "\n" + tail.getSource().getString());
        }
        return new Pragma(head.getKeyword(), content + " " + continued, source);
    }
}
