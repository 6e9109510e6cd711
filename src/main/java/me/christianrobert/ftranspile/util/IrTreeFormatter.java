package me.christianrobert.ftranspile.util;

import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.Source;

/**
 * Formats IR trees as indented text, one node per line with its source lines.
 *
 * <pre>
 * SourceFile{path=null, units=1} @1-4
 *   Subroutine{name=foo, args=[x]} @1-4
 *     Section{...} @2-2
 *     Assignment{lhs=Scalar{name=x}, ptr=false} @3-3
 * </pre>
 */
public class IrTreeFormatter {

  private static final String INDENT = "  ";

  public static String format(Node root) {
    if (root == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(root, 0, sb);
    return sb.toString();
  }

  private static void formatNode(Node node, int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
    sb.append(AstTreeFormatter.escapeAndTruncate(String.valueOf(node)));
    Source source = node.getSource();
    if (source != null) {
      sb.append(" @").append(source.getLineStart()).append("-").append(source.getLineEnd());
    }
    sb.append("\n");
    for (Node child : node.getChildren()) {
      formatNode(child, depth + 1, sb);
    }
  }
}
