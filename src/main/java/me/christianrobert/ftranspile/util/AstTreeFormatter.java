package me.christianrobert.ftranspile.util;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Formats ANTLR parse trees into human-readable, indented text representation.
 *
 * <p>Useful for debugging and understanding how Fortran is parsed by the grammar.</p>
 *
 * <p>Example output (with a vocabulary):</p>
 * <pre>
 * assignmentStmt
 *   designator [x]
 *     partRef [x]
 *       name [x]
 *         "x" (NAME)
 *   "=" (ASSIGN)
 *   addExpr
 *     primaryExpr [x]
 *       ...
 *     "+" (PLUS)
 *     primaryExpr [1]
 *       ...
 *   eos [\n]
 *     "\n" (NEWLINE)
 * </pre>
 */
public class AstTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a parse tree without token type names.
   */
  public static String format(ParseTree tree) {
    return format(tree, null);
  }

  /**
   * Formats a parse tree, naming terminal tokens through the given vocabulary
   * (usually {@code FortranLexer.VOCABULARY}).
   *
   * @param tree Root of the parse tree
   * @param vocabulary Token names, may be null
   * @return Formatted string representation
   */
  public static String format(ParseTree tree, Vocabulary vocabulary) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(tree, 0, sb, vocabulary);
    return sb.toString();
  }

  private static void formatNode(ParseTree tree, int depth, StringBuilder sb, Vocabulary vocabulary) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }

    if (tree instanceof TerminalNode) {
      TerminalNode terminal = (TerminalNode) tree;
      Token symbol = terminal.getSymbol();
      String tokenName = symbol.getType() == Token.EOF ? "EOF" : getTokenName(symbol, vocabulary);

      sb.append("\"").append(escapeAndTruncate(terminal.getText())).append("\"");
      if (!tokenName.isEmpty()) {
        sb.append(" (").append(tokenName).append(")");
      }
      sb.append("\n");

    } else if (tree instanceof ParserRuleContext) {
      ParserRuleContext ctx = (ParserRuleContext) tree;
      sb.append(getRuleName(ctx));

      // Show text snippet for small nodes (helpful for identification)
      if (ctx.getChildCount() <= 2) {
        String text = ctx.getText();
        if (text.length() <= 30) {
          sb.append(" [").append(escapeAndTruncate(text)).append("]");
        }
      }
      sb.append("\n");

      for (int i = 0; i < ctx.getChildCount(); i++) {
        formatNode(ctx.getChild(i), depth + 1, sb, vocabulary);
      }

    } else {
      sb.append("(unknown: ").append(tree.getClass().getSimpleName()).append(")\n");
    }
  }

  /**
   * Rule name from the context class, without its "Context" suffix and spelled like the grammar rule.
   */
  private static String getRuleName(ParserRuleContext ctx) {
    String className = ctx.getClass().getSimpleName();
    if (className.endsWith("Context")) {
      className = className.substring(0, className.length() - "Context".length());
    }
    if (className.isEmpty()) {
      return className;
    }
    return Character.toLowerCase(className.charAt(0)) + className.substring(1);
  }

  private static String getTokenName(Token symbol, Vocabulary vocabulary) {
    if (vocabulary == null) {
      return "";
    }
    String name = vocabulary.getSymbolicName(symbol.getType());
    return name != null ? name : "";
  }

  static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }

    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");

    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }

    return text;
  }
}
