package me.christianrobert.kugelblitz.translator.util;

import me.christianrobert.kugelblitz.translator.ast.SyntaxNode;

/**
 * Formats syntax trees into human-readable, indented text representation.
 *
 * <p>Useful for debugging and understanding which tree a front end delivered.</p>
 *
 * <p>Example output:</p>
 * <pre>
 * MODULE
 *   FUNCTION_DEF [add(a, b)]
 *     RETURN
 *       BIN_OP
 *         NAME [a]
 *         OPERATOR [ADD]
 *         NAME [b]
 * </pre>
 */
public class SyntaxTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_LABEL_LENGTH = 50;

  /**
   * Formats a syntax tree into human-readable text.
   *
   * @param tree Root of the syntax tree
   * @return Formatted string representation
   */
  public static String format(SyntaxNode tree) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(tree, 0, sb);
    return sb.toString();
  }

  private static void formatNode(SyntaxNode node, int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }

    sb.append(node.getKind() != null ? node.getKind().name() : node.getClass().getSimpleName());

    String label = node.getLabel();
    if (label != null) {
      sb.append(" [").append(escapeAndTruncate(label)).append("]");
    }
    sb.append("\n");

    for (SyntaxNode child : node.getChildren()) {
      formatNode(child, depth + 1, sb);
    }
  }

  /**
   * Escapes and truncates text for display.
   */
  private static String escapeAndTruncate(String text) {
    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");

    if (text.length() > MAX_LABEL_LENGTH) {
      text = text.substring(0, MAX_LABEL_LENGTH) + "...";
    }

    return text;
  }
}
