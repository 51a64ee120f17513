package me.christianrobert.vbtranspiler.transpiler.util;

import me.christianrobert.vbtranspiler.transpiler.parser.SyntaxNode;

/**
 * Formats syntax trees into human-readable, indented text representation.
 *
 * <p>Useful for debugging and for showing how source code was structured by the parser.</p>
 *
 * <p>Example output:</p>
 * <pre>
 * compilation_unit (1-5)
 *   class_declaration (1-5) [Public Class Calculator]
 *     method_declaration (2-4) [Public Function Add(a As Integer, b As Integer) As Integer]
 *       statement (3) [Return a + b]
 * </pre>
 */
public class AstTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 80;

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

    sb.append(node.getKind());
    sb.append(" (").append(node.getStartLine());
    if (node.getEndLine() != node.getStartLine()) {
      sb.append("-").append(node.getEndLine());
    }
    sb.append(")");

    if (!node.getText().isEmpty()) {
      sb.append(" [").append(escapeAndTruncate(node.getText())).append("]");
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

    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }
    return text;
  }
}
