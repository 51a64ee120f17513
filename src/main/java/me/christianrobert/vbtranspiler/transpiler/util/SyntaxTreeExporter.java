package me.christianrobert.vbtranspiler.transpiler.util;

import me.christianrobert.vbtranspiler.transpiler.parser.SyntaxNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a syntax tree into nested maps for JSON responses and AI requests.
 *
 * <p>Output is capped: nodes below {@code maxDepth} are replaced by a
 * {@code {"type": "max_depth_reached"}} marker, only the first {@code maxChildren} children of a
 * node are exported, and node text is cut to {@code maxTextLength} characters.</p>
 */
public class SyntaxTreeExporter {

  public static final int DEFAULT_MAX_DEPTH = 50;
  public static final int DEFAULT_MAX_CHILDREN = 20;
  public static final int DEFAULT_MAX_TEXT_LENGTH = 100;

  private final int maxDepth;
  private final int maxChildren;
  private final int maxTextLength;

  public SyntaxTreeExporter() {
    this(DEFAULT_MAX_DEPTH, DEFAULT_MAX_CHILDREN, DEFAULT_MAX_TEXT_LENGTH);
  }

  public SyntaxTreeExporter(int maxDepth, int maxChildren, int maxTextLength) {
    this.maxDepth = maxDepth;
    this.maxChildren = maxChildren;
    this.maxTextLength = maxTextLength;
  }

  /**
   * Exports a tree.
   *
   * @param root Root node, may be null
   * @return Map with keys id, type, start_line, end_line, text, children; null for a null root
   */
  public Map<String, Object> export(SyntaxNode root) {
    if (root == null) {
      return null;
    }
    return exportNode(root, 0);
  }

  private Map<String, Object> exportNode(SyntaxNode node, int depth) {
    Map<String, Object> result = new LinkedHashMap<>();
    if (depth > maxDepth) {
      result.put("type", "max_depth_reached");
      return result;
    }

    result.put("id", node.getId());
    result.put("type", node.getKind());
    result.put("start_line", node.getStartLine());
    result.put("end_line", node.getEndLine());
    String text = node.getText();
    result.put("text", text.length() > maxTextLength ? text.substring(0, maxTextLength) : text);

    List<Map<String, Object>> children = new ArrayList<>();
    if (depth < maxDepth) {
      List<SyntaxNode> nodeChildren = node.getChildren();
      int limit = Math.min(nodeChildren.size(), maxChildren);
      for (int i = 0; i < limit; i++) {
        children.add(exportNode(nodeChildren.get(i), depth + 1));
      }
    }
    result.put("children", children);
    return result;
  }
}
