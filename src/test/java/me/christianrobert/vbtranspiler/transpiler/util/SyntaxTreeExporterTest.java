package me.christianrobert.vbtranspiler.transpiler.util;

import me.christianrobert.vbtranspiler.transpiler.parser.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxTreeExporterTest {

  private static SyntaxNode leaf(String id, String text, int line) {
    return new SyntaxNode(id, "statement", text, line, line, List.of());
  }

  @Test
  void export_nodeFields() {
    SyntaxNode root = new SyntaxNode("n1", SyntaxNode.COMPILATION_UNIT, "", 1, 2,
        List.of(leaf("n2", "x = 1", 1), leaf("n3", "y = 2", 2)));

    Map<String, Object> exported = new SyntaxTreeExporter().export(root);

    assertEquals("n1", exported.get("id"));
    assertEquals("compilation_unit", exported.get("type"));
    assertEquals(1, exported.get("start_line"));
    assertEquals(2, exported.get("end_line"));
    assertEquals("", exported.get("text"));
    List<?> children = (List<?>) exported.get("children");
    assertEquals(2, children.size());
    assertEquals("x = 1", ((Map<?, ?>) children.get(0)).get("text"));
  }

  @Test
  void export_limitsChildrenAndText() {
    List<SyntaxNode> leaves = new ArrayList<>();
    for (int i = 1; i <= 5; i++) {
      leaves.add(leaf("c" + i, "statement number " + i, i));
    }
    SyntaxNode root = new SyntaxNode("n1", SyntaxNode.COMPILATION_UNIT, "", 1, 5, leaves);

    Map<String, Object> exported = new SyntaxTreeExporter(50, 3, 9).export(root);

    List<?> children = (List<?>) exported.get("children");
    assertEquals(3, children.size());
    assertEquals("statement", ((Map<?, ?>) children.get(0)).get("text"));
  }

  @Test
  void export_depthLimit() {
    SyntaxNode deep = new SyntaxNode("n3", "statement", "x", 3, 3, List.of());
    SyntaxNode middle = new SyntaxNode("n2", "block", "b", 2, 3, List.of(deep));
    SyntaxNode root = new SyntaxNode("n1", SyntaxNode.COMPILATION_UNIT, "", 1, 3, List.of(middle));

    Map<String, Object> exported = new SyntaxTreeExporter(1, 20, 100).export(root);

    Map<?, ?> middleExport = (Map<?, ?>) ((List<?>) exported.get("children")).get(0);
    assertEquals("block", middleExport.get("type"));
    assertTrue(((List<?>) middleExport.get("children")).isEmpty());
  }

  @Test
  void export_nullRoot() {
    assertNull(new SyntaxTreeExporter().export(null));
  }
}
