package me.christianrobert.vbtranspiler.core.tools;

import me.christianrobert.vbtranspiler.core.model.Language;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CodeCleanerTest {

  @Test
  void removeComments_vbKeepsApostropheInString() {
    String code = "Dim s = \"it's\" ' note\nDim t = 1";

    String result = CodeCleaner.removeComments(code, Language.VBNET);

    assertEquals("Dim s = \"it's\" \nDim t = 1", result);
  }

  @Test
  void removeComments_csharpLineAndBlockComments() {
    String code = """
        int x = 1; // one
        /* block
           comment */ int y = 2;
        string s = "// not a comment";""";

    String result = CodeCleaner.removeComments(code, Language.CSHARP);

    assertFalse(result.contains("one"));
    assertFalse(result.contains("block"));
    assertTrue(result.contains("int y = 2;"));
    assertTrue(result.contains("\"// not a comment\""));
    assertEquals(4, result.split("\n", -1).length);
  }

  @Test
  void removeComments_csharpCharLiteral() {
    String result = CodeCleaner.removeComments("char c = '/'; // slash", Language.CSHARP);

    assertEquals("char c = '/'; ", result);
  }

  @Test
  void removeComments_null() {
    assertNull(CodeCleaner.removeComments(null, Language.CSHARP));
  }

  @Test
  void blankStringLiterals_keepsQuotes() {
    assertEquals("x = \"      \"", CodeCleaner.blankStringLiterals("x = \"End If\"", Language.VBNET));
    assertEquals("s = \"     \";", CodeCleaner.blankStringLiterals("s = \"{ }\\\"\";", Language.CSHARP));
  }

  @Test
  void findLineCommentStart() {
    assertEquals(10, CodeCleaner.findLineCommentStart("x = \"a'b\" ' c", Language.VBNET));
    assertEquals(14, CodeCleaner.findLineCommentStart("var s = \"//\"; // c", Language.CSHARP));
    assertEquals(-1, CodeCleaner.findLineCommentStart("Return a + b", Language.VBNET));
  }

  @Test
  void mapOutsideStrings_leavesLiteralsAlone() {
    String result = CodeCleaner.mapOutsideStrings("a = \"Nothing\" Or Nothing", Language.VBNET,
        s -> s.replace("Nothing", "null"));

    assertEquals("a = \"Nothing\" Or null", result);
  }

  @Test
  void mapOutsideStrings_verbatimString() {
    String result = CodeCleaner.mapOutsideStrings("p = @\"C:\\x\" + x", Language.CSHARP, String::toUpperCase);

    assertEquals("P = @\"C:\\x\" + X", result);
  }
}
