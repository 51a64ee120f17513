package me.christianrobert.vbtranspiler.transpiler.parser;

import me.christianrobert.vbtranspiler.core.model.Language;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineStructureParserTest {

    private final LineStructureParser parser = new LineStructureParser();

    @Test
    void parse_vbClassWithFunction() {
        String code = """
                Public Class Calculator
                    Public Function Add(a As Integer, b As Integer) As Integer
                        Return a + b
                    End Function
                End Class""";

        ParseResult result = parser.parse(code, Language.VBNET);

        assertTrue(result.isAvailable());
        assertTrue(result.isSuccess());
        SyntaxNode root = result.getTree();
        assertEquals(SyntaxNode.COMPILATION_UNIT, root.getKind());
        assertEquals(1, root.getChildCount());

        SyntaxNode classNode = root.getChildren().get(0);
        assertEquals("class_declaration", classNode.getKind());
        assertEquals("Public Class Calculator", classNode.getText());
        assertEquals(1, classNode.getStartLine());
        assertEquals(5, classNode.getEndLine());

        SyntaxNode method = classNode.getChildren().get(0);
        assertEquals("method_declaration", method.getKind());
        assertEquals(2, method.getStartLine());
        assertEquals(4, method.getEndLine());
        assertEquals(1, method.getChildCount());
        assertEquals("statement", method.getChildren().get(0).getKind());
        assertEquals("Return a + b", method.getChildren().get(0).getText());
    }

    @Test
    void parse_csharpNestedBlocks() {
        String code = """
                public class Counter {
                    private int _x;
                    public void Run() {
                        if (_x > 0) {
                            _x--;
                        }
                    }
                }""";

        ParseResult result = parser.parse(code, Language.CSHARP);

        assertTrue(result.isSuccess());
        SyntaxNode classNode = result.getTree().getChildren().get(0);
        assertEquals("class_declaration", classNode.getKind());
        assertEquals(2, classNode.getChildCount());
        assertEquals("field_declaration", classNode.getChildren().get(0).getKind());

        SyntaxNode method = classNode.getChildren().get(1);
        assertEquals("method_declaration", method.getKind());
        SyntaxNode ifNode = method.getChildren().get(0);
        assertEquals("if_statement", ifNode.getKind());
        assertEquals(4, ifNode.getStartLine());
        assertEquals(6, ifNode.getEndLine());
    }

    @Test
    void parse_commentsBecomeNodes() {
        ParseResult result = parser.parse("' note\nDim x As Integer", Language.VBNET);

        assertEquals("comment", result.getTree().getChildren().get(0).getKind());
        assertEquals("statement", result.getTree().getChildren().get(1).getKind());
    }

    @Test
    void parse_unclosedBlocksEndAtLastLine() {
        String code = """
                Public Class A
                    Public Sub Run()""";

        ParseResult result = parser.parse(code, Language.VBNET);

        assertTrue(result.isSuccess());
        SyntaxNode classNode = result.getTree().getChildren().get(0);
        assertEquals(2, classNode.getEndLine());
        assertEquals(2, classNode.getChildren().get(0).getEndLine());
    }

    @Test
    void parse_unmatchedCloserIgnored() {
        ParseResult result = parser.parse("End If\nx = 1", Language.VBNET);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getTree().getChildCount());
    }

    @Test
    void parse_nodeIdsAreSequential() {
        ParseResult result = parser.parse("Public Class A\nEnd Class", Language.VBNET);

        assertEquals("n1", result.getTree().getId());
        assertEquals("n2", result.getTree().getChildren().get(0).getId());
    }

    @Test
    void parse_blankInputFails() {
        ParseResult result = parser.parse("   \n  ", Language.CSHARP);

        assertTrue(result.isAvailable());
        assertFalse(result.isSuccess());
        assertEquals("Empty source code", result.getErrorMessage());
    }
}
