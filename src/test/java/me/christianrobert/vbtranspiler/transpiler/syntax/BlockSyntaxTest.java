package me.christianrobert.vbtranspiler.transpiler.syntax;

import me.christianrobert.vbtranspiler.core.model.Language;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link KeywordBlockSyntax} and {@link BraceBlockSyntax}.
 */
class BlockSyntaxTest {

    private final BlockSyntax keyword = BlockSyntax.forLanguage(Language.VBNET);
    private final BlockSyntax brace = BlockSyntax.forLanguage(Language.CSHARP);

    private static LogicalLine line(String code) {
        return new LogicalLine(1, code, null, code);
    }

    private static BlockEvent single(List<BlockEvent> events) {
        assertEquals(1, events.size(), "Expected one event: " + events);
        return events.get(0);
    }

    private static void assertEvent(BlockEvent event, BlockEvent.Type type, BlockKind kind, String label) {
        assertEquals(type, event.getType());
        assertEquals(kind, event.getKind());
        assertEquals(label, event.getLabel());
    }

    // ========== Keyword-paired ==========

    @Test
    void keyword_openersAndClosers() {
        assertEvent(single(keyword.scan(line("Public Class Foo"), null, null)), BlockEvent.Type.OPEN, BlockKind.CLASS, "Class");
        assertEvent(single(keyword.scan(line("End Class"), null, null)), BlockEvent.Type.CLOSE, BlockKind.CLASS, "Class");
        assertEvent(single(keyword.scan(line("End Sub"), null, null)), BlockEvent.Type.CLOSE, BlockKind.METHOD, "Sub");
        assertEvent(single(keyword.scan(line("end synclock"), null, null)), BlockEvent.Type.CLOSE, BlockKind.OTHER, "SyncLock");
        assertEvent(single(keyword.scan(line("Next i"), null, null)), BlockEvent.Type.CLOSE, BlockKind.LOOP, "For");
        assertEvent(single(keyword.scan(line("Wend"), null, null)), BlockEvent.Type.CLOSE, BlockKind.LOOP, "While");
        assertEvent(single(keyword.scan(line("Select Case x"), null, null)), BlockEvent.Type.OPEN, BlockKind.CONDITIONAL, "Select");
    }

    @Test
    void keyword_continuations() {
        assertEvent(single(keyword.scan(line("Else"), null, null)), BlockEvent.Type.CONTINUE, BlockKind.CONDITIONAL, "Else");
        assertEvent(single(keyword.scan(line("ElseIf x > 1 Then"), null, null)), BlockEvent.Type.CONTINUE, BlockKind.CONDITIONAL, "ElseIf");
        assertEvent(single(keyword.scan(line("Case 1"), null, null)), BlockEvent.Type.CONTINUE, BlockKind.CONDITIONAL, "Case");
        assertEvent(single(keyword.scan(line("Catch ex As Exception"), null, null)), BlockEvent.Type.CONTINUE, BlockKind.OTHER, "Catch");
    }

    @Test
    void keyword_singleLineIfOpensNothing() {
        assertTrue(keyword.scan(line("If x Then y = 1"), null, null).isEmpty());
        assertEvent(single(keyword.scan(line("If x Then"), null, null)), BlockEvent.Type.OPEN, BlockKind.CONDITIONAL, "If");
    }

    @Test
    void keyword_proceduresWithoutBody() {
        assertTrue(keyword.scan(line("Function Foo() As Integer"), null, "Interface").isEmpty());
        assertTrue(keyword.scan(line("Public MustOverride Sub Foo()"), null, "Class").isEmpty());
        assertEvent(single(keyword.scan(line("Public Sub Foo()"), null, "Class")), BlockEvent.Type.OPEN, BlockKind.METHOD, "Sub");
    }

    @Test
    void keyword_propertyOpensOnlyWithAccessors() {
        assertTrue(keyword.scan(line("Public Property Name As String"), line("End Class"), "Class").isEmpty());
        assertEvent(single(keyword.scan(line("Public Property Name As String"), line("Get"), "Class")),
                BlockEvent.Type.OPEN, BlockKind.METHOD, "Property");
        assertEvent(single(keyword.scan(line("Get"), null, "Property")), BlockEvent.Type.OPEN, BlockKind.METHOD, "Get");
        assertEvent(single(keyword.scan(line("Public Property Get Name() As String"), null, null)),
                BlockEvent.Type.OPEN, BlockKind.METHOD, "Property");
    }

    // ========== Brace-paired ==========

    @Test
    void brace_classifiesHeaders() {
        assertEvent(single(brace.scan(line("public class A {"), null, null)), BlockEvent.Type.OPEN, BlockKind.CLASS, "class");
        assertEvent(single(brace.scan(line("if (x) {"), null, null)), BlockEvent.Type.OPEN, BlockKind.CONDITIONAL, "if");
        assertEvent(single(brace.scan(line("foreach (var i in items) {"), null, null)), BlockEvent.Type.OPEN, BlockKind.LOOP, "foreach");
        assertEvent(single(brace.scan(line("public void Run() {"), null, null)), BlockEvent.Type.OPEN, BlockKind.METHOD, "method");
        assertEvent(single(brace.scan(line("{"), null, null)), BlockEvent.Type.OPEN, BlockKind.OTHER, "block");
    }

    @Test
    void brace_closeAndContinuation() {
        BlockEvent close = single(brace.scan(line("}"), null, null));
        assertEquals(BlockEvent.Type.CLOSE, close.getType());
        assertNull(close.getKind());
        assertTrue(close.accepts(BlockKind.LOOP));

        assertEvent(single(brace.scan(line("} else {"), null, null)), BlockEvent.Type.CONTINUE, BlockKind.CONDITIONAL, "else");
        assertEvent(single(brace.scan(line("} catch (Exception e) {"), null, null)), BlockEvent.Type.CONTINUE, BlockKind.OTHER, "catch");
    }

    @Test
    void brace_inlinePropertyOpensAndCloses() {
        List<BlockEvent> events = brace.scan(line("public int X { get; set; }"), null, null);

        assertEquals(2, events.size());
        assertEvent(events.get(0), BlockEvent.Type.OPEN, BlockKind.METHOD, "property");
        assertEquals(BlockEvent.Type.CLOSE, events.get(1).getType());
    }

    @Test
    void brace_ignoresBracesInStrings() {
        assertTrue(brace.scan(line("string s = \"{\";"), null, null).isEmpty());
    }
}
