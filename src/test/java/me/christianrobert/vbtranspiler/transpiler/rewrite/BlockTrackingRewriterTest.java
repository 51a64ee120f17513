package me.christianrobert.vbtranspiler.transpiler.rewrite;

import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.transpiler.rewrite.dialect.VbToCSharpDialect;
import me.christianrobert.vbtranspiler.transpiler.syntax.BlockKind;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteRule.closer;
import static me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteRule.rule;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the generic rewriting loop against a small hand-made VB.NET to C# table.
 */
class BlockTrackingRewriterTest {

    private final RuleTable table = new RuleTable(Language.VBNET, Language.CSHARP, List.of(
            rule("^Class\\s+(\\w+)$", "class {1}").push(BlockKind.CLASS, "Class").named(1),
            rule("^If\\s+(.+?)\\s+Then$", "if ({1})").push(BlockKind.CONDITIONAL, "If"),
            rule("^Else$", "} else {").reopen(BlockKind.CONDITIONAL),
            closer("^End\\s+If$", BlockKind.CONDITIONAL),
            closer("^End\\s+Class$", BlockKind.CLASS),
            rule("^Return\\s+(.+)$", "return {1};"),
            rule("^Dim\\s+(\\w+)$", "var {1};")
    ), Collections.emptyList(), new VbToCSharpDialect(), null);

    private final BlockTrackingRewriter rewriter = new BlockTrackingRewriter();

    @Test
    void rewrite_nestedBlocks() {
        String source = """
                Class Foo
                If x Then
                Return 1
                Else
                Return 2
                End If
                End Class""";

        RewriteOutcome outcome = rewriter.rewrite(source, table);

        String expected = """
                class Foo {
                    if (x) {
                        return 1;
                    } else {
                        return 2;
                    }
                }""";
        assertEquals(expected, outcome.getCode());
        assertTrue(outcome.getWarnings().isEmpty(), "Unexpected warnings: " + outcome.getWarnings());
        assertTrue(outcome.isBalanced());
    }

    @Test
    void rewrite_caseInsensitiveRules() {
        RewriteOutcome outcome = rewriter.rewrite("CLASS Foo\nend class", table);

        assertEquals("class Foo {\n}", outcome.getCode());
        assertTrue(outcome.isBalanced());
    }

    @Test
    void rewrite_unmatchedLinePassedThrough() {
        String source = """
                Class Foo
                Stop
                End Class""";

        RewriteOutcome outcome = rewriter.rewrite(source, table);

        String[] lines = outcome.getCode().split("\n");
        assertEquals(3, lines.length);
        assertEquals("    Stop", lines[1]);
        assertEquals(1, outcome.getWarnings().size());
        assertEquals("no rule matched at line 2, passed through verbatim: Stop", outcome.getWarnings().get(0));
        assertTrue(outcome.isBalanced());
    }

    @Test
    void rewrite_unclosedBlocksLeftOnStack() {
        String source = """
                Class Foo
                If x Then
                Return 1""";

        RewriteOutcome outcome = rewriter.rewrite(source, table);

        assertFalse(outcome.isBalanced());
        assertEquals(2, outcome.getOpenFrames().size());
        assertEquals(1, outcome.getOpenFrames().get(0).getOpenedAtLine());
        assertEquals("Foo", outcome.getOpenFrames().get(0).getName());
        assertEquals(2, outcome.getOpenFrames().get(1).getOpenedAtLine());
    }

    @Test
    void rewrite_unmatchedCloser() {
        RewriteOutcome outcome = rewriter.rewrite("End If", table);

        assertEquals("End If", outcome.getCode());
        assertEquals(List.of("unmatched closer at line 1"), outcome.getWarnings());
    }

    @Test
    void rewrite_mismatchedCloserClosesNearestFrame() {
        String source = """
                Class Foo
                If x Then
                End Class""";

        RewriteOutcome outcome = rewriter.rewrite(source, table);

        assertEquals(1, outcome.getWarnings().size());
        assertTrue(outcome.getWarnings().get(0).startsWith("mismatched closer at line 3"));
        assertEquals(1, outcome.getOpenFrames().size());
        assertEquals(BlockKind.CONDITIONAL, outcome.getOpenFrames().get(0).getKind());
    }

    @Test
    void rewrite_unmatchedContinuation() {
        RewriteOutcome outcome = rewriter.rewrite("Else", table);

        assertEquals(List.of("unmatched continuation at line 1"), outcome.getWarnings());
    }

    @Test
    void rewrite_commentsUseTargetLeader() {
        String source = """
                ' greeting
                Return 1 ' one""";

        RewriteOutcome outcome = rewriter.rewrite(source, table);

        String[] lines = outcome.getCode().split("\n");
        assertEquals("// greeting", lines[0]);
        assertEquals("return 1; // one", lines[1]);
    }

    @Test
    void rewrite_blankLinesKept() {
        RewriteOutcome outcome = rewriter.rewrite("Dim a\n\nDim b", table);

        assertEquals("var a;\n\nvar b;", outcome.getCode());
    }

    @Test
    void rewrite_customIndentSize() {
        RewriteOutcome outcome = new BlockTrackingRewriter(2).rewrite("Class Foo\nDim a\nEnd Class", table);

        assertEquals("class Foo {\n  var a;\n}", outcome.getCode());
    }

    @Test
    void rewrite_initialStackIsNotModified() {
        BlockStack initial = new BlockStack();
        initial.push(new BlockFrame(BlockKind.CLASS, 1, "Class", "Outer"));

        RewriteOutcome outcome = rewriter.rewrite("End Class", table, initial);

        assertTrue(outcome.isBalanced());
        assertEquals(1, initial.size());
    }

    @Test
    void rewrite_nullSource() {
        RewriteOutcome outcome = rewriter.rewrite(null, table);

        assertEquals("", outcome.getCode());
        assertTrue(outcome.isBalanced());
    }
}
