package me.christianrobert.vbtranspiler.transpiler.validation;

import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.transpiler.rewrite.BlockFrame;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteOutcome;
import me.christianrobert.vbtranspiler.transpiler.syntax.BlockKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TranspileValidatorTest {

    private final TranspileValidator validator = new TranspileValidator();

    // ========== Rewrite validation ==========

    @Test
    void validateRewrite_openFramesAreErrors() {
        RewriteOutcome outcome = new RewriteOutcome("public class A {\n    public void Run() {", List.of(), List.of(
                new BlockFrame(BlockKind.CLASS, 1, "Class", "A"),
                new BlockFrame(BlockKind.METHOD, 2, "Sub", "Run")));

        ValidationReport report = validator.validateRewrite("Public Class A\n    Public Sub Run()", outcome,
                Language.VBNET, Language.CSHARP);

        assertFalse(report.isValid());
        assertEquals(List.of("unclosed block started at line 1", "unclosed block started at line 2"),
                report.getErrorMessages());
        assertEquals(1, report.getErrors().get(0).getLine());
        assertEquals(2, report.getErrors().get(1).getLine());
    }

    @Test
    void validateRewrite_leftoverSourceTokens() {
        RewriteOutcome outcome = new RewriteOutcome("var x = 1;\nDim y As Integer", List.of(), List.of());

        ValidationReport report = validator.validateRewrite("Dim x = 1\nDim y As Integer", outcome,
                Language.VBNET, Language.CSHARP);

        assertTrue(report.isValid());
        assertEquals(List.of("leftover VB.NET token 'Dim' at output line 2"), report.getWarningMessages());
        assertEquals(2, report.getWarnings().get(0).getLine());
    }

    @Test
    void validateRewrite_ignoresCommentsAndStrings() {
        RewriteOutcome outcome = new RewriteOutcome("var s = \"End If\"; // Dim", List.of(), List.of());

        ValidationReport report = validator.validateRewrite("Dim s = \"End If\" ' Dim", outcome,
                Language.VBNET, Language.CSHARP);

        assertTrue(report.getWarnings().isEmpty(), "Unexpected warnings: " + report.getWarningMessages());
    }

    @Test
    void validateRewrite_emptyOutputIsError() {
        RewriteOutcome outcome = new RewriteOutcome("", List.of(), List.of());

        ValidationReport report = validator.validateRewrite("Public Class A", outcome, Language.VBNET, Language.CSHARP);

        assertEquals(List.of("no output produced"), report.getErrorMessages());
        assertEquals(0, report.getErrors().get(0).getLine());
    }

    @Test
    void validateRewrite_csharpTokensInVb() {
        RewriteOutcome outcome = new RewriteOutcome("Dim x = 1;", List.of(), List.of());

        ValidationReport report = validator.validateRewrite("var x = 1;", outcome, Language.CSHARP, Language.VBNET);

        assertEquals(1, report.getWarnings().size());
        assertTrue(report.getWarningMessages().get(0).startsWith("leftover C# token"));
    }

    // ========== Source validation ==========

    @Test
    void validateSource_balancedCode() {
        String code = """
                Public Class Calculator
                    Public Function Add(a As Integer, b As Integer) As Integer
                        Return a + b
                    End Function
                End Class""";

        ValidationReport report = validator.validateSource(code, Language.VBNET);

        assertTrue(report.isValid());
        assertTrue(report.getWarnings().isEmpty());
    }

    @Test
    void validateSource_oneErrorPerUnclosedBlock() {
        String code = """
                Public Class A
                    Public Sub Run()
                        If x Then""";

        ValidationReport report = validator.validateSource(code, Language.VBNET);

        assertEquals(List.of("unclosed block started at line 1", "unclosed block started at line 2",
                "unclosed block started at line 3"), report.getErrorMessages());
    }

    @Test
    void validateSource_closerSkipsInnerBlock() {
        String code = """
                Public Class A
                    Public Sub Run()
                End Class""";

        ValidationReport report = validator.validateSource(code, Language.VBNET);

        assertEquals(List.of("unclosed block started at line 2"), report.getErrorMessages());
    }

    @Test
    void validateSource_unmatchedCloserAndShortCode() {
        ValidationReport report = validator.validateSource("}", Language.CSHARP);

        assertEquals(List.of("unmatched closer at line 1"), report.getErrorMessages());
        assertEquals(List.of("Code is very short"), report.getWarningMessages());
        assertEquals(0, report.getWarnings().get(0).getLine());
    }

    @Test
    void validateSource_unmatchedContinuationIsWarning() {
        String code = """
                Else
                total = total + 1""";

        ValidationReport report = validator.validateSource(code, Language.VBNET);

        assertTrue(report.isValid());
        assertEquals(List.of("unmatched continuation at line 1"), report.getWarningMessages());
    }

    @Test
    void validateSource_emptyCode() {
        ValidationReport report = validator.validateSource("  ", Language.CSHARP);

        assertFalse(report.isValid());
        assertEquals(List.of("Empty source code"), report.getErrorMessages());
    }
}
