package me.christianrobert.vbtranspiler.transpiler.rewrite.rules;

import me.christianrobert.vbtranspiler.transpiler.rewrite.BlockTrackingRewriter;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteOutcome;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RuleTable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VbNetToCSharpRulesTest {

    private final RuleTable table = new VbNetToCSharpRules().createTable();
    private final BlockTrackingRewriter rewriter = new BlockTrackingRewriter();

    @Test
    void rewrite_classWithFunction() {
        String source = """
                Public Class Calculator
                    Public Function Add(a As Integer, b As Integer) As Integer
                        Return a + b
                    End Function
                End Class""";

        RewriteOutcome outcome = rewriter.rewrite(source, table);

        String expected = """
                public class Calculator {
                    public int Add(int a, int b) {
                        return a + b;
                    }
                }""";
        assertEquals(expected, outcome.getCode());
        assertTrue(outcome.getWarnings().isEmpty());
        assertTrue(outcome.isBalanced());
    }

    @Test
    void rewrite_conditionalsAndFields() {
        String source = """
                Public Class Counter
                    Private _count As Integer = 0

                    Public Sub Increment(ByVal amount As Integer)
                        If amount > 0 Then
                            _count += amount
                        Else
                            Throw New ArgumentException("amount")
                        End If
                    End Sub
                End Class""";

        RewriteOutcome outcome = rewriter.rewrite(source, table);

        String expected = """
                public class Counter {
                    private int _count = 0;

                    public void Increment(int amount) {
                        if (amount > 0) {
                            _count += amount;
                        } else {
                            throw new ArgumentException("amount");
                        }
                    }
                }""";
        assertEquals(expected, outcome.getCode());
        assertTrue(outcome.getWarnings().isEmpty(), "Unexpected warnings: " + outcome.getWarnings());
    }

    @Test
    void rewrite_propertyWithAccessors() {
        String source = """
                Public Property Name As String
                    Get
                        Return _name
                    End Get
                    Set(value As String)
                        _name = value
                    End Set
                End Property""";

        RewriteOutcome outcome = rewriter.rewrite(source, table);

        String expected = """
                public string Name {
                    get {
                        return _name;
                    }
                    set {
                        _name = value;
                    }
                }""";
        assertEquals(expected, outcome.getCode());
    }

    @Test
    void rewrite_operatorsAndConditions() {
        RewriteOutcome outcome = rewriter.rewrite("If x = 1 AndAlso y <> 2 Then\nEnd If", table);

        assertEquals("if (x == 1 && y != 2) {\n}", outcome.getCode());
    }

    @Test
    void rewrite_loopsAndLocals() {
        String source = """
                Dim total As Integer = 0
                Dim names As New List(Of String)
                For i As Integer = 0 To 9
                    total += i
                Next""";

        RewriteOutcome outcome = rewriter.rewrite(source, table);

        String expected = """
                int total = 0;
                var names = new List<string>();
                for (int i = 0; i <= 9; i++) {
                    total += i;
                }""";
        assertEquals(expected, outcome.getCode());
    }

    @Test
    void rewrite_stringLiteralsUntouched() {
        RewriteOutcome outcome = rewriter.rewrite("Console.WriteLine(\"Nothing And True\")", table);

        assertEquals("Console.WriteLine(\"Nothing And True\");", outcome.getCode());
    }

    @Test
    void rewrite_selectCasePassedThrough() {
        RewriteOutcome outcome = rewriter.rewrite("Select Case x", table);

        assertEquals("Select Case x", outcome.getCode());
        assertEquals(1, outcome.getWarnings().size());
        assertTrue(outcome.getWarnings().get(0).startsWith("no rule matched at line 1"));
    }

    @Test
    void advisory() {
        assertEquals(VbNetToCSharpRules.ADVISORY, table.getAdvisory());
    }

    // ========== Generics and statement separators ==========

    @Test
    void rewrite_genericFunctionKeepsTypeParameters() {
        String source = """
                Public Shared Function Echo(Of T)(value As T) As T
                    Return value
                End Function""";

        RewriteOutcome outcome = rewriter.rewrite(source, table);

        String expected = """
                public static T Echo<T>(T value) {
                    return value;
                }""";
        assertEquals(expected, outcome.getCode());
        assertTrue(outcome.getWarnings().isEmpty());
        assertTrue(outcome.isBalanced());
    }

    @Test
    void rewrite_genericSubDropsConstraints() {
        RewriteOutcome outcome = rewriter.rewrite("Public Sub Add(Of T As Class)(item As T)\nEnd Sub", table);

        assertEquals("public void Add<T>(T item) {\n}", outcome.getCode());
        assertTrue(outcome.getWarnings().isEmpty());
    }

    @Test
    void rewrite_colonSeparatedStatements() {
        RewriteOutcome outcome = rewriter.rewrite("Dim x As Integer = 1 : x = 2", table);

        assertEquals("int x = 1;\nx = 2;", outcome.getCode());
        assertTrue(outcome.getWarnings().isEmpty());
    }
}
