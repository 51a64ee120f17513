package me.christianrobert.vbtranspiler.transpiler.service;

import me.christianrobert.vbtranspiler.config.service.ConfigService;
import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.transpiler.ai.AiEndpoint;
import me.christianrobert.vbtranspiler.transpiler.ai.AiRewriteClient;
import me.christianrobert.vbtranspiler.transpiler.ai.AiRewriteResult;
import me.christianrobert.vbtranspiler.transpiler.context.SourceAnalysis;
import me.christianrobert.vbtranspiler.transpiler.context.TranspileException;
import me.christianrobert.vbtranspiler.transpiler.context.TranspileMethod;
import me.christianrobert.vbtranspiler.transpiler.context.TranspileResult;
import me.christianrobert.vbtranspiler.transpiler.parser.LineStructureParser;
import me.christianrobert.vbtranspiler.transpiler.rewrite.rules.RuleTableRegistry;
import me.christianrobert.vbtranspiler.transpiler.semantic.SemanticExtractor;
import me.christianrobert.vbtranspiler.transpiler.validation.TranspileValidator;
import me.christianrobert.vbtranspiler.transpiler.validation.ValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TranspileServiceTest {

    private static final String VB_CALCULATOR = """
            Public Class Calculator
                Public Function Add(a As Integer, b As Integer) As Integer
                    Return a + b
                End Function
            End Class""";

    private static final String CSHARP_CALCULATOR = """
            public class Calculator {
                public int Add(int a, int b) {
                    return a + b;
                }
            }""";

    private TranspileService service;
    private AiRewriteClient aiClient;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        aiClient = mock(AiRewriteClient.class);
        configService = new ConfigService();

        service = new TranspileService();
        service.parser = new LineStructureParser();
        service.semanticExtractor = new SemanticExtractor();
        service.ruleTableRegistry = RuleTableRegistry.withDefaults();
        service.validator = new TranspileValidator();
        service.aiClient = aiClient;
        service.configService = configService;
    }

    // ========== Rule-based conversion ==========

    @Test
    void transpile_vbNetToCSharp() {
        TranspileResult result = service.transpile(VB_CALCULATOR, "vbnet", "csharp", false, null);

        assertTrue(result.isSuccess(), "Errors: " + result.getErrors());
        assertEquals(CSHARP_CALCULATOR, result.getCode());
        assertEquals(TranspileMethod.RULE_BASED, result.getMethod());
        assertTrue(result.getErrors().isEmpty());
        assertEquals(List.of("Converted VB.NET to C#. Review Option Strict and type conversions."), result.getWarnings());
        long closers = result.getCode().lines().filter(line -> line.trim().equals("}")).count();
        assertEquals(2, closers);
        verifyNoInteractions(aiClient);
    }

    @Test
    void transpile_cSharpBackToVbNet() {
        TranspileResult result = service.transpile(CSHARP_CALCULATOR, "c#", "vbnet", false, null);

        assertTrue(result.isSuccess());
        assertEquals(VB_CALCULATOR, result.getCode());
    }

    @Test
    void transpile_roundTripKeepsDeclarations() {
        String source = """
                public static class Helpers {
                    public static int Twice(int x) {
                        return x * 2;
                    }
                }

                public class Person {
                    private string _name;

                    public Person(string name) {
                        _name = name;
                    }

                    public int Age { get; set; }

                    public static T First<T>(List<T> items) {
                        return items.First();
                    }
                }""";

        TranspileResult vb = service.transpile(source, "csharp", "vbnet", false, null);
        assertTrue(vb.isSuccess(), "Errors: " + vb.getErrors());
        TranspileResult back = service.transpile(vb.getCode(), "vbnet", "csharp", false, null);
        assertTrue(back.isSuccess(), "Errors: " + back.getErrors());

        SourceAnalysis original = service.parse(source, "csharp", false);
        SourceAnalysis converted = service.parse(vb.getCode(), "vbnet", false);
        SourceAnalysis returned = service.parse(back.getCode(), "csharp", false);

        assertEquals(2, original.getSummary().getClasses().size());
        assertEquals(3, original.getSummary().getMethods().size());
        assertEquals(2, original.getSummary().getProperties().size());
        for (SourceAnalysis analysis : List.of(converted, returned)) {
            assertEquals(original.getSummary().getClasses().size(), analysis.getSummary().getClasses().size());
            assertEquals(original.getSummary().getMethods().size(), analysis.getSummary().getMethods().size());
            assertEquals(original.getSummary().getProperties().size(), analysis.getSummary().getProperties().size());
        }
        assertTrue(vb.getCode().contains("Public Module Helpers"));
        assertTrue(vb.getCode().contains("Public Sub New(name As String)"));
        assertTrue(vb.getCode().contains("Function First(Of T)(items As List(Of T)) As T"));
        assertTrue(back.getCode().contains("public Person(string name) {"));
        assertTrue(back.getCode().contains("public int Age { get; set; }"));
        assertTrue(back.getCode().contains("public static T First<T>(List<T> items) {"));
        assertTrue(vb.getWarnings().stream().noneMatch(w -> w.startsWith("no rule matched")), "Warnings: " + vb.getWarnings());
        assertTrue(back.getWarnings().stream().noneMatch(w -> w.startsWith("no rule matched")), "Warnings: " + back.getWarnings());
    }

    @Test
    void transpile_unmatchedLineIsWarning() {
        String code = """
                Public Sub Run()
                    Stop
                End Sub""";

        TranspileResult result = service.transpile(code, "vbnet", "csharp", false, null);

        assertTrue(result.isSuccess());
        long passThrough = result.getWarnings().stream().filter(w -> w.startsWith("no rule matched")).count();
        assertEquals(1, passThrough);
        assertTrue(result.getCode().contains("    Stop"));
    }

    @Test
    void transpile_unclosedBlocksAreErrors() {
        String code = """
                Public Class A
                    Public Sub Run()
                        Console.WriteLine("x")""";

        TranspileResult result = service.transpile(code, "vbnet", "csharp", false, null);

        assertFalse(result.isSuccess());
        assertEquals(List.of("unclosed block started at line 1", "unclosed block started at line 2"), result.getErrors());
        assertEquals(TranspileMethod.RULE_BASED, result.getMethod());
        assertNotNull(result.getCode());
    }

    @Test
    void transpile_vb6ToCSharpIsChained() {
        String code = """
                Private Function Total(a As Integer, b As Long) As Integer
                    Total = a + b
                End Function""";

        TranspileResult result = service.transpile(code, "vb", "csharp", false, null);

        assertTrue(result.isSuccess(), "Errors: " + result.getErrors());
        assertTrue(result.getWarnings().contains("Two-step conversion (VB -> VB.NET -> C#). Extensive testing required."));
        assertTrue(result.getCode().endsWith("}"));
    }

    @Test
    void conversionPath() {
        assertEquals(List.of(Language.VBNET, Language.CSHARP), service.conversionPath(Language.VBNET, Language.CSHARP));
        assertEquals(List.of(Language.VB6, Language.VBNET, Language.CSHARP),
                service.conversionPath(Language.VB6, Language.CSHARP));
        assertEquals(List.of(Language.CSHARP, Language.VBNET, Language.VB6),
                service.conversionPath(Language.CSHARP, Language.VB6));
        assertTrue(service.conversionPath(Language.VBNET, Language.VBNET).isEmpty());
    }

    // ========== Request failures ==========

    @Test
    void transpile_sameLanguage() {
        TranspileResult result = service.transpile(VB_CALCULATOR, "vbnet", "vbnet", false, null);

        assertFalse(result.isSuccess());
        assertEquals(List.of("Conversion from VB.NET to VB.NET not supported"), result.getErrors());
        assertNull(result.getMethod());
    }

    @Test
    void transpile_unknownLanguage() {
        TranspileResult result = service.transpile(VB_CALCULATOR, "python", "csharp", false, null);

        assertFalse(result.isSuccess());
        assertEquals(List.of("Unsupported language: python"), result.getErrors());
    }

    @Test
    void transpile_blankCode() {
        TranspileResult result = service.transpile("  \n ", "vbnet", "csharp", false, null);

        assertFalse(result.isSuccess());
        assertEquals(List.of("Empty source code"), result.getErrors());
    }

    // ========== AI-assisted conversion ==========

    @Test
    void transpile_aiDisabledFallsBack() {
        configService.setConfigValue(ConfigService.AI_ENABLED, false);

        TranspileResult result = service.transpile(VB_CALCULATOR, "vbnet", "csharp", true,
                new AiEndpoint("http://ai.local", null));

        assertTrue(result.isSuccess());
        assertEquals(TranspileMethod.RULE_BASED, result.getMethod());
        assertTrue(result.getWarnings().contains("AI-assisted conversion is disabled, used rule-based conversion"));
        verifyNoInteractions(aiClient);
    }

    @Test
    void transpile_aiWithoutServerUrlFallsBack() {
        TranspileResult result = service.transpile(VB_CALCULATOR, "vbnet", "csharp", true, null);

        assertEquals(TranspileMethod.RULE_BASED, result.getMethod());
        assertTrue(result.getWarnings().contains("AI server URL not configured, used rule-based conversion"));
        verifyNoInteractions(aiClient);
    }

    @Test
    void transpile_aiFailureFallsBack() {
        when(aiClient.rewrite(any(), any(), anyString(), any(), any()))
                .thenReturn(AiRewriteResult.failure("AI server returned 500"));

        TranspileResult result = service.transpile(VB_CALCULATOR, "vbnet", "csharp", true,
                new AiEndpoint("http://ai.local", "key"));

        assertTrue(result.isSuccess());
        assertEquals(TranspileMethod.RULE_BASED, result.getMethod());
        assertEquals(CSHARP_CALCULATOR, result.getCode());
        assertTrue(result.getWarnings().contains(
                "AI-assisted conversion failed (AI server returned 500), fell back to rule-based conversion"));
    }

    @Test
    void transpile_aiSuccess() {
        when(aiClient.rewrite(any(), any(), anyString(), eq(Language.VBNET), eq(Language.CSHARP)))
                .thenReturn(AiRewriteResult.success("// from ai"));

        TranspileResult result = service.transpile(VB_CALCULATOR, "vbnet", "csharp", true,
                new AiEndpoint("http://ai.local", null));

        assertTrue(result.isSuccess());
        assertEquals(TranspileMethod.AI_ASSISTED, result.getMethod());
        assertEquals("// from ai", result.getCode());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void transpile_aiUsesConfiguredEndpoint() {
        configService.setConfigValue(ConfigService.AI_SERVER_URL, "http://configured.local");
        when(aiClient.rewrite(any(), any(), anyString(), any(), any())).thenReturn(AiRewriteResult.success("x"));

        service.transpile(VB_CALCULATOR, "vbnet", "csharp", true, new AiEndpoint("", null));

        verify(aiClient).rewrite(argThat(e -> "http://configured.local".equals(e.getServerUrl())),
                anyMap(), eq(VB_CALCULATOR), eq(Language.VBNET), eq(Language.CSHARP));
    }

    // ========== Parse and validate ==========

    @Test
    void parse_withAstRendering() {
        SourceAnalysis analysis = service.parse(VB_CALCULATOR, "vbnet", true);

        assertTrue(analysis.isSuccess());
        assertNotNull(analysis.getAst());
        assertTrue(analysis.hasAstTree());
        assertEquals("Calculator", analysis.getSummary().getClasses().get(0).getName());
        assertEquals("Add", analysis.getSummary().getMethods().get(0).getName());
    }

    @Test
    void parse_withoutAstRendering() {
        SourceAnalysis analysis = service.parse(VB_CALCULATOR, "vbnet", false);

        assertTrue(analysis.isSuccess());
        assertFalse(analysis.hasAstTree());
    }

    @Test
    void parse_unknownLanguage() {
        SourceAnalysis analysis = service.parse("x", "python", false);

        assertFalse(analysis.isSuccess());
        assertEquals("Unsupported language: python", analysis.getErrorMessage());
    }

    @Test
    void validate_balancedSource() {
        ValidationReport report = service.validate(CSHARP_CALCULATOR, "csharp");

        assertTrue(report.isValid());
    }

    @Test
    void validate_unknownLanguageThrows() {
        TranspileException e = assertThrows(TranspileException.class, () -> service.validate("x", "python"));

        assertEquals("Unsupported language: python", e.getMessage());
    }
}
