package me.christianrobert.vbtranspiler.transpiler.rest;

import me.christianrobert.vbtranspiler.transpiler.ai.AiConnectionResult;
import me.christianrobert.vbtranspiler.transpiler.ai.AiEndpoint;
import me.christianrobert.vbtranspiler.transpiler.context.SourceAnalysis;
import me.christianrobert.vbtranspiler.transpiler.context.TranspileException;
import me.christianrobert.vbtranspiler.transpiler.context.TranspileMethod;
import me.christianrobert.vbtranspiler.transpiler.context.TranspileResult;
import me.christianrobert.vbtranspiler.transpiler.semantic.SemanticSummary;
import me.christianrobert.vbtranspiler.transpiler.service.TranspileService;
import me.christianrobert.vbtranspiler.transpiler.validation.Diagnostic;
import me.christianrobert.vbtranspiler.transpiler.validation.ValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TranspilerResourceTest {

    private TranspilerResource resource;
    private TranspileService transpileService;

    @BeforeEach
    void setUp() {
        transpileService = mock(TranspileService.class);
        resource = new TranspilerResource();
        resource.transpileService = transpileService;
    }

    @Test
    void root() {
        assertEquals("VB/C# Transpiler API v1.0", resource.root().get("message"));
    }

    // ========== Transpile ==========

    @Test
    void transpile_responseShape() {
        when(transpileService.transpile("Dim x = 1", "vbnet", "csharp", false, null))
                .thenReturn(TranspileResult.success("var x = 1;", List.of("hint"), TranspileMethod.RULE_BASED));

        Map<String, Object> request = new HashMap<>();
        request.put("code", "Dim x = 1");
        request.put("source_lang", "vbnet");
        request.put("target_lang", "csharp");

        Map<String, Object> response = resource.transpile(request);

        assertEquals(List.of("success", "transpiled_code", "warnings", "errors", "method"), List.copyOf(response.keySet()));
        assertEquals(true, response.get("success"));
        assertEquals("var x = 1;", response.get("transpiled_code"));
        assertEquals(List.of("hint"), response.get("warnings"));
        assertEquals(List.of(), response.get("errors"));
        assertEquals("rule-based", response.get("method"));
    }

    @Test
    void transpile_failureHasNoMethod() {
        when(transpileService.transpile(anyString(), anyString(), anyString(), anyBoolean(), any()))
                .thenReturn(TranspileResult.failure("x", List.of(), "Unsupported language: python"));

        Map<String, Object> response = resource.transpile(Map.of("code", "x", "source_lang", "python", "target_lang", "csharp"));

        assertEquals(false, response.get("success"));
        assertEquals(List.of("Unsupported language: python"), response.get("errors"));
        assertTrue(response.containsKey("method"));
        assertNull(response.get("method"));
    }

    @Test
    void transpile_aiConfigMapped() {
        when(transpileService.transpile(anyString(), anyString(), anyString(), anyBoolean(), any()))
                .thenReturn(TranspileResult.success("//", List.of(), TranspileMethod.AI_ASSISTED));

        Map<String, Object> request = new HashMap<>();
        request.put("code", "Dim x = 1");
        request.put("source_lang", "vbnet");
        request.put("target_lang", "csharp");
        request.put("use_ai", true);
        request.put("ai_config", Map.of("server_url", "http://ai.local", "api_key", "k"));

        Map<String, Object> response = resource.transpile(request);

        assertEquals("ai-assisted", response.get("method"));
        verify(transpileService).transpile(eq("Dim x = 1"), eq("vbnet"), eq("csharp"), eq(true),
                argThat(e -> e != null && "http://ai.local".equals(e.getServerUrl()) && "k".equals(e.getApiKey())));
    }

    @Test
    void transpile_useAiDefaultsToFalse() {
        when(transpileService.transpile(anyString(), anyString(), anyString(), anyBoolean(), any()))
                .thenReturn(TranspileResult.success("x", List.of(), TranspileMethod.RULE_BASED));

        resource.transpile(Map.of("code", "x", "source_lang", "vbnet", "target_lang", "csharp"));

        verify(transpileService).transpile("x", "vbnet", "csharp", false, null);
    }

    // ========== Validate ==========

    @Test
    void validate_diagnosticsAsMaps() {
        when(transpileService.validate("}", "csharp")).thenReturn(new ValidationReport(
                List.of(new Diagnostic(1, "unmatched closer at line 1")),
                List.of(Diagnostic.general("Code is very short"))));

        Map<String, Object> response = resource.validate(Map.of("code", "}", "language", "csharp"));

        assertEquals(false, response.get("valid"));
        assertEquals(List.of(Map.of("line", 1, "message", "unmatched closer at line 1")), response.get("errors"));
        assertEquals(List.of(Map.of("line", 0, "message", "Code is very short")), response.get("warnings"));
    }

    @Test
    void validate_unknownLanguageIsInvalid() {
        when(transpileService.validate(any(), any())).thenThrow(new TranspileException("Unsupported language: python"));

        Map<String, Object> response = resource.validate(Map.of("code", "x", "language", "python"));

        assertEquals(false, response.get("valid"));
        assertEquals(List.of(Map.of("line", 0, "message", "Unsupported language: python")), response.get("errors"));
    }

    // ========== Parse ==========

    @Test
    void parse_omitsAstTreeWhenNotRequested() {
        when(transpileService.parse("x", "vbnet", false))
                .thenReturn(SourceAnalysis.success(Map.of("type", "compilation_unit"), SemanticSummary.empty(), null, List.of()));

        Map<String, Object> response = resource.parse(false, Map.of("code", "x", "source_lang", "vbnet"));

        assertEquals(true, response.get("success"));
        assertFalse(response.containsKey("ast_tree"));
        assertEquals(Map.of("type", "compilation_unit"), response.get("ast"));
        assertNull(response.get("error"));
    }

    @Test
    void parse_includesAstTree() {
        when(transpileService.parse("x", "vbnet", true))
                .thenReturn(SourceAnalysis.success(Map.of(), SemanticSummary.empty(), "compilation_unit", List.of()));

        Map<String, Object> response = resource.parse(true, Map.of("code", "x", "source_lang", "vbnet"));

        assertEquals("compilation_unit", response.get("ast_tree"));
    }

    // ========== AI connection ==========

    @Test
    void testAiConnection_mapsResult() {
        when(transpileService.testAiConnection(any(AiEndpoint.class)))
                .thenReturn(new AiConnectionResult(true, 200, "Connection successful"));

        Map<String, Object> response = resource.testAiConnection(Map.of("server_url", "http://ai.local"));

        assertEquals(true, response.get("success"));
        assertEquals(200, response.get("status_code"));
        assertEquals("Connection successful", response.get("message"));
    }
}
