package me.christianrobert.vbtranspiler.transpiler.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.vbtranspiler.transpiler.ai.AiConnectionResult;
import me.christianrobert.vbtranspiler.transpiler.ai.AiEndpoint;
import me.christianrobert.vbtranspiler.transpiler.context.SourceAnalysis;
import me.christianrobert.vbtranspiler.transpiler.context.TranspileException;
import me.christianrobert.vbtranspiler.transpiler.context.TranspileResult;
import me.christianrobert.vbtranspiler.transpiler.service.TranspileService;
import me.christianrobert.vbtranspiler.transpiler.validation.Diagnostic;
import me.christianrobert.vbtranspiler.transpiler.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for parsing, transpiling and validating VB6, VB.NET and C# source.
 *
 * <p>Usage:
 * <pre>
 * # Transpile VB.NET to C#
 * curl -X POST "http://localhost:8080/api/transpile" \
 *   -H "Content-Type: application/json" \
 *   --data '{"code": "Public Class A\nEnd Class", "source_lang": "vbnet", "target_lang": "csharp", "use_ai": false}'
 *
 * # Parse C# and include the text tree
 * curl -X POST "http://localhost:8080/api/parse?showAst=true" \
 *   -H "Content-Type: application/json" \
 *   --data '{"code": "public class A { }", "source_lang": "csharp"}'
 * </pre>
 *
 * <p>Response format of /transpile (JSON):
 * <pre>
 * {
 *   "success": true,
 *   "transpiled_code": "public class A\n{\n}",
 *   "warnings": ["Converted VB.NET to C#. Review Option Strict and type conversions."],
 *   "errors": [],
 *   "method": "rule-based"
 * }
 * </pre>
 *
 * <p>Note: Always returns HTTP 200. Check "success" (or "valid") in the response.
 * A failed transpilation is a valid business outcome, not an HTTP error.
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TranspilerResource {

    private static final Logger log = LoggerFactory.getLogger(TranspilerResource.class);

    static final String API_MESSAGE = "VB/C# Transpiler API v1.0";

    @Inject
    TranspileService transpileService;

    @GET
    public Map<String, Object> root() {
        return Map.of("message", API_MESSAGE);
    }

    @POST
    @Path("/parse")
    public Map<String, Object> parse(@QueryParam("showAst") @DefaultValue("false") boolean showAst,
                                     Map<String, Object> request) {
        log.info("Parse request received via REST API");
        String code = stringValue(request, "code");
        String sourceLang = stringValue(request, "source_lang");
        log.debug("Source language: {} (showAst={})", sourceLang, showAst);
        log.trace("Source code: {}", code);

        SourceAnalysis analysis = transpileService.parse(code, sourceLang, showAst);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", analysis.isSuccess());
        response.put("ast", analysis.getAst());
        response.put("semantic_tree", analysis.getSummary());
        if (analysis.hasAstTree()) {
            response.put("ast_tree", analysis.getAstTree());
        }
        response.put("warnings", analysis.getWarnings());
        response.put("error", analysis.getErrorMessage());

        if (!analysis.isSuccess()) {
            log.warn("Parse failed: {}", analysis.getErrorMessage());
        }
        return response;
    }

    @POST
    @Path("/transpile")
    public Map<String, Object> transpile(Map<String, Object> request) {
        log.info("Transpile request received via REST API");
        String code = stringValue(request, "code");
        String sourceLang = stringValue(request, "source_lang");
        String targetLang = stringValue(request, "target_lang");
        boolean useAi = booleanValue(request, "use_ai", false);
        AiEndpoint endpoint = endpointValue(request == null ? null : request.get("ai_config"));
        log.debug("Transpiling {} -> {} (useAi={}, endpoint={})", sourceLang, targetLang, useAi, endpoint);
        log.trace("Source code: {}", code);

        TranspileResult result = transpileService.transpile(code, sourceLang, targetLang, useAi, endpoint);

        if (result.isSuccess()) {
            log.info("Transpilation succeeded ({})", result.getMethod().getTag());
        } else {
            log.warn("Transpilation failed: {}", result.getErrors());
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", result.isSuccess());
        response.put("transpiled_code", result.getCode());
        response.put("warnings", result.getWarnings());
        response.put("errors", result.getErrors());
        response.put("method", result.getMethod() != null ? result.getMethod().getTag() : null);
        return response;
    }

    @POST
    @Path("/validate")
    public Map<String, Object> validate(Map<String, Object> request) {
        log.info("Validate request received via REST API");
        String code = stringValue(request, "code");
        String language = stringValue(request, "language");

        ValidationReport report;
        try {
            report = transpileService.validate(code, language);
        } catch (TranspileException e) {
            log.warn("Validation rejected: {}", e.getMessage());
            report = new ValidationReport(List.of(Diagnostic.general(e.getMessage())), List.of());
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("valid", report.isValid());
        response.put("errors", diagnostics(report.getErrors()));
        response.put("warnings", diagnostics(report.getWarnings()));
        return response;
    }

    @POST
    @Path("/ai/test")
    public Map<String, Object> testAiConnection(Map<String, Object> request) {
        log.info("AI server connection test requested via REST API");
        AiConnectionResult result = transpileService.testAiConnection(endpointValue(request));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", result.isSuccess());
        response.put("status_code", result.getStatusCode());
        response.put("message", result.getMessage());
        return response;
    }

    private static List<Map<String, Object>> diagnostics(List<Diagnostic> diagnostics) {
        List<Map<String, Object>> result = new ArrayList<>(diagnostics.size());
        for (Diagnostic diagnostic : diagnostics) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("line", diagnostic.getLine());
            entry.put("message", diagnostic.getMessage());
            result.add(entry);
        }
        return result;
    }

    private static AiEndpoint endpointValue(Object value) {
        if (!(value instanceof Map)) {
            return null;
        }
        Map<?, ?> map = (Map<?, ?>) value;
        Object serverUrl = map.get("server_url");
        Object apiKey = map.get("api_key");
        return new AiEndpoint(serverUrl != null ? serverUrl.toString() : null, apiKey != null ? apiKey.toString() : null);
    }

    private static String stringValue(Map<String, Object> request, String key) {
        if (request == null) {
            return null;
        }
        Object value = request.get(key);
        return value != null ? value.toString() : null;
    }

    private static boolean booleanValue(Map<String, Object> request, String key, boolean defaultValue) {
        if (request == null) {
            return defaultValue;
        }
        Object value = request.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }
}
