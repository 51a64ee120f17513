package me.christianrobert.vbtranspiler.transpiler.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.vbtranspiler.config.service.ConfigService;
import me.christianrobert.vbtranspiler.core.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * AI rewrite client over HTTP with JSON bodies.
 *
 * <p>Request body:</p>
 * <pre>
 * {
 *   "context": {"ast": {...}, "source_code": "...", "source_language": "vbnet", "target_language": "csharp"},
 *   "task": "Transpile the provided vbnet code to csharp. Use the AST context provided."
 * }
 * </pre>
 * <p>A 200 response carrying {@code result} or {@code transpiled_code} is a success. Any other status,
 * a body without code, a transport error or a timeout is a failure. An API key is sent as bearer token.</p>
 */
@ApplicationScoped
public class HttpAiRewriteClient implements AiRewriteClient {

    private static final Logger log = LoggerFactory.getLogger(HttpAiRewriteClient.class);

    @Inject
    ConfigService configService;

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public AiRewriteResult rewrite(AiEndpoint endpoint, Map<String, Object> ast, String sourceCode,
                                   Language source, Language target) {
        if (endpoint == null || !endpoint.isConfigured()) {
            return AiRewriteResult.failure("AI server URL not configured");
        }

        int timeoutSeconds = configService.getConfigValueAsInt(ConfigService.AI_TIMEOUT_SECONDS, 30);
        log.debug("Calling AI rewrite service at {} ({} -> {}, timeout {}s)", endpoint.getServerUrl(),
                source.getTag(), target.getTag(), timeoutSeconds);

        try {
            String body = buildPayload(ast, sourceCode, source, target);
            log.trace("AI request body: {}", body);

            HttpRequest request = requestBuilder(endpoint, timeoutSeconds)
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                log.warn("AI rewrite service returned status {}", response.statusCode());
                return AiRewriteResult.failure("AI server returned " + response.statusCode());
            }
            log.trace("AI response body: {}", response.body());
            return parseResponse(response.body());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("AI rewrite call interrupted");
            return AiRewriteResult.failure("AI call interrupted");
        } catch (IOException | IllegalArgumentException e) {
            log.warn("AI rewrite call to {} failed: {}", endpoint.getServerUrl(), e.toString());
            return AiRewriteResult.failure("AI call failed: " + describe(e));
        }
    }

    @Override
    public AiConnectionResult testConnection(AiEndpoint endpoint) {
        if (endpoint == null || !endpoint.isConfigured()) {
            return new AiConnectionResult(false, null, "Error: server URL is required");
        }

        int timeoutSeconds = configService.getConfigValueAsInt(ConfigService.AI_CONNECTION_TEST_TIMEOUT_SECONDS, 10);
        log.info("Testing AI server connection to {}", endpoint.getServerUrl());

        try {
            HttpRequest request = requestBuilder(endpoint, timeoutSeconds).GET().build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            int status = response.statusCode();
            boolean reachable = status == 200 || status == 201;
            log.info("AI server connection test finished with status {}", status);
            return new AiConnectionResult(reachable, status, reachable ? "Connection successful" : "Connection failed");

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new AiConnectionResult(false, null, "Error: connection test interrupted");
        } catch (IOException | IllegalArgumentException e) {
            log.warn("AI server connection test failed: {}", e.toString());
            return new AiConnectionResult(false, null, "Error: " + describe(e));
        }
    }

    private HttpRequest.Builder requestBuilder(AiEndpoint endpoint, int timeoutSeconds) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(endpoint.getServerUrl().trim()))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .header("Content-Type", "application/json");
        if (endpoint.hasApiKey()) {
            builder.header("Authorization", "Bearer " + endpoint.getApiKey());
        }
        return builder;
    }

    String buildPayload(Map<String, Object> ast, String sourceCode, Language source, Language target)
            throws JsonProcessingException {
        ObjectNode payload = objectMapper.createObjectNode();
        ObjectNode context = payload.putObject("context");
        context.set("ast", objectMapper.valueToTree(ast));
        context.put("source_code", sourceCode);
        context.put("source_language", source.getTag());
        context.put("target_language", target.getTag());
        payload.put("task", "Transpile the provided " + source.getTag() + " code to " + target.getTag()
                + ". Use the AST context provided.");
        return objectMapper.writeValueAsString(payload);
    }

    AiRewriteResult parseResponse(String body) {
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return AiRewriteResult.failure("AI server returned invalid JSON: " + e.getOriginalMessage());
        }
        String code = textField(json, "result");
        if (code == null) {
            code = textField(json, "transpiled_code");
        }
        if (code == null || code.isBlank()) {
            return AiRewriteResult.failure("AI server response contains no code");
        }
        return AiRewriteResult.success(code);
    }

    private static String textField(JsonNode json, String field) {
        JsonNode node = json == null ? null : json.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
