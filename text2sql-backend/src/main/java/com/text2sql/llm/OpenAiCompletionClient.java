package com.text2sql.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Completion client for OpenAI-compatible {@code /v1/chat/completions} endpoints.
 *
 * Structured calls use function tools with a forced {@code tool_choice}. The client talks plain HTTP
 * (no vendor SDK), so any OpenAI-compatible gateway can sit behind {@code text2sql.llm.base-url}.
 */
@Component
public class OpenAiCompletionClient implements CompletionClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompletionClient.class);

    private static final int MAX_ERROR_BODY_CHARS = 500;

    private final ObjectMapper objectMapper;
    private final CompletionSettings settings;
    private final HttpClient httpClient;

    /**
     * Create a new completion client.
     *
     * @param objectMapper Jackson object mapper
     * @param settings gateway settings
     */
    public OpenAiCompletionClient(ObjectMapper objectMapper, CompletionSettings settings) {
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Log which gateway and models are configured. Never logs the API key.
     */
    @PostConstruct
    public void logConfigStatus() {
        if (settings.hasApiKey()) {
            log.info(
                    "Completion gateway configured (base_url={}, model={}, generation_fallback={}, debug_fallback={}, timeout_ms={})",
                    settings.baseUrl(),
                    settings.model(),
                    settings.generationFallbackModel(),
                    settings.debugFallbackModel(),
                    settings.timeoutMs()
            );
            return;
        }
        log.warn(
                "No global completion API key configured (base_url={}, model={}); requests need a customer-specific key",
                settings.baseUrl(),
                settings.model()
        );
    }

    @Override
    public Optional<JsonNode> callFunction(CompletionRequest request, FunctionSpec function, String model)
            throws CompletionException {
        Map<String, Object> payload = basePayload(request, model);
        payload.put("tools", List.of(Map.of(
                "type", "function",
                "function", Map.of(
                        "name", function.name(),
                        "description", function.description(),
                        "parameters", function.parametersSchema()
                )
        )));
        payload.put("tool_choice", Map.of(
                "type", "function",
                "function", Map.of("name", function.name())
        ));

        String body = post(request.apiKey(), payload, model);
        return extractFunctionArguments(body, function.name());
    }

    @Override
    public String complete(CompletionRequest request, String model) throws CompletionException {
        String body = post(request.apiKey(), basePayload(request, model), model);
        try {
            JsonNode contentNode = objectMapper.readTree(body).path("choices").path(0).path("message").path("content");
            String content = contentNode.isTextual() ? contentNode.asText().trim() : "";
            if (content.isEmpty()) {
                throw new CompletionException("Completion response has no message content");
            }
            return content;
        } catch (JsonProcessingException e) {
            throw new CompletionException("Completion response is not valid JSON", e);
        }
    }

    /**
     * Pull the arguments of the first call to {@code functionName} out of a chat completion response.
     *
     * @param body response body
     * @param functionName expected function name
     * @return parsed arguments, or empty when the response has no such call
     * @throws CompletionException when the body or the arguments are not valid JSON
     */
    Optional<JsonNode> extractFunctionArguments(String body, String functionName) throws CompletionException {
        try {
            JsonNode toolCalls = objectMapper.readTree(body).path("choices").path(0).path("message").path("tool_calls");
            if (!toolCalls.isArray() || toolCalls.isEmpty()) {
                return Optional.empty();
            }
            JsonNode fn = toolCalls.path(0).path("function");
            if (!functionName.equals(fn.path("name").asText())) {
                return Optional.empty();
            }
            JsonNode arguments = fn.path("arguments");
            if (arguments.isObject()) {
                return Optional.of(arguments);
            }
            if (!arguments.isTextual() || arguments.asText().isBlank()) {
                return Optional.empty();
            }
            JsonNode parsed = objectMapper.readTree(arguments.asText());
            return parsed != null && parsed.isObject() ? Optional.of(parsed) : Optional.empty();
        } catch (JsonProcessingException e) {
            throw new CompletionException("Function call arguments are not valid JSON", e);
        }
    }

    private Map<String, Object> basePayload(CompletionRequest request, String model) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", List.of(
                Map.of("role", "system", "content", request.systemMessage()),
                Map.of("role", "user", "content", request.userMessage())
        ));
        return payload;
    }

    private String post(String apiKey, Map<String, Object> payload, String model) throws CompletionException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("Completion API key is required");
        }

        try {
            String json = objectMapper.writeValueAsString(payload);
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(settings.baseUrl() + "/v1/chat/completions"))
                    .timeout(Duration.ofMillis(settings.timeoutMs()))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                    .build();

            log.debug("Sending completion request (model={})", model);
            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() >= 400) {
                log.warn("Completion gateway request failed (status_code={}, base_url={}, model={})",
                        response.statusCode(), settings.baseUrl(), model);
                throw new CompletionException("Completion gateway error: HTTP " + response.statusCode() + " - "
                        + truncate(response.body()));
            }
            return response.body();
        } catch (IOException e) {
            throw new CompletionException("Completion request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("Completion request interrupted", e);
        }
    }

    private static String truncate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= MAX_ERROR_BODY_CHARS ? s : s.substring(0, MAX_ERROR_BODY_CHARS);
    }
}
