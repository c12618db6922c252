package com.naturalsql.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.naturalsql.config.LlmConfig;
import com.naturalsql.exception.CompilationException;
import com.naturalsql.exception.LanguageModelDisabledException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link LanguageModel} backed by an OpenAI-compatible {@code /v1/chat/completions} endpoint.
 *
 * <p>Uses plain HTTP requests (no vendor SDK) so any compatible gateway or local server can be used.
 */
@Service
public class OpenAiCompatibleLanguageModel implements LanguageModel {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleLanguageModel.class);

    private final ObjectMapper objectMapper;
    private final LlmConfig config;
    private final HttpClient httpClient;

    /**
     * Create a new model client.
     *
     * @param objectMapper Jackson object mapper
     * @param config language model configuration
     */
    public OpenAiCompatibleLanguageModel(ObjectMapper objectMapper, LlmConfig config) {
        this.objectMapper = objectMapper;
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Log whether SQL compilation is available. The API key is never logged.
     */
    @PostConstruct
    public void logConfigStatus() {
        if (config.isEnabled()) {
            log.info("Language model is ENABLED (base_url={}, model={}, timeout_ms={})",
                    config.baseUrl(), config.model(), config.timeoutMs());
            return;
        }
        log.warn("Language model is DISABLED (base_url={}, api_key_configured={}, model_configured={})",
                config.baseUrl(),
                config.apiKey() != null && !config.apiKey().isBlank(),
                config.model() != null && !config.model().isBlank());
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public CompletableFuture<String> generate(Prompt prompt) {
        if (!config.isEnabled()) {
            return CompletableFuture.failedFuture(
                    new LanguageModelDisabledException(String.join("; ", config.getDisabledWarnings())));
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(buildPayload(prompt));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new CompilationException("Failed to encode model request", e));
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/v1/chat/completions"))
                .timeout(Duration.ofMillis(config.timeoutMs()))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(this::readContent);
    }

    private Map<String, Object> buildPayload(Prompt prompt) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", config.model());
        payload.put("temperature", 0);
        payload.put("messages", List.of(
                Map.of("role", "system", "content", prompt.system()),
                Map.of("role", "user", "content", prompt.user())
        ));
        return payload;
    }

    private String readContent(HttpResponse<String> response) {
        if (response.statusCode() >= 400) {
            log.warn("Language model request failed (status_code={}, base_url={}, model={})",
                    response.statusCode(), config.baseUrl(), config.model());
            throw new CompilationException("Language model gateway error: HTTP " + response.statusCode() + " - " + response.body());
        }
        try {
            JsonNode root = objectMapper.readTree(response.body());
            JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
            return contentNode.isTextual() ? contentNode.asText() : "";
        } catch (JsonProcessingException e) {
            throw new CompilationException("Language model returned a malformed response", e);
        }
    }
}
