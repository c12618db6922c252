package com.naturalsql.config;

import org.springframework.core.env.Environment;

import java.util.List;

/**
 * Immutable language model configuration resolved from properties or environment variables.
 *
 * @param baseUrl   OpenAI-compatible gateway base URL, without the {@code /v1} suffix
 * @param apiKey    bearer token
 * @param model     model name
 * @param timeoutMs compilation timeout
 */
public record LlmConfig(String baseUrl, String apiKey, String model, int timeoutMs) {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com";
    public static final int DEFAULT_TIMEOUT_MS = 30000;

    public static LlmConfig fromEnvironment(Environment environment) {
        String baseUrl = ConfigValues.getTrimmed(environment, "naturalsql.llm.base-url", "LLM_BASE_URL");
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        String apiKey = ConfigValues.getTrimmed(environment, "naturalsql.llm.api-key", "LLM_API_KEY");
        String model = ConfigValues.getTrimmed(environment, "naturalsql.llm.model", "LLM_MODEL");
        int timeoutMs = ConfigValues.getInt(environment, "naturalsql.llm.timeout-ms", "LLM_TIMEOUT_MS", DEFAULT_TIMEOUT_MS);
        return new LlmConfig(baseUrl, apiKey, model, timeoutMs);
    }

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank()
                && model != null && !model.isBlank();
    }

    public List<String> getDisabledWarnings() {
        return List.of(
                "Language model is disabled - missing configuration",
                "Required env: LLM_API_KEY, LLM_MODEL",
                "Optional env: LLM_BASE_URL, LLM_TIMEOUT_MS"
        );
    }

    @Override
    public String toString() {
        return "LlmConfig[baseUrl=" + baseUrl + ", apiKeyConfigured=" + (apiKey != null && !apiKey.isBlank())
                + ", model=" + model + ", timeoutMs=" + timeoutMs + "]";
    }
}
