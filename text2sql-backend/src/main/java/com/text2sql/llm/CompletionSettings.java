package com.text2sql.llm;

import org.springframework.core.env.Environment;

import java.util.List;

/**
 * Immutable completion gateway settings resolved from the Spring environment.
 *
 * <p>Every value can be given as a property ({@code text2sql.llm.*}) or as an environment variable;
 * the property wins when both are present.
 *
 * @param baseUrl OpenAI-compatible gateway base URL
 * @param apiKey global API key, used when the customer has none
 * @param model primary model
 * @param generationFallbackModel model tried when generation fails on the primary model
 * @param debugFallbackModel model tried when debug repair fails on the primary model
 * @param timeoutMs request timeout for one completion call
 */
public record CompletionSettings(
        String baseUrl,
        String apiKey,
        String model,
        String generationFallbackModel,
        String debugFallbackModel,
        int timeoutMs
) {
    static final String DEFAULT_BASE_URL = "https://api.openai.com";
    static final String DEFAULT_MODEL = "gpt-4o";
    static final String DEFAULT_GENERATION_FALLBACK_MODEL = "gpt-4";
    static final String DEFAULT_DEBUG_FALLBACK_MODEL = "gpt-3.5-turbo";
    static final int DEFAULT_TIMEOUT_MS = 30000;

    /**
     * Resolve settings from the environment.
     *
     * @param environment Spring environment
     * @return settings
     */
    public static CompletionSettings fromEnvironment(Environment environment) {
        String baseUrl = getTrimmed(environment, "text2sql.llm.base-url", "OPENAI_BASE_URL");
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }

        String apiKey = getTrimmed(environment, "text2sql.llm.api-key", "OPENAI_API_KEY");
        String model = orDefault(getTrimmed(environment, "text2sql.llm.model", "LLM_MODEL"), DEFAULT_MODEL);
        String generationFallback = orDefault(
                getTrimmed(environment, "text2sql.llm.generation-fallback-model", "LLM_GENERATION_FALLBACK_MODEL"),
                DEFAULT_GENERATION_FALLBACK_MODEL);
        String debugFallback = orDefault(
                getTrimmed(environment, "text2sql.llm.debug-fallback-model", "LLM_DEBUG_FALLBACK_MODEL"),
                DEFAULT_DEBUG_FALLBACK_MODEL);

        int timeoutMs = DEFAULT_TIMEOUT_MS;
        String timeoutRaw = getTrimmed(environment, "text2sql.llm.timeout-ms", "LLM_TIMEOUT_MS");
        if (timeoutRaw != null && !timeoutRaw.isBlank()) {
            try {
                timeoutMs = Integer.parseInt(timeoutRaw);
            } catch (NumberFormatException ignored) {
                // Keep default
            }
        }

        return new CompletionSettings(baseUrl, apiKey, model, generationFallback, debugFallback, timeoutMs);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Model order for SQL generation.
     *
     * @return policy
     */
    public ModelFallbackPolicy generationPolicy() {
        return ModelFallbackPolicy.of(model, generationFallbackModel);
    }

    /**
     * Model order for debug repair.
     *
     * @return policy
     */
    public ModelFallbackPolicy debugPolicy() {
        return ModelFallbackPolicy.of(model, debugFallbackModel);
    }

    /**
     * Model order for unstructured calls such as summarization: the primary model only.
     *
     * @return policy
     */
    public ModelFallbackPolicy primaryOnly() {
        return new ModelFallbackPolicy(List.of(model));
    }

    @Override
    public String toString() {
        return "CompletionSettings[baseUrl=" + baseUrl + ", apiKeyConfigured=" + hasApiKey() + ", model=" + model
                + ", generationFallbackModel=" + generationFallbackModel + ", debugFallbackModel=" + debugFallbackModel
                + ", timeoutMs=" + timeoutMs + "]";
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String getTrimmed(Environment environment, String propKey, String envKey) {
        String v = null;
        if (environment != null && propKey != null && !propKey.isBlank()) {
            v = environment.getProperty(propKey);
        }
        if ((v == null || v.isBlank()) && envKey != null && !envKey.isBlank()) {
            v = environment != null ? environment.getProperty(envKey) : null;
        }
        if (v == null) {
            return null;
        }
        return v.trim();
    }
}
