package com.healthmonitor.advisory;

import java.time.Duration;

/**
 * Connection and sampling settings for {@link LlmErrorClassifier}.
 * A blank API key leaves the classifier unavailable.
 */
public record LlmClassifierSettings(
    String apiKey,
    String baseUrl,
    String model,
    double temperature,
    int maxTokens,
    Duration requestTimeout
) {
    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    public LlmClassifierSettings {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        if (model == null || model.isBlank()) {
            model = DEFAULT_MODEL;
        }
        if (requestTimeout == null) {
            requestTimeout = Duration.ofSeconds(10);
        }
    }

    public static LlmClassifierSettings defaults(String apiKey) {
        return new LlmClassifierSettings(apiKey, DEFAULT_BASE_URL, DEFAULT_MODEL, 0.3, 500, Duration.ofSeconds(10));
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
