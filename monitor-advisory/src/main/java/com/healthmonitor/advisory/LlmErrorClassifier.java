package com.healthmonitor.advisory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.healthmonitor.core.exception.ClassificationException;
import com.healthmonitor.core.model.ErrorCategory;
import com.healthmonitor.core.model.ErrorClassification;
import com.healthmonitor.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Classifier backed by an OpenAI-compatible chat completions endpoint.
 *
 * Usage:
 * <pre>
 * ErrorClassifier classifier = new LlmErrorClassifier(
 *     LlmClassifierSettings.defaults(System.getenv("OPENAI_API_KEY")), new ObjectMapper());
 * ErrorClassification result = classifier.classify(ClassificationRequest.from(event));
 * </pre>
 *
 * The model must answer with a JSON object; anything that does not map onto
 * the closed category and severity sets is rejected as a failure.
 */
public class LlmErrorClassifier implements ErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(LlmErrorClassifier.class);

    static final String SYSTEM_PROMPT = """
        You are an integration support engineer for a construction contractor software platform.

        Your job is to analyze integration failures and provide actionable insights. The platform integrates with:
        - Procore (project management - jobs, cost codes, daily logs)
        - Gusto (payroll - employee data, timecards, payroll runs)
        - QuickBooks (accounting - job costs, invoices, GL entries)
        - Stripe Issuing (payments - virtual cards for field purchases)
        - Certified Payroll systems (compliance - LCPtracker, WH-347, prevailing wage)

        When analyzing errors, consider:
        1. Common failure patterns for each integration
        2. Impact on construction workflows (job costing, payroll, field operations)
        3. Urgency based on payroll deadlines, job schedules, or compliance requirements
        4. Specific, actionable fixes that a support engineer or contractor admin can take

        Always respond in JSON format with these fields:
        - category: one of "auth", "rate_limit", "data_validation", "data_state_mismatch", "network", "spending_control", "compliance", "unknown"
        - severity: one of "low", "medium", "high", "critical"
        - cause: plain English explanation of what went wrong (2-3 sentences max)
        - suggestedFix: specific, actionable steps to resolve (2-4 steps)
        - affectedData: array of data types that may be affected
        - businessImpact: how this affects the contractor's operations (1 sentence)""";

    private final LlmClassifierSettings settings;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public LlmErrorClassifier(LlmClassifierSettings settings, ObjectMapper objectMapper) {
        this(settings, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), objectMapper);
    }

    public LlmErrorClassifier(LlmClassifierSettings settings, HttpClient httpClient, ObjectMapper objectMapper) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isAvailable() {
        return settings.hasApiKey();
    }

    @Override
    public String name() {
        return "llm:" + settings.model();
    }

    @Override
    public ErrorClassification classify(ClassificationRequest request) {
        if (!isAvailable()) {
            throw new ClassificationException("No API key configured for " + name());
        }

        HttpResponse<String> response;
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(settings.baseUrl() + "/chat/completions"))
                .timeout(settings.requestTimeout())
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + settings.apiKey())
                .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(request)))
                .build();
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClassificationException("Interrupted while calling " + name(), e);
        } catch (IOException e) {
            throw new ClassificationException("Request to " + name() + " failed: " + e.getMessage(), e);
        }

        if (response.statusCode() != 200) {
            log.warn("Classifier {} answered HTTP {} for event {}", name(), response.statusCode(), request.eventId());
            throw new ClassificationException("Classifier returned HTTP " + response.statusCode());
        }
        return parseCompletion(response.body());
    }

    String buildRequestBody(ClassificationRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", settings.model());
        body.put("temperature", settings.temperature());
        body.put("max_tokens", settings.maxTokens());
        body.putObject("response_format").put("type", "json_object");

        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", buildUserPrompt(request));

        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ClassificationException("Could not serialize classifier request", e);
        }
    }

    String buildUserPrompt(ClassificationRequest request) {
        return "Analyze this integration failure:\n\n"
            + "Integration: " + request.integration().id() + "\n"
            + "Event Type: " + request.eventType() + "\n"
            + "Error Message: " + orDefault(request.errorMessage(), "Unknown error") + "\n"
            + "Error Code: " + orDefault(request.errorCode(), "N/A") + "\n"
            + "Context: " + prettyJson(request.errorContext(), "{}") + "\n"
            + "Payload: " + prettyJson(request.payload(), "null") + "\n\n"
            + "Provide your analysis in JSON format.";
    }

    /**
     * Extract and validate the classification from a chat completion body.
     *
     * @throws ClassificationException if the body or the model's answer is malformed
     */
    ErrorClassification parseCompletion(String responseBody) {
        JsonNode content;
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            JsonNode text = root.path("choices").path(0).path("message").path("content");
            if (!text.isTextual() || text.asText().isBlank()) {
                throw new ClassificationException("Empty response from classifier");
            }
            content = objectMapper.readTree(text.asText());
        } catch (JsonProcessingException e) {
            throw new ClassificationException("Classifier returned malformed JSON", e);
        }

        if (!content.isObject()) {
            throw new ClassificationException("Classifier answer is not a JSON object");
        }

        ErrorCategory category;
        Severity severity;
        try {
            category = ErrorCategory.fromValue(requiredText(content, "category"));
            severity = Severity.fromValue(requiredText(content, "severity"));
        } catch (IllegalArgumentException e) {
            throw new ClassificationException(e.getMessage(), e);
        }

        List<String> affectedData = new ArrayList<>();
        content.path("affectedData").forEach(node -> affectedData.add(node.asText()));

        return new ErrorClassification(
            category,
            severity,
            requiredText(content, "cause"),
            requiredText(content, "suggestedFix"),
            affectedData,
            content.path("businessImpact").asText("")
        );
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ClassificationException("Classifier answer is missing '" + field + "'");
        }
        return value.asText();
    }

    private String prettyJson(JsonNode node, String whenMissing) {
        if (node == null || node.isMissingNode()) {
            return whenMissing;
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return node.toString();
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
