package com.marco.orchestrator.classifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marco.orchestrator.config.MarcoProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Classifier backend on top of the Anthropic Messages API.
 *
 * Plain {@link HttpClient} + Jackson: one POST per classification, no SDK.
 * Status codes are mapped onto the transient / semantic split the
 * classifier's retry policy needs:
 * <ul>
 *   <li>I/O errors, 408, 429, 5xx (incl. 529 overloaded) — transient</li>
 *   <li>every other non-200 — semantic, never retried</li>
 * </ul>
 */
@Component
public class ClaudeClassifierBackend implements ClassifierBackend {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClassifierBackend.class);

    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 1024;

    /**
     * The subset of the API response we care about.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        public String firstText() {
            if (content == null) return null;
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElse(null);
        }
    }

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       apiUrl;
    private final String       model;
    private final Duration     requestTimeout;

    public ClaudeClassifierBackend(@Value("${marco.classifier.api-key:}") String apiKey,
                                   MarcoProperties properties,
                                   ObjectMapper objectMapper) {
        this.apiKey         = apiKey;
        this.apiUrl         = properties.getClassifier().getBaseUrl() + "/v1/messages";
        this.model          = properties.getClassifier().getModel();
        this.requestTimeout = properties.getClassifier().getTimeout();
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("marco.classifier.api-key is not set; every classification will fail");
        }
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        String requestBody;
        try {
            requestBody = json.writeValueAsString(Map.of(
                    "model",      model,
                    "max_tokens", MAX_TOKENS,
                    "system",     systemPrompt,
                    "messages",   List.of(Map.of("role", "user", "content", userPrompt))
            ));
        } catch (JsonProcessingException e) {
            throw new ClassifierBackendException(false, "Could not serialise classifier request", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl))
                .timeout(requestTimeout)
                .header("content-type",      "application/json")
                .header("x-api-key",         apiKey)
                .header("anthropic-version", API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ClassifierBackendException(true, "Classifier backend unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClassifierBackendException(false, "Classifier call interrupted", e);
        }

        int status = response.statusCode();
        if (status != 200) {
            boolean transientFailure = status == 408 || status == 429 || status >= 500;
            throw new ClassifierBackendException(transientFailure,
                    "Classifier backend error %d: %s".formatted(status, response.body()));
        }

        try {
            // An empty reply is still a reply; the parser turns it into a zero-confidence candidate.
            String text = json.readValue(response.body(), MessagesResponse.class).firstText();
            return text == null ? "" : text;
        } catch (JsonProcessingException e) {
            throw new ClassifierBackendException(false, "Unreadable classifier backend response", e);
        }
    }
}
