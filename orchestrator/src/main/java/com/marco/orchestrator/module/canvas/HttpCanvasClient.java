package com.marco.orchestrator.module.canvas;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
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

/**
 * {@link CanvasClient} over the Canvas LMS REST API v1.
 *
 * Uses java.net.http.HttpClient with a bearer token, one GET per call.
 * Only the first page (100 items) of each listing is read.
 */
@Component
public class HttpCanvasClient implements CanvasClient {

    private static final Logger log = LoggerFactory.getLogger(HttpCanvasClient.class);

    private static final int PAGE_SIZE = 100;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       token;
    private final Duration     requestTimeout;

    public HttpCanvasClient(@Value("${marco.canvas.token:}") String token,
                            MarcoProperties properties,
                            ObjectMapper objectMapper) {
        String url = properties.getCanvas().getBaseUrl();
        this.baseUrl        = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.token          = token;
        this.requestTimeout = properties.getCanvas().getRequestTimeout();
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        if (!properties.getCanvas().isConfigured()) {
            log.warn("marco.canvas.base-url is not set; canvas actions will be rejected");
        }
    }

    @Override
    public List<Course> listCourses() {
        return get("/api/v1/courses?enrollment_state=active&per_page=" + PAGE_SIZE,
                new TypeReference<>() {}, "listCourses");
    }

    @Override
    public List<Assignment> listAssignments(long courseId) {
        return get("/api/v1/courses/" + courseId + "/assignments?order_by=due_at&per_page=" + PAGE_SIZE,
                new TypeReference<>() {}, "listAssignments for course " + courseId);
    }

    @Override
    public List<Announcement> listAnnouncements(long courseId) {
        return get("/api/v1/announcements?context_codes[]=course_" + courseId + "&per_page=" + PAGE_SIZE,
                new TypeReference<>() {}, "listAnnouncements for course " + courseId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private <T> T get(String pathAndQuery, TypeReference<T> type, String opName) {
        if (baseUrl.isBlank()) {
            throw new CanvasClientException(400, "Canvas is not configured (marco.canvas.base-url)");
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + pathAndQuery.replace("[]", "%5B%5D")))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + token)
                .header("Accept",        "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CanvasClientException(opName + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CanvasClientException(opName + " interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new CanvasClientException(response.statusCode(),
                    opName + " failed: HTTP " + response.statusCode());
        }
        try {
            return json.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw new CanvasClientException(200, "Unreadable Canvas response for " + opName, e);
        }
    }
}
