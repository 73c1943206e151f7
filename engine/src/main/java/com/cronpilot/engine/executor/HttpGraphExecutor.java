package com.cronpilot.engine.executor;

import com.cronpilot.engine.config.CronProperties;
import com.cronpilot.engine.executor.dto.ExecuteGraphRequest;
import com.cronpilot.engine.executor.dto.ExecutionResult;
import com.cronpilot.engine.model.ResourceLimits;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the graph executor service.
 *
 * One endpoint: POST {base-url}/graphs/{graphId}/execute. Uses
 * java.net.http.HttpClient with explicit control over headers and
 * timeouts. Called from the runner's worker threads, so blocking here is
 * fine; an interrupt from the runner's timeout aborts the call.
 */
@Component
public class HttpGraphExecutor implements GraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(HttpGraphExecutor.class);

    // Request timeout slack on top of the job's own wall-clock cap.
    private static final Duration TIMEOUT_SLACK = Duration.ofSeconds(5);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public HttpGraphExecutor(CronProperties props, ObjectMapper objectMapper) {
        this.baseUrl = stripTrailingSlash(props.executor().baseUrl());
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(props.executor().connectTimeoutSeconds()))
                .build();
    }

    @Override
    public ExecutionResult execute(String graphId, Map<String, Object> inputs, Path artifactsDir, ResourceLimits caps) {
        log.info("Executing graph '{}' ({} input keys, maxRunSeconds={})",
                graphId, inputs.size(), caps.maxRunSeconds());
        String body = toJson(new ExecuteGraphRequest(graphId, inputs, artifactsDir.toString(), caps));
        String path = "/graphs/" + URLEncoder.encode(graphId, StandardCharsets.UTF_8) + "/execute";
        String respBody = post(path, body, "execute " + graphId,
                Duration.ofSeconds(caps.maxRunSeconds()).plus(TIMEOUT_SLACK));
        try {
            ExecutionResult result = json.readValue(respBody, ExecutionResult.class);
            log.info("Graph '{}' finished: {} steps, {} tokens", graphId, result.steps_used(), result.tokens_used());
            return result;
        } catch (JsonProcessingException e) {
            throw new ExecutorException(ExecutorException.BAD_RESPONSE,
                    "Failed to parse execute response for " + graphId, false, e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(String path, String jsonBody, String opName, Duration timeout) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw ExecutorException.forStatus(resp.statusCode(),
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (IOException e) {
            throw new ExecutorException(ExecutorException.NETWORK, opName + " failed: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException(ExecutorException.INTERRUPTED, opName + " interrupted", true, e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutorException(ExecutorException.BAD_RESPONSE, "JSON serialization failed", false, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
