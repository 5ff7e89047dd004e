package com.codeforge.orchestrator.step;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * HTTP client for the remote generation service.
 *
 * <pre>
 *   POST {baseUrl}/generate/{agent_type}
 *   { "job_id", "agent_type", "input_context", "outputs", "iteration_count" }
 *   → 200 { ...step output... }
 * </pre>
 *
 * Non-200 responses and transport failures become {@link StepException}s
 * whose kind drives retry classification.
 */
public class GenerationServiceClient {

    private static final Logger log = LoggerFactory.getLogger(GenerationServiceClient.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     requestTimeout;

    public GenerationServiceClient(String baseUrl, Duration requestTimeout, ObjectMapper json) {
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
        this.json           = json;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public Map<String, Object> generate(StepRequest request) {
        String agent    = request.agentType().wireName();
        String provider = request.agentType().provider();

        String body;
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("job_id",          request.jobId());
            payload.put("agent_type",      agent);
            payload.put("input_context",   request.inputContext());
            payload.put("outputs",         request.outputs());
            payload.put("iteration_count", request.iterationCount());
            body = json.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new StepException(StepException.Kind.MALFORMED_REQUEST, provider,
                    "Could not serialise request for step '" + agent + "'", e);
        }

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/generate/" + agent))
                .timeout(requestTimeout)
                .header("content-type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new StepException(StepException.Kind.TIMEOUT, provider,
                    "Generation service timed out for step '" + agent + "'", e);
        } catch (ConnectException e) {
            throw new StepException(StepException.Kind.CONNECTION, provider,
                    "Generation service unreachable at " + baseUrl, e);
        } catch (IOException e) {
            throw new StepException(StepException.Kind.CONNECTION, provider,
                    "I/O error calling generation service: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while calling step '" + agent + "'");
        }

        if (response.statusCode() != 200) {
            throw StepException.fromHttpStatus(response.statusCode(), provider, response.body());
        }

        try {
            Map<String, Object> out = json.readValue(response.body(), MAP_TYPE);
            log.debug("Step '{}' returned {} field(s)", agent, out == null ? 0 : out.size());
            return out == null ? Map.of() : out;
        } catch (JsonProcessingException e) {
            throw new StepException(StepException.Kind.UNKNOWN, provider,
                    "Generation service returned a non-JSON body for step '" + agent + "'", e);
        }
    }
}
