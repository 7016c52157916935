package com.strategylab.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strategylab.api.dto.request.CreateBatchJobRequest;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link BatchJobApiClient} over HTTP. Successful bodies are unwrapped from the
 * {@code {success, data}} envelope; error bodies contribute {@code error.message} to the
 * thrown exception.
 */
public class RestBatchJobApiClient implements BatchJobApiClient {

    private static final Logger log = LoggerFactory.getLogger(RestBatchJobApiClient.class);

    private static final String JOBS_PATH = "/api/batch-jobs";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    /**
     * @param restTemplate template whose root URI points at the StrategyLab server
     */
    public RestBatchJobApiClient(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode create(CreateBatchJobRequest request) {
        return call("create batch job", () -> restTemplate.postForObject(JOBS_PATH, request, String.class));
    }

    @Override
    public JsonNode fetch(String jobId) {
        return call("fetch batch job " + jobId, () -> restTemplate.getForObject(JOBS_PATH + "/{id}", String.class, jobId));
    }

    @Override
    public JsonNode cancel(String jobId) {
        return call(
                "cancel batch job " + jobId,
                () -> restTemplate.postForObject(JOBS_PATH + "/{id}/cancel", null, String.class, jobId));
    }

    private JsonNode call(String action, RemoteCall remoteCall) {
        String body;
        try {
            body = remoteCall.execute();
        } catch (HttpStatusCodeException e) {
            String message = errorMessageOf(e.getResponseBodyAsString());
            log.debug("Failed to {}: {} {}", action, e.getStatusCode().value(), message);
            throw new BatchClientException(
                    message != null ? message : "Failed to " + action + ": HTTP " + e.getStatusCode().value(),
                    e.getStatusCode().value(),
                    e);
        } catch (RestClientException e) {
            throw new BatchClientException("Failed to " + action + ": " + e.getMessage(), 0, e);
        }
        return unwrap(body);
    }

    /** Returns the {@code data} member of an envelope, or the body itself when there is none. */
    JsonNode unwrap(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode data = root.get("data");
            return data != null && root.has("success") ? data : root;
        } catch (IOException e) {
            throw new BatchClientException("Unreadable response from batch API: " + e.getMessage(), 0, e);
        }
    }

    private String errorMessageOf(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode message = root.path("error").path("message");
            if (message.isTextual()) {
                return message.asText();
            }
            JsonNode error = root.get("error");
            return error != null && error.isTextual() ? error.asText() : null;
        } catch (IOException e) {
            return null;
        }
    }

    @FunctionalInterface
    private interface RemoteCall {
        String execute();
    }
}
