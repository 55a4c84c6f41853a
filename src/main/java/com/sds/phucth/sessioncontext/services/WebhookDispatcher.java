package com.sds.phucth.sessioncontext.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sds.phucth.sessioncontext.dto.DispatchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Posts the final payload as JSON to the configured automation webhook. One attempt per
 * approval, no retries; timeouts come from the {@code dispatchRestClient} request factory.
 */
@Service
@Slf4j
public class WebhookDispatcher implements ActionDispatcher {

    static final String SESSION_HEADER = "X-Session-Id";
    static final String INTENT_HEADER = "X-Intent";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String webhookUrl;

    public WebhookDispatcher(RestClient dispatchRestClient,
                             ObjectMapper objectMapper,
                             @Value("${app.dispatch.webhookUrl:}") String webhookUrl) {
        this.restClient = dispatchRestClient;
        this.objectMapper = objectMapper;
        this.webhookUrl = webhookUrl;
    }

    @Override
    public DispatchResult send(String sessionId, String intent, Map<String, Object> payload) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.error("No automation webhook configured, cannot dispatch {} for session {}", intent, sessionId);
            return DispatchResult.failed(null, "Automation webhook is not configured", 0);
        }

        long started = System.nanoTime();
        try {
            ResponseEntity<String> response = restClient.post()
                    .uri(webhookUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(SESSION_HEADER, sessionId)
                    .header(INTENT_HEADER, intent)
                    .body(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, res) -> {
                        // status is inspected below
                    })
                    .toEntity(String.class);

            long elapsed = elapsedMs(started);
            int status = response.getStatusCode().value();
            if (response.getStatusCode().is2xxSuccessful()) {
                log.info("Dispatched {} for session {} (HTTP {}, {}ms)", intent, sessionId, status, elapsed);
                return DispatchResult.delivered(status, parseBody(response.getBody()), elapsed);
            }

            log.warn("Automation webhook rejected {} for session {} with HTTP {}", intent, sessionId, status);
            return DispatchResult.failed(status, "Automation webhook responded with HTTP " + status, elapsed);
        } catch (ResourceAccessException e) {
            long elapsed = elapsedMs(started);
            String error = e.getCause() instanceof SocketTimeoutException
                    ? "Automation webhook timed out"
                    : "Automation webhook unreachable: " + e.getMostSpecificCause().getMessage();
            log.warn("Dispatch of {} for session {} failed after {}ms: {}", intent, sessionId, elapsed, error);
            return DispatchResult.failed(null, error, elapsed);
        } catch (RestClientException e) {
            long elapsed = elapsedMs(started);
            log.warn("Dispatch of {} for session {} failed after {}ms: {}", intent, sessionId, elapsed, e.getMessage());
            return DispatchResult.failed(null, "Automation webhook request failed: " + e.getMessage(), elapsed);
        }
    }

    // non-JSON bodies are kept as text under "message"
    private Map<String, Object> parseBody(String body) {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            return Map.of("message", body);
        }
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
