package fr.lapetina.mcp.client.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A fully-formed request submitted to a transport.
 * Produced per call, never persisted.
 *
 * @param method            HTTP method
 * @param url               absolute target URL
 * @param headers           extra request headers (opaque, e.g. caller-supplied credentials)
 * @param body              JSON body, or null for body-less requests
 * @param timeout           whole-call deadline, or null for the transport default
 * @param retryableStatuses statuses that trigger a retry, or null for the defaults
 */
public record CallEnvelope(
        String method,
        URI url,
        Map<String, String> headers,
        JsonNode body,
        Duration timeout,
        Set<Integer> retryableStatuses
) {
    /** Statuses retried when the caller does not override them. */
    public static final Set<Integer> DEFAULT_RETRYABLE_STATUSES = Set.of(408, 429, 500, 502, 503, 504);

    public CallEnvelope {
        Objects.requireNonNull(method, "Method is required");
        Objects.requireNonNull(url, "URL is required");
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        retryableStatuses = retryableStatuses != null ? Set.copyOf(retryableStatuses) : DEFAULT_RETRYABLE_STATUSES;
    }

    public static CallEnvelope post(URI url, JsonNode body, Duration timeout) {
        return new CallEnvelope("POST", url, null, body, timeout, null);
    }

    public static CallEnvelope get(URI url, Duration timeout) {
        return new CallEnvelope("GET", url, null, null, timeout, null);
    }

    public CallEnvelope withHeaders(Map<String, String> extraHeaders) {
        return new CallEnvelope(method, url, extraHeaders, body, timeout, retryableStatuses);
    }

    public CallEnvelope withRetryableStatuses(Set<Integer> statuses) {
        return new CallEnvelope(method, url, headers, body, timeout, statuses);
    }

    public boolean isRetryable(int status) {
        return retryableStatuses.contains(status);
    }
}
