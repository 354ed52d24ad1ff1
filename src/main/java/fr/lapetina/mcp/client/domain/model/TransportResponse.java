package fr.lapetina.mcp.client.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a transport request.
 * Immutable and thread-safe.
 *
 * @param status   HTTP status code
 * @param json     decoded body when the response declared JSON, otherwise null
 * @param rawBody  decompressed body bytes
 * @param headers  response headers
 * @param attempts number of attempts that were made, including the first
 */
public record TransportResponse(
        int status,
        JsonNode json,
        byte[] rawBody,
        Map<String, List<String>> headers,
        int attempts
) {
    public TransportResponse {
        rawBody = rawBody != null ? rawBody : new byte[0];
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public boolean isJson() {
        return json != null;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public String bodyAsString() {
        return new String(rawBody, StandardCharsets.UTF_8);
    }
}
