package fr.lapetina.mcp.client.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-item outcome of a batch or fan-out call.
 * Exactly one of {@code value} or {@code errorType} is set.
 * Immutable and thread-safe.
 */
public record InvocationResult(
        String destination,
        String operation,
        JsonNode value,
        ErrorType errorType,
        String errorMessage,
        Duration latency
) {
    public InvocationResult {
        Objects.requireNonNull(destination, "Destination is required");
        Objects.requireNonNull(operation, "Operation is required");
        if (errorType == null && value == null) {
            throw new IllegalArgumentException("Successful result requires a value");
        }
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    /**
     * Creates a successful result.
     */
    public static InvocationResult success(String destination, String operation, JsonNode value, Duration latency) {
        return new InvocationResult(destination, operation, value, null, null, latency);
    }

    /**
     * Creates an error result.
     */
    public static InvocationResult error(
            String destination,
            String operation,
            ErrorType errorType,
            String errorMessage,
            Duration latency
    ) {
        return new InvocationResult(destination, operation, null, errorType, errorMessage, latency);
    }

    /**
     * Renders the result as JSON: the value itself, or {@code {"error": message}}.
     */
    public JsonNode toJson() {
        if (isSuccess()) {
            return value;
        }
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("error", errorMessage != null ? errorMessage : errorType.name());
        return node;
    }
}
