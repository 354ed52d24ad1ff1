package fr.lapetina.mcp.client.domain.model;

import java.util.Objects;

/**
 * One independent call of a fan-out.
 *
 * @param destination registry name
 * @param operation   operation name
 * @param payload     arguments, serialized with Jackson (may be null)
 */
public record FanOutCall(String destination, String operation, Object payload) {

    public FanOutCall {
        Objects.requireNonNull(destination, "Destination is required");
        Objects.requireNonNull(operation, "Operation is required");
    }

    public static FanOutCall of(String destination, String operation, Object payload) {
        return new FanOutCall(destination, operation, payload);
    }
}
