package fr.lapetina.mcp.client.exception;

import fr.lapetina.mcp.client.domain.model.ErrorType;

/**
 * Destination name is not in the registry.
 */
public final class DestinationNotFoundException extends McpClientException {

    private final String destination;

    public DestinationNotFoundException(String destination) {
        super(ErrorType.DESTINATION_NOT_FOUND, "Destination not found: " + destination);
        this.destination = destination;
    }

    public String getDestination() {
        return destination;
    }
}
