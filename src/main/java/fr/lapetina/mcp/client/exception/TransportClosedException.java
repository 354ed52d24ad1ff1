package fr.lapetina.mcp.client.exception;

import fr.lapetina.mcp.client.domain.model.ErrorType;

/**
 * Request issued after the transport was shut down.
 */
public final class TransportClosedException extends McpClientException {

    public TransportClosedException(String destination) {
        super(ErrorType.TRANSPORT_CLOSED, "Transport is closed for destination: " + destination);
    }
}
