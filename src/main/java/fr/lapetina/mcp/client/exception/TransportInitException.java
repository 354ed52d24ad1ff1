package fr.lapetina.mcp.client.exception;

import fr.lapetina.mcp.client.domain.model.ErrorType;

/**
 * Destination host could not be resolved while initializing its transport.
 * Soft: logged, never blocks initialization.
 */
public final class TransportInitException extends McpClientException {

    public TransportInitException(String destination, Throwable cause) {
        super(ErrorType.TRANSPORT_INIT, "Transport init failed for destination: " + destination, cause);
    }
}
