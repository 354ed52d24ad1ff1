package fr.lapetina.mcp.client.exception;

import fr.lapetina.mcp.client.domain.model.ErrorType;

/**
 * Transient network failure (connection refused, reset, unreadable response).
 */
public final class ConnectionException extends McpClientException {

    public ConnectionException(String message, Throwable cause) {
        super(ErrorType.CONNECTION_ERROR, message, cause);
    }
}
