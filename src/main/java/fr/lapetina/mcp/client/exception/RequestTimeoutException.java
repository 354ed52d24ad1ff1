package fr.lapetina.mcp.client.exception;

import fr.lapetina.mcp.client.domain.model.ErrorType;

/**
 * Call deadline expired, either during a round-trip or during a backoff sleep.
 */
public final class RequestTimeoutException extends McpClientException {

    public RequestTimeoutException(String message) {
        super(ErrorType.REQUEST_TIMEOUT, message);
    }

    public RequestTimeoutException(String message, Throwable cause) {
        super(ErrorType.REQUEST_TIMEOUT, message, cause);
    }
}
