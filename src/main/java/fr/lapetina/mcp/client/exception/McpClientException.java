package fr.lapetina.mcp.client.exception;

import fr.lapetina.mcp.client.domain.model.ErrorType;

/**
 * Base class for every failure raised by the client layer.
 * Carries the {@link ErrorType} used for metrics and per-item results.
 */
public class McpClientException extends RuntimeException {

    private final ErrorType errorType;

    public McpClientException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public McpClientException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
