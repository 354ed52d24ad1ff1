package fr.lapetina.mcp.client.exception;

import fr.lapetina.mcp.client.domain.model.ErrorType;

/**
 * Response failed validation. Not retried.
 */
public final class InvalidResponseException extends McpClientException {

    public InvalidResponseException(String message) {
        super(ErrorType.INVALID_RESPONSE, message);
    }
}
