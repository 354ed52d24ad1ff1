package fr.lapetina.mcp.client.exception;

import fr.lapetina.mcp.client.domain.model.ErrorType;

/**
 * Destination answered an invocation with a status other than 200.
 */
public final class InvocationErrorException extends McpClientException {

    private final int status;

    public InvocationErrorException(int status) {
        super(ErrorType.INVOCATION_ERROR, "Invocation returned HTTP " + status);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
