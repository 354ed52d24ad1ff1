package fr.lapetina.mcp.client.exception;

import fr.lapetina.mcp.client.domain.model.ErrorType;

/**
 * Facade-level failure: any client error re-wrapped with destination and operation context.
 * Callers of the facade never see the underlying exceptions unwrapped.
 */
public final class InvocationFailedException extends McpClientException {

    private final String destination;
    private final String operation;

    public InvocationFailedException(String destination, String operation, Throwable cause) {
        super(ErrorType.INVOCATION_FAILED,
                "Invocation failed: destination=" + destination + ", operation=" + operation
                        + ", cause=" + cause.getMessage(),
                cause);
        this.destination = destination;
        this.operation = operation;
    }

    public String getDestination() {
        return destination;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * Returns the error type of the wrapped failure.
     */
    public ErrorType getCauseType() {
        if (getCause() instanceof McpClientException) {
            return ((McpClientException) getCause()).getErrorType();
        }
        return ErrorType.INTERNAL_ERROR;
    }
}
