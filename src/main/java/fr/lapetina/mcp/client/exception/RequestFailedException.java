package fr.lapetina.mcp.client.exception;

import fr.lapetina.mcp.client.domain.model.ErrorType;

/**
 * Request gave up: non-retryable status, or retries exhausted.
 *
 * {@link #getStatus()} is -1 when the last attempt failed at the transport level;
 * the underlying failure is then the cause.
 */
public final class RequestFailedException extends McpClientException {

    public static final int NO_STATUS = -1;

    private final int status;
    private final int attempts;

    public RequestFailedException(String url, int status, int attempts) {
        super(ErrorType.REQUEST_FAILED,
                "Request failed: url=" + url + ", status=" + status + ", attempts=" + attempts);
        this.status = status;
        this.attempts = attempts;
    }

    public RequestFailedException(String url, int attempts, Throwable lastError) {
        super(ErrorType.REQUEST_FAILED,
                "Request failed: url=" + url + ", attempts=" + attempts + ", error=" + lastError.getMessage(),
                lastError);
        this.status = NO_STATUS;
        this.attempts = attempts;
    }

    public int getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }
}
