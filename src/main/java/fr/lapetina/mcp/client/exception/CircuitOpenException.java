package fr.lapetina.mcp.client.exception;

import fr.lapetina.mcp.client.domain.model.ErrorType;

import java.time.Duration;

/**
 * Request rejected without I/O because the destination's circuit breaker is open.
 */
public final class CircuitOpenException extends McpClientException {

    private final Duration retryAfter;

    public CircuitOpenException(String destination, Duration retryAfter) {
        super(ErrorType.CIRCUIT_OPEN, "Circuit breaker is open for destination: " + destination
                + ", retryAfterMs=" + retryAfter.toMillis());
        this.retryAfter = retryAfter;
    }

    /**
     * Time left before the breaker admits a trial request.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
