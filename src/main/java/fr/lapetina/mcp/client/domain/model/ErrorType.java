package fr.lapetina.mcp.client.domain.model;

/**
 * Error taxonomy for destination calls.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** Registry or settings file missing or malformed */
    CONFIG_LOAD,

    /** Destination name not present in the registry */
    DESTINATION_NOT_FOUND,

    /** Transport could not resolve its destination at startup (soft, logged only) */
    TRANSPORT_INIT,

    /** Call issued after the transport was shut down */
    TRANSPORT_CLOSED,

    /** Connection refused, reset or otherwise broken */
    CONNECTION_ERROR,

    /** Call deadline expired */
    REQUEST_TIMEOUT,

    /** Retryable status exhausted, non-retryable status, or transport errors exhausted */
    REQUEST_FAILED,

    /** Response rejected by validation (null or {error: ...} shape) */
    INVALID_RESPONSE,

    /** Destination answered with a status other than 200 */
    INVOCATION_ERROR,

    /** Circuit breaker is open for the target destination */
    CIRCUIT_OPEN,

    /** Facade-level wrapper carrying destination and operation context */
    INVOCATION_FAILED,

    /** Internal system error */
    INTERNAL_ERROR
}
