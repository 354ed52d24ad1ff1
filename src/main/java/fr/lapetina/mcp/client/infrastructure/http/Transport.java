package fr.lapetina.mcp.client.infrastructure.http;

import fr.lapetina.mcp.client.domain.model.CallEnvelope;
import fr.lapetina.mcp.client.domain.model.Destination;
import fr.lapetina.mcp.client.domain.model.TransportResponse;
import fr.lapetina.mcp.client.infrastructure.metrics.NetworkStats;

import java.util.concurrent.CompletableFuture;

/**
 * Delivers requests to exactly one destination.
 *
 * Two implementations exist: {@link HttpTransport} talks HTTP with retry and compression,
 * {@link NoOpTransport} answers locally for tests and dry runs. The facade picks one through
 * the {@link TransportFactory} it is built with.
 *
 * Implementations must be thread-safe.
 */
public interface Transport extends AutoCloseable {

    /**
     * Prepares the connection set. Idempotent. DNS failures are logged, never thrown.
     */
    void initialize();

    /**
     * Executes one logical request, retrying as configured.
     *
     * @return the final response; statuses outside the retryable set below 400 are returned as-is
     * @throws fr.lapetina.mcp.client.exception.TransportClosedException after {@link #shutdown()}
     * @throws fr.lapetina.mcp.client.exception.RequestFailedException on non-retryable 4xx/5xx or exhausted retries
     * @throws fr.lapetina.mcp.client.exception.RequestTimeoutException when the call deadline expires
     * @throws fr.lapetina.mcp.client.exception.CircuitOpenException when the destination's breaker is open
     */
    TransportResponse request(CallEnvelope envelope);

    /**
     * Probes the destination's health endpoint. Never completes exceptionally.
     */
    CompletableFuture<Boolean> healthCheck();

    /**
     * Drains in-flight requests and releases resources. Idempotent.
     */
    void shutdown();

    boolean isClosed();

    Destination getDestination();

    NetworkStats getStats();

    @Override
    default void close() {
        shutdown();
    }
}
