/**
 * Per-destination HTTP transports.
 *
 * <p>A {@link fr.lapetina.mcp.client.infrastructure.http.Transport} owns the connection set of
 * exactly one destination. {@link fr.lapetina.mcp.client.infrastructure.http.HttpTransport}
 * compresses request bodies above the configured threshold, retries retryable statuses and
 * transport errors with jittered backoff, and trips a
 * {@link fr.lapetina.mcp.client.infrastructure.http.CircuitBreaker} after repeated failures.
 * {@link fr.lapetina.mcp.client.infrastructure.http.NoOpTransport} never touches the network.
 */
package fr.lapetina.mcp.client.infrastructure.http;
