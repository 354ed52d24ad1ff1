/**
 * Exception taxonomy of the client layer.
 *
 * <p>All exceptions are unchecked and extend
 * {@link fr.lapetina.mcp.client.exception.McpClientException}, which carries an
 * {@link fr.lapetina.mcp.client.domain.model.ErrorType}.
 *
 * <h2>Propagation</h2>
 * <ul>
 *   <li>Transport errors ({@code ConnectionException}, retryable statuses) are retried by the
 *       transport, then surfaced as {@code RequestFailedException}</li>
 *   <li>Deadline expiry surfaces as {@code RequestTimeoutException}, with no further retry</li>
 *   <li>The facade wraps everything in {@code InvocationFailedException} with destination and
 *       operation context</li>
 *   <li>Batch and fan-out calls never throw per item; failures become error results</li>
 * </ul>
 */
package fr.lapetina.mcp.client.exception;
