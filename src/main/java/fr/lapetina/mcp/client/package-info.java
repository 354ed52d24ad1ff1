/**
 * Resilient client for a fleet of HTTP tool servers.
 *
 * <h2>Architecture</h2>
 * <pre>
 * caller
 *   -> McpClient.invoke(destination, operation, payload)
 *        resolve in DestinationRegistry
 *        throttle, acquire parallelism slot
 *   -> Transport.request(CallEnvelope)           one per destination
 *        compress, send, retry with backoff, update NetworkStats
 *   <- TransportResponse
 *        check status, validate, update ClientStats
 *   <- JsonNode
 * </pre>
 *
 * <h2>Packages</h2>
 * <ul>
 *   <li>{@code domain} - Model records, retry schedules, operating-mode presets</li>
 *   <li>{@code exception} - Unchecked error taxonomy</li>
 *   <li>{@code infrastructure} - Config, registry, HTTP transports, metrics</li>
 *   <li>{@code client} - The facade</li>
 * </ul>
 *
 * @see fr.lapetina.mcp.client.McpClientFactory
 * @see fr.lapetina.mcp.client.client.McpClient
 */
package fr.lapetina.mcp.client;
