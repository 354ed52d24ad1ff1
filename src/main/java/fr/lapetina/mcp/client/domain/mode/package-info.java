/**
 * Operating-mode presets.
 *
 * <p>A mode bundles a {@link fr.lapetina.mcp.client.infrastructure.config.TransportConfig} and a
 * {@link fr.lapetina.mcp.client.infrastructure.config.ClientConfig} so deployments can switch
 * behavior by name without code changes.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * OperatingMode mode = OperatingMode.fromName("resilient");
 * McpClient client = McpClient.builder()
 *         .registry(registry)
 *         .mode(mode)
 *         .build();
 * }</pre>
 */
package fr.lapetina.mcp.client.domain.mode;
