/**
 * Transport and client configuration.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.mcp.client.infrastructure.config.TransportConfig} - Per-destination transport settings</li>
 *   <li>{@link fr.lapetina.mcp.client.infrastructure.config.ClientConfig} - Facade settings</li>
 *   <li>{@link fr.lapetina.mcp.client.infrastructure.config.ClientSettings} - YAML settings model with overrides</li>
 *   <li>{@link fr.lapetina.mcp.client.infrastructure.config.SettingsLoader} - YAML loading from file or classpath</li>
 * </ul>
 *
 * <h2>Settings Sections</h2>
 * <ul>
 *   <li>{@code mode} - Operating mode preset name</li>
 *   <li>{@code registryPath} - Destination registry JSON file</li>
 *   <li>{@code metricsPrefix} - Prefix of Prometheus meter names</li>
 *   <li>{@code transport} - Transport overrides (timeouts, compression, retry, circuit breaker)</li>
 *   <li>{@code client} - Facade overrides (batching, parallelism, validation, throttling)</li>
 * </ul>
 */
package fr.lapetina.mcp.client.infrastructure.config;
