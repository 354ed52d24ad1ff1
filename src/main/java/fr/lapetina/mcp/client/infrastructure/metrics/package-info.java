/**
 * Read-only statistics surface.
 *
 * <p>{@link fr.lapetina.mcp.client.infrastructure.metrics.NetworkStats} and
 * {@link fr.lapetina.mcp.client.infrastructure.metrics.ClientStats} are plain atomic counters owned
 * by a transport and a facade respectively. Snapshots are immutable records.
 * {@link fr.lapetina.mcp.client.infrastructure.metrics.MetricsRegistry} exposes the same counters
 * through Micrometer for Prometheus scraping.
 */
package fr.lapetina.mcp.client.infrastructure.metrics;
