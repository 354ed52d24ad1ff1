package fr.lapetina.mcp.client.infrastructure.metrics;

import fr.lapetina.mcp.client.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToDoubleFunction;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Per-destination wire counters read from each transport's {@link NetworkStats}
 * - Client-level invocation counters read from {@link ClientStats}
 * - Invocation latency timers per destination and operation
 * - Error counters by type
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final Set<String> boundDestinations = ConcurrentHashMap.newKeySet();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("mcp_client");
    }

    /**
     * Exposes a transport's counters. Binding the same destination twice is a no-op.
     */
    public void bindTransport(String destination, NetworkStats stats) {
        if (!boundDestinations.add(destination)) {
            return;
        }
        destinationCounter("_bytes_sent", "Request bytes written", destination, stats, NetworkStats::getBytesSent);
        destinationCounter("_bytes_received", "Response bytes read", destination, stats, NetworkStats::getBytesReceived);
        destinationCounter("_attempts_total", "HTTP attempts issued", destination, stats, NetworkStats::getRequestsSent);
        destinationCounter("_transport_succeeded_total", "Requests that succeeded", destination, stats,
                NetworkStats::getRequestsSucceeded);
        destinationCounter("_transport_failed_total", "Requests that failed after all attempts", destination, stats,
                NetworkStats::getRequestsFailed);
        destinationCounter("_retries_total", "Retries performed", destination, stats, NetworkStats::getRetriedRequests);
        destinationCounter("_connection_errors_total", "Connection-level failures", destination, stats,
                NetworkStats::getConnectionErrors);
        destinationCounter("_timeout_errors_total", "Timed out attempts", destination, stats,
                NetworkStats::getTimeoutErrors);

        Gauge.builder(prefix + "_avg_latency_ms", stats, NetworkStats::getAvgLatencyMs)
                .description("Mean attempt latency")
                .tag("destination", destination)
                .register(registry);

        Gauge.builder(prefix + "_compression_ratio", stats, NetworkStats::getCompressionRatio)
                .description("Uncompressed over compressed request size")
                .tag("destination", destination)
                .register(registry);

        log.debug("Transport metrics bound: destination={}", destination);
    }

    private void destinationCounter(
            String suffix,
            String description,
            String destination,
            NetworkStats stats,
            ToDoubleFunction<NetworkStats> reader
    ) {
        FunctionCounter.builder(prefix + suffix, stats, reader)
                .description(description)
                .tag("destination", destination)
                .register(registry);
    }

    /**
     * Exposes a facade's invocation counters.
     */
    public void bindClient(ClientStats stats) {
        FunctionCounter.builder(prefix + "_invocations_total", stats, ClientStats::getRequestsSent)
                .description("Invocations issued")
                .register(registry);
        FunctionCounter.builder(prefix + "_invocations_succeeded_total", stats, ClientStats::getRequestsSucceeded)
                .description("Invocations that succeeded")
                .register(registry);
        FunctionCounter.builder(prefix + "_invocations_failed_total", stats, ClientStats::getRequestsFailed)
                .description("Invocations that failed")
                .register(registry);
    }

    /**
     * Records invocation latency.
     */
    public void recordLatency(String destination, String operation, boolean success, Duration latency) {
        String outcome = success ? "success" : "failure";
        String key = destination + ":" + operation + ":" + outcome;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_invocation_latency")
                        .description("Invocation latency")
                        .tag("destination", destination)
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String destination, ErrorType errorType) {
        String key = destination + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("destination", destination)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
