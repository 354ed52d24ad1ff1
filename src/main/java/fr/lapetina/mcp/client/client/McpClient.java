package fr.lapetina.mcp.client.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.mcp.client.domain.mode.OperatingMode;
import fr.lapetina.mcp.client.domain.model.CallEnvelope;
import fr.lapetina.mcp.client.domain.model.Destination;
import fr.lapetina.mcp.client.domain.model.ErrorType;
import fr.lapetina.mcp.client.domain.model.FanOutCall;
import fr.lapetina.mcp.client.domain.model.InvocationResult;
import fr.lapetina.mcp.client.domain.model.TransportResponse;
import fr.lapetina.mcp.client.exception.InvalidResponseException;
import fr.lapetina.mcp.client.exception.InvocationErrorException;
import fr.lapetina.mcp.client.exception.InvocationFailedException;
import fr.lapetina.mcp.client.exception.McpClientException;
import fr.lapetina.mcp.client.exception.RequestTimeoutException;
import fr.lapetina.mcp.client.exception.TransportClosedException;
import fr.lapetina.mcp.client.infrastructure.config.ClientConfig;
import fr.lapetina.mcp.client.infrastructure.config.TransportConfig;
import fr.lapetina.mcp.client.infrastructure.http.Transport;
import fr.lapetina.mcp.client.infrastructure.http.TransportFactory;
import fr.lapetina.mcp.client.infrastructure.metrics.ClientStats;
import fr.lapetina.mcp.client.infrastructure.metrics.ClientStatsSnapshot;
import fr.lapetina.mcp.client.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mcp.client.infrastructure.metrics.NetworkStatsSnapshot;
import fr.lapetina.mcp.client.infrastructure.registry.DestinationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Operation-level client over a fleet of tool servers.
 *
 * Invocations resolve the destination in the registry, create its transport on first use,
 * pass the throttle and the parallelism gate, then POST
 * {@code {"operation": ..., "arguments": ...}} to {@code {baseUrl}/invoke/{operation}}.
 * Every failure reaches the caller as an {@link InvocationFailedException}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (McpClient client = McpClient.builder()
 *         .registry(DestinationRegistry.load("mcp-servers.json"))
 *         .mode(OperatingMode.RESILIENT)
 *         .build()) {
 *     JsonNode result = client.invoke("search", "query", Map.of("q", "java"));
 * }
 * }</pre>
 *
 * Thread-safe. Owns its transports, its stats and, unless one was supplied, its metrics registry.
 */
public final class McpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);

    static final String MDC_DESTINATION = "destination";
    static final String MDC_OPERATION = "operation";

    private final DestinationRegistry registry;
    private final OperatingMode mode;
    private final TransportConfig transportConfig;
    private final ClientConfig clientConfig;
    private final TransportFactory transportFactory;
    private final MetricsRegistry metrics;
    private final boolean ownsMetrics;
    private final Map<String, String> defaultHeaders;
    private final Map<String, Map<String, String>> destinationHeaders;

    private final ObjectMapper objectMapper;
    private final ClientStats stats = new ClientStats();
    private final Map<String, Transport> transports = new ConcurrentHashMap<>();
    private final Semaphore parallelism;
    private final RequestThrottler throttler;
    private final ExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private McpClient(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "Destination registry is required");
        this.mode = builder.mode;
        this.transportConfig = builder.transportConfig != null ? builder.transportConfig : mode.transportConfig();
        this.clientConfig = builder.clientConfig != null ? builder.clientConfig : mode.clientConfig();
        this.transportFactory = builder.transportFactory;
        this.ownsMetrics = builder.metricsRegistry == null;
        this.metrics = ownsMetrics ? new MetricsRegistry() : builder.metricsRegistry;
        this.defaultHeaders = Map.copyOf(builder.defaultHeaders);
        Map<String, Map<String, String>> perDestination = new HashMap<>();
        builder.destinationHeaders.forEach((name, headers) -> perDestination.put(name, Map.copyOf(headers)));
        this.destinationHeaders = Map.copyOf(perDestination);

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        this.parallelism = new Semaphore(clientConfig.maxParallelRequests(), true);
        this.throttler = clientConfig.enableThrottling()
                ? new RequestThrottler(clientConfig.requestsPerSecond())
                : null;

        AtomicInteger threadCounter = new AtomicInteger(0);
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "mcp-client-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        metrics.bindClient(stats);

        log.info("McpClient created: mode={}, destinations={}, maxParallelRequests={}, batchSize={}, throttling={}",
                mode.configName(), registry.size(), clientConfig.maxParallelRequests(), clientConfig.batchSize(),
                throttler != null ? clientConfig.requestsPerSecond() + "rps" : "off");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Invokes an operation with the default call deadline.
     *
     * @see #invoke(String, String, Object, Duration)
     */
    public JsonNode invoke(String destination, String operation, Object payload) {
        return invoke(destination, operation, payload, null);
    }

    /**
     * Invokes an operation on a destination and returns its decoded result.
     *
     * @param destination registry name
     * @param operation   operation name, appended to {@code /invoke/}
     * @param payload     arguments; any Jackson-serializable value, may be null
     * @param timeout     whole-call deadline, or null for connect plus request timeout
     * @return the JSON result, or a text node when the destination did not answer JSON
     * @throws InvocationFailedException on any failure, with the original error as cause
     */
    public JsonNode invoke(String destination, String operation, Object payload, Duration timeout) {
        long start = System.nanoTime();
        MDC.put(MDC_DESTINATION, destination);
        MDC.put(MDC_OPERATION, operation);
        stats.recordSent();
        try {
            JsonNode result = doInvoke(destination, operation, payload, timeout);
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            stats.recordSuccess(latency);
            metrics.recordLatency(destination, operation, true, latency);
            log.debug("Invocation succeeded: destination={}, operation={}, latencyMs={}",
                    destination, operation, latency.toMillis());
            return result;
        } catch (RuntimeException e) {
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            stats.recordFailure(latency);
            metrics.recordLatency(destination, operation, false, latency);
            ErrorType errorType = e instanceof McpClientException
                    ? ((McpClientException) e).getErrorType()
                    : ErrorType.INTERNAL_ERROR;
            metrics.incrementErrorCount(destination, errorType);
            log.warn("Invocation failed: destination={}, operation={}, errorType={}, latencyMs={}, error={}",
                    destination, operation, errorType, latency.toMillis(), e.getMessage());
            throw new InvocationFailedException(destination, operation, e);
        } finally {
            MDC.remove(MDC_DESTINATION);
            MDC.remove(MDC_OPERATION);
        }
    }

    private JsonNode doInvoke(String destination, String operation, Object payload, Duration timeout) {
        Destination target = registry.resolve(destination);
        Transport transport = transportFor(target);

        Duration callTimeout = timeout != null ? timeout : transportConfig.defaultCallTimeout();
        long deadline = System.nanoTime() + callTimeout.toNanos();

        if (throttler != null) {
            throttler.acquire(deadline);
        }
        acquireSlot(deadline);
        try {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new RequestTimeoutException("Call deadline expired before dispatch: destination=" + destination);
            }
            CallEnvelope envelope = CallEnvelope.post(
                    target.invokeUri(operation),
                    buildBody(operation, payload),
                    Duration.ofNanos(remaining))
                    .withHeaders(headersFor(destination));

            TransportResponse response = transport.request(envelope);
            if (response.status() != 200) {
                throw new InvocationErrorException(response.status());
            }

            JsonNode result = unwrap(response);
            if (clientConfig.enableResponseValidation()) {
                validate(result);
            }
            return result;
        } finally {
            parallelism.release();
        }
    }

    /**
     * Client-wide headers overlaid with the destination's own; destination values win.
     */
    Map<String, String> headersFor(String destination) {
        Map<String, String> specific = destinationHeaders.get(destination);
        if (specific == null || specific.isEmpty()) {
            return defaultHeaders;
        }
        Map<String, String> merged = new HashMap<>(defaultHeaders);
        merged.putAll(specific);
        return merged;
    }

    private void acquireSlot(long deadline) {
        boolean acquired;
        try {
            acquired = parallelism.tryAcquire(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestTimeoutException("Interrupted waiting for a parallelism slot", e);
        }
        if (!acquired) {
            throw new RequestTimeoutException("Call deadline expired waiting for a parallelism slot");
        }
    }

    private ObjectNode buildBody(String operation, Object payload) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("operation", operation);
        body.set("arguments", payload == null ? NullNode.getInstance() : objectMapper.valueToTree(payload));
        return body;
    }

    private JsonNode unwrap(TransportResponse response) {
        if (response.isJson()) {
            return response.json();
        }
        if (response.rawBody().length == 0) {
            return NullNode.getInstance();
        }
        return TextNode.valueOf(response.bodyAsString());
    }

    private void validate(JsonNode result) {
        if (result == null || result.isNull() || result.isMissingNode()) {
            throw new InvalidResponseException("Destination returned a null result");
        }
        if (result.isObject() && result.has("error")) {
            JsonNode error = result.get("error");
            throw new InvalidResponseException("Destination returned an error: "
                    + (error.isTextual() ? error.asText() : error.toString()));
        }
    }

    private Transport transportFor(Destination target) {
        if (closed.get()) {
            throw new TransportClosedException(target.name());
        }
        Transport transport = transports.get(target.name());
        if (transport == null) {
            // Initialization resolves DNS, so it runs outside the map
            Transport created = transportFactory.create(target, transportConfig);
            created.initialize();
            transport = transports.putIfAbsent(target.name(), created);
            if (transport == null) {
                transport = created;
                metrics.bindTransport(target.name(), created.getStats());
            } else if (transport != created) {
                log.debug("Discarding concurrently created transport: destination={}", target.name());
                created.shutdown();
            }
        }
        // Lost a race with shutdown
        if (closed.get()) {
            transport.shutdown();
            throw new TransportClosedException(target.name());
        }
        return transport;
    }

    /**
     * Invokes an operation on the client's worker pool.
     *
     * @return a future completed with the result, or exceptionally with an {@link InvocationFailedException}
     */
    public CompletableFuture<JsonNode> invokeAsync(String destination, String operation, Object payload) {
        return invokeAsync(destination, operation, payload, null);
    }

    public CompletableFuture<JsonNode> invokeAsync(
            String destination,
            String operation,
            Object payload,
            Duration timeout
    ) {
        try {
            return CompletableFuture.supplyAsync(() -> invoke(destination, operation, payload, timeout), executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new InvocationFailedException(destination, operation,
                    new TransportClosedException(destination)));
        }
    }

    /**
     * Invokes the same operation once per payload.
     *
     * Payloads are processed in consecutive chunks of {@code batchSize}; the items of a chunk run
     * concurrently and the next chunk starts once the whole chunk has completed. The returned list
     * has one result per payload, in input order. Failures are reported per item.
     */
    public List<InvocationResult> batchInvoke(String destination, String operation, List<?> payloads) {
        if (closed.get()) {
            return payloads.stream()
                    .map(payload -> closedResult(destination, operation))
                    .toList();
        }
        int batchSize = clientConfig.batchSize();
        int total = payloads.size();
        List<InvocationResult> results = new ArrayList<>(total);

        int chunkIndex = 0;
        for (int from = 0; from < total; from += batchSize) {
            List<?> chunk = payloads.subList(from, Math.min(from + batchSize, total));
            List<CompletableFuture<InvocationResult>> futures = chunk.stream()
                    .map(payload -> submit(destination, operation, payload))
                    .toList();
            for (CompletableFuture<InvocationResult> future : futures) {
                results.add(future.join());
            }
            log.debug("Batch chunk completed: destination={}, operation={}, chunk={}, size={}",
                    destination, operation, chunkIndex++, chunk.size());
        }

        long failed = results.stream().filter(InvocationResult::isError).count();
        log.info("Batch completed: destination={}, operation={}, items={}, chunks={}, failed={}",
                destination, operation, total, chunkIndex, failed);
        return results;
    }

    /**
     * Issues independent calls concurrently, bounded by the parallelism gate.
     *
     * @return one result per call, keyed by the call's index in {@code calls}
     */
    public Map<Integer, InvocationResult> fanOut(List<FanOutCall> calls) {
        List<CompletableFuture<InvocationResult>> futures = calls.stream()
                .map(call -> submit(call.destination(), call.operation(), call.payload()))
                .toList();

        Map<Integer, InvocationResult> results = new TreeMap<>();
        for (int i = 0; i < futures.size(); i++) {
            results.put(i, futures.get(i).join());
        }

        long failed = results.values().stream().filter(InvocationResult::isError).count();
        log.info("Fan-out completed: calls={}, failed={}", calls.size(), failed);
        return results;
    }

    private CompletableFuture<InvocationResult> submit(String destination, String operation, Object payload) {
        if (closed.get()) {
            return CompletableFuture.completedFuture(closedResult(destination, operation));
        }
        try {
            return CompletableFuture.supplyAsync(() -> invokeForResult(destination, operation, payload), executor);
        } catch (RejectedExecutionException e) {
            // Pool stopped by a concurrent shutdown
            return CompletableFuture.completedFuture(closedResult(destination, operation));
        }
    }

    private InvocationResult closedResult(String destination, String operation) {
        return InvocationResult.error(destination, operation, ErrorType.TRANSPORT_CLOSED,
                "Client is shut down", Duration.ZERO);
    }

    private InvocationResult invokeForResult(String destination, String operation, Object payload) {
        long start = System.nanoTime();
        try {
            JsonNode value = invoke(destination, operation, payload);
            return InvocationResult.success(destination, operation, value,
                    Duration.ofNanos(System.nanoTime() - start));
        } catch (InvocationFailedException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return InvocationResult.error(destination, operation, e.getCauseType(), cause.getMessage(),
                    Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Probes one destination's health endpoint.
     *
     * @throws fr.lapetina.mcp.client.exception.DestinationNotFoundException for unknown names
     */
    public boolean healthCheck(String destination) {
        Destination target = registry.resolve(destination);
        return transportFor(target).healthCheck().join();
    }

    /**
     * Probes every registered destination concurrently.
     *
     * @return destination name to health, in registry order
     */
    public Map<String, Boolean> healthCheckAll() {
        Map<String, CompletableFuture<Boolean>> pending = new LinkedHashMap<>();
        for (Destination target : registry.all()) {
            pending.put(target.name(), transportFor(target).healthCheck());
        }
        Map<String, Boolean> results = new LinkedHashMap<>();
        pending.forEach((name, future) -> results.put(name, future.join()));
        return results;
    }

    public List<String> destinations() {
        return registry.names();
    }

    public ClientStatsSnapshot stats() {
        return stats.snapshot();
    }

    /**
     * Wire counters of a destination whose transport has been created.
     */
    public Optional<NetworkStatsSnapshot> networkStats(String destination) {
        Transport transport = transports.get(destination);
        return transport != null ? Optional.of(transport.getStats().snapshot()) : Optional.empty();
    }

    /**
     * Resets the invocation counters and the wire counters of every transport.
     */
    public void resetStats() {
        stats.reset();
        transports.values().forEach(transport -> transport.getStats().reset());
        log.info("Statistics reset");
    }

    public OperatingMode getMode() {
        return mode;
    }

    public TransportConfig getTransportConfig() {
        return transportConfig;
    }

    public ClientConfig getClientConfig() {
        return clientConfig;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metrics;
    }

    public DestinationRegistry getRegistry() {
        return registry;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Shuts down every transport and the worker pool. Idempotent.
     */
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down McpClient: transports={}", transports.size());

        transports.values().forEach(Transport::shutdown);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(transportConfig.getShutdownDrainTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (ownsMetrics) {
            metrics.close();
        }

        log.info("McpClient shutdown complete");
    }

    @Override
    public void close() {
        shutdown();
    }

    public static final class Builder {
        private DestinationRegistry registry;
        private OperatingMode mode = OperatingMode.STANDARD;
        private TransportConfig transportConfig;
        private ClientConfig clientConfig;
        private TransportFactory transportFactory = TransportFactory.http();
        private MetricsRegistry metricsRegistry;
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> destinationHeaders = new HashMap<>();

        public Builder registry(DestinationRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Selects the preset used for any config not set explicitly.
         */
        public Builder mode(OperatingMode mode) {
            this.mode = Objects.requireNonNull(mode, "Mode is required");
            return this;
        }

        public Builder transportConfig(TransportConfig transportConfig) {
            this.transportConfig = transportConfig;
            return this;
        }

        public Builder clientConfig(ClientConfig clientConfig) {
            this.clientConfig = clientConfig;
            return this;
        }

        public Builder transportFactory(TransportFactory transportFactory) {
            this.transportFactory = Objects.requireNonNull(transportFactory, "Transport factory is required");
            return this;
        }

        /**
         * Shares an existing registry; the client will not close it.
         */
        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        /**
         * Opaque headers, e.g. credentials, sent with every invocation.
         */
        public Builder defaultHeaders(Map<String, String> headers) {
            this.defaultHeaders.putAll(headers);
            return this;
        }

        public Builder defaultHeader(String name, String value) {
            this.defaultHeaders.put(name, value);
            return this;
        }

        /**
         * Headers sent only to one destination, overriding client-wide ones with the same name.
         */
        public Builder destinationHeaders(String destination, Map<String, String> headers) {
            this.destinationHeaders.computeIfAbsent(destination, k -> new LinkedHashMap<>()).putAll(headers);
            return this;
        }

        public McpClient build() {
            return new McpClient(this);
        }
    }
}
