package fr.lapetina.mcp.client.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.mcp.client.domain.model.CallEnvelope;
import fr.lapetina.mcp.client.domain.model.Destination;
import fr.lapetina.mcp.client.domain.model.TransportResponse;
import fr.lapetina.mcp.client.domain.retry.BackoffCalculator;
import fr.lapetina.mcp.client.exception.CircuitOpenException;
import fr.lapetina.mcp.client.exception.ConnectionException;
import fr.lapetina.mcp.client.exception.InvalidResponseException;
import fr.lapetina.mcp.client.exception.McpClientException;
import fr.lapetina.mcp.client.exception.RequestFailedException;
import fr.lapetina.mcp.client.exception.RequestTimeoutException;
import fr.lapetina.mcp.client.exception.TransportClosedException;
import fr.lapetina.mcp.client.exception.TransportInitException;
import fr.lapetina.mcp.client.infrastructure.config.TransportConfig;
import fr.lapetina.mcp.client.infrastructure.metrics.NetworkStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HTTP transport for one destination.
 *
 * Uses java.net.http.HttpClient, whose connection pool is bounded here by a semaphore of
 * {@link TransportConfig#effectiveConnectionLimit()} permits. Each logical request runs a
 * retry loop with jittered backoff under a single call deadline, and is guarded by a
 * circuit breaker.
 */
public final class HttpTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);

    private static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(5);
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final Destination destination;
    private final TransportConfig config;
    private final ObjectMapper objectMapper;
    private final PayloadCompressor compressor;
    private final BackoffCalculator backoff;
    private final CircuitBreaker circuitBreaker;
    private final NetworkStats stats;
    private final Semaphore connectionPermits;

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicLong lastDnsResolveNanos = new AtomicLong(0);

    private volatile HttpClient httpClient;
    private volatile ExecutorService executor;

    public HttpTransport(Destination destination, TransportConfig config) {
        this(destination, config, config.backoffCalculator());
    }

    HttpTransport(Destination destination, TransportConfig config, BackoffCalculator backoff) {
        this.destination = destination;
        this.config = config;
        this.backoff = backoff;
        this.compressor = new PayloadCompressor(
                config.isCompressionEnabled(),
                config.getCompressionAlgorithm(),
                config.getCompressionThresholdBytes());
        this.circuitBreaker = CircuitBreaker.forDestination(destination.name(), config);
        this.stats = new NetworkStats(destination.name());
        this.connectionPermits = new Semaphore(config.effectiveConnectionLimit(), true);
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public void initialize() {
        if (closed.get()) {
            throw new TransportClosedException(destination.name());
        }
        if (initialized.get()) {
            return;
        }
        synchronized (this) {
            if (initialized.get()) {
                return;
            }
            AtomicInteger threadCounter = new AtomicInteger(0);
            this.executor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "mcp-transport-" + destination.name() + "-" + threadCounter.getAndIncrement());
                t.setDaemon(true);
                return t;
            });
            this.httpClient = HttpClient.newBuilder()
                    .connectTimeout(config.getConnectTimeout())
                    .version(HttpClient.Version.HTTP_1_1)
                    .executor(executor)
                    .build();
            resolveHost();
            initialized.set(true);
        }

        log.info("Transport initialized: destination={}, baseUrl={}, connectionLimit={}, keepalive={}, config={}",
                destination.name(), destination.baseUrl(), config.effectiveConnectionLimit(),
                config.isKeepaliveEnabled(), config);
    }

    private void resolveHost() {
        lastDnsResolveNanos.set(System.nanoTime());
        String host = destination.host();
        if (host == null) {
            return;
        }
        try {
            InetAddress[] addresses = InetAddress.getAllByName(host);
            log.debug("Destination resolved: destination={}, host={}, addresses={}",
                    destination.name(), host, addresses.length);
        } catch (UnknownHostException e) {
            TransportInitException failure = new TransportInitException(destination.name(), e);
            log.warn("DNS resolution failed, continuing: destination={}, host={}, error={}",
                    destination.name(), host, failure.getMessage());
        }
    }

    private void refreshDnsIfStale() {
        long last = lastDnsResolveNanos.get();
        long ttl = config.getDnsCacheTtl().toNanos();
        if (System.nanoTime() - last >= ttl && lastDnsResolveNanos.compareAndSet(last, System.nanoTime())) {
            resolveHost();
        }
    }

    @Override
    public TransportResponse request(CallEnvelope envelope) {
        if (closed.get()) {
            throw new TransportClosedException(destination.name());
        }
        initialize();

        inFlight.incrementAndGet();
        try {
            // Shutdown may have started between the check above and the increment
            if (closed.get()) {
                throw new TransportClosedException(destination.name());
            }
            if (!circuitBreaker.allowRequest()) {
                Duration retryAfter = circuitBreaker.remainingOpenTime();
                log.warn("Request blocked by circuit breaker: destination={}, url={}, retryAfterMs={}",
                        destination.name(), envelope.url(), retryAfter.toMillis());
                stats.recordFailure();
                throw new CircuitOpenException(destination.name(), retryAfter);
            }

            try {
                TransportResponse response = execute(envelope);
                circuitBreaker.recordSuccess();
                stats.recordSuccess();
                return response;
            } catch (McpClientException e) {
                circuitBreaker.recordFailure();
                stats.recordFailure();
                throw e;
            }
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private TransportResponse execute(CallEnvelope envelope) {
        Duration timeout = envelope.timeout() != null ? envelope.timeout() : config.defaultCallTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        String url = envelope.url().toString();

        PayloadCompressor.Encoded encoded = encodeBody(envelope);
        if (encoded != null && encoded.isCompressed()) {
            stats.recordCompression(encoded.originalSize(), encoded.body().length);
        }

        refreshDnsIfStale();

        int maxAttempts = config.effectiveMaxRetries() + 1;
        McpClientException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new RequestTimeoutException(
                        "Call deadline of " + timeout.toMillis() + "ms expired: url=" + url, lastError);
            }

            HttpResponse<byte[]> response;
            try {
                response = send(envelope, encoded, remaining);
                lastError = null;
            } catch (HttpTimeoutException e) {
                stats.recordTimeoutError();
                lastError = new RequestTimeoutException("Attempt timed out: url=" + url, e);
                response = null;
            } catch (IOException e) {
                stats.recordConnectionError();
                lastError = new ConnectionException("Connection failed: url=" + url + ", error=" + e.getMessage(), e);
                response = null;
            }

            if (response != null) {
                int status = response.statusCode();
                if (!envelope.isRetryable(status)) {
                    if (status >= 400) {
                        log.error("Request failed with non-retryable status: destination={}, url={}, status={}, attempt={}",
                                destination.name(), url, status, attempt);
                        throw new RequestFailedException(url, status, attempt);
                    }
                    log.debug("Request completed: destination={}, url={}, status={}, attempt={}",
                            destination.name(), url, status, attempt);
                    return decode(response, attempt);
                }
                if (attempt == maxAttempts) {
                    log.error("Retries exhausted: destination={}, url={}, status={}, attempts={}",
                            destination.name(), url, status, attempt);
                    throw new RequestFailedException(url, status, attempt);
                }
                log.warn("Retryable status: destination={}, url={}, status={}, attempt={}",
                        destination.name(), url, status, attempt);
            } else {
                if (lastError instanceof RequestTimeoutException && deadline - System.nanoTime() <= 0) {
                    log.error("Request timed out: destination={}, url={}, attempt={}", destination.name(), url, attempt);
                    throw lastError;
                }
                if (attempt == maxAttempts) {
                    log.error("Retries exhausted: destination={}, url={}, attempts={}, error={}",
                            destination.name(), url, attempt, lastError.getMessage());
                    throw new RequestFailedException(url, attempt, lastError);
                }
                log.warn("Transport error: destination={}, url={}, attempt={}, error={}",
                        destination.name(), url, attempt, lastError.getMessage());
            }

            backoffBeforeRetry(attempt, deadline, url, lastError);
        }

        // Unreachable: the last iteration always returns or throws
        throw new IllegalStateException("Retry loop exited without outcome: url=" + url);
    }

    private void backoffBeforeRetry(int attempt, long deadline, String url, McpClientException lastError) {
        Duration delay = backoff.delayFor(attempt);
        long remaining = deadline - System.nanoTime();
        if (delay.toNanos() >= remaining) {
            log.error("Call deadline expires during backoff: destination={}, url={}, delayMs={}, remainingMs={}",
                    destination.name(), url, delay.toMillis(), TimeUnit.NANOSECONDS.toMillis(remaining));
            throw new RequestTimeoutException("Call deadline expires during retry backoff: url=" + url, lastError);
        }
        stats.recordRetry();
        log.debug("Backing off before retry: destination={}, retry={}, delayMs={}",
                destination.name(), attempt, delay.toMillis());
        try {
            Thread.sleep(delay.toMillis(), delay.toNanosPart() % 1_000_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestTimeoutException("Interrupted during retry backoff: url=" + url, e);
        }
    }

    private HttpResponse<byte[]> send(CallEnvelope envelope, PayloadCompressor.Encoded encoded, long remainingNanos)
            throws IOException {
        boolean acquired;
        try {
            acquired = connectionPermits.tryAcquire(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestTimeoutException("Interrupted waiting for a connection: url=" + envelope.url(), e);
        }
        if (!acquired) {
            throw new HttpTimeoutException("No connection available before deadline");
        }

        try {
            HttpRequest request = buildRequest(envelope, encoded, Duration.ofNanos(remainingNanos));
            long start = System.nanoTime();
            stats.recordAttempt(encoded != null ? encoded.body().length : 0);

            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());

            stats.recordResponse(response.body().length, Duration.ofNanos(System.nanoTime() - start));
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestTimeoutException("Interrupted during request: url=" + envelope.url(), e);
        } finally {
            connectionPermits.release();
        }
    }

    private HttpRequest buildRequest(CallEnvelope envelope, PayloadCompressor.Encoded encoded, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(envelope.url())
                .timeout(timeout)
                .header("Accept", JSON_CONTENT_TYPE)
                .header("Accept-Encoding", "gzip");

        for (Map.Entry<String, String> header : envelope.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        if (encoded == null) {
            return builder.method(envelope.method(), HttpRequest.BodyPublishers.noBody()).build();
        }

        builder.header("Content-Type", JSON_CONTENT_TYPE);
        if (encoded.isCompressed()) {
            builder.header("Content-Encoding", encoded.contentEncoding());
        }
        return builder.method(envelope.method(), HttpRequest.BodyPublishers.ofByteArray(encoded.body())).build();
    }

    private PayloadCompressor.Encoded encodeBody(CallEnvelope envelope) {
        if (envelope.body() == null) {
            return null;
        }
        try {
            return compressor.encode(objectMapper.writeValueAsBytes(envelope.body()));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not serializable: " + e.getMessage(), e);
        }
    }

    private TransportResponse decode(HttpResponse<byte[]> response, int attempts) {
        byte[] body;
        try {
            body = PayloadCompressor.decode(response.body(),
                    response.headers().firstValue("Content-Encoding").orElse(null));
        } catch (IOException e) {
            throw new InvalidResponseException("Unreadable compressed response body: " + e.getMessage());
        }

        String contentType = response.headers().firstValue("Content-Type").orElse("");
        JsonNode json = null;
        if (contentType.toLowerCase(Locale.ROOT).contains(JSON_CONTENT_TYPE) && body.length > 0) {
            try {
                json = objectMapper.readTree(body);
            } catch (IOException e) {
                throw new InvalidResponseException("Malformed JSON response body: " + e.getMessage());
            }
        }

        return new TransportResponse(response.statusCode(), json, body, response.headers().map(), attempts);
    }

    @Override
    public CompletableFuture<Boolean> healthCheck() {
        if (closed.get()) {
            return CompletableFuture.completedFuture(false);
        }
        initialize();

        URI uri = destination.healthUri();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(HEALTH_CHECK_TIMEOUT)
                .GET()
                .build();

        log.debug("Health check started: destination={}, uri={}", destination.name(), uri);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean healthy = response.statusCode() == 200;
                    if (healthy) {
                        log.debug("Health check passed: destination={}, status={}",
                                destination.name(), response.statusCode());
                    } else {
                        log.warn("Health check failed: destination={}, status={}",
                                destination.name(), response.statusCode());
                    }
                    return healthy;
                })
                .exceptionally(ex -> {
                    log.warn("Health check error: destination={}, error={}", destination.name(), ex.getMessage());
                    return false;
                });
    }

    @Override
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        long drainDeadline = System.nanoTime() + config.getShutdownDrainTimeout().toNanos();
        try {
            while (inFlight.get() > 0 && System.nanoTime() < drainDeadline) {
                Thread.sleep(10);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining in-flight requests: destination={}", destination.name());
        }
        if (inFlight.get() > 0) {
            log.warn("Shutdown drain timed out: destination={}, inFlight={}", destination.name(), inFlight.get());
        }

        ExecutorService pool = executor;
        if (pool != null) {
            pool.shutdown();
        }

        log.info("Transport shut down: destination={}, requestsSent={}, requestsFailed={}",
                destination.name(), stats.getRequestsSent(), stats.getRequestsFailed());
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public Destination getDestination() {
        return destination;
    }

    @Override
    public NetworkStats getStats() {
        return stats;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public TransportConfig getConfig() {
        return config;
    }
}
