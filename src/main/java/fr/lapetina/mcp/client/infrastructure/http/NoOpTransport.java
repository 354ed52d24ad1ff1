package fr.lapetina.mcp.client.infrastructure.http;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.mcp.client.domain.model.CallEnvelope;
import fr.lapetina.mcp.client.domain.model.Destination;
import fr.lapetina.mcp.client.domain.model.TransportResponse;
import fr.lapetina.mcp.client.exception.TransportClosedException;
import fr.lapetina.mcp.client.infrastructure.metrics.NetworkStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport that performs no I/O and answers every request with HTTP 200 {@code {"noop": true}}.
 */
public final class NoOpTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(NoOpTransport.class);

    private static final String BODY = "{\"noop\":true}";

    private final Destination destination;
    private final NetworkStats stats;
    private final AtomicInteger requestCount = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public NoOpTransport(Destination destination) {
        this.destination = destination;
        this.stats = new NetworkStats(destination.name());
    }

    @Override
    public void initialize() {
        log.debug("No-op transport initialized: destination={}", destination.name());
    }

    @Override
    public TransportResponse request(CallEnvelope envelope) {
        if (closed.get()) {
            throw new TransportClosedException(destination.name());
        }
        requestCount.incrementAndGet();
        stats.recordAttempt(0);
        stats.recordResponse(0, Duration.ZERO);
        stats.recordSuccess();

        ObjectNode json = JsonNodeFactory.instance.objectNode();
        json.put("noop", true);
        return new TransportResponse(
                200,
                json,
                BODY.getBytes(StandardCharsets.UTF_8),
                Map.of("content-type", List.of("application/json")),
                1
        );
    }

    @Override
    public CompletableFuture<Boolean> healthCheck() {
        return CompletableFuture.completedFuture(!closed.get());
    }

    @Override
    public void shutdown() {
        closed.set(true);
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

    public int getRequestCount() {
        return requestCount.get();
    }
}
