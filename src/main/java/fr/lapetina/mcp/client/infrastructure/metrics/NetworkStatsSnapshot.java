package fr.lapetina.mcp.client.infrastructure.metrics;

import java.time.Instant;

/**
 * Point-in-time copy of a transport's {@link NetworkStats}.
 */
public record NetworkStatsSnapshot(
        String destination,
        long bytesSent,
        long bytesReceived,
        long requestsSent,
        long requestsSucceeded,
        long requestsFailed,
        long retriedRequests,
        long connectionErrors,
        long timeoutErrors,
        double avgLatencyMs,
        double compressionRatio,
        Instant capturedAt
) {
}
