package fr.lapetina.mcp.client.infrastructure.metrics;

import java.time.Instant;

/**
 * Point-in-time copy of a facade's {@link ClientStats}.
 *
 * @param avgLatencyMs total latency divided by completed (succeeded + failed) invocations
 */
public record ClientStatsSnapshot(
        long requestsSent,
        long requestsSucceeded,
        long requestsFailed,
        double totalLatencyMs,
        double avgLatencyMs,
        Instant capturedAt
) {
}
