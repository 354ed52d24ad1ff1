package fr.lapetina.mcp.client.infrastructure.config;

/**
 * Facade settings. Immutable.
 *
 * @param batchSize                items issued concurrently per batch chunk
 * @param maxParallelRequests      permits of the facade-wide parallelism gate
 * @param enableResponseValidation reject null and {error: ...} results
 * @param enableThrottling         enforce a minimum interval between requests
 * @param requestsPerSecond        throttling ceiling
 */
public record ClientConfig(
        int batchSize,
        int maxParallelRequests,
        boolean enableResponseValidation,
        boolean enableThrottling,
        double requestsPerSecond
) {
    public ClientConfig {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
        }
        if (maxParallelRequests < 1) {
            throw new IllegalArgumentException("maxParallelRequests must be >= 1, was " + maxParallelRequests);
        }
        if (enableThrottling && !(requestsPerSecond > 0)) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0 when throttling, was " + requestsPerSecond);
        }
    }

    public ClientConfig withBatchSize(int value) {
        return new ClientConfig(value, maxParallelRequests, enableResponseValidation, enableThrottling, requestsPerSecond);
    }

    public ClientConfig withMaxParallelRequests(int value) {
        return new ClientConfig(batchSize, value, enableResponseValidation, enableThrottling, requestsPerSecond);
    }

    public ClientConfig withResponseValidation(boolean value) {
        return new ClientConfig(batchSize, maxParallelRequests, value, enableThrottling, requestsPerSecond);
    }

    public ClientConfig withThrottling(boolean enabled, double rps) {
        return new ClientConfig(batchSize, maxParallelRequests, enableResponseValidation, enabled, rps);
    }
}
