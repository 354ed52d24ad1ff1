package fr.lapetina.mcp.client.domain.model;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A named backend tool server reachable over HTTP.
 * Immutable and thread-safe.
 *
 * @param name    registry key
 * @param baseUrl base URL without trailing slash
 */
public record Destination(String name, URI baseUrl) {

    public Destination {
        Objects.requireNonNull(name, "Destination name is required");
        Objects.requireNonNull(baseUrl, "Base URL is required");
        String raw = baseUrl.toString();
        if (raw.endsWith("/")) {
            baseUrl = URI.create(raw.replaceAll("/+$", ""));
        }
    }

    public static Destination of(String name, String baseUrl) {
        return new Destination(name, URI.create(baseUrl));
    }

    /**
     * Resolves a path relative to the base URL.
     *
     * @param path path starting with '/'
     */
    public URI resolve(String path) {
        return URI.create(baseUrl + path);
    }

    /**
     * Invoke endpoint for an operation. The operation name is percent-encoded as a single
     * path segment, so {@code /}, {@code ?} and {@code #} never change the route.
     *
     * @throws IllegalArgumentException for a null or blank operation
     */
    public URI invokeUri(String operation) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("Operation name is required");
        }
        return resolve("/invoke/" + encodePathSegment(operation));
    }

    static String encodePathSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public URI healthUri() {
        return resolve("/health");
    }

    public String host() {
        return baseUrl.getHost();
    }
}
