package fr.lapetina.mcp.client.infrastructure.http;

/**
 * Request body compression algorithms.
 */
public enum CompressionAlgorithm {
    NONE(null),
    GZIP("gzip");

    private final String contentEncoding;

    CompressionAlgorithm(String contentEncoding) {
        this.contentEncoding = contentEncoding;
    }

    /**
     * Value of the Content-Encoding header, or null when nothing is applied.
     */
    public String contentEncoding() {
        return contentEncoding;
    }
}
