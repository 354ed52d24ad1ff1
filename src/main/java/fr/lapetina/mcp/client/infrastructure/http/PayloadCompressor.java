package fr.lapetina.mcp.client.infrastructure.http;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Applies the configured request compression and inflates gzip responses.
 */
public final class PayloadCompressor {

    private final boolean enabled;
    private final CompressionAlgorithm algorithm;
    private final int thresholdBytes;

    public PayloadCompressor(boolean enabled, CompressionAlgorithm algorithm, int thresholdBytes) {
        this.enabled = enabled;
        this.algorithm = algorithm;
        this.thresholdBytes = thresholdBytes;
    }

    /**
     * Result of {@link #encode}.
     *
     * @param body            bytes to put on the wire
     * @param contentEncoding Content-Encoding header value, or null when sent as-is
     * @param originalSize    size before compression
     */
    public record Encoded(byte[] body, String contentEncoding, int originalSize) {

        public boolean isCompressed() {
            return contentEncoding != null;
        }

        /**
         * Original size divided by wire size; 1.0 when uncompressed.
         */
        public double ratio() {
            return isCompressed() && body.length > 0 ? (double) originalSize / body.length : 1.0;
        }
    }

    /**
     * Compresses the body when compression is enabled and the body is at least
     * {@code thresholdBytes} long. A compressed form that is not smaller than the
     * original is discarded.
     */
    public Encoded encode(byte[] body) {
        if (!shouldCompress(body)) {
            return new Encoded(body, null, body.length);
        }
        byte[] compressed = gzip(body);
        if (compressed.length >= body.length) {
            return new Encoded(body, null, body.length);
        }
        return new Encoded(compressed, algorithm.contentEncoding(), body.length);
    }

    boolean shouldCompress(byte[] body) {
        return enabled
                && algorithm != CompressionAlgorithm.NONE
                && body.length > 0
                && body.length >= thresholdBytes;
    }

    /**
     * Inflates a response body according to its Content-Encoding.
     */
    public static byte[] decode(byte[] body, String contentEncoding) throws IOException {
        if (contentEncoding == null || !contentEncoding.trim().equalsIgnoreCase("gzip") || body.length == 0) {
            return body;
        }
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
            return in.readAllBytes();
        }
    }

    static byte[] gzip(byte[] body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, body.length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(body);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }
}
