package txengine.state;

/**
 * Compression applied to stored snapshot payloads.
 *
 * <p>Checksums and sizes always describe the uncompressed payload.
 */
public enum CompressionType {
    NONE,
    GZIP
}
