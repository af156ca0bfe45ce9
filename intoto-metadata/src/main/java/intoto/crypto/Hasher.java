package intoto.crypto;

/**
 * Abstraction for cryptographic hashing.
 * Used to describe target files by content digest.
 */
public interface Hasher {

    /** JCA algorithm name, e.g. {@code SHA-256}. */
    String algorithmName();

    /** Name under which digests appear in metadata hash maps, e.g. {@code sha256}. */
    String metadataKey();

    /** Compute the hash of the given data. */
    byte[] hash(byte[] data);

    default HashValue digest(byte[] data) {
        return new HashValue(hash(data));
    }
}
