package intoto.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Set;

/**
 * SHA-2 family hasher (SHA-256 by default, also SHA-224, SHA-384 and SHA-512).
 */
public class Sha2Hasher implements Hasher {

    private static final Set<String> SUPPORTED = Set.of("SHA-224", "SHA-256", "SHA-384", "SHA-512");

    private final String algorithm;

    public Sha2Hasher() {
        this("SHA-256");
    }

    public Sha2Hasher(String algorithm) {
        if (!SUPPORTED.contains(algorithm)) {
            throw new IllegalArgumentException("Not a SHA-2 algorithm: " + algorithm);
        }
        this.algorithm = algorithm;
    }

    /**
     * Hasher for a metadata hash-map key such as {@code sha256} or {@code sha512}.
     *
     * @throws IllegalArgumentException if the key does not name a supported SHA-2 algorithm
     */
    public static Sha2Hasher forMetadataKey(String key) {
        String algorithm = "SHA-" + key.substring(Math.min(3, key.length()));
        if (!key.startsWith("sha") || !SUPPORTED.contains(algorithm)) {
            throw new IllegalArgumentException("Not a SHA-2 hash name: " + key);
        }
        return new Sha2Hasher(algorithm);
    }

    @Override
    public String algorithmName() {
        return algorithm;
    }

    @Override
    public String metadataKey() {
        return algorithm.replace("-", "").toLowerCase(Locale.ROOT);
    }

    @Override
    public byte[] hash(byte[] data) {
        try {
            return MessageDigest.getInstance(algorithm).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }
}
