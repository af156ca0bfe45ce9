package intoto.crypto;

import java.util.List;

/**
 * Supported signing schemes, each bound to the {@link Signer} that implements it.
 * Keys carry their scheme so a signature is always checked with the algorithm
 * it was made with.
 */
public enum SignatureScheme {

    /** Ed25519 via BouncyCastle. */
    ED25519("ed25519", new Ed25519Signer()),

    /** ECDSA over NIST P-256 with SHA-256. */
    ECDSA_P256_SHA256("ecdsa-sha2-nistp256", new EcdsaP256Signer()),

    /** RSA-3072 with PSS padding and SHA-256. */
    RSASSA_PSS_SHA256("rsassa-pss-sha256", new RsaSigner(3072));

    private final String id;
    private final Signer signer;

    SignatureScheme(String id, Signer signer) {
        this.id = id;
        this.signer = signer;
    }

    /** Identifier used for this scheme in key metadata. */
    public String id() {
        return id;
    }

    public Signer signer() {
        return signer;
    }

    /** All schemes in declaration order. */
    public static List<SignatureScheme> all() {
        return List.of(values());
    }

    @Override
    public String toString() {
        return id;
    }
}
