package intoto.crypto;

import intoto.error.EncodingException;
import intoto.error.VerificationFailureException;

import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * A public key bound to its signing scheme and key ID.
 */
public final class PublicKey {

    private final SignatureScheme scheme;
    private final java.security.PublicKey key;
    private final KeyId keyId;

    public PublicKey(SignatureScheme scheme, java.security.PublicKey key) {
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        this.key = Objects.requireNonNull(key, "key");
        this.keyId = KeyId.forKey(key);
    }

    /**
     * Decode an X.509 SubjectPublicKeyInfo encoded key.
     *
     * @throws EncodingException if the bytes are not a key of the given scheme
     */
    public static PublicKey fromSpki(byte[] spki, SignatureScheme scheme) throws EncodingException {
        try {
            return new PublicKey(scheme, scheme.signer().decodePublicKey(spki));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new EncodingException("Cannot decode " + scheme + " public key", e);
        }
    }

    public SignatureScheme scheme() {
        return scheme;
    }

    public KeyId keyId() {
        return keyId;
    }

    /** SubjectPublicKeyInfo encoding. */
    public byte[] asSpki() {
        return key.getEncoded();
    }

    /**
     * Check {@code signature} over {@code message}.
     *
     * @throws VerificationFailureException if the signature does not verify under this key
     */
    public void verify(byte[] message, Signature signature) throws VerificationFailureException {
        if (!scheme.signer().verify(message, signature.value(), key)) {
            throw new VerificationFailureException(
                    "Bad " + scheme + " signature from key ID " + signature.keyId());
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PublicKey other && scheme == other.scheme && keyId.equals(other.keyId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, keyId);
    }

    @Override
    public String toString() {
        return "PublicKey{" + scheme + ", keyid=" + keyId + "}";
    }
}
