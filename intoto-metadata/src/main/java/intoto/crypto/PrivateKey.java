package intoto.crypto;

import intoto.error.EncodingException;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.util.Objects;

/**
 * A signing key: a key pair bound to its signing scheme.
 */
public final class PrivateKey {

    private final SignatureScheme scheme;
    private final KeyPair keyPair;
    private final PublicKey publicKey;

    public PrivateKey(SignatureScheme scheme, KeyPair keyPair) {
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        this.keyPair = Objects.requireNonNull(keyPair, "keyPair");
        this.publicKey = new PublicKey(scheme, keyPair.getPublic());
    }

    /** Generate a fresh random key. */
    public static PrivateKey generate(SignatureScheme scheme) {
        return new PrivateKey(scheme, scheme.signer().generateKeyPair());
    }

    /**
     * Derive a key deterministically from {@code label}.
     * Same label, same key; only meant for fixtures and demos.
     */
    public static PrivateKey derive(SignatureScheme scheme, String label) {
        return new PrivateKey(scheme, scheme.signer().deriveKeyPair(label));
    }

    /**
     * Load a key from its PKCS#8 private half and SubjectPublicKeyInfo public half.
     *
     * @throws EncodingException if either encoding is not a key of the given scheme
     */
    public static PrivateKey fromEncoded(byte[] pkcs8, byte[] spki, SignatureScheme scheme)
            throws EncodingException {
        try {
            Signer signer = scheme.signer();
            return new PrivateKey(scheme,
                    new KeyPair(signer.decodePublicKey(spki), signer.decodePrivateKey(pkcs8)));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new EncodingException("Cannot decode " + scheme + " key pair", e);
        }
    }

    public SignatureScheme scheme() {
        return scheme;
    }

    public PublicKey publicKey() {
        return publicKey;
    }

    public KeyId keyId() {
        return publicKey.keyId();
    }

    /** PKCS#8 encoding of the private half. */
    public byte[] asPkcs8() {
        return keyPair.getPrivate().getEncoded();
    }

    /** Sign {@code message}, tagging the result with this key's ID. */
    public Signature sign(byte[] message) {
        byte[] sig = scheme.signer().sign(message, keyPair.getPrivate());
        return new Signature(publicKey.keyId(), sig);
    }

    @Override
    public String toString() {
        return "PrivateKey{" + scheme + ", keyid=" + keyId() + "}";
    }
}
