package intoto.crypto;

import java.security.KeyPair;

/**
 * Abstraction for digital signature operations.
 * Each implementation provides a different algorithm (ECDSA, Ed25519, RSA).
 */
public interface Signer {

    /** Human-readable algorithm name, also used in benchmark output. */
    String algorithmName();

    /** Generate a fresh key pair suitable for this signing scheme. */
    KeyPair generateKeyPair();

    /**
     * Derive a deterministic key pair from a label string.
     * Used for reproducible fixtures and demos, not for production keys.
     */
    KeyPair deriveKeyPair(String label);

    /** Sign the given data using the private key. */
    byte[] sign(byte[] data, java.security.PrivateKey privateKey);

    /** Verify a signature against the given data and public key. */
    boolean verify(byte[] data, byte[] signature, java.security.PublicKey publicKey);

    /**
     * Decode an X.509 SubjectPublicKeyInfo encoded public key.
     *
     * @throws java.security.GeneralSecurityException if the encoding is not a key of this scheme
     */
    java.security.PublicKey decodePublicKey(byte[] spki) throws java.security.GeneralSecurityException;

    /**
     * Decode a PKCS#8 encoded private key.
     *
     * @throws java.security.GeneralSecurityException if the encoding is not a key of this scheme
     */
    java.security.PrivateKey decodePrivateKey(byte[] pkcs8) throws java.security.GeneralSecurityException;
}
