package intoto.model;

import intoto.crypto.KeyId;
import intoto.crypto.PrivateKey;
import intoto.crypto.PublicKey;
import intoto.crypto.Signature;
import intoto.error.EncodingException;
import intoto.error.InvalidArgumentException;
import intoto.error.VerificationFailureException;
import intoto.interchange.SignedEnvelope;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A serialized document with attached, not yet verified, signatures.
 * <p>
 * Each signature was made over the canonical bytes of the document by some
 * key. Whether those keys are trusted is only established by {@link #verify}.
 * Instances are immutable and can be verified any number of times, from any
 * number of threads.
 *
 * @param <R> raw representation of the interchange format
 * @param <M> metadata type
 */
public final class SignedMetadata<R, M extends Metadata> {

    private final List<Signature> signatures;
    private final R metadata;
    private final MetadataFormat<R, M> format;

    SignedMetadata(List<Signature> signatures, R metadata, MetadataFormat<R, M> format) {
        this.signatures = List.copyOf(signatures);
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.format = Objects.requireNonNull(format, "format");
    }

    /** Serialize {@code metadata} and sign its canonical bytes with {@code privateKey}. */
    public static <R, M extends Metadata> SignedMetadata<R, M> create(M metadata, PrivateKey privateKey,
                                                                      MetadataFormat<R, M> format)
            throws EncodingException {
        return SignedMetadataBuilder.from(metadata, format).sign(privateKey).build();
    }

    public List<Signature> signatures() {
        return signatures;
    }

    /** The signed payload in raw form. */
    public R signed() {
        return metadata;
    }

    public MetadataFormat<R, M> format() {
        return format;
    }

    /**
     * Serialize to canonical bytes.
     * <p>
     * Only meant for metadata produced by this process. Re-serializing metadata
     * obtained elsewhere does not reproduce its original bytes: unknown fields
     * are dropped on parsing, and whitespace and member order are not kept.
     * Hashes published for the original bytes will not match.
     */
    public RawSignedMetadata<R, M> toRaw() throws EncodingException {
        R envelope = format.interchange().serializeEnvelope(new SignedEnvelope<>(signatures, metadata));
        return new RawSignedMetadata<>(format.canonicalize(envelope), format);
    }

    /**
     * Combine the signatures of two copies of the same document.
     * <p>
     * Signatures from {@code other} whose key ID is not already present are
     * appended after this instance's signatures, in {@code other}'s order. Where
     * both carry a signature from the same key, this instance's is kept. The
     * result is not re-sorted.
     *
     * @return a new instance holding the union of signatures
     * @throws InvalidArgumentException if the two signed payloads differ
     */
    public SignedMetadata<R, M> mergeSignatures(SignedMetadata<R, M> other) throws InvalidArgumentException {
        if (!metadata.equals(other.metadata)) {
            throw new InvalidArgumentException("Attempted to merge unequal metadata");
        }

        Set<KeyId> keyIds = new HashSet<>();
        for (Signature sig : signatures) {
            keyIds.add(sig.keyId());
        }

        List<Signature> merged = new ArrayList<>(signatures);
        for (Signature sig : other.signatures) {
            if (keyIds.add(sig.keyId())) {
                merged.add(sig);
            }
        }
        return new SignedMetadata<>(merged, metadata, format);
    }

    /**
     * Decode the document without checking any signature.
     * Not safe on metadata from an untrusted source.
     */
    public M assumeValid() throws EncodingException {
        return format.deserialize(metadata);
    }

    /**
     * Verify with per-signature events logged through SLF4J.
     *
     * @see #verify(int, Iterable, VerificationListener)
     */
    public M verify(int threshold, Iterable<PublicKey> authorizedKeys)
            throws VerificationFailureException, EncodingException {
        return verify(threshold, authorizedKeys, VerificationListener.logging());
    }

    /**
     * Decode the document if at least {@code threshold} distinct keys from
     * {@code authorizedKeys} made a valid signature over its canonical bytes.
     * <p>
     * Signatures are checked in stored order, and checking stops as soon as the
     * threshold is reached. A key counts once however many entries it has.
     * Signatures from unknown keys and signatures that fail to verify are
     * reported to {@code listener} and otherwise ignored. If a key ID appears
     * more than once in {@code authorizedKeys}, the last one wins.
     *
     * @throws VerificationFailureException if there are no signatures, the threshold
     *         is below one, or fewer than {@code threshold} keys signed validly
     * @throws EncodingException if the payload cannot be canonicalized or decoded
     */
    public M verify(int threshold, Iterable<PublicKey> authorizedKeys, VerificationListener listener)
            throws VerificationFailureException, EncodingException {
        if (signatures.isEmpty()) {
            throw new VerificationFailureException("The metadata was not signed with any authorized keys.");
        }
        if (threshold < 1) {
            throw new VerificationFailureException("Threshold must be strictly greater than zero");
        }

        Map<KeyId, PublicKey> authorized = new HashMap<>();
        for (PublicKey key : authorizedKeys) {
            authorized.put(key.keyId(), key);
        }

        byte[] canonicalBytes = format.canonicalize(metadata);

        // one entry per key ID, kept in order of first appearance
        Map<KeyId, List<Signature>> byKey = new LinkedHashMap<>();
        for (Signature sig : signatures) {
            byKey.computeIfAbsent(sig.keyId(), k -> new ArrayList<>()).add(sig);
        }

        int needed = threshold;
        for (Map.Entry<KeyId, List<Signature>> entry : byKey.entrySet()) {
            KeyId keyId = entry.getKey();
            PublicKey key = authorized.get(keyId);
            if (key == null) {
                listener.unauthorizedKey(keyId);
                continue;
            }
            if (anyVerifies(key, canonicalBytes, entry.getValue(), listener)) {
                listener.goodSignature(keyId);
                needed--;
                if (needed == 0) {
                    break;
                }
            }
        }

        if (needed > 0) {
            throw new VerificationFailureException(
                    "Signature threshold not met: " + (threshold - needed) + "/" + threshold);
        }

        // trusted now: the signatures above cover exactly these bytes
        return assumeValid();
    }

    private static boolean anyVerifies(PublicKey key, byte[] message, List<Signature> candidates,
                                       VerificationListener listener) {
        for (Signature sig : candidates) {
            try {
                key.verify(message, sig);
                return true;
            } catch (VerificationFailureException e) {
                listener.badSignature(sig.keyId(), e);
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SignedMetadata<?, ?> other
                && signatures.equals(other.signatures)
                && metadata.equals(other.metadata)
                && format.equals(other.format);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signatures, metadata, format);
    }

    @Override
    public String toString() {
        return "SignedMetadata{" + format.metadataType().getSimpleName() + ", signatures=" + signatures + "}";
    }
}
