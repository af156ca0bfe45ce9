package intoto.model;

import intoto.crypto.KeyId;
import intoto.crypto.PrivateKey;
import intoto.crypto.Signature;
import intoto.error.EncodingException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects signatures over one fixed payload and produces {@link SignedMetadata}.
 * <p>
 * The canonical bytes are computed once, when the builder is created, from a
 * payload already known to decode as {@code M}. Every signature added later is
 * over exactly those bytes. Builders are immutable: {@link #sign} returns a new
 * builder and leaves the receiver untouched.
 * <p>
 * Signing with several private keys on one machine is unusual. The normal flow
 * is for each party to build its own copy and combine them with
 * {@link SignedMetadata#mergeSignatures}.
 */
public final class SignedMetadataBuilder<R, M extends Metadata> {

    private final MetadataFormat<R, M> format;
    private final Map<KeyId, Signature> signatures;
    private final R metadata;
    private final byte[] metadataBytes;

    private SignedMetadataBuilder(MetadataFormat<R, M> format, Map<KeyId, Signature> signatures,
                                  R metadata, byte[] metadataBytes) {
        this.format = format;
        this.signatures = signatures;
        this.metadata = metadata;
        this.metadataBytes = metadataBytes;
    }

    /** Start from a typed document. */
    public static <R, M extends Metadata> SignedMetadataBuilder<R, M> from(M metadata, MetadataFormat<R, M> format)
            throws EncodingException {
        return fromRawMetadata(format.serialize(metadata), format);
    }

    /**
     * Start from an already serialized document.
     *
     * @throws EncodingException if {@code metadata} does not decode as the format's metadata type
     */
    public static <R, M extends Metadata> SignedMetadataBuilder<R, M> fromRawMetadata(R metadata, MetadataFormat<R, M> format)
            throws EncodingException {
        format.deserialize(metadata);
        byte[] metadataBytes = format.canonicalize(metadata);
        // held payload is re-read from the canonical bytes, so it cannot drift from them
        R canonical = format.interchange().fromBytes(metadataBytes);
        return new SignedMetadataBuilder<>(format, Map.of(), canonical, metadataBytes);
    }

    /**
     * Sign the canonical bytes with {@code privateKey}, replacing any earlier
     * signature by the same key.
     *
     * @return a new builder holding the extra signature
     */
    public SignedMetadataBuilder<R, M> sign(PrivateKey privateKey) {
        Signature sig = privateKey.sign(metadataBytes);
        Map<KeyId, Signature> next = new HashMap<>(signatures);
        next.put(sig.keyId(), sig);
        return new SignedMetadataBuilder<>(format, Collections.unmodifiableMap(next), metadata, metadataBytes);
    }

    /** Key IDs that have signed so far. */
    public List<KeyId> signers() {
        List<KeyId> ids = new ArrayList<>(signatures.keySet());
        Collections.sort(ids);
        return ids;
    }

    /** The signed payload's canonical bytes. */
    public byte[] canonicalBytes() {
        return metadataBytes.clone();
    }

    /** Signed metadata with the collected signatures sorted by key ID. */
    public SignedMetadata<R, M> build() {
        List<Signature> sorted = new ArrayList<>(signatures.values());
        sorted.sort(Comparator.comparing(Signature::keyId));
        return new SignedMetadata<>(sorted, metadata, format);
    }
}
