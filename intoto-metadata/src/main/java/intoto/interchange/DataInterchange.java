package intoto.interchange;

import intoto.error.EncodingException;

/**
 * A serialization format for metadata.
 * <p>
 * {@code R} is the format's in-memory raw representation. It must implement
 * structural {@code equals}, which is how two documents are compared when
 * merging signatures.
 * <p>
 * {@link #canonicalize} must be deterministic: logically equal raw values give
 * identical bytes no matter how the input that produced them was formatted.
 * Those bytes are what signatures are computed over.
 *
 * @param <R> raw representation
 */
public interface DataInterchange<R> {

    /** File extension for documents in this format, without the dot. */
    String extension();

    /** Parse bytes into the raw representation without applying any schema. */
    R fromBytes(byte[] bytes) throws EncodingException;

    /** Convert a typed value into the raw representation. */
    <T> R serialize(T value) throws EncodingException;

    /** Convert the raw representation into a typed value, checking it against {@code type}. */
    <T> T deserialize(R raw, Class<T> type) throws EncodingException;

    /** Deterministic byte form of {@code raw}. */
    byte[] canonicalize(R raw) throws EncodingException;

    /** Build the raw form of a signed document. */
    R serializeEnvelope(SignedEnvelope<R> envelope) throws EncodingException;

    /** Split the raw form of a signed document into its signatures and signed payload. */
    SignedEnvelope<R> deserializeEnvelope(R raw) throws EncodingException;
}
