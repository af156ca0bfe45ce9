package intoto.model;

import intoto.error.EncodingException;
import intoto.interchange.SignedEnvelope;

import java.util.Arrays;
import java.util.Objects;

/**
 * Unverified signed metadata as bytes, tagged with the format and metadata type
 * it is expected to be in. Nothing about the bytes is trusted until the parsed
 * result has been verified.
 */
public final class RawSignedMetadata<R, M extends Metadata> {

    private final byte[] bytes;
    private final MetadataFormat<R, M> format;

    public RawSignedMetadata(byte[] bytes, MetadataFormat<R, M> format) {
        this.bytes = bytes.clone();
        this.format = Objects.requireNonNull(format, "format");
    }

    public byte[] asBytes() {
        return bytes.clone();
    }

    public MetadataFormat<R, M> format() {
        return format;
    }

    /**
     * Parse the envelope. No signature is checked.
     *
     * @throws EncodingException if the bytes are not a well formed signed document
     */
    public SignedMetadata<R, M> parse() throws EncodingException {
        R raw = format.interchange().fromBytes(bytes);
        SignedEnvelope<R> envelope = format.interchange().deserializeEnvelope(raw);
        return new SignedMetadata<>(envelope.signatures(), envelope.signed(), format);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RawSignedMetadata<?, ?> other
                && Arrays.equals(bytes, other.bytes)
                && format.equals(other.format);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(bytes) + format.hashCode();
    }

    @Override
    public String toString() {
        return "RawSignedMetadata{" + format.metadataType().getSimpleName() + ", " + bytes.length + " bytes}";
    }
}
