package intoto.model;

import com.fasterxml.jackson.databind.JsonNode;
import intoto.error.EncodingException;
import intoto.interchange.DataInterchange;
import intoto.interchange.Json;

import java.util.Objects;

/**
 * Binds an interchange format to a metadata type.
 * Signed metadata carries its format so that it is always decoded with the
 * interchange it was encoded with, into the type it claims to be.
 *
 * @param <R> raw representation of the interchange
 * @param <M> metadata type
 */
public record MetadataFormat<R, M extends Metadata>(
        DataInterchange<R> interchange,
        Class<M> metadataType
) {
    public MetadataFormat {
        Objects.requireNonNull(interchange, "interchange");
        Objects.requireNonNull(metadataType, "metadataType");
    }

    /** JSON format for {@code metadataType}. */
    public static <M extends Metadata> MetadataFormat<JsonNode, M> json(Class<M> metadataType) {
        return new MetadataFormat<>(Json.INSTANCE, metadataType);
    }

    public R serialize(M metadata) throws EncodingException {
        return interchange.serialize(metadata);
    }

    public M deserialize(R raw) throws EncodingException {
        return interchange.deserialize(raw, metadataType);
    }

    public byte[] canonicalize(R raw) throws EncodingException {
        return interchange.canonicalize(raw);
    }
}
