package intoto.interchange;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import intoto.crypto.Signature;
import intoto.error.EncodingException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * JSON interchange backed by Jackson, with {@link JsonNode} as raw representation.
 * <p>
 * Canonical form: object members sorted by name, no insignificant whitespace,
 * integers written in full. Floating point numbers have no canonical form and
 * are rejected. Duplicate object members are rejected when parsing.
 */
public final class Json implements DataInterchange<JsonNode> {

    /** Shared instance; the class holds no mutable state. */
    public static final Json INSTANCE = new Json();

    private final ObjectMapper mapper;
    private final JavaType signatureListType;

    public Json() {
        JsonFactory factory = JsonFactory.builder()
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .build();
        this.mapper = new ObjectMapper(factory)
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.signatureListType = mapper.getTypeFactory().constructCollectionType(List.class, Signature.class);
    }

    @Override
    public String extension() {
        return "json";
    }

    @Override
    public JsonNode fromBytes(byte[] bytes) throws EncodingException {
        JsonNode node;
        try {
            node = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new EncodingException("Malformed JSON: " + e.getMessage(), e);
        }
        if (node == null || node.isMissingNode()) {
            throw new EncodingException("Empty JSON document");
        }
        return node;
    }

    @Override
    public <T> JsonNode serialize(T value) throws EncodingException {
        Objects.requireNonNull(value, "value");
        try {
            return mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new EncodingException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    @Override
    public <T> T deserialize(JsonNode raw, Class<T> type) throws EncodingException {
        T value;
        try {
            value = mapper.treeToValue(raw, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EncodingException("Cannot decode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
        if (value == null) {
            throw new EncodingException("Cannot decode " + type.getSimpleName() + " from null");
        }
        return value;
    }

    @Override
    public byte[] canonicalize(JsonNode raw) throws EncodingException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonGenerator gen = mapper.getFactory().createGenerator(out, JsonEncoding.UTF8)) {
            writeCanonical(raw, gen);
        } catch (IOException e) {
            throw new EncodingException("Cannot canonicalize JSON", e);
        }
        return out.toByteArray();
    }

    @Override
    public JsonNode serializeEnvelope(SignedEnvelope<JsonNode> envelope) throws EncodingException {
        ObjectNode root = mapper.createObjectNode();
        root.set(SignedEnvelope.SIGNATURES_FIELD, serialize(envelope.signatures()));
        root.set(SignedEnvelope.SIGNED_FIELD, envelope.signed().deepCopy());
        return root;
    }

    @Override
    public SignedEnvelope<JsonNode> deserializeEnvelope(JsonNode raw) throws EncodingException {
        if (!raw.isObject()) {
            throw new EncodingException("Signed metadata must be a JSON object, got " + raw.getNodeType());
        }
        JsonNode signatures = raw.get(SignedEnvelope.SIGNATURES_FIELD);
        if (signatures == null || !signatures.isArray()) {
            throw new EncodingException("Signed metadata has no '" + SignedEnvelope.SIGNATURES_FIELD + "' array");
        }
        JsonNode signed = raw.get(SignedEnvelope.SIGNED_FIELD);
        if (signed == null || signed.isNull()) {
            throw new EncodingException("Signed metadata has no '" + SignedEnvelope.SIGNED_FIELD + "' member");
        }

        List<Signature> decoded;
        try {
            decoded = mapper.treeToValue(signatures, signatureListType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EncodingException("Malformed signature list: " + e.getMessage(), e);
        }
        if (decoded.contains(null)) {
            throw new EncodingException("Signature list contains null");
        }
        return new SignedEnvelope<>(decoded, signed.deepCopy());
    }

    private static void writeCanonical(JsonNode node, JsonGenerator gen) throws IOException, EncodingException {
        if (node.isObject()) {
            gen.writeStartObject();
            TreeSet<String> names = new TreeSet<>();
            for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
                names.add(it.next());
            }
            for (String name : names) {
                gen.writeFieldName(name);
                writeCanonical(node.get(name), gen);
            }
            gen.writeEndObject();
        } else if (node.isArray()) {
            gen.writeStartArray();
            for (JsonNode element : node) {
                writeCanonical(element, gen);
            }
            gen.writeEndArray();
        } else if (node.isTextual()) {
            gen.writeString(node.textValue());
        } else if (node.isIntegralNumber()) {
            gen.writeNumber(node.bigIntegerValue());
        } else if (node.isNumber()) {
            throw new EncodingException("Floating point number has no canonical form: " + node);
        } else if (node.isBoolean()) {
            gen.writeBoolean(node.booleanValue());
        } else if (node.isNull()) {
            gen.writeNull();
        } else {
            throw new EncodingException("Cannot canonicalize JSON node of type " + node.getNodeType());
        }
    }
}
