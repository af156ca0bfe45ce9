package intoto.model.targets;

import com.fasterxml.jackson.databind.JsonNode;
import intoto.crypto.HashValue;
import intoto.crypto.PrivateKey;
import intoto.crypto.Sha2Hasher;
import intoto.crypto.SignatureScheme;
import intoto.error.EncodingException;
import intoto.error.VerificationFailureException;
import intoto.interchange.Json;
import intoto.model.MetadataFormat;
import intoto.model.SignedMetadata;
import intoto.model.TargetPath;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TargetsMetadataTest {

    private static final MetadataFormat<JsonNode, TargetsMetadata> FORMAT = MetadataFormat.json(TargetsMetadata.class);
    private static final byte[] FIRMWARE = "firmware image v2".getBytes(StandardCharsets.UTF_8);
    private static final Instant EXPIRES = Instant.parse("2030-01-01T00:00:00Z");

    private static TargetsMetadata targets() throws EncodingException {
        return new TargetsMetadata(3, EXPIRES,
                Map.of(TargetPath.of("images/fw.bin"), TargetFile.of(FIRMWARE, new Sha2Hasher())));
    }

    private static JsonNode parse(String json) throws EncodingException {
        return Json.INSTANCE.fromBytes(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void targetFileAcceptsMatchingPayload() throws Exception {
        TargetFile file = TargetFile.of(FIRMWARE, new Sha2Hasher(), new Sha2Hasher("SHA-512"));
        file.verify(FIRMWARE);
        assertEquals(FIRMWARE.length, file.length());
    }

    @Test
    void targetFileRejectsWrongLength() {
        TargetFile file = TargetFile.of(FIRMWARE, new Sha2Hasher());
        VerificationFailureException e = assertThrows(VerificationFailureException.class,
                () -> file.verify("short".getBytes(StandardCharsets.UTF_8)));
        assertTrue(e.getMessage().startsWith("Payload length mismatch"));
    }

    @Test
    void targetFileRejectsWrongDigest() {
        byte[] other = FIRMWARE.clone();
        other[0] ^= 1;
        TargetFile file = TargetFile.of(FIRMWARE, new Sha2Hasher());

        VerificationFailureException e = assertThrows(VerificationFailureException.class, () -> file.verify(other));
        assertEquals("Payload sha256 mismatch", e.getMessage());
    }

    @Test
    void targetFileNeedsAKnownAlgorithm() {
        TargetFile file = new TargetFile(FIRMWARE.length, Map.of("blake2b", HashValue.fromHex("00")));
        assertThrows(VerificationFailureException.class, () -> file.verify(FIRMWARE));
        TargetFile unknownSha = new TargetFile(3, Map.of("sha999", HashValue.fromHex("00")));
        assertThrows(VerificationFailureException.class, () -> unknownSha.verify(new byte[3]));
        assertThrows(IllegalArgumentException.class, () -> new TargetFile(1, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new TargetFile(-1, Map.of("sha256", HashValue.fromHex("00"))));
    }

    @Test
    void encodesTufFields() throws Exception {
        JsonNode node = FORMAT.serialize(targets());

        assertEquals("targets", node.get("_type").textValue());
        assertEquals("1.0", node.get("spec_version").textValue());
        assertEquals(3, node.get("version").intValue());
        assertEquals("2030-01-01T00:00:00Z", node.get("expires").textValue());
        JsonNode file = node.get("targets").get("images/fw.bin");
        assertEquals(FIRMWARE.length, file.get("length").longValue());
        assertEquals(new Sha2Hasher().digest(FIRMWARE).toString(), file.get("hashes").get("sha256").textValue());

        assertEquals(targets(), FORMAT.deserialize(node));
    }

    @Test
    void signedTargetsVerify() throws Exception {
        PrivateKey key = PrivateKey.derive(SignatureScheme.ECDSA_P256_SHA256, "targets");
        SignedMetadata<JsonNode, TargetsMetadata> signed = SignedMetadata.create(targets(), key, FORMAT);

        TargetsMetadata verified = signed.toRaw().parse().verify(1, List.of(key.publicKey()));

        assertEquals(3, verified.version());
        verified.target(TargetPath.of("images/fw.bin")).orElseThrow().verify(FIRMWARE);
        assertTrue(verified.target(TargetPath.of("images/other.bin")).isEmpty());
    }

    @Test
    void rejectsOtherTypesAndVersions() {
        assertThrows(EncodingException.class, () -> FORMAT.deserialize(parse(
                "{\"_type\":\"root\",\"spec_version\":\"1.0\",\"version\":1,\"expires\":\"2030-01-01T00:00:00Z\"}")));
        assertThrows(EncodingException.class, () -> FORMAT.deserialize(parse(
                "{\"_type\":\"targets\",\"spec_version\":\"2.0\",\"version\":1,\"expires\":\"2030-01-01T00:00:00Z\"}")));
        assertThrows(EncodingException.class, () -> FORMAT.deserialize(parse(
                "{\"_type\":\"targets\",\"spec_version\":\"1.0\",\"version\":0,\"expires\":\"2030-01-01T00:00:00Z\"}")));
    }

    @Test
    void keepsDecodedSpecVersion() throws Exception {
        TargetsMetadata decoded = FORMAT.deserialize(parse(
                "{\"_type\":\"targets\",\"spec_version\":\"1.1\",\"version\":2,\"expires\":\"2030-01-01T00:00:00Z\"}"));

        assertEquals("1.1", decoded.specVersion());
        assertEquals("1.1", FORMAT.serialize(decoded).get("spec_version").textValue());
        assertNotEquals(new TargetsMetadata(2, EXPIRES, Map.of()), decoded);
    }

    @Test
    void expiryIsKeptToTheSecond() {
        TargetsMetadata metadata = new TargetsMetadata(1, Instant.parse("2030-01-01T00:00:00.750Z"), Map.of());

        assertEquals(EXPIRES, metadata.expires());
        assertFalse(metadata.isExpired(Instant.parse("2029-12-31T23:59:59Z")));
        assertTrue(metadata.isExpired(Instant.parse("2030-01-01T00:00:01Z")));
    }
}
