package intoto.model.link;

import com.fasterxml.jackson.databind.JsonNode;
import intoto.crypto.PrivateKey;
import intoto.crypto.Sha2Hasher;
import intoto.error.EncodingException;
import intoto.error.VerificationFailureException;
import intoto.interchange.Json;
import intoto.model.RawSignedMetadata;
import intoto.model.SignedMetadata;
import intoto.model.SignedMetadataBuilder;
import intoto.model.TargetPath;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static intoto.TestFixtures.LINK_FORMAT;
import static intoto.TestFixtures.buildLink;
import static intoto.TestFixtures.key;
import static intoto.TestFixtures.packageLink;
import static intoto.TestFixtures.publicKeys;
import static org.junit.jupiter.api.Assertions.*;

class LinkMetadataTest {

    private static JsonNode parse(String json) throws EncodingException {
        return Json.INSTANCE.fromBytes(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void encodesWithTypeAndSortedMembers() throws Exception {
        JsonNode node = LINK_FORMAT.serialize(packageLink());

        assertEquals("link", node.get("_type").textValue());
        assertEquals("package", node.get("name").textValue());
        assertEquals("abc", node.get("materials").get("out.bin").get("sha256").textValue());
        assertEquals("def0", node.get("products").get("dist/app.tar.gz").get("sha256").textValue());
        assertEquals("/usr/bin", node.get("env").get("PATH").textValue());
        assertTrue(node.get("byproducts").isEmpty());
    }

    @Test
    void decodesWhatItEncodes() throws Exception {
        LinkMetadata link = packageLink();
        assertEquals(link, LINK_FORMAT.deserialize(LINK_FORMAT.serialize(link)));
        assertEquals(0, link.version());
    }

    @Test
    void optionalMembersDefaultToEmpty() throws Exception {
        LinkMetadata link = LINK_FORMAT.deserialize(parse("{\"_type\":\"link\",\"name\":\"x\"}"));

        assertEquals("x", link.name());
        assertTrue(link.materials().isEmpty());
        assertTrue(link.products().isEmpty());
        assertTrue(link.env().isEmpty());
        assertTrue(link.byproducts().isEmpty());
    }

    @Test
    void rejectsOtherTypes() {
        assertThrows(EncodingException.class,
                () -> LINK_FORMAT.deserialize(parse("{\"_type\":\"layout\",\"name\":\"x\"}")));
        assertThrows(EncodingException.class,
                () -> LINK_FORMAT.deserialize(parse("{\"name\":\"x\"}")));
        assertThrows(EncodingException.class,
                () -> LINK_FORMAT.deserialize(parse("{\"_type\":\"link\"}")));
    }

    @Test
    void rejectsUnsafeArtifactPaths() {
        assertThrows(EncodingException.class, () -> LINK_FORMAT.deserialize(
                parse("{\"_type\":\"link\",\"name\":\"x\",\"products\":{\"../etc/passwd\":{}}}")));
        assertThrows(EncodingException.class, () -> LINK_FORMAT.deserialize(
                parse("{\"_type\":\"link\",\"name\":\"x\",\"materials\":{\"/abs\":{}}}")));
    }

    @Test
    void describesContentWithDigests() {
        byte[] content = "abc".getBytes(StandardCharsets.UTF_8);
        TargetDescription description = TargetDescription.of(content, new Sha2Hasher(), new Sha2Hasher("SHA-512"));

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", description.hash("sha256"));
        assertNotNull(description.hash("sha512"));
        assertEquals(2, description.hashes().size());
    }

    @Test
    void twoFunctionariesSignTheSameLink() throws Exception {
        PrivateKey k1 = key("k1");
        PrivateKey k2 = key("k2");

        SignedMetadata<JsonNode, LinkMetadata> byK1 = SignedMetadataBuilder.from(buildLink(), LINK_FORMAT).sign(k1).build();
        VerificationFailureException e = assertThrows(VerificationFailureException.class,
                () -> byK1.verify(2, publicKeys(k1, k2)));
        assertEquals("Signature threshold not met: 1/2", e.getMessage());

        SignedMetadata<JsonNode, LinkMetadata> byK2 = SignedMetadataBuilder.from(buildLink(), LINK_FORMAT).sign(k2).build();
        SignedMetadata<JsonNode, LinkMetadata> both = byK1.mergeSignatures(byK2);
        assertEquals(buildLink(), both.verify(2, publicKeys(k1, k2)));

        RawSignedMetadata<JsonNode, LinkMetadata> raw = both.toRaw();
        RawSignedMetadata<JsonNode, LinkMetadata> received = new RawSignedMetadata<>(raw.asBytes(), LINK_FORMAT);
        LinkMetadata verified = received.parse().verify(2, publicKeys(k1, k2));
        assertEquals("build", verified.name());
        assertEquals("abc", verified.products().get(TargetPath.of("out.bin")).hash("sha256"));
    }
}
