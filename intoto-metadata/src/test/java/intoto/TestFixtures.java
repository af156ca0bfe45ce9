package intoto;

import com.fasterxml.jackson.databind.JsonNode;
import intoto.crypto.PrivateKey;
import intoto.crypto.PublicKey;
import intoto.crypto.SignatureScheme;
import intoto.error.EncodingException;
import intoto.model.MetadataFormat;
import intoto.model.TargetPath;
import intoto.model.link.LinkMetadata;
import intoto.model.link.TargetDescription;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared keys and documents for tests. Keys are derived from labels, so the
 * same label always gives the same key.
 */
public final class TestFixtures {

    public static final MetadataFormat<JsonNode, LinkMetadata> LINK_FORMAT = MetadataFormat.json(LinkMetadata.class);

    private static final Map<String, PrivateKey> KEYS = new ConcurrentHashMap<>();

    private TestFixtures() {}

    /** Ed25519 key derived from {@code label}. */
    public static PrivateKey key(String label) {
        return KEYS.computeIfAbsent(label, l -> PrivateKey.derive(SignatureScheme.ED25519, l));
    }

    public static List<PublicKey> publicKeys(PrivateKey... keys) {
        List<PublicKey> result = new ArrayList<>();
        for (PrivateKey key : keys) {
            result.add(key.publicKey());
        }
        return result;
    }

    /** {@code {name: "build", materials: {}, products: {"out.bin": {sha256: "abc"}}}} */
    public static LinkMetadata buildLink() throws EncodingException {
        return LinkMetadata.builder("build")
                .product(TargetPath.of("out.bin"), new TargetDescription(Map.of("sha256", "abc")))
                .build();
    }

    public static LinkMetadata packageLink() throws EncodingException {
        return LinkMetadata.builder("package")
                .material(TargetPath.of("out.bin"), new TargetDescription(Map.of("sha256", "abc")))
                .product(TargetPath.of("dist/app.tar.gz"), new TargetDescription(Map.of("sha256", "def0")))
                .env("PATH", "/usr/bin")
                .build();
    }
}
