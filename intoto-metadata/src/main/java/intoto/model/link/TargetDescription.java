package intoto.model.link;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import intoto.crypto.Hasher;
import intoto.model.Util;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Digests of one material or product, keyed by algorithm name ({@code sha256}, ...).
 * Digests are kept as recorded; they are compared, never decoded.
 */
public final class TargetDescription {

    private final SortedMap<String, String> hashes;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public TargetDescription(Map<String, String> hashes) {
        this.hashes = Collections.unmodifiableSortedMap(new TreeMap<>(hashes));
    }

    /** Describe {@code content} with one digest per hasher. */
    public static TargetDescription of(byte[] content, Hasher... hashers) {
        Map<String, String> hashes = new TreeMap<>();
        for (Hasher hasher : hashers) {
            hashes.put(hasher.metadataKey(), Util.hex(hasher.hash(content)));
        }
        return new TargetDescription(hashes);
    }

    @JsonValue
    public SortedMap<String, String> hashes() {
        return hashes;
    }

    public String hash(String algorithm) {
        return hashes.get(algorithm);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TargetDescription other && hashes.equals(other.hashes);
    }

    @Override
    public int hashCode() {
        return hashes.hashCode();
    }

    @Override
    public String toString() {
        return hashes.toString();
    }
}
