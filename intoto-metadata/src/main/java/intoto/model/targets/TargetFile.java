package intoto.model.targets;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import intoto.crypto.HashValue;
import intoto.crypto.Hasher;
import intoto.crypto.Sha2Hasher;
import intoto.error.VerificationFailureException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Describes a single target file in targets metadata.
 * A client uses this to check a downloaded payload before installing it.
 */
public final class TargetFile {

    private final long length;
    private final SortedMap<String, HashValue> hashes;

    @JsonCreator
    public TargetFile(@JsonProperty(value = "length", required = true) long length,
                      @JsonProperty(value = "hashes", required = true) Map<String, HashValue> hashes) {
        if (length < 0) {
            throw new IllegalArgumentException("Target length cannot be negative: " + length);
        }
        if (hashes == null || hashes.isEmpty()) {
            throw new IllegalArgumentException("Target must have at least one hash");
        }
        this.length = length;
        this.hashes = Collections.unmodifiableSortedMap(new TreeMap<>(hashes));
    }

    /** Describe {@code payload} with its length and one digest per hasher. */
    public static TargetFile of(byte[] payload, Hasher... hashers) {
        Map<String, HashValue> hashes = new TreeMap<>();
        for (Hasher hasher : hashers) {
            hashes.put(hasher.metadataKey(), hasher.digest(payload));
        }
        return new TargetFile(payload.length, hashes);
    }

    @JsonProperty("length")
    public long length() {
        return length;
    }

    @JsonProperty("hashes")
    public SortedMap<String, HashValue> hashes() {
        return hashes;
    }

    /**
     * Check {@code payload} against the recorded length and every SHA-2 digest.
     * Digests under other algorithm names are skipped; at least one must be checked.
     *
     * @throws VerificationFailureException on a length or digest mismatch
     */
    public void verify(byte[] payload) throws VerificationFailureException {
        if (payload.length != length) {
            throw new VerificationFailureException(
                    "Payload length mismatch: expected " + length + ", got " + payload.length);
        }
        int checked = 0;
        for (Map.Entry<String, HashValue> entry : hashes.entrySet()) {
            Hasher hasher;
            try {
                hasher = Sha2Hasher.forMetadataKey(entry.getKey());
            } catch (IllegalArgumentException e) {
                continue;
            }
            if (!hasher.digest(payload).equals(entry.getValue())) {
                throw new VerificationFailureException("Payload " + entry.getKey() + " mismatch");
            }
            checked++;
        }
        if (checked == 0) {
            throw new VerificationFailureException("No supported hash algorithm in " + hashes.keySet());
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TargetFile other && length == other.length && hashes.equals(other.hashes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(length, hashes);
    }

    @Override
    public String toString() {
        return "TargetFile{length=" + length + ", hashes=" + hashes + "}";
    }
}
