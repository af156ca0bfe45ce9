package intoto.crypto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import intoto.model.Util;

import java.util.Objects;

/**
 * Stable identifier of a public key: the hex SHA-256 of its SubjectPublicKeyInfo
 * encoding. Ordered lexicographically by that hex string.
 */
public final class KeyId implements Comparable<KeyId> {

    private final String value;

    private KeyId(String value) {
        this.value = value;
    }

    /**
     * Wraps an identifier read from metadata. Any non-empty string is accepted:
     * an identifier that matches no authorized key is simply never trusted.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static KeyId of(String value) {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Key ID cannot be empty");
        }
        return new KeyId(value);
    }

    /** Computes the identifier of a JCA public key. */
    public static KeyId forKey(java.security.PublicKey key) {
        return new KeyId(Util.hex(Util.sha256(key.getEncoded())));
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public int compareTo(KeyId o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KeyId other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
