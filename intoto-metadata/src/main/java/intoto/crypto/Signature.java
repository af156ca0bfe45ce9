package intoto.crypto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import intoto.model.Util;

import java.util.Objects;

/**
 * A signature paired with the identifier of the key that made it.
 * <p>
 * Equality and hash code consider the key ID only, so a set of signatures holds
 * at most one entry per key. Compare {@link #value()} to tell two signatures
 * from the same key apart.
 */
public final class Signature {

    private final KeyId keyId;
    private final byte[] value;

    public Signature(KeyId keyId, byte[] value) {
        this.keyId = Objects.requireNonNull(keyId, "keyId");
        this.value = value.clone();
    }

    @JsonCreator
    static Signature fromJson(@JsonProperty(value = "keyid", required = true) KeyId keyId,
                              @JsonProperty(value = "sig", required = true) String hex) {
        return new Signature(keyId, Util.unhex(hex));
    }

    @JsonProperty("keyid")
    public KeyId keyId() {
        return keyId;
    }

    public byte[] value() {
        return value.clone();
    }

    @JsonProperty("sig")
    String hexValue() {
        return Util.hex(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Signature other && keyId.equals(other.keyId);
    }

    @Override
    public int hashCode() {
        return keyId.hashCode();
    }

    @Override
    public String toString() {
        return "Signature{keyid=" + keyId + ", sig=" + hexValue() + "}";
    }
}
