package intoto.crypto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import intoto.model.Util;

import java.util.Arrays;

/**
 * A content digest. Displays as lower-case hex, which is also its JSON form
 * and the form used when prefixing target file names.
 */
public final class HashValue {

    private final byte[] value;

    public HashValue(byte[] value) {
        this.value = value.clone();
    }

    /**
     * @throws IllegalArgumentException if {@code hex} is not valid hex
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static HashValue fromHex(String hex) {
        return new HashValue(Util.unhex(hex));
    }

    public byte[] value() {
        return value.clone();
    }

    @JsonValue
    @Override
    public String toString() {
        return Util.hex(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof HashValue other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }
}
