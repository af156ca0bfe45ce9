package intoto.model;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Shared helpers: hex encoding, SHA-256 and byte concatenation.
 */
public final class Util {

    private Util() {}

    private static final HexFormat HEX = HexFormat.of();

    public static String hex(byte[] data) {
        return HEX.formatHex(data);
    }

    /**
     * Decodes a plain hex string. A {@code 0x} prefix is not accepted.
     *
     * @throws IllegalArgumentException if {@code s} is not valid hex
     */
    public static byte[] unhex(String s) {
        return HEX.parseHex(s);
    }

    /** SHA-256 hash (convenience wrapper). */
    public static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }

    public static byte[] concat(byte[]... arrays) {
        int total = 0;
        for (byte[] a : arrays) total += a.length;
        byte[] result = new byte[total];
        int offset = 0;
        for (byte[] a : arrays) {
            System.arraycopy(a, 0, result, offset, a.length);
            offset += a.length;
        }
        return result;
    }
}
