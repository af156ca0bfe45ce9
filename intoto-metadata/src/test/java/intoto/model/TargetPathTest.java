package intoto.model;

import intoto.crypto.HashValue;
import intoto.crypto.Sha2Hasher;
import intoto.error.EncodingException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TargetPathTest {

    @Test
    void splitsIntoComponents() throws Exception {
        assertEquals(List.of("foo", "bar"), TargetPath.of("foo/bar").components());
        assertEquals(List.of("foo"), TargetPath.of("foo").components());
    }

    @Test
    void hashPrefixGoesOnFileName() throws Exception {
        HashValue hash = HashValue.fromHex("abcd");
        assertEquals("foo/abcd.bar", TargetPath.of("foo/bar").withHashPrefix(hash).value());
        assertEquals("abcd.bar", TargetPath.of("bar").withHashPrefix(hash).value());
        assertEquals("a/b/abcd.c.tar.gz", TargetPath.of("a/b/c.tar.gz").withHashPrefix(hash).value());
    }

    @Test
    void hashPrefixUsesContentDigest() throws Exception {
        HashValue digest = new Sha2Hasher().digest("payload".getBytes());
        TargetPath prefixed = TargetPath.of("firmware/ecu.bin").withHashPrefix(digest);
        assertEquals("firmware/" + digest + ".ecu.bin", prefixed.value());
        assertEquals(64 + ".ecu.bin".length(), prefixed.components().get(1).length());
    }

    @Test
    void rejectsUnsafePaths() {
        assertThrows(EncodingException.class, () -> TargetPath.of("/etc/passwd"));
        assertThrows(EncodingException.class, () -> TargetPath.of("foo/../../etc/passwd"));
        assertThrows(EncodingException.class, () -> TargetPath.of(""));
    }

    @Test
    void ordersByString() throws Exception {
        assertTrue(TargetPath.of("a/b").compareTo(TargetPath.of("a/c")) < 0);
        assertEquals(TargetPath.of("x"), TargetPath.of("x"));
        assertNotEquals(TargetPath.of("x"), TargetPath.of("x/"));
    }
}
