package org.stianloader.picocache.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.stianloader.picocache.lock.KeyHasher;

public class KeyHasherTest {

    @Test
    public void testDeterministic() {
        assertEquals(KeyHasher.hash("2301.00001"), KeyHasher.hash("2301.00001"));
        assertNotEquals(KeyHasher.hash("2301.00001"), KeyHasher.hash("2301.00002"));
    }

    @Test
    public void testFixedLengthAndFilesystemSafe() {
        for (String key : new String[] {"", "P1", "hep-th/9901001", "../../etc/passwd", "a very long key ".repeat(64), "üäö"}) {
            String hash = KeyHasher.hash(key);
            assertEquals(KeyHasher.HASH_LENGTH, hash.length(), key);
            assertTrue(hash.matches("[0-9a-f]+"), hash);
        }
    }

    @Test
    public void testKnownValue() {
        // First 128 bits of SHA-256("abc")
        assertEquals("ba7816bf8f01cfea414140de5dae2223", KeyHasher.hash("abc"));
    }
}
