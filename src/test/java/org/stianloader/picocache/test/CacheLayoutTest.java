package org.stianloader.picocache.test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picocache.CacheLayout;
import org.stianloader.picocache.lock.KeyHasher;

public class CacheLayoutTest {

    @Test
    public void testPaths(@TempDir Path root) {
        CacheLayout layout = new CacheLayout(root);
        Path base = root.toAbsolutePath().normalize();
        assertEquals(base.resolve("P1"), layout.getEntry("P1"));
        assertEquals(base.resolve(".locks").resolve(KeyHasher.hash("P1") + ".lock"), layout.getLockFile("P1"));
        assertEquals(base.resolve(".staging"), layout.getStagingDirectory());
        assertEquals("hep-th%2F9901001.", layout.getStagingPrefix("hep-th/9901001"));
        assertEquals(base.resolve("hep-th%2F9901001"), layout.getEntry("hep-th/9901001"));
    }

    @Test
    public void testEntriesAreNeverNested(@TempDir Path root) {
        CacheLayout layout = new CacheLayout(root);
        Path base = root.toAbsolutePath().normalize();
        for (String key : new String[] {"P1", "P1/x", "hep-th", "hep-th/9901001", "a/b/c"}) {
            assertEquals(base, layout.getEntry(key).getParent(), key);
        }
        assertNotEquals(layout.getEntry("a_b"), layout.getEntry("a/b"));
        assertFalse(layout.getEntry("P1/x").startsWith(layout.getEntry("P1")));
        assertEquals(base, layout.newBackupLocation("hep-th/9901001").getParent());
    }

    @Test
    public void testBackupLocation(@TempDir Path root) {
        CacheLayout layout = new CacheLayout(root);
        Path first = layout.newBackupLocation("P1");
        Path second = layout.newBackupLocation("P1");
        assertNotEquals(first, second);
        assertEquals(layout.getEntry("P1").getParent(), first.getParent());
        assertTrue(first.getFileName().toString().startsWith("P1.old."));
        assertFalse(Files.exists(first));
    }

    @Test
    public void testCreateDirectoriesIsIdempotent(@TempDir Path root) {
        CacheLayout layout = new CacheLayout(root.resolve("nested").resolve("cache"));
        assertDoesNotThrow(layout::createDirectories);
        assertDoesNotThrow(layout::createDirectories);
        assertTrue(Files.isDirectory(layout.getLockDirectory()));
        assertTrue(Files.isDirectory(layout.getStagingDirectory()));
    }

    @Test
    public void testRejectedKeys() {
        for (String key : new String[] {"", ".locks", ".staging", "/abs", "a/../b", "..", "a//b", "a/", "a\\b", "C:x", "a/./b", "a%2Fb", "P1.old.8000000000000000"}) {
            assertThrows(IllegalArgumentException.class, () -> CacheLayout.validateKey(key), key);
        }
        assertDoesNotThrow(() -> CacheLayout.validateKey("2301.00001"));
        assertDoesNotThrow(() -> CacheLayout.validateKey("hep-th/9901001"));
        assertDoesNotThrow(() -> CacheLayout.validateKey("P1.v2"));
    }
}
