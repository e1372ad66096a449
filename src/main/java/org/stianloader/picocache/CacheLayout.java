package org.stianloader.picocache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picocache.lock.KeyHasher;

/**
 * Describes where things live below a cache root:
 *
 * <ul>
 * <li>{@code <root>/<name>/} - the entry of a key</li>
 * <li>{@code <root>/.locks/<hash>.lock} - the lock file of a key</li>
 * <li>{@code <root>/.staging/<name>.<random>/} - in-flight downloads</li>
 * <li>{@code <root>/<name>.old.<random>/} - an entry displaced during publish</li>
 * </ul>
 *
 * <p>The name of a key is the key itself, except that forward slashes are written as {@code %2F}
 * (e.g. {@code hep-th/9901001} is stored as {@code hep-th%2F9901001}). Every entry is thus a direct child
 * of the root and no entry can be located inside another one. As the percent sign is reserved, distinct
 * keys always have distinct names. Keys may not start with a dot, as the dot-prefixed names below
 * the root are reserved for the cache itself.
 */
public final class CacheLayout {

    @NotNull
    public static final String LOCK_DIRECTORY = ".locks";
    @NotNull
    public static final String STAGING_DIRECTORY = ".staging";
    @NotNull
    public static final String BACKUP_INFIX = ".old.";
    @NotNull
    public static final String ESCAPED_SLASH = "%2F";

    @NotNull
    private final Path root;

    public CacheLayout(@NotNull Path root) {
        this.root = Objects.requireNonNull(root, "root may not be null").toAbsolutePath().normalize();
    }

    /**
     * Checks whether a key can be used as an entry name.
     *
     * @param key The key to check
     * @throws IllegalArgumentException If the key is empty, absolute, contains reserved characters, empty, "." or ".." segments,
     * starts with a dot or could be mistaken for a backup of another entry.
     */
    public static void validateKey(@NotNull String key) {
        Objects.requireNonNull(key, "key may not be null");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("The key may not be empty");
        }
        if (key.charAt(0) == '.' || key.charAt(0) == '/') {
            throw new IllegalArgumentException("The key may not start with '.' or '/': \"" + key + "\"");
        }
        if (key.indexOf('\\') != -1 || key.indexOf(':') != -1 || key.indexOf('%') != -1 || key.indexOf('\0') != -1) {
            throw new IllegalArgumentException("The key contains a reserved character: \"" + key + "\"");
        }
        if (key.contains(CacheLayout.BACKUP_INFIX)) {
            throw new IllegalArgumentException("The key may not contain \"" + CacheLayout.BACKUP_INFIX + "\": \"" + key + "\"");
        }
        for (String segment : key.split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new IllegalArgumentException("The key contains an empty, \".\" or \"..\" path segment: \"" + key + "\"");
            }
        }
    }

    @NotNull
    private static String randomSuffix() {
        return Long.toHexString(ThreadLocalRandom.current().nextLong() | Long.MIN_VALUE);
    }

    @NotNull
    @Contract(pure = true)
    public Path getRoot() {
        return this.root;
    }

    @NotNull
    @Contract(pure = true)
    public Path getLockDirectory() {
        return this.root.resolve(CacheLayout.LOCK_DIRECTORY);
    }

    @NotNull
    @Contract(pure = true)
    public Path getStagingDirectory() {
        return this.root.resolve(CacheLayout.STAGING_DIRECTORY);
    }

    /**
     * Obtains the name of the entry directory of a key, which is the key with every slash replaced by {@link #ESCAPED_SLASH}.
     *
     * @param key The key
     * @return The name of the entry, a single path segment
     */
    @NotNull
    @Contract(pure = true)
    public static String getEntryName(@NotNull String key) {
        CacheLayout.validateKey(key);
        return key.replace("/", CacheLayout.ESCAPED_SLASH);
    }

    @NotNull
    @Contract(pure = true)
    public Path getEntry(@NotNull String key) {
        return this.root.resolve(CacheLayout.getEntryName(key));
    }

    @NotNull
    @Contract(pure = true)
    public Path getLockFile(@NotNull String key) {
        CacheLayout.validateKey(key);
        return this.getLockDirectory().resolve(KeyHasher.hash(key) + ".lock");
    }

    /**
     * Obtains the prefix of the staging directories of a key.
     *
     * @param key The key
     * @return The entry name of the key, followed by a dot
     */
    @NotNull
    @Contract(pure = true)
    public String getStagingPrefix(@NotNull String key) {
        return CacheLayout.getEntryName(key) + '.';
    }

    /**
     * Generates a fresh backup location for the entry of a key. The returned path is a direct child of the root
     * and did not exist at the time of the call; callers must still move into it without replacing existing files.
     *
     * @param key The key
     * @return The backup location
     */
    @NotNull
    public Path newBackupLocation(@NotNull String key) {
        Path entry = this.getEntry(key);
        Path backup;
        do {
            backup = entry.resolveSibling(entry.getFileName().toString() + CacheLayout.BACKUP_INFIX + CacheLayout.randomSuffix());
        } while (Files.exists(backup));
        return backup;
    }

    /**
     * Creates the root, lock and staging directories. Directories that already exist are left untouched.
     *
     * @throws IOException If a directory could not be created
     */
    public void createDirectories() throws IOException {
        Files.createDirectories(this.root);
        Files.createDirectories(this.getLockDirectory());
        Files.createDirectories(this.getStagingDirectory());
    }

    @Override
    public String toString() {
        return "CacheLayout[" + this.root + "]";
    }
}
