package org.stianloader.picocache.lock;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Maps arbitrary cache keys onto fixed-length names that are safe to use as a single
 * path component on every filesystem picocache runs on.
 */
public final class KeyHasher {

    /**
     * The length of every name returned by {@link #hash(String)}.
     */
    public static final int HASH_LENGTH = 32;

    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    private KeyHasher() {
        throw new AssertionError();
    }

    /**
     * Hashes a key into a lowercase hexadecimal string of exactly {@link #HASH_LENGTH} characters.
     * The first 128 bits of the SHA-256 digest of the UTF-8 encoded key are used.
     *
     * @param key The key to hash
     * @return The hashed key
     */
    @NotNull
    @Contract(pure = true)
    public static String hash(@NotNull String key) {
        byte[] digest;
        try {
            digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException(e);
        }
        StringBuilder hex = new StringBuilder(KeyHasher.HASH_LENGTH);
        for (int i = 0; i < KeyHasher.HASH_LENGTH / 2; i++) {
            int x = digest[i] & 0xFF;
            hex.append(KeyHasher.HEX_DIGITS[x >>> 4]).append(KeyHasher.HEX_DIGITS[x & 0x0F]);
        }
        return hex.toString();
    }
}
