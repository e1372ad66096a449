package org.stianloader.picocache;

import java.nio.file.Path;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of ensuring that a key is cached. A successful result guarantees that {@link #getEntry()} was a
 * valid entry at the time the operation completed; a failed one carries a {@link CacheFailure}.
 */
public final class CacheResult {

    @NotNull
    private final Path entry;
    @Nullable
    private final CacheFailure failure;
    private final boolean cacheHit;

    private CacheResult(@NotNull Path entry, @Nullable CacheFailure failure, boolean cacheHit) {
        this.entry = Objects.requireNonNull(entry, "entry may not be null");
        this.failure = failure;
        this.cacheHit = cacheHit;
    }

    @NotNull
    public static CacheResult hit(@NotNull Path entry) {
        return new CacheResult(entry, null, true);
    }

    @NotNull
    public static CacheResult published(@NotNull Path entry) {
        return new CacheResult(entry, null, false);
    }

    @NotNull
    public static CacheResult failed(@NotNull Path entry, @NotNull CacheFailure failure) {
        return new CacheResult(entry, Objects.requireNonNull(failure, "failure may not be null"), false);
    }

    @Contract(pure = true)
    public boolean isSuccess() {
        return this.failure == null;
    }

    /**
     * Whether the entry was served from disk without contacting the repository.
     *
     * @return True on a cache hit
     */
    @Contract(pure = true)
    public boolean isCacheHit() {
        return this.cacheHit;
    }

    @NotNull
    @Contract(pure = true)
    public Path getEntry() {
        return this.entry;
    }

    @Nullable
    @Contract(pure = true)
    public CacheFailure getFailure() {
        return this.failure;
    }

    @Override
    public String toString() {
        if (this.failure == null) {
            return "CacheResult[" + (this.cacheHit ? "hit" : "published") + ", " + this.entry + "]";
        }
        return "CacheResult[failed, " + this.entry + ", " + this.failure + "]";
    }
}
