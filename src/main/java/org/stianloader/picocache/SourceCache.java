package org.stianloader.picocache;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picocache.archive.SafeArchiveExtractor;
import org.stianloader.picocache.internal.ConcurrencyUtil;
import org.stianloader.picocache.internal.StagingPipeline;
import org.stianloader.picocache.lock.KeyLockManager;
import org.stianloader.picocache.lock.LockTimeoutException;
import org.stianloader.picocache.logging.LoggingAdapter;
import org.stianloader.picocache.repo.SourceRepository;
import org.stianloader.picocache.validate.EntryValidator;

/**
 * Keeps a local, unpacked copy of remote source archives.
 *
 * <p>Each key maps to a directory {@code <root>/<key>/} which is handed out only once it is complete. Downloads are
 * built in a staging directory and renamed into place, so a failed or interrupted download never damages
 * an entry that was valid before. Work on the same key is serialized across threads and processes that share the
 * root; different keys never wait on each other.
 *
 * <p>Instances are thread-safe once configured.
 */
public class SourceCache {

    /**
     * The default lock timeout used by {@link #ensureCached(String, Path, boolean, boolean)}.
     */
    @NotNull
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofMinutes(10);

    /**
     * The default payload suffix. An entry is only considered valid if it contains at least one file ending with it.
     */
    @NotNull
    public static final String DEFAULT_PAYLOAD_SUFFIX = ".tex";

    @NotNull
    private static final Executor DIRECT_EXECUTOR = Runnable::run;

    @NotNull
    private final SourceRepository repository;
    @NotNull
    private LoggingAdapter logger = LoggingAdapter.getDefaultLogger();
    @NotNull
    private String payloadSuffix = SourceCache.DEFAULT_PAYLOAD_SUFFIX;
    @NotNull
    private EntryValidator validator = new EntryValidator(SourceCache.DEFAULT_PAYLOAD_SUFFIX);

    public SourceCache(@NotNull SourceRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository may not be null");
    }

    /**
     * Obtains the cache root used if the caller does not have a preference.
     * The system property {@code picocache.cacheRoot} takes precedence. Otherwise {@code %LOCALAPPDATA%\picocache}
     * is used on Windows and {@code $XDG_CACHE_HOME/picocache} (defaulting to {@code ~/.cache/picocache}) everywhere else.
     *
     * @return The default cache root
     */
    @NotNull
    public static Path getDefaultCacheRoot() {
        String override = System.getProperty("picocache.cacheRoot");
        if (override != null && !override.isEmpty()) {
            return Paths.get(override);
        }
        String home = System.getProperty("user.home", ".");
        String base;
        if (System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows")) {
            base = System.getenv("LOCALAPPDATA");
            if (base == null || base.isEmpty()) {
                base = home;
            }
        } else {
            base = System.getenv("XDG_CACHE_HOME");
            if (base == null || base.isEmpty()) {
                return Paths.get(home, ".cache", "picocache");
            }
        }
        return Paths.get(base, "picocache");
    }

    @NotNull
    @Contract(pure = true)
    public SourceRepository getRepository() {
        return this.repository;
    }

    @NotNull
    @Contract(pure = true)
    public LoggingAdapter getLogger() {
        return this.logger;
    }

    @NotNull
    @Contract(pure = true)
    public String getPayloadSuffix() {
        return this.payloadSuffix;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public SourceCache setLogger(@NotNull LoggingAdapter logger) {
        this.logger = Objects.requireNonNull(logger, "logger may not be null");
        return this;
    }

    /**
     * Sets the suffix of the files an entry must contain to be considered valid, ".tex" by default.
     * The comparison is case-insensitive.
     *
     * @param payloadSuffix The suffix, including the leading dot
     * @return The current {@link SourceCache} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public SourceCache setPayloadSuffix(@NotNull String payloadSuffix) {
        this.validator = new EntryValidator(payloadSuffix);
        this.payloadSuffix = payloadSuffix;
        return this;
    }

    /**
     * Checks whether a directory is a complete cache entry, without touching the network or taking any lock.
     *
     * @param entry The directory to check
     * @return True if the directory can be used as-is
     */
    public boolean isValid(@NotNull Path entry) {
        return this.validator.isValid(entry);
    }

    @NotNull
    @Contract(pure = true)
    public Path getEntry(@NotNull Path root, @NotNull String key) {
        return new CacheLayout(root).getEntry(key);
    }

    /**
     * Renames a file or directory as part of publishing an entry. The target never exists when this method is called.
     *
     * @param source The path to move
     * @param target The new location
     * @throws IOException If the rename failed
     */
    protected void movePath(@NotNull Path source, @NotNull Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
    }

    public boolean ensureCached(@NotNull String key, @NotNull Path root, boolean useCache, boolean repairStale) {
        return this.ensureCached(key, root, useCache, repairStale, SourceCache.DEFAULT_LOCK_TIMEOUT);
    }

    /**
     * Makes sure that {@code <root>/<key>} is a valid entry.
     *
     * @param key The key
     * @param root The cache root. It and its internal directories are created if absent.
     * @param useCache Whether an existing valid entry may be used without downloading it again
     * @param repairStale Whether an existing entry that is not valid may be replaced. Ignored if useCache is false,
     * as the entry is replaced anyway in that case.
     * @param lockTimeout The maximum time to wait for other operations on the same key
     * @return True if the entry is valid when this method returns
     */
    public boolean ensureCached(@NotNull String key, @NotNull Path root, boolean useCache, boolean repairStale, @NotNull Duration lockTimeout) {
        return this.ensureCachedResult(key, root, useCache, repairStale, lockTimeout).isSuccess();
    }

    /**
     * Same as {@link #ensureCached(String, Path, boolean, boolean, Duration)}, but describes the outcome in detail.
     *
     * @param key The key
     * @param root The cache root
     * @param useCache Whether an existing valid entry may be used without downloading it again
     * @param repairStale Whether an existing entry that is not valid may be replaced
     * @param lockTimeout The maximum time to wait for other operations on the same key
     * @return The outcome. Failures are reported through the result, never thrown.
     * @throws IllegalArgumentException If the key cannot be used as a directory name, see {@link CacheLayout#validateKey(String)}
     */
    @NotNull
    public CacheResult ensureCachedResult(@NotNull String key, @NotNull Path root, boolean useCache, boolean repairStale, @NotNull Duration lockTimeout) {
        Objects.requireNonNull(lockTimeout, "lockTimeout may not be null");
        CacheLayout layout = new CacheLayout(root);
        Path entry = layout.getEntry(key);
        LoggingAdapter logger = this.logger;

        try {
            layout.createDirectories();
        } catch (IOException e) {
            CacheFailure failure = CacheFailure.of(FailureKind.IO_ERROR, "Unable to create cache directories below " + layout.getRoot(), e);
            logger.warn(SourceCache.class, "{}", failure);
            return CacheResult.failed(entry, failure);
        }

        StagingPipeline pipeline = new StagingPipeline(this.repository, new SafeArchiveExtractor(logger, "main" + this.payloadSuffix),
                this.validator, this::movePath, SourceCache.DIRECT_EXECUTOR, logger);

        try {
            return new KeyLockManager(logger).withLock(layout, key, lockTimeout, () -> pipeline.run(layout, key, useCache, repairStale));
        } catch (LockTimeoutException e) {
            CacheFailure failure = CacheFailure.of(FailureKind.LOCK_TIMEOUT, e.getMessage(), e);
            logger.warn(SourceCache.class, "{}", failure);
            return CacheResult.failed(entry, failure);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CacheFailure failure = CacheFailure.of(FailureKind.LOCK_TIMEOUT, "Interrupted while waiting for the lock of key '" + key + "'", e);
            logger.warn(SourceCache.class, "{}", failure);
            return CacheResult.failed(entry, failure);
        } catch (IOException e) {
            CacheFailure failure = CacheFailure.of(FailureKind.IO_ERROR, "Unable to lock key '" + key + "'", e);
            logger.warn(SourceCache.class, "{}", failure);
            return CacheResult.failed(entry, failure);
        }
    }

    /**
     * Schedules {@link #ensureCachedResult(String, Path, boolean, boolean, Duration)} on the given executor.
     * The returned future completes normally for every cache failure; it only completes exceptionally
     * for invalid arguments.
     *
     * @param key The key
     * @param root The cache root
     * @param useCache Whether an existing valid entry may be used without downloading it again
     * @param repairStale Whether an existing entry that is not valid may be replaced
     * @param lockTimeout The maximum time to wait for other operations on the same key
     * @param executor The executor to block on
     * @return A future completing with the outcome
     */
    @NotNull
    public CompletableFuture<CacheResult> ensureCachedAsync(@NotNull String key, @NotNull Path root, boolean useCache, boolean repairStale, @NotNull Duration lockTimeout, @NotNull Executor executor) {
        return ConcurrencyUtil.schedule(() -> this.ensureCachedResult(key, root, useCache, repairStale, lockTimeout), executor);
    }
}
