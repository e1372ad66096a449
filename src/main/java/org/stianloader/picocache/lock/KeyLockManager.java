package org.stianloader.picocache.lock;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picocache.CacheLayout;
import org.stianloader.picocache.logging.LoggingAdapter;

/**
 * Serializes all work on a single cache key, both across threads of this JVM and across processes
 * that share the same cache root.
 *
 * <p>Cross-process exclusion is achieved through an advisory {@link FileLock} on
 * {@code <root>/.locks/<hash>.lock}, see {@link CacheLayout#getLockFile(String)}. As file locks are held on behalf
 * of the whole JVM, threads of the same JVM are additionally serialized through a {@link Semaphore} per lock file.
 * A semaphore is used instead of a reentrant lock so that a thread which already holds the lock of a key
 * times out instead of running into an {@link OverlappingFileLockException}. Semaphores are reference counted
 * and dropped once no thread holds or waits for them.
 *
 * <p>Lock files are never deleted. Deleting a lock file while another process waits on it would allow
 * a third process to lock a freshly created file of the same name, breaking mutual exclusion.
 */
public class KeyLockManager {

    private static final class LocalLock {
        @NotNull
        private final Semaphore semaphore = new Semaphore(1);
        // Only modified inside ConcurrentMap#compute
        private int users;
    }

    @NotNull
    private static final ConcurrentMap<Path, LocalLock> LOCAL_LOCKS = new ConcurrentHashMap<>();
    private static final long POLL_INTERVAL_MILLIS = 10L;

    @NotNull
    private final LoggingAdapter logger;

    public KeyLockManager(@NotNull LoggingAdapter logger) {
        this.logger = Objects.requireNonNull(logger, "logger may not be null");
    }

    /**
     * Obtains the amount of lock files that threads of this JVM currently hold or wait for.
     *
     * @return The amount of in-process locks in use
     */
    public static int getActiveLocalLocks() {
        return KeyLockManager.LOCAL_LOCKS.size();
    }

    @NotNull
    private static LocalLock retainLocalLock(@NotNull Path lockFile) {
        return KeyLockManager.LOCAL_LOCKS.compute(lockFile, (path, lock) -> {
            LocalLock retained = lock == null ? new LocalLock() : lock;
            retained.users++;
            return retained;
        });
    }

    private static void releaseLocalLock(@NotNull Path lockFile) {
        KeyLockManager.LOCAL_LOCKS.computeIfPresent(lockFile, (path, lock) -> --lock.users == 0 ? null : lock);
    }

    private static long toNanosSaturated(@NotNull Duration timeout) {
        if (timeout.isNegative()) {
            return 0L;
        }
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Runs the given action while holding the exclusive lock of a key. The lock is released
     * before this method returns, regardless of whether the action completed normally.
     *
     * @param <T> The type of the action's result
     * @param layout The layout of the cache root the key belongs to
     * @param key The cache key to lock
     * @param timeout The maximum time to wait for the lock
     * @param body The action to run. It is run at most once
     * @return The value returned by the action
     * @throws LockTimeoutException If the lock could not be obtained in time, in which case the action was not run
     * @throws IOException If the lock file could not be opened or the action threw an {@link IOException}
     * @throws InterruptedException If the current thread was interrupted while waiting for the lock
     */
    public <T> T withLock(@NotNull CacheLayout layout, @NotNull String key, @NotNull Duration timeout, @NotNull LockedAction<T> body) throws IOException, InterruptedException {
        Path lockFile = layout.getLockFile(key);
        Files.createDirectories(lockFile.getParent());

        long start = System.nanoTime();
        long timeoutNanos = KeyLockManager.toNanosSaturated(timeout);

        Path localKey = lockFile.toAbsolutePath().normalize();
        LocalLock localLock = KeyLockManager.retainLocalLock(localKey);
        try {
            if (!localLock.semaphore.tryAcquire(timeoutNanos, TimeUnit.NANOSECONDS)) {
                throw new LockTimeoutException("Waited more than " + timeout.toMillis() + " ms for another thread to release the lock on " + lockFile.toAbsolutePath(), lockFile);
            }

            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                    FileLock fileLock = this.acquire(channel, lockFile, start, timeoutNanos, timeout)) {
                this.logger.debug(KeyLockManager.class, "Acquired lock for key '{}' after {} ms", key, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
                return body.run();
            } finally {
                localLock.semaphore.release();
            }
        } finally {
            KeyLockManager.releaseLocalLock(localKey);
        }
    }

    @NotNull
    private FileLock acquire(@NotNull FileChannel channel, @NotNull Path lockFile, long start, long timeoutNanos, @NotNull Duration timeout) throws IOException, InterruptedException {
        boolean waitLogged = false;
        while (true) {
            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                // Held by this JVM outside of this manager
                lock = null;
            }
            if (lock != null) {
                return lock;
            }

            long remaining = timeoutNanos - (System.nanoTime() - start);
            if (remaining <= 0L) {
                throw new LockTimeoutException("Waited more than " + timeout.toMillis() + " ms to acquire lock on " + lockFile.toAbsolutePath(), lockFile);
            }
            if (!waitLogged) {
                this.logger.debug(KeyLockManager.class, "Lock {} is held by another process, waiting", lockFile);
                waitLogged = true;
            }
            Thread.sleep(Math.min(KeyLockManager.POLL_INTERVAL_MILLIS, TimeUnit.NANOSECONDS.toMillis(remaining) + 1L));
        }
    }
}
