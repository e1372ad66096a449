package org.stianloader.picocache.lock;

import java.io.IOException;
import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown by {@link KeyLockManager#withLock(org.stianloader.picocache.CacheLayout, String, java.time.Duration, LockedAction)}
 * if the lock of a key could not be obtained in time. The guarded action has not been run when this exception is thrown.
 */
public class LockTimeoutException extends IOException {

    private static final long serialVersionUID = 4155213930118412096L;

    @NotNull
    private final transient Path lockFile;

    public LockTimeoutException(@NotNull String message, @NotNull Path lockFile) {
        super(message);
        this.lockFile = lockFile;
    }

    @NotNull
    public Path getLockFile() {
        return this.lockFile;
    }
}
