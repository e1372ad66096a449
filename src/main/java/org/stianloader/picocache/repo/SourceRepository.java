package org.stianloader.picocache.repo;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The remote side of the cache: tells whether a source archive exists for a key and downloads it.
 *
 * <p>Both operations are invoked at most once per download attempt, {@link #isAvailable(String, Executor)}
 * always before {@link #getSource(String, Executor)}. Neither is invoked when the cache can serve a key
 * from disk. Implementations apply their own network timeouts; the cache does not cancel an in-flight transfer.
 */
public interface SourceRepository {

    /**
     * Checks whether the remote holds a usable source archive for a key. This method must not have side effects.
     *
     * @param key The cache key
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future completing with true if the archive can be downloaded. An exceptional completion
     * is treated as if the archive was unavailable.
     */
    @NotNull
    CompletableFuture<Boolean> isAvailable(@NotNull String key, @NotNull Executor executor);

    /**
     * Downloads the raw archive of a key.
     *
     * @param key The cache key
     * @param executor The executor with whom asynchronous operations should be performed.
     * @return A future completing with the raw bytes of the archive, or exceptionally if the transfer failed
     */
    @NotNull
    CompletableFuture<byte[]> getSource(@NotNull String key, @NotNull Executor executor);

    @NotNull
    @Contract(pure = true)
    String getRepositoryId();
}
