package org.stianloader.picocache.internal;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;

public final class ConcurrencyUtil {

    private ConcurrencyUtil() {
        throw new AssertionError();
    }

    @NotNull
    public static <T> CompletableFuture<T> schedule(@NotNull Callable<T> source, @NotNull Executor executor) {
        Objects.requireNonNull(source, "source may not be null");

        CompletableFuture<T> cf = new CompletableFuture<>();
        executor.execute(() -> {
            if (cf.isDone()) {
                return;
            }
            try {
                cf.complete(source.call());
            } catch (Throwable t) {
                cf.completeExceptionally(t);
            }
        });
        return cf;
    }

    /**
     * Blocks until the future completes and returns its value. The exception the future completed with
     * is thrown as-is instead of being wrapped in an {@link ExecutionException}.
     *
     * @param <T> The type of the value
     * @param future The future to wait on
     * @return The value of the future
     * @throws Exception The cause of an exceptional completion
     */
    public static <T> T await(@NotNull CompletableFuture<T> future) throws Exception {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
