package org.stianloader.picocache;

import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Describes why a cache operation failed.
 *
 * <p>A failure may carry a nested failure. This is the case for a {@link FailureKind#PUBLISH_FAILED publish}
 * whose rollback failed as well: the outer failure describes the publish, the nested one the rollback.
 * Only such failures leave the cache in a state that needs manual cleanup.
 */
public final class CacheFailure {

    @NotNull
    private final FailureKind kind;
    @NotNull
    private final String message;
    @Nullable
    private final Throwable cause;
    @Nullable
    private final CacheFailure nested;

    public CacheFailure(@NotNull FailureKind kind, @NotNull String message, @Nullable Throwable cause, @Nullable CacheFailure nested) {
        this.kind = Objects.requireNonNull(kind, "kind may not be null");
        this.message = Objects.requireNonNull(message, "message may not be null");
        this.cause = cause;
        this.nested = nested;
    }

    @NotNull
    public static CacheFailure of(@NotNull FailureKind kind, @NotNull String message) {
        return new CacheFailure(kind, message, null, null);
    }

    @NotNull
    public static CacheFailure of(@NotNull FailureKind kind, @NotNull String message, @Nullable Throwable cause) {
        return new CacheFailure(kind, message, cause, null);
    }

    @NotNull
    @Contract(pure = true)
    public FailureKind getKind() {
        return this.kind;
    }

    @NotNull
    @Contract(pure = true)
    public String getMessage() {
        return this.message;
    }

    @Nullable
    @Contract(pure = true)
    public Throwable getCause() {
        return this.cause;
    }

    @Nullable
    @Contract(pure = true)
    public CacheFailure getNested() {
        return this.nested;
    }

    /**
     * Whether a publish failed and the previous entry could not be moved back into place. In that case the
     * entry is missing and the previous tree only survives in a backup directory next to it.
     *
     * @return True if manual intervention is required
     */
    @Contract(pure = true)
    public boolean requiresOperatorAttention() {
        return this.kind == FailureKind.PUBLISH_FAILED && this.nested != null;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(this.kind).append(": ").append(this.message);
        if (this.cause != null) {
            builder.append(" (").append(this.cause).append(')');
        }
        if (this.nested != null) {
            builder.append("; ").append(this.nested);
        }
        return builder.toString();
    }
}
