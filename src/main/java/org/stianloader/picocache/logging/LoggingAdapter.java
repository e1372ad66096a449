package org.stianloader.picocache.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Sink for everything picocache has to say about cache hits, downloads, publishes
 * and the cleanup work that accompanies them.
 *
 * <p>picocache is meant to be embedded into other tools, so it does not force SLF4J onto
 * its users. The {@link #getDefaultLogger() default adapter} uses SLF4J if it is present on the classpath
 * and falls back to {@link java.util.logging.Logger JUL} otherwise. Unlike a plain static logger, an adapter
 * is handed to the {@link org.stianloader.picocache.SourceCache} explicitly, which passes it on to
 * every component it drives. Nothing below the facade reads {@link #getDefaultLogger()}.
 *
 * <p>Messages use SLF4J-style "{}" placeholders. Arguments that do not map to a placeholder
 * are appended to the end of the message, leftover placeholders are kept as-is. If the last
 * argument is a {@link Throwable}, its stacktrace should be logged.
 */
public abstract class LoggingAdapter {

    @NotNull
    private static volatile LoggingAdapter defaultInstance = LoggingAdapter.detectDefault();

    @NotNull
    private static LoggingAdapter detectDefault() {
        try {
            Class.forName("org.slf4j.LoggerFactory");
            return new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            return new JULLogAdapter();
        }
    }

    /**
     * Obtains the adapter that newly created caches start out with.
     *
     * @return The default adapter
     */
    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.defaultInstance;
    }

    /**
     * Replaces the adapter that newly created caches start out with. Meant to be called once
     * during application startup. Caches which already exist keep the adapter they were created with.
     *
     * @param instance The new default adapter
     */
    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.defaultInstance = Objects.requireNonNull(instance, "instance may not be null");
    }

    public abstract void log(@NotNull LogLevel level, @NotNull Class<?> origin, @NotNull String message, Object... args);

    public final void debug(@NotNull Class<?> origin, @NotNull String message, Object... args) {
        this.log(LogLevel.DEBUG, origin, message, args);
    }

    public final void info(@NotNull Class<?> origin, @NotNull String message, Object... args) {
        this.log(LogLevel.INFO, origin, message, args);
    }

    public final void warn(@NotNull Class<?> origin, @NotNull String message, Object... args) {
        this.log(LogLevel.WARN, origin, message, args);
    }

    public final void error(@NotNull Class<?> origin, @NotNull String message, Object... args) {
        this.log(LogLevel.ERROR, origin, message, args);
    }
}
