package org.stianloader.picocache.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

class JULLogAdapter extends LoggingAdapter {

    /**
     * Substitutes the "{}" placeholders of an SLF4J-style message. Surplus arguments are appended,
     * a trailing surplus {@link Throwable} is rendered with its stacktrace.
     */
    @NotNull
    @Contract(pure = true)
    static String formatMessage(@NotNull String message, Object... args) {
        StringBuilder builder = new StringBuilder(message.length() + 16 * args.length);
        int cursor = 0;
        for (int i = 0; i < args.length; i++) {
            int placeholder = message.indexOf("{}", cursor);
            if (placeholder != -1) {
                builder.append(message, cursor, placeholder).append(Objects.toString(args[i]));
                cursor = placeholder + 2;
                continue;
            }
            builder.append(message, cursor, message.length());
            cursor = message.length();
            if (i == (args.length - 1) && args[i] instanceof Throwable) {
                StringWriter sw = new StringWriter();
                ((Throwable) args[i]).printStackTrace(new PrintWriter(sw));
                builder.append('\n').append(sw);
            } else {
                builder.append(' ').append(Objects.toString(args[i]));
            }
        }
        builder.append(message, cursor, message.length());
        return builder.toString();
    }

    @NotNull
    private static Level toJUL(@NotNull LogLevel level) {
        switch (level) {
        case DEBUG:
            return Level.FINE;
        case INFO:
            return Level.INFO;
        case WARN:
            return Level.WARNING;
        case ERROR:
            return Level.SEVERE;
        default:
            throw new IncompatibleClassChangeError("Unknown level: " + level);
        }
    }

    @Override
    public void log(@NotNull LogLevel level, @NotNull Class<?> origin, @NotNull String message, Object... args) {
        Logger.getLogger(origin.getName()).log(JULLogAdapter.toJUL(level), () -> JULLogAdapter.formatMessage(message, args));
    }
}
