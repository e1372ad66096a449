package org.stianloader.picocache.test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picocache.logging.LogLevel;
import org.stianloader.picocache.logging.LoggingAdapter;

class RecordingLoggingAdapter extends LoggingAdapter {

    final List<String> messages = new CopyOnWriteArrayList<>();

    @Override
    public void log(@NotNull LogLevel level, @NotNull Class<?> origin, @NotNull String message, Object... args) {
        StringBuilder builder = new StringBuilder().append(level).append(' ').append(message);
        for (Object arg : args) {
            builder.append(" | ").append(arg);
        }
        this.messages.add(builder.toString());
        LoggingAdapter.getDefaultLogger().log(level, origin, message, args);
    }

    boolean hasLogged(@NotNull LogLevel level) {
        String prefix = level.name() + ' ';
        return this.messages.stream().anyMatch(m -> m.startsWith(prefix));
    }
}
