package org.stianloader.picocache.logging;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class SLF4JLogAdapter extends LoggingAdapter {

    @Override
    public void log(@NotNull LogLevel level, @NotNull Class<?> origin, @NotNull String message, Object... args) {
        Logger logger = LoggerFactory.getLogger(origin);
        switch (level) {
        case DEBUG:
            logger.debug(message, args);
            break;
        case INFO:
            logger.info(message, args);
            break;
        case WARN:
            logger.warn(message, args);
            break;
        case ERROR:
            logger.error(message, args);
            break;
        default:
            throw new IncompatibleClassChangeError("Unknown level: " + level);
        }
    }
}
