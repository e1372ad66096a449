package org.stianloader.picocache.logging;

/**
 * The severity levels understood by {@link LoggingAdapter}. Levels map one-to-one onto the SLF4J levels
 * of the same name, and onto {@link java.util.logging.Level#FINE}, {@link java.util.logging.Level#INFO},
 * {@link java.util.logging.Level#WARNING} and {@link java.util.logging.Level#SEVERE} respectively when
 * logging through JUL.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;
}
