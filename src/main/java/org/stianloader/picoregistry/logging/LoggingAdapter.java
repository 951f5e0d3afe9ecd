package org.stianloader.picoregistry.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Logging facade used by the registry provider and the content listers.
 *
 * <p>picoregistry only declares SLF4J as an optional dependency. If
 * {@code org.slf4j.LoggerFactory} can be found on the classpath all messages
 * are passed on to SLF4J, otherwise they end up in {@link java.util.logging.Logger JUL}.
 * Embedding applications that have their own logging setup can install their own
 * sink through {@link #setDefaultLogger(LoggingAdapter)}.
 *
 * <p>Messages use SLF4J-style "{}" placeholders. Arguments without a matching placeholder
 * are appended to the message, and a trailing {@link Throwable} argument has its stacktrace
 * logged. Placeholders are never escaped or indexed.
 */
public abstract class LoggingAdapter {

    @NotNull
    static LoggingAdapter currentInstance;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        currentInstance = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance, "instance may not be null");
    }

    public abstract void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void error(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void info(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args);
}
