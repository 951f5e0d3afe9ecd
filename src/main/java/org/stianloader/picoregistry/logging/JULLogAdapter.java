package org.stianloader.picoregistry.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

class JULLogAdapter extends LoggingAdapter {

    @NotNull
    @Contract(pure = true)
    static String format(@NotNull String message, Object... args) {
        StringBuilder builder = new StringBuilder();
        int head = 0;
        for (int i = 0; i < args.length; i++) {
            Object arg = args[i];
            if (i == args.length - 1 && arg instanceof Throwable) {
                StringWriter trace = new StringWriter();
                ((Throwable) arg).printStackTrace(new PrintWriter(trace));
                builder.append(message, head, message.length()).append('\n').append(trace);
                return builder.toString();
            }
            int placeholder = message.indexOf("{}", head);
            if (placeholder == -1) {
                builder.append(message, head, message.length()).append(' ').append(Objects.toString(arg));
                head = message.length();
            } else {
                builder.append(message, head, placeholder).append(Objects.toString(arg));
                head = placeholder + 2;
            }
        }
        return builder.append(message, head, message.length()).toString();
    }

    private static void log(@NotNull Class<?> clazz, @NotNull Level level, @NotNull String message, Object... args) {
        Logger logger = Logger.getLogger(clazz.getName());
        if (logger.isLoggable(level)) {
            logger.log(level, JULLogAdapter.format(message, args));
        }
    }

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.FINE, message, args);
    }

    @Override
    public void error(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.SEVERE, message, args);
    }

    @Override
    public void info(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.INFO, message, args);
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.WARNING, message, args);
    }
}
