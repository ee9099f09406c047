package io.amqpmesh.logging;

/**
 * Pluggable sink for the mesh's operational log lines.
 * <p>
 * {@code message} uses SLF4J-style {@code {}} placeholders. A trailing {@link Throwable} in
 * {@code args} is treated as the cause.
 */
@FunctionalInterface
public interface MeshLogger {

    void log(LogLevel level, String message, Object... args);

    default void info(String message, Object... args) {
        log(LogLevel.INFO, message, args);
    }

    default void warn(String message, Object... args) {
        log(LogLevel.WARN, message, args);
    }

    default void error(String message, Object... args) {
        log(LogLevel.ERROR, message, args);
    }
}
