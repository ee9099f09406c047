package io.amqpmesh.logging;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link MeshLogger} that forwards to SLF4J.
 */
public final class Slf4jMeshLogger implements MeshLogger {

    private static final String DEFAULT_LOGGER = "io.amqpmesh.AmqpMesh";

    private final Logger delegate;

    public Slf4jMeshLogger() {
        this(LoggerFactory.getLogger(DEFAULT_LOGGER));
    }

    public Slf4jMeshLogger(Logger delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void log(LogLevel level, String message, Object... args) {
        Objects.requireNonNull(level, "level");
        switch (level) {
            case ERROR -> delegate.error(message, args);
            case WARN -> delegate.warn(message, args);
            default -> delegate.info(message, args);
        }
    }
}
