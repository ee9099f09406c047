package io.amqpmesh;

/**
 * Base type for failures surfaced to callers of {@link AmqpMesh}.
 */
public class AmqpMeshException extends RuntimeException {

    public AmqpMeshException(String message) {
        super(message);
    }

    public AmqpMeshException(String message, Throwable cause) {
        super(message, cause);
    }
}
