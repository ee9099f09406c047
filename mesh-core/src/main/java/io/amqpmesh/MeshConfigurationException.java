package io.amqpmesh;

/**
 * Raised when the broker configuration is missing or unusable.
 */
public class MeshConfigurationException extends AmqpMeshException {

    public MeshConfigurationException(String message) {
        super(message);
    }
}
