package io.amqpmesh;

/**
 * Indicates that a send found no ready channel on any connection.
 */
public class NoChannelAvailableException extends AmqpMeshException {

    public NoChannelAvailableException(String message) {
        super(message);
    }
}
