package io.amqpmesh;

/**
 * Wraps a transport failure raised while publishing or encoding an outbound message.
 */
public class MessageDispatchException extends AmqpMeshException {

    public MessageDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
