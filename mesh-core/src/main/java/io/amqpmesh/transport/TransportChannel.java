package io.amqpmesh.transport;

import java.io.IOException;
import java.util.Map;

/**
 * The operations the mesh needs from a broker channel, and nothing more.
 */
public interface TransportChannel {

    void publish(String exchange, String routingKey, byte[] payload, PublishOptions options) throws IOException;

    void sendToQueue(String queue, byte[] payload) throws IOException;

    void assertExchange(String exchange, ExchangeType type, boolean durable) throws IOException;

    /**
     * Binds {@code queue} to {@code exchange}.
     *
     * @param headers header match arguments, or {@code null} for routing-key bindings
     */
    void bindQueue(String queue, String exchange, String routingKey, Map<String, Object> headers) throws IOException;

    /**
     * Registers a consumer with manual acknowledgement.
     *
     * @return the broker-assigned consumer tag
     */
    String consume(String queue, DeliveryCallback callback) throws IOException;

    void ack(InboundMessage message) throws IOException;

    void nack(InboundMessage message, boolean multiple, boolean requeue) throws IOException;
}
