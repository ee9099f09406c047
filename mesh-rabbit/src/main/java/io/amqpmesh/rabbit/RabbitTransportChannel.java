package io.amqpmesh.rabbit;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import io.amqpmesh.transport.ChannelOptions;
import io.amqpmesh.transport.DeliveryCallback;
import io.amqpmesh.transport.ExchangeType;
import io.amqpmesh.transport.InboundMessage;
import io.amqpmesh.transport.PublishOptions;
import io.amqpmesh.transport.TransportChannel;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TransportChannel} over a RabbitMQ driver channel.
 */
public final class RabbitTransportChannel implements TransportChannel {

    private static final String DEFAULT_EXCHANGE = "";

    private final Channel channel;
    private final ChannelOptions options;

    public RabbitTransportChannel(Channel channel, ChannelOptions options) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public void publish(String exchange, String routingKey, byte[] payload, PublishOptions publishOptions)
        throws IOException {
        PublishOptions effective = publishOptions != null ? publishOptions : PublishOptions.none();
        AMQP.BasicProperties properties = RabbitMessages.toProperties(effective, options.json());
        channel.basicPublish(exchange, routingKey, effective.mandatory(), properties, payload);
    }

    @Override
    public void sendToQueue(String queue, byte[] payload) throws IOException {
        AMQP.BasicProperties properties = RabbitMessages.toProperties(PublishOptions.none(), options.json());
        channel.basicPublish(DEFAULT_EXCHANGE, queue, properties, payload);
    }

    @Override
    public void assertExchange(String exchange, ExchangeType type, boolean durable) throws IOException {
        channel.exchangeDeclare(exchange, type.wireName(), durable);
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey, Map<String, Object> headers)
        throws IOException {
        channel.queueBind(queue, exchange, routingKey != null ? routingKey : "", headers);
    }

    @Override
    public String consume(String queue, DeliveryCallback callback) throws IOException {
        Objects.requireNonNull(callback, "callback");
        return channel.basicConsume(queue, false,
            (consumerTag, delivery) -> callback.onDelivery(RabbitMessages.toInbound(delivery)),
            consumerTag -> callback.onDelivery(null));
    }

    @Override
    public void ack(InboundMessage message) throws IOException {
        channel.basicAck(message.deliveryTag(), false);
    }

    @Override
    public void nack(InboundMessage message, boolean multiple, boolean requeue) throws IOException {
        channel.basicNack(message.deliveryTag(), multiple, requeue);
    }
}
