package io.amqpmesh.transport;

/**
 * Receives deliveries from {@link TransportChannel#consume}. A {@code null} message means the
 * broker cancelled the consumer.
 */
@FunctionalInterface
public interface DeliveryCallback {

    void onDelivery(InboundMessage message);
}
