package io.amqpmesh.transport;

/**
 * Invoked with a freshly opened channel each time the owning connection is established.
 */
@FunctionalInterface
public interface ChannelSetup {

    void setup(TransportChannel channel) throws Exception;
}
