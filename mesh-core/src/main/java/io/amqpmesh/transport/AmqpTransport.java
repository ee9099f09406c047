package io.amqpmesh.transport;

import java.util.List;

/**
 * Opens resilient broker connections. Implementations own reconnection; callers never see a
 * connectivity failure from {@link #connect}.
 */
public interface AmqpTransport {

    TransportConnection connect(List<String> urls, ConnectionOptions options);

    default TransportConnection connect(List<String> urls) {
        return connect(urls, ConnectionOptions.transportDefaults());
    }
}
