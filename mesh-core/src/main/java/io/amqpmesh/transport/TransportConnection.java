package io.amqpmesh.transport;

/**
 * A managed connection that survives broker restarts.
 * <p>
 * Channels are requested with a {@link ChannelSetup} callback rather than returned directly: the
 * callback runs every time the connection is (re)established, so the caller always holds a live
 * channel without tracking reconnects itself.
 */
public interface TransportConnection {

    void addLifecycleListener(ConnectionLifecycleListener listener);

    void createChannel(ChannelOptions options, ChannelSetup setup);
}
