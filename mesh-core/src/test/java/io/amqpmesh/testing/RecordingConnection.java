package io.amqpmesh.testing;

import io.amqpmesh.transport.ChannelOptions;
import io.amqpmesh.transport.ChannelSetup;
import io.amqpmesh.transport.ConnectionLifecycleListener;
import io.amqpmesh.transport.TransportConnection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingConnection implements TransportConnection {

    private record Registration(ChannelOptions options, ChannelSetup setup) {
    }

    private final RecordingTransport transport;
    private final String url;
    private final List<ConnectionLifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final List<RecordingChannel> channels = new CopyOnWriteArrayList<>();
    private volatile boolean established;

    RecordingConnection(RecordingTransport transport, String url) {
        this.transport = transport;
        this.url = url;
    }

    @Override
    public void addLifecycleListener(ConnectionLifecycleListener listener) {
        listeners.add(listener);
    }

    @Override
    public void createChannel(ChannelOptions options, ChannelSetup setup) {
        Registration registration = new Registration(options, setup);
        registrations.add(registration);
        if (established) {
            open(registration);
        }
    }

    /**
     * Marks the connection as up and runs every registered channel setup on a fresh channel, the
     * way a reconnect would.
     */
    public void establish() {
        established = true;
        listeners.forEach(ConnectionLifecycleListener::onConnect);
        for (Registration registration : registrations) {
            open(registration);
        }
    }

    public void failConnect(Throwable cause) {
        listeners.forEach(listener -> listener.onConnectFailed(cause));
    }

    public void disconnect(Throwable cause) {
        established = false;
        listeners.forEach(listener -> listener.onDisconnect(cause));
    }

    public void block(String reason) {
        listeners.forEach(listener -> listener.onBlocked(reason));
    }

    public void unblock() {
        listeners.forEach(ConnectionLifecycleListener::onUnblocked);
    }

    public String url() {
        return url;
    }

    public List<RecordingChannel> channels() {
        return List.copyOf(channels);
    }

    public RecordingChannel channel(int index) {
        return channels.get(index);
    }

    public int registrationCount() {
        return registrations.size();
    }

    private void open(Registration registration) {
        RecordingChannel channel = new RecordingChannel(transport, registration.options());
        channels.add(channel);
        try {
            registration.setup().setup(channel);
        } catch (Exception ex) {
            throw new IllegalStateException("channel setup failed", ex);
        }
    }
}
