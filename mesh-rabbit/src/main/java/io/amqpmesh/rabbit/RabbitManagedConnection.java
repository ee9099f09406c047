package io.amqpmesh.rabbit;

import com.rabbitmq.client.BlockedListener;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import io.amqpmesh.support.Redaction;
import io.amqpmesh.transport.ChannelOptions;
import io.amqpmesh.transport.ChannelSetup;
import io.amqpmesh.transport.ConnectionLifecycleListener;
import io.amqpmesh.transport.TransportConnection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionListener;

/**
 * A RabbitMQ connection that reconnects forever and replays channel setups after each reconnect.
 * <p>
 * All connect attempts and channel setups run on one scheduler thread owned by the connection, so
 * the connection state below is only touched from that thread.
 */
final class RabbitManagedConnection implements TransportConnection, ConnectionListener {

    private static final Logger log = LoggerFactory.getLogger(RabbitManagedConnection.class);

    private final String displayName;
    private final List<String> urls;
    private final RabbitConnectionSettings settings;
    private final RabbitConnectionFactoryProvider factoryProvider;
    private final ScheduledExecutorService scheduler;
    private final List<ConnectionLifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private final List<ChannelRegistration> registrations = new CopyOnWriteArrayList<>();

    private int attempt;
    private volatile CachingConnectionFactory factory;
    private volatile Connection connection;
    private volatile boolean closed;

    RabbitManagedConnection(List<String> urls,
                            RabbitConnectionSettings settings,
                            RabbitConnectionFactoryProvider factoryProvider) {
        if (urls == null || urls.isEmpty()) {
            throw new IllegalArgumentException("urls must not be empty");
        }
        this.urls = List.copyOf(urls);
        this.settings = Objects.requireNonNull(settings, "settings");
        this.factoryProvider = Objects.requireNonNull(factoryProvider, "factoryProvider");
        this.displayName = Redaction.redactPassword(this.urls.get(0));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "amqp-mesh-connection");
            thread.setDaemon(true);
            return thread;
        });
    }

    void start() {
        submit(this::connect);
    }

    @Override
    public void addLifecycleListener(ConnectionLifecycleListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Registers {@code setup} for every future connect. The registration is recorded on the
     * scheduler thread, so a connect attempt already in progress replays it at most once.
     */
    @Override
    public void createChannel(ChannelOptions options, ChannelSetup setup) {
        ChannelRegistration registration = new ChannelRegistration(
            Objects.requireNonNull(options, "options"), Objects.requireNonNull(setup, "setup"));
        submit(() -> {
            registrations.add(registration);
            if (isConnected()) {
                openChannel(registration);
            }
        });
    }

    String displayName() {
        return displayName;
    }

    boolean isConnected() {
        Connection current = connection;
        return current != null && current.isOpen();
    }

    void close() {
        closed = true;
        scheduler.shutdownNow();
        destroy(factory);
        factory = null;
        connection = null;
    }

    @Override
    public void onCreate(Connection created) {
        log.debug("Connection created for {}", displayName);
    }

    @Override
    public void onShutDown(ShutdownSignalException signal) {
        if (closed || signal.isInitiatedByApplication()) {
            return;
        }
        submit(() -> handleDisconnect(signal));
    }

    private void connect() {
        if (closed || isConnected()) {
            return;
        }
        String url = urls.get(Math.floorMod(attempt++, urls.size()));
        CachingConnectionFactory candidate = null;
        Connection created;
        try {
            candidate = factoryProvider.create(url, settings);
            candidate.addConnectionListener(this);
            created = candidate.createConnection();
            created.addBlockedListener(new BlockedListener() {
                @Override
                public void handleBlocked(String reason) {
                    notifyListeners(listener -> listener.onBlocked(reason));
                }

                @Override
                public void handleUnblocked() {
                    notifyListeners(ConnectionLifecycleListener::onUnblocked);
                }
            });
        } catch (RuntimeException ex) {
            log.debug("Connect attempt to {} failed", Redaction.redactPassword(url), ex);
            destroy(candidate);
            notifyListeners(listener -> listener.onConnectFailed(ex));
            scheduleReconnect();
            return;
        }
        factory = candidate;
        connection = created;
        notifyListeners(ConnectionLifecycleListener::onConnect);
        for (ChannelRegistration registration : registrations) {
            openChannel(registration);
        }
    }

    private void handleDisconnect(ShutdownSignalException signal) {
        if (closed || connection == null) {
            return;
        }
        CachingConnectionFactory previous = factory;
        factory = null;
        connection = null;
        notifyListeners(listener -> listener.onDisconnect(signal));
        destroy(previous);
        scheduleReconnect();
    }

    private void openChannel(ChannelRegistration registration) {
        try {
            Channel channel = connection.createChannel(false);
            registration.setup().setup(new RabbitTransportChannel(channel, registration.options()));
        } catch (Exception ex) {
            log.error("Channel setup failed on {}; it will be retried after the next reconnect", displayName, ex);
        }
    }

    private void scheduleReconnect() {
        if (closed) {
            return;
        }
        long delayMillis = settings.reconnectDelay().toMillis();
        log.info("Reconnecting to {} in {} ms", displayName, delayMillis);
        try {
            scheduler.schedule(this::connect, delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            log.debug("Reconnect to {} skipped; connection is closing", displayName);
        }
    }

    private void submit(Runnable task) {
        if (closed) {
            return;
        }
        try {
            scheduler.execute(task);
        } catch (RejectedExecutionException ex) {
            log.debug("Task for {} skipped; connection is closing", displayName);
        }
    }

    private void notifyListeners(Consumer<ConnectionLifecycleListener> event) {
        for (ConnectionLifecycleListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException ex) {
                log.warn("Connection lifecycle listener failed for {}", displayName, ex);
            }
        }
    }

    private static void destroy(CachingConnectionFactory candidate) {
        if (candidate == null) {
            return;
        }
        try {
            candidate.destroy();
        } catch (RuntimeException ex) {
            log.debug("Failed to destroy connection factory", ex);
        }
    }

    private record ChannelRegistration(ChannelOptions options, ChannelSetup setup) {
    }
}
