package io.amqpmesh.registry;

import io.amqpmesh.config.BrokerConfig;
import io.amqpmesh.logging.MeshLogger;
import io.amqpmesh.support.Redaction;
import io.amqpmesh.transport.AmqpTransport;
import io.amqpmesh.transport.ChannelOptions;
import io.amqpmesh.transport.ConnectionLifecycleListener;
import io.amqpmesh.transport.ConnectionOptions;
import io.amqpmesh.transport.TransportConnection;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Opens one managed connection per configured endpoint and one send channel per host.
 * <p>
 * Connections opened from {@code urls} are keyed by the URL and keep the transport's reconnect
 * defaults. Connections opened from {@code hosts} are keyed by the host name and use
 * {@link #HOST_CONNECTION_OPTIONS}. Connectivity failures are only logged; retrying is left to the
 * transport.
 */
public final class ConnectionRegistry {

    public static final ConnectionOptions HOST_CONNECTION_OPTIONS = new ConnectionOptions(
        Duration.ofMillis(5000), Duration.ofSeconds(60), Duration.ofSeconds(60));

    private final AmqpTransport transport;
    private final ChannelRegistry channels;
    private final MeshLogger logger;
    private final Map<String, TransportConnection> connections = new LinkedHashMap<>();
    private CompletableFuture<Void> started;

    public ConnectionRegistry(AmqpTransport transport, ChannelRegistry channels, MeshLogger logger) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.channels = Objects.requireNonNull(channels, "channels");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Opens every configured connection. Repeated calls return the first call's future.
     *
     * @return a future completing once every host's send channel has been set up at least once
     */
    public synchronized CompletableFuture<Void> start(BrokerConfig config) {
        Objects.requireNonNull(config, "config");
        if (started != null) {
            return started;
        }
        for (String url : config.urls()) {
            open(url, url, ConnectionOptions.transportDefaults());
        }
        List<CompletableFuture<Void>> channelsReady = new ArrayList<>(config.hosts().size());
        for (String host : config.hosts()) {
            TransportConnection connection = open(host, config.urlForHost(host), HOST_CONNECTION_OPTIONS);
            channelsReady.add(openSendChannel(host, connection));
        }
        started = CompletableFuture.allOf(channelsReady.toArray(CompletableFuture[]::new));
        return started;
    }

    public synchronized Map<String, TransportConnection> connections() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(connections));
    }

    public synchronized int size() {
        return connections.size();
    }

    private TransportConnection open(String key, String url, ConnectionOptions options) {
        String redactedUrl = Redaction.redactPassword(url);
        logger.info("Connecting to AMQP server at {}", redactedUrl);
        TransportConnection connection = transport.connect(List.of(url), options);
        connection.addLifecycleListener(new LoggingLifecycleListener(redactedUrl));
        connections.put(key, connection);
        return connection;
    }

    private CompletableFuture<Void> openSendChannel(String key, TransportConnection connection) {
        CompletableFuture<Void> ready = new CompletableFuture<>();
        channels.expect(key);
        connection.createChannel(ChannelOptions.forJson(), channel -> {
            channels.register(key, channel);
            ready.complete(null);
        });
        return ready;
    }

    private final class LoggingLifecycleListener implements ConnectionLifecycleListener {

        private final String redactedUrl;

        private LoggingLifecycleListener(String redactedUrl) {
            this.redactedUrl = redactedUrl;
        }

        @Override
        public void onConnect() {
            logger.info("Connected to AMQP server at {}", redactedUrl);
        }

        @Override
        public void onConnectFailed(Throwable cause) {
            logger.error("Failed to connect to AMQP server at {}: {}", redactedUrl, describe(cause));
        }

        @Override
        public void onDisconnect(Throwable cause) {
            logger.error("Disconnected from AMQP server at {}: {}", redactedUrl, describe(cause));
        }

        @Override
        public void onBlocked(String reason) {
            logger.error("AMQP server at {} is blocked: {}", redactedUrl, reason);
        }

        @Override
        public void onUnblocked() {
            logger.info("AMQP server at {} is unblocked", redactedUrl);
        }

        private String describe(Throwable cause) {
            if (cause == null) {
                return "n/a";
            }
            return Redaction.redactPassword(String.valueOf(cause.getMessage()));
        }
    }
}
