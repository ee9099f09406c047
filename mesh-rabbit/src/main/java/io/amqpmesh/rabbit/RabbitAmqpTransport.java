package io.amqpmesh.rabbit;

import io.amqpmesh.transport.AmqpTransport;
import io.amqpmesh.transport.ConnectionOptions;
import io.amqpmesh.transport.TransportConnection;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RabbitMQ-backed {@link AmqpTransport} built on Spring AMQP's caching connection factory.
 * <p>
 * Connections returned by {@link #connect} retry indefinitely; {@link #close()} is the only way to
 * stop them.
 */
public final class RabbitAmqpTransport implements AmqpTransport, AutoCloseable {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_HEARTBEAT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(5);

    private static final Logger log = LoggerFactory.getLogger(RabbitAmqpTransport.class);

    private final Duration connectTimeout;
    private final Duration heartbeat;
    private final Duration reconnectDelay;
    private final RabbitConnectionFactoryProvider factoryProvider;
    private final MeterRegistry meterRegistry;
    private final List<RabbitManagedConnection> connections = new CopyOnWriteArrayList<>();
    private final List<RabbitConnectionMetrics> metrics = new CopyOnWriteArrayList<>();

    public RabbitAmqpTransport() {
        this(builder());
    }

    private RabbitAmqpTransport(Builder builder) {
        this.connectTimeout = builder.connectTimeout;
        this.heartbeat = builder.heartbeat;
        this.reconnectDelay = builder.reconnectDelay;
        this.factoryProvider = builder.factoryProvider != null
            ? builder.factoryProvider
            : new RabbitConnectionFactories(builder.connectionName);
        this.meterRegistry = builder.meterRegistry;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public TransportConnection connect(List<String> urls, ConnectionOptions options) {
        Objects.requireNonNull(options, "options");
        RabbitConnectionSettings settings = new RabbitConnectionSettings(
            options.connectTimeoutOr(connectTimeout),
            options.heartbeatIntervalOr(heartbeat),
            options.reconnectDelayOr(reconnectDelay));
        RabbitManagedConnection connection = new RabbitManagedConnection(urls, settings, factoryProvider);
        if (meterRegistry != null) {
            RabbitConnectionMetrics connectionMetrics =
                new RabbitConnectionMetrics(meterRegistry, connection.displayName());
            connection.addLifecycleListener(connectionMetrics);
            metrics.add(connectionMetrics);
        }
        connections.add(connection);
        connection.start();
        return connection;
    }

    @Override
    public void close() {
        log.info("Closing {} AMQP connection(s)", connections.size());
        for (RabbitManagedConnection connection : connections) {
            connection.close();
        }
        connections.clear();
        metrics.forEach(RabbitConnectionMetrics::close);
        metrics.clear();
    }

    public static final class Builder {
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration heartbeat = DEFAULT_HEARTBEAT;
        private Duration reconnectDelay = DEFAULT_RECONNECT_DELAY;
        private String connectionName = "amqp-mesh";
        private RabbitConnectionFactoryProvider factoryProvider;
        private MeterRegistry meterRegistry;

        private Builder() {
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = requireNonNegative(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder heartbeat(Duration heartbeat) {
            this.heartbeat = requireNonNegative(heartbeat, "heartbeat");
            return this;
        }

        public Builder reconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = requireNonNegative(reconnectDelay, "reconnectDelay");
            return this;
        }

        public Builder connectionName(String connectionName) {
            if (connectionName == null || connectionName.isBlank()) {
                throw new IllegalArgumentException("connectionName must not be null or blank");
            }
            this.connectionName = connectionName;
            return this;
        }

        public Builder factoryProvider(RabbitConnectionFactoryProvider factoryProvider) {
            this.factoryProvider = factoryProvider;
            return this;
        }

        /**
         * Registers connection lifecycle meters for every connection the transport opens.
         */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public RabbitAmqpTransport build() {
            return new RabbitAmqpTransport(this);
        }

        private static Duration requireNonNegative(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative()) {
                throw new IllegalArgumentException(name + " must be >= 0");
            }
            return value;
        }
    }
}
