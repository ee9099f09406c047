package io.amqpmesh;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.amqpmesh.config.BrokerConfig;
import io.amqpmesh.consumer.DeliveryProcessor;
import io.amqpmesh.consumer.MessageHandler;
import io.amqpmesh.logging.MeshLogger;
import io.amqpmesh.logging.Slf4jMeshLogger;
import io.amqpmesh.registry.ChannelRegistry;
import io.amqpmesh.registry.ConnectionRegistry;
import io.amqpmesh.registry.StartupGate;
import io.amqpmesh.topology.BindingResolver;
import io.amqpmesh.transport.AmqpTransport;
import io.amqpmesh.transport.ChannelOptions;
import io.amqpmesh.transport.PublishOptions;
import io.amqpmesh.transport.TransportChannel;
import io.amqpmesh.transport.TransportConnection;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Send/consume facade over every configured broker.
 * <p>
 * Construction opens a connection per configured endpoint in the background. Sends block until
 * every host's send channel is ready, then go out on the named connection (or the first ready
 * one). Consumers attach to <em>every</em> connection, so a queue is drained from all brokers and
 * each message is delivered to the single handler.
 * <p>
 * Queue names starting with {@value #EXCHANGE_MARKER} address an exchange instead of a queue:
 * {@code send("#amq.topic", data, null, "orders.created", PublishOptions.none())} publishes to
 * {@code amq.topic} with routing key {@code orders.created}.
 */
public final class AmqpMesh {

    public static final String EXCHANGE_MARKER = "#";

    private final BrokerConfig config;
    private final MeshLogger logger;
    private final ObjectMapper objectMapper;
    private final ChannelRegistry channels;
    private final ConnectionRegistry connections;
    private final BindingResolver bindingResolver;
    private final DeliveryProcessor deliveryProcessor;
    private final StartupGate startupGate = new StartupGate();

    public AmqpMesh(BrokerConfig config, AmqpTransport transport) {
        this(builder(config, transport));
    }

    private AmqpMesh(Builder builder) {
        this.config = builder.config;
        this.logger = builder.logger != null ? builder.logger : new Slf4jMeshLogger();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.channels = new ChannelRegistry();
        this.connections = new ConnectionRegistry(builder.transport, channels, logger);
        this.bindingResolver = new BindingResolver(config.bindings(), logger);
        this.deliveryProcessor = new DeliveryProcessor(objectMapper, logger);
        start();
    }

    public static Builder builder(BrokerConfig config, AmqpTransport transport) {
        return new Builder(config, transport);
    }

    /**
     * Opens all configured connections. Invoked by the constructor; further calls are no-ops.
     *
     * @return a future completing once every host's send channel is ready
     */
    public CompletableFuture<Void> start() {
        connections.start(config).thenRun(() -> {
            if (startupGate.open()) {
                logger.info("All AMQP channels started successfully");
            }
        });
        return startupGate.whenOpen();
    }

    public boolean isStarted() {
        return startupGate.isOpen();
    }

    public void send(String queue, Object data) {
        send(queue, data, null, null, PublishOptions.none());
    }

    public void send(String queue, Object data, String connectionName) {
        send(queue, data, connectionName, null, PublishOptions.none());
    }

    /**
     * Encodes {@code data} as JSON and sends it, blocking until startup has completed.
     *
     * @param queue          target queue, or {@value #EXCHANGE_MARKER} followed by an exchange name
     * @param connectionName preferred connection; the first ready channel is used when absent or unknown
     * @param routingKey     routing key for exchange publishes, defaults to the empty string
     * @param options        publish properties for exchange publishes
     * @throws NoChannelAvailableException when no channel is ready
     * @throws MessageDispatchException    when encoding or the broker call fails
     */
    public void send(String queue, Object data, String connectionName, String routingKey, PublishOptions options) {
        requireText(queue, "queue");
        startupGate.await();
        dispatch(queue, data, connectionName, routingKey, options);
    }

    public CompletableFuture<Void> sendAsync(String queue, Object data) {
        return sendAsync(queue, data, null, null, PublishOptions.none());
    }

    /**
     * Non-blocking variant of {@link #send(String, Object, String, String, PublishOptions)}; the
     * message goes out once startup has completed.
     */
    public CompletableFuture<Void> sendAsync(String queue,
                                             Object data,
                                             String connectionName,
                                             String routingKey,
                                             PublishOptions options) {
        requireText(queue, "queue");
        return startupGate.whenOpen().thenRun(() -> dispatch(queue, data, connectionName, routingKey, options));
    }

    /**
     * Attaches {@code handler} to {@code queue} on every connection, each through its own channel,
     * and declares the queue's configured bindings on that channel.
     */
    public void consume(String queue, MessageHandler handler) {
        requireText(queue, "queue");
        Objects.requireNonNull(handler, "handler");
        for (Map.Entry<String, TransportConnection> entry : connections.connections().entrySet()) {
            logger.info("Consuming from queue {} on connection {}", queue, entry.getKey());
            entry.getValue().createChannel(ChannelOptions.forJson(), channel -> {
                channel.consume(queue, message -> deliveryProcessor.process(channel, handler, message));
                bindingResolver.setupBindings(channel, queue);
            });
        }
    }

    public void setupBindings(TransportChannel channel, String queueName) throws IOException {
        bindingResolver.setupBindings(channel, queueName);
    }

    public BrokerConfig config() {
        return config;
    }

    public List<String> connectionNames() {
        return List.copyOf(connections.connections().keySet());
    }

    public List<String> readyChannelNames() {
        return channels.readyKeys();
    }

    private void dispatch(String queue,
                          Object data,
                          String connectionName,
                          String routingKey,
                          PublishOptions options) {
        TransportChannel channel = channels.select(connectionName)
            .orElseThrow(() -> new NoChannelAvailableException("No channel available to send message"));
        byte[] payload = encode(data);
        try {
            if (queue.startsWith(EXCHANGE_MARKER)) {
                channel.publish(queue.substring(EXCHANGE_MARKER.length()),
                    routingKey != null ? routingKey : "",
                    payload,
                    options != null ? options : PublishOptions.none());
            } else {
                channel.sendToQueue(queue, payload);
            }
        } catch (IOException | RuntimeException ex) {
            throw new MessageDispatchException("Failed to send message to " + queue, ex);
        }
    }

    private byte[] encode(Object data) {
        try {
            return objectMapper.writeValueAsBytes(data);
        } catch (JsonProcessingException ex) {
            throw new MessageDispatchException("Failed to encode message as JSON", ex);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }

    public static final class Builder {
        private final BrokerConfig config;
        private final AmqpTransport transport;
        private MeshLogger logger;
        private ObjectMapper objectMapper;

        private Builder(BrokerConfig config, AmqpTransport transport) {
            if (config == null) {
                throw new MeshConfigurationException("amqp-mesh configuration is required");
            }
            this.config = config;
            this.transport = Objects.requireNonNull(transport, "transport");
        }

        public Builder logger(MeshLogger logger) {
            this.logger = logger;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public AmqpMesh build() {
            return new AmqpMesh(this);
        }
    }
}
