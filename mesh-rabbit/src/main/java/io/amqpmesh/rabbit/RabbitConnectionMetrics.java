package io.amqpmesh.rabbit;

import io.amqpmesh.transport.ConnectionLifecycleListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer view of one managed connection's lifecycle. Meters are tagged with the redacted
 * connection URL.
 */
final class RabbitConnectionMetrics implements ConnectionLifecycleListener, AutoCloseable {

    static final String CONNECTED = "amqp_mesh_connection_up";
    static final String BLOCKED = "amqp_mesh_connection_blocked";
    static final String CONNECTS = "amqp_mesh_connection_connects_total";
    static final String CONNECT_FAILURES = "amqp_mesh_connection_connect_failures_total";
    static final String DISCONNECTS = "amqp_mesh_connection_disconnects_total";

    private final MeterRegistry meterRegistry;
    private final AtomicInteger connectedValue = new AtomicInteger();
    private final AtomicInteger blockedValue = new AtomicInteger();
    private final Counter connects;
    private final Counter connectFailures;
    private final Counter disconnects;
    private final List<Meter> meters;

    RabbitConnectionMetrics(MeterRegistry meterRegistry, String connection) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        Tags tags = Tags.of("connection", Objects.requireNonNull(connection, "connection"));
        Gauge connected = Gauge.builder(CONNECTED, connectedValue, AtomicInteger::doubleValue)
            .description("1 while the AMQP connection is established")
            .tags(tags)
            .register(meterRegistry);
        Gauge blocked = Gauge.builder(BLOCKED, blockedValue, AtomicInteger::doubleValue)
            .description("1 while the broker blocks publishing on the connection")
            .tags(tags)
            .register(meterRegistry);
        this.connects = Counter.builder(CONNECTS)
            .description("Successful connection attempts")
            .tags(tags)
            .register(meterRegistry);
        this.connectFailures = Counter.builder(CONNECT_FAILURES)
            .description("Failed connection attempts")
            .tags(tags)
            .register(meterRegistry);
        this.disconnects = Counter.builder(DISCONNECTS)
            .description("Unexpected connection losses")
            .tags(tags)
            .register(meterRegistry);
        this.meters = List.of(connected, blocked, connects, connectFailures, disconnects);
    }

    @Override
    public void onConnect() {
        connects.increment();
        connectedValue.set(1);
        blockedValue.set(0);
    }

    @Override
    public void onConnectFailed(Throwable cause) {
        connectFailures.increment();
        connectedValue.set(0);
    }

    @Override
    public void onDisconnect(Throwable cause) {
        disconnects.increment();
        connectedValue.set(0);
        blockedValue.set(0);
    }

    @Override
    public void onBlocked(String reason) {
        blockedValue.set(1);
    }

    @Override
    public void onUnblocked() {
        blockedValue.set(0);
    }

    @Override
    public void close() {
        connectedValue.set(0);
        for (Meter meter : meters) {
            meterRegistry.remove(meter);
        }
    }
}
