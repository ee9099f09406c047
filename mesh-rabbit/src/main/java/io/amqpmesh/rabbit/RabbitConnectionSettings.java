package io.amqpmesh.rabbit;

import java.time.Duration;
import java.util.Objects;

/**
 * Effective reconnect policy of one managed connection, after defaults have been applied.
 */
public record RabbitConnectionSettings(Duration connectTimeout, Duration heartbeat, Duration reconnectDelay) {

    public RabbitConnectionSettings {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(heartbeat, "heartbeat");
        Objects.requireNonNull(reconnectDelay, "reconnectDelay");
    }
}
