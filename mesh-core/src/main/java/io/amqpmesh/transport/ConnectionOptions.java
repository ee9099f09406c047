package io.amqpmesh.transport;

import java.time.Duration;

/**
 * Reconnect policy overrides for a single connection. A {@code null} component keeps the
 * transport's own default.
 *
 * @param connectTimeout    socket connect timeout
 * @param heartbeatInterval AMQP heartbeat negotiated with the broker
 * @param reconnectDelay    pause between a failure and the next connect attempt
 */
public record ConnectionOptions(Duration connectTimeout, Duration heartbeatInterval, Duration reconnectDelay) {

    private static final ConnectionOptions TRANSPORT_DEFAULTS = new ConnectionOptions(null, null, null);

    public ConnectionOptions {
        requireNonNegative(connectTimeout, "connectTimeout");
        requireNonNegative(heartbeatInterval, "heartbeatInterval");
        requireNonNegative(reconnectDelay, "reconnectDelay");
    }

    public static ConnectionOptions transportDefaults() {
        return TRANSPORT_DEFAULTS;
    }

    public Duration connectTimeoutOr(Duration fallback) {
        return connectTimeout != null ? connectTimeout : fallback;
    }

    public Duration heartbeatIntervalOr(Duration fallback) {
        return heartbeatInterval != null ? heartbeatInterval : fallback;
    }

    public Duration reconnectDelayOr(Duration fallback) {
        return reconnectDelay != null ? reconnectDelay : fallback;
    }

    private static void requireNonNegative(Duration value, String name) {
        if (value != null && value.isNegative()) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
    }
}
