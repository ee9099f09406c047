package io.amqpmesh.transport;

/**
 * Exchange kinds the mesh declares.
 */
public enum ExchangeType {
    TOPIC("topic", "amq.topic"),
    HEADERS("headers", "amq.headers");

    private final String wireName;
    private final String defaultExchange;

    ExchangeType(String wireName, String defaultExchange) {
        this.wireName = wireName;
        this.defaultExchange = defaultExchange;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Broker-predeclared exchange of this type, used when a binding names none.
     */
    public String defaultExchange() {
        return defaultExchange;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
