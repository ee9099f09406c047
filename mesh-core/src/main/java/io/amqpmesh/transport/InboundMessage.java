package io.amqpmesh.transport;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message delivered to a consumer, detached from the driver's own types.
 */
public final class InboundMessage {

    private final byte[] body;
    private final long deliveryTag;
    private final String exchange;
    private final String routingKey;
    private final boolean redelivered;
    private final Map<String, Object> headers;
    private final String contentType;
    private final String messageId;
    private final String correlationId;

    private InboundMessage(Builder builder) {
        this.body = builder.body == null ? new byte[0] : builder.body.clone();
        this.deliveryTag = builder.deliveryTag;
        this.exchange = builder.exchange;
        this.routingKey = builder.routingKey;
        this.redelivered = builder.redelivered;
        this.headers = builder.headers == null || builder.headers.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.contentType = builder.contentType;
        this.messageId = builder.messageId;
        this.correlationId = builder.correlationId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public long deliveryTag() {
        return deliveryTag;
    }

    public String exchange() {
        return exchange;
    }

    public String routingKey() {
        return routingKey;
    }

    public boolean redelivered() {
        return redelivered;
    }

    public Map<String, Object> headers() {
        return headers;
    }

    public String contentType() {
        return contentType;
    }

    public String messageId() {
        return messageId;
    }

    public String correlationId() {
        return correlationId;
    }

    @Override
    public String toString() {
        return "InboundMessage{deliveryTag=" + deliveryTag
            + ", exchange='" + exchange + '\''
            + ", routingKey='" + routingKey + '\''
            + ", redelivered=" + redelivered
            + ", bytes=" + body.length + '}';
    }

    public static final class Builder {
        private byte[] body;
        private long deliveryTag;
        private String exchange;
        private String routingKey;
        private boolean redelivered;
        private Map<String, Object> headers;
        private String contentType;
        private String messageId;
        private String correlationId;

        private Builder() {
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder body(String body) {
            this.body = body == null ? null : body.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        public Builder deliveryTag(long deliveryTag) {
            this.deliveryTag = deliveryTag;
            return this;
        }

        public Builder exchange(String exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey;
            return this;
        }

        public Builder redelivered(boolean redelivered) {
            this.redelivered = redelivered;
            return this;
        }

        public Builder headers(Map<String, Object> headers) {
            this.headers = headers;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public InboundMessage build() {
            return new InboundMessage(this);
        }
    }
}
