package io.amqpmesh.rabbit;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.LongString;
import io.amqpmesh.transport.InboundMessage;
import io.amqpmesh.transport.PublishOptions;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between driver types and the mesh's transport-neutral message types.
 */
final class RabbitMessages {

    static final String JSON_CONTENT_TYPE = "application/json";
    private static final int PERSISTENT_DELIVERY_MODE = 2;

    private RabbitMessages() {
    }

    static InboundMessage toInbound(Delivery delivery) {
        AMQP.BasicProperties properties = delivery.getProperties();
        InboundMessage.Builder builder = InboundMessage.builder()
            .body(delivery.getBody())
            .deliveryTag(delivery.getEnvelope().getDeliveryTag())
            .exchange(delivery.getEnvelope().getExchange())
            .routingKey(delivery.getEnvelope().getRoutingKey())
            .redelivered(delivery.getEnvelope().isRedeliver());
        if (properties != null) {
            builder.headers(normaliseHeaders(properties.getHeaders()))
                .contentType(properties.getContentType())
                .messageId(properties.getMessageId())
                .correlationId(properties.getCorrelationId());
        }
        return builder.build();
    }

    static AMQP.BasicProperties toProperties(PublishOptions options, boolean json) {
        AMQP.BasicProperties.Builder builder = new AMQP.BasicProperties.Builder();
        String contentType = options.contentType() != null ? options.contentType() : json ? JSON_CONTENT_TYPE : null;
        builder.contentType(contentType);
        if (!options.headers().isEmpty()) {
            builder.headers(options.headers());
        }
        if (options.persistent()) {
            builder.deliveryMode(PERSISTENT_DELIVERY_MODE);
        }
        if (options.correlationId() != null) {
            builder.correlationId(options.correlationId());
        }
        if (options.messageId() != null) {
            builder.messageId(options.messageId());
        }
        if (options.expiration() != null) {
            builder.expiration(Long.toString(options.expiration().toMillis()));
        }
        if (options.priority() != null) {
            builder.priority(options.priority());
        }
        return builder.build();
    }

    static Map<String, Object> normaliseHeaders(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> headers = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (key != null) {
                headers.put(key, normaliseValue(value));
            }
        });
        return Collections.unmodifiableMap(headers);
    }

    private static Object normaliseValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LongString longString) {
            return longString.toString();
        }
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        if (value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            for (Object element : list) {
                converted.add(normaliseValue(element));
            }
            return Collections.unmodifiableList(converted);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            map.forEach((key, val) -> {
                if (key != null) {
                    converted.put(key.toString(), normaliseValue(val));
                }
            });
            return Collections.unmodifiableMap(converted);
        }
        return value;
    }
}
