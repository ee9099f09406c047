package io.amqpmesh.transport;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-supplied properties for an exchange publish.
 *
 * @param headers       message headers, consulted by headers exchanges
 * @param contentType   overrides the channel's default content type
 * @param persistent    delivery mode 2 when {@code true}
 * @param correlationId correlation identifier
 * @param messageId     message identifier
 * @param expiration    per-message TTL
 * @param priority      message priority
 * @param mandatory     return unroutable messages instead of dropping them
 */
public record PublishOptions(Map<String, Object> headers,
                             String contentType,
                             boolean persistent,
                             String correlationId,
                             String messageId,
                             Duration expiration,
                             Integer priority,
                             boolean mandatory) {

    private static final PublishOptions NONE = new PublishOptions(null, null, false, null, null, null, null, false);

    public PublishOptions {
        headers = headers == null || headers.isEmpty() ? Map.of() : copy(headers);
        if (expiration != null && expiration.isNegative()) {
            throw new IllegalArgumentException("expiration must be >= 0");
        }
        if (priority != null && (priority < 0 || priority > 255)) {
            throw new IllegalArgumentException("priority must be between 0 and 255");
        }
    }

    public static PublishOptions none() {
        return NONE;
    }

    public static PublishOptions withHeaders(Map<String, Object> headers) {
        return builder().headers(headers).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Map<String, Object> copy(Map<String, Object> headers) {
        Map<String, Object> copy = new LinkedHashMap<>();
        headers.forEach((key, value) -> {
            if (key != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    public static final class Builder {
        private Map<String, Object> headers;
        private String contentType;
        private boolean persistent;
        private String correlationId;
        private String messageId;
        private Duration expiration;
        private Integer priority;
        private boolean mandatory;

        private Builder() {
        }

        public Builder headers(Map<String, Object> headers) {
            this.headers = headers;
            return this;
        }

        public Builder header(String name, Object value) {
            if (this.headers == null) {
                this.headers = new LinkedHashMap<>();
            } else if (!(this.headers instanceof LinkedHashMap)) {
                this.headers = new LinkedHashMap<>(this.headers);
            }
            this.headers.put(name, value);
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder persistent(boolean persistent) {
            this.persistent = persistent;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder expiration(Duration expiration) {
            this.expiration = expiration;
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder mandatory(boolean mandatory) {
            this.mandatory = mandatory;
            return this;
        }

        public PublishOptions build() {
            return new PublishOptions(headers, contentType, persistent, correlationId, messageId, expiration,
                priority, mandatory);
        }
    }
}
