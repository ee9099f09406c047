package io.amqpmesh.config;

import io.amqpmesh.MeshConfigurationException;
import io.amqpmesh.transport.ExchangeType;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Declares how a queue is attached to an exchange when a consumer subscribes to it.
 * <p>
 * A rule that carries {@code topics} targets a topic exchange; otherwise it targets a headers
 * exchange and is only actionable when {@code headers} are present.
 *
 * @param queue    queue the rule applies to
 * @param exchange exchange name, or {@code null} for the broker default of the resolved type
 * @param topics   routing-key patterns, or {@code null} when the rule is not a topic binding
 * @param headers  header match arguments, or {@code null}
 */
public record BindingRule(String queue, String exchange, List<String> topics, Map<String, Object> headers) {

    public BindingRule {
        if (queue == null || queue.isBlank()) {
            throw new MeshConfigurationException("binding queue must not be null or blank");
        }
        exchange = exchange == null || exchange.isBlank() ? null : exchange;
        topics = topics == null ? null : Configs.copyList(topics, "topics");
        headers = headers == null ? null : Configs.deepCopy(headers);
    }

    public static BindingRule topic(String queue, String exchange, String... topics) {
        return new BindingRule(queue, exchange, Arrays.asList(topics), null);
    }

    public static BindingRule headers(String queue, String exchange, Map<String, Object> headers) {
        return new BindingRule(queue, exchange, null, headers);
    }

    public ExchangeType exchangeType() {
        return topics != null ? ExchangeType.TOPIC : ExchangeType.HEADERS;
    }

    public String resolvedExchange() {
        return exchange != null ? exchange : exchangeType().defaultExchange();
    }

    public boolean hasHeaders() {
        return headers != null;
    }

    public boolean appliesTo(String queueName) {
        return queue.equals(queueName);
    }
}
