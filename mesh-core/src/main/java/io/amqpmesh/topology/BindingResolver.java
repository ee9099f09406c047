package io.amqpmesh.topology;

import io.amqpmesh.config.BindingRule;
import io.amqpmesh.logging.MeshLogger;
import io.amqpmesh.transport.ExchangeType;
import io.amqpmesh.transport.TransportChannel;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Declares exchanges and queue bindings for a consumed queue from the configured rules.
 * <p>
 * Rules are visited in configuration order. Every matching topic rule is honoured. The first
 * matching headers rule that carries headers ends the pass, so at most one headers binding is
 * made per queue and rules after it are not visited.
 */
public final class BindingResolver {

    private final List<BindingRule> bindings;
    private final MeshLogger logger;

    public BindingResolver(List<BindingRule> bindings, MeshLogger logger) {
        this.bindings = List.copyOf(Objects.requireNonNull(bindings, "bindings"));
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public void setupBindings(TransportChannel channel, String queueName) throws IOException {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(queueName, "queueName");
        for (BindingRule binding : bindings) {
            if (!binding.appliesTo(queueName)) {
                continue;
            }
            ExchangeType type = binding.exchangeType();
            String exchange = binding.resolvedExchange();
            logger.info("Asserting Exchange {} with type {}", exchange, type);
            channel.assertExchange(exchange, type, true);
            if (type == ExchangeType.TOPIC) {
                for (String topic : binding.topics()) {
                    channel.bindQueue(queueName, exchange, topic, null);
                    logger.info("Binding exchange {} to topic {} with queue {}", exchange, topic, queueName);
                }
            } else if (type == ExchangeType.HEADERS && binding.hasHeaders()) {
                logger.info("Binding exchange {} to headers {} with queue {}", exchange, binding.headers(), queueName);
                channel.bindQueue(queueName, exchange, "", binding.headers());
                return;
            } else {
                logger.error("Unsupported binding type: {}", type);
            }
        }
    }
}
