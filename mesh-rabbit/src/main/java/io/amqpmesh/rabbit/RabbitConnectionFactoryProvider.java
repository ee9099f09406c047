package io.amqpmesh.rabbit;

import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;

/**
 * Creates the Spring AMQP factory used for a single connect attempt.
 */
@FunctionalInterface
public interface RabbitConnectionFactoryProvider {

    CachingConnectionFactory create(String url, RabbitConnectionSettings settings);
}
