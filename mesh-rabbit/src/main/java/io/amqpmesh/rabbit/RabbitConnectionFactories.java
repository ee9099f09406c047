package io.amqpmesh.rabbit;

import io.amqpmesh.support.Redaction;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.Objects;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;

/**
 * Default {@link RabbitConnectionFactoryProvider}: one {@link CachingConnectionFactory} per URL
 * with the driver's own recovery switched off, since reconnects are driven by
 * {@link RabbitManagedConnection}.
 */
public final class RabbitConnectionFactories implements RabbitConnectionFactoryProvider {

    private final String connectionName;

    public RabbitConnectionFactories(String connectionName) {
        this.connectionName = Objects.requireNonNull(connectionName, "connectionName");
    }

    @Override
    public CachingConnectionFactory create(String url, RabbitConnectionSettings settings) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(settings, "settings");
        com.rabbitmq.client.ConnectionFactory rabbit = new com.rabbitmq.client.ConnectionFactory();
        try {
            rabbit.setUri(url);
        } catch (URISyntaxException | GeneralSecurityException | IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid AMQP URL " + Redaction.redactPassword(url), ex);
        }
        rabbit.setAutomaticRecoveryEnabled(false);
        rabbit.setTopologyRecoveryEnabled(false);
        rabbit.setConnectionTimeout(Math.toIntExact(settings.connectTimeout().toMillis()));
        rabbit.setRequestedHeartbeat(Math.toIntExact(settings.heartbeat().toSeconds()));

        CachingConnectionFactory factory = new CachingConnectionFactory(rabbit);
        factory.setConnectionNameStrategy(ignored -> connectionName);
        return factory;
    }
}
