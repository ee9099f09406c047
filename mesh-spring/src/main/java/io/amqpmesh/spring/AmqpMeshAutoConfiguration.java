package io.amqpmesh.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.amqpmesh.AmqpMesh;
import io.amqpmesh.logging.MeshLogger;
import io.amqpmesh.logging.Slf4jMeshLogger;
import io.amqpmesh.rabbit.RabbitAmqpTransport;
import io.amqpmesh.transport.AmqpTransport;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires a RabbitMQ transport and an {@link AmqpMesh} from {@code amqp-mesh.*} properties.
 * <p>
 * Startup fails when the starter is on the classpath without any configured host or url; set
 * {@code amqp-mesh.enabled=false} to opt out.
 */
@AutoConfiguration
@ConditionalOnClass({AmqpMesh.class, RabbitAmqpTransport.class})
@ConditionalOnProperty(prefix = "amqp-mesh", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(AmqpMeshProperties.class)
public class AmqpMeshAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AmqpMeshAutoConfiguration.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(AmqpTransport.class)
    RabbitAmqpTransport amqpMeshTransport(AmqpMeshProperties properties, ObjectProvider<MeterRegistry> meterRegistry) {
        AmqpMeshProperties.TransportProperties transport = properties.getTransport();
        return RabbitAmqpTransport.builder()
            .connectTimeout(transport.getConnectTimeout())
            .heartbeat(transport.getHeartbeat())
            .reconnectDelay(transport.getReconnectDelay())
            .connectionName(transport.getConnectionName())
            .meterRegistry(meterRegistry.getIfAvailable())
            .build();
    }

    @Bean
    @ConditionalOnMissingBean
    MeshLogger amqpMeshLogger() {
        return new Slf4jMeshLogger();
    }

    @Bean
    @ConditionalOnMissingBean
    AmqpMesh amqpMesh(AmqpMeshProperties properties,
                      AmqpTransport transport,
                      MeshLogger logger,
                      ObjectProvider<ObjectMapper> objectMapper) {
        AmqpMesh mesh = AmqpMesh.builder(properties.toBrokerConfig(), transport)
            .logger(logger)
            .objectMapper(objectMapper.getIfAvailable(ObjectMapper::new))
            .build();
        log.info("AMQP mesh configured with connections {}", mesh.connectionNames());
        return mesh;
    }
}
