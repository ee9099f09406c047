package io.amqpmesh.spring;

import io.amqpmesh.config.BindingRule;
import io.amqpmesh.config.BrokerConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties that drive the AMQP mesh auto-configuration.
 */
@Validated
@ConfigurationProperties(prefix = "amqp-mesh")
public class AmqpMeshProperties {

    private boolean enabled = true;
    private Set<String> urls = new LinkedHashSet<>();
    private List<String> hosts = new ArrayList<>();
    private String defaultUrl;
    @Valid
    private List<BindingProperties> bindings = new ArrayList<>();
    private final TransportProperties transport = new TransportProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Set<String> getUrls() {
        return urls;
    }

    public void setUrls(Set<String> urls) {
        this.urls = urls == null ? new LinkedHashSet<>() : new LinkedHashSet<>(urls);
    }

    public List<String> getHosts() {
        return hosts;
    }

    public void setHosts(List<String> hosts) {
        this.hosts = hosts == null ? new ArrayList<>() : new ArrayList<>(hosts);
    }

    public String getDefaultUrl() {
        return defaultUrl;
    }

    public void setDefaultUrl(String defaultUrl) {
        this.defaultUrl = defaultUrl;
    }

    public List<BindingProperties> getBindings() {
        return bindings;
    }

    public void setBindings(List<BindingProperties> bindings) {
        this.bindings = bindings == null ? new ArrayList<>() : new ArrayList<>(bindings);
    }

    public TransportProperties getTransport() {
        return transport;
    }

    /**
     * Converts the bound properties into the immutable core configuration.
     */
    public BrokerConfig toBrokerConfig() {
        List<BindingRule> rules = new ArrayList<>(bindings.size());
        for (BindingProperties binding : bindings) {
            rules.add(binding.toRule());
        }
        return new BrokerConfig(urls, hosts, defaultUrl, rules);
    }

    public static final class BindingProperties {

        @NotBlank
        private String queue;
        private String exchange;
        private List<String> topic;
        private Map<String, Object> headers;

        public String getQueue() {
            return queue;
        }

        public void setQueue(String queue) {
            this.queue = queue;
        }

        public String getExchange() {
            return exchange;
        }

        public void setExchange(String exchange) {
            this.exchange = exchange;
        }

        public List<String> getTopic() {
            return topic;
        }

        public void setTopic(List<String> topic) {
            this.topic = topic;
        }

        public Map<String, Object> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, Object> headers) {
            this.headers = headers == null ? null : new LinkedHashMap<>(headers);
        }

        BindingRule toRule() {
            return new BindingRule(queue, exchange, topic, headers);
        }
    }

    public static final class TransportProperties {
        private Duration connectTimeout = Duration.ofSeconds(60);
        private Duration heartbeat = Duration.ofSeconds(5);
        private Duration reconnectDelay = Duration.ofSeconds(5);
        private String connectionName = "amqp-mesh";

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        }

        public Duration getHeartbeat() {
            return heartbeat;
        }

        public void setHeartbeat(Duration heartbeat) {
            this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat must not be null");
        }

        public Duration getReconnectDelay() {
            return reconnectDelay;
        }

        public void setReconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay must not be null");
        }

        public String getConnectionName() {
            return connectionName;
        }

        public void setConnectionName(String connectionName) {
            if (connectionName == null || connectionName.isBlank()) {
                throw new IllegalArgumentException("amqp-mesh.transport.connection-name must not be null or blank");
            }
            this.connectionName = connectionName;
        }
    }
}
