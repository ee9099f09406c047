package io.amqpmesh.config;

import io.amqpmesh.MeshConfigurationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable description of the brokers to connect to and the bindings to declare.
 *
 * @param urls       full connection strings, each opened as its own connection keyed by the URL
 * @param hosts      host names substituted into {@code defaultUrl}, each keyed by the host name
 * @param defaultUrl URL template containing {@value #HOST_PLACEHOLDER}
 * @param bindings   binding rules, evaluated in order
 */
public record BrokerConfig(Set<String> urls, List<String> hosts, String defaultUrl, List<BindingRule> bindings) {

    public static final String HOST_PLACEHOLDER = "{host}";

    public BrokerConfig {
        urls = urls == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(Configs.copyList(urls, "urls")));
        hosts = hosts == null ? List.of() : Configs.copyList(hosts, "hosts");
        bindings = bindings == null ? List.of() : copyBindings(bindings);
        if (urls.isEmpty() && hosts.isEmpty()) {
            throw new MeshConfigurationException("at least one host or url must be configured");
        }
        if (!hosts.isEmpty() && (defaultUrl == null || defaultUrl.isBlank())) {
            throw new MeshConfigurationException("defaultUrl is required when hosts are configured");
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String host : hosts) {
            if (host.isBlank()) {
                throw new MeshConfigurationException("hosts must not contain blank entries");
            }
            if (!seen.add(host)) {
                throw new MeshConfigurationException("duplicate host '" + host + "'");
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Connection URL for {@code host}, built from {@link #defaultUrl()}.
     */
    public String urlForHost(String host) {
        return defaultUrl.replace(HOST_PLACEHOLDER, host);
    }

    private static List<BindingRule> copyBindings(List<BindingRule> bindings) {
        List<BindingRule> copy = new ArrayList<>(bindings.size());
        for (BindingRule rule : bindings) {
            if (rule == null) {
                throw new MeshConfigurationException("bindings must not contain null entries");
            }
            copy.add(rule);
        }
        return Collections.unmodifiableList(copy);
    }

    public static final class Builder {
        private final Set<String> urls = new LinkedHashSet<>();
        private final List<String> hosts = new ArrayList<>();
        private final List<BindingRule> bindings = new ArrayList<>();
        private String defaultUrl;

        private Builder() {
        }

        public Builder url(String url) {
            this.urls.add(url);
            return this;
        }

        public Builder urls(Collection<String> urls) {
            this.urls.addAll(urls);
            return this;
        }

        public Builder host(String host) {
            this.hosts.add(host);
            return this;
        }

        public Builder hosts(Collection<String> hosts) {
            this.hosts.addAll(hosts);
            return this;
        }

        public Builder defaultUrl(String defaultUrl) {
            this.defaultUrl = defaultUrl;
            return this;
        }

        public Builder binding(BindingRule rule) {
            this.bindings.add(rule);
            return this;
        }

        public Builder bindings(Collection<BindingRule> rules) {
            this.bindings.addAll(rules);
            return this;
        }

        public BrokerConfig build() {
            return new BrokerConfig(urls, hosts, defaultUrl, bindings);
        }
    }
}
