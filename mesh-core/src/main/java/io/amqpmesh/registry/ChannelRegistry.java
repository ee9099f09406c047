package io.amqpmesh.registry;

import io.amqpmesh.transport.TransportChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Send channels keyed by connection name.
 * <p>
 * Lookups iterate keys in the order their connections were opened, not the order their channels
 * became ready. A reconnect replaces the stored channel under the same key.
 */
public final class ChannelRegistry {

    private final List<String> order = new CopyOnWriteArrayList<>();
    private final Map<String, TransportChannel> channels = new ConcurrentHashMap<>();

    void expect(String key) {
        Objects.requireNonNull(key, "key");
        if (!order.contains(key)) {
            order.add(key);
        }
    }

    void register(String key, TransportChannel channel) {
        Objects.requireNonNull(channel, "channel");
        expect(key);
        channels.put(key, channel);
    }

    public Optional<TransportChannel> find(String key) {
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(channels.get(key));
    }

    public Optional<TransportChannel> first() {
        for (String key : order) {
            TransportChannel channel = channels.get(key);
            if (channel != null) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }

    /**
     * Prefers the channel of {@code preferred}, falling back to {@link #first()}.
     */
    public Optional<TransportChannel> select(String preferred) {
        Optional<TransportChannel> named = find(preferred);
        return named.isPresent() ? named : first();
    }

    public List<String> readyKeys() {
        List<String> ready = new ArrayList<>();
        for (String key : order) {
            if (channels.containsKey(key)) {
                ready.add(key);
            }
        }
        return List.copyOf(ready);
    }

    public boolean isEmpty() {
        return channels.isEmpty();
    }

    public int size() {
        return channels.size();
    }
}
