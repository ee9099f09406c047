package io.amqpmesh.registry;

import io.amqpmesh.transport.TransportChannel;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ChannelRegistryTest {

    private final TransportChannel alpha = mock(TransportChannel.class);
    private final TransportChannel beta = mock(TransportChannel.class);

    @Test
    void emptyRegistryHasNoChannel() {
        ChannelRegistry registry = new ChannelRegistry();
        registry.expect("alpha");

        assertThat(registry.isEmpty()).isTrue();
        assertThat(registry.first()).isEmpty();
        assertThat(registry.select("alpha")).isEmpty();
        assertThat(registry.readyKeys()).isEmpty();
    }

    @Test
    void firstFollowsExpectedOrderRatherThanReadiness() {
        ChannelRegistry registry = new ChannelRegistry();
        registry.expect("alpha");
        registry.expect("beta");

        registry.register("beta", beta);
        assertThat(registry.first()).containsSame(beta);

        registry.register("alpha", alpha);
        assertThat(registry.first()).containsSame(alpha);
        assertThat(registry.readyKeys()).containsExactly("alpha", "beta");
    }

    @Test
    void selectPrefersNamedChannelAndFallsBack() {
        ChannelRegistry registry = new ChannelRegistry();
        registry.register("alpha", alpha);
        registry.register("beta", beta);

        assertThat(registry.select("beta")).containsSame(beta);
        assertThat(registry.select("gamma")).containsSame(alpha);
        assertThat(registry.select(null)).containsSame(alpha);
        assertThat(registry.select("")).containsSame(alpha);
    }

    @Test
    void reRegistrationReplacesChannelUnderSameKey() {
        ChannelRegistry registry = new ChannelRegistry();
        registry.register("alpha", alpha);
        TransportChannel replacement = mock(TransportChannel.class);

        registry.register("alpha", replacement);

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.find("alpha")).containsSame(replacement);
    }
}
