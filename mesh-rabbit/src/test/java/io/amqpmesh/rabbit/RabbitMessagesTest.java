package io.amqpmesh.rabbit;

import com.rabbitmq.client.impl.LongStringHelper;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RabbitMessagesTest {

    @Test
    void normalisesLongStringsAndBytesRecursively() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("region", LongStringHelper.asLongString("eu-west"));
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("tenant", LongStringHelper.asLongString("acme"));
        raw.put("trace", "abc".getBytes(StandardCharsets.UTF_8));
        raw.put("path", List.of(LongStringHelper.asLongString("a"), 2));
        raw.put("meta", nested);
        raw.put("retries", 3);

        Map<String, Object> headers = RabbitMessages.normaliseHeaders(raw);

        assertThat(headers).containsEntry("tenant", "acme")
            .containsEntry("trace", "abc")
            .containsEntry("path", List.of("a", 2))
            .containsEntry("meta", Map.of("region", "eu-west"))
            .containsEntry("retries", 3);
    }

    @Test
    void missingHeadersBecomeEmptyMap() {
        assertThat(RabbitMessages.normaliseHeaders(null)).isEmpty();
    }
}
