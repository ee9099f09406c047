package io.amqpmesh.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.amqpmesh.logging.MeshLogger;
import io.amqpmesh.transport.InboundMessage;
import io.amqpmesh.transport.TransportChannel;
import java.io.IOException;
import java.util.Objects;

/**
 * Decodes a delivery, runs the handler and settles the message.
 * <p>
 * Each delivery is isolated: a handler failure rejects only that message (no requeue) and does not
 * propagate to the consumer. {@link VirtualMachineError}s are rethrown after the reject.
 */
public final class DeliveryProcessor {

    private final ObjectReader reader;
    private final MeshLogger logger;

    public DeliveryProcessor(ObjectMapper objectMapper, MeshLogger logger) {
        this.reader = Objects.requireNonNull(objectMapper, "objectMapper")
            .readerFor(Object.class)
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * @return {@code false} when the delivery was a broker cancellation and nothing was settled
     */
    public boolean process(TransportChannel channel, MessageHandler handler, InboundMessage message) {
        if (message == null) {
            return false;
        }
        Object content = decode(message);
        try {
            handler.handle(content, message);
        } catch (Exception | Error ex) {
            logger.error("Error processing message {}", message, ex);
            settle(message, () -> channel.nack(message, false, false));
            if (ex instanceof VirtualMachineError fatal) {
                throw fatal;
            }
            return true;
        }
        settle(message, () -> channel.ack(message));
        return true;
    }

    /**
     * Parses JSON-shaped bodies (leading <code>&#123;</code> or <code>[</code>); anything else, including
     * malformed JSON, is returned as the raw string.
     */
    public Object decode(InboundMessage message) {
        String text = message.bodyAsString();
        if (!text.startsWith("{") && !text.startsWith("[")) {
            return text;
        }
        try {
            return reader.readValue(text);
        } catch (JsonProcessingException ex) {
            logger.warn("Failed to parse message as JSON content: {}", text);
            return text;
        }
    }

    private void settle(InboundMessage message, Settlement settlement) {
        try {
            settlement.run();
        } catch (IOException | RuntimeException ex) {
            logger.error("Failed to settle message {}", message, ex);
        }
    }

    @FunctionalInterface
    private interface Settlement {
        void run() throws IOException;
    }
}
