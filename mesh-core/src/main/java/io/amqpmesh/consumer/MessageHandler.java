package io.amqpmesh.consumer;

import io.amqpmesh.transport.InboundMessage;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Business callback for consumed messages. Returning normally acknowledges the message; throwing
 * rejects it without requeue.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * @param content decoded payload: a {@code Map} or {@code List} for JSON bodies, otherwise the
     *                body as a UTF-8 string
     * @param message the raw delivery
     */
    void handle(Object content, InboundMessage message) throws Exception;

    /**
     * Adapts a handler that completes asynchronously. The returned stage is awaited before the
     * message is acknowledged; an exceptional completion rejects it.
     */
    static MessageHandler async(AsyncMessageHandler handler) {
        Objects.requireNonNull(handler, "handler");
        return (content, message) -> {
            CompletionStage<?> stage = handler.handle(content, message);
            if (stage == null) {
                return;
            }
            try {
                stage.toCompletableFuture().get();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw ex;
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause();
                if (cause instanceof Exception exception) {
                    throw exception;
                }
                throw ex;
            }
        };
    }
}
