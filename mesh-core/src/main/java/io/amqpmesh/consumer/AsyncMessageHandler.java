package io.amqpmesh.consumer;

import io.amqpmesh.transport.InboundMessage;
import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface AsyncMessageHandler {

    CompletionStage<?> handle(Object content, InboundMessage message) throws Exception;
}
