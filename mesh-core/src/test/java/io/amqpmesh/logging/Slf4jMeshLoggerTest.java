package io.amqpmesh.logging;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class Slf4jMeshLoggerTest {

    @Test
    void forwardsEachLevel() {
        Logger delegate = mock(Logger.class);
        Slf4jMeshLogger logger = new Slf4jMeshLogger(delegate);
        IllegalStateException failure = new IllegalStateException("boom");

        logger.info("Connected to AMQP server at {}", "amqp://host");
        logger.warn("Failed to parse message as JSON content: {}", "{oops");
        logger.error("Error processing message {}", "msg", failure);

        verify(delegate).info("Connected to AMQP server at {}", new Object[] {"amqp://host"});
        verify(delegate).warn("Failed to parse message as JSON content: {}", new Object[] {"{oops"});
        verify(delegate).error("Error processing message {}", new Object[] {"msg", failure});
    }
}
