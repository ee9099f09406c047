package io.amqpmesh.registry;

import io.amqpmesh.AmqpMeshException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * One-shot readiness signal. Pending until {@link #open()} is called once, open forever after.
 */
public final class StartupGate {

    private final CompletableFuture<Void> opened = new CompletableFuture<>();

    /**
     * @return {@code true} if this call opened the gate
     */
    public boolean open() {
        return opened.complete(null);
    }

    public boolean isOpen() {
        return opened.isDone();
    }

    /**
     * Blocks the calling thread until the gate opens.
     */
    public void await() {
        if (opened.isDone()) {
            return;
        }
        try {
            opened.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AmqpMeshException("Interrupted while waiting for AMQP channels to start", ex);
        } catch (ExecutionException ex) {
            // never completed exceptionally
            throw new IllegalStateException(ex.getCause());
        }
    }

    /**
     * Future completing when the gate opens. Completing or cancelling the returned future does not
     * affect the gate.
     */
    public CompletableFuture<Void> whenOpen() {
        return opened.copy();
    }
}
