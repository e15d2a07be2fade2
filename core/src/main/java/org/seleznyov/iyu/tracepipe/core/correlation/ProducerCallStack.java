package org.seleznyov.iyu.tracepipe.core.correlation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Open function correlations of one producer. Mutated only by the active correlator writer,
 * {@code depth} and activity fields are volatile for readers on other threads.
 */
final class ProducerCallStack {

    private final String producerId;
    private final Deque<UUID> openCorrelations = new ArrayDeque<>();

    private volatile int depth;
    private volatile long lastActivityMillis;
    private volatile UUID lastReceiveCorrelationId;

    ProducerCallStack(String producerId, long nowMillis) {
        this.producerId = producerId;
        this.lastActivityMillis = nowMillis;
    }

    void push(UUID correlationId) {
        openCorrelations.push(correlationId);
        depth = openCorrelations.size();
    }

    UUID pop() {
        final UUID correlationId = openCorrelations.poll();
        depth = openCorrelations.size();
        return correlationId;
    }

    UUID peek() {
        return openCorrelations.peek();
    }

    void touch(long nowMillis) {
        lastActivityMillis = nowMillis;
    }

    void lastReceive(UUID correlationId) {
        lastReceiveCorrelationId = correlationId;
    }

    UUID lastReceive() {
        return lastReceiveCorrelationId;
    }

    int depth() {
        return depth;
    }

    long lastActivityMillis() {
        return lastActivityMillis;
    }

    String producerId() {
        return producerId;
    }
}
