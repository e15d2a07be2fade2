package org.seleznyov.iyu.tracepipe.core.correlation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sends waiting for their receive, FIFO per signature. Every change of a signature's queue
 * happens inside a per-key {@code compute}, so the sweep and the correlator can interleave.
 */
final class PendingMessageRegistry {

    private final Map<MessageSignature, Deque<PendingMessage>> pending = new ConcurrentHashMap<>();
    private final AtomicInteger size = new AtomicInteger(0);

    void register(MessageSignature signature, PendingMessage message) {
        pending.compute(signature, (key, queue) -> {
            final Deque<PendingMessage> target = queue == null ? new ArrayDeque<>() : queue;
            target.addLast(message);
            size.incrementAndGet();
            return target;
        });
    }

    /**
     * Removes and returns the oldest send registered under {@code signature}, or {@code null}.
     */
    PendingMessage take(MessageSignature signature) {
        final PendingMessage[] taken = new PendingMessage[1];
        pending.computeIfPresent(signature, (key, queue) -> {
            taken[0] = queue.pollFirst();
            if (taken[0] != null) {
                size.decrementAndGet();
            }
            return queue.isEmpty() ? null : queue;
        });
        return taken[0];
    }

    /**
     * Drops a single signature's sends registered before {@code cutoffMillis}.
     *
     * @return number of sends removed
     */
    int removeOlderThan(MessageSignature signature, long cutoffMillis) {
        final int[] removed = new int[1];
        pending.computeIfPresent(signature, (key, queue) -> {
            while (!queue.isEmpty() && queue.peekFirst().sentAtMillis() < cutoffMillis) {
                queue.pollFirst();
                removed[0]++;
            }
            size.addAndGet(-removed[0]);
            return queue.isEmpty() ? null : queue;
        });
        return removed[0];
    }

    Iterable<MessageSignature> signatures() {
        return pending.keySet();
    }

    int size() {
        return size.get();
    }
}
