package org.seleznyov.iyu.tracepipe.core.ringbuffer;

import org.seleznyov.iyu.tracepipe.domain.model.event.Event;

/**
 * Result of a single-slot read. When {@code event} is {@code null} the read was empty and
 * {@code nextPosition} is where the consumer should retry.
 */
public record ReadResult(
    Event event,
    long nextPosition
) {

    static ReadResult empty(long position) {
        return new ReadResult(null, position);
    }

    public boolean isEmpty() {
        return event == null;
    }
}
