package org.seleznyov.iyu.tracepipe.core.ringbuffer;

import org.seleznyov.iyu.tracepipe.domain.model.event.Event;

import java.util.List;

public record BatchRead(
    List<Event> events,
    long nextPosition
) {

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
