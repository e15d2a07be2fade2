package org.seleznyov.iyu.tracepipe.domain.model.event;

import lombok.Builder;

import java.util.UUID;

/**
 * Trace event as produced by instrumentation and normalized by the ingestor.
 *
 * Design considerations:
 * - Immutable once written into the ring buffer
 * - {@code timestamp} is monotonic nanoseconds, {@code wallTime} is epoch nanoseconds
 * - {@code correlationId} and {@code parentId} are producer hints, the correlator
 *   decides the final values
 */
@Builder(toBuilder = true)
public record Event(
    UUID eventId,
    EventKind kind,
    long timestamp,
    long wallTime,
    String producerId,
    UUID correlationId,
    UUID parentId,
    EventPayload payload
) {

    public String symbolKey() {
        return payload == null ? null : payload.symbolKey();
    }
}
