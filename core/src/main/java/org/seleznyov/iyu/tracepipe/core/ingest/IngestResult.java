package org.seleznyov.iyu.tracepipe.core.ingest;

import java.util.UUID;

/**
 * Outcome of a single ingest call. The event id is assigned even when the event was dropped.
 */
public record IngestResult(
    UUID eventId,
    IngestStatus status
) {

    static final IngestResult DISABLED = new IngestResult(null, IngestStatus.DISABLED);

    public boolean accepted() {
        return status == IngestStatus.ACCEPTED;
    }
}
