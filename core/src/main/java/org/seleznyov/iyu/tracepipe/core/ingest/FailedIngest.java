package org.seleznyov.iyu.tracepipe.core.ingest;

import java.util.UUID;

/**
 * @param index   position of the event in the submitted batch
 * @param eventId assigned id, {@code null} when the batch element itself was {@code null}
 */
public record FailedIngest(
    int index,
    UUID eventId,
    IngestStatus status
) {

}
