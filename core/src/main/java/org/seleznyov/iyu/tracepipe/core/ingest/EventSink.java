package org.seleznyov.iyu.tracepipe.core.ingest;

import org.seleznyov.iyu.tracepipe.domain.model.event.Event;

/**
 * Pre-bound ingestion entry point for callers that already hold formed events.
 */
@FunctionalInterface
public interface EventSink {

    IngestResult accept(Event event);
}
