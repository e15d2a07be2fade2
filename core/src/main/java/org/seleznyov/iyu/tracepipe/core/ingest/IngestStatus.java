package org.seleznyov.iyu.tracepipe.core.ingest;

public enum IngestStatus {
    ACCEPTED,
    /** Buffer full or contended, counted as dropped. */
    DROPPED,
    /** Capture switched off, the event was never built. */
    DISABLED
}
