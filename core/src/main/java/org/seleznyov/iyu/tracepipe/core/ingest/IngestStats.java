package org.seleznyov.iyu.tracepipe.core.ingest;

public record IngestStats(
    boolean enabled,
    long accepted,
    long dropped,
    long disabled,
    long truncatedValues
) {

}
