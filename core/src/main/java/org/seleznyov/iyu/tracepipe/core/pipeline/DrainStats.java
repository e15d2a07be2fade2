package org.seleznyov.iyu.tracepipe.core.pipeline;

public record DrainStats(
    boolean running,
    long cursor,
    long batches,
    long eventsStored,
    long timeouts,
    long retries,
    long droppedBatches,
    long droppedEvents,
    long failures
) {

}
