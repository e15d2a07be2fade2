package org.seleznyov.iyu.tracepipe.core.pipeline;

import org.seleznyov.iyu.tracepipe.core.correlation.CorrelatorStats;
import org.seleznyov.iyu.tracepipe.core.ingest.IngestStats;
import org.seleznyov.iyu.tracepipe.core.ringbuffer.RingBufferStats;
import org.seleznyov.iyu.tracepipe.core.store.StoreStats;

/**
 * Observability snapshot of the whole pipeline. Each part is read separately, the snapshot
 * is not consistent across parts.
 */
public record PipelineStats(
    RingBufferStats buffer,
    IngestStats ingest,
    CorrelatorStats correlation,
    DrainStats drain,
    StoreStats store
) {

}
