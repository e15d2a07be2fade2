package org.seleznyov.iyu.tracepipe.core.configuration.properties;

import org.seleznyov.iyu.tracepipe.core.ringbuffer.OverflowPolicy;

import java.time.Duration;

public record TracePipelineConfiguration(
    boolean enabled,
    RingBufferConfiguration ringBuffer,
    IngestConfiguration ingest,
    CorrelationConfiguration correlation,
    HotStoreConfiguration hotStore,
    DrainConfiguration drain
) {

    public static TracePipelineConfiguration defaults() {
        return new TracePipelineConfiguration(
            true,
            new RingBufferConfiguration(65_536, OverflowPolicy.DROP_OLDEST, 1024),
            new IngestConfiguration(4096),
            new CorrelationConfiguration(
                Duration.ofMinutes(5),
                Duration.ofSeconds(30),
                Duration.ofMillis(50),
                1_000_000
            ),
            new HotStoreConfiguration(1_000_000, Duration.ofHours(1), Duration.ofSeconds(60)),
            new DrainConfiguration(1000, Duration.ofSeconds(1), 0, 100, 100_000L)
        );
    }
}
