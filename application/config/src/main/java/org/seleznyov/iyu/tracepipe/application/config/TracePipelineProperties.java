package org.seleznyov.iyu.tracepipe.application.config;

import lombok.Data;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.CorrelationConfiguration;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.DrainConfiguration;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.HotStoreConfiguration;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.IngestConfiguration;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.RingBufferConfiguration;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.TracePipelineConfiguration;
import org.seleznyov.iyu.tracepipe.core.ringbuffer.OverflowPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the trace pipeline
 */
@ConfigurationProperties(prefix = "tracepipe")
@Data
public class TracePipelineProperties {

    /**
     * Hot-path capture switch, read on every ingest call
     */
    private boolean enabled = true;

    private RingBuffer ringBuffer = new RingBuffer();
    private Ingest ingest = new Ingest();
    private Correlation correlation = new Correlation();
    private HotStore hotStore = new HotStore();
    private Drain drain = new Drain();

    @Data
    public static class RingBuffer {
        private int capacity = 65_536; // power of 2
        private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_OLDEST;
        private int writeAttempts = 1024;
    }

    @Data
    public static class Ingest {
        private int maxPayloadBytes = 4096;
    }

    @Data
    public static class Correlation {
        private Duration ttl = Duration.ofMinutes(5);
        private Duration sweepInterval = Duration.ofSeconds(30);
        private Duration sweepTimeBudget = Duration.ofMillis(50);
        private int maxTrackedCorrelations = 1_000_000; // soft cap
    }

    @Data
    public static class HotStore {
        private int maxEvents = 1_000_000;
        private Duration maxAge = Duration.ofHours(1);
        private Duration pruneInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class Drain {
        private int batchSize = 1000;
        private Duration correlationTimeout = Duration.ofSeconds(1);
        private int maxBatchRetries = 0;
        private int maxIdleSpins = 100;
        private long parkNanos = 100_000L;
    }

    public void validate() {
        if (ringBuffer.capacity <= 0 || Integer.bitCount(ringBuffer.capacity) != 1) {
            throw new IllegalArgumentException("Ring buffer capacity must be a power of 2: " + ringBuffer.capacity);
        }

        if (ringBuffer.writeAttempts < 1) {
            throw new IllegalArgumentException("Invalid ring buffer write attempts: " + ringBuffer.writeAttempts);
        }

        if (ingest.maxPayloadBytes < 1) {
            throw new IllegalArgumentException("Invalid max payload bytes: " + ingest.maxPayloadBytes);
        }

        if (!isPositive(correlation.ttl) || !isPositive(correlation.sweepInterval)) {
            throw new IllegalArgumentException("Correlation TTL and sweep interval must be positive");
        }

        if (correlation.maxTrackedCorrelations < 1) {
            throw new IllegalArgumentException("Invalid max tracked correlations: " + correlation.maxTrackedCorrelations);
        }

        if (hotStore.maxEvents < 1 || !isPositive(hotStore.maxAge) || !isPositive(hotStore.pruneInterval)) {
            throw new IllegalArgumentException("Hot store limits must be positive");
        }

        if (drain.batchSize < 1 || drain.batchSize > ringBuffer.capacity) {
            throw new IllegalArgumentException("Drain batch size must be between 1 and the ring buffer capacity: " +
                drain.batchSize);
        }

        if (drain.maxBatchRetries < 0 || drain.maxIdleSpins < 0 || drain.parkNanos < 1) {
            throw new IllegalArgumentException("Invalid drain idle or retry settings");
        }

        if (!isPositive(drain.correlationTimeout)) {
            throw new IllegalArgumentException("Correlation timeout must be positive");
        }
    }

    public TracePipelineConfiguration toConfiguration() {
        return new TracePipelineConfiguration(
            enabled,
            new RingBufferConfiguration(ringBuffer.capacity, ringBuffer.overflowPolicy, ringBuffer.writeAttempts),
            new IngestConfiguration(ingest.maxPayloadBytes),
            new CorrelationConfiguration(
                correlation.ttl,
                correlation.sweepInterval,
                correlation.sweepTimeBudget,
                correlation.maxTrackedCorrelations
            ),
            new HotStoreConfiguration(hotStore.maxEvents, hotStore.maxAge, hotStore.pruneInterval),
            new DrainConfiguration(
                drain.batchSize,
                drain.correlationTimeout,
                drain.maxBatchRetries,
                drain.maxIdleSpins,
                drain.parkNanos
            )
        );
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }
}
