package org.seleznyov.iyu.tracepipe.core.configuration.properties;

import java.time.Duration;

public record DrainConfiguration(
    int batchSize,
    Duration correlationTimeout,
    int maxBatchRetries,
    int maxIdleSpins,
    long parkNanos
) {

}
