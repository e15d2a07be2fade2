package org.seleznyov.iyu.tracepipe.core.configuration.properties;

import java.time.Duration;

public record CorrelationConfiguration(
    Duration ttl,
    Duration sweepInterval,
    Duration sweepTimeBudget,
    int maxTrackedCorrelations
) {

}
