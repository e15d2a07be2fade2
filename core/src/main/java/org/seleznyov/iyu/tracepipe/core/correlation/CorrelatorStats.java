package org.seleznyov.iyu.tracepipe.core.correlation;

public record CorrelatorStats(
    long eventsCorrelated,
    int trackedCorrelations,
    int linkEntries,
    int pendingMessages,
    int activeProducers,
    int pendingSpawns,
    ConfidenceDistribution confidence,
    long orphanExits,
    long unmatchedReceives,
    long malformedEvents,
    long sweeps
) {

}
