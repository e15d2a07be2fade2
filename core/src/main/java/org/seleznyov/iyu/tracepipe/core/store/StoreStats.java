package org.seleznyov.iyu.tracepipe.core.store;

/**
 * @param oldestTimestamp monotonic timestamp of the oldest stored event, {@code -1} when empty
 */
public record StoreStats(
    int events,
    int timeBuckets,
    int producers,
    int symbols,
    int correlations,
    long inserted,
    long pruned,
    long oldestTimestamp,
    long newestTimestamp
) {

}
