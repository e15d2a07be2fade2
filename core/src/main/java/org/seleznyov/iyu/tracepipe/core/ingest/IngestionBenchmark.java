package org.seleznyov.iyu.tracepipe.core.ingest;

public record IngestionBenchmark(
    double avgTimeNanos,
    long minTimeNanos,
    long maxTimeNanos,
    long totalTimeNanos,
    int operations
) {

}
