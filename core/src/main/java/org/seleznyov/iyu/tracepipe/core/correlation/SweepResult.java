package org.seleznyov.iyu.tracepipe.core.correlation;

/**
 * Outcome of one cleanup sweep.
 *
 * @param budgetExhausted the sweep stopped at its time budget, the rest is left for the next run
 * @param skipped         another sweep was already running
 */
public record SweepResult(
    int metadataRemoved,
    int linksRemoved,
    int pendingRemoved,
    int callStacksRemoved,
    int spawnsRemoved,
    int evictedOverCap,
    boolean budgetExhausted,
    boolean skipped,
    long durationMillis
) {

    static final SweepResult SKIPPED = new SweepResult(0, 0, 0, 0, 0, 0, false, true, 0);

    public int totalRemoved() {
        return metadataRemoved + linksRemoved + pendingRemoved + callStacksRemoved + spawnsRemoved + evictedOverCap;
    }
}
