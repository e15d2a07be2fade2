package org.seleznyov.iyu.tracepipe.core.correlation;

/**
 * Number of correlated events per confidence level since start.
 */
public record ConfidenceDistribution(
    long full,
    long partial,
    long none
) {

    public long total() {
        return full + partial + none;
    }

    public long lowConfidence() {
        return partial + none;
    }
}
