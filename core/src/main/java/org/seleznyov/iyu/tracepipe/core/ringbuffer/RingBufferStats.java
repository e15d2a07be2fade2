package org.seleznyov.iyu.tracepipe.core.ringbuffer;

public record RingBufferStats(
    int capacity,
    long writes,
    long reads,
    long dropped,
    long rejected,
    long contended,
    long occupancy,
    long writePosition,
    long readPosition
) {

    public double utilization() {
        return capacity == 0 ? 0.0 : (double) occupancy / capacity;
    }
}
