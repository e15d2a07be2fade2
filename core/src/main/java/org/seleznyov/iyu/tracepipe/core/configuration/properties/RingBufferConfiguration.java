package org.seleznyov.iyu.tracepipe.core.configuration.properties;

import org.seleznyov.iyu.tracepipe.core.ringbuffer.OverflowPolicy;

public record RingBufferConfiguration(
    int capacity,
    OverflowPolicy overflowPolicy,
    int writeAttempts
) {

}
