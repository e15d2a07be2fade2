package org.seleznyov.iyu.tracepipe.core.ringbuffer;

public enum OverflowPolicy {
    /** Advance the read position by one slot, losing the oldest event, and retry. */
    DROP_OLDEST,
    /** Discard the incoming event and count it as dropped. */
    DROP_NEWEST,
    /** Refuse the incoming event, the caller decides what to do with it. */
    REJECT
}
