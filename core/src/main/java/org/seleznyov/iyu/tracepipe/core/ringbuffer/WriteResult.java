package org.seleznyov.iyu.tracepipe.core.ringbuffer;

public enum WriteResult {
    OK,
    FULL,
    /** CAS retries exhausted under contention, the event was not written. */
    CONTENDED;

    public boolean isOk() {
        return this == OK;
    }
}
