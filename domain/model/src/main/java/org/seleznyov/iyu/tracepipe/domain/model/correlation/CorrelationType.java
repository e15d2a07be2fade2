package org.seleznyov.iyu.tracepipe.domain.model.correlation;

/**
 * How the correlation id of an event was derived.
 */
public enum CorrelationType {
    FUNCTION_CALL,
    FUNCTION_RETURN,
    ORPHAN_RETURN,
    MESSAGE_SEND,
    MESSAGE_RECEIVE,
    UNMATCHED_RECEIVE,
    INHERITED,
    NEW_CHAIN,
    PROCESS_LIFECYCLE,
    MALFORMED
}
