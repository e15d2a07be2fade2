package org.seleznyov.iyu.tracepipe.domain.model.correlation;

public enum CorrelationFlag {
    ORPHAN_EXIT,
    NO_SEND_MATCH,
    MALFORMED
}
