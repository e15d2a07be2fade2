package org.seleznyov.iyu.tracepipe.core.store;

public enum QueryStatus {
    OK,
    /** {@code start > end}. */
    INVALID_RANGE,
    /** Non-positive limit. */
    INVALID_LIMIT
}
