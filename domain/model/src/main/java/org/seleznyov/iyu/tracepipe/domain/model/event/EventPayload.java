package org.seleznyov.iyu.tracepipe.domain.model.event;

/**
 * Kind-specific part of an {@link Event}. Free-form values inside a payload may be
 * replaced by a {@link TruncatedValue} when they exceed the ingest size threshold.
 */
public interface EventPayload {

    /**
     * Key for the symbol index, {@code null} when the payload has none.
     */
    default String symbolKey() {
        return null;
    }
}
