package org.seleznyov.iyu.tracepipe.core.correlation;

import org.seleznyov.iyu.tracepipe.domain.model.correlation.CorrelationType;

import java.util.UUID;

/**
 * Tracked state of one correlation id. {@code rootId} is resolved once, when the correlation
 * is first seen, and reused by every child.
 */
public record CorrelationMetadata(
    UUID correlationId,
    UUID parentId,
    UUID rootId,
    long createdAtMillis,
    CorrelationType type,
    double confidence
) {

}
