package org.seleznyov.iyu.tracepipe.domain.model.correlation;

import org.seleznyov.iyu.tracepipe.domain.model.event.Event;
import org.seleznyov.iyu.tracepipe.domain.model.event.EventKind;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Event enriched by the correlator. Never mutated after it leaves the correlator.
 */
public record CorrelatedEvent(
    Event event,
    UUID correlationId,
    UUID parentId,
    UUID rootId,
    List<CausalLink> links,
    CorrelationType correlationType,
    double confidence,
    Set<CorrelationFlag> flags
) {

    public CorrelatedEvent {
        links = List.copyOf(links);
        flags = Set.copyOf(flags);
    }

    public UUID eventId() {
        return event.eventId();
    }

    public long timestamp() {
        return event.timestamp();
    }

    public String producerId() {
        return event.producerId();
    }

    public EventKind kind() {
        return event.kind();
    }

    public String symbolKey() {
        return event.symbolKey();
    }

    public boolean hasFlag(CorrelationFlag flag) {
        return flags.contains(flag);
    }

    public boolean hasLink(RelationKind relation, UUID targetId) {
        return links.contains(new CausalLink(relation, targetId));
    }
}
