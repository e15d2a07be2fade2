package org.seleznyov.iyu.tracepipe.domain.model.event;

/**
 * Spawn: the event producer is the parent, {@code childProducerId} the spawned producer.
 * Exit: {@code childProducerId} is the producer that terminated.
 */
public record ProcessPayload(
    String parentProducerId,
    String childProducerId,
    Object reason
) implements EventPayload {

}
