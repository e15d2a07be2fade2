package org.seleznyov.iyu.tracepipe.domain.model.event;

public record StateChangePayload(
    String callback,
    Object oldState,
    Object newState,
    StateDiff diff
) implements EventPayload {

}
