package org.seleznyov.iyu.tracepipe.domain.model.event;

public record ErrorPayload(
    String errorType,
    Object message,
    Object stacktrace
) implements EventPayload {

}
