package org.seleznyov.iyu.tracepipe.domain.model.event;

public record FunctionReturnPayload(
    String symbol,
    Object returnValue,
    long durationNanos
) implements EventPayload {

    @Override
    public String symbolKey() {
        return symbol;
    }
}
