package org.seleznyov.iyu.tracepipe.domain.model.event;

public record FunctionCallPayload(
    String symbol,
    Object args,
    int arity
) implements EventPayload {

    @Override
    public String symbolKey() {
        return symbol;
    }
}
