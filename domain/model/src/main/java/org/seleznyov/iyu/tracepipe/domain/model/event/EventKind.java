package org.seleznyov.iyu.tracepipe.domain.model.event;

public enum EventKind {
    FUNCTION_ENTRY(FunctionCallPayload.class),
    FUNCTION_EXIT(FunctionReturnPayload.class),
    MESSAGE_SEND(MessagePayload.class),
    MESSAGE_RECEIVE(MessagePayload.class),
    STATE_CHANGE(StateChangePayload.class),
    PROCESS_SPAWN(ProcessPayload.class),
    PROCESS_EXIT(ProcessPayload.class),
    ERROR(ErrorPayload.class),
    METRIC(MetricPayload.class);

    private final Class<? extends EventPayload> payloadType;

    EventKind(Class<? extends EventPayload> payloadType) {
        this.payloadType = payloadType;
    }

    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    public boolean accepts(EventPayload payload) {
        return payloadType.isInstance(payload);
    }
}
