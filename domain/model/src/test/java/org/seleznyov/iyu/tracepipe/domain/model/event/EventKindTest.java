package org.seleznyov.iyu.tracepipe.domain.model.event;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class EventKindTest {

    @Test
    void everyKindShouldAcceptItsOwnPayloadType() {
        assertThat(EventKind.FUNCTION_ENTRY.accepts(new FunctionCallPayload("Mod.fun", List.of(1), 1))).isTrue();
        assertThat(EventKind.FUNCTION_EXIT.accepts(new FunctionReturnPayload("Mod.fun", "ok", 10L))).isTrue();
        assertThat(EventKind.MESSAGE_SEND.accepts(new MessagePayload("a", "b", "hi", 1L))).isTrue();
        assertThat(EventKind.MESSAGE_RECEIVE.accepts(new MessagePayload("a", "b", "hi", 1L))).isTrue();
        assertThat(EventKind.STATE_CHANGE.accepts(new StateChangePayload("handle", 1, 2, StateDiff.changed(0)))).isTrue();
        assertThat(EventKind.PROCESS_SPAWN.accepts(new ProcessPayload("a", "b", null))).isTrue();
        assertThat(EventKind.PROCESS_EXIT.accepts(new ProcessPayload(null, "b", "normal"))).isTrue();
        assertThat(EventKind.ERROR.accepts(new ErrorPayload("RuntimeError", "boom", null))).isTrue();
        assertThat(EventKind.METRIC.accepts(new MetricPayload("queue.len", 3.0, Map.of()))).isTrue();
    }

    @Test
    void shouldRejectMismatchedOrMissingPayload() {
        assertThat(EventKind.FUNCTION_ENTRY.accepts(new FunctionReturnPayload("Mod.fun", "ok", 10L))).isFalse();
        assertThat(EventKind.METRIC.accepts(null)).isFalse();
    }

    @Test
    void symbolKeyShouldComeFromFunctionPayloadsOnly() {
        Event call = Event.builder()
            .eventId(UUID.randomUUID())
            .kind(EventKind.FUNCTION_ENTRY)
            .producerId("p1")
            .payload(new FunctionCallPayload("Cache.get", null, 0))
            .build();
        Event metric = call.toBuilder()
            .kind(EventKind.METRIC)
            .payload(new MetricPayload("hits", 1.0, null))
            .build();
        Event empty = call.toBuilder().payload(null).build();

        assertThat(call.symbolKey()).isEqualTo("Cache.get");
        assertThat(metric.symbolKey()).isNull();
        assertThat(empty.symbolKey()).isNull();
    }

    @Test
    void stateDiffFactories() {
        assertThat(StateDiff.NO_CHANGE.changed()).isFalse();
        assertThat(StateDiff.changed(-12)).isEqualTo(new StateDiff(true, -12));
    }
}
