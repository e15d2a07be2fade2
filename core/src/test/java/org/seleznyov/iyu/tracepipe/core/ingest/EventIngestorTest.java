package org.seleznyov.iyu.tracepipe.core.ingest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.seleznyov.iyu.tracepipe.core.ringbuffer.BatchRead;
import org.seleznyov.iyu.tracepipe.core.ringbuffer.EventRingBuffer;
import org.seleznyov.iyu.tracepipe.core.ringbuffer.OverflowPolicy;
import org.seleznyov.iyu.tracepipe.core.support.MutableClock;
import org.seleznyov.iyu.tracepipe.core.support.TestEvents;
import org.seleznyov.iyu.tracepipe.domain.model.event.Event;
import org.seleznyov.iyu.tracepipe.domain.model.event.EventKind;
import org.seleznyov.iyu.tracepipe.domain.model.event.FunctionCallPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.MessagePayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.ProcessPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.StateChangePayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.TruncatedValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventIngestorTest {

    private EventRingBuffer buffer;
    private EventIngestor ingestor;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        buffer = new EventRingBuffer(8, OverflowPolicy.REJECT, 64);
        clock = MutableClock.startingNow();
        AtomicLong monotonic = new AtomicLong(1_000);
        ingestor = new EventIngestor(buffer, new PayloadTruncator(32), true, monotonic::incrementAndGet, clock);
    }

    @Test
    void functionCallIsStampedIdentifiedAndWritten() {
        UUID hint = UUID.randomUUID();

        IngestResult result = ingestor.ingestFunctionCall("p1", "Orders.place", List.of("a", "b"), hint);

        assertThat(result.accepted()).isTrue();
        Event event = single();
        assertThat(event.eventId()).isEqualTo(result.eventId());
        assertThat(event.kind()).isEqualTo(EventKind.FUNCTION_ENTRY);
        assertThat(event.producerId()).isEqualTo("p1");
        assertThat(event.correlationId()).isEqualTo(hint);
        assertThat(event.timestamp()).isEqualTo(1_001L);
        assertThat(event.wallTime()).isEqualTo(clock.instant().getEpochSecond() * 1_000_000_000L);
        assertThat(event.payload()).isInstanceOfSatisfying(FunctionCallPayload.class, payload -> {
            assertThat(payload.symbol()).isEqualTo("Orders.place");
            assertThat(payload.arity()).isEqualTo(2);
        });
    }

    @Test
    void eventIdsAreTimeOrdered() {
        UUID first = ingestor.ingestMetric("p1", "m", 1.0, null).eventId();
        UUID second = ingestor.ingestMetric("p1", "m", 2.0, null).eventId();

        assertThat(second.compareTo(first)).isPositive();
    }

    @Test
    void oversizedArgumentsAreTruncatedWithTypeHint() {
        ingestor.ingestFunctionCall("p1", "Bulk.load", Arrays.asList(new String[50]), null);

        FunctionCallPayload payload = (FunctionCallPayload) single().payload();
        assertThat(payload.args()).isInstanceOfSatisfying(TruncatedValue.class,
            marker -> assertThat(marker.typeHint()).isEqualTo("List"));
        assertThat(payload.arity()).isEqualTo(50);
        assertThat(ingestor.stats().truncatedValues()).isEqualTo(1);
    }

    @Test
    void sendAndReceiveCarryTheSameContentHash() {
        String content = "ping".repeat(20);
        ingestor.ingestMessageSend("p1", "p2", content);
        ingestor.ingestMessageReceive("p2", "p1", content);

        List<Event> events = buffer.readBatch(0, 10).events();
        MessagePayload send = (MessagePayload) events.get(0).payload();
        MessagePayload receive = (MessagePayload) events.get(1).payload();

        assertThat(send.senderId()).isEqualTo("p1");
        assertThat(send.receiverId()).isEqualTo("p2");
        assertThat(receive.senderId()).isEqualTo("p1");
        assertThat(receive.receiverId()).isEqualTo("p2");
        assertThat(send.content()).isInstanceOf(TruncatedValue.class);
        assertThat(send.contentHash()).isEqualTo(receive.contentHash()).isNotZero();
    }

    @Test
    void stateChangeComputesDiffAndProcessEventsCarryProducers() {
        ingestor.ingestStateChange("p1", "handle_call", Map.of("n", 1), Map.of("n", 2));
        ingestor.ingestProcessSpawn("p1", "p9", "worker");
        ingestor.ingestProcessExit("p9", "normal");

        List<Event> events = buffer.readBatch(0, 10).events();
        assertThat(((StateChangePayload) events.get(0).payload()).diff().changed()).isTrue();
        assertThat((ProcessPayload) events.get(1).payload())
            .isEqualTo(new ProcessPayload("p1", "p9", "worker"));
        assertThat(events.get(2).producerId()).isEqualTo("p9");
        assertThat(((ProcessPayload) events.get(2).payload()).childProducerId()).isEqualTo("p9");
    }

    @Test
    void fullBufferIsReportedAsDroppedWithoutThrowing() {
        for (int i = 0; i < 8; i++) {
            assertThat(ingestor.ingestError("p1", "Timeout", "late", null, null).accepted()).isTrue();
        }

        IngestResult result = ingestor.ingestError("p1", "Timeout", "late", null, null);

        assertThat(result.status()).isEqualTo(IngestStatus.DROPPED);
        assertThat(result.eventId()).isNotNull();
        assertThat(ingestor.stats().dropped()).isEqualTo(1);
        assertThat(ingestor.stats().accepted()).isEqualTo(8);
    }

    @Test
    void disabledIngestorSkipsEventsAndCountsThem() {
        ingestor.setEnabled(false);

        IngestResult result = ingestor.ingestFunctionCall("p1", "f", null, null);

        assertThat(result.status()).isEqualTo(IngestStatus.DISABLED);
        assertThat(buffer.writePosition()).isZero();
        assertThat(ingestor.stats().disabled()).isEqualTo(1);

        ingestor.setEnabled(true);
        assertThat(ingestor.ingestFunctionCall("p1", "f", null, null).accepted()).isTrue();
    }

    @Test
    void batchReportsFailuresByIndex() {
        List<Event> events = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            events.add(TestEvents.entry("p1", "f" + i).toBuilder().eventId(null).timestamp(0L).build());
        }

        BatchIngestResult result = ingestor.ingestBatch(events);

        assertThat(result.ok()).isEqualTo(8);
        assertThat(result.failed()).extracting(FailedIngest::index).containsExactly(8, 9);
        assertThat(result.failed()).allSatisfy(failed -> {
            assertThat(failed.status()).isEqualTo(IngestStatus.DROPPED);
            assertThat(failed.eventId()).isNotNull();
        });
        assertThat(buffer.readBatch(0, 10).events()).allSatisfy(event -> {
            assertThat(event.eventId()).isNotNull();
            assertThat(event.timestamp()).isPositive();
        });
    }

    @Test
    void fastPathWritesPreformedEvents() {
        EventSink sink = ingestor.fastPath();
        Event event = TestEvents.metric("p1", "rps", 10);

        IngestResult result = sink.accept(event);

        assertThat(result.eventId()).isEqualTo(event.eventId());
        assertThat(single().timestamp()).isEqualTo(event.timestamp());
    }

    @Test
    void benchmarkMeasuresEveryIteration() {
        EventIngestor large = new EventIngestor(
            new EventRingBuffer(1024, OverflowPolicy.DROP_OLDEST, 64), new PayloadTruncator(4096), true
        );

        IngestionBenchmark benchmark = large.benchmark(TestEvents.metric("p1", "rps", 1), 100);

        assertThat(benchmark.operations()).isEqualTo(100);
        assertThat(benchmark.minTimeNanos()).isLessThanOrEqualTo(benchmark.maxTimeNanos());
        assertThat(benchmark.totalTimeNanos()).isGreaterThanOrEqualTo(benchmark.maxTimeNanos());
        assertThat(large.stats().accepted()).isEqualTo(100);
        assertThatThrownBy(() -> large.benchmark(TestEvents.metric("p1", "rps", 1), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private Event single() {
        BatchRead batch = buffer.readBatch(0, 10);
        assertThat(batch.events()).hasSize(1);
        return batch.events().get(0);
    }
}
