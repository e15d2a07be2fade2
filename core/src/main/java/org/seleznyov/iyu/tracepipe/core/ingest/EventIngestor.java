package org.seleznyov.iyu.tracepipe.core.ingest;

import lombok.extern.slf4j.Slf4j;
import org.seleznyov.iyu.tracepipe.core.ringbuffer.EventRingBuffer;
import org.seleznyov.iyu.tracepipe.core.ringbuffer.WriteResult;
import org.seleznyov.iyu.tracepipe.domain.model.event.ErrorPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.Event;
import org.seleznyov.iyu.tracepipe.domain.model.event.EventKind;
import org.seleznyov.iyu.tracepipe.domain.model.event.EventPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.FunctionCallPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.FunctionReturnPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.MessagePayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.MetricPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.ProcessPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.StateChangePayload;
import org.seleznyov.iyu.tracepipe.shared.utils.Uuid7Utils;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongSupplier;

/**
 * Producer-facing entry point of the pipeline.
 * <p>
 * Every call assigns a time-ordered event id, stamps monotonic and wall time, bounds the payload
 * and writes the event into the ring buffer. Nothing here throws at a producer: a full buffer is
 * reported as {@link IngestStatus#DROPPED} and counted.
 */
@Slf4j
public class EventIngestor {

    private final EventRingBuffer ringBuffer;
    private final PayloadTruncator truncator;
    private final AtomicBoolean enabled;
    private final LongSupplier monotonicClock;
    private final Clock wallClock;

    private final LongAdder accepted = new LongAdder();
    private final LongAdder dropped = new LongAdder();
    private final LongAdder disabled = new LongAdder();

    public EventIngestor(EventRingBuffer ringBuffer, PayloadTruncator truncator, boolean enabled) {
        this(ringBuffer, truncator, enabled, System::nanoTime, Clock.systemUTC());
    }

    public EventIngestor(
        EventRingBuffer ringBuffer,
        PayloadTruncator truncator,
        boolean enabled,
        LongSupplier monotonicClock,
        Clock wallClock
    ) {
        this.ringBuffer = ringBuffer;
        this.truncator = truncator;
        this.enabled = new AtomicBoolean(enabled);
        this.monotonicClock = monotonicClock;
        this.wallClock = wallClock;
    }

    public IngestResult ingestFunctionCall(String producerId, String symbol, Object args, UUID correlationHint) {
        if (!enabled.get()) {
            return disabled();
        }
        final int arity = args instanceof Collection<?> collection ? collection.size()
            : args instanceof Object[] array ? array.length
            : args == null ? 0 : 1;
        return submit(
            EventKind.FUNCTION_ENTRY,
            producerId,
            correlationHint,
            new FunctionCallPayload(symbol, truncator.truncate(args), arity)
        );
    }

    public IngestResult ingestFunctionReturn(
        String producerId,
        String symbol,
        Object returnValue,
        long durationNanos,
        UUID correlationHint
    ) {
        if (!enabled.get()) {
            return disabled();
        }
        return submit(
            EventKind.FUNCTION_EXIT,
            producerId,
            correlationHint,
            new FunctionReturnPayload(symbol, truncator.truncate(returnValue), durationNanos)
        );
    }

    /**
     * Send from {@code producerId} to {@code receiverId}.
     */
    public IngestResult ingestMessageSend(String producerId, String receiverId, Object content) {
        if (!enabled.get()) {
            return disabled();
        }
        return submit(EventKind.MESSAGE_SEND, producerId, null, message(producerId, receiverId, content));
    }

    /**
     * Receive on {@code producerId} of a message sent by {@code senderId}.
     */
    public IngestResult ingestMessageReceive(String producerId, String senderId, Object content) {
        if (!enabled.get()) {
            return disabled();
        }
        return submit(EventKind.MESSAGE_RECEIVE, producerId, null, message(senderId, producerId, content));
    }

    public IngestResult ingestStateChange(String producerId, String callback, Object oldState, Object newState) {
        if (!enabled.get()) {
            return disabled();
        }
        return submit(
            EventKind.STATE_CHANGE,
            producerId,
            null,
            new StateChangePayload(
                callback,
                truncator.truncate(oldState),
                truncator.truncate(newState),
                truncator.diff(oldState, newState)
            )
        );
    }

    /**
     * Spawn is reported by the parent producer.
     */
    public IngestResult ingestProcessSpawn(String parentProducerId, String childProducerId, Object reason) {
        if (!enabled.get()) {
            return disabled();
        }
        return submit(
            EventKind.PROCESS_SPAWN,
            parentProducerId,
            null,
            new ProcessPayload(parentProducerId, childProducerId, truncator.truncate(reason))
        );
    }

    public IngestResult ingestProcessExit(String producerId, Object reason) {
        if (!enabled.get()) {
            return disabled();
        }
        return submit(
            EventKind.PROCESS_EXIT,
            producerId,
            null,
            new ProcessPayload(null, producerId, truncator.truncate(reason))
        );
    }

    public IngestResult ingestError(
        String producerId,
        String errorType,
        Object message,
        Object stacktrace,
        UUID correlationHint
    ) {
        if (!enabled.get()) {
            return disabled();
        }
        return submit(
            EventKind.ERROR,
            producerId,
            correlationHint,
            new ErrorPayload(errorType, truncator.truncate(message), truncator.truncate(stacktrace))
        );
    }

    public IngestResult ingestMetric(String producerId, String name, double value, Map<String, Object> metadata) {
        if (!enabled.get()) {
            return disabled();
        }
        return submit(
            EventKind.METRIC,
            producerId,
            null,
            truncator.truncate(new MetricPayload(name, value, metadata == null ? Map.of() : metadata))
        );
    }

    /**
     * Ingests a pre-formed event. Missing id and timestamps are filled in, the payload is bounded.
     * The event is forwarded as is otherwise, malformed input is left for the correlator to flag.
     */
    public IngestResult ingest(Event event) {
        if (!enabled.get()) {
            return disabled();
        }
        if (event == null) {
            dropped.increment();
            return new IngestResult(null, IngestStatus.DROPPED);
        }
        return write(normalize(event));
    }

    public BatchIngestResult ingestBatch(List<Event> events) {
        int ok = 0;
        final List<FailedIngest> failed = new ArrayList<>();

        for (int i = 0; i < events.size(); i++) {
            final IngestResult result = ingest(events.get(i));
            if (result.accepted()) {
                ok++;
            } else {
                failed.add(new FailedIngest(i, result.eventId(), result.status()));
            }
        }

        if (!failed.isEmpty()) {
            log.debug("Batch ingest: {} accepted, {} failed", ok, failed.size());
        }
        return new BatchIngestResult(ok, List.copyOf(failed));
    }

    /**
     * Sink bound to this ingestor for callers that already hold formed events.
     */
    public EventSink fastPath() {
        return this::ingest;
    }

    /**
     * Measures {@link #ingest(Event)} latency on copies of {@code sample}. Every copy gets its own id,
     * so the measured events are real writes into the buffer.
     */
    public IngestionBenchmark benchmark(Event sample, int iterations) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("Iterations must be positive");
        }
        long min = Long.MAX_VALUE;
        long max = 0;
        long total = 0;

        for (int i = 0; i < iterations; i++) {
            final Event copy = sample.toBuilder().eventId(null).timestamp(0L).wallTime(0L).build();
            final long start = System.nanoTime();
            ingest(copy);
            final long elapsed = System.nanoTime() - start;
            min = Math.min(min, elapsed);
            max = Math.max(max, elapsed);
            total += elapsed;
        }

        final IngestionBenchmark benchmark = new IngestionBenchmark(
            (double) total / iterations, min, max, total, iterations
        );
        log.info("Ingestion benchmark: {} ops, avg={}ns, min={}ns, max={}ns",
            iterations, String.format("%.1f", benchmark.avgTimeNanos()), min, max);
        return benchmark;
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    public void setEnabled(boolean value) {
        if (enabled.getAndSet(value) != value) {
            log.info("Trace ingestion {}", value ? "enabled" : "disabled");
        }
    }

    public IngestStats stats() {
        return new IngestStats(
            enabled.get(),
            accepted.sum(),
            dropped.sum(),
            disabled.sum(),
            truncator.truncatedValues()
        );
    }

    private MessagePayload message(String senderId, String receiverId, Object content) {
        // Хэш по полному содержимому, до усечения
        final long contentHash = truncator.contentHash(content);
        return new MessagePayload(senderId, receiverId, truncator.truncate(content), contentHash);
    }

    private IngestResult submit(EventKind kind, String producerId, UUID correlationHint, EventPayload payload) {
        final Event event = new Event(
            Uuid7Utils.nextMonotonicUuid7(),
            kind,
            monotonicClock.getAsLong(),
            wallNanos(),
            producerId,
            correlationHint,
            null,
            payload
        );
        return write(event);
    }

    private Event normalize(Event event) {
        return event.toBuilder()
            .eventId(event.eventId() == null ? Uuid7Utils.nextMonotonicUuid7() : event.eventId())
            .timestamp(event.timestamp() == 0L ? monotonicClock.getAsLong() : event.timestamp())
            .wallTime(event.wallTime() == 0L ? wallNanos() : event.wallTime())
            .payload(event.payload() == null ? null : truncator.truncate(event.payload()))
            .build();
    }

    private IngestResult write(Event event) {
        final WriteResult result = ringBuffer.write(event);
        if (result.isOk()) {
            accepted.increment();
            return new IngestResult(event.eventId(), IngestStatus.ACCEPTED);
        }
        dropped.increment();
        return new IngestResult(event.eventId(), IngestStatus.DROPPED);
    }

    private IngestResult disabled() {
        disabled.increment();
        return IngestResult.DISABLED;
    }

    private long wallNanos() {
        final Instant now = wallClock.instant();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }
}
