package org.seleznyov.iyu.tracepipe.core.pipeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.CorrelationConfiguration;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.DrainConfiguration;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.HotStoreConfiguration;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.IngestConfiguration;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.RingBufferConfiguration;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.TracePipelineConfiguration;
import org.seleznyov.iyu.tracepipe.core.ingest.EventIngestor;
import org.seleznyov.iyu.tracepipe.core.ringbuffer.OverflowPolicy;
import org.seleznyov.iyu.tracepipe.core.store.QueryResult;
import org.seleznyov.iyu.tracepipe.domain.model.correlation.CorrelatedEvent;
import org.seleznyov.iyu.tracepipe.domain.model.correlation.RelationKind;
import org.seleznyov.iyu.tracepipe.domain.model.event.EventKind;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class TracePipelineTest {

    private TracePipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new TracePipeline(new TracePipelineConfiguration(
            true,
            new RingBufferConfiguration(1024, OverflowPolicy.DROP_OLDEST, 1024),
            new IngestConfiguration(256),
            new CorrelationConfiguration(Duration.ofMinutes(1), Duration.ofSeconds(10), Duration.ofMillis(50), 10_000),
            new HotStoreConfiguration(10_000, Duration.ofMinutes(10), Duration.ofSeconds(10)),
            new DrainConfiguration(64, Duration.ofSeconds(1), 0, 10, 100_000L)
        ));
    }

    @AfterEach
    void tearDown() {
        pipeline.stop();
    }

    @Test
    void eventsFlowFromIngestorToQueryableStore() {
        pipeline.start();
        EventIngestor ingestor = pipeline.ingestor();

        UUID outer = ingestor.ingestFunctionCall("p1", "Checkout.submit", List.of(42), null).eventId();
        ingestor.ingestFunctionCall("p1", "Payment.charge", List.of(42), null);
        ingestor.ingestMessageSend("p1", "p2", "charge:42");
        ingestor.ingestFunctionReturn("p1", "Payment.charge", "ok", 1_000L, null);
        ingestor.ingestFunctionReturn("p1", "Checkout.submit", "ok", 5_000L, null);
        ingestor.ingestMessageReceive("p2", "p1", "charge:42");

        await().atMost(Duration.ofSeconds(5)).until(() -> pipeline.store().size() == 6);

        CorrelatedEvent outerEntry = pipeline.get(outer).orElseThrow();
        QueryResult chain = pipeline.queryByCorrelation(outerEntry.correlationId(), 10);
        assertThat(chain.events()).extracting(CorrelatedEvent::kind)
            .containsExactly(EventKind.FUNCTION_ENTRY, EventKind.FUNCTION_EXIT);

        CorrelatedEvent send = pipeline.queryByProducer("p1", 10).events().stream()
            .filter(event -> event.kind() == EventKind.MESSAGE_SEND)
            .findFirst()
            .orElseThrow();
        CorrelatedEvent receive = pipeline.queryByProducer("p2", 10).events().get(0);
        assertThat(receive.hasLink(RelationKind.RECEIVES, send.correlationId())).isTrue();
        assertThat(send.rootId()).isEqualTo(outerEntry.correlationId());

        assertThat(pipeline.queryBySymbol("Payment.charge", 10).events()).hasSize(2);
    }

    @Test
    void stopFlushesEventsStillInTheBuffer() {
        pipeline.ingestor().ingestMetric("p1", "queue.depth", 3, null);
        pipeline.ingestor().ingestMetric("p1", "queue.depth", 4, null);

        pipeline.stop();

        assertThat(pipeline.store().size()).isEqualTo(2);
        PipelineStats stats = pipeline.stats();
        assertThat(stats.buffer().writes()).isEqualTo(2);
        assertThat(stats.buffer().occupancy()).isZero();
        assertThat(stats.ingest().accepted()).isEqualTo(2);
        assertThat(stats.correlation().eventsCorrelated()).isEqualTo(2);
        assertThat(stats.store().events()).isEqualTo(2);
    }

    @Test
    void flushIsRejectedWhileTheDrainThreadRuns() {
        pipeline.start();

        assertThatThrownBy(pipeline::flush)
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void stopRightAfterStartReturnsPromptly() {
        pipeline.start();
        long startedAt = System.nanoTime();

        pipeline.stop();

        assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isLessThan(Duration.ofSeconds(2));
        assertThat(pipeline.isRunning()).isFalse();
    }

    @Test
    void disabledPipelineCapturesNothing() {
        pipeline.ingestor().setEnabled(false);
        pipeline.ingestor().ingestFunctionCall("p1", "f", null, null);

        assertThat(pipeline.flush()).isZero();
        assertThat(pipeline.stats().ingest().disabled()).isEqualTo(1);
        assertThat(pipeline.stats().buffer().writes()).isZero();
    }
}
