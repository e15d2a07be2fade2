package org.seleznyov.iyu.tracepipe.application.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.seleznyov.iyu.tracepipe.core.ingest.EventIngestor;
import org.seleznyov.iyu.tracepipe.core.pipeline.TracePipeline;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class TracePipelineServiceConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(TracePipelineServiceConfiguration.class)
        .withPropertyValues(
            "tracepipe.ring-buffer.capacity=1024",
            "tracepipe.drain.batch-size=64",
            "tracepipe.correlation.sweep-interval=1h",
            "tracepipe.hot-store.prune-interval=1h"
        );

    @Test
    void shouldRegisterServicesAndMeters() {
        contextRunner
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).hasSingleBean(CorrelationCleanupService.class);
                assertThat(context).hasSingleBean(HotStoreRetentionService.class);

                MeterRegistry registry = context.getBean(MeterRegistry.class);
                assertThat(context.getBean(PipelineMetrics.class).meterRegistry()).isSameAs(registry);
                assertThat(registry.find("tracepipe.buffer.occupancy").gauge()).isNotNull();
                assertThat(registry.find("tracepipe.correlations.tracked").gauge()).isNotNull();
                assertThat(registry.find("tracepipe.buffer.dropped").functionCounter()).isNotNull();
                assertThat(registry.find("tracepipe.sweep.removed").counter()).isNotNull();
                assertThat(registry.find("tracepipe.store.prune.duration").timer()).isNotNull();
            });
    }

    @Test
    void shouldFallBackToSimpleRegistry() {
        contextRunner.run(context -> {
            PipelineMetrics metrics = context.getBean(PipelineMetrics.class);

            assertThat(metrics.meterRegistry()).isInstanceOf(SimpleMeterRegistry.class);
        });
    }

    @Test
    void cleanupCanBeDisabled() {
        contextRunner
            .withPropertyValues(
                "tracepipe.correlation.cleanup.enabled=false",
                "tracepipe.hot-store.retention.enabled=false"
            )
            .run(context -> {
                assertThat(context).doesNotHaveBean(CorrelationCleanupService.class);
                assertThat(context).doesNotHaveBean(HotStoreRetentionService.class);
                assertThat(context).hasSingleBean(PipelineMetrics.class);
            });
    }

    @Test
    void metersShouldFollowIngestedEvents() {
        contextRunner
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .run(context -> {
                EventIngestor ingestor = context.getBean(EventIngestor.class);
                MeterRegistry registry = context.getBean(MeterRegistry.class);

                ingestor.ingestFunctionCall("worker-1", "Worker.run", List.of(), null);
                ingestor.ingestFunctionReturn("worker-1", "Worker.run", "ok", 1_000L, null);

                await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                    assertThat(registry.get("tracepipe.store.events").gauge().value()).isEqualTo(2.0));
                assertThat(registry.get("tracepipe.buffer.writes").functionCounter().count()).isEqualTo(2.0);
            });
    }

    @Test
    void scheduledSweepShouldRecordStats() {
        contextRunner
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .run(context -> {
                CorrelationCleanupService cleanupService = context.getBean(CorrelationCleanupService.class);
                MeterRegistry registry = context.getBean(MeterRegistry.class);

                cleanupService.performScheduledSweep();

                CorrelationCleanupService.CleanupStats stats = cleanupService.getCleanupStats();
                assertThat(stats.sweeps()).isEqualTo(1);
                assertThat(stats.totalEntriesRemoved()).isZero();
                assertThat(stats.lastSweepTimestamp()).isPositive();
                assertThat(registry.get("tracepipe.sweep.duration").timer().count()).isEqualTo(1);
            });
    }

    @Test
    void retentionShouldPruneEventsPastMaxAge() {
        contextRunner
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .withPropertyValues("tracepipe.hot-store.max-age=1ms")
            .run(context -> {
                TracePipeline pipeline = context.getBean(TracePipeline.class);
                HotStoreRetentionService retentionService = context.getBean(HotStoreRetentionService.class);
                MeterRegistry registry = context.getBean(MeterRegistry.class);

                pipeline.ingestor().ingestMetric("worker-1", "queue.len", 1.0, null);
                pipeline.ingestor().ingestMetric("worker-1", "queue.len", 2.0, null);
                await().atMost(5, TimeUnit.SECONDS).until(() -> pipeline.store().size() == 2);

                Thread.sleep(10);

                assertThat(retentionService.enforceRetention()).isEqualTo(2);
                assertThat(pipeline.store().size()).isZero();

                HotStoreRetentionService.RetentionStats stats = retentionService.getRetentionStats();
                assertThat(stats.totalEventsPruned()).isEqualTo(2);
                assertThat(stats.maxAge()).isEqualTo(Duration.ofMillis(1));
                assertThat(registry.get("tracepipe.store.pruned").counter().count()).isEqualTo(2.0);
            });
    }
}
