package org.seleznyov.iyu.tracepipe.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.seleznyov.iyu.tracepipe.core.correlation.SweepResult;
import org.seleznyov.iyu.tracepipe.core.pipeline.TracePipeline;

import java.time.Duration;

/**
 * Micrometer binding of the pipeline counters. Gauges read the live components, the sweep and
 * prune meters are fed by the scheduled services.
 */
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    // Счетчики
    private final Counter sweepRemoved;
    private final Counter sweepBudgetExhausted;
    private final Counter storePruned;

    // Таймеры
    private final Timer sweepTimer;
    private final Timer pruneTimer;

    public PipelineMetrics(MeterRegistry meterRegistry, TracePipeline pipeline) {
        this.meterRegistry = meterRegistry;

        Gauge.builder("tracepipe.buffer.occupancy", pipeline, p -> p.ringBuffer().stats().occupancy())
            .description("Events written but not yet released by the drain loop")
            .register(meterRegistry);

        Gauge.builder("tracepipe.buffer.utilization", pipeline, p -> p.ringBuffer().stats().utilization())
            .description("Ring buffer occupancy relative to capacity")
            .register(meterRegistry);

        FunctionCounter.builder("tracepipe.buffer.writes", pipeline, p -> p.ringBuffer().stats().writes())
            .description("Events written into the ring buffer")
            .register(meterRegistry);

        FunctionCounter.builder("tracepipe.buffer.dropped", pipeline, p -> p.ringBuffer().stats().dropped())
            .description("Events lost to the overflow policy")
            .register(meterRegistry);

        FunctionCounter.builder("tracepipe.buffer.rejected", pipeline, p -> p.ringBuffer().stats().rejected())
            .description("Writes rejected on a full buffer")
            .register(meterRegistry);

        FunctionCounter.builder("tracepipe.ingest.dropped", pipeline, p -> p.ingestor().stats().dropped())
            .description("Ingest calls that did not reach the buffer")
            .register(meterRegistry);

        Gauge.builder("tracepipe.correlations.tracked", pipeline, p -> p.correlator().trackedCorrelations())
            .description("Correlation ids with live metadata")
            .register(meterRegistry);

        Gauge.builder("tracepipe.correlations.pending_messages", pipeline, p -> p.correlator().pendingMessageCount())
            .description("Sends waiting for a matching receive")
            .register(meterRegistry);

        FunctionCounter.builder("tracepipe.correlations.low_confidence", pipeline,
                p -> p.correlator().stats().confidence().lowConfidence())
            .description("Events correlated with confidence below 1.0")
            .register(meterRegistry);

        FunctionCounter.builder("tracepipe.drain.timeouts", pipeline, p -> p.drainLoop().stats().timeouts())
            .description("Correlation calls that exceeded the drain timeout")
            .register(meterRegistry);

        Gauge.builder("tracepipe.store.events", pipeline, p -> p.store().size())
            .description("Events in the hot store")
            .register(meterRegistry);

        this.sweepRemoved = Counter.builder("tracepipe.sweep.removed")
            .description("Correlation state entries removed by cleanup sweeps")
            .register(meterRegistry);

        this.sweepBudgetExhausted = Counter.builder("tracepipe.sweep.budget_exhausted")
            .description("Sweeps stopped at their time budget")
            .register(meterRegistry);

        this.storePruned = Counter.builder("tracepipe.store.pruned")
            .description("Events removed from the hot store by retention")
            .register(meterRegistry);

        this.sweepTimer = Timer.builder("tracepipe.sweep.duration")
            .description("Duration of correlation cleanup sweeps")
            .register(meterRegistry);

        this.pruneTimer = Timer.builder("tracepipe.store.prune.duration")
            .description("Duration of hot store retention runs")
            .register(meterRegistry);
    }

    public void recordSweep(SweepResult result) {
        if (result.skipped()) {
            return;
        }
        sweepRemoved.increment(result.totalRemoved());
        sweepTimer.record(Duration.ofMillis(result.durationMillis()));
        if (result.budgetExhausted()) {
            sweepBudgetExhausted.increment();
        }
    }

    public void recordPrune(int removed, Duration duration) {
        storePruned.increment(removed);
        pruneTimer.record(duration);
    }

    public MeterRegistry meterRegistry() {
        return meterRegistry;
    }
}
