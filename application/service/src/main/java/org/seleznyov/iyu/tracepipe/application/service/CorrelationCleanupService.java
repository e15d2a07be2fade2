package org.seleznyov.iyu.tracepipe.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.seleznyov.iyu.tracepipe.core.correlation.EventCorrelator;
import org.seleznyov.iyu.tracepipe.core.correlation.SweepResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic cleanup of correlation state older than the TTL.
 * <p>
 * Configuration properties:
 * - tracepipe.correlation.cleanup.enabled: Enable/disable the scheduled sweep (default: true)
 * - tracepipe.correlation.sweep-interval: Delay between sweeps (default: 30s)
 */
@Service
@ConditionalOnProperty(name = "tracepipe.correlation.cleanup.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CorrelationCleanupService {

    private final EventCorrelator correlator;
    private final PipelineMetrics metrics;

    private final AtomicLong totalRemoved = new AtomicLong(0);
    private final AtomicLong sweepCount = new AtomicLong(0);
    private final AtomicLong lastSweepTime = new AtomicLong(0);

    @Scheduled(
        fixedDelayString = "#{@tracePipelineConfiguration.correlation().sweepInterval().toMillis()}",
        initialDelayString = "#{@tracePipelineConfiguration.correlation().sweepInterval().toMillis()}"
    )
    public void performScheduledSweep() {
        try {
            final SweepResult result = correlator.sweep();
            if (result.skipped()) {
                log.debug("Correlation sweep skipped, previous sweep still running");
                return;
            }

            totalRemoved.addAndGet(result.totalRemoved());
            sweepCount.incrementAndGet();
            lastSweepTime.set(System.currentTimeMillis());
            metrics.recordSweep(result);

            log.info("Correlation sweep completed in {}ms: removed {} entries (metadata={}, pending={}, stacks={})",
                result.durationMillis(), result.totalRemoved(), result.metadataRemoved(),
                result.pendingRemoved(), result.callStacksRemoved());

        } catch (Exception e) {
            log.error("Correlation sweep failed: {}", e.getMessage(), e);
        }
    }

    public CleanupStats getCleanupStats() {
        return new CleanupStats(
            totalRemoved.get(),
            sweepCount.get(),
            lastSweepTime.get()
        );
    }

    /**
     * Cleanup statistics for monitoring.
     */
    public record CleanupStats(
        long totalEntriesRemoved,
        long sweeps,
        long lastSweepTimestamp
    ) {

    }
}
