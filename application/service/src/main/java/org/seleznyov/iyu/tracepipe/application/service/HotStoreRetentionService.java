package org.seleznyov.iyu.tracepipe.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.seleznyov.iyu.tracepipe.core.store.HotEventStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic hot store retention: prune by age, then enforce the event cap.
 * <p>
 * Configuration properties:
 * - tracepipe.hot-store.retention.enabled: Enable/disable scheduled retention (default: true)
 * - tracepipe.hot-store.prune-interval: Delay between runs (default: 60s)
 */
@Service
@ConditionalOnProperty(name = "tracepipe.hot-store.retention.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class HotStoreRetentionService {

    private final HotEventStore store;
    private final PipelineMetrics metrics;

    private final AtomicLong totalPruned = new AtomicLong(0);
    private final AtomicLong lastRunTime = new AtomicLong(0);

    @Scheduled(
        fixedDelayString = "#{@tracePipelineConfiguration.hotStore().pruneInterval().toMillis()}",
        initialDelayString = "#{@tracePipelineConfiguration.hotStore().pruneInterval().toMillis()}"
    )
    public void performScheduledRetention() {
        try {
            enforceRetention();
        } catch (Exception e) {
            log.error("Hot store retention failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs retention immediately against the current monotonic time.
     *
     * @return number of events removed
     */
    public int enforceRetention() {
        final long startTime = System.nanoTime();
        final int removed = store.enforceRetention(startTime);
        final Duration duration = Duration.ofNanos(System.nanoTime() - startTime);

        totalPruned.addAndGet(removed);
        lastRunTime.set(System.currentTimeMillis());
        metrics.recordPrune(removed, duration);

        if (removed > 0) {
            log.info("Hot store retention completed in {}ms: pruned {} events, {} left",
                duration.toMillis(), removed, store.size());
        }
        return removed;
    }

    public RetentionStats getRetentionStats() {
        return new RetentionStats(
            totalPruned.get(),
            lastRunTime.get(),
            store.maxEvents(),
            store.maxAge()
        );
    }

    public record RetentionStats(
        long totalEventsPruned,
        long lastRunTimestamp,
        int maxEvents,
        Duration maxAge
    ) {

    }
}
