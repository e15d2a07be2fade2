package org.seleznyov.iyu.tracepipe.core.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.DrainConfiguration;
import org.seleznyov.iyu.tracepipe.core.correlation.EventCorrelator;
import org.seleznyov.iyu.tracepipe.core.ringbuffer.BatchRead;
import org.seleznyov.iyu.tracepipe.core.ringbuffer.EventRingBuffer;
import org.seleznyov.iyu.tracepipe.core.store.HotEventStore;
import org.seleznyov.iyu.tracepipe.domain.model.correlation.CorrelatedEvent;
import org.seleznyov.iyu.tracepipe.domain.model.event.Event;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.LockSupport;

/**
 * Single consumer of the ring buffer: drains a batch, correlates it on a dedicated thread with a
 * timeout, stores the result and only then releases the slots.
 * <p>
 * A batch whose correlation times out stays undelivered. The next {@code maxBatchRetries} calls
 * wait again on the same correlation instead of submitting the batch anew, so the correlator
 * sees every event once. After that the batch is cancelled, dropped and counted. A batch that
 * fails with an exception is dropped at once.
 */
@Slf4j
public class CorrelationDrainLoop implements Runnable {

    private static final int STATE_NEW = 0;
    private static final int STATE_RUNNING = 1;
    private static final int STATE_STOPPED = 2;

    private static final VarHandle STATE_VAR_HANDLE;

    static {
        try {
            MethodHandles.Lookup lookup = MethodHandles.lookup();
            STATE_VAR_HANDLE = lookup.findVarHandle(
                CorrelationDrainLoop.class, "state", int.class);
        } catch (Exception e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final EventRingBuffer ringBuffer;
    private final EventCorrelator correlator;
    private final HotEventStore store;
    private final int batchSize;
    private final long correlationTimeoutNanos;
    private final int maxBatchRetries;
    private final int maxIdleSpins;
    private final long parkNanos;
    private final ExecutorService correlationExecutor;

    private int state;

    // Пишется только потоком, который сейчас дренирует буфер
    private volatile long cursor;
    private int batchAttempts;
    private BatchRead pendingBatch;
    private Future<List<CorrelatedEvent>> pendingCorrelation;

    private final LongAdder batches = new LongAdder();
    private final LongAdder eventsStored = new LongAdder();
    private final LongAdder timeouts = new LongAdder();
    private final LongAdder retries = new LongAdder();
    private final LongAdder droppedBatches = new LongAdder();
    private final LongAdder droppedEvents = new LongAdder();
    private final LongAdder failures = new LongAdder();

    public CorrelationDrainLoop(
        EventRingBuffer ringBuffer,
        EventCorrelator correlator,
        HotEventStore store,
        DrainConfiguration configuration
    ) {
        if (configuration.batchSize() <= 0) {
            throw new IllegalArgumentException("Drain batch size must be positive");
        }
        if (configuration.correlationTimeout() == null
            || configuration.correlationTimeout().isNegative()
            || configuration.correlationTimeout().isZero()) {
            throw new IllegalArgumentException("Correlation timeout must be positive");
        }
        if (configuration.maxBatchRetries() < 0) {
            throw new IllegalArgumentException("Max batch retries cannot be negative");
        }
        this.ringBuffer = ringBuffer;
        this.correlator = correlator;
        this.store = store;
        this.batchSize = configuration.batchSize();
        this.correlationTimeoutNanos = configuration.correlationTimeout().toNanos();
        this.maxBatchRetries = configuration.maxBatchRetries();
        this.maxIdleSpins = configuration.maxIdleSpins();
        this.parkNanos = configuration.parkNanos();
        this.correlationExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "tracepipe-correlator");
            thread.setDaemon(true);
            return thread;
        });
        this.state = STATE_NEW;
        this.cursor = ringBuffer.readPosition();
    }

    @Override
    public void run() {
        if (!STATE_VAR_HANDLE.compareAndSet(this, STATE_NEW, STATE_RUNNING)) {
            log.info("Correlation drain loop was stopped before it started");
            return;
        }
        log.info("Correlation drain loop started at position {}", cursor);

        int idleSpins = 0;

        while ((int) STATE_VAR_HANDLE.getAcquire(this) == STATE_RUNNING && !Thread.currentThread().isInterrupted()) {
            final int stored = drainOnce();

            if (stored > 0) {
                idleSpins = 0;
            } else {
                idleSpins++;
                handleIdle(idleSpins);
            }
        }

        log.info("Correlation drain loop stopped at position {}", cursor);
    }

    /**
     * Drains and processes at most one batch.
     *
     * @return number of events stored
     */
    public int drainOnce() {
        final BatchRead batch;
        final Future<List<CorrelatedEvent>> future;

        if (pendingCorrelation != null) {
            // Повтор - ждем ту же корреляцию, батч повторно не отправляем
            batch = pendingBatch;
            future = pendingCorrelation;
        } else {
            batch = ringBuffer.readBatch(cursor, batchSize);
            if (batch.isEmpty()) {
                cursor = batch.nextPosition();
                return 0;
            }
            batches.increment();
            final List<Event> drained = batch.events();
            future = correlationExecutor.submit(() -> correlator.correlate(drained));
        }

        final List<Event> events = batch.events();
        try {
            final List<CorrelatedEvent> correlated = future.get(correlationTimeoutNanos, TimeUnit.NANOSECONDS);
            clearPending();
            store.putBatch(correlated);
            commit(batch);
            eventsStored.add(correlated.size());
            return correlated.size();

        } catch (TimeoutException e) {
            timeouts.increment();
            if (batchAttempts < maxBatchRetries) {
                batchAttempts++;
                retries.increment();
                pendingBatch = batch;
                pendingCorrelation = future;
                log.warn("Correlation of {} events timed out, waiting again {}/{}", events.size(), batchAttempts, maxBatchRetries);
                return 0;
            }
            future.cancel(true);
            clearPending();
            log.warn("Correlation of {} events timed out, dropping batch at position {}", events.size(), cursor);
            drop(batch);
            return 0;

        } catch (ExecutionException e) {
            clearPending();
            failures.increment();
            log.error("Correlation of {} events failed, dropping batch: {}",
                events.size(), e.getCause().getMessage(), e.getCause());
            drop(batch);
            return 0;

        } catch (InterruptedException e) {
            // Корреляция продолжается, ее результат заберет следующий вызов
            pendingBatch = batch;
            pendingCorrelation = future;
            Thread.currentThread().interrupt();
            return 0;
        }
    }

    /**
     * Processes batches until the buffer has nothing left at the cursor.
     *
     * @return number of events stored
     */
    public long drainRemaining() {
        long total = 0;
        int idleRounds = 0;

        while (!Thread.currentThread().isInterrupted()) {
            final int stored = drainOnce();
            total += stored;
            if (stored > 0) {
                idleRounds = 0;
                continue;
            }
            if (cursor >= ringBuffer.writePosition() || ++idleRounds > Math.max(maxIdleSpins, 1)) {
                break;
            }
            // Слот захвачен, но еще не опубликован, или батч ждет повтора
            Thread.onSpinWait();
        }
        return total;
    }

    /**
     * Stops the loop. A loop stopped before {@link #run()} starts never enters the drain cycle.
     */
    public void stop() {
        STATE_VAR_HANDLE.setRelease(this, STATE_STOPPED);
    }

    public boolean isRunning() {
        return (int) STATE_VAR_HANDLE.getAcquire(this) == STATE_RUNNING;
    }

    /**
     * Stops the correlation executor. The loop itself must already be stopped.
     */
    public void shutdown() {
        correlationExecutor.shutdown();
        try {
            if (!correlationExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Correlation executor didn't shutdown gracefully, forcing...");
                correlationExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            correlationExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public long cursor() {
        return cursor;
    }

    public DrainStats stats() {
        return new DrainStats(
            isRunning(),
            cursor,
            batches.sum(),
            eventsStored.sum(),
            timeouts.sum(),
            retries.sum(),
            droppedBatches.sum(),
            droppedEvents.sum(),
            failures.sum()
        );
    }

    private void commit(BatchRead batch) {
        cursor = batch.nextPosition();
        batchAttempts = 0;
        ringBuffer.advanceReadPosition(cursor);
    }

    private void clearPending() {
        pendingBatch = null;
        pendingCorrelation = null;
    }

    private void drop(BatchRead batch) {
        droppedBatches.increment();
        droppedEvents.add(batch.events().size());
        commit(batch);
    }

    private void handleIdle(int idleSpins) {
        if (idleSpins < maxIdleSpins) {
            Thread.onSpinWait();
        } else {
            LockSupport.parkNanos(parkNanos);
        }
    }
}
