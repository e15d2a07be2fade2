package org.seleznyov.iyu.tracepipe.core.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.TracePipelineConfiguration;
import org.seleznyov.iyu.tracepipe.core.correlation.EventCorrelator;
import org.seleznyov.iyu.tracepipe.core.correlation.SweepResult;
import org.seleznyov.iyu.tracepipe.core.ingest.EventIngestor;
import org.seleznyov.iyu.tracepipe.core.ingest.PayloadTruncator;
import org.seleznyov.iyu.tracepipe.core.ringbuffer.EventRingBuffer;
import org.seleznyov.iyu.tracepipe.core.store.HotEventStore;
import org.seleznyov.iyu.tracepipe.core.store.QueryResult;
import org.seleznyov.iyu.tracepipe.core.store.TimeOrder;
import org.seleznyov.iyu.tracepipe.domain.model.correlation.CorrelatedEvent;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Wires producer → ingestor → ring buffer → drain loop → correlator → hot store and exposes
 * the consumer-facing query API.
 */
@Slf4j
public class TracePipeline {

    private static final long STOP_JOIN_MILLIS = TimeUnit.SECONDS.toMillis(5);

    private final TracePipelineConfiguration configuration;
    private final EventRingBuffer ringBuffer;
    private final EventIngestor ingestor;
    private final EventCorrelator correlator;
    private final HotEventStore store;
    private final CorrelationDrainLoop drainLoop;

    private Thread drainThread;
    private boolean stopped;

    public TracePipeline(TracePipelineConfiguration configuration) {
        this(configuration, Clock.systemUTC());
    }

    public TracePipeline(TracePipelineConfiguration configuration, Clock clock) {
        this.configuration = configuration;
        this.ringBuffer = new EventRingBuffer(configuration.ringBuffer());
        this.ingestor = new EventIngestor(
            ringBuffer,
            new PayloadTruncator(configuration.ingest().maxPayloadBytes()),
            configuration.enabled(),
            System::nanoTime,
            clock
        );
        this.correlator = new EventCorrelator(configuration.correlation(), clock);
        this.store = new HotEventStore(configuration.hotStore());
        this.drainLoop = new CorrelationDrainLoop(ringBuffer, correlator, store, configuration.drain());
    }

    public synchronized void start() {
        if (stopped) {
            throw new IllegalStateException("Trace pipeline has been stopped");
        }
        if (drainThread != null && drainThread.isAlive()) {
            return;
        }
        drainThread = new Thread(drainLoop, "tracepipe-drain");
        drainThread.setDaemon(true);
        drainThread.start();
        log.info("Trace pipeline started: capacity={}, policy={}, batchSize={}",
            ringBuffer.capacity(), ringBuffer.overflowPolicy(), configuration.drain().batchSize());
    }

    /**
     * Stops the drain thread, then correlates and stores whatever is still in the buffer.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        if (drainThread != null) {
            drainLoop.stop();
            try {
                drainThread.join(STOP_JOIN_MILLIS);
                if (drainThread.isAlive()) {
                    log.warn("Drain thread didn't stop in {}ms, interrupting", STOP_JOIN_MILLIS);
                    drainThread.interrupt();
                    drainThread.join(STOP_JOIN_MILLIS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while stopping the drain thread");
                return;
            }
            drainThread = null;
        }

        final long flushed = drainLoop.drainRemaining();
        drainLoop.shutdown();
        stopped = true;
        log.info("Trace pipeline stopped, flushed {} events. Final stats: {}", flushed, stats());
    }

    /**
     * Synchronously processes everything currently in the buffer on the calling thread.
     *
     * @throws IllegalStateException while the drain thread is running
     */
    public synchronized long flush() {
        if (drainThread != null) {
            throw new IllegalStateException("Cannot flush while the drain thread is running");
        }
        return drainLoop.drainRemaining();
    }

    public boolean isRunning() {
        return drainLoop.isRunning();
    }

    public SweepResult sweep() {
        return correlator.sweep();
    }

    public Optional<CorrelatedEvent> get(UUID eventId) {
        return store.get(eventId);
    }

    public QueryResult queryTimeRange(long start, long end, int limit, TimeOrder order) {
        return store.queryTimeRange(start, end, limit, order);
    }

    public QueryResult queryByProducer(String producerId, int limit) {
        return store.queryByProducer(producerId, limit);
    }

    public QueryResult queryBySymbol(String symbolKey, int limit) {
        return store.queryBySymbol(symbolKey, limit);
    }

    public QueryResult queryByCorrelation(UUID correlationId, int limit) {
        return store.queryByCorrelation(correlationId, limit);
    }

    public PipelineStats stats() {
        return new PipelineStats(
            ringBuffer.stats(),
            ingestor.stats(),
            correlator.stats(),
            drainLoop.stats(),
            store.stats()
        );
    }

    public TracePipelineConfiguration configuration() {
        return configuration;
    }

    public EventIngestor ingestor() {
        return ingestor;
    }

    public EventRingBuffer ringBuffer() {
        return ringBuffer;
    }

    public EventCorrelator correlator() {
        return correlator;
    }

    public HotEventStore store() {
        return store;
    }

    public CorrelationDrainLoop drainLoop() {
        return drainLoop;
    }
}
