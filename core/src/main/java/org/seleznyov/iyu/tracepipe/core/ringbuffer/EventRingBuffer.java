package org.seleznyov.iyu.tracepipe.core.ringbuffer;

import com.lmax.disruptor.Sequence;
import lombok.extern.slf4j.Slf4j;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.RingBufferConfiguration;
import org.seleznyov.iyu.tracepipe.domain.model.event.Event;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.concurrent.locks.LockSupport;

/**
 * Fixed-capacity MWMR ring buffer of trace events.
 * <p>
 * Producers claim a position with a CAS on {@code writePosition}; nobody ever blocks.
 * Consumers keep their own cursors and read without changing shared state. Only the owner
 * of the buffer (the drain loop) moves {@code readPosition} forward after it has processed
 * a batch, the {@link OverflowPolicy#DROP_OLDEST} policy moves it when the buffer is full.
 * <p>
 * Invariant: {@code writePosition - readPosition <= capacity}.
 * <p>
 * {@code dropped} counts positions evicted from behind {@code readPosition}. The drain loop moves
 * {@code readPosition} only after its batch is stored, so an event it has already read can still
 * be counted as dropped while it reaches the store.
 */
@Slf4j
public class EventRingBuffer {

    private static final long DROP_LOG_EVERY = 1024;

    private final int capacity;
    private final long mask;
    private final OverflowPolicy overflowPolicy;
    private final int writeAttempts;
    private final AtomicReferenceArray<Slot> slots;

    // Padded sequences - writers and readers hammer these from different cores
    private final Sequence writePosition = new Sequence(0L);
    private final Sequence readPosition = new Sequence(0L);
    private final Sequence totalWrites = new Sequence(0L);

    private final AtomicLong totalReads = new AtomicLong(0);
    private final AtomicLong droppedCount = new AtomicLong(0);
    private final AtomicLong rejectedCount = new AtomicLong(0);
    private final AtomicLong contendedCount = new AtomicLong(0);

    public EventRingBuffer(RingBufferConfiguration configuration) {
        this(configuration.capacity(), configuration.overflowPolicy(), configuration.writeAttempts());
    }

    public EventRingBuffer(int capacity, OverflowPolicy overflowPolicy, int writeAttempts) {
        if (capacity <= 0 || Integer.bitCount(capacity) != 1) {
            throw new IllegalArgumentException("Ring buffer capacity must be a power of 2, got " + capacity);
        }
        if (overflowPolicy == null) {
            throw new IllegalArgumentException("Overflow policy cannot be null");
        }
        if (writeAttempts <= 0) {
            throw new IllegalArgumentException("Write attempts must be positive");
        }
        this.capacity = capacity;
        this.mask = capacity - 1L;
        this.overflowPolicy = overflowPolicy;
        this.writeAttempts = writeAttempts;
        this.slots = new AtomicReferenceArray<>(capacity);

        log.info("Created event ring buffer: capacity={}, overflowPolicy={}", capacity, overflowPolicy);
    }

    /**
     * Multiple writers - optimistic read, CAS commit, retry on conflict.
     * <p>
     * Only a lost CAS on the write position counts against {@code writeAttempts}. Evicting the
     * oldest event under {@link OverflowPolicy#DROP_OLDEST} always leads to another attempt.
     */
    public WriteResult write(Event event) {
        int attempt = 0;
        while (attempt < writeAttempts) {
            final long currentWritePosition = writePosition.get();
            final long currentReadPosition = readPosition.get();

            if (currentWritePosition - currentReadPosition >= capacity) {
                if (overflowPolicy != OverflowPolicy.DROP_OLDEST) {
                    return onFull();
                }
                // Вытесняем самое старое событие и пробуем снова
                if (readPosition.compareAndSet(currentReadPosition, currentReadPosition + 1)) {
                    onDropped();
                }
                continue;
            }

            if (!writePosition.compareAndSet(currentWritePosition, currentWritePosition + 1)) {
                // Другой писатель опередил нас
                backoff(attempt++);
                continue;
            }

            // Слот захвачен - публикуем, если его еще не перезаписал более новый писатель
            final Slot claimed = new Slot(currentWritePosition, event);
            slots.accumulateAndGet(
                index(currentWritePosition),
                claimed,
                (current, candidate) -> current == null || current.position() < candidate.position()
                    ? candidate
                    : current
            );
            totalWrites.incrementAndGet();
            return WriteResult.OK;
        }

        contendedCount.incrementAndGet();
        log.debug("Ring buffer write gave up after {} attempts", writeAttempts);
        return WriteResult.CONTENDED;
    }

    /**
     * Reads the event at {@code position}. Positions already overwritten or dropped are
     * clamped forward to the oldest valid one; positions at or past the write position are empty.
     */
    public ReadResult read(long position) {
        long current = Math.max(position, readPosition.get());

        while (true) {
            if (current >= writePosition.get()) {
                return ReadResult.empty(current);
            }

            final Slot slot = slots.get(index(current));
            if (slot != null && slot.position() == current) {
                totalReads.incrementAndGet();
                return new ReadResult(slot.event(), current + 1);
            }

            if (slot != null && slot.position() > current) {
                // Слот уже перезаписан - догоняем readPosition
                final long oldestValid = readPosition.get();
                current = Math.max(oldestValid, slot.position() - mask);
                continue;
            }

            // Позиция захвачена, но событие еще не опубликовано
            return ReadResult.empty(current);
        }
    }

    public BatchRead readBatch(long position, int maxEvents) {
        if (maxEvents <= 0) {
            throw new IllegalArgumentException("Max batch size must be positive");
        }
        final List<Event> events = new ArrayList<>(Math.min(maxEvents, capacity));
        long current = position;

        while (events.size() < maxEvents) {
            final ReadResult result = read(current);
            current = result.nextPosition();
            if (result.isEmpty()) {
                break;
            }
            events.add(result.event());
        }

        return new BatchRead(events, current);
    }

    /**
     * Releases slots up to {@code position} (exclusive). Never moves backwards and never
     * past the write position.
     *
     * @return read position after the call
     */
    public long advanceReadPosition(long position) {
        while (true) {
            final long currentReadPosition = readPosition.get();
            final long target = Math.min(position, writePosition.get());
            if (target <= currentReadPosition) {
                return currentReadPosition;
            }
            if (readPosition.compareAndSet(currentReadPosition, target)) {
                return target;
            }
            Thread.onSpinWait();
        }
    }

    public RingBufferStats stats() {
        final long currentReadPosition = readPosition.get();
        final long currentWritePosition = writePosition.get();
        final long occupancy = Math.max(0, Math.min(capacity, currentWritePosition - currentReadPosition));

        return new RingBufferStats(
            capacity,
            totalWrites.get(),
            totalReads.get(),
            droppedCount.get(),
            rejectedCount.get(),
            contendedCount.get(),
            occupancy,
            currentWritePosition,
            currentReadPosition
        );
    }

    public int capacity() {
        return capacity;
    }

    public OverflowPolicy overflowPolicy() {
        return overflowPolicy;
    }

    public long writePosition() {
        return writePosition.get();
    }

    public long readPosition() {
        return readPosition.get();
    }

    private WriteResult onFull() {
        if (overflowPolicy == OverflowPolicy.DROP_NEWEST) {
            onDropped();
        } else {
            rejectedCount.incrementAndGet();
        }
        return WriteResult.FULL;
    }

    private void onDropped() {
        final long dropped = droppedCount.incrementAndGet();
        if (dropped % DROP_LOG_EVERY == 1) {
            log.warn("Ring buffer is full, policy={}, dropped so far: {}", overflowPolicy, dropped);
        }
    }

    private int index(long position) {
        return (int) (position & mask);
    }

    private static void backoff(int attempt) {
        if (attempt < 20) {
            Thread.onSpinWait();
        } else if (attempt < 50) {
            Thread.yield();
        } else {
            LockSupport.parkNanos(1_000L << Math.min(attempt - 50, 10));
        }
    }

    private record Slot(long position, Event event) {

    }
}
