package org.seleznyov.iyu.tracepipe.shared.utils;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

public class Uuid7Utils {

    private static volatile long baseTimestampMs = System.currentTimeMillis();
    private static volatile long baseNanoTime = System.nanoTime();
    private static volatile long lastSyncNanos = System.nanoTime();
    private static final long SYNC_INTERVAL_NANOS = 10_000_000L; // 10ms

    // Последний выданный MSB, для монотонности внутри одной миллисекунды
    private static final AtomicLong LAST_MOST_SIG_BITS = new AtomicLong(0);

    private Uuid7Utils() {

    }

    public static long uuidToLong(UUID uuid) {
        return uuid.getMostSignificantBits() ^ uuid.getLeastSignificantBits();
    }

    /**
     * Генерирует UUID7 с микросекундной точностью.
     *
     * Структура:
     * - 48 бит: timestamp в миллисекундах
     * - 4 бита: версия (7)
     * - 12 бит: микросекундная часть (0-999 мкс)
     * - 2 бита: variant (10)
     * - 62 бита: random
     *
     * @return UUID версии 7
     */
    public static UUID nextUuid7() {
        return new UUID(nextMostSigBits(), nextLeastSigBits());
    }

    /**
     * Strictly increasing UUID7 across all threads of the process.
     * When two ids fall into the same microsecond the 12-bit sub-millisecond field is
     * bumped, overflowing into the timestamp if needed, so ordering by
     * {@link UUID#compareTo(UUID)} matches generation order.
     */
    public static UUID nextMonotonicUuid7() {
        while (true) {
            final long candidate = nextMostSigBits();
            final long last = LAST_MOST_SIG_BITS.get();
            final long next = candidate > last ? candidate : increment(last);
            if (LAST_MOST_SIG_BITS.compareAndSet(last, next)) {
                return new UUID(next, nextLeastSigBits());
            }
            Thread.onSpinWait();
        }
    }

    /**
     * Millisecond timestamp encoded in the upper 48 bits of a UUID7.
     */
    public static long timestampMillis(UUID uuid) {
        return uuid.getMostSignificantBits() >>> 16;
    }

    private static long nextMostSigBits() {
        long currentNanos = System.nanoTime();

        // Периодическая синхронизация (раз в 10ms)
        if (currentNanos - lastSyncNanos >= SYNC_INTERVAL_NANOS) {
            baseTimestampMs = System.currentTimeMillis();
            baseNanoTime = currentNanos;
            lastSyncNanos = currentNanos;
        }

        // Вычисляем текущий timestamp на основе nanoTime offset
        long nanoOffset = currentNanos - baseNanoTime;
        long timestamp = baseTimestampMs + (nanoOffset / 1_000_000L);

        // Используем микросекундную часть для 12-битного поля
        int microseconds = (int) ((nanoOffset % 1_000_000L) / 1000L);

        return (timestamp << 16) | (0x7L << 12) | (microseconds & 0xFFF);
    }

    private static long nextLeastSigBits() {
        return (ThreadLocalRandom.current().nextLong() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
    }

    private static long increment(long mostSigBits) {
        final long subMillis = mostSigBits & 0xFFFL;
        if (subMillis < 0xFFFL) {
            return mostSigBits + 1;
        }
        // 12 бит исчерпаны - переносим в timestamp, версия остается 7
        final long timestamp = (mostSigBits >>> 16) + 1;
        return (timestamp << 16) | (0x7L << 12);
    }
}
