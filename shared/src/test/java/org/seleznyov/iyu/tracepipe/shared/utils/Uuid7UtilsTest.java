package org.seleznyov.iyu.tracepipe.shared.utils;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class Uuid7UtilsTest {

    @Test
    void shouldGenerateVersion7Uuid() {
        UUID uuid = Uuid7Utils.nextUuid7();

        assertThat(uuid.version()).isEqualTo(7);
        assertThat(uuid.variant()).isEqualTo(2);
    }

    @Test
    void shouldEncodeCurrentTimestamp() {
        long before = System.currentTimeMillis();
        UUID uuid = Uuid7Utils.nextUuid7();
        long after = System.currentTimeMillis();

        // Базовый timestamp синхронизируется раз в 10ms
        assertThat(Uuid7Utils.timestampMillis(uuid)).isBetween(before - 20, after + 20);
    }

    @Test
    void monotonicIdsShouldBeStrictlyIncreasing() {
        UUID previous = Uuid7Utils.nextMonotonicUuid7();
        for (int i = 0; i < 100_000; i++) {
            UUID next = Uuid7Utils.nextMonotonicUuid7();
            assertThat(next.getMostSignificantBits()).isGreaterThan(previous.getMostSignificantBits());
            assertThat(next.version()).isEqualTo(7);
            previous = next;
        }
    }

    @Test
    void monotonicIdsShouldBeUniqueAcrossThreads() throws Exception {
        int threads = 4;
        int perThread = 20_000;
        Set<UUID> ids = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                start.await();
                List<UUID> local = new ArrayList<>(perThread);
                for (int i = 0; i < perThread; i++) {
                    local.add(Uuid7Utils.nextMonotonicUuid7());
                }
                ids.addAll(local);
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(ids).hasSize(threads * perThread);
    }

    @Test
    void uuidToLongShouldFoldBothHalves() {
        UUID uuid = new UUID(0x0F0F0F0F0F0F0F0FL, 0xF0F0F0F0F0F0F0F0L);

        assertThat(Uuid7Utils.uuidToLong(uuid)).isEqualTo(-1L);
    }

    @Test
    void plainGeneratorShouldProduceDistinctIds() {
        Set<UUID> ids = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            ids.add(Uuid7Utils.nextUuid7());
        }

        assertThat(ids).hasSize(10_000);
    }
}
