package org.seleznyov.iyu.tracepipe.core.store;

import lombok.extern.slf4j.Slf4j;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.HotStoreConfiguration;
import org.seleznyov.iyu.tracepipe.domain.model.correlation.CorrelatedEvent;
import org.seleznyov.iyu.tracepipe.domain.model.event.EventKind;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory store of correlated events.
 * <p>
 * One primary table keyed by event id plus secondary indexes by monotonic timestamp, producer,
 * symbol and correlation id. A write touches the primary table first and then every index,
 * the whole update is not atomic. Each index entry is changed inside a per-key {@code compute},
 * so writers and pruning never leave an empty id set behind.
 */
@Slf4j
public class HotEventStore {

    private final int maxEvents;
    private final Duration maxAge;

    private final Map<UUID, CorrelatedEvent> events = new ConcurrentHashMap<>();
    private final ConcurrentSkipListMap<Long, NavigableSet<UUID>> timeIndex = new ConcurrentSkipListMap<>();
    private final Map<String, NavigableSet<UUID>> producerIndex = new ConcurrentHashMap<>();
    private final Map<String, NavigableSet<UUID>> symbolIndex = new ConcurrentHashMap<>();
    private final Map<UUID, NavigableSet<UUID>> correlationIndex = new ConcurrentHashMap<>();

    private final LongAdder inserted = new LongAdder();
    private final LongAdder pruned = new LongAdder();

    public HotEventStore(HotStoreConfiguration configuration) {
        this(configuration.maxEvents(), configuration.maxAge());
    }

    public HotEventStore(int maxEvents, Duration maxAge) {
        if (maxEvents <= 0) {
            throw new IllegalArgumentException("Hot store max events must be positive");
        }
        if (maxAge == null || maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("Hot store max age must be positive");
        }
        this.maxEvents = maxEvents;
        this.maxAge = maxAge;
    }

    public void put(CorrelatedEvent event) {
        final CorrelatedEvent previous = events.put(event.eventId(), event);
        if (previous != null) {
            // Повторная запись того же события - переиндексируем
            unindex(previous);
        }
        index(event);
        inserted.increment();
    }

    public void putBatch(Collection<CorrelatedEvent> batch) {
        for (CorrelatedEvent event : batch) {
            put(event);
        }
    }

    public Optional<CorrelatedEvent> get(UUID eventId) {
        return eventId == null ? Optional.empty() : Optional.ofNullable(events.get(eventId));
    }

    /**
     * Events with {@code start <= timestamp <= end}.
     */
    public QueryResult queryTimeRange(long start, long end, int limit, TimeOrder order) {
        if (start > end) {
            return QueryResult.INVALID_RANGE;
        }
        if (limit <= 0) {
            return QueryResult.INVALID_LIMIT;
        }

        NavigableMap<Long, NavigableSet<UUID>> range = timeIndex.subMap(start, true, end, true);
        if (order == TimeOrder.DESC) {
            range = range.descendingMap();
        }

        final List<CorrelatedEvent> result = new ArrayList<>(Math.min(limit, 256));
        for (NavigableSet<UUID> ids : range.values()) {
            final Set<UUID> ordered = order == TimeOrder.DESC ? ids.descendingSet() : ids;
            if (collect(ordered, result, limit, null)) {
                break;
            }
        }
        return QueryResult.ok(result);
    }

    public QueryResult queryByProducer(String producerId, int limit) {
        return queryIndex(producerIndex.get(producerId), limit, null, TimeOrder.ASC);
    }

    public QueryResult queryBySymbol(String symbolKey, int limit) {
        return queryIndex(symbolIndex.get(symbolKey), limit, null, TimeOrder.ASC);
    }

    public QueryResult queryByCorrelation(UUID correlationId, int limit) {
        return queryByCorrelation(correlationId, limit, null, TimeOrder.ASC);
    }

    /**
     * @param kinds event kinds to keep, {@code null} or empty keeps all
     */
    public QueryResult queryByCorrelation(UUID correlationId, int limit, Set<EventKind> kinds, TimeOrder order) {
        return queryIndex(correlationIndex.get(correlationId), limit, kinds, order);
    }

    /**
     * Removes every event with {@code timestamp < cutoff} from the primary table and all indexes.
     *
     * @return number of events removed
     */
    public int prune(long cutoff) {
        int removed = 0;
        for (Map.Entry<Long, NavigableSet<UUID>> bucket : timeIndex.headMap(cutoff, false).entrySet()) {
            for (UUID eventId : bucket.getValue()) {
                if (remove(eventId)) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("Pruned {} events older than {}", removed, cutoff);
        }
        return removed;
    }

    /**
     * Removes up to {@code count} events starting from the oldest timestamp.
     */
    public int pruneOldest(int count) {
        int removed = 0;
        outer:
        for (NavigableSet<UUID> ids : timeIndex.values()) {
            for (UUID eventId : ids) {
                if (removed >= count) {
                    break outer;
                }
                if (remove(eventId)) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("Pruned {} oldest events", removed);
        }
        return removed;
    }

    public int pruneOlderThan(Duration age, long nowNanos) {
        return prune(nowNanos - age.toNanos());
    }

    public int enforceMaxEvents() {
        final int excess = events.size() - maxEvents;
        return excess > 0 ? pruneOldest(excess) : 0;
    }

    /**
     * Age-based prune against {@code nowNanos} followed by the event cap.
     */
    public int enforceRetention(long nowNanos) {
        return pruneOlderThan(maxAge, nowNanos) + enforceMaxEvents();
    }

    public int size() {
        return events.size();
    }

    public StoreStats stats() {
        final Map.Entry<Long, NavigableSet<UUID>> oldest = timeIndex.firstEntry();
        final Map.Entry<Long, NavigableSet<UUID>> newest = timeIndex.lastEntry();
        return new StoreStats(
            events.size(),
            timeIndex.size(),
            producerIndex.size(),
            symbolIndex.size(),
            correlationIndex.size(),
            inserted.sum(),
            pruned.sum(),
            oldest == null ? -1L : oldest.getKey(),
            newest == null ? -1L : newest.getKey()
        );
    }

    public int maxEvents() {
        return maxEvents;
    }

    public Duration maxAge() {
        return maxAge;
    }

    boolean indexedAnywhere(UUID eventId) {
        return containsId(timeIndex.values(), eventId)
            || containsId(producerIndex.values(), eventId)
            || containsId(symbolIndex.values(), eventId)
            || containsId(correlationIndex.values(), eventId);
    }

    private boolean remove(UUID eventId) {
        final CorrelatedEvent event = events.remove(eventId);
        if (event == null) {
            return false;
        }
        unindex(event);
        pruned.increment();
        return true;
    }

    private void index(CorrelatedEvent event) {
        final UUID eventId = event.eventId();
        addTo(timeIndex, event.timestamp(), eventId);
        addTo(producerIndex, event.producerId(), eventId);
        addTo(symbolIndex, event.symbolKey(), eventId);
        addTo(correlationIndex, event.correlationId(), eventId);
    }

    private void unindex(CorrelatedEvent event) {
        final UUID eventId = event.eventId();
        removeFrom(timeIndex, event.timestamp(), eventId);
        removeFrom(producerIndex, event.producerId(), eventId);
        removeFrom(symbolIndex, event.symbolKey(), eventId);
        removeFrom(correlationIndex, event.correlationId(), eventId);
    }

    private QueryResult queryIndex(NavigableSet<UUID> ids, int limit, Set<EventKind> kinds, TimeOrder order) {
        if (limit <= 0) {
            return QueryResult.INVALID_LIMIT;
        }
        if (ids == null) {
            return QueryResult.ok(List.of());
        }
        final List<CorrelatedEvent> result = new ArrayList<>(Math.min(limit, 256));
        collect(order == TimeOrder.DESC ? ids.descendingSet() : ids, result, limit, kinds);
        return QueryResult.ok(result);
    }

    /**
     * @return {@code true} when the limit is reached
     */
    private boolean collect(Set<UUID> ids, List<CorrelatedEvent> result, int limit, Set<EventKind> kinds) {
        for (UUID eventId : ids) {
            final CorrelatedEvent event = events.get(eventId);
            // Индекс может опережать основную таблицу во время записи или удаления
            if (event == null || (kinds != null && !kinds.isEmpty() && !kinds.contains(event.kind()))) {
                continue;
            }
            result.add(event);
            if (result.size() >= limit) {
                return true;
            }
        }
        return false;
    }

    private static <K> void addTo(Map<K, NavigableSet<UUID>> index, K key, UUID eventId) {
        if (key == null) {
            return;
        }
        index.compute(key, (k, ids) -> {
            final NavigableSet<UUID> target = ids == null ? new ConcurrentSkipListSet<>() : ids;
            target.add(eventId);
            return target;
        });
    }

    private static <K> void removeFrom(Map<K, NavigableSet<UUID>> index, K key, UUID eventId) {
        if (key == null) {
            return;
        }
        index.computeIfPresent(key, (k, ids) -> {
            ids.remove(eventId);
            return ids.isEmpty() ? null : ids;
        });
    }

    private static boolean containsId(Collection<NavigableSet<UUID>> sets, UUID eventId) {
        for (NavigableSet<UUID> ids : sets) {
            if (ids.contains(eventId)) {
                return true;
            }
        }
        return false;
    }
}
