package org.seleznyov.iyu.tracepipe.core.correlation;

import lombok.extern.slf4j.Slf4j;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.CorrelationConfiguration;
import org.seleznyov.iyu.tracepipe.domain.model.correlation.CausalLink;
import org.seleznyov.iyu.tracepipe.domain.model.correlation.Confidence;
import org.seleznyov.iyu.tracepipe.domain.model.correlation.CorrelatedEvent;
import org.seleznyov.iyu.tracepipe.domain.model.correlation.CorrelationFlag;
import org.seleznyov.iyu.tracepipe.domain.model.correlation.CorrelationType;
import org.seleznyov.iyu.tracepipe.domain.model.correlation.RelationKind;
import org.seleznyov.iyu.tracepipe.domain.model.event.Event;
import org.seleznyov.iyu.tracepipe.domain.model.event.EventKind;
import org.seleznyov.iyu.tracepipe.domain.model.event.MessagePayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.ProcessPayload;
import org.seleznyov.iyu.tracepipe.shared.utils.Uuid7Utils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reconstructs causal relationships in the drained event stream.
 * <p>
 * State tables:
 * - call stacks: producer id to the stack of open function correlations
 * - pending messages: message signature to the sends still waiting for a receive
 * - metadata: correlation id to {@link CorrelationMetadata}
 * - links: correlation id to its causal links
 * <p>
 * Batches are correlated by one writer at a time. The cleanup sweep runs on its own timer and only
 * removes single keys atomically, so it never waits for a batch.
 */
@Slf4j
public class EventCorrelator {

    private static final int SWEEP_BUDGET_CHECK_EVERY = 256;
    private static final double CAP_EVICTION_TARGET = 0.9;

    private final long ttlMillis;
    private final long sweepBudgetNanos;
    private final int maxTrackedCorrelations;
    private final Clock clock;

    private final Map<String, ProducerCallStack> callStacks = new ConcurrentHashMap<>();
    private final PendingMessageRegistry pendingMessages = new PendingMessageRegistry();
    private final Map<UUID, CorrelationMetadata> metadata = new ConcurrentHashMap<>();
    private final Map<UUID, List<CausalLink>> links = new ConcurrentHashMap<>();
    private final Map<String, SpawnRecord> spawns = new ConcurrentHashMap<>();

    private final ReentrantLock writerLock = new ReentrantLock();
    private final ReentrantLock sweepLock = new ReentrantLock();

    private final LongAdder eventsCorrelated = new LongAdder();
    private final LongAdder fullConfidence = new LongAdder();
    private final LongAdder partialConfidence = new LongAdder();
    private final LongAdder noConfidence = new LongAdder();
    private final LongAdder orphanExits = new LongAdder();
    private final LongAdder unmatchedReceives = new LongAdder();
    private final LongAdder malformedEvents = new LongAdder();
    private final LongAdder sweeps = new LongAdder();

    public EventCorrelator(CorrelationConfiguration configuration, Clock clock) {
        if (configuration.ttl() == null || configuration.ttl().isNegative() || configuration.ttl().isZero()) {
            throw new IllegalArgumentException("Correlation TTL must be positive");
        }
        if (configuration.maxTrackedCorrelations() <= 0) {
            throw new IllegalArgumentException("Max tracked correlations must be positive");
        }
        this.ttlMillis = configuration.ttl().toMillis();
        this.sweepBudgetNanos = configuration.sweepTimeBudget() == null
            ? Long.MAX_VALUE
            : configuration.sweepTimeBudget().toNanos();
        this.maxTrackedCorrelations = configuration.maxTrackedCorrelations();
        this.clock = clock;
    }

    /**
     * Correlates a drained batch in order. Checks the interrupt flag between events, an interrupted
     * batch ends with {@link CancellationException} and keeps the state of the events already done.
     */
    public List<CorrelatedEvent> correlate(List<Event> batch) {
        final List<CorrelatedEvent> result = new ArrayList<>(batch.size());

        writerLock.lock();
        try {
            for (Event event : batch) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException(
                        "Correlation interrupted after " + result.size() + " of " + batch.size() + " events"
                    );
                }
                result.add(correlateEvent(event));
            }
        } finally {
            writerLock.unlock();
        }

        if (metadata.size() > maxTrackedCorrelations) {
            log.warn("Tracked correlations {} exceed the soft cap {}, running cleanup",
                metadata.size(), maxTrackedCorrelations);
            sweep();
        }
        return result;
    }

    public CorrelatedEvent correlate(Event event) {
        writerLock.lock();
        try {
            return correlateEvent(event);
        } finally {
            writerLock.unlock();
        }
    }

    /**
     * Time-boxed cleanup of correlation state older than the TTL, then eviction of the oldest
     * correlations while the tracked count is over the soft cap.
     */
    public SweepResult sweep() {
        if (!sweepLock.tryLock()) {
            return SweepResult.SKIPPED;
        }
        try {
            final long startNanos = System.nanoTime();
            final long deadline = sweepBudgetNanos == Long.MAX_VALUE ? Long.MAX_VALUE : startNanos + sweepBudgetNanos;
            final long cutoff = clock.millis() - ttlMillis;

            final SweepCounter counter = new SweepCounter(deadline);

            for (CorrelationMetadata entry : metadata.values()) {
                if (counter.exhausted()) {
                    break;
                }
                if (entry.createdAtMillis() < cutoff && metadata.remove(entry.correlationId(), entry)) {
                    counter.metadataRemoved++;
                    if (links.remove(entry.correlationId()) != null) {
                        counter.linksRemoved++;
                    }
                }
            }

            // Ссылки без метаданных (метаданные удалены раньше или гонка с correlate)
            for (UUID correlationId : links.keySet()) {
                if (counter.exhausted()) {
                    break;
                }
                if (!metadata.containsKey(correlationId) && links.remove(correlationId) != null) {
                    counter.linksRemoved++;
                }
            }

            for (MessageSignature signature : pendingMessages.signatures()) {
                if (counter.exhausted()) {
                    break;
                }
                counter.pendingRemoved += pendingMessages.removeOlderThan(signature, cutoff);
            }

            for (ProducerCallStack stack : callStacks.values()) {
                if (counter.exhausted()) {
                    break;
                }
                if (stack.lastActivityMillis() < cutoff && callStacks.remove(stack.producerId(), stack)) {
                    counter.callStacksRemoved++;
                }
            }

            for (Map.Entry<String, SpawnRecord> spawn : spawns.entrySet()) {
                if (counter.exhausted()) {
                    break;
                }
                if (spawn.getValue().createdAtMillis() < cutoff && spawns.remove(spawn.getKey(), spawn.getValue())) {
                    counter.spawnsRemoved++;
                }
            }

            if (!counter.exhausted() && metadata.size() > maxTrackedCorrelations) {
                counter.evictedOverCap = evictOldest(metadata.size() - (int) (maxTrackedCorrelations * CAP_EVICTION_TARGET));
            }

            sweeps.increment();
            final SweepResult result = new SweepResult(
                counter.metadataRemoved,
                counter.linksRemoved,
                counter.pendingRemoved,
                counter.callStacksRemoved,
                counter.spawnsRemoved,
                counter.evictedOverCap,
                counter.exhausted,
                false,
                (System.nanoTime() - startNanos) / 1_000_000
            );

            if (result.budgetExhausted()) {
                log.warn("Correlation sweep hit its time budget, removed {} entries so far", result.totalRemoved());
            } else if (result.totalRemoved() > 0) {
                log.debug("Correlation sweep removed {} entries in {}ms", result.totalRemoved(), result.durationMillis());
            }
            return result;
        } finally {
            sweepLock.unlock();
        }
    }

    public Optional<CorrelationMetadata> metadata(UUID correlationId) {
        return Optional.ofNullable(metadata.get(correlationId));
    }

    public List<CausalLink> links(UUID correlationId) {
        return links.getOrDefault(correlationId, List.of());
    }

    public int callStackDepth(String producerId) {
        final ProducerCallStack stack = callStacks.get(producerId);
        return stack == null ? 0 : stack.depth();
    }

    public int pendingMessageCount() {
        return pendingMessages.size();
    }

    public int trackedCorrelations() {
        return metadata.size();
    }

    public CorrelatorStats stats() {
        return new CorrelatorStats(
            eventsCorrelated.sum(),
            metadata.size(),
            links.size(),
            pendingMessages.size(),
            callStacks.size(),
            spawns.size(),
            new ConfidenceDistribution(fullConfidence.sum(), partialConfidence.sum(), noConfidence.sum()),
            orphanExits.sum(),
            unmatchedReceives.sum(),
            malformedEvents.sum(),
            sweeps.sum()
        );
    }

    private CorrelatedEvent correlateEvent(Event event) {
        final Event identified = event.eventId() == null
            ? event.toBuilder().eventId(Uuid7Utils.nextMonotonicUuid7()).build()
            : event;

        final CorrelatedEvent correlated = isMalformed(identified)
            ? correlateMalformed(identified)
            : switch (identified.kind()) {
                case FUNCTION_ENTRY -> correlateEntry(identified);
                case FUNCTION_EXIT -> correlateExit(identified);
                case MESSAGE_SEND -> correlateSend(identified);
                case MESSAGE_RECEIVE -> correlateReceive(identified);
                case PROCESS_SPAWN -> correlateSpawn(identified);
                case PROCESS_EXIT -> correlateProcessExit(identified);
                case STATE_CHANGE, ERROR, METRIC -> correlateInherited(identified);
            };

        eventsCorrelated.increment();
        if (correlated.confidence() >= Confidence.FULL) {
            fullConfidence.increment();
        } else if (correlated.confidence() > Confidence.NONE) {
            partialConfidence.increment();
        } else {
            noConfidence.increment();
        }
        return correlated;
    }

    private CorrelatedEvent correlateEntry(Event event) {
        final long now = clock.millis();
        final ProducerCallStack stack = stackOf(event.producerId(), now);
        final List<CausalLink> eventLinks = new ArrayList<>(2);

        UUID parentId = stack.peek();
        if (parentId == null) {
            final SpawnRecord spawn = spawns.remove(event.producerId());
            if (spawn != null) {
                parentId = spawn.spawnCorrelationId();
                eventLinks.add(new CausalLink(RelationKind.SPAWNED_BY, parentId));
            } else {
                parentId = event.parentId();
            }
        }
        if (parentId != null) {
            eventLinks.add(new CausalLink(RelationKind.CHILD_OF, parentId));
        }

        final UUID correlationId = event.correlationId() != null
            ? event.correlationId()
            : Uuid7Utils.nextMonotonicUuid7();
        stack.push(correlationId);

        final CorrelationMetadata entry = track(correlationId, parentId, CorrelationType.FUNCTION_CALL, Confidence.FULL, now);
        appendLinks(correlationId, eventLinks);

        return new CorrelatedEvent(
            event, correlationId, entry.parentId(), entry.rootId(), eventLinks,
            CorrelationType.FUNCTION_CALL, Confidence.FULL, Set.of()
        );
    }

    private CorrelatedEvent correlateExit(Event event) {
        final long now = clock.millis();
        final ProducerCallStack stack = stackOf(event.producerId(), now);
        final UUID correlationId = stack.pop();

        if (correlationId == null) {
            orphanExits.increment();
            final UUID orphanId = Uuid7Utils.nextMonotonicUuid7();
            track(orphanId, null, CorrelationType.ORPHAN_RETURN, Confidence.PARTIAL, now);
            log.debug("Orphan function exit on producer {}, symbol {}", event.producerId(), event.symbolKey());
            return new CorrelatedEvent(
                event, orphanId, null, orphanId, List.of(),
                CorrelationType.ORPHAN_RETURN, Confidence.PARTIAL, EnumSet.of(CorrelationFlag.ORPHAN_EXIT)
            );
        }

        final CorrelationMetadata entry = metadata.get(correlationId);
        final UUID parentId = entry != null ? entry.parentId() : stack.peek();
        final UUID rootId = entry != null ? entry.rootId() : resolveRoot(correlationId, parentId);

        return new CorrelatedEvent(
            event, correlationId, parentId, rootId, List.of(),
            CorrelationType.FUNCTION_RETURN, Confidence.FULL, Set.of()
        );
    }

    private CorrelatedEvent correlateSend(Event event) {
        final long now = clock.millis();
        final MessagePayload message = (MessagePayload) event.payload();
        final ProducerCallStack stack = stackOf(event.producerId(), now);

        final UUID correlationId = Uuid7Utils.nextMonotonicUuid7();
        final CorrelationMetadata entry = track(correlationId, stack.peek(), CorrelationType.MESSAGE_SEND, Confidence.FULL, now);
        pendingMessages.register(sendSignature(event, message), new PendingMessage(correlationId, now));

        return new CorrelatedEvent(
            event, correlationId, entry.parentId(), entry.rootId(), List.of(),
            CorrelationType.MESSAGE_SEND, Confidence.FULL, Set.of()
        );
    }

    private CorrelatedEvent correlateReceive(Event event) {
        final long now = clock.millis();
        final MessagePayload message = (MessagePayload) event.payload();
        final ProducerCallStack stack = stackOf(event.producerId(), now);

        final UUID correlationId = Uuid7Utils.nextMonotonicUuid7();
        final PendingMessage send = pendingMessages.take(receiveSignature(event, message));

        if (send == null) {
            unmatchedReceives.increment();
            final CorrelationMetadata entry = track(
                correlationId, stack.peek(), CorrelationType.UNMATCHED_RECEIVE, Confidence.PARTIAL, now
            );
            return new CorrelatedEvent(
                event, correlationId, entry.parentId(), entry.rootId(), List.of(),
                CorrelationType.UNMATCHED_RECEIVE, Confidence.PARTIAL, EnumSet.of(CorrelationFlag.NO_SEND_MATCH)
            );
        }

        final List<CausalLink> eventLinks = List.of(new CausalLink(RelationKind.RECEIVES, send.correlationId()));
        final CorrelationMetadata entry = track(correlationId, stack.peek(), CorrelationType.MESSAGE_RECEIVE, Confidence.FULL, now);
        appendLinks(correlationId, eventLinks);
        stack.lastReceive(correlationId);

        return new CorrelatedEvent(
            event, correlationId, entry.parentId(), entry.rootId(), eventLinks,
            CorrelationType.MESSAGE_RECEIVE, Confidence.FULL, Set.of()
        );
    }

    private CorrelatedEvent correlateSpawn(Event event) {
        final long now = clock.millis();
        final ProcessPayload process = (ProcessPayload) event.payload();
        final ProducerCallStack stack = stackOf(event.producerId(), now);

        final UUID correlationId = Uuid7Utils.nextMonotonicUuid7();
        final CorrelationMetadata entry = track(correlationId, stack.peek(), CorrelationType.PROCESS_LIFECYCLE, Confidence.FULL, now);
        spawns.put(process.childProducerId(), new SpawnRecord(correlationId, event.producerId(), now));

        return new CorrelatedEvent(
            event, correlationId, entry.parentId(), entry.rootId(), List.of(),
            CorrelationType.PROCESS_LIFECYCLE, Confidence.FULL, Set.of()
        );
    }

    private CorrelatedEvent correlateProcessExit(Event event) {
        final long now = clock.millis();
        final ProcessPayload process = (ProcessPayload) event.payload();
        final String exitedProducer = process.childProducerId() != null ? process.childProducerId() : event.producerId();

        final ProducerCallStack stack = callStacks.remove(exitedProducer);
        spawns.remove(exitedProducer);

        final UUID openCorrelation = stack == null ? null : stack.peek();
        final UUID correlationId = openCorrelation != null ? openCorrelation : Uuid7Utils.nextMonotonicUuid7();
        final CorrelationMetadata entry = openCorrelation != null
            ? metadataOrTrack(openCorrelation, CorrelationType.PROCESS_LIFECYCLE, now)
            : track(correlationId, null, CorrelationType.PROCESS_LIFECYCLE, Confidence.FULL, now);

        if (stack != null && stack.depth() > 0) {
            log.debug("Producer {} exited with {} open calls", exitedProducer, stack.depth());
        }

        return new CorrelatedEvent(
            event, correlationId, entry.parentId(), entry.rootId(), List.of(),
            CorrelationType.PROCESS_LIFECYCLE, Confidence.FULL, Set.of()
        );
    }

    /**
     * State change, error and metric: the producer hint wins, then the open call, otherwise a new chain.
     */
    private CorrelatedEvent correlateInherited(Event event) {
        final long now = clock.millis();
        final ProducerCallStack stack = stackOf(event.producerId(), now);

        final UUID inheritedId = event.correlationId() != null ? event.correlationId() : stack.peek();
        final UUID correlationId;
        final CorrelationType type;
        final CorrelationMetadata entry;

        if (inheritedId != null) {
            correlationId = inheritedId;
            type = CorrelationType.INHERITED;
            entry = metadataOrTrack(inheritedId, CorrelationType.INHERITED, now);
        } else {
            correlationId = Uuid7Utils.nextMonotonicUuid7();
            type = CorrelationType.NEW_CHAIN;
            entry = track(correlationId, null, CorrelationType.NEW_CHAIN, Confidence.FULL, now);
        }

        List<CausalLink> eventLinks = List.of();
        if (event.kind() == EventKind.STATE_CHANGE) {
            final UUID trigger = stack.lastReceive();
            if (trigger != null && metadata.containsKey(trigger)) {
                eventLinks = List.of(new CausalLink(RelationKind.TRIGGERED_BY, trigger));
                appendLinks(correlationId, eventLinks);
            }
        }

        return new CorrelatedEvent(
            event, correlationId, entry.parentId(), entry.rootId(), eventLinks,
            type, Confidence.FULL, Set.of()
        );
    }

    private CorrelatedEvent correlateMalformed(Event event) {
        malformedEvents.increment();
        final UUID correlationId = Uuid7Utils.nextMonotonicUuid7();
        track(correlationId, null, CorrelationType.MALFORMED, Confidence.NONE, clock.millis());
        log.debug("Malformed event {}: kind={}, producer={}", event.eventId(), event.kind(), event.producerId());

        return new CorrelatedEvent(
            event, correlationId, null, correlationId, List.of(),
            CorrelationType.MALFORMED, Confidence.NONE, EnumSet.of(CorrelationFlag.MALFORMED)
        );
    }

    private boolean isMalformed(Event event) {
        if (event.kind() == null || event.producerId() == null || event.producerId().isBlank()) {
            return true;
        }
        if (!event.kind().accepts(event.payload())) {
            return true;
        }
        if (event.payload() instanceof MessagePayload message) {
            return event.kind() == EventKind.MESSAGE_SEND
                ? message.receiverId() == null
                : message.senderId() == null;
        }
        if (event.kind() == EventKind.PROCESS_SPAWN) {
            return ((ProcessPayload) event.payload()).childProducerId() == null;
        }
        return false;
    }

    private static MessageSignature sendSignature(Event event, MessagePayload message) {
        final String sender = message.senderId() != null ? message.senderId() : event.producerId();
        return new MessageSignature(sender, message.receiverId(), message.contentHash());
    }

    private static MessageSignature receiveSignature(Event event, MessagePayload message) {
        final String receiver = message.receiverId() != null ? message.receiverId() : event.producerId();
        return new MessageSignature(message.senderId(), receiver, message.contentHash());
    }

    private ProducerCallStack stackOf(String producerId, long now) {
        final ProducerCallStack stack = callStacks.computeIfAbsent(producerId, id -> new ProducerCallStack(id, now));
        stack.touch(now);
        return stack;
    }

    private CorrelationMetadata track(UUID correlationId, UUID parentId, CorrelationType type, double confidence, long now) {
        final CorrelationMetadata created = new CorrelationMetadata(
            correlationId, parentId, resolveRoot(correlationId, parentId), now, type, confidence
        );
        final CorrelationMetadata existing = metadata.putIfAbsent(correlationId, created);
        return existing != null ? existing : created;
    }

    private CorrelationMetadata metadataOrTrack(UUID correlationId, CorrelationType type, long now) {
        final CorrelationMetadata existing = metadata.get(correlationId);
        return existing != null ? existing : track(correlationId, null, type, Confidence.FULL, now);
    }

    /**
     * Follows parent ids to the origin of the chain. Stops at the first ancestor with a resolved root.
     */
    private UUID resolveRoot(UUID correlationId, UUID parentId) {
        if (parentId == null) {
            return correlationId;
        }
        final Set<UUID> visited = new HashSet<>();
        visited.add(correlationId);

        UUID current = parentId;
        while (visited.add(current)) {
            final CorrelationMetadata parent = metadata.get(current);
            if (parent == null) {
                return current;
            }
            if (parent.rootId() != null) {
                return parent.rootId();
            }
            if (parent.parentId() == null) {
                return current;
            }
            current = parent.parentId();
        }
        // Цикл в подсказках продюсера
        return current;
    }

    private void appendLinks(UUID correlationId, List<CausalLink> newLinks) {
        if (newLinks.isEmpty()) {
            return;
        }
        links.compute(correlationId, (id, existing) -> {
            if (existing == null) {
                return List.copyOf(newLinks);
            }
            final List<CausalLink> merged = new ArrayList<>(existing.size() + newLinks.size());
            merged.addAll(existing);
            merged.addAll(newLinks);
            return List.copyOf(merged);
        });
    }

    private int evictOldest(int count) {
        if (count <= 0) {
            return 0;
        }
        final List<CorrelationMetadata> oldest = metadata.values().stream()
            .sorted(Comparator.comparingLong(CorrelationMetadata::createdAtMillis))
            .limit(count)
            .toList();

        int evicted = 0;
        for (CorrelationMetadata entry : oldest) {
            if (metadata.remove(entry.correlationId(), entry)) {
                links.remove(entry.correlationId());
                evicted++;
            }
        }
        log.info("Evicted {} oldest correlations over the soft cap of {}", evicted, maxTrackedCorrelations);
        return evicted;
    }

    private static final class SweepCounter {

        private final long deadlineNanos;
        private int iterations;
        private boolean exhausted;

        private int metadataRemoved;
        private int linksRemoved;
        private int pendingRemoved;
        private int callStacksRemoved;
        private int spawnsRemoved;
        private int evictedOverCap;

        private SweepCounter(long deadlineNanos) {
            this.deadlineNanos = deadlineNanos;
        }

        private boolean exhausted() {
            if (exhausted) {
                return true;
            }
            if (++iterations % SWEEP_BUDGET_CHECK_EVERY == 0
                && deadlineNanos != Long.MAX_VALUE
                && System.nanoTime() - deadlineNanos > 0) {
                exhausted = true;
            }
            return exhausted;
        }
    }
}
