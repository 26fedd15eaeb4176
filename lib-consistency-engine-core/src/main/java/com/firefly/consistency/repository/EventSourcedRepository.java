/*
 * Copyright 2025 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.firefly.consistency.repository;

import com.firefly.consistency.aggregate.Aggregate;
import com.firefly.consistency.aggregate.AggregateEvent;
import com.firefly.consistency.aggregate.DomainEvent;
import com.firefly.consistency.aggregate.EventHandlers;
import com.firefly.consistency.eventsourcing.AppendResult;
import com.firefly.consistency.eventsourcing.EventStore;
import com.firefly.consistency.eventsourcing.Snapshot;
import com.firefly.consistency.eventsourcing.SnapshotStore;
import com.firefly.consistency.eventsourcing.SourcedEvent;
import com.firefly.consistency.outbox.OutboxMessage;
import com.firefly.consistency.serialization.EventSerializer;
import com.firefly.consistency.serialization.SerializedPayload;
import com.firefly.consistency.util.LogFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Loads and saves aggregates of one type.
 *
 * <p>{@link #load(String)} replays the latest snapshot (if any) plus the events after it.
 * {@link #save(Aggregate)} appends the uncommitted events together with one outbox message
 * per event in a single atomic store call, so no event is stored without its outbox row.
 * A {@link AppendResult.ConcurrencyConflict} is returned, not thrown; the aggregate keeps
 * its uncommitted events and the caller reloads and retries.
 *
 * @param <A> aggregate type
 * @param <S> aggregate state type
 */
public class EventSourcedRepository<A extends Aggregate<S>, S> {
    private static final Logger log = LoggerFactory.getLogger(EventSourcedRepository.class);

    private final String aggregateType;
    private final Function<String, A> factory;
    private final EventHandlers<S> handlers;
    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final EventSerializer serializer;
    private final int snapshotFrequency;
    private final boolean publishEvents;
    private final BiFunction<String, String, String> topicResolver;
    private final Clock clock;

    private EventSourcedRepository(Builder<A, S> b) {
        this.aggregateType = Objects.requireNonNull(b.aggregateType, "aggregateType");
        this.factory = Objects.requireNonNull(b.factory, "factory");
        this.handlers = Objects.requireNonNull(b.handlers, "handlers");
        this.eventStore = Objects.requireNonNull(b.eventStore, "eventStore");
        this.serializer = Objects.requireNonNull(b.serializer, "serializer");
        this.snapshotStore = b.snapshotStore;
        this.snapshotFrequency = b.snapshotFrequency;
        this.publishEvents = b.publishEvents;
        this.topicResolver = b.topicResolver != null ? b.topicResolver : (type, eventType) -> type;
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        if (snapshotFrequency > 0 && snapshotStore == null) {
            throw new IllegalArgumentException("snapshotFrequency requires a SnapshotStore");
        }
    }

    public static <A extends Aggregate<S>, S> Builder<A, S> builder(String aggregateType,
                                                                    Function<String, A> factory,
                                                                    EventHandlers<S> handlers) {
        return new Builder<>(aggregateType, factory, handlers);
    }

    public String aggregateType() {
        return aggregateType;
    }

    /**
     * Rebuilds the aggregate from its snapshot and event stream.
     * Emits nothing if the aggregate has never been saved.
     */
    public Mono<A> load(String id) {
        return loadSnapshot(id).flatMap(snapshot -> {
            A aggregate = factory.apply(id);
            snapshot.ifPresent(r -> aggregate.restore(r.version(), r.state()));
            long from = snapshot.map(Restored::version).orElse(0L);
            return eventStore.load(id, from)
                    .map(this::toAggregateEvent)
                    .collectList()
                    .flatMap(events -> {
                        if (events.isEmpty() && snapshot.isEmpty()) {
                            return Mono.empty();
                        }
                        aggregate.loadFromHistory(events);
                        return Mono.just(aggregate);
                    });
        });
    }

    /** Like {@link #load(String)} but returns a fresh aggregate when none is stored. */
    public Mono<A> loadOrCreate(String id) {
        return load(id).switchIfEmpty(Mono.fromSupplier(() -> factory.apply(id)));
    }

    public Mono<Boolean> exists(String id) {
        return eventStore.currentVersion(id).map(v -> v > 0);
    }

    /**
     * Appends the aggregate's uncommitted events (and their outbox messages) with the
     * aggregate's committed version as expected version.
     */
    public Mono<AppendResult> save(A aggregate) {
        return Mono.defer(() -> {
            List<AggregateEvent> pending = aggregate.uncommittedEvents();
            long expected = aggregate.committedVersion();
            List<SourcedEvent> events = pending.stream().map(e -> toSourcedEvent(aggregate, e)).toList();
            List<OutboxMessage> outbox = publishEvents
                    ? events.stream().map(this::toOutboxMessage).toList()
                    : List.of();
            return eventStore.append(aggregate.id(), expected, events, outbox)
                    .flatMap(result -> {
                        if (result instanceof AppendResult.Appended appended) {
                            if (!pending.isEmpty()) {
                                aggregate.clearUncommitted();
                            }
                            return maybeSnapshot(aggregate, expected, appended.version()).thenReturn(result);
                        }
                        AppendResult.ConcurrencyConflict c = (AppendResult.ConcurrencyConflict) result;
                        log.info(LogFormat.json(
                                "repository_event", "concurrency_conflict",
                                "aggregate_type", aggregateType,
                                "aggregate_id", c.aggregateId(),
                                "expected_version", Long.toString(c.expectedVersion()),
                                "actual_version", Long.toString(c.actualVersion())
                        ));
                        return Mono.just(result);
                    });
        });
    }

    private Mono<Optional<Restored<S>>> loadSnapshot(String id) {
        if (snapshotStore == null) {
            return Mono.just(Optional.empty());
        }
        return snapshotStore.loadSnapshot(id)
                .map(this::decode)
                .defaultIfEmpty(Optional.empty());
    }

    // unreadable snapshots are skipped; the full stream is authoritative
    private Optional<Restored<S>> decode(Snapshot snapshot) {
        try {
            S state = serializer.deserializeState(snapshot.state(), handlers.stateType());
            return Optional.of(new Restored<>(snapshot.version(), state));
        } catch (RuntimeException e) {
            log.warn("Ignoring unreadable snapshot of {} at version {}", snapshot.aggregateId(), snapshot.version(), e);
            return Optional.empty();
        }
    }

    private Mono<Boolean> maybeSnapshot(A aggregate, long previousVersion, long newVersion) {
        if (snapshotFrequency <= 0 || previousVersion / snapshotFrequency == newVersion / snapshotFrequency) {
            return Mono.just(false);
        }
        return Mono.defer(() -> snapshotStore.saveSnapshot(new Snapshot(aggregate.id(), newVersion,
                        serializer.serializeState(aggregate.state()), clock.instant())))
                .doOnSuccess(written -> log.debug("Snapshot of {} at version {} written={}", aggregate.id(), newVersion, written))
                .onErrorResume(e -> {
                    log.warn("Snapshot of {} at version {} failed; the commit is unaffected", aggregate.id(), newVersion, e);
                    return Mono.just(false);
                });
    }

    private SourcedEvent toSourcedEvent(A aggregate, AggregateEvent event) {
        SerializedPayload p = serializer.serialize(event.payload());
        return new SourcedEvent(event.eventId(), aggregateType, aggregate.id(), event.version(),
                event.eventType(), p.payload(), p.schemaVersion(), event.occurredAt());
    }

    private AggregateEvent toAggregateEvent(SourcedEvent event) {
        Class<? extends DomainEvent> type = handlers.payloadType(event.eventType())
                .orElseThrow(() -> new IllegalStateException("No handler for event type " + event.eventType()
                        + " on aggregate " + aggregateType));
        DomainEvent payload = serializer.deserialize(event, type);
        return new AggregateEvent(event.eventId(), event.aggregateId(), event.version(), event.eventType(),
                payload, event.occurredAt());
    }

    private OutboxMessage toOutboxMessage(SourcedEvent event) {
        return OutboxMessage.pending(event.eventId(), aggregateType, event.aggregateId(), event.eventType(),
                topicResolver.apply(aggregateType, event.eventType()), serializer.toEnvelope(event), clock.instant());
    }

    private record Restored<S>(long version, S state) {}

    public static final class Builder<A extends Aggregate<S>, S> {
        private final String aggregateType;
        private final Function<String, A> factory;
        private final EventHandlers<S> handlers;
        private EventStore eventStore;
        private SnapshotStore snapshotStore;
        private EventSerializer serializer;
        private int snapshotFrequency;
        private boolean publishEvents = true;
        private BiFunction<String, String, String> topicResolver;
        private Clock clock;

        private Builder(String aggregateType, Function<String, A> factory, EventHandlers<S> handlers) {
            this.aggregateType = aggregateType;
            this.factory = factory;
            this.handlers = handlers;
        }

        public Builder<A, S> eventStore(EventStore eventStore) { this.eventStore = eventStore; return this; }
        public Builder<A, S> snapshotStore(SnapshotStore snapshotStore) { this.snapshotStore = snapshotStore; return this; }
        public Builder<A, S> serializer(EventSerializer serializer) { this.serializer = serializer; return this; }
        /** Take a snapshot each time the version crosses a multiple of {@code every}; 0 disables snapshots. */
        public Builder<A, S> snapshotFrequency(int every) {
            if (every < 0) throw new IllegalArgumentException("snapshotFrequency must be >= 0");
            this.snapshotFrequency = every;
            return this;
        }
        /** Whether saved events are also written to the outbox (default {@code true}). */
        public Builder<A, S> publishEvents(boolean publish) { this.publishEvents = publish; return this; }
        /** Maps (aggregateType, eventType) to the broker topic; defaults to the aggregate type. */
        public Builder<A, S> topicResolver(BiFunction<String, String, String> resolver) { this.topicResolver = resolver; return this; }
        public Builder<A, S> clock(Clock clock) { this.clock = clock; return this; }

        public EventSourcedRepository<A, S> build() {
            return new EventSourcedRepository<>(this);
        }
    }
}
