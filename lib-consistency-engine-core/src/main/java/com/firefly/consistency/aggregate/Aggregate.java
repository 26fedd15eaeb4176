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

package com.firefly.consistency.aggregate;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Base class of event-sourced aggregates.
 *
 * <p>State changes only by applying events through the {@link EventHandlers} table of the
 * concrete type. Domain operations validate first (throwing
 * {@link com.firefly.consistency.exception.DomainException}) and then call
 * {@link #raise(DomainEvent)}, so a rejected operation never leaves events behind.
 *
 * <p>Instances are owned by one use case at a time and are not thread-safe.
 *
 * @param <S> immutable state type
 */
public abstract class Aggregate<S> {

    private final String id;
    private final EventHandlers<S> handlers;
    private final Clock clock;
    private final List<AggregateEvent> uncommitted = new ArrayList<>();
    private S state;
    private long version;

    protected Aggregate(String id, EventHandlers<S> handlers, S initialState) {
        this(id, handlers, initialState, Clock.systemUTC());
    }

    protected Aggregate(String id, EventHandlers<S> handlers, S initialState, Clock clock) {
        this.id = Objects.requireNonNull(id, "id");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String id() {
        return id;
    }

    /** Version including uncommitted events. */
    public long version() {
        return version;
    }

    /** Version of the last event known to be stored; the expected version of the next save. */
    public long committedVersion() {
        return version - uncommitted.size();
    }

    public S state() {
        return state;
    }

    public EventHandlers<S> handlers() {
        return handlers;
    }

    /**
     * Builds the next event for {@code payload} and applies it.
     */
    protected final AggregateEvent raise(DomainEvent payload) {
        Objects.requireNonNull(payload, "payload");
        AggregateEvent event = new AggregateEvent(
                UUID.randomUUID().toString(),
                id,
                version + 1,
                handlers.eventTypeOf(payload),
                payload,
                clock.instant().truncatedTo(ChronoUnit.MICROS));
        apply(event);
        return event;
    }

    /**
     * Folds {@code event} into the state and records it as uncommitted.
     *
     * @throws IllegalStateException if the event does not directly follow the current version
     */
    public final void apply(AggregateEvent event) {
        fold(event);
        uncommitted.add(event);
    }

    /** Folds an already stored event without recording it. */
    public final void replay(AggregateEvent event) {
        fold(event);
    }

    public final void loadFromHistory(Iterable<AggregateEvent> events) {
        for (AggregateEvent e : events) {
            replay(e);
        }
    }

    /**
     * Seeds a fresh instance from a snapshot.
     *
     * @throws IllegalStateException if events were applied already
     */
    public final void restore(long snapshotVersion, S snapshotState) {
        if (version != 0 || !uncommitted.isEmpty()) {
            throw new IllegalStateException("Snapshots can only be restored into a fresh aggregate");
        }
        this.state = Objects.requireNonNull(snapshotState, "snapshotState");
        this.version = snapshotVersion;
    }

    public final List<AggregateEvent> uncommittedEvents() {
        return List.copyOf(uncommitted);
    }

    public final boolean hasUncommittedEvents() {
        return !uncommitted.isEmpty();
    }

    /** Returns and forgets the uncommitted events; called once per successful commit. */
    public final List<AggregateEvent> clearUncommitted() {
        List<AggregateEvent> out = List.copyOf(uncommitted);
        uncommitted.clear();
        return out;
    }

    private void fold(AggregateEvent event) {
        if (!id.equals(event.aggregateId())) {
            throw new IllegalStateException("Event " + event.eventId() + " belongs to " + event.aggregateId() + ", not " + id);
        }
        if (event.version() != version + 1) {
            throw new IllegalStateException("Event version " + event.version() + " does not follow " + version + " on " + id);
        }
        state = handlers.apply(state, event.eventType(), event.payload());
        version = event.version();
    }
}
