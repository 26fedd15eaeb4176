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
import com.firefly.consistency.aggregate.EventHandlers;
import com.firefly.consistency.eventsourcing.EventStore;
import com.firefly.consistency.eventsourcing.SnapshotStore;
import com.firefly.consistency.serialization.EventSerializer;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Function;

/**
 * Hands out repository builders pre-wired with the shared stores, serializer, clock and
 * snapshot frequency, so application code only supplies the aggregate specifics.
 */
public class EventSourcedRepositoryFactory {
    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final EventSerializer serializer;
    private final int snapshotFrequency;
    private final Clock clock;

    public EventSourcedRepositoryFactory(EventStore eventStore,
                                         SnapshotStore snapshotStore,
                                         EventSerializer serializer,
                                         int snapshotFrequency,
                                         Clock clock) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.snapshotStore = snapshotStore;
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.snapshotFrequency = snapshotFrequency;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public <A extends Aggregate<S>, S> EventSourcedRepository.Builder<A, S> builder(String aggregateType,
                                                                                   Function<String, A> factory,
                                                                                   EventHandlers<S> handlers) {
        return EventSourcedRepository.builder(aggregateType, factory, handlers)
                .eventStore(eventStore)
                .snapshotStore(snapshotStore)
                .serializer(serializer)
                .snapshotFrequency(snapshotStore != null ? snapshotFrequency : 0)
                .clock(clock);
    }

    public <A extends Aggregate<S>, S> EventSourcedRepository<A, S> create(String aggregateType,
                                                                          Function<String, A> factory,
                                                                          EventHandlers<S> handlers) {
        return this.<A, S>builder(aggregateType, factory, handlers).build();
    }

    public int snapshotFrequency() {
        return snapshotFrequency;
    }
}
