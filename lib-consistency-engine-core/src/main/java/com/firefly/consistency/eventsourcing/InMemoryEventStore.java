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

package com.firefly.consistency.eventsourcing;

import com.firefly.consistency.outbox.InMemoryOutboxStore;
import com.firefly.consistency.outbox.OutboxMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Event store kept in memory. Paired with an {@link InMemoryOutboxStore} so that events
 * and their outbox messages are committed under one lock, the in-memory equivalent of a
 * database transaction. Intended for tests and single-process deployments.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final Object lock = new Object();
    private final Map<String, List<SourcedEvent>> streams = new HashMap<>();
    private final List<SourcedEvent> globalLog = new ArrayList<>();
    private final InMemoryOutboxStore outboxStore;

    public InMemoryEventStore() {
        this(new InMemoryOutboxStore());
    }

    public InMemoryEventStore(InMemoryOutboxStore outboxStore) {
        this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
    }

    /** The outbox this store writes to as part of every append. */
    public InMemoryOutboxStore outboxStore() {
        return outboxStore;
    }

    @Override
    public Mono<AppendResult> append(String aggregateId, long expectedVersion,
                                     List<SourcedEvent> events, List<OutboxMessage> outboxMessages) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                List<SourcedEvent> stream = streams.getOrDefault(aggregateId, List.of());
                long current = stream.size();
                if (events == null || events.isEmpty()) {
                    return AppendResult.appended(current);
                }
                if (current != expectedVersion) {
                    log.debug("Append to {} rejected: expected version {} but was {}", aggregateId, expectedVersion, current);
                    return AppendResult.conflict(aggregateId, expectedVersion, current);
                }
                EventSequence.validate(aggregateId, expectedVersion, events);
                // the outbox insert validates before mutating, so a failure leaves both logs untouched
                outboxStore.insertAll(outboxMessages == null ? List.of() : outboxMessages);
                List<SourcedEvent> updated = new ArrayList<>(stream);
                updated.addAll(events);
                streams.put(aggregateId, updated);
                globalLog.addAll(events);
                return AppendResult.appended(current + events.size());
            }
        });
    }

    @Override
    public Flux<SourcedEvent> load(String aggregateId, long fromVersion, long toVersion) {
        return Flux.defer(() -> {
            List<SourcedEvent> copy;
            synchronized (lock) {
                copy = List.copyOf(streams.getOrDefault(aggregateId, List.of()));
            }
            return Flux.fromIterable(copy)
                    .filter(e -> e.version() > fromVersion && e.version() <= toVersion);
        });
    }

    @Override
    public Mono<Long> currentVersion(String aggregateId) {
        return Mono.fromSupplier(() -> {
            synchronized (lock) {
                return (long) streams.getOrDefault(aggregateId, List.of()).size();
            }
        });
    }

    @Override
    public Flux<SourcedEvent> loadAll(long fromPosition, int limit) {
        return Flux.defer(() -> {
            List<SourcedEvent> page;
            synchronized (lock) {
                int from = (int) Math.min(Math.max(0L, fromPosition), globalLog.size());
                int to = (int) Math.min((long) from + Math.max(0, limit), globalLog.size());
                page = List.copyOf(globalLog.subList(from, to));
            }
            return Flux.fromIterable(page);
        });
    }
}
