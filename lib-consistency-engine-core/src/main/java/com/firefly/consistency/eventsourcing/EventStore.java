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

import com.firefly.consistency.outbox.OutboxMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Append-only, per-aggregate ordered event log with optimistic concurrency.
 *
 * <p>Implementations must guarantee that an append is atomic: either every event (and
 * every outbox message handed in with them) is stored, or nothing is. A mismatching
 * expected version yields {@link AppendResult.ConcurrencyConflict} and leaves the log
 * unchanged. Appends to different aggregates never conflict.
 */
public interface EventStore {

    default Mono<AppendResult> append(String aggregateId, long expectedVersion, List<SourcedEvent> events) {
        return append(aggregateId, expectedVersion, events, List.of());
    }

    /**
     * Appends events and inserts the outbox messages that represent them in one atomic unit.
     * Events must carry versions {@code expectedVersion + 1 ..} in order. Appending zero
     * events is a no-op returning the current version.
     */
    Mono<AppendResult> append(String aggregateId, long expectedVersion,
                              List<SourcedEvent> events, List<OutboxMessage> outboxMessages);

    default Flux<SourcedEvent> load(String aggregateId) {
        return load(aggregateId, 0L);
    }

    /** Events with {@code version > fromVersion}, ascending. Empty for unknown aggregates. */
    default Flux<SourcedEvent> load(String aggregateId, long fromVersion) {
        return load(aggregateId, fromVersion, Long.MAX_VALUE);
    }

    /** Events with {@code fromVersion < version <= toVersion}, ascending. */
    Flux<SourcedEvent> load(String aggregateId, long fromVersion, long toVersion);

    /** Current version of the aggregate, 0 if it has no events. */
    Mono<Long> currentVersion(String aggregateId);

    /**
     * Events of all aggregates in global commit order, skipping the first
     * {@code fromPosition} entries.
     */
    Flux<SourcedEvent> loadAll(long fromPosition, int limit);
}
