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

import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Snapshot store backed by a {@link ConcurrentHashMap}. The monotonic check and the
 * write happen in one atomic {@code compute}.
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Mono<Snapshot> loadSnapshot(String aggregateId) {
        return Mono.fromSupplier(() -> snapshots.get(aggregateId));
    }

    @Override
    public Mono<Boolean> saveSnapshot(Snapshot snapshot) {
        return Mono.fromSupplier(() -> {
            boolean[] written = {false};
            snapshots.compute(snapshot.aggregateId(), (id, current) -> {
                if (current != null && current.version() > snapshot.version()) {
                    return current;
                }
                written[0] = true;
                return snapshot;
            });
            return written[0];
        });
    }

    @Override
    public Mono<Void> deleteSnapshot(String aggregateId) {
        return Mono.fromRunnable(() -> snapshots.remove(aggregateId));
    }

    public int size() {
        return snapshots.size();
    }
}
