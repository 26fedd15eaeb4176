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

/**
 * Storage for aggregate snapshots. Writes are monotonic: saving a version older than
 * the stored one is silently ignored.
 */
public interface SnapshotStore {

    Mono<Snapshot> loadSnapshot(String aggregateId);

    /**
     * Stores the snapshot unless a newer one already exists.
     *
     * @return {@code true} when the snapshot was written, {@code false} when it was stale
     */
    Mono<Boolean> saveSnapshot(Snapshot snapshot);

    Mono<Void> deleteSnapshot(String aggregateId);
}
