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

package com.firefly.consistency.r2dbc;

import com.firefly.consistency.eventsourcing.Snapshot;
import com.firefly.consistency.eventsourcing.SnapshotStore;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

import java.util.Objects;

import static com.firefly.consistency.r2dbc.R2dbcSupport.instant;
import static com.firefly.consistency.r2dbc.R2dbcSupport.longValue;
import static com.firefly.consistency.r2dbc.R2dbcSupport.ts;

/**
 * Snapshot store over the {@code snapshots} table. The monotonic rule is part of the
 * {@code UPDATE} predicate, so a stale writer changes nothing.
 */
public class R2dbcSnapshotStore implements SnapshotStore {

    private final DatabaseClient db;

    public R2dbcSnapshotStore(DatabaseClient db) {
        this.db = Objects.requireNonNull(db, "db");
    }

    @Override
    public Mono<Snapshot> loadSnapshot(String aggregateId) {
        return db.sql("SELECT aggregate_id, version, state, taken_at FROM snapshots WHERE aggregate_id = :aggregate_id")
                .bind("aggregate_id", aggregateId)
                .map((row, md) -> new Snapshot(
                        row.get("aggregate_id", String.class),
                        longValue(row, "version"),
                        row.get("state", String.class),
                        instant(row, "taken_at")))
                .one();
    }

    @Override
    public Mono<Boolean> saveSnapshot(Snapshot snapshot) {
        Mono<Long> update = db.sql("""
                        UPDATE snapshots SET version = :version, state = :state, taken_at = :taken_at
                         WHERE aggregate_id = :aggregate_id AND version <= :version
                        """)
                .bind("aggregate_id", snapshot.aggregateId())
                .bind("version", snapshot.version())
                .bind("state", snapshot.state())
                .bind("taken_at", ts(snapshot.takenAt()))
                .fetch().rowsUpdated();
        return update.flatMap(updated -> updated > 0 ? Mono.just(true) : insert(snapshot));
    }

    @Override
    public Mono<Void> deleteSnapshot(String aggregateId) {
        return db.sql("DELETE FROM snapshots WHERE aggregate_id = :aggregate_id")
                .bind("aggregate_id", aggregateId)
                .fetch().rowsUpdated().then();
    }

    // no row was updated: either there is none yet or the stored one is newer
    private Mono<Boolean> insert(Snapshot snapshot) {
        return db.sql("INSERT INTO snapshots (aggregate_id, version, state, taken_at) VALUES (:aggregate_id, :version, :state, :taken_at)")
                .bind("aggregate_id", snapshot.aggregateId())
                .bind("version", snapshot.version())
                .bind("state", snapshot.state())
                .bind("taken_at", ts(snapshot.takenAt()))
                .fetch().rowsUpdated()
                .map(n -> n > 0)
                .onErrorResume(DataIntegrityViolationException.class, e -> Mono.just(false));
    }
}
