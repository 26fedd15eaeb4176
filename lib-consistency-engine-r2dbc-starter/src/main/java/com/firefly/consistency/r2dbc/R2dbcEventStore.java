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

import com.firefly.consistency.eventsourcing.AppendResult;
import com.firefly.consistency.eventsourcing.EventSequence;
import com.firefly.consistency.eventsourcing.EventStore;
import com.firefly.consistency.eventsourcing.SourcedEvent;
import com.firefly.consistency.outbox.OutboxMessage;
import com.firefly.consistency.util.LogFormat;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

import static com.firefly.consistency.r2dbc.R2dbcSupport.instant;
import static com.firefly.consistency.r2dbc.R2dbcSupport.longValue;
import static com.firefly.consistency.r2dbc.R2dbcSupport.ts;

/**
 * Event store over R2DBC.
 *
 * <p>An append runs in one transaction: the version check, the event inserts and the
 * outbox inserts commit together. Two writers that pass the version check at the same
 * time are separated by the {@code UNIQUE(aggregate_id, version)} constraint; the loser
 * gets a {@link AppendResult.ConcurrencyConflict}.
 */
public class R2dbcEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(R2dbcEventStore.class);

    private static final String SELECT = "SELECT event_id, aggregate_type, aggregate_id, version, event_type, payload, "
            + "schema_version, occurred_at FROM events";

    private static final String INSERT = """
            INSERT INTO events (event_id, aggregate_type, aggregate_id, version, event_type, payload, schema_version, occurred_at)
            VALUES (:event_id, :aggregate_type, :aggregate_id, :version, :event_type, :payload, :schema_version, :occurred_at)
            """;

    private final DatabaseClient db;
    private final TransactionalOperator tx;

    public R2dbcEventStore(DatabaseClient db, TransactionalOperator tx) {
        this.db = Objects.requireNonNull(db, "db");
        this.tx = Objects.requireNonNull(tx, "tx");
    }

    @Override
    public Mono<AppendResult> append(String aggregateId, long expectedVersion,
                                     List<SourcedEvent> events, List<OutboxMessage> outboxMessages) {
        if (events == null || events.isEmpty()) {
            return currentVersion(aggregateId).map(AppendResult::appended);
        }
        List<OutboxMessage> outbox = outboxMessages == null ? List.of() : outboxMessages;
        Mono<AppendResult> unit = currentVersion(aggregateId).flatMap(actual -> {
            if (actual != expectedVersion) {
                return Mono.just(AppendResult.conflict(aggregateId, expectedVersion, actual));
            }
            EventSequence.validate(aggregateId, expectedVersion, events);
            return Flux.fromIterable(events).concatMap(this::insert)
                    .thenMany(Flux.fromIterable(outbox).concatMap(m -> OutboxRows.insert(db, m)))
                    .then(Mono.just(AppendResult.appended(expectedVersion + events.size())));
        });
        return tx.transactional(unit)
                .onErrorResume(DataIntegrityViolationException.class, e -> currentVersion(aggregateId)
                        .flatMap(actual -> {
                            if (actual == expectedVersion) {
                                // not a version race: a duplicate event or outbox id
                                return Mono.error(e);
                            }
                            log.debug(LogFormat.json(
                                    "event_store", "append_race_lost",
                                    "aggregate_id", aggregateId,
                                    "expected_version", Long.toString(expectedVersion),
                                    "actual_version", Long.toString(actual)
                            ));
                            return Mono.just(AppendResult.conflict(aggregateId, expectedVersion, actual));
                        }));
    }

    @Override
    public Flux<SourcedEvent> load(String aggregateId, long fromVersion, long toVersion) {
        return db.sql(SELECT + " WHERE aggregate_id = :aggregate_id AND version > :from AND version <= :to ORDER BY version")
                .bind("aggregate_id", aggregateId)
                .bind("from", fromVersion)
                .bind("to", toVersion)
                .map(R2dbcEventStore::map)
                .all();
    }

    @Override
    public Mono<Long> currentVersion(String aggregateId) {
        return db.sql("SELECT COALESCE(MAX(version), 0) AS current_version FROM events WHERE aggregate_id = :aggregate_id")
                .bind("aggregate_id", aggregateId)
                .map((row, md) -> longValue(row, "current_version"))
                .one()
                .defaultIfEmpty(0L);
    }

    @Override
    public Flux<SourcedEvent> loadAll(long fromPosition, int limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        // LIMIT/OFFSET are inlined; both are numbers we control
        String sql = (SELECT + " ORDER BY position LIMIT %d OFFSET %d").formatted(limit, Math.max(0L, fromPosition));
        return db.sql(sql).map(R2dbcEventStore::map).all();
    }

    private Mono<Void> insert(SourcedEvent e) {
        return db.sql(INSERT)
                .bind("event_id", e.eventId())
                .bind("aggregate_type", e.aggregateType())
                .bind("aggregate_id", e.aggregateId())
                .bind("version", e.version())
                .bind("event_type", e.eventType())
                .bind("payload", e.payload())
                .bind("schema_version", e.schemaVersion())
                .bind("occurred_at", ts(e.occurredAt()))
                .fetch().rowsUpdated().then();
    }

    private static SourcedEvent map(Row row, RowMetadata metadata) {
        Integer schemaVersion = row.get("schema_version", Integer.class);
        return new SourcedEvent(
                row.get("event_id", String.class),
                row.get("aggregate_type", String.class),
                row.get("aggregate_id", String.class),
                longValue(row, "version"),
                row.get("event_type", String.class),
                row.get("payload", String.class),
                schemaVersion == null ? 1 : schemaVersion,
                instant(row, "occurred_at")
        );
    }
}
