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

import com.firefly.consistency.outbox.OutboxMessage;
import com.firefly.consistency.outbox.OutboxStatus;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

import static com.firefly.consistency.r2dbc.R2dbcSupport.bindMaybe;
import static com.firefly.consistency.r2dbc.R2dbcSupport.bindTs;
import static com.firefly.consistency.r2dbc.R2dbcSupport.instant;

/**
 * SQL and row mapping of the {@code outbox} table. Inserts are shared between the event
 * store, which writes them inside its append transaction, and the outbox store.
 */
final class OutboxRows {
    private OutboxRows() {}

    static final String COLUMNS = "id, aggregate_type, aggregate_id, event_type, topic, payload, created_at, "
            + "processed_at, retry_count, status, claimed_by, claimed_at, next_attempt_at, last_error";

    private static final String INSERT = """
            INSERT INTO outbox (id, aggregate_type, aggregate_id, event_type, topic, payload, created_at,
                                processed_at, retry_count, status, claimed_by, claimed_at, next_attempt_at, last_error)
            VALUES (:id, :aggregate_type, :aggregate_id, :event_type, :topic, :payload, :created_at,
                    :processed_at, :retry_count, :status, :claimed_by, :claimed_at, :next_attempt_at, :last_error)
            """;

    static Mono<Void> insert(DatabaseClient db, OutboxMessage m) {
        DatabaseClient.GenericExecuteSpec spec = db.sql(INSERT)
                .bind("id", m.id())
                .bind("aggregate_type", m.aggregateType())
                .bind("aggregate_id", m.aggregateId())
                .bind("event_type", m.eventType())
                .bind("topic", m.topic())
                .bind("payload", m.payload())
                .bind("retry_count", m.retryCount())
                .bind("status", m.status().name());
        spec = bindTs(spec, "created_at", m.createdAt());
        spec = bindTs(spec, "processed_at", m.processedAt());
        spec = bindTs(spec, "claimed_at", m.claimedAt());
        spec = bindTs(spec, "next_attempt_at", m.nextAttemptAt());
        spec = bindMaybe(spec, "claimed_by", m.claimedBy(), String.class);
        spec = bindMaybe(spec, "last_error", m.lastError(), String.class);
        return spec.fetch().rowsUpdated().then();
    }

    static OutboxMessage map(Row row, RowMetadata metadata) {
        Integer retries = row.get("retry_count", Integer.class);
        return new OutboxMessage(
                row.get("id", String.class),
                row.get("aggregate_type", String.class),
                row.get("aggregate_id", String.class),
                row.get("event_type", String.class),
                row.get("topic", String.class),
                row.get("payload", String.class),
                instant(row, "created_at"),
                instant(row, "processed_at"),
                retries == null ? 0 : retries,
                OutboxStatus.valueOf(row.get("status", String.class)),
                row.get("claimed_by", String.class),
                instant(row, "claimed_at"),
                instant(row, "next_attempt_at"),
                row.get("last_error", String.class)
        );
    }
}
