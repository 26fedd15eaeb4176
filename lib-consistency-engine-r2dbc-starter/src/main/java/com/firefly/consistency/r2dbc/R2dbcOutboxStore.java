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
import com.firefly.consistency.outbox.OutboxStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

import static com.firefly.consistency.r2dbc.R2dbcSupport.bindTs;
import static com.firefly.consistency.r2dbc.R2dbcSupport.longValue;
import static com.firefly.consistency.r2dbc.R2dbcSupport.ts;

/**
 * Outbox store over the {@code outbox} table.
 *
 * <p>A claim selects due candidates, then takes each one with a conditional
 * {@code UPDATE} that repeats the due and lease checks, since another publisher may
 * have claimed, failed and rescheduled the row after the select. Only the
 * publisher whose update touched the row owns it, so replicas polling the same table
 * never deliver the same message concurrently.
 */
public class R2dbcOutboxStore implements OutboxStore {
    private static final Logger log = LoggerFactory.getLogger(R2dbcOutboxStore.class);

    private static final String SELECT = "SELECT " + OutboxRows.COLUMNS + " FROM outbox";

    private static final String CLAIM = """
            UPDATE outbox SET claimed_by = :owner, claimed_at = :now
             WHERE id = :id AND status = 'PENDING'
               AND (next_attempt_at IS NULL OR next_attempt_at <= :now)
               AND (claimed_by IS NULL OR claimed_at IS NULL OR claimed_at <= :expired)
            """;

    private static final String REQUEUE = """
            UPDATE outbox SET status = 'PENDING', retry_count = 0, processed_at = NULL,
                              claimed_by = NULL, claimed_at = NULL, next_attempt_at = NULL
             WHERE id = :id AND status = 'DEAD_LETTER'
            """;

    private final DatabaseClient db;
    private final TransactionalOperator tx;

    public R2dbcOutboxStore(DatabaseClient db, TransactionalOperator tx) {
        this.db = Objects.requireNonNull(db, "db");
        this.tx = Objects.requireNonNull(tx, "tx");
    }

    @Override
    public Mono<Void> enqueue(List<OutboxMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return Mono.empty();
        }
        return tx.transactional(Flux.fromIterable(messages).concatMap(m -> OutboxRows.insert(db, m)).then());
    }

    @Override
    public Flux<OutboxMessage> claimBatch(String owner, int batchSize, Duration lease, Instant now) {
        if (batchSize <= 0) {
            return Flux.empty();
        }
        Instant expired = now.minus(lease);
        String candidates = (SELECT + """
                 WHERE status = 'PENDING'
                   AND (next_attempt_at IS NULL OR next_attempt_at <= :now)
                   AND (claimed_by IS NULL OR claimed_at IS NULL OR claimed_at <= :expired)
                 ORDER BY created_at, id
                 LIMIT %d
                """).formatted(batchSize);
        return db.sql(candidates)
                .bind("now", ts(now))
                .bind("expired", ts(expired))
                .map(OutboxRows::map)
                .all()
                .concatMap(m -> db.sql(CLAIM)
                        .bind("owner", owner)
                        .bind("now", ts(now))
                        .bind("expired", ts(expired))
                        .bind("id", m.id())
                        .fetch().rowsUpdated()
                        .flatMap(updated -> {
                            if (updated == 0) {
                                log.debug("Outbox message {} was claimed by another publisher", m.id());
                                return Mono.empty();
                            }
                            return Mono.just(m.claim(owner, now));
                        }));
    }

    @Override
    public Mono<Boolean> markProcessed(String id, String owner, Instant now) {
        return db.sql("""
                        UPDATE outbox SET status = 'PUBLISHED', processed_at = :now,
                                          claimed_by = NULL, claimed_at = NULL, next_attempt_at = NULL
                         WHERE id = :id AND status = 'PENDING'
                        """)
                .bind("now", ts(now))
                .bind("id", id)
                .fetch().rowsUpdated()
                .map(n -> n > 0);
    }

    @Override
    public Mono<OutboxMessage> markFailed(String id, String owner, String error, Instant nextAttemptAt, int maxRetries) {
        Mono<OutboxMessage> unit = db.sql(SELECT + " WHERE id = :id AND status = 'PENDING' AND claimed_by = :owner")
                .bind("id", id)
                .bind("owner", owner)
                .map(OutboxRows::map)
                .one()
                .flatMap(current -> {
                    OutboxMessage failed = current.failed(error, nextAttemptAt, maxRetries);
                    DatabaseClient.GenericExecuteSpec spec = db.sql("""
                                    UPDATE outbox SET retry_count = :retry_count, status = :status, last_error = :last_error,
                                                      claimed_by = NULL, claimed_at = NULL, next_attempt_at = :next_attempt_at
                                     WHERE id = :id AND status = 'PENDING' AND claimed_by = :owner
                                    """)
                            .bind("retry_count", failed.retryCount())
                            .bind("status", failed.status().name())
                            .bind("id", id)
                            .bind("owner", owner);
                    spec = R2dbcSupport.bindMaybe(spec, "last_error", failed.lastError(), String.class);
                    spec = bindTs(spec, "next_attempt_at", failed.nextAttemptAt());
                    return spec.fetch().rowsUpdated()
                            .flatMap(n -> n > 0 ? Mono.just(failed) : Mono.<OutboxMessage>empty());
                });
        return tx.transactional(unit);
    }

    @Override
    public Mono<OutboxMessage> findById(String id) {
        return db.sql(SELECT + " WHERE id = :id")
                .bind("id", id)
                .map(OutboxRows::map)
                .one();
    }

    @Override
    public Flux<OutboxMessage> findDeadLetters(int limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        return db.sql((SELECT + " WHERE status = 'DEAD_LETTER' ORDER BY created_at, id LIMIT %d").formatted(limit))
                .map(OutboxRows::map)
                .all();
    }

    @Override
    public Mono<Boolean> retryDeadLetter(String id) {
        return db.sql(REQUEUE)
                .bind("id", id)
                .fetch().rowsUpdated()
                .map(n -> n > 0);
    }

    @Override
    public Mono<Integer> retryDeadLetters(int limit) {
        return findDeadLetters(limit)
                .concatMap(m -> retryDeadLetter(m.id()))
                .filter(Boolean::booleanValue)
                .count()
                .map(Long::intValue);
    }

    @Override
    public Mono<Integer> deletePublishedBefore(Instant cutoff) {
        return db.sql("DELETE FROM outbox WHERE status = 'PUBLISHED' AND processed_at < :cutoff")
                .bind("cutoff", ts(cutoff))
                .fetch().rowsUpdated()
                .map(Long::intValue);
    }

    @Override
    public Mono<Long> countByStatus(OutboxStatus status) {
        return db.sql("SELECT COUNT(*) AS message_count FROM outbox WHERE status = :status")
                .bind("status", status.name())
                .map((row, md) -> longValue(row, "message_count"))
                .one()
                .defaultIfEmpty(0L);
    }
}
