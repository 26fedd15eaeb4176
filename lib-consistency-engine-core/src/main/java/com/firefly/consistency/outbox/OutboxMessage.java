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

package com.firefly.consistency.outbox;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An integration event waiting in the outbox. Created in the same atomic unit as the
 * domain events it represents. Every state change returns a new value.
 */
public record OutboxMessage(String id,
                            String aggregateType,
                            String aggregateId,
                            String eventType,
                            String topic,
                            String payload,
                            Instant createdAt,
                            Instant processedAt,
                            int retryCount,
                            OutboxStatus status,
                            String claimedBy,
                            Instant claimedAt,
                            Instant nextAttemptAt,
                            String lastError) {

    public OutboxMessage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(aggregateType, "aggregateType");
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(status, "status");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
    }

    public static OutboxMessage pending(String id, String aggregateType, String aggregateId,
                                        String eventType, String topic, String payload, Instant createdAt) {
        return new OutboxMessage(id, aggregateType, aggregateId, eventType, topic, payload, createdAt,
                null, 0, OutboxStatus.PENDING, null, null, null, null);
    }

    /**
     * A message can be claimed when it is pending, due, and either unclaimed or its lease
     * has run out.
     */
    public boolean isClaimable(Instant now, Duration lease) {
        if (status != OutboxStatus.PENDING) return false;
        if (nextAttemptAt != null && nextAttemptAt.isAfter(now)) return false;
        return claimedBy == null || claimedAt == null || !claimedAt.plus(lease).isAfter(now);
    }

    public OutboxMessage claim(String owner, Instant at) {
        return new OutboxMessage(id, aggregateType, aggregateId, eventType, topic, payload, createdAt,
                processedAt, retryCount, status, owner, at, nextAttemptAt, lastError);
    }

    public OutboxMessage processed(Instant at) {
        return new OutboxMessage(id, aggregateType, aggregateId, eventType, topic, payload, createdAt,
                at, retryCount, OutboxStatus.PUBLISHED, null, null, null, lastError);
    }

    /**
     * Records a failed delivery. The message becomes a dead letter once its retry count
     * exceeds {@code maxRetries}; otherwise it waits until {@code nextAttemptAt}.
     */
    public OutboxMessage failed(String error, Instant nextAttemptAt, int maxRetries) {
        int retries = retryCount + 1;
        OutboxStatus next = retries > maxRetries ? OutboxStatus.DEAD_LETTER : OutboxStatus.PENDING;
        return new OutboxMessage(id, aggregateType, aggregateId, eventType, topic, payload, createdAt,
                null, retries, next, null, null, next == OutboxStatus.PENDING ? nextAttemptAt : null, error);
    }

    /** Puts a dead letter back into the pending queue with a fresh retry budget. */
    public OutboxMessage requeued() {
        return new OutboxMessage(id, aggregateType, aggregateId, eventType, topic, payload, createdAt,
                null, 0, OutboxStatus.PENDING, null, null, null, lastError);
    }

    public boolean isDeadLetter() {
        return status == OutboxStatus.DEAD_LETTER;
    }
}
