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

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Storage port of the outbox table.
 *
 * <p>Domain commits insert rows through {@code EventStore#append}; this interface is used
 * by the publisher and by operators. Claims are conditional updates so that two publisher
 * replicas never hold the same message at the same time.
 */
public interface OutboxStore {

    /**
     * Inserts messages that are not tied to an event append, e.g. integration commands
     * emitted by a saga step. The batch is atomic.
     */
    Mono<Void> enqueue(List<OutboxMessage> messages);

    /**
     * Claims up to {@code batchSize} claimable messages for {@code owner}, oldest first.
     *
     * @see OutboxMessage#isClaimable(Instant, Duration)
     */
    Flux<OutboxMessage> claimBatch(String owner, int batchSize, Duration lease, Instant now);

    /**
     * Marks a delivered message as published.
     *
     * @return {@code true} if the message moved to {@link OutboxStatus#PUBLISHED}
     */
    Mono<Boolean> markProcessed(String id, String owner, Instant now);

    /**
     * Records a failed delivery attempt for a message still claimed by {@code owner}.
     * Emits the updated message, or nothing if the claim was lost meanwhile.
     */
    Mono<OutboxMessage> markFailed(String id, String owner, String error, Instant nextAttemptAt, int maxRetries);

    Mono<OutboxMessage> findById(String id);

    Flux<OutboxMessage> findDeadLetters(int limit);

    /** @return {@code true} if the message was a dead letter and is pending again */
    Mono<Boolean> retryDeadLetter(String id);

    /** Requeues up to {@code limit} dead letters; emits how many were requeued. */
    Mono<Integer> retryDeadLetters(int limit);

    /** Removes published messages processed before {@code cutoff}; emits how many were removed. */
    Mono<Integer> deletePublishedBefore(Instant cutoff);

    Mono<Long> countByStatus(OutboxStatus status);
}
