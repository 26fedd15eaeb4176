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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outbox kept in memory. Every operation runs under one lock, which makes claims
 * exclusive in the same way a conditional {@code UPDATE} does in a database.
 */
public class InMemoryOutboxStore implements OutboxStore {

    private final Object lock = new Object();
    private final Map<String, OutboxMessage> messages = new LinkedHashMap<>();

    /**
     * Inserts all messages or none. Called by the in-memory event store while it holds its
     * own append lock.
     *
     * @throws IllegalArgumentException if an id is already present or repeated in the batch
     */
    public void insertAll(List<OutboxMessage> batch) {
        if (batch.isEmpty()) return;
        synchronized (lock) {
            Set<String> seen = new HashSet<>();
            for (OutboxMessage m : batch) {
                if (messages.containsKey(m.id()) || !seen.add(m.id())) {
                    throw new IllegalArgumentException("Duplicate outbox message id " + m.id());
                }
            }
            for (OutboxMessage m : batch) {
                messages.put(m.id(), m);
            }
        }
    }

    @Override
    public Mono<Void> enqueue(List<OutboxMessage> batch) {
        return Mono.fromRunnable(() -> insertAll(batch));
    }

    @Override
    public Flux<OutboxMessage> claimBatch(String owner, int batchSize, Duration lease, Instant now) {
        return Flux.defer(() -> {
            List<OutboxMessage> claimed = new ArrayList<>();
            synchronized (lock) {
                List<OutboxMessage> candidates = messages.values().stream()
                        .filter(m -> m.isClaimable(now, lease))
                        .sorted(Comparator.comparing(OutboxMessage::createdAt))
                        .limit(Math.max(0, batchSize))
                        .toList();
                for (OutboxMessage m : candidates) {
                    OutboxMessage c = m.claim(owner, now);
                    messages.put(c.id(), c);
                    claimed.add(c);
                }
            }
            return Flux.fromIterable(claimed);
        });
    }

    @Override
    public Mono<Boolean> markProcessed(String id, String owner, Instant now) {
        return Mono.fromSupplier(() -> {
            synchronized (lock) {
                OutboxMessage m = messages.get(id);
                if (m == null || m.status() != OutboxStatus.PENDING) {
                    return false;
                }
                messages.put(id, m.processed(now));
                return true;
            }
        });
    }

    @Override
    public Mono<OutboxMessage> markFailed(String id, String owner, String error, Instant nextAttemptAt, int maxRetries) {
        return Mono.fromSupplier(() -> {
            synchronized (lock) {
                OutboxMessage m = messages.get(id);
                if (m == null || m.status() != OutboxStatus.PENDING || !owner.equals(m.claimedBy())) {
                    return null;
                }
                OutboxMessage failed = m.failed(error, nextAttemptAt, maxRetries);
                messages.put(id, failed);
                return failed;
            }
        });
    }

    @Override
    public Mono<OutboxMessage> findById(String id) {
        return Mono.fromSupplier(() -> {
            synchronized (lock) {
                return messages.get(id);
            }
        });
    }

    @Override
    public Flux<OutboxMessage> findDeadLetters(int limit) {
        return Flux.defer(() -> Flux.fromIterable(select(OutboxStatus.DEAD_LETTER, limit)));
    }

    @Override
    public Mono<Boolean> retryDeadLetter(String id) {
        return Mono.fromSupplier(() -> {
            synchronized (lock) {
                OutboxMessage m = messages.get(id);
                if (m == null || !m.isDeadLetter()) {
                    return false;
                }
                messages.put(id, m.requeued());
                return true;
            }
        });
    }

    @Override
    public Mono<Integer> retryDeadLetters(int limit) {
        return Mono.fromSupplier(() -> {
            synchronized (lock) {
                List<OutboxMessage> dead = select(OutboxStatus.DEAD_LETTER, limit);
                dead.forEach(m -> messages.put(m.id(), m.requeued()));
                return dead.size();
            }
        });
    }

    @Override
    public Mono<Integer> deletePublishedBefore(Instant cutoff) {
        return Mono.fromSupplier(() -> {
            synchronized (lock) {
                int before = messages.size();
                messages.values().removeIf(m -> m.status() == OutboxStatus.PUBLISHED
                        && m.processedAt() != null && m.processedAt().isBefore(cutoff));
                return before - messages.size();
            }
        });
    }

    @Override
    public Mono<Long> countByStatus(OutboxStatus status) {
        return Mono.fromSupplier(() -> {
            synchronized (lock) {
                return messages.values().stream().filter(m -> m.status() == status).count();
            }
        });
    }

    /** All messages in insertion order, for inspection in tests and tools. */
    public List<OutboxMessage> snapshot() {
        synchronized (lock) {
            return List.copyOf(messages.values());
        }
    }

    private List<OutboxMessage> select(OutboxStatus status, int limit) {
        synchronized (lock) {
            return messages.values().stream()
                    .filter(m -> m.status() == status)
                    .sorted(Comparator.comparing(OutboxMessage::createdAt))
                    .limit(Math.max(0, limit))
                    .toList();
        }
    }
}
