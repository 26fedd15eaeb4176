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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryOutboxStoreTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
    private static final Duration LEASE = Duration.ofSeconds(30);

    private static OutboxMessage message(String id, int offsetSeconds) {
        return OutboxMessage.pending(id, "Order", "o-1", "OrderCreated", "orders", "{}", T0.plusSeconds(offsetSeconds));
    }

    @Test
    void claimsRespectBatchSizeAndOrder() {
        InMemoryOutboxStore store = new InMemoryOutboxStore();
        store.enqueue(List.of(message("b", 2), message("a", 1), message("c", 3))).block();

        List<OutboxMessage> claimed = store.claimBatch("p-1", 2, LEASE, T0.plusSeconds(10)).collectList().block();

        assertEquals(List.of("a", "b"), claimed.stream().map(OutboxMessage::id).toList());
        assertTrue(claimed.stream().allMatch(m -> "p-1".equals(m.claimedBy())));
        assertEquals(List.of("c"), store.claimBatch("p-2", 10, LEASE, T0.plusSeconds(10)).map(OutboxMessage::id).collectList().block());
    }

    @Test
    void failedMessageWaitsForItsNextAttempt() {
        InMemoryOutboxStore store = new InMemoryOutboxStore();
        store.enqueue(List.of(message("a", 0))).block();
        store.claimBatch("p-1", 10, LEASE, T0).blockLast();

        OutboxMessage failed = store.markFailed("a", "p-1", "boom", T0.plusSeconds(5), 3).block();

        assertNotNull(failed);
        assertNull(failed.claimedBy());
        assertEquals(0, store.claimBatch("p-1", 10, LEASE, T0.plusSeconds(4)).count().block());
        assertEquals(1, store.claimBatch("p-1", 10, LEASE, T0.plusSeconds(5)).count().block());
    }

    @Test
    void duplicateIdsAreRejectedAtomically() {
        InMemoryOutboxStore store = new InMemoryOutboxStore();
        store.enqueue(List.of(message("a", 0))).block();

        assertThrows(IllegalArgumentException.class, () -> store.insertAll(List.of(message("b", 0), message("a", 0))));
        assertThrows(IllegalArgumentException.class, () -> store.insertAll(List.of(message("c", 0), message("c", 0))));
        assertEquals(1, store.snapshot().size());
    }

    @Test
    void countsByStatus() {
        InMemoryOutboxStore store = new InMemoryOutboxStore();
        store.enqueue(List.of(message("a", 0), message("b", 1))).block();
        store.claimBatch("p-1", 1, LEASE, T0).blockLast();
        store.markProcessed("a", "p-1", T0).block();

        assertEquals(1L, store.countByStatus(OutboxStatus.PUBLISHED).block());
        assertEquals(1L, store.countByStatus(OutboxStatus.PENDING).block());
        assertEquals(0L, store.countByStatus(OutboxStatus.DEAD_LETTER).block());
        assertFalse(store.markProcessed("a", "p-1", T0).block(), "already published");
        assertFalse(store.retryDeadLetter("a").block());
    }
}
