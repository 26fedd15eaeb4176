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

import com.firefly.consistency.outbox.OutboxMessage;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventStoreTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private static SourcedEvent event(String aggregateId, long version) {
        return new SourcedEvent(UUID.randomUUID().toString(), "Order", aggregateId, version,
                "ItemAdded", "{\"v\":" + version + "}", 1, T0.plusSeconds(version));
    }

    private static List<SourcedEvent> events(String aggregateId, long fromVersion, int count) {
        List<SourcedEvent> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(event(aggregateId, fromVersion + i));
        }
        return out;
    }

    private static OutboxMessage message(SourcedEvent e) {
        return OutboxMessage.pending(e.eventId(), e.aggregateType(), e.aggregateId(), e.eventType(), "orders", "{}", T0);
    }

    @Test
    void appendsAndLoadsInVersionOrder() {
        InMemoryEventStore store = new InMemoryEventStore();

        AppendResult first = store.append("o-1", 0, events("o-1", 1, 2)).block();
        AppendResult second = store.append("o-1", 2, events("o-1", 3, 1)).block();

        assertEquals(AppendResult.appended(2), first);
        assertEquals(AppendResult.appended(3), second);
        List<SourcedEvent> loaded = store.load("o-1").collectList().block();
        assertNotNull(loaded);
        assertEquals(List.of(1L, 2L, 3L), loaded.stream().map(SourcedEvent::version).toList());
        assertEquals(3L, store.currentVersion("o-1").block());
    }

    @Test
    void staleExpectedVersionIsAConflictAndWritesNothing() {
        InMemoryEventStore store = new InMemoryEventStore();
        store.append("o-1", 0, events("o-1", 1, 2)).block();

        AppendResult result = store.append("o-1", 1, events("o-1", 2, 1), List.of(message(event("o-1", 2)))).block();

        assertNotNull(result);
        assertTrue(result.isConflict());
        assertEquals(new AppendResult.ConcurrencyConflict("o-1", 1, 2), result);
        assertEquals(2L, store.currentVersion("o-1").block());
        assertTrue(store.outboxStore().snapshot().isEmpty());
    }

    @Test
    void emptyAppendReturnsCurrentVersionWithoutCheckingExpected() {
        InMemoryEventStore store = new InMemoryEventStore();
        store.append("o-1", 0, events("o-1", 1, 3)).block();

        StepVerifier.create(store.append("o-1", 0, List.of()))
                .expectNext(AppendResult.appended(3))
                .verifyComplete();
    }

    @Test
    void rejectsNonContiguousVersions() {
        InMemoryEventStore store = new InMemoryEventStore();

        StepVerifier.create(store.append("o-1", 0, List.of(event("o-1", 1), event("o-1", 3))))
                .expectError(IllegalArgumentException.class)
                .verify();
        assertEquals(0L, store.currentVersion("o-1").block());
    }

    @Test
    void rangeLoadExcludesFromAndIncludesTo() {
        InMemoryEventStore store = new InMemoryEventStore();
        store.append("o-1", 0, events("o-1", 1, 5)).block();

        List<Long> versions = store.load("o-1", 2, 4).map(SourcedEvent::version).collectList().block();

        assertEquals(List.of(3L, 4L), versions);
        assertEquals(List.of(), store.load("unknown").collectList().block());
    }

    @Test
    void outboxMessagesAreWrittenWithTheEvents() {
        InMemoryEventStore store = new InMemoryEventStore();
        List<SourcedEvent> batch = events("o-1", 1, 2);

        store.append("o-1", 0, batch, batch.stream().map(InMemoryEventStoreTest::message).toList()).block();

        assertEquals(batch.stream().map(SourcedEvent::eventId).toList(),
                store.outboxStore().snapshot().stream().map(OutboxMessage::id).toList());
    }

    @Test
    void failedOutboxInsertRollsBackTheAppend() {
        InMemoryEventStore store = new InMemoryEventStore();
        SourcedEvent existing = event("o-2", 1);
        store.append("o-2", 0, List.of(existing), List.of(message(existing))).block();

        SourcedEvent e = event("o-1", 1);
        OutboxMessage clash = OutboxMessage.pending(existing.eventId(), "Order", "o-1", "ItemAdded", "orders", "{}", T0);

        StepVerifier.create(store.append("o-1", 0, List.of(e), List.of(clash)))
                .expectError(IllegalArgumentException.class)
                .verify();
        assertEquals(0L, store.currentVersion("o-1").block());
        assertEquals(1, store.outboxStore().snapshot().size());
    }

    @Test
    void concurrentAppendsAtTheSameVersionLetExactlyOneWin() {
        InMemoryEventStore store = new InMemoryEventStore();

        List<AppendResult> results = Flux.range(0, 16)
                .flatMap(i -> store.append("o-1", 0, List.of(event("o-1", 1))).subscribeOn(Schedulers.parallel()))
                .collectList()
                .block();

        assertNotNull(results);
        assertEquals(1, results.stream().filter(r -> !r.isConflict()).count());
        assertEquals(15, results.stream().filter(AppendResult::isConflict).count());
        assertEquals(1L, store.currentVersion("o-1").block());
    }

    @Test
    void loadAllPagesThroughTheGlobalLogInCommitOrder() {
        InMemoryEventStore store = new InMemoryEventStore();
        store.append("a", 0, events("a", 1, 2)).block();
        store.append("b", 0, events("b", 1, 1)).block();
        store.append("a", 2, events("a", 3, 1)).block();

        List<String> page1 = store.loadAll(0, 2).map(e -> e.aggregateId() + e.version()).collectList().block();
        List<String> page2 = store.loadAll(2, 2).map(e -> e.aggregateId() + e.version()).collectList().block();

        assertEquals(List.of("a1", "a2"), page1);
        assertEquals(List.of("b1", "a3"), page2);
        assertEquals(List.of(), store.loadAll(4, 10).collectList().block());
    }

    @Test
    void versionOrThrowRaisesOnConflict() {
        AppendResult conflict = AppendResult.conflict("o-1", 1, 2);

        assertThrows(com.firefly.consistency.exception.ConcurrencyConflictException.class, conflict::versionOrThrow);
        assertEquals(5L, AppendResult.appended(5).versionOrThrow());
        assertEquals("conflict@2", conflict.fold(v -> "ok", c -> "conflict@" + c.actualVersion()));
    }
}
