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
import com.firefly.consistency.eventsourcing.Snapshot;
import com.firefly.consistency.eventsourcing.SourcedEvent;
import com.firefly.consistency.outbox.OutboxMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class R2dbcEventStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private H2Database h2;
    private R2dbcEventStore store;

    @BeforeEach
    void setUp() {
        h2 = H2Database.create();
        store = new R2dbcEventStore(h2.db, h2.tx);
    }

    private static List<SourcedEvent> events(String aggregateId, long from, int count) {
        List<SourcedEvent> list = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            list.add(new SourcedEvent(UUID.randomUUID().toString(), "Order", aggregateId, from + i,
                    "ItemAdded", "{\"n\":" + (from + i) + "}", 1, NOW.plusSeconds(i)));
        }
        return list;
    }

    private static OutboxMessage outboxFor(SourcedEvent e) {
        return OutboxMessage.pending(e.eventId(), e.aggregateType(), e.aggregateId(), e.eventType(), "orders", e.payload(), NOW);
    }

    @Test
    void appendsAndLoadsInVersionOrder() {
        List<SourcedEvent> batch = events("o-1", 1, 3);

        StepVerifier.create(store.append("o-1", 0, batch))
                .expectNext(AppendResult.appended(3))
                .verifyComplete();

        List<SourcedEvent> loaded = store.load("o-1").collectList().block();
        assertEquals(batch, loaded);
        assertEquals(List.of(3L), store.load("o-1", 2).map(SourcedEvent::version).collectList().block());
        assertEquals(List.of(2L), store.load("o-1", 1, 2).map(SourcedEvent::version).collectList().block());
        assertEquals(3L, store.currentVersion("o-1").block());
        assertEquals(0L, store.currentVersion("missing").block());
        assertTrue(store.load("missing").collectList().block().isEmpty());
    }

    @Test
    void staleExpectedVersionIsAConflictAndWritesNothing() {
        store.append("o-1", 0, events("o-1", 1, 2)).block();

        AppendResult result = store.append("o-1", 1, events("o-1", 2, 1)).block();

        assertEquals(AppendResult.conflict("o-1", 1, 2), result);
        assertEquals(2, h2.count("events"));
    }

    @Test
    void eventsAndOutboxRowsCommitTogether() {
        List<SourcedEvent> batch = events("o-1", 1, 2);
        store.append("o-1", 0, batch, batch.stream().map(R2dbcEventStoreTest::outboxFor).toList()).block();
        assertEquals(2, h2.count("outbox"));

        // the second outbox row reuses an existing id, so the whole append rolls back
        List<SourcedEvent> next = events("o-1", 3, 2);
        List<OutboxMessage> outbox = List.of(outboxFor(next.get(0)), outboxFor(batch.get(0)));
        StepVerifier.create(store.append("o-1", 2, next, outbox))
                .expectError(DataIntegrityViolationException.class)
                .verify();

        assertEquals(2L, store.currentVersion("o-1").block());
        assertEquals(2, h2.count("events"));
        assertEquals(2, h2.count("outbox"));
    }

    @Test
    void loadAllFollowsCommitOrderAcrossAggregates() {
        store.append("a", 0, events("a", 1, 2)).block();
        store.append("b", 0, events("b", 1, 1)).block();
        store.append("a", 2, events("a", 3, 1)).block();

        List<String> all = store.loadAll(0, 10).map(e -> e.aggregateId() + e.version()).collectList().block();
        assertEquals(List.of("a1", "a2", "b1", "a3"), all);
        assertEquals(List.of("b1"), store.loadAll(2, 1).map(e -> e.aggregateId() + e.version()).collectList().block());
    }

    @Test
    void snapshotsAreMonotonic() {
        R2dbcSnapshotStore snapshots = new R2dbcSnapshotStore(h2.db);
        Instant takenAt = NOW.truncatedTo(ChronoUnit.MILLIS);

        assertTrue(snapshots.saveSnapshot(new Snapshot("o-1", 5, "{\"v\":5}", takenAt)).block());
        assertFalse(snapshots.saveSnapshot(new Snapshot("o-1", 3, "{\"v\":3}", takenAt)).block());
        assertTrue(snapshots.saveSnapshot(new Snapshot("o-1", 5, "{\"v\":\"5b\"}", takenAt)).block());

        Snapshot stored = snapshots.loadSnapshot("o-1").block();
        assertNotNull(stored);
        assertEquals(5, stored.version());
        assertEquals("{\"v\":\"5b\"}", stored.state());
        assertEquals(takenAt, stored.takenAt());

        snapshots.deleteSnapshot("o-1").block();
        assertNull(snapshots.loadSnapshot("o-1").block());
    }
}
