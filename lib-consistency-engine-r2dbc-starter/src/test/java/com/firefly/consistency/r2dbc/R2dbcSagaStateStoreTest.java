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

import com.firefly.consistency.saga.SagaBuilder;
import com.firefly.consistency.saga.SagaDefinition;
import com.firefly.consistency.saga.SagaState;
import com.firefly.consistency.saga.SagaStatus;
import com.firefly.consistency.serialization.JacksonEventSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class R2dbcSagaStateStoreTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private final SagaDefinition checkout = SagaBuilder.saga("Checkout")
            .step("reserve").map(ctx -> "r").add()
            .step("charge").map(ctx -> "c").add()
            .build();

    private R2dbcSagaStateStore store;

    @BeforeEach
    void setUp() {
        store = new R2dbcSagaStateStore(H2Database.create().db, JacksonEventSerializer.defaultObjectMapper());
    }

    @Test
    void stateRoundTripsWithStepsAndData() {
        SagaState state = SagaState.pending("s-1", checkout, Map.of("orderId", "o-1", "amount", 42), T0)
                .withStatus(SagaStatus.RUNNING, T0.plusSeconds(1));
        state = state.withStep(state.step(1).running(T0.plusSeconds(1)).succeeded(2, T0.plusSeconds(2)), T0.plusSeconds(2));

        assertTrue(store.insert(SagaState.pending("s-1", checkout, Map.of(), T0)).block());
        assertSame(state, store.save(state).block());

        SagaState loaded = store.findById("s-1").block();
        assertEquals(state, loaded);
        assertEquals(42, loaded.data().get("amount"));
    }

    @Test
    void insertIsIdempotentAndSaveUpserts() {
        assertTrue(store.insert(SagaState.pending("s-1", checkout, Map.of("a", 1), T0)).block());
        assertFalse(store.insert(SagaState.pending("s-1", checkout, Map.of("a", 2), T0)).block());
        assertEquals(1, store.findById("s-1").block().data().get("a"));

        SagaState fresh = SagaState.pending("s-2", checkout, Map.of(), T0);
        store.save(fresh).block();
        assertEquals(fresh, store.findById("s-2").block());
    }

    @Test
    void queriesFilterByStatusAndName() {
        store.save(SagaState.pending("s-1", checkout, Map.of(), T0).withStatus(SagaStatus.RUNNING, T0)).block();
        store.save(SagaState.pending("s-2", checkout, Map.of(), T0.plusSeconds(1))
                .finished(SagaStatus.COMPLETED, T0.plusSeconds(5))).block();
        store.save(SagaState.pending("s-3", checkout, Map.of(), T0.plusSeconds(2))
                .withStatus(SagaStatus.COMPENSATING, T0.plusSeconds(3))).block();

        assertEquals(List.of("s-1", "s-3"), store.findByStatus(SagaStatus.resumable())
                .map(SagaState::sagaId).collectList().block());
        assertEquals(List.of("s-2", "s-3", "s-1"), store.findRecent(null, null, 10)
                .map(SagaState::sagaId).collectList().block());
        assertEquals(List.of("s-2"), store.findRecent("Checkout", SagaStatus.COMPLETED, 10)
                .map(SagaState::sagaId).collectList().block());
        assertTrue(store.findRecent("Other", null, 10).collectList().block().isEmpty());
        assertTrue(store.findByStatus(Set.of()).collectList().block().isEmpty());
    }
}
