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

package com.firefly.consistency.projection;

import com.firefly.consistency.aggregate.EventHandlers;
import com.firefly.consistency.eventsourcing.InMemoryEventStore;
import com.firefly.consistency.eventsourcing.SourcedEvent;
import com.firefly.consistency.fixtures.ItemAdded;
import com.firefly.consistency.fixtures.Order;
import com.firefly.consistency.fixtures.OrderCreated;
import com.firefly.consistency.fixtures.OrderState;
import com.firefly.consistency.repository.EventSourcedRepository;
import com.firefly.consistency.serialization.JacksonEventSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionEngineTest {

    record OrderSummary(String orderId, String customerId, int units) {
        OrderSummary withUnits(int more) {
            return new OrderSummary(orderId, customerId, units + more);
        }
    }

    // no handler for OrderCancelled: the projection skips it
    private static final EventHandlers<OrderSummary> SUMMARY = EventHandlers.forState(OrderSummary.class)
            .on(OrderCreated.class, (v, e) -> new OrderSummary(v.orderId(), e.customerId(), v.units()))
            .on(ItemAdded.class, (v, e) -> v.withUnits(e.quantity()))
            .ignoringUnknown()
            .build();

    private final JacksonEventSerializer serializer = new JacksonEventSerializer(JacksonEventSerializer.defaultObjectMapper());
    private InMemoryEventStore store;
    private EventSourcedRepository<Order, OrderState> repository;
    private ProjectionEngine<OrderSummary> engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        repository = EventSourcedRepository.<Order, OrderState>builder("Order", Order::new, Order.HANDLERS)
                .eventStore(store)
                .serializer(serializer)
                .build();
        engine = new ProjectionEngine<>("order-summary",
                new EventProjection<>(id -> new OrderSummary(id, null, 0), SUMMARY, serializer), store);
    }

    private void order(String id, int... quantities) {
        Order order = new Order(id);
        order.create("c-" + id);
        for (int q : quantities) {
            order.addItem("sku", q);
        }
        repository.save(order).block();
    }

    private List<SourcedEvent> history(String id) {
        return store.load(id).collectList().block();
    }

    @Test
    void rebuildFoldsTheWholeHistory() {
        order("o-1", 2, 3);
        Order o = repository.load("o-1").block();
        o.cancel("changed mind");
        repository.save(o).block();

        OrderSummary view = engine.rebuild("o-1").block();

        assertEquals(new OrderSummary("o-1", "c-o-1", 5), view);
        assertEquals(4, engine.lastVersion("o-1"));
        assertNull(engine.rebuild("none").block());
        assertTrue(engine.view("none").isEmpty());
    }

    @Test
    void incrementalUpdatesMatchRebuild() {
        order("o-1", 1, 4);
        for (SourcedEvent e : history("o-1")) {
            engine.applyIncremental(e).block();
        }
        OrderSummary incremental = engine.view("o-1").orElseThrow();

        engine.reset();
        assertEquals(incremental, engine.rebuild("o-1").block());
    }

    @Test
    void redeliveredEventIsIgnored() {
        order("o-1", 1);
        List<SourcedEvent> events = history("o-1");
        events.forEach(e -> engine.applyIncremental(e).block());

        OrderSummary again = engine.applyIncremental(events.get(1)).block();

        assertEquals(new OrderSummary("o-1", "c-o-1", 1), again);
        assertEquals(2, engine.lastVersion("o-1"));
    }

    @Test
    void gapTriggersRebuildFromTheStore() {
        order("o-1", 1, 2, 3);
        List<SourcedEvent> events = history("o-1");
        engine.applyIncremental(events.get(0)).block();

        OrderSummary view = engine.applyIncremental(events.get(3)).block();

        assertEquals(new OrderSummary("o-1", "c-o-1", 6), view);
        assertEquals(4, engine.lastVersion("o-1"));
    }

    @Test
    void rebuildAllScansTheGlobalLogWithAFilter() {
        order("a-1", 1);
        order("b-1", 2);
        order("a-2", 3);

        Integer rebuilt = engine.rebuild(id -> id.startsWith("a-")).block();

        assertEquals(2, rebuilt);
        assertEquals(3, engine.view("a-2").orElseThrow().units());
        assertFalse(engine.views().containsKey("b-1"));
    }
}
