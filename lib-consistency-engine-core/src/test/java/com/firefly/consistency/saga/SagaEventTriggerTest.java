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

package com.firefly.consistency.saga;

import com.firefly.consistency.outbox.InMemoryMessageBroker;
import com.firefly.consistency.outbox.OutboundRecord;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SagaEventTriggerTest {

    private static OutboundRecord record(String messageId, String eventType, String orderId) {
        return new OutboundRecord("orders", orderId, "{}", Map.of(
                OutboundRecord.HEADER_MESSAGE_ID, messageId,
                OutboundRecord.HEADER_EVENT_TYPE, eventType));
    }

    @Test
    void redeliveredEventStartsTheSagaOnce() {
        List<String> shipped = new CopyOnWriteArrayList<>();
        InMemorySagaStateStore store = new InMemorySagaStateStore();
        SagaOrchestrator orchestrator = new SagaOrchestrator(store, null);
        orchestrator.register(SagaBuilder.saga("Fulfil")
                .step("ship").run(ctx -> shipped.add(ctx.get("orderId", String.class))).add()
                .build());
        SagaEventTrigger trigger = new SagaEventTrigger(orchestrator)
                .on("OrderCreated", "Fulfil", r -> Map.of("orderId", r.key()));
        InMemoryMessageBroker broker = new InMemoryMessageBroker();
        broker.subscribe("orders", trigger.asSubscriber());

        OutboundRecord created = record("m-1", "OrderCreated", "o-1");
        broker.publish(created).block();
        broker.publish(created).block();
        broker.publish(record("m-2", "OrderCancelled", "o-1")).block();

        String sagaId = SagaEventTrigger.sagaIdFor("Fulfil", "m-1");
        SagaState state = Mono.defer(() -> orchestrator.getStatus(sagaId))
                .filter(SagaState::isTerminal)
                .repeatWhenEmpty(r -> r.delayElements(Duration.ofMillis(10)))
                .block(Duration.ofSeconds(5));

        assertEquals(SagaStatus.COMPLETED, state.status());
        assertEquals(List.of("o-1"), shipped);
        assertEquals(1, store.size());
    }

    @Test
    void sagaIdIsDeterministicPerSagaAndMessage() {
        assertEquals(SagaEventTrigger.sagaIdFor("A", "m-1"), SagaEventTrigger.sagaIdFor("A", "m-1"));
        assertNotEquals(SagaEventTrigger.sagaIdFor("A", "m-1"), SagaEventTrigger.sagaIdFor("B", "m-1"));
    }
}
