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

import com.firefly.consistency.outbox.OutboundRecord;
import com.firefly.consistency.util.LogFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Starts sagas in reaction to published events.
 *
 * <p>The saga id is derived from the saga name and the message id, so an event delivered
 * more than once starts its saga only once.
 */
public class SagaEventTrigger {
    private static final Logger log = LoggerFactory.getLogger(SagaEventTrigger.class);

    private final SagaOrchestrator orchestrator;
    private final Map<String, List<Binding>> bindings = new ConcurrentHashMap<>();

    public SagaEventTrigger(SagaOrchestrator orchestrator) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    }

    /**
     * Starts {@code sagaName} for every record of {@code eventType}, with the saga input
     * produced by {@code inputMapper}.
     */
    public SagaEventTrigger on(String eventType, String sagaName, Function<OutboundRecord, Map<String, Object>> inputMapper) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(sagaName, "sagaName");
        Objects.requireNonNull(inputMapper, "inputMapper");
        bindings.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(new Binding(sagaName, inputMapper));
        return this;
    }

    /** Starts the sagas bound to the record's event type and completes once they are persisted. */
    public Mono<Void> handle(OutboundRecord record) {
        String eventType = record.eventType();
        List<Binding> matching = eventType == null ? List.of() : bindings.getOrDefault(eventType, List.of());
        if (matching.isEmpty()) {
            return Mono.empty();
        }
        String messageId = record.messageId() != null ? record.messageId() : record.key();
        return Flux.fromIterable(matching)
                .concatMap(binding -> Mono.defer(() -> {
                    String sagaId = sagaIdFor(binding.sagaName(), messageId);
                    log.debug(LogFormat.json("saga_event", "triggered", "saga", binding.sagaName(),
                            "sagaId", sagaId, "event_type", eventType, "message_id", messageId));
                    return orchestrator.startWithId(sagaId, binding.sagaName(), binding.inputMapper().apply(record));
                }))
                .then();
    }

    /** Adapter for {@link com.firefly.consistency.outbox.InMemoryMessageBroker#subscribe}. */
    public Function<OutboundRecord, Mono<Void>> asSubscriber() {
        return this::handle;
    }

    static String sagaIdFor(String sagaName, String messageId) {
        return UUID.nameUUIDFromBytes((sagaName + ":" + messageId).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private record Binding(String sagaName, Function<OutboundRecord, Map<String, Object>> inputMapper) { }
}
