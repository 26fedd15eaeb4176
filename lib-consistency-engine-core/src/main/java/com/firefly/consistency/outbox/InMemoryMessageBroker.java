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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-process broker for development and testing. Records are dispatched to the
 * subscribers of their topic (and to wildcard subscribers) one after another; a
 * subscriber error fails the publish, which the outbox treats as a missing ack.
 * Keeps a bounded history of published records.
 */
public class InMemoryMessageBroker implements MessageBroker {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBroker.class);

    public static final String ALL_TOPICS = "*";

    private final Map<String, List<Function<OutboundRecord, Mono<Void>>>> subscribers = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<OutboundRecord> history = new ConcurrentLinkedDeque<>();
    private final int maxHistory;

    public InMemoryMessageBroker() {
        this(1000);
    }

    public InMemoryMessageBroker(int maxHistory) {
        this.maxHistory = Math.max(1, maxHistory);
    }

    public void subscribe(String topic, Function<OutboundRecord, Mono<Void>> handler) {
        subscribers.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(handler);
    }

    @Override
    public Mono<Void> publish(OutboundRecord record) {
        return Mono.defer(() -> {
            history.addLast(record);
            while (history.size() > maxHistory) {
                history.pollFirst();
            }
            log.debug("In-memory broker received {} on {}", record.messageId(), record.topic());
            List<Function<OutboundRecord, Mono<Void>>> targets = new ArrayList<>(
                    subscribers.getOrDefault(record.topic(), List.of()));
            if (!ALL_TOPICS.equals(record.topic())) {
                targets.addAll(subscribers.getOrDefault(ALL_TOPICS, List.of()));
            }
            return Flux.fromIterable(targets).concatMap(h -> h.apply(record)).then();
        });
    }

    public List<OutboundRecord> history() {
        return List.copyOf(history);
    }

    public void clearHistory() {
        history.clear();
    }
}
