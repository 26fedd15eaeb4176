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

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Saga state kept in memory. Terminal sagas beyond {@code historyLimit} are evicted,
 * oldest first; running sagas are never evicted. State is lost on restart, so crash
 * recovery needs one of the persistent stores.
 */
public class InMemorySagaStateStore implements SagaStateStore {

    private final Map<String, SagaState> states = new ConcurrentHashMap<>();
    private final int historyLimit;

    public InMemorySagaStateStore() {
        this(1000);
    }

    public InMemorySagaStateStore(int historyLimit) {
        if (historyLimit < 1) throw new IllegalArgumentException("historyLimit must be >= 1");
        this.historyLimit = historyLimit;
    }

    @Override
    public Mono<Boolean> insert(SagaState state) {
        return Mono.fromSupplier(() -> {
            boolean inserted = states.putIfAbsent(state.sagaId(), state) == null;
            if (inserted) {
                evict();
            }
            return inserted;
        });
    }

    @Override
    public Mono<SagaState> save(SagaState state) {
        return Mono.fromSupplier(() -> {
            states.put(state.sagaId(), state);
            if (state.isTerminal()) {
                evict();
            }
            return state;
        });
    }

    @Override
    public Mono<SagaState> findById(String sagaId) {
        return Mono.fromSupplier(() -> states.get(sagaId));
    }

    @Override
    public Flux<SagaState> findByStatus(Set<SagaStatus> statuses) {
        return Flux.defer(() -> Flux.fromIterable(states.values().stream()
                .filter(s -> statuses.contains(s.status()))
                .sorted(Comparator.comparing(SagaState::createdAt))
                .toList()));
    }

    @Override
    public Flux<SagaState> findRecent(String sagaName, SagaStatus status, int limit) {
        return Flux.defer(() -> Flux.fromIterable(states.values().stream()
                .filter(s -> sagaName == null || sagaName.equals(s.sagaName()))
                .filter(s -> status == null || status == s.status())
                .sorted(Comparator.comparing(SagaState::updatedAt, Comparator.nullsLast(Comparator.naturalOrder())).reversed())
                .limit(Math.max(0, limit))
                .toList()));
    }

    public int size() {
        return states.size();
    }

    private synchronized void evict() {
        int excess = states.size() - historyLimit;
        if (excess <= 0) return;
        List<SagaState> oldest = states.values().stream()
                .filter(SagaState::isTerminal)
                .sorted(Comparator.comparing(SagaState::updatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .limit(excess)
                .toList();
        oldest.forEach(s -> states.remove(s.sagaId(), s));
    }
}
