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

import java.util.Set;

/**
 * Persistence port for saga state.
 */
public interface SagaStateStore {

    /**
     * Stores a new saga unless one with the same id exists.
     *
     * @return {@code true} if the state was inserted
     */
    Mono<Boolean> insert(SagaState state);

    /** Inserts or replaces the state of a saga. */
    Mono<SagaState> save(SagaState state);

    Mono<SagaState> findById(String sagaId);

    Flux<SagaState> findByStatus(Set<SagaStatus> statuses);

    /**
     * Most recently updated sagas first.
     *
     * @param sagaName filter, or {@code null} for all sagas
     * @param status   filter, or {@code null} for every status
     */
    Flux<SagaState> findRecent(String sagaName, SagaStatus status, int limit);
}
