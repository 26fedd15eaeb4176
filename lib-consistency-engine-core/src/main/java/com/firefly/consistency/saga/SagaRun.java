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

import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Mutable execution state of one saga instance inside the orchestrator. Every change
 * goes through {@link #persist(UnaryOperator)}, which also snapshots the context
 * variables, so the stored state is never behind the in-memory one.
 */
final class SagaRun {
    final SagaDefinition definition;
    final SagaContext context;
    final Duration budget;
    final Instant deadline;

    private final AtomicReference<SagaState> state;
    private final SagaStateStore store;
    private final Clock clock;

    private volatile int failedStep;
    private volatile boolean compensationFailed;

    SagaRun(SagaDefinition definition, SagaState initial, Duration budget, SagaStateStore store, Clock clock) {
        this.definition = definition;
        this.context = new SagaContext(initial.sagaId(), initial.sagaName(), initial.data());
        this.budget = budget;
        this.deadline = initial.createdAt().plus(budget);
        this.state = new AtomicReference<>(initial);
        this.store = store;
        this.clock = clock;
    }

    String sagaId() { return state.get().sagaId(); }
    String sagaName() { return definition.name(); }
    SagaState state() { return state.get(); }
    Instant now() { return clock.instant(); }

    Mono<SagaState> persist(UnaryOperator<SagaState> change) {
        return Mono.defer(() -> {
            SagaState next = change.apply(state.get()).withData(context.variables());
            state.set(next);
            return store.save(next).thenReturn(next);
        });
    }

    void markFailed(int stepIndex) { this.failedStep = stepIndex; }
    boolean hasFailed() { return failedStep > 0; }
    int failedStep() { return failedStep; }

    void markCompensationFailed() { this.compensationFailed = true; }
    boolean compensationFailed() { return compensationFailed; }
}
