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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Resuming sagas from persisted state, as after a crash of the previous process.
 */
class SagaRecoveryTest {

    private final List<String> actions = new CopyOnWriteArrayList<>();
    private final List<String> compensations = new CopyOnWriteArrayList<>();
    private InMemorySagaStateStore store;
    private SagaOrchestrator orchestrator;
    private SagaDefinition checkout;

    @BeforeEach
    void setUp() {
        store = new InMemorySagaStateStore();
        orchestrator = new SagaOrchestrator(store, null, SagaOrchestratorSettings.defaults(), Clock.systemUTC());
        SagaBuilder b = SagaBuilder.saga("Checkout");
        for (String name : List.of("reserve", "charge", "ship")) {
            b.step(name)
                    .action(ctx -> Mono.fromCallable(() -> {
                        actions.add(name + ":" + ctx.idempotencyKey());
                        return name + "-ok";
                    }))
                    .compensation(ctx -> Mono.fromRunnable(() -> compensations.add(name)))
                    .add();
        }
        checkout = b.build();
        orchestrator.register(checkout);
    }

    private SagaState persisted(SagaStatus status, StepStatus... stepStatuses) {
        Instant now = Instant.now();
        SagaState state = SagaState.pending("saga-1", checkout, Map.of("orderId", "o-1"), now).withStatus(status, now);
        for (int i = 0; i < stepStatuses.length; i++) {
            StepResult step = state.step(i + 1);
            StepResult updated = switch (stepStatuses[i]) {
                case PENDING -> step;
                case RUNNING -> step.running(now);
                case SUCCESS -> step.running(now).succeeded(1, now);
                case FAILED -> step.running(now).failed(1, "boom", now);
                default -> step.running(now).succeeded(1, now).withStatus(stepStatuses[i], null, now);
            };
            state = state.withStep(updated, now);
        }
        store.save(state).block();
        return state;
    }

    @Test
    void runningSagaResumesAtTheInterruptedStep() {
        persisted(SagaStatus.RUNNING, StepStatus.SUCCESS, StepStatus.RUNNING, StepStatus.PENDING);

        List<SagaState> recovered = orchestrator.recover().collectList().block();

        assertEquals(1, recovered.size());
        SagaState state = recovered.get(0);
        assertEquals(SagaStatus.COMPLETED, state.status());
        assertEquals(List.of("charge:saga-1:2", "ship:saga-1:3"), actions);
        assertEquals("o-1", state.data().get("orderId"));
    }

    @Test
    void pendingSagaStartsFromTheBeginning() {
        persisted(SagaStatus.PENDING);

        SagaState state = orchestrator.recover().blockLast();

        assertEquals(SagaStatus.COMPLETED, state.status());
        assertEquals(3, actions.size());
    }

    @Test
    void persistedStepFailureGoesStraightToCompensation() {
        persisted(SagaStatus.RUNNING, StepStatus.SUCCESS, StepStatus.FAILED, StepStatus.PENDING);

        SagaState state = orchestrator.recover().blockLast();

        assertEquals(SagaStatus.COMPENSATED, state.status());
        assertTrue(actions.isEmpty());
        assertEquals(List.of("reserve"), compensations);
    }

    @Test
    void compensationInDoubtIsNotRepeated() {
        persisted(SagaStatus.COMPENSATING, StepStatus.SUCCESS, StepStatus.COMPENSATING, StepStatus.FAILED);

        SagaState state = orchestrator.recover().blockLast();

        assertEquals(SagaStatus.COMPENSATION_FAILED, state.status());
        assertEquals(List.of("reserve"), compensations);
        assertEquals(StepStatus.COMPENSATION_FAILED, state.step(2).status());
        assertEquals(StepStatus.COMPENSATED, state.step(1).status());
    }

    @Test
    void compensationFailureRecordedBeforeRestartIsKept() {
        persisted(SagaStatus.COMPENSATING, StepStatus.SUCCESS, StepStatus.COMPENSATION_FAILED, StepStatus.FAILED);

        SagaState state = orchestrator.recover().blockLast();

        assertEquals(SagaStatus.COMPENSATION_FAILED, state.status());
        assertEquals(List.of("reserve"), compensations);
        assertEquals(StepStatus.COMPENSATED, state.step(1).status());
        assertEquals(StepStatus.COMPENSATION_FAILED, state.step(2).status());
    }

    @Test
    void haltPolicyStaysHaltedAfterRestart() {
        orchestrator = new SagaOrchestrator(store, null,
                new SagaOrchestratorSettings(Duration.ofMinutes(5), CompensationPolicy.HALT_ON_FAILURE), Clock.systemUTC());
        orchestrator.register(checkout);
        persisted(SagaStatus.COMPENSATING, StepStatus.SUCCESS, StepStatus.COMPENSATION_FAILED, StepStatus.FAILED);

        SagaState state = orchestrator.recover().blockLast();

        assertEquals(SagaStatus.COMPENSATION_FAILED, state.status());
        assertTrue(compensations.isEmpty());
        assertEquals(StepStatus.SUCCESS, state.step(1).status());
    }

    @Test
    void alreadyCompensatedStepsAreNotCompensatedAgain() {
        persisted(SagaStatus.COMPENSATING, StepStatus.SUCCESS, StepStatus.COMPENSATED, StepStatus.FAILED);

        SagaState state = orchestrator.recover().blockLast();

        assertEquals(SagaStatus.COMPENSATED, state.status());
        assertEquals(List.of("reserve"), compensations);
    }

    @Test
    void sagasWithoutDefinitionOrAlreadyTerminalAreLeftAlone() {
        Instant now = Instant.now();
        SagaDefinition unknown = SagaBuilder.saga("Unknown").step("x").map(ctx -> 1).add().build();
        store.save(SagaState.pending("orphan", unknown, Map.of(), now).withStatus(SagaStatus.RUNNING, now)).block();
        store.save(SagaState.pending("done", checkout, Map.of(), now).finished(SagaStatus.COMPLETED, now)).block();

        List<SagaState> recovered = orchestrator.recover().collectList().block(Duration.ofSeconds(5));

        assertTrue(recovered.isEmpty());
        assertEquals(SagaStatus.RUNNING, store.findById("orphan").block().status());
    }

    @Test
    void expiredBudgetFailsTheResumedStep() {
        Instant longAgo = Instant.now().minus(Duration.ofHours(1));
        SagaState state = SagaState.pending("old", checkout, Map.of(), longAgo).withStatus(SagaStatus.RUNNING, longAgo);
        state = state.withStep(state.step(1).running(longAgo).succeeded(1, longAgo), longAgo);
        store.save(state).block();

        SagaState result = orchestrator.recover().blockLast();

        assertEquals(SagaStatus.COMPENSATED, result.status());
        assertTrue(actions.isEmpty());
        assertEquals(List.of("reserve"), compensations);
        assertTrue(result.step(2).error().contains("timeout"));
    }
}
