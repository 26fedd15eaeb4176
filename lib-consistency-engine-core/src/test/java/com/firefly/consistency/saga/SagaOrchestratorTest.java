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

import com.firefly.consistency.exception.SagaTimeoutException;
import com.firefly.consistency.observability.SagaEvents;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class SagaOrchestratorTest {

    static class RecordingEvents implements SagaEvents {
        final List<String> calls = new CopyOnWriteArrayList<>();
        final List<Throwable> stepErrors = new CopyOnWriteArrayList<>();
        @Override public void onStart(String sagaName, String sagaId) { calls.add("start"); }
        @Override public void onStepSuccess(String sagaName, String sagaId, int stepIndex, String stepName, int attempts, long latencyMs) { calls.add("ok:" + stepName); }
        @Override public void onStepFailed(String sagaName, String sagaId, int stepIndex, String stepName, Throwable error, int attempts, long latencyMs) { calls.add("failed:" + stepName); stepErrors.add(error); }
        @Override public void onCompensated(String sagaName, String sagaId, int stepIndex, String stepName, Throwable error) { calls.add((error == null ? "compensated:" : "compensation_failed:") + stepName); }
        @Override public void onCompensationSkipped(String sagaName, String sagaId, int stepIndex, String stepName, String reason) { calls.add("skipped:" + stepName); }
        @Override public void onCompleted(String sagaName, String sagaId, SagaStatus status) { calls.add("completed:" + status); }
    }

    private final RecordingEvents events = new RecordingEvents();
    private final InMemorySagaStateStore store = new InMemorySagaStateStore();

    private SagaOrchestrator orchestrator(CompensationPolicy policy) {
        return new SagaOrchestrator(store, events, new SagaOrchestratorSettings(Duration.ofMinutes(1), policy), Clock.systemUTC());
    }

    private SagaOrchestrator orchestrator() {
        return orchestrator(CompensationPolicy.BEST_EFFORT);
    }

    private static SagaState awaitTerminal(SagaOrchestrator orchestrator, String sagaId) {
        return Mono.defer(() -> orchestrator.getStatus(sagaId))
                .filter(SagaState::isTerminal)
                .repeatWhenEmpty(r -> r.delayElements(Duration.ofMillis(10)))
                .block(Duration.ofSeconds(5));
    }

    /** Saga of {@code size} steps where step {@code failAt} (1-based, 0 = none) fails. */
    private static SagaDefinition recordingSaga(String name, int size, int failAt, List<String> compensations) {
        SagaBuilder b = SagaBuilder.saga(name);
        for (int i = 1; i <= size; i++) {
            String stepName = "s" + i;
            boolean fails = i == failAt;
            b.step(stepName)
                    .action(ctx -> fails ? Mono.error(new IllegalStateException(stepName + " failed")) : Mono.just(stepName + "-done"))
                    .compensation(ctx -> Mono.fromRunnable(() -> compensations.add(stepName)))
                    .add();
        }
        return b.build();
    }

    @Test
    void successfulSagaCompletesAndKeepsStepOutputs() {
        SagaDefinition def = SagaBuilder.saga("Checkout")
                .step("reserve").map(ctx -> "R-" + ctx.get("orderId", String.class)).add()
                .step("charge").action(ctx -> Mono.just(ctx.get("reserve", String.class) + "/paid")).add()
                .build();

        SagaState state = orchestrator().execute(def, Map.of("orderId", "o-1")).block();

        assertNotNull(state);
        assertEquals(SagaStatus.COMPLETED, state.status());
        assertEquals("R-o-1", state.data().get("reserve"));
        assertEquals("R-o-1/paid", state.data().get("charge"));
        assertTrue(state.steps().stream().allMatch(s -> s.status() == StepStatus.SUCCESS && s.attempts() == 1));
        assertNotNull(state.completedAt());
        assertEquals(List.of("start", "ok:reserve", "ok:charge", "completed:COMPLETED"), events.calls);
        assertEquals(state, store.findById(state.sagaId()).block());
    }

    @Test
    void failureCompensatesCompletedStepsInReverseOrder() {
        List<String> compensations = new CopyOnWriteArrayList<>();
        SagaDefinition def = recordingSaga("Checkout", 3, 3, compensations);

        SagaState state = orchestrator().execute(def, Map.of()).block();

        assertNotNull(state);
        assertEquals(SagaStatus.COMPENSATED, state.status());
        assertEquals(List.of("s2", "s1"), compensations);
        assertEquals(List.of(StepStatus.COMPENSATED, StepStatus.COMPENSATED, StepStatus.FAILED),
                state.steps().stream().map(StepResult::status).toList());
        assertTrue(state.failureReason().contains("s3"));
        assertEquals(1, events.stepErrors.size());
        assertEquals(3, ((com.firefly.consistency.exception.SagaStepException) events.stepErrors.get(0)).getStepIndex());
    }

    @Test
    void compensationOrderIsAlwaysTheReverseOfCompletion() {
        SagaOrchestrator orchestrator = orchestrator();
        for (int size = 1; size <= 5; size++) {
            for (int failAt = 1; failAt <= size; failAt++) {
                List<String> compensations = new CopyOnWriteArrayList<>();
                SagaState state = orchestrator.execute(recordingSaga("S" + size + "_" + failAt, size, failAt, compensations), Map.of()).block();

                List<String> expected = IntStream.iterate(failAt - 1, i -> i >= 1, i -> i - 1)
                        .mapToObj(i -> "s" + i).collect(Collectors.toList());
                assertEquals(expected, compensations, "size=" + size + " failAt=" + failAt);
                assertEquals(SagaStatus.COMPENSATED, state.status());
            }
        }
    }

    @Test
    void failedCompensationIsRecordedAndOthersStillRun() {
        List<String> compensations = new CopyOnWriteArrayList<>();
        SagaDefinition def = SagaBuilder.saga("Checkout")
                .step("a").map(ctx -> "a").compensation(ctx -> Mono.fromRunnable(() -> compensations.add("a"))).add()
                .step("b").map(ctx -> "b").compensation(ctx -> Mono.error(new IllegalStateException("refund API down"))).add()
                .step("c").action(ctx -> Mono.error(new IllegalStateException("boom"))).add()
                .build();
        SagaOrchestrator orchestrator = orchestrator();

        SagaState state = orchestrator.execute(def, Map.of()).block();

        assertNotNull(state);
        assertEquals(SagaStatus.COMPENSATION_FAILED, state.status());
        assertEquals(List.of("a"), compensations);
        assertEquals(StepStatus.COMPENSATION_FAILED, state.step(2).status());
        assertTrue(state.step(2).error().contains("refund API down"));
        assertEquals(StepStatus.COMPENSATED, state.step(1).status());
        assertTrue(events.calls.contains("compensation_failed:b"));
        assertEquals(List.of(state.sagaId()),
                orchestrator.compensationFailures().map(SagaState::sagaId).collectList().block());
    }

    @Test
    void haltOnFailureStopsCompensating() {
        List<String> compensations = new CopyOnWriteArrayList<>();
        SagaDefinition def = SagaBuilder.saga("Checkout")
                .step("a").map(ctx -> "a").compensation(ctx -> Mono.fromRunnable(() -> compensations.add("a"))).add()
                .step("b").map(ctx -> "b").compensation(ctx -> Mono.error(new IllegalStateException("down"))).add()
                .step("c").action(ctx -> Mono.error(new IllegalStateException("boom"))).add()
                .build();

        SagaState state = orchestrator(CompensationPolicy.HALT_ON_FAILURE).execute(def, Map.of()).block();

        assertEquals(SagaStatus.COMPENSATION_FAILED, state.status());
        assertTrue(compensations.isEmpty());
        assertEquals(StepStatus.SUCCESS, state.step(1).status());
        assertTrue(events.calls.contains("skipped:a"));
    }

    @Test
    void sagaTimeoutFailsTheRunningStepAndCompensates() {
        List<String> compensations = new CopyOnWriteArrayList<>();
        SagaDefinition def = SagaBuilder.saga("Slow")
                .timeout(Duration.ofMillis(200))
                .step("a").map(ctx -> "a").compensation(ctx -> Mono.fromRunnable(() -> compensations.add("a"))).add()
                .step("b").action(ctx -> Mono.delay(Duration.ofSeconds(10))).add()
                .step("c").map(ctx -> "c").add()
                .build();

        long started = System.nanoTime();
        SagaState state = orchestrator().execute(def, Map.of()).block(Duration.ofSeconds(5));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        assertNotNull(state);
        assertEquals(SagaStatus.COMPENSATED, state.status());
        assertEquals(List.of("a"), compensations);
        assertEquals(StepStatus.FAILED, state.step(2).status());
        assertEquals(StepStatus.PENDING, state.step(3).status());
        assertInstanceOf(SagaTimeoutException.class, events.stepErrors.get(0).getCause());
        assertTrue(elapsedMs < 3000, "timeout should cut the step short, took " + elapsedMs + "ms");
    }

    @Test
    void stepIsRetriedUntilItSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        SagaDefinition def = SagaBuilder.saga("Flaky")
                .step("charge").action(ctx -> calls.incrementAndGet() < 3
                        ? Mono.error(new IllegalStateException("transient"))
                        : Mono.just("ok")).retry(2).backoff(Duration.ofMillis(10)).add()
                .build();

        SagaState state = orchestrator().execute(def, Map.of()).block();

        assertEquals(SagaStatus.COMPLETED, state.status());
        assertEquals(3, state.step(1).attempts());
        assertEquals(3, calls.get());
    }

    @Test
    void perAttemptTimeoutCountsAgainstRetries() {
        AtomicInteger calls = new AtomicInteger();
        SagaDefinition def = SagaBuilder.saga("Hanging")
                .step("call").action(ctx -> {
                    calls.incrementAndGet();
                    return Mono.never();
                }).timeout(Duration.ofMillis(30)).retry(1).add()
                .build();

        SagaState state = orchestrator().execute(def, Map.of()).block(Duration.ofSeconds(5));

        assertEquals(SagaStatus.COMPENSATED, state.status());
        assertEquals(2, calls.get());
        assertEquals(2, state.step(1).attempts());
    }

    @Test
    void stepsWithoutCompensationAreSkipped() {
        SagaDefinition def = SagaBuilder.saga("NoUndo")
                .step("log").run(ctx -> { }).add()
                .step("fail").action(ctx -> Mono.error(new IllegalStateException("x"))).add()
                .build();

        SagaState state = orchestrator().execute(def, Map.of()).block();

        assertEquals(SagaStatus.COMPENSATED, state.status());
        assertTrue(events.calls.contains("skipped:log"));
        assertEquals(StepStatus.SUCCESS, state.step(1).status());
    }

    @Test
    void callbacksRunForTheTerminalStatusAndTheirErrorsAreContained() {
        List<String> seen = new ArrayList<>();
        SagaDefinition ok = SagaBuilder.saga("Ok")
                .onCompleted(s -> Mono.fromRunnable(() -> seen.add("completed:" + s.sagaId())))
                .step("a").map(ctx -> "a").add()
                .build();
        SagaDefinition failing = SagaBuilder.saga("Failing")
                .onCompensated(s -> Mono.error(new IllegalStateException("callback broke")))
                .step("a").action(ctx -> Mono.error(new IllegalStateException("x"))).add()
                .build();
        SagaOrchestrator orchestrator = orchestrator();

        SagaState done = orchestrator.execute(ok, Map.of()).block();
        SagaState compensated = orchestrator.execute(failing, Map.of()).block();

        assertEquals(List.of("completed:" + done.sagaId()), seen);
        assertEquals(SagaStatus.COMPENSATED, compensated.status());
    }

    @Test
    void startRunsInTheBackgroundAndIsObservable() {
        SagaOrchestrator orchestrator = orchestrator();
        orchestrator.register(SagaBuilder.saga("Async")
                .step("a").action(ctx -> Mono.delay(Duration.ofMillis(50)).thenReturn("a")).add()
                .build());

        String sagaId = orchestrator.start("Async", Map.of("k", "v")).block();

        assertNotNull(sagaId);
        SagaState state = awaitTerminal(orchestrator, sagaId);
        assertEquals(SagaStatus.COMPLETED, state.status());
        assertEquals("v", state.data().get("k"));
    }

    @Test
    void startWithIdIsIdempotent() {
        AtomicInteger runs = new AtomicInteger();
        SagaOrchestrator orchestrator = orchestrator();
        SagaDefinition def = SagaBuilder.saga("Once").step("a").run(ctx -> runs.incrementAndGet()).add().build();

        orchestrator.startWithId("fixed-id", def, Map.of()).block();
        awaitTerminal(orchestrator, "fixed-id");
        orchestrator.startWithId("fixed-id", def, Map.of()).block();

        assertEquals(1, runs.get());
        assertEquals(1, orchestrator.history("Once", null, 10).count().block());
    }

    @Test
    void historyFiltersByNameAndStatus() {
        SagaOrchestrator orchestrator = orchestrator();
        List<String> ignored = new CopyOnWriteArrayList<>();
        orchestrator.execute(recordingSaga("H", 2, 0, ignored), Map.of()).block();
        orchestrator.execute(orchestrator.definition("H").orElseThrow(), Map.of()).block();
        orchestrator.execute(recordingSaga("Other", 1, 1, ignored), Map.of()).block();

        assertEquals(2, orchestrator.history("H", null, 10).count().block());
        assertEquals(1, orchestrator.history(null, SagaStatus.COMPENSATED, 10).count().block());
        assertEquals(1, orchestrator.history(null, null, 1).count().block());
    }

    @Test
    void registryRejectsConflictingNamesAndUnknownSagas() {
        SagaOrchestrator orchestrator = orchestrator();
        SagaDefinition first = SagaBuilder.saga("Dup").step("a").map(ctx -> 1).add().build();
        SagaDefinition second = SagaBuilder.saga("Dup").step("a").map(ctx -> 2).add().build();

        orchestrator.register(first);
        orchestrator.register(first);
        assertThrows(IllegalStateException.class, () -> orchestrator.register(second));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.execute("Missing", Map.of()).block());
        assertTrue(orchestrator.unregister("Dup"));
        assertTrue(orchestrator.definition("Dup").isEmpty());
    }

    @Test
    void contextExposesAStableIdempotencyKeyPerStep() {
        List<String> keys = new CopyOnWriteArrayList<>();
        SagaDefinition def = SagaBuilder.saga("Keys")
                .step("a").run(ctx -> keys.add(ctx.idempotencyKey())).add()
                .step("b").run(ctx -> keys.add(ctx.idempotencyKey())).add()
                .build();

        SagaState state = orchestrator().execute(def, Map.of()).block();

        assertEquals(List.of(state.sagaId() + ":1", state.sagaId() + ":2"), keys);
    }
}
