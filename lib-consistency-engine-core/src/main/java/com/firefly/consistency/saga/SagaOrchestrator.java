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

import com.firefly.consistency.exception.SagaStepException;
import com.firefly.consistency.exception.SagaTimeoutException;
import com.firefly.consistency.observability.SagaEvents;
import com.firefly.consistency.util.LogFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes saga definitions step by step and compensates completed steps in reverse
 * order when one fails.
 *
 * <p>Every transition (saga status, step status, context variables) is written to the
 * {@link SagaStateStore} before the orchestrator moves on, so {@link #recover()} can
 * resume interrupted sagas after a restart. A step that was {@code RUNNING} at crash time
 * is executed again; step actions should therefore be idempotent on
 * {@link SagaContext#idempotencyKey()}.
 *
 * <p>Store failures are not step failures: they abort the run and leave the last
 * persisted state for recovery.
 */
public class SagaOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SagaOrchestrator.class);

    private final SagaStateStore store;
    private final SagaEvents events;
    private final SagaOrchestratorSettings settings;
    private final Clock clock;
    private final SagaCompensator compensator;
    private final Map<String, SagaDefinition> definitions = new ConcurrentHashMap<>();
    private final Map<String, Disposable> inFlight = new ConcurrentHashMap<>();

    public SagaOrchestrator(SagaStateStore store, SagaEvents events, SagaOrchestratorSettings settings, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.events = events != null ? events : new SagaEvents() {};
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.compensator = new SagaCompensator(this.events, settings.compensationPolicy());
    }

    public SagaOrchestrator(SagaStateStore store, SagaEvents events) {
        this(store, events, SagaOrchestratorSettings.defaults(), Clock.systemUTC());
    }

    // ---------------------------------------------------------------- registry

    /**
     * Registers a definition under its name. Registering the same instance twice is a no-op.
     *
     * @throws IllegalStateException if another definition already uses the name
     */
    public void register(SagaDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        SagaDefinition existing = definitions.putIfAbsent(definition.name(), definition);
        if (existing != null && existing != definition) {
            throw new IllegalStateException("Saga already registered: " + definition.name());
        }
    }

    public boolean unregister(String sagaName) {
        return definitions.remove(sagaName) != null;
    }

    public Optional<SagaDefinition> definition(String sagaName) {
        return Optional.ofNullable(definitions.get(sagaName));
    }

    public Collection<SagaDefinition> definitions() {
        return List.copyOf(definitions.values());
    }

    // ---------------------------------------------------------------- starting

    /** Persists a new saga and runs it in the background. Emits the saga id once persisted. */
    public Mono<String> start(String sagaName, Map<String, Object> input) {
        return Mono.defer(() -> start(requireDefinition(sagaName), input));
    }

    public Mono<String> start(SagaDefinition definition, Map<String, Object> input) {
        return startWithId(UUID.randomUUID().toString(), definition, input);
    }

    /**
     * Starts a saga under a caller-chosen id. If a saga with that id already exists nothing
     * is started and the id is returned, which makes redelivered trigger events harmless.
     */
    public Mono<String> startWithId(String sagaId, String sagaName, Map<String, Object> input) {
        return Mono.defer(() -> startWithId(sagaId, requireDefinition(sagaName), input));
    }

    public Mono<String> startWithId(String sagaId, SagaDefinition definition, Map<String, Object> input) {
        return Mono.defer(() -> {
            register(definition);
            SagaState initial = SagaState.pending(sagaId, definition, input, clock.instant());
            return store.insert(initial).map(inserted -> {
                if (inserted) {
                    launch(definition, initial);
                } else {
                    log.info(LogFormat.json("saga_event", "duplicate_start", "saga", definition.name(), "sagaId", sagaId));
                }
                return sagaId;
            });
        });
    }

    /** Persists a new saga and runs it to a terminal state. */
    public Mono<SagaState> execute(String sagaName, Map<String, Object> input) {
        return Mono.defer(() -> execute(requireDefinition(sagaName), input));
    }

    public Mono<SagaState> execute(SagaDefinition definition, Map<String, Object> input) {
        return Mono.defer(() -> {
            register(definition);
            SagaState initial = SagaState.pending(UUID.randomUUID().toString(), definition, input, clock.instant());
            return store.insert(initial).then(run(definition, initial));
        });
    }

    // ---------------------------------------------------------------- queries

    public Mono<SagaState> getStatus(String sagaId) {
        return store.findById(sagaId);
    }

    /** Most recently updated sagas first; {@code null} filters match everything. */
    public Flux<SagaState> history(String sagaName, SagaStatus status, int limit) {
        return store.findRecent(sagaName, status, limit);
    }

    /** Sagas whose compensation failed and need an operator. */
    public Flux<SagaState> compensationFailures() {
        return store.findByStatus(EnumSet.of(SagaStatus.COMPENSATION_FAILED));
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    // ---------------------------------------------------------------- recovery

    /**
     * Resumes every non-terminal saga found in the store, one at a time, and emits their
     * final states. Sagas already running in this orchestrator, sagas whose definition is
     * not registered and sagas whose stored steps do not match the registered definition
     * are skipped.
     */
    public Flux<SagaState> recover() {
        return store.findByStatus(SagaStatus.resumable())
                .filter(s -> !inFlight.containsKey(s.sagaId()))
                .concatMap(state -> {
                    SagaDefinition definition = definitions.get(state.sagaName());
                    if (definition == null) {
                        log.warn(LogFormat.json("saga_event", "recovery_skipped", "saga", state.sagaName(),
                                "sagaId", state.sagaId(), "reason", "definition not registered"));
                        return Mono.empty();
                    }
                    if (definition.size() != state.steps().size()) {
                        log.error(LogFormat.json("saga_event", "recovery_skipped", "saga", state.sagaName(),
                                "sagaId", state.sagaId(), "reason", "stored steps do not match definition"));
                        return Mono.empty();
                    }
                    events.onResumed(state.sagaName(), state.sagaId(), state.status());
                    return run(definition, state)
                            .onErrorResume(e -> {
                                log.error(LogFormat.json("saga_event", "recovery_failed", "saga", state.sagaName(),
                                        "sagaId", state.sagaId(), "error_class", LogFormat.errorClass(e),
                                        "error_msg", LogFormat.errorMessage(e)), e);
                                return Mono.empty();
                            });
                });
    }

    /** Cancels background runs. Their sagas stay in the store and are picked up by {@link #recover()}. */
    public void shutdown() {
        inFlight.values().forEach(Disposable::dispose);
        inFlight.clear();
    }

    // ---------------------------------------------------------------- execution

    private SagaDefinition requireDefinition(String sagaName) {
        SagaDefinition definition = definitions.get(sagaName);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown saga: " + sagaName);
        }
        return definition;
    }

    private void launch(SagaDefinition definition, SagaState initial) {
        String sagaId = initial.sagaId();
        Disposable running = run(definition, initial)
                .subscribeOn(Schedulers.boundedElastic())
                .doFinally(signal -> inFlight.remove(sagaId))
                .subscribe(
                        state -> { },
                        e -> log.error(LogFormat.json("saga_event", "run_aborted", "saga", definition.name(),
                                "sagaId", sagaId, "error_class", LogFormat.errorClass(e),
                                "error_msg", LogFormat.errorMessage(e)), e));
        inFlight.put(sagaId, running);
        if (running.isDisposed()) {
            inFlight.remove(sagaId, running);
        }
    }

    Mono<SagaState> run(SagaDefinition definition, SagaState initial) {
        Duration budget = definition.timeout().orElse(settings.defaultTimeout());
        SagaRun run = new SagaRun(definition, initial, budget, store, clock);
        Mono<SagaState> flow = switch (initial.status()) {
            case PENDING, RUNNING -> begin(run)
                    .then(executeSteps(run))
                    .then(Mono.defer(() -> run.hasFailed() ? compensate(run) : finish(run, SagaStatus.COMPLETED)));
            case COMPENSATING -> compensate(run);
            default -> Mono.just(initial);
        };
        return flow.flatMap(state -> invokeCallback(definition, state));
    }

    private Mono<Void> begin(SagaRun run) {
        if (run.state().status() != SagaStatus.PENDING) {
            return Mono.empty();
        }
        return run.persist(s -> s.withStatus(SagaStatus.RUNNING, run.now()))
                .doOnSuccess(s -> events.onStart(run.sagaName(), run.sagaId()))
                .then();
    }

    private Mono<Void> executeSteps(SagaRun run) {
        List<StepResult> steps = run.state().steps();
        int first = 1;
        while (first <= steps.size() && steps.get(first - 1).status() == StepStatus.SUCCESS) {
            first++;
        }
        if (first <= steps.size() && steps.get(first - 1).status() == StepStatus.FAILED) {
            // failure persisted before the crash, compensation never started
            run.markFailed(first);
            return Mono.empty();
        }
        return Flux.range(first, steps.size() - first + 1)
                .concatMap(index -> Mono.defer(() -> run.hasFailed() ? Mono.<Void>empty() : executeStep(run, index)))
                .then();
    }

    private Mono<Void> executeStep(SagaRun run, int index) {
        StepDefinition step = run.definition.step(index);
        Duration remaining = Duration.between(clock.instant(), run.deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            return onStepFailure(run, index, new SagaTimeoutException(run.sagaId(), run.budget), 0, 0L);
        }

        AtomicInteger attempts = new AtomicInteger();
        Mono<Object> action = Mono.defer(() -> {
            attempts.incrementAndGet();
            return step.handler().execute(run.context);
        });
        if (step.timeout() != null) {
            action = action.timeout(step.timeout());
        }
        if (step.retry() > 0) {
            action = step.backoff().isZero()
                    ? action.retryWhen(Retry.max(step.retry()).onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    : action.retryWhen(Retry.fixedDelay(step.retry(), step.backoff()).onRetryExhaustedThrow((spec, signal) -> signal.failure()));
        }
        Mono<Outcome> outcome = action
                .timeout(remaining, Mono.error(() -> new SagaTimeoutException(run.sagaId(), run.budget)))
                .map(Outcome::success)
                .defaultIfEmpty(Outcome.success(null))
                .onErrorResume(e -> Mono.just(Outcome.failure(e)));

        return Mono.defer(() -> {
            long start = System.nanoTime();
            run.context.currentStepIndex(index);
            return run.persist(s -> s.withStep(s.step(index).running(run.now()), run.now()))
                    .doOnSuccess(s -> events.onStepStarted(run.sagaName(), run.sagaId(), index, step.name()))
                    .then(outcome)
                    .flatMap(o -> {
                        long latencyMs = (System.nanoTime() - start) / 1_000_000L;
                        return o.error() == null
                                ? onStepSuccess(run, index, o.value(), attempts.get(), latencyMs)
                                : onStepFailure(run, index, o.error(), attempts.get(), latencyMs);
                    });
        });
    }

    private Mono<Void> onStepSuccess(SagaRun run, int index, Object output, int attempts, long latencyMs) {
        StepDefinition step = run.definition.step(index);
        if (output != null) {
            run.context.put(step.name(), output);
        }
        return run.persist(s -> s.withStep(s.step(index).succeeded(attempts, run.now()), run.now()))
                .doOnSuccess(s -> events.onStepSuccess(run.sagaName(), run.sagaId(), index, step.name(), attempts, latencyMs))
                .then();
    }

    private Mono<Void> onStepFailure(SagaRun run, int index, Throwable cause, int attempts, long latencyMs) {
        StepDefinition step = run.definition.step(index);
        SagaStepException error = new SagaStepException(run.sagaId(), index, step.name(), cause);
        run.markFailed(index);
        log.warn(LogFormat.json(
                "saga_step", "failed",
                "saga", run.sagaName(),
                "sagaId", run.sagaId(),
                "step_index", Integer.toString(index),
                "step", step.name(),
                "attempts", Integer.toString(attempts),
                "error_class", LogFormat.errorClass(cause),
                "error_msg", LogFormat.errorMessage(cause)
        ));
        return run.persist(s -> s.withStep(s.step(index).failed(attempts, error.getMessage(), run.now()), run.now())
                        .withFailureReason(error.getMessage()))
                .doOnSuccess(s -> events.onStepFailed(run.sagaName(), run.sagaId(), index, step.name(), error, attempts, latencyMs))
                .then();
    }

    private Mono<SagaState> compensate(SagaRun run) {
        return run.persist(s -> s.status() == SagaStatus.COMPENSATING ? s : s.withStatus(SagaStatus.COMPENSATING, run.now()))
                .then(compensator.compensate(run))
                .then(Mono.defer(() -> finish(run,
                        run.compensationFailed() ? SagaStatus.COMPENSATION_FAILED : SagaStatus.COMPENSATED)));
    }

    private Mono<SagaState> finish(SagaRun run, SagaStatus terminal) {
        return run.persist(s -> s.finished(terminal, run.now()))
                .doOnSuccess(s -> events.onCompleted(run.sagaName(), run.sagaId(), terminal));
    }

    private Mono<SagaState> invokeCallback(SagaDefinition definition, SagaState state) {
        return definition.callbackFor(state.status())
                .map(callback -> Mono.defer(() -> callback.accept(state))
                        .onErrorResume(e -> {
                            log.warn(LogFormat.json("saga_event", "callback_failed", "saga", state.sagaName(),
                                    "sagaId", state.sagaId(), "status", state.status().name(),
                                    "error_class", LogFormat.errorClass(e), "error_msg", LogFormat.errorMessage(e)));
                            return Mono.empty();
                        })
                        .thenReturn(state))
                .orElseGet(() -> Mono.just(state));
    }

    private record Outcome(Object value, Throwable error) {
        static Outcome success(Object value) { return new Outcome(value, null); }
        static Outcome failure(Throwable error) { return new Outcome(null, error); }
    }
}
