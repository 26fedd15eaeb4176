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

import com.firefly.consistency.exception.CompensationException;
import com.firefly.consistency.observability.SagaEvents;
import com.firefly.consistency.util.LogFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Runs the compensations of a failed saga, newest successful step first.
 *
 * <p>Only steps that succeeded are compensated; the failed step and the steps after it
 * never are. Each compensation is invoked at most once: a step whose status is still
 * {@link StepStatus#COMPENSATING} when a saga is resumed may or may not have been undone,
 * so it is reported as failed for an operator instead of being invoked again.
 */
final class SagaCompensator {
    private static final Logger log = LoggerFactory.getLogger(SagaCompensator.class);

    private final SagaEvents events;
    private final CompensationPolicy policy;

    SagaCompensator(SagaEvents events, CompensationPolicy policy) {
        this.events = events;
        this.policy = policy;
    }

    Mono<Void> compensate(SagaRun run) {
        List<Integer> order = new ArrayList<>();
        for (StepResult r : run.state().steps()) {
            // a failure recorded before a restart still decides the outcome and the halt policy
            if (r.status() == StepStatus.COMPENSATION_FAILED) {
                run.markCompensationFailed();
            }
            if (r.status() == StepStatus.SUCCESS || r.status() == StepStatus.COMPENSATING) {
                order.add(r.stepIndex());
            }
        }
        Collections.reverse(order);
        return Flux.fromIterable(order)
                .concatMap(index -> compensateOne(run, index))
                .then();
    }

    private Mono<Void> compensateOne(SagaRun run, int index) {
        return Mono.defer(() -> {
            StepResult step = run.state().step(index);
            StepDefinition def = run.definition.step(index);

            if (step.status() == StepStatus.COMPENSATING) {
                CompensationException err = new CompensationException(run.sagaId(), index, def.name(),
                        new IllegalStateException("compensation outcome unknown after restart"));
                return recordFailure(run, step, err);
            }
            if (!def.hasCompensation()) {
                events.onCompensationSkipped(run.sagaName(), run.sagaId(), index, def.name(), "no compensation");
                return Mono.empty();
            }
            if (run.compensationFailed() && policy == CompensationPolicy.HALT_ON_FAILURE) {
                events.onCompensationSkipped(run.sagaName(), run.sagaId(), index, def.name(), "halted after failed compensation");
                return Mono.empty();
            }

            run.context.currentStepIndex(index);
            return run.persist(s -> s.withStep(step.withStatus(StepStatus.COMPENSATING, null, run.now()), run.now()))
                    .doOnSuccess(s -> events.onCompensationStarted(run.sagaName(), run.sagaId(), index, def.name()))
                    .then(Mono.defer(() -> def.compensation().compensate(run.context))
                            .then(Mono.just(Optional.<Throwable>empty()))
                            .onErrorResume(e -> Mono.just(Optional.of(e))))
                    .flatMap(error -> {
                        if (error.isPresent()) {
                            return recordFailure(run, run.state().step(index),
                                    new CompensationException(run.sagaId(), index, def.name(), error.get()));
                        }
                        events.onCompensated(run.sagaName(), run.sagaId(), index, def.name(), null);
                        return run.persist(s -> s.withStep(s.step(index).withStatus(StepStatus.COMPENSATED, null, run.now()), run.now()))
                                .then();
                    });
        });
    }

    private Mono<Void> recordFailure(SagaRun run, StepResult step, CompensationException err) {
        run.markCompensationFailed();
        log.error(LogFormat.json(
                "saga_step", "compensation_error",
                "saga", run.sagaName(),
                "sagaId", run.sagaId(),
                "step_index", Integer.toString(step.stepIndex()),
                "step", step.stepName(),
                "error_class", LogFormat.errorClass(err.getCause()),
                "error_msg", LogFormat.errorMessage(err.getCause())
        ));
        events.onCompensated(run.sagaName(), run.sagaId(), step.stepIndex(), step.stepName(), err);
        return run.persist(s -> s.withStep(step.withStatus(StepStatus.COMPENSATION_FAILED, err.getMessage(), run.now()), run.now())
                        .withFailureReason(err.getMessage()))
                .then();
    }
}
