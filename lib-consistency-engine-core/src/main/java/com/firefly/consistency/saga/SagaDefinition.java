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

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of a saga: its ordered steps, an optional wall-clock budget and
 * completion callbacks. Usually built with {@link SagaBuilder}.
 */
public final class SagaDefinition {
    private final String name;
    private final List<StepDefinition> steps;
    private final Duration timeout;
    private final SagaCallback onCompleted;
    private final SagaCallback onCompensated;
    private final SagaCallback onFailed;

    SagaDefinition(String name, List<StepDefinition> steps, Duration timeout,
                   SagaCallback onCompleted, SagaCallback onCompensated, SagaCallback onFailed) {
        this.name = Objects.requireNonNull(name, "name");
        this.steps = List.copyOf(steps);
        this.timeout = timeout;
        this.onCompleted = onCompleted;
        this.onCompensated = onCompensated;
        this.onFailed = onFailed;
        if (this.steps.isEmpty()) {
            throw new IllegalStateException("Saga " + name + " has no steps");
        }
    }

    public String name() { return name; }
    public List<StepDefinition> steps() { return steps; }

    /** Step by 1-based index. */
    public StepDefinition step(int stepIndex) { return steps.get(stepIndex - 1); }

    public int size() { return steps.size(); }

    /** Wall-clock budget of the whole saga; empty means the orchestrator default. */
    public Optional<Duration> timeout() { return Optional.ofNullable(timeout); }

    /** Callback for the given terminal status, if any. */
    Optional<SagaCallback> callbackFor(SagaStatus status) {
        return Optional.ofNullable(switch (status) {
            case COMPLETED -> onCompleted;
            case COMPENSATED -> onCompensated;
            case COMPENSATION_FAILED -> onFailed;
            default -> null;
        });
    }
}
