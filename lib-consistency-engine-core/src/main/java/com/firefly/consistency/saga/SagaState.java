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

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted state of a saga instance, saved after every transition so a restarted
 * orchestrator can resume it.
 *
 * @param data saga variables (input plus step outputs); persistent stores keep them as JSON
 */
public record SagaState(String sagaId,
                        String sagaName,
                        SagaStatus status,
                        List<StepResult> steps,
                        Map<String, Object> data,
                        Instant createdAt,
                        Instant updatedAt,
                        Instant completedAt,
                        String failureReason) {

    public SagaState {
        Objects.requireNonNull(sagaId, "sagaId");
        Objects.requireNonNull(sagaName, "sagaName");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        steps = List.copyOf(steps == null ? List.of() : steps);
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data == null ? Map.of() : data));
    }

    public static SagaState pending(String sagaId, SagaDefinition definition, Map<String, Object> input, Instant now) {
        List<StepResult> steps = new ArrayList<>();
        List<StepDefinition> defs = definition.steps();
        for (int i = 0; i < defs.size(); i++) {
            steps.add(StepResult.pending(i + 1, defs.get(i).name(), defs.get(i).hasCompensation()));
        }
        return new SagaState(sagaId, definition.name(), SagaStatus.PENDING, steps, input, now, now, null, null);
    }

    /** Step by 1-based index. */
    public StepResult step(int stepIndex) {
        return steps.get(stepIndex - 1);
    }

    public SagaState withStatus(SagaStatus next, Instant now) {
        return new SagaState(sagaId, sagaName, next, steps, data, createdAt, now, completedAt, failureReason);
    }

    public SagaState withStep(StepResult step, Instant now) {
        List<StepResult> updated = new ArrayList<>(steps);
        updated.set(step.stepIndex() - 1, step);
        return new SagaState(sagaId, sagaName, status, updated, data, createdAt, now, completedAt, failureReason);
    }

    public SagaState withData(Map<String, Object> variables) {
        return new SagaState(sagaId, sagaName, status, steps, variables, createdAt, updatedAt, completedAt, failureReason);
    }

    public SagaState withFailureReason(String reason) {
        return new SagaState(sagaId, sagaName, status, steps, data, createdAt, updatedAt, completedAt, reason);
    }

    public SagaState finished(SagaStatus terminal, Instant now) {
        return new SagaState(sagaId, sagaName, terminal, steps, data, createdAt, now, now, failureReason);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
