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

import java.time.Instant;

/**
 * Persisted outcome of one step. Indexes are 1-based in declaration order.
 */
public record StepResult(int stepIndex,
                         String stepName,
                         StepStatus status,
                         boolean compensationAvailable,
                         int attempts,
                         String error,
                         Instant startedAt,
                         Instant finishedAt) {

    public static StepResult pending(int stepIndex, String stepName, boolean compensationAvailable) {
        return new StepResult(stepIndex, stepName, StepStatus.PENDING, compensationAvailable, 0, null, null, null);
    }

    public StepResult running(Instant at) {
        return new StepResult(stepIndex, stepName, StepStatus.RUNNING, compensationAvailable, attempts, null, at, null);
    }

    public StepResult succeeded(int attempts, Instant at) {
        return new StepResult(stepIndex, stepName, StepStatus.SUCCESS, compensationAvailable, attempts, null, startedAt, at);
    }

    public StepResult failed(int attempts, String error, Instant at) {
        return new StepResult(stepIndex, stepName, StepStatus.FAILED, compensationAvailable, attempts, error,
                startedAt != null ? startedAt : at, at);
    }

    public StepResult withStatus(StepStatus next, String error, Instant at) {
        return new StepResult(stepIndex, stepName, next, compensationAvailable, attempts, error, startedAt, at);
    }
}
