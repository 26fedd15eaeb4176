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

package com.firefly.consistency.exception;

/**
 * A compensation action failed. The saga ends in {@code COMPENSATION_FAILED} and waits
 * for an operator; the compensation is never retried automatically.
 */
public class CompensationException extends ConsistencyException {
    private final String sagaId;
    private final int stepIndex;
    private final String stepName;

    public CompensationException(String sagaId, int stepIndex, String stepName, Throwable cause) {
        super("Compensation of step " + stepIndex + " (" + stepName + ") failed for saga " + sagaId
                + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.sagaId = sagaId;
        this.stepIndex = stepIndex;
        this.stepName = stepName;
    }

    public String getSagaId() { return sagaId; }
    public int getStepIndex() { return stepIndex; }
    public String getStepName() { return stepName; }
}
