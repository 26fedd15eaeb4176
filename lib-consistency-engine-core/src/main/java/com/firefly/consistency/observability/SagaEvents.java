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

package com.firefly.consistency.observability;

import com.firefly.consistency.saga.SagaStatus;

/**
 * Observability hook for saga lifecycle events.
 * Provide your own Spring bean of this type to export metrics, traces or logs.
 * A default logger-based implementation is provided: {@link SagaLoggerEvents}.
 *
 * Notes:
 * - step indexes are 1-based, in declaration order.
 * - onCompensated is invoked for both success and error cases; a null error indicates a successful compensation.
 */
public interface SagaEvents {
    default void onStart(String sagaName, String sagaId) {}
    /** Invoked by crash recovery before a persisted saga continues. */
    default void onResumed(String sagaName, String sagaId, SagaStatus status) {}
    /** Invoked when a step transitions to RUNNING. */
    default void onStepStarted(String sagaName, String sagaId, int stepIndex, String stepName) {}
    default void onStepSuccess(String sagaName, String sagaId, int stepIndex, String stepName, int attempts, long latencyMs) {}
    default void onStepFailed(String sagaName, String sagaId, int stepIndex, String stepName, Throwable error, int attempts, long latencyMs) {}

    default void onCompensationStarted(String sagaName, String sagaId, int stepIndex, String stepName) {}
    default void onCompensated(String sagaName, String sagaId, int stepIndex, String stepName, Throwable error) {}
    default void onCompensationSkipped(String sagaName, String sagaId, int stepIndex, String stepName, String reason) {}

    default void onCompleted(String sagaName, String sagaId, SagaStatus status) {}
}
