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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fans out every {@link SagaEvents} callback to a list of delegates. A failing delegate
 * is logged and does not prevent the remaining ones from being called.
 */
public class CompositeSagaEvents implements SagaEvents {
    private static final Logger log = LoggerFactory.getLogger(CompositeSagaEvents.class);

    private final List<SagaEvents> delegates;

    public CompositeSagaEvents(List<SagaEvents> delegates) {
        this.delegates = List.copyOf(Objects.requireNonNull(delegates, "delegates"));
    }

    public List<SagaEvents> delegates() {
        return delegates;
    }

    private void each(Consumer<SagaEvents> call) {
        for (SagaEvents d : delegates) {
            try {
                call.accept(d);
            } catch (RuntimeException e) {
                log.warn("Saga events delegate {} failed", d.getClass().getName(), e);
            }
        }
    }

    @Override
    public void onStart(String sagaName, String sagaId) {
        each(d -> d.onStart(sagaName, sagaId));
    }

    @Override
    public void onResumed(String sagaName, String sagaId, SagaStatus status) {
        each(d -> d.onResumed(sagaName, sagaId, status));
    }

    @Override
    public void onStepStarted(String sagaName, String sagaId, int stepIndex, String stepName) {
        each(d -> d.onStepStarted(sagaName, sagaId, stepIndex, stepName));
    }

    @Override
    public void onStepSuccess(String sagaName, String sagaId, int stepIndex, String stepName, int attempts, long latencyMs) {
        each(d -> d.onStepSuccess(sagaName, sagaId, stepIndex, stepName, attempts, latencyMs));
    }

    @Override
    public void onStepFailed(String sagaName, String sagaId, int stepIndex, String stepName, Throwable error, int attempts, long latencyMs) {
        each(d -> d.onStepFailed(sagaName, sagaId, stepIndex, stepName, error, attempts, latencyMs));
    }

    @Override
    public void onCompensationStarted(String sagaName, String sagaId, int stepIndex, String stepName) {
        each(d -> d.onCompensationStarted(sagaName, sagaId, stepIndex, stepName));
    }

    @Override
    public void onCompensated(String sagaName, String sagaId, int stepIndex, String stepName, Throwable error) {
        each(d -> d.onCompensated(sagaName, sagaId, stepIndex, stepName, error));
    }

    @Override
    public void onCompensationSkipped(String sagaName, String sagaId, int stepIndex, String stepName, String reason) {
        each(d -> d.onCompensationSkipped(sagaName, sagaId, stepIndex, stepName, reason));
    }

    @Override
    public void onCompleted(String sagaName, String sagaId, SagaStatus status) {
        each(d -> d.onCompleted(sagaName, sagaId, status));
    }
}
