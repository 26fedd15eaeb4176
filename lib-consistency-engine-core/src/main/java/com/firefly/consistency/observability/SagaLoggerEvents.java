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
import com.firefly.consistency.util.LogFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link SagaEvents} implementation that emits JSON-friendly key/value logs via SLF4J.
 * Includes error class/message and the compensation lifecycle.
 */
public class SagaLoggerEvents implements SagaEvents {
    private static final Logger log = LoggerFactory.getLogger(SagaLoggerEvents.class);

    @Override
    public void onStart(String sagaName, String sagaId) {
        log.info(LogFormat.json(
                "saga_event", "start",
                "saga", sagaName,
                "sagaId", sagaId
        ));
    }

    @Override
    public void onResumed(String sagaName, String sagaId, SagaStatus status) {
        log.info(LogFormat.json(
                "saga_event", "resumed",
                "saga", sagaName,
                "sagaId", sagaId,
                "status", status.name()
        ));
    }

    @Override
    public void onStepStarted(String sagaName, String sagaId, int stepIndex, String stepName) {
        log.info(LogFormat.json(
                "saga_event", "step_started",
                "saga", sagaName,
                "sagaId", sagaId,
                "step_index", Integer.toString(stepIndex),
                "step", stepName
        ));
    }

    @Override
    public void onStepSuccess(String sagaName, String sagaId, int stepIndex, String stepName, int attempts, long latencyMs) {
        log.info(LogFormat.json(
                "saga_event", "step_success",
                "saga", sagaName,
                "sagaId", sagaId,
                "step_index", Integer.toString(stepIndex),
                "step", stepName,
                "attempts", Integer.toString(attempts),
                "latency_ms", Long.toString(latencyMs)
        ));
    }

    @Override
    public void onStepFailed(String sagaName, String sagaId, int stepIndex, String stepName, Throwable error, int attempts, long latencyMs) {
        log.warn(LogFormat.json(
                "saga_event", "step_failed",
                "saga", sagaName,
                "sagaId", sagaId,
                "step_index", Integer.toString(stepIndex),
                "step", stepName,
                "attempts", Integer.toString(attempts),
                "latency_ms", Long.toString(latencyMs),
                "error_class", LogFormat.errorClass(error),
                "error_msg", LogFormat.errorMessage(error)
        ));
    }

    @Override
    public void onCompensationStarted(String sagaName, String sagaId, int stepIndex, String stepName) {
        log.info(LogFormat.json(
                "saga_event", "compensation_started",
                "saga", sagaName,
                "sagaId", sagaId,
                "step_index", Integer.toString(stepIndex),
                "step", stepName
        ));
    }

    @Override
    public void onCompensated(String sagaName, String sagaId, int stepIndex, String stepName, Throwable error) {
        if (error == null) {
            log.info(LogFormat.json(
                    "saga_event", "compensated",
                    "saga", sagaName,
                    "sagaId", sagaId,
                    "step_index", Integer.toString(stepIndex),
                    "step", stepName
            ));
        } else {
            log.error(LogFormat.json(
                    "saga_event", "compensation_failed",
                    "saga", sagaName,
                    "sagaId", sagaId,
                    "step_index", Integer.toString(stepIndex),
                    "step", stepName,
                    "error_class", LogFormat.errorClass(error),
                    "error_msg", LogFormat.errorMessage(error)
            ));
        }
    }

    @Override
    public void onCompensationSkipped(String sagaName, String sagaId, int stepIndex, String stepName, String reason) {
        log.debug(LogFormat.json(
                "saga_event", "compensation_skipped",
                "saga", sagaName,
                "sagaId", sagaId,
                "step_index", Integer.toString(stepIndex),
                "step", stepName,
                "reason", reason
        ));
    }

    @Override
    public void onCompleted(String sagaName, String sagaId, SagaStatus status) {
        String line = LogFormat.json(
                "saga_event", "completed",
                "saga", sagaName,
                "sagaId", sagaId,
                "status", status.name()
        );
        if (status == SagaStatus.COMPENSATION_FAILED) {
            log.error(line);
        } else {
            log.info(line);
        }
    }
}
