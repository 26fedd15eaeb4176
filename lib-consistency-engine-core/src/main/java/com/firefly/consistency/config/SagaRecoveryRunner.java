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

package com.firefly.consistency.config;

import com.firefly.consistency.saga.SagaOrchestrator;
import com.firefly.consistency.util.LogFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import reactor.core.scheduler.Schedulers;

/**
 * Resumes interrupted sagas once the application is ready, in the background.
 */
public class SagaRecoveryRunner implements ApplicationListener<ApplicationReadyEvent> {
    private static final Logger log = LoggerFactory.getLogger(SagaRecoveryRunner.class);

    private final SagaOrchestrator orchestrator;

    public SagaRecoveryRunner(SagaOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        orchestrator.recover()
                .count()
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        n -> log.info(LogFormat.json("saga_event", "recovery_done", "resumed", Long.toString(n))),
                        e -> log.error(LogFormat.json("saga_event", "recovery_failed",
                                "error_class", LogFormat.errorClass(e), "error_msg", LogFormat.errorMessage(e)), e));
    }
}
