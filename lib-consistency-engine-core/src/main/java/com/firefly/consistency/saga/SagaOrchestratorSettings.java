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
import java.util.Objects;

/**
 * Orchestrator defaults.
 *
 * @param defaultTimeout     budget for sagas that do not declare one
 * @param compensationPolicy behaviour after a failed compensation
 */
public record SagaOrchestratorSettings(Duration defaultTimeout, CompensationPolicy compensationPolicy) {

    public SagaOrchestratorSettings {
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(compensationPolicy, "compensationPolicy");
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
    }

    public static SagaOrchestratorSettings defaults() {
        return new SagaOrchestratorSettings(Duration.ofMinutes(5), CompensationPolicy.BEST_EFFORT);
    }
}
