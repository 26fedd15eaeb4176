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
 * One step of a saga definition.
 *
 * @param name         unique within the saga
 * @param handler      the action
 * @param compensation undo action, or {@code null} when the step needs none
 * @param timeout      per-attempt timeout, or {@code null}
 * @param retry        additional attempts after a failed one
 * @param backoff      delay between attempts
 */
public record StepDefinition(String name,
                             StepHandler handler,
                             CompensationHandler compensation,
                             Duration timeout,
                             int retry,
                             Duration backoff) {

    public StepDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        if (retry < 0) throw new IllegalArgumentException("retry must be >= 0");
        backoff = backoff == null ? Duration.ZERO : backoff;
    }

    public boolean hasCompensation() {
        return compensation != null;
    }
}
