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

import java.time.Duration;

/**
 * The saga exceeded its wall-clock budget while running. Treated as a failure of the
 * step that was in flight.
 */
public class SagaTimeoutException extends ConsistencyException {
    private final String sagaId;
    private final Duration budget;

    public SagaTimeoutException(String sagaId, Duration budget) {
        super("Saga " + sagaId + " exceeded its timeout of " + budget);
        this.sagaId = sagaId;
        this.budget = budget;
    }

    public String getSagaId() { return sagaId; }
    public Duration getBudget() { return budget; }
}
