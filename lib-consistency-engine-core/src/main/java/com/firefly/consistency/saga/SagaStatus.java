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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a saga instance:
 * {@code PENDING -> RUNNING -> COMPLETED}, or on failure
 * {@code RUNNING -> COMPENSATING -> COMPENSATED | COMPENSATION_FAILED}.
 */
public enum SagaStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    COMPENSATING,
    COMPENSATED,
    /** Terminal; an operator has to resolve the failed compensation. */
    COMPENSATION_FAILED;

    private static final Set<SagaStatus> TERMINAL = EnumSet.of(COMPLETED, COMPENSATED, COMPENSATION_FAILED);
    private static final Set<SagaStatus> RESUMABLE = EnumSet.of(PENDING, RUNNING, COMPENSATING);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** States that crash recovery picks up after a restart. */
    public static Set<SagaStatus> resumable() {
        return EnumSet.copyOf(RESUMABLE);
    }
}
