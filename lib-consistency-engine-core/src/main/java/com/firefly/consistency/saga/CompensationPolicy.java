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

/**
 * What happens to the remaining compensations once one of them fails.
 */
public enum CompensationPolicy {
    /** Keep compensating the earlier steps; the saga still ends in COMPENSATION_FAILED. */
    BEST_EFFORT,
    /** Stop at the first failed compensation and leave the rest to the operator. */
    HALT_ON_FAILURE
}
