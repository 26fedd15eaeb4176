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

import com.firefly.consistency.outbox.OutboxMessage;

import java.time.Instant;

/**
 * Observability hook for the outbox publisher. All methods default to no-ops.
 */
public interface OutboxEvents {
    default void onBatchClaimed(String publisherId, int size) {}
    default void onPublished(OutboxMessage message, long latencyMs) {}
    default void onDeliveryFailed(OutboxMessage message, Throwable error, Instant nextAttemptAt) {}
    default void onDeadLettered(OutboxMessage message, Throwable error) {}
    default void onDeadLettersRequeued(int count) {}
    default void onCleanup(int removed) {}
}
