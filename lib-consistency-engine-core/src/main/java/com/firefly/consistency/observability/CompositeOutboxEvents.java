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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fans out {@link OutboxEvents} callbacks to several delegates.
 */
public class CompositeOutboxEvents implements OutboxEvents {
    private static final Logger log = LoggerFactory.getLogger(CompositeOutboxEvents.class);

    private final List<OutboxEvents> delegates;

    public CompositeOutboxEvents(List<OutboxEvents> delegates) {
        this.delegates = List.copyOf(Objects.requireNonNull(delegates, "delegates"));
    }

    private void each(Consumer<OutboxEvents> call) {
        for (OutboxEvents d : delegates) {
            try {
                call.accept(d);
            } catch (RuntimeException e) {
                log.warn("Outbox events delegate {} failed", d.getClass().getName(), e);
            }
        }
    }

    @Override
    public void onBatchClaimed(String publisherId, int size) {
        each(d -> d.onBatchClaimed(publisherId, size));
    }

    @Override
    public void onPublished(OutboxMessage message, long latencyMs) {
        each(d -> d.onPublished(message, latencyMs));
    }

    @Override
    public void onDeliveryFailed(OutboxMessage message, Throwable error, Instant nextAttemptAt) {
        each(d -> d.onDeliveryFailed(message, error, nextAttemptAt));
    }

    @Override
    public void onDeadLettered(OutboxMessage message, Throwable error) {
        each(d -> d.onDeadLettered(message, error));
    }

    @Override
    public void onDeadLettersRequeued(int count) {
        each(d -> d.onDeadLettersRequeued(count));
    }

    @Override
    public void onCleanup(int removed) {
        each(d -> d.onCleanup(removed));
    }
}
