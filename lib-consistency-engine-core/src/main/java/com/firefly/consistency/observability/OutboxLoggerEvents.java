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
import com.firefly.consistency.util.LogFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * {@link OutboxEvents} that logs through SLF4J in the same key/value format as the saga logs.
 */
public class OutboxLoggerEvents implements OutboxEvents {
    private static final Logger log = LoggerFactory.getLogger(OutboxLoggerEvents.class);

    @Override
    public void onBatchClaimed(String publisherId, int size) {
        if (size > 0) {
            log.debug(LogFormat.json(
                    "outbox_event", "claimed",
                    "publisher", publisherId,
                    "count", Integer.toString(size)
            ));
        }
    }

    @Override
    public void onPublished(OutboxMessage message, long latencyMs) {
        log.debug(LogFormat.json(
                "outbox_event", "published",
                "messageId", message.id(),
                "topic", message.topic(),
                "event_type", message.eventType(),
                "latency_ms", Long.toString(latencyMs)
        ));
    }

    @Override
    public void onDeliveryFailed(OutboxMessage message, Throwable error, Instant nextAttemptAt) {
        log.warn(LogFormat.json(
                "outbox_event", "delivery_failed",
                "messageId", message.id(),
                "topic", message.topic(),
                "retry_count", Integer.toString(message.retryCount()),
                "next_attempt_at", String.valueOf(nextAttemptAt),
                "error_class", LogFormat.errorClass(error),
                "error_msg", LogFormat.errorMessage(error)
        ));
    }

    @Override
    public void onDeadLettered(OutboxMessage message, Throwable error) {
        log.error(LogFormat.json(
                "outbox_event", "dead_lettered",
                "messageId", message.id(),
                "topic", message.topic(),
                "aggregate_id", message.aggregateId(),
                "retry_count", Integer.toString(message.retryCount()),
                "error_class", LogFormat.errorClass(error),
                "error_msg", LogFormat.errorMessage(error)
        ));
    }

    @Override
    public void onDeadLettersRequeued(int count) {
        log.info(LogFormat.json(
                "outbox_event", "dead_letters_requeued",
                "count", Integer.toString(count)
        ));
    }

    @Override
    public void onCleanup(int removed) {
        log.info(LogFormat.json(
                "outbox_event", "cleanup",
                "removed", Integer.toString(removed)
        ));
    }
}
