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
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.time.Instant;

/**
 * Micrometer counters and a delivery latency timer for the outbox publisher.
 */
public class OutboxMicrometerEvents implements OutboxEvents {
    private final MeterRegistry registry;

    public OutboxMicrometerEvents(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onPublished(OutboxMessage message, long latencyMs) {
        Tags tags = Tags.of(Tag.of("topic", message.topic()));
        registry.counter("outbox.published", tags).increment();
        Timer.builder("outbox.delivery.latency")
                .tags(tags)
                .register(registry)
                .record(Duration.ofMillis(Math.max(0L, latencyMs)));
    }

    @Override
    public void onDeliveryFailed(OutboxMessage message, Throwable error, Instant nextAttemptAt) {
        registry.counter("outbox.delivery.failed", Tags.of(Tag.of("topic", message.topic()))).increment();
    }

    @Override
    public void onDeadLettered(OutboxMessage message, Throwable error) {
        registry.counter("outbox.dead_lettered", Tags.of(Tag.of("topic", message.topic()))).increment();
    }

    @Override
    public void onDeadLettersRequeued(int count) {
        registry.counter("outbox.dead_letters.requeued").increment(count);
    }
}
