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

package com.firefly.consistency.outbox;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Tuning of one {@link OutboxPublisher} instance.
 *
 * @param publisherId     owner written into {@code claimed_by}; unique per replica
 * @param batchSize       messages claimed per poll
 * @param pollInterval    pause between polls
 * @param leaseDuration   how long a claim stays exclusive; must exceed {@code deliveryTimeout}
 * @param maxRetries      failed deliveries tolerated before a message is dead-lettered
 * @param deliveryTimeout upper bound for one broker call
 */
public record OutboxPublisherSettings(String publisherId,
                                      int batchSize,
                                      Duration pollInterval,
                                      Duration leaseDuration,
                                      int maxRetries,
                                      Duration deliveryTimeout) {

    public OutboxPublisherSettings {
        Objects.requireNonNull(publisherId, "publisherId");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(leaseDuration, "leaseDuration");
        Objects.requireNonNull(deliveryTimeout, "deliveryTimeout");
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (deliveryTimeout.compareTo(leaseDuration) >= 0) {
            throw new IllegalArgumentException("deliveryTimeout must be shorter than leaseDuration");
        }
    }

    public static OutboxPublisherSettings defaults() {
        return new OutboxPublisherSettings("outbox-" + UUID.randomUUID(), 100, Duration.ofSeconds(5),
                Duration.ofSeconds(30), 3, Duration.ofSeconds(10));
    }

    public OutboxPublisherSettings withPublisherId(String id) {
        return new OutboxPublisherSettings(id, batchSize, pollInterval, leaseDuration, maxRetries, deliveryTimeout);
    }

    public OutboxPublisherSettings withMaxRetries(int retries) {
        return new OutboxPublisherSettings(publisherId, batchSize, pollInterval, leaseDuration, retries, deliveryTimeout);
    }

    public OutboxPublisherSettings withBatchSize(int size) {
        return new OutboxPublisherSettings(publisherId, size, pollInterval, leaseDuration, maxRetries, deliveryTimeout);
    }

    public OutboxPublisherSettings withPollInterval(Duration interval) {
        return new OutboxPublisherSettings(publisherId, batchSize, interval, leaseDuration, maxRetries, deliveryTimeout);
    }
}
