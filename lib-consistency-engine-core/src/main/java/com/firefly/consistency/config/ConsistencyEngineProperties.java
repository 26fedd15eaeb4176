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

package com.firefly.consistency.config;

import com.firefly.consistency.saga.CompensationPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties for the consistency engine.
 *
 * Example configuration:
 * <pre>
 * firefly.consistency.event-store.snapshot-frequency=50
 * firefly.consistency.outbox.batch-size=200
 * firefly.consistency.outbox.poll-interval=2s
 * firefly.consistency.outbox.backoff.base-delay=500ms
 * firefly.consistency.saga.default-timeout=10m
 * firefly.consistency.saga.compensation-policy=HALT_ON_FAILURE
 * </pre>
 */
@ConfigurationProperties(prefix = "firefly.consistency")
public class ConsistencyEngineProperties {

    @NestedConfigurationProperty
    private EventStoreProperties eventStore = new EventStoreProperties();

    @NestedConfigurationProperty
    private OutboxProperties outbox = new OutboxProperties();

    @NestedConfigurationProperty
    private SagaProperties saga = new SagaProperties();

    public EventStoreProperties getEventStore() {
        return eventStore;
    }

    public void setEventStore(EventStoreProperties eventStore) {
        this.eventStore = eventStore;
    }

    public OutboxProperties getOutbox() {
        return outbox;
    }

    public void setOutbox(OutboxProperties outbox) {
        this.outbox = outbox;
    }

    public SagaProperties getSaga() {
        return saga;
    }

    public void setSaga(SagaProperties saga) {
        this.saga = saga;
    }

    public static class EventStoreProperties {
        /**
         * Take a snapshot every N versions; 0 disables snapshots.
         */
        private int snapshotFrequency = 0;

        public int getSnapshotFrequency() {
            return snapshotFrequency;
        }

        public void setSnapshotFrequency(int snapshotFrequency) {
            this.snapshotFrequency = snapshotFrequency;
        }
    }

    public static class OutboxProperties {
        /**
         * Whether the outbox publisher is created.
         */
        private boolean enabled = true;

        /**
         * Lease owner id of this instance; a random id is used when blank.
         */
        private String publisherId;

        private int batchSize = 100;
        private Duration pollInterval = Duration.ofSeconds(5);
        private Duration leaseDuration = Duration.ofSeconds(30);
        private Duration deliveryTimeout = Duration.ofSeconds(10);

        /**
         * Failed deliveries tolerated before a message is dead-lettered.
         */
        private int maxRetries = 3;

        /**
         * Start polling with the application context.
         */
        private boolean autoStart = true;

        /**
         * Register an {@code InMemoryMessageBroker} when no broker bean exists.
         */
        private boolean inMemoryBroker = false;

        @NestedConfigurationProperty
        private BackoffProperties backoff = new BackoffProperties();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPublisherId() {
            return publisherId;
        }

        public void setPublisherId(String publisherId) {
            this.publisherId = publisherId;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getLeaseDuration() {
            return leaseDuration;
        }

        public void setLeaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
        }

        public Duration getDeliveryTimeout() {
            return deliveryTimeout;
        }

        public void setDeliveryTimeout(Duration deliveryTimeout) {
            this.deliveryTimeout = deliveryTimeout;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public boolean isInMemoryBroker() {
            return inMemoryBroker;
        }

        public void setInMemoryBroker(boolean inMemoryBroker) {
            this.inMemoryBroker = inMemoryBroker;
        }

        public BackoffProperties getBackoff() {
            return backoff;
        }

        public void setBackoff(BackoffProperties backoff) {
            this.backoff = backoff;
        }
    }

    /**
     * Retry delay {@code baseDelay * multiplier^(retry-1)}, capped at {@code maxDelay},
     * spread by {@code jitterFactor}.
     */
    public static class BackoffProperties {
        private Duration baseDelay = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofMinutes(5);
        private double jitterFactor = 0.1;

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }
    }

    public static class SagaProperties {
        /**
         * Budget for sagas that do not declare a timeout.
         */
        private Duration defaultTimeout = Duration.ofMinutes(5);

        private CompensationPolicy compensationPolicy = CompensationPolicy.BEST_EFFORT;

        /**
         * Resume non-terminal sagas once the application is ready.
         */
        private boolean recoverOnStartup = true;

        /**
         * Terminal sagas kept by the in-memory state store.
         */
        private int historyLimit = 1000;

        public Duration getDefaultTimeout() {
            return defaultTimeout;
        }

        public void setDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
        }

        public CompensationPolicy getCompensationPolicy() {
            return compensationPolicy;
        }

        public void setCompensationPolicy(CompensationPolicy compensationPolicy) {
            this.compensationPolicy = compensationPolicy;
        }

        public boolean isRecoverOnStartup() {
            return recoverOnStartup;
        }

        public void setRecoverOnStartup(boolean recoverOnStartup) {
            this.recoverOnStartup = recoverOnStartup;
        }

        public int getHistoryLimit() {
            return historyLimit;
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit;
        }
    }
}
