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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.consistency.eventsourcing.EventStore;
import com.firefly.consistency.eventsourcing.InMemoryEventStore;
import com.firefly.consistency.eventsourcing.InMemorySnapshotStore;
import com.firefly.consistency.eventsourcing.SnapshotStore;
import com.firefly.consistency.observability.CompositeOutboxEvents;
import com.firefly.consistency.observability.CompositeSagaEvents;
import com.firefly.consistency.observability.OutboxEvents;
import com.firefly.consistency.observability.OutboxLoggerEvents;
import com.firefly.consistency.observability.OutboxMicrometerEvents;
import com.firefly.consistency.observability.SagaEvents;
import com.firefly.consistency.observability.SagaLoggerEvents;
import com.firefly.consistency.observability.SagaMicrometerEvents;
import com.firefly.consistency.outbox.BackoffPolicy;
import com.firefly.consistency.outbox.ExponentialBackoff;
import com.firefly.consistency.outbox.InMemoryMessageBroker;
import com.firefly.consistency.outbox.MessageBroker;
import com.firefly.consistency.outbox.OutboxPublisher;
import com.firefly.consistency.outbox.OutboxPublisherSettings;
import com.firefly.consistency.outbox.OutboxStore;
import com.firefly.consistency.repository.EventSourcedRepositoryFactory;
import com.firefly.consistency.saga.InMemorySagaStateStore;
import com.firefly.consistency.saga.SagaDefinition;
import com.firefly.consistency.saga.SagaEventTrigger;
import com.firefly.consistency.saga.SagaOrchestrator;
import com.firefly.consistency.saga.SagaOrchestratorSettings;
import com.firefly.consistency.saga.SagaStateStore;
import com.firefly.consistency.serialization.EventSerializer;
import com.firefly.consistency.serialization.EventUpcaster;
import com.firefly.consistency.serialization.JacksonEventSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Wires the consistency engine with in-memory defaults.
 * <p>
 * Every bean backs off when the application (or a storage starter) defines its own:
 * <ul>
 *   <li>event store, snapshot store, outbox store and saga state store (in-memory by default)</li>
 *   <li>the Jackson serializer, picking up {@link EventUpcaster} beans</li>
 *   <li>the saga orchestrator, which registers every {@link SagaDefinition} bean</li>
 *   <li>the outbox publisher, only when a {@link MessageBroker} bean exists</li>
 * </ul>
 * An application-defined {@link SagaEvents} or {@link OutboxEvents} replaces the composite of
 * the built-in sinks; mark it {@code @Primary} since the built-in sinks stay registered.
 * Configuration lives under {@code firefly.consistency}.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(ConsistencyEngineProperties.class)
public class ConsistencyEngineAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyEngineAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock consistencyClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper consistencyObjectMapper() {
        return JacksonEventSerializer.defaultObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventSerializer eventSerializer(ObjectMapper objectMapper, ObjectProvider<EventUpcaster> upcasters) {
        return new JacksonEventSerializer(objectMapper, upcasters.orderedStream().toList());
    }

    // ---------------------------------------------------------------- stores

    @Bean
    @ConditionalOnMissingBean
    public EventStore eventStore() {
        log.info("Configuring in-memory event store (no durable persistence)");
        return new InMemoryEventStore();
    }

    /**
     * The outbox must share a transaction with the event store, so the default is the
     * outbox embedded in the in-memory event store.
     */
    @Bean
    @ConditionalOnMissingBean
    public OutboxStore outboxStore(EventStore eventStore) {
        if (eventStore instanceof InMemoryEventStore inMemory) {
            return inMemory.outboxStore();
        }
        throw new IllegalStateException("EventStore " + eventStore.getClass().getName()
                + " is not in-memory; define the OutboxStore that shares its transactions");
    }

    @Bean
    @ConditionalOnMissingBean
    public SnapshotStore snapshotStore() {
        return new InMemorySnapshotStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaStateStore sagaStateStore(ConsistencyEngineProperties properties) {
        return new InMemorySagaStateStore(properties.getSaga().getHistoryLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public EventSourcedRepositoryFactory eventSourcedRepositoryFactory(EventStore eventStore,
                                                                       SnapshotStore snapshotStore,
                                                                       EventSerializer serializer,
                                                                       ConsistencyEngineProperties properties,
                                                                       Clock clock) {
        return new EventSourcedRepositoryFactory(eventStore, snapshotStore, serializer,
                properties.getEventStore().getSnapshotFrequency(), clock);
    }

    // ---------------------------------------------------------------- observability

    @Bean
    @ConditionalOnMissingBean
    public SagaLoggerEvents sagaLoggerEvents() {
        return new SagaLoggerEvents();
    }

    /** Built-in sinks do not count as an application-defined {@link SagaEvents}. */
    @Bean
    @Primary
    @ConditionalOnMissingBean(value = SagaEvents.class, ignored = {SagaLoggerEvents.class, SagaMicrometerEvents.class})
    public SagaEvents sagaEventsComposite(SagaLoggerEvents logger, ObjectProvider<SagaMicrometerEvents> micrometer) {
        List<SagaEvents> sinks = new ArrayList<>();
        sinks.add(logger);
        SagaMicrometerEvents m = micrometer.getIfAvailable();
        if (m != null) sinks.add(m);
        return new CompositeSagaEvents(sinks);
    }

    @Bean
    @ConditionalOnMissingBean
    public OutboxLoggerEvents outboxLoggerEvents() {
        return new OutboxLoggerEvents();
    }

    @Bean
    @Primary
    @ConditionalOnMissingBean(value = OutboxEvents.class, ignored = {OutboxLoggerEvents.class, OutboxMicrometerEvents.class})
    public OutboxEvents outboxEventsComposite(OutboxLoggerEvents logger, ObjectProvider<OutboxMicrometerEvents> micrometer) {
        List<OutboxEvents> sinks = new ArrayList<>();
        sinks.add(logger);
        OutboxMicrometerEvents m = micrometer.getIfAvailable();
        if (m != null) sinks.add(m);
        return new CompositeOutboxEvents(sinks);
    }

    @Configuration
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnBean(type = "io.micrometer.core.instrument.MeterRegistry")
    static class MicrometerAutoConfig {
        @Bean
        public SagaMicrometerEvents sagaMicrometerEvents(io.micrometer.core.instrument.MeterRegistry registry) {
            return new SagaMicrometerEvents(registry);
        }

        @Bean
        public OutboxMicrometerEvents outboxMicrometerEvents(io.micrometer.core.instrument.MeterRegistry registry) {
            return new OutboxMicrometerEvents(registry);
        }
    }

    // ---------------------------------------------------------------- sagas

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public SagaOrchestrator sagaOrchestrator(SagaStateStore store,
                                             SagaEvents events,
                                             ConsistencyEngineProperties properties,
                                             Clock clock,
                                             ObjectProvider<SagaDefinition> definitions) {
        ConsistencyEngineProperties.SagaProperties saga = properties.getSaga();
        SagaOrchestrator orchestrator = new SagaOrchestrator(store, events,
                new SagaOrchestratorSettings(saga.getDefaultTimeout(), saga.getCompensationPolicy()), clock);
        definitions.orderedStream().forEach(orchestrator::register);
        log.info("Saga orchestrator configured with {} definition(s), compensation policy {}",
                orchestrator.definitions().size(), saga.getCompensationPolicy());
        return orchestrator;
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaEventTrigger sagaEventTrigger(SagaOrchestrator orchestrator) {
        return new SagaEventTrigger(orchestrator);
    }

    @Bean
    @ConditionalOnProperty(name = "firefly.consistency.saga.recover-on-startup", havingValue = "true", matchIfMissing = true)
    public SagaRecoveryRunner sagaRecoveryRunner(SagaOrchestrator orchestrator) {
        return new SagaRecoveryRunner(orchestrator);
    }

    // ---------------------------------------------------------------- outbox

    @Bean
    @ConditionalOnMissingBean(MessageBroker.class)
    @ConditionalOnProperty(name = "firefly.consistency.outbox.in-memory-broker", havingValue = "true")
    public InMemoryMessageBroker inMemoryMessageBroker() {
        log.info("Configuring in-memory message broker; messages do not leave the process");
        return new InMemoryMessageBroker();
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffPolicy outboxBackoffPolicy(ConsistencyEngineProperties properties) {
        ConsistencyEngineProperties.BackoffProperties b = properties.getOutbox().getBackoff();
        return new ExponentialBackoff(b.getBaseDelay(), b.getMultiplier(), b.getMaxDelay(), b.getJitterFactor());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MessageBroker.class)
    @ConditionalOnProperty(name = "firefly.consistency.outbox.enabled", havingValue = "true", matchIfMissing = true)
    public OutboxPublisher outboxPublisher(OutboxStore store,
                                           MessageBroker broker,
                                           BackoffPolicy backoff,
                                           OutboxEvents events,
                                           ConsistencyEngineProperties properties,
                                           Clock clock) {
        ConsistencyEngineProperties.OutboxProperties o = properties.getOutbox();
        String publisherId = o.getPublisherId() == null || o.getPublisherId().isBlank()
                ? "outbox-" + UUID.randomUUID()
                : o.getPublisherId();
        OutboxPublisherSettings settings = new OutboxPublisherSettings(publisherId, o.getBatchSize(),
                o.getPollInterval(), o.getLeaseDuration(), o.getMaxRetries(), o.getDeliveryTimeout());
        return new OutboxPublisher(store, broker, settings, backoff, events, clock);
    }

    @Bean
    @ConditionalOnBean(OutboxPublisher.class)
    public OutboxPublisherLifecycle outboxPublisherLifecycle(OutboxPublisher publisher, ConsistencyEngineProperties properties) {
        return new OutboxPublisherLifecycle(publisher, properties.getOutbox().isAutoStart());
    }
}
