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

import com.firefly.consistency.eventsourcing.EventStore;
import com.firefly.consistency.eventsourcing.InMemoryEventStore;
import com.firefly.consistency.eventsourcing.SnapshotStore;
import com.firefly.consistency.observability.CompositeSagaEvents;
import com.firefly.consistency.observability.SagaEvents;
import com.firefly.consistency.observability.SagaMicrometerEvents;
import com.firefly.consistency.outbox.BackoffPolicy;
import com.firefly.consistency.outbox.InMemoryMessageBroker;
import com.firefly.consistency.outbox.OutboxPublisher;
import com.firefly.consistency.outbox.OutboxStore;
import com.firefly.consistency.repository.EventSourcedRepositoryFactory;
import com.firefly.consistency.saga.CompensationPolicy;
import com.firefly.consistency.saga.SagaBuilder;
import com.firefly.consistency.saga.SagaDefinition;
import com.firefly.consistency.saga.SagaEventTrigger;
import com.firefly.consistency.saga.SagaOrchestrator;
import com.firefly.consistency.saga.SagaStateStore;
import com.firefly.consistency.serialization.EventSerializer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ConsistencyEngineAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConsistencyEngineAutoConfiguration.class));

    @Test
    void shouldCreateInMemoryDefaults() {
        this.contextRunner.run(context -> {
            assertThat(context).hasSingleBean(EventStore.class);
            assertThat(context.getBean(EventStore.class)).isInstanceOf(InMemoryEventStore.class);
            assertThat(context).hasSingleBean(SnapshotStore.class);
            assertThat(context).hasSingleBean(OutboxStore.class);
            assertThat(context).hasSingleBean(SagaStateStore.class);
            assertThat(context).hasSingleBean(EventSerializer.class);
            assertThat(context).hasSingleBean(EventSourcedRepositoryFactory.class);
            assertThat(context).hasSingleBean(SagaOrchestrator.class);
            assertThat(context).hasSingleBean(SagaEventTrigger.class);
            assertThat(context).hasSingleBean(BackoffPolicy.class);
            assertThat(context).hasBean("sagaRecoveryRunner");
            assertThat(context.getBean(SagaEvents.class)).isInstanceOf(CompositeSagaEvents.class);
        });
    }

    @Test
    void outboxStoreSharesTheInMemoryEventStoreTransaction() {
        this.contextRunner.run(context -> {
            InMemoryEventStore eventStore = context.getBean(InMemoryEventStore.class);
            assertThat(context.getBean(OutboxStore.class)).isSameAs(eventStore.outboxStore());
        });
    }

    @Test
    void shouldNotCreatePublisherWithoutBroker() {
        this.contextRunner.run(context -> {
            assertThat(context).doesNotHaveBean(OutboxPublisher.class);
            assertThat(context).doesNotHaveBean(OutboxPublisherLifecycle.class);
        });
    }

    @Test
    void shouldCreatePublisherWithInMemoryBroker() {
        this.contextRunner
                .withPropertyValues(
                        "firefly.consistency.outbox.in-memory-broker=true",
                        "firefly.consistency.outbox.auto-start=false",
                        "firefly.consistency.outbox.publisher-id=node-1",
                        "firefly.consistency.outbox.batch-size=10",
                        "firefly.consistency.outbox.max-retries=5"
                )
                .run(context -> {
                    assertThat(context).hasSingleBean(InMemoryMessageBroker.class);
                    assertThat(context).hasSingleBean(OutboxPublisher.class);
                    OutboxPublisher publisher = context.getBean(OutboxPublisher.class);
                    assertThat(publisher.settings().publisherId()).isEqualTo("node-1");
                    assertThat(publisher.settings().batchSize()).isEqualTo(10);
                    assertThat(publisher.settings().maxRetries()).isEqualTo(5);
                    assertThat(publisher.isRunning()).isFalse();
                });
    }

    @Test
    void shouldRespectOutboxEnabledProperty() {
        this.contextRunner
                .withPropertyValues(
                        "firefly.consistency.outbox.in-memory-broker=true",
                        "firefly.consistency.outbox.enabled=false"
                )
                .run(context -> {
                    assertThat(context).hasSingleBean(InMemoryMessageBroker.class);
                    assertThat(context).doesNotHaveBean(OutboxPublisher.class);
                });
    }

    @Test
    void lifecycleStartsAndStopsThePublisher() {
        this.contextRunner
                .withPropertyValues(
                        "firefly.consistency.outbox.in-memory-broker=true",
                        "firefly.consistency.outbox.poll-interval=1h"
                )
                .run(context -> {
                    OutboxPublisher publisher = context.getBean(OutboxPublisher.class);
                    assertThat(publisher.isRunning()).isTrue();
                    assertThat(publisher.settings().publisherId()).startsWith("outbox-");
                    context.getBean(OutboxPublisherLifecycle.class).stop();
                    assertThat(publisher.isRunning()).isFalse();
                });
    }

    @Test
    void shouldBindSagaAndEventStoreProperties() {
        this.contextRunner
                .withPropertyValues(
                        "firefly.consistency.saga.default-timeout=30s",
                        "firefly.consistency.saga.compensation-policy=HALT_ON_FAILURE",
                        "firefly.consistency.saga.recover-on-startup=false",
                        "firefly.consistency.event-store.snapshot-frequency=50",
                        "firefly.consistency.outbox.backoff.base-delay=200ms"
                )
                .run(context -> {
                    ConsistencyEngineProperties properties = context.getBean(ConsistencyEngineProperties.class);
                    assertThat(properties.getSaga().getDefaultTimeout()).isEqualTo(Duration.ofSeconds(30));
                    assertThat(properties.getSaga().getCompensationPolicy()).isEqualTo(CompensationPolicy.HALT_ON_FAILURE);
                    assertThat(properties.getOutbox().getBackoff().getBaseDelay()).isEqualTo(Duration.ofMillis(200));
                    assertThat(context.getBean(EventSourcedRepositoryFactory.class).snapshotFrequency()).isEqualTo(50);
                    assertThat(context).doesNotHaveBean(SagaRecoveryRunner.class);
                });
    }

    @Test
    void registersSagaDefinitionBeans() {
        SagaDefinition fulfil = SagaBuilder.saga("Fulfil").step("ship").map(ctx -> "ok").add().build();
        this.contextRunner
                .withBean("fulfilSaga", SagaDefinition.class, () -> fulfil)
                .run(context -> {
                    SagaOrchestrator orchestrator = context.getBean(SagaOrchestrator.class);
                    assertThat(orchestrator.definition("Fulfil")).contains(fulfil);
                });
    }

    @Test
    void shouldAddMicrometerSinkWhenRegistryExists() {
        this.contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> {
                    assertThat(context).hasSingleBean(SagaMicrometerEvents.class);
                    CompositeSagaEvents composite = (CompositeSagaEvents) context.getBean(SagaEvents.class);
                    assertThat(composite.delegates()).hasSize(2);
                });
    }

    @Test
    void shouldBackOffForApplicationSagaEvents() {
        SagaEvents custom = new SagaEvents() {};
        this.contextRunner
                .withBean("customSagaEvents", SagaEvents.class, () -> custom, bd -> bd.setPrimary(true))
                .run(context -> {
                    assertThat(context).doesNotHaveBean("sagaEventsComposite");
                    assertThat(context.getBean(SagaEvents.class)).isSameAs(custom);
                    assertThat(context).hasSingleBean(SagaOrchestrator.class);
                });
    }
}
