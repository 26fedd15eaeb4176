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

package com.firefly.consistency.r2dbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.consistency.config.ConsistencyEngineAutoConfiguration;
import com.firefly.consistency.eventsourcing.EventStore;
import com.firefly.consistency.eventsourcing.SnapshotStore;
import com.firefly.consistency.outbox.OutboxStore;
import com.firefly.consistency.saga.SagaStateStore;
import com.firefly.consistency.serialization.JacksonEventSerializer;
import io.r2dbc.spi.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;

/**
 * Auto-configuration of the relational stores.
 * <p>
 * Runs before {@link ConsistencyEngineAutoConfiguration} so its in-memory defaults back off.
 * Event store and outbox store share the application's {@link ConnectionFactory}, which
 * puts every event append and its outbox rows in one database transaction.
 * <p>
 * Configuration is controlled through the {@code firefly.consistency.r2dbc} properties.
 */
@AutoConfiguration(before = ConsistencyEngineAutoConfiguration.class, after = R2dbcAutoConfiguration.class)
@EnableConfigurationProperties(R2dbcStoreProperties.class)
@ConditionalOnClass({DatabaseClient.class, ConnectionFactory.class})
@ConditionalOnBean(ConnectionFactory.class)
@ConditionalOnProperty(name = "firefly.consistency.r2dbc.enabled", havingValue = "true", matchIfMissing = true)
public class R2dbcConsistencyAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(R2dbcConsistencyAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(EventStore.class)
    public R2dbcEventStore r2dbcEventStore(ConnectionFactory connectionFactory) {
        log.info("Configuring R2DBC event store");
        return new R2dbcEventStore(DatabaseClient.create(connectionFactory), transactional(connectionFactory));
    }

    @Bean
    @ConditionalOnMissingBean(OutboxStore.class)
    public R2dbcOutboxStore r2dbcOutboxStore(ConnectionFactory connectionFactory) {
        return new R2dbcOutboxStore(DatabaseClient.create(connectionFactory), transactional(connectionFactory));
    }

    @Bean
    @ConditionalOnMissingBean(SnapshotStore.class)
    public R2dbcSnapshotStore r2dbcSnapshotStore(ConnectionFactory connectionFactory) {
        return new R2dbcSnapshotStore(DatabaseClient.create(connectionFactory));
    }

    @Bean
    @ConditionalOnMissingBean(SagaStateStore.class)
    public R2dbcSagaStateStore r2dbcSagaStateStore(ConnectionFactory connectionFactory,
                                                   ObjectProvider<ObjectMapper> objectMapper) {
        log.info("Configuring R2DBC saga state store");
        return new R2dbcSagaStateStore(DatabaseClient.create(connectionFactory),
                objectMapper.getIfUnique(JacksonEventSerializer::defaultObjectMapper));
    }

    @Bean
    @ConditionalOnProperty(name = "firefly.consistency.r2dbc.initialize-schema", havingValue = "true", matchIfMissing = true)
    public ConnectionFactoryInitializer consistencySchemaInitializer(ConnectionFactory connectionFactory,
                                                                     R2dbcStoreProperties properties) {
        log.info("Initializing consistency engine tables from {}", properties.getSchemaLocation());
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(
                new DefaultResourceLoader().getResource(properties.getSchemaLocation())));
        return initializer;
    }

    // transactions are bound to the ConnectionFactory, so stores sharing it join the same one
    private static TransactionalOperator transactional(ConnectionFactory connectionFactory) {
        return TransactionalOperator.create(new R2dbcTransactionManager(connectionFactory));
    }
}
