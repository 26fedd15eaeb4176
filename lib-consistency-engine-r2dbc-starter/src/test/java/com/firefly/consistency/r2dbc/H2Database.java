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

import io.r2dbc.h2.H2ConnectionFactory;
import io.r2dbc.spi.ConnectionFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.util.UUID;

/**
 * A fresh in-memory H2 database with the consistency tables, one per test.
 */
final class H2Database {

    final ConnectionFactory connectionFactory;
    final DatabaseClient db;
    final TransactionalOperator tx;

    private H2Database() {
        this.connectionFactory = H2ConnectionFactory.inMemory("consistency-" + UUID.randomUUID());
        new ResourceDatabasePopulator(new ClassPathResource("db/consistency/schema.sql"))
                .populate(connectionFactory)
                .block();
        this.db = DatabaseClient.create(connectionFactory);
        this.tx = TransactionalOperator.create(new R2dbcTransactionManager(connectionFactory));
    }

    static H2Database create() {
        return new H2Database();
    }

    long count(String table) {
        Long n = db.sql("SELECT COUNT(*) AS n FROM " + table)
                .map((row, md) -> row.get("n", Long.class))
                .one()
                .block();
        return n == null ? 0L : n;
    }
}
