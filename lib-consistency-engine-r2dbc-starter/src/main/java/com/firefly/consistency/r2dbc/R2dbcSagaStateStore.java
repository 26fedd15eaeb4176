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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.consistency.saga.SagaState;
import com.firefly.consistency.saga.SagaStateStore;
import com.firefly.consistency.saga.SagaStatus;
import com.firefly.consistency.saga.StepResult;
import io.r2dbc.spi.Row;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.firefly.consistency.r2dbc.R2dbcSupport.bindMaybe;
import static com.firefly.consistency.r2dbc.R2dbcSupport.bindTs;
import static com.firefly.consistency.r2dbc.R2dbcSupport.instant;

/**
 * Saga state store over the {@code sagas} table. Step results and saga variables are
 * kept as JSON documents next to the indexed status columns.
 */
public class R2dbcSagaStateStore implements SagaStateStore {

    private static final TypeReference<List<StepResult>> STEPS = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> DATA = new TypeReference<>() {};

    private static final String SELECT = "SELECT saga_id, saga_name, status, steps_json, data_json, created_at, "
            + "updated_at, completed_at, failure_reason FROM sagas";

    private final DatabaseClient db;
    private final ObjectMapper mapper;

    public R2dbcSagaStateStore(DatabaseClient db, ObjectMapper mapper) {
        this.db = Objects.requireNonNull(db, "db");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public Mono<Boolean> insert(SagaState state) {
        return Mono.defer(() -> bind(db.sql("""
                        INSERT INTO sagas (saga_id, saga_name, status, steps_json, data_json, created_at,
                                           updated_at, completed_at, failure_reason)
                        VALUES (:saga_id, :saga_name, :status, :steps_json, :data_json, :created_at,
                                :updated_at, :completed_at, :failure_reason)
                        """), state)
                        .fetch().rowsUpdated()
                        .map(n -> n > 0))
                .onErrorResume(DataIntegrityViolationException.class, e -> Mono.just(false));
    }

    @Override
    public Mono<SagaState> save(SagaState state) {
        return Mono.defer(() -> bind(db.sql("""
                        UPDATE sagas SET saga_name = :saga_name, status = :status, steps_json = :steps_json,
                                         data_json = :data_json, created_at = :created_at, updated_at = :updated_at,
                                         completed_at = :completed_at, failure_reason = :failure_reason
                         WHERE saga_id = :saga_id
                        """), state)
                        .fetch().rowsUpdated())
                .flatMap(updated -> updated > 0 ? Mono.just(true) : insert(state))
                .thenReturn(state);
    }

    @Override
    public Mono<SagaState> findById(String sagaId) {
        return db.sql(SELECT + " WHERE saga_id = :saga_id")
                .bind("saga_id", sagaId)
                .map((row, md) -> map(row))
                .one();
    }

    @Override
    public Flux<SagaState> findByStatus(Set<SagaStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return Flux.empty();
        }
        List<String> names = statuses.stream().map(Enum::name).toList();
        return db.sql(SELECT + " WHERE status IN (:statuses) ORDER BY created_at, saga_id")
                .bind("statuses", names)
                .map((row, md) -> map(row))
                .all();
    }

    @Override
    public Flux<SagaState> findRecent(String sagaName, SagaStatus status, int limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        List<String> where = new ArrayList<>();
        if (sagaName != null) where.add("saga_name = :saga_name");
        if (status != null) where.add("status = :status");
        String sql = SELECT
                + (where.isEmpty() ? "" : " WHERE " + String.join(" AND ", where))
                + " ORDER BY updated_at DESC, saga_id LIMIT " + limit;
        DatabaseClient.GenericExecuteSpec spec = db.sql(sql);
        if (sagaName != null) spec = spec.bind("saga_name", sagaName);
        if (status != null) spec = spec.bind("status", status.name());
        return spec.map((row, md) -> map(row)).all();
    }

    private DatabaseClient.GenericExecuteSpec bind(DatabaseClient.GenericExecuteSpec spec, SagaState state) {
        spec = spec.bind("saga_id", state.sagaId())
                .bind("saga_name", state.sagaName())
                .bind("status", state.status().name())
                .bind("steps_json", write(state.steps()))
                .bind("data_json", write(state.data()));
        spec = bindTs(spec, "created_at", state.createdAt());
        spec = bindTs(spec, "updated_at", state.updatedAt());
        spec = bindTs(spec, "completed_at", state.completedAt());
        return bindMaybe(spec, "failure_reason", state.failureReason(), String.class);
    }

    private SagaState map(Row row) {
        return new SagaState(
                row.get("saga_id", String.class),
                row.get("saga_name", String.class),
                SagaStatus.valueOf(row.get("status", String.class)),
                read(row.get("steps_json", String.class), STEPS),
                read(row.get("data_json", String.class), DATA),
                instant(row, "created_at"),
                instant(row, "updated_at"),
                instant(row, "completed_at"),
                row.get("failure_reason", String.class)
        );
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize saga state", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable saga state document", e);
        }
    }
}
