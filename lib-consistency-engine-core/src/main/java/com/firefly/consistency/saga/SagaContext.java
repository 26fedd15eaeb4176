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

package com.firefly.consistency.saga;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime context handed to step actions and compensations.
 *
 * <p>Holds the saga variables: the input given at start, plus the output of each
 * successful step stored under the step name. Variables are persisted with the saga
 * state after every transition; with a persistent store they come back from JSON after
 * a restart, so keep them to JSON-friendly values (strings, numbers, maps, lists).
 */
public final class SagaContext {
    private final String sagaId;
    private final String sagaName;
    private final Map<String, Object> variables = new ConcurrentHashMap<>();
    private volatile int currentStepIndex;

    public SagaContext(String sagaId, String sagaName, Map<String, Object> variables) {
        this.sagaId = Objects.requireNonNull(sagaId, "sagaId");
        this.sagaName = Objects.requireNonNull(sagaName, "sagaName");
        if (variables != null) {
            variables.forEach(this::put);
        }
    }

    public String sagaId() { return sagaId; }
    public String sagaName() { return sagaName; }

    /** 1-based index of the step (or compensation) being executed. */
    public int currentStepIndex() { return currentStepIndex; }

    void currentStepIndex(int index) { this.currentStepIndex = index; }

    /**
     * Stable key for the current step of this saga. Steps may be executed again after a
     * crash, so side effects should be deduplicated on it.
     */
    public String idempotencyKey() {
        return sagaId + ":" + currentStepIndex;
    }

    public Object get(String key) {
        return variables.get(key);
    }

    public <T> T get(String key, Class<T> type) {
        Object v = variables.get(key);
        if (v == null) return null;
        if (!type.isInstance(v)) {
            throw new ClassCastException("Saga variable '" + key + "' is " + v.getClass().getName() + ", not " + type.getName());
        }
        return type.cast(v);
    }

    public <T> Optional<T> find(String key, Class<T> type) {
        return Optional.ofNullable(get(key, type));
    }

    public boolean has(String key) {
        return variables.containsKey(key);
    }

    /** Stores a variable; a {@code null} value removes it. */
    public void put(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            variables.remove(key);
        } else {
            variables.put(key, value);
        }
    }

    public Map<String, Object> variables() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }
}
