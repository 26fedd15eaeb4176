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

package com.firefly.consistency.aggregate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Dispatch table from event type to a pure state transition {@code (S, P) -> S}.
 *
 * <p>Built once per aggregate or projection type and shared by all its instances.
 * Handlers must be deterministic and must not mutate their inputs; replaying the same
 * events always yields an equal state.
 *
 * <pre>
 * static final EventHandlers&lt;OrderState&gt; HANDLERS = EventHandlers.forState(OrderState.class)
 *         .on(OrderCreated.class, (s, e) -&gt; s.created(e.customerId()))
 *         .on(ItemAdded.class, (s, e) -&gt; s.withItem(e.sku()))
 *         .build();
 * </pre>
 *
 * @param <S> state type
 */
public final class EventHandlers<S> {

    private final Class<S> stateType;
    private final Map<String, Handler<S, ?>> byType;
    private final Map<Class<?>, String> typeByClass;
    private final boolean ignoreUnknown;

    private EventHandlers(Class<S> stateType, Map<String, Handler<S, ?>> byType,
                          Map<Class<?>, String> typeByClass, boolean ignoreUnknown) {
        this.stateType = stateType;
        this.byType = Collections.unmodifiableMap(byType);
        this.typeByClass = Collections.unmodifiableMap(typeByClass);
        this.ignoreUnknown = ignoreUnknown;
    }

    public static <S> Builder<S> forState(Class<S> stateType) {
        return new Builder<>(stateType);
    }

    public Class<S> stateType() {
        return stateType;
    }

    public boolean handles(String eventType) {
        return byType.containsKey(eventType);
    }

    public Set<String> eventTypes() {
        return byType.keySet();
    }

    /** Payload class registered for {@code eventType}. */
    public Optional<Class<? extends DomainEvent>> payloadType(String eventType) {
        Handler<S, ?> h = byType.get(eventType);
        if (h == null) {
            return Optional.empty();
        }
        Class<? extends DomainEvent> type = h.payloadType();
        return Optional.of(type);
    }

    /**
     * @throws IllegalArgumentException if the payload's class was never registered
     */
    public String eventTypeOf(DomainEvent payload) {
        String type = typeByClass.get(payload.getClass());
        if (type == null) {
            throw new IllegalArgumentException("No handler registered for payload " + payload.getClass().getName());
        }
        return type;
    }

    /**
     * Folds one event into {@code state}. Unknown types are skipped when the table was
     * built with {@link Builder#ignoringUnknown()}, and rejected otherwise.
     */
    public S apply(S state, String eventType, DomainEvent payload) {
        Handler<S, ?> handler = byType.get(eventType);
        if (handler == null) {
            if (ignoreUnknown) {
                return state;
            }
            throw new IllegalStateException("No handler for event type " + eventType + " on " + stateType.getSimpleName());
        }
        S next = handler.apply(state, payload);
        if (next == null) {
            throw new IllegalStateException("Handler for " + eventType + " returned null state");
        }
        return next;
    }

    private record Handler<S, P extends DomainEvent>(Class<P> payloadType, BiFunction<S, P, S> fn) {
        S apply(S state, DomainEvent payload) {
            return fn.apply(state, payloadType.cast(payload));
        }
    }

    public static final class Builder<S> {
        private final Class<S> stateType;
        private final Map<String, Handler<S, ?>> byType = new LinkedHashMap<>();
        private final Map<Class<?>, String> typeByClass = new LinkedHashMap<>();
        private boolean ignoreUnknown;

        private Builder(Class<S> stateType) {
            this.stateType = Objects.requireNonNull(stateType, "stateType");
        }

        public <P extends DomainEvent> Builder<S> on(Class<P> payloadType, BiFunction<S, P, S> handler) {
            Objects.requireNonNull(payloadType, "payloadType");
            Objects.requireNonNull(handler, "handler");
            String type = EventTypes.typeOf(payloadType);
            if (byType.containsKey(type)) {
                throw new IllegalStateException("Duplicate handler for event type " + type);
            }
            byType.put(type, new Handler<>(payloadType, handler));
            typeByClass.put(payloadType, type);
            return this;
        }

        /** Skip events without a handler instead of failing; used by projections. */
        public Builder<S> ignoringUnknown() {
            this.ignoreUnknown = true;
            return this;
        }

        public EventHandlers<S> build() {
            return new EventHandlers<>(stateType, new LinkedHashMap<>(byType), new LinkedHashMap<>(typeByClass), ignoreUnknown);
        }
    }
}
