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

package com.firefly.consistency.projection;

import com.firefly.consistency.aggregate.DomainEvent;
import com.firefly.consistency.aggregate.EventHandlers;
import com.firefly.consistency.eventsourcing.SourcedEvent;
import com.firefly.consistency.serialization.EventSerializer;

import java.util.Objects;
import java.util.function.Function;

/**
 * {@link Projection} driven by an {@link EventHandlers} dispatch table. Event types the
 * table does not know are skipped without being decoded.
 */
public final class EventProjection<V> implements Projection<V> {

    private final Function<String, V> initial;
    private final EventHandlers<V> handlers;
    private final EventSerializer serializer;

    public EventProjection(Function<String, V> initial, EventHandlers<V> handlers, EventSerializer serializer) {
        this.initial = Objects.requireNonNull(initial, "initial");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
    }

    @Override
    public V initial(String aggregateId) {
        return initial.apply(aggregateId);
    }

    @Override
    public V apply(V view, SourcedEvent event) {
        return handlers.payloadType(event.eventType())
                .map(type -> {
                    DomainEvent payload = serializer.deserialize(event, type);
                    return handlers.apply(view, event.eventType(), payload);
                })
                .orElse(view);
    }
}
