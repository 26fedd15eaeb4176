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

package com.firefly.consistency.eventsourcing;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted domain event. Immutable; ordering within one aggregate is total by
 * {@link #version()}, which starts at 1.
 *
 * @param eventId       unique id of the event, reused as the id of its outbox message
 * @param aggregateType logical type of the aggregate that produced the event
 * @param aggregateId   id of the aggregate
 * @param version       position of the event in the aggregate's stream
 * @param eventType     dispatch tag of the payload
 * @param payload       serialized payload, opaque to the store
 * @param schemaVersion schema version the payload was written with
 * @param occurredAt    time the event was raised
 */
public record SourcedEvent(String eventId,
                           String aggregateType,
                           String aggregateId,
                           long version,
                           String eventType,
                           String payload,
                           int schemaVersion,
                           Instant occurredAt) {

    public SourcedEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(aggregateType, "aggregateType");
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(occurredAt, "occurredAt");
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1 but was " + version);
        }
        if (schemaVersion < 1) {
            throw new IllegalArgumentException("schemaVersion must be >= 1 but was " + schemaVersion);
        }
    }
}
