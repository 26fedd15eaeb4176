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

package com.firefly.consistency.serialization;

import com.firefly.consistency.aggregate.DomainEvent;
import com.firefly.consistency.eventsourcing.SourcedEvent;
import com.firefly.consistency.exception.SchemaVersionException;

/**
 * Encodes event payloads, event envelopes and snapshot state.
 */
public interface EventSerializer {

    /** Serializes a payload with its event type and current schema version. */
    SerializedPayload serialize(DomainEvent payload);

    /**
     * Reads the payload of {@code event} as {@code type}, upcasting older schema versions first.
     *
     * @throws SchemaVersionException if the stored version is newer than {@code type}'s or
     *                                no upcaster path exists
     */
    <T extends DomainEvent> T deserialize(SourcedEvent event, Class<T> type);

    /** Full envelope of an event, as published through the outbox. */
    String toEnvelope(SourcedEvent event);

    SourcedEvent fromEnvelope(String envelope);

    String serializeState(Object state);

    <S> S deserializeState(String state, Class<S> type);
}
