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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.firefly.consistency.aggregate.DomainEvent;
import com.firefly.consistency.aggregate.EventTypes;
import com.firefly.consistency.eventsourcing.SourcedEvent;
import com.firefly.consistency.exception.SchemaVersionException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Jackson implementation of {@link EventSerializer}.
 *
 * <p>Envelopes are JSON objects carrying every {@link SourcedEvent} field, with the
 * payload kept as an embedded string so the envelope round-trips to an equal event.
 */
public class JacksonEventSerializer implements EventSerializer {

    private final ObjectMapper mapper;
    private final Map<String, Map<Integer, EventUpcaster>> upcasters = new HashMap<>();

    public JacksonEventSerializer(ObjectMapper mapper) {
        this(mapper, List.of());
    }

    public JacksonEventSerializer(ObjectMapper mapper, List<EventUpcaster> upcasters) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        for (EventUpcaster u : upcasters) {
            EventUpcaster previous = this.upcasters
                    .computeIfAbsent(u.eventType(), t -> new HashMap<>())
                    .putIfAbsent(u.fromVersion(), u);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate upcaster for " + u.eventType() + " v" + u.fromVersion());
            }
        }
    }

    /**
     * Mapper configured the way the engine expects: JSR-310 types as ISO strings and
     * unknown properties ignored so that added fields do not break old readers.
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    @Override
    public SerializedPayload serialize(DomainEvent payload) {
        Class<?> type = payload.getClass();
        try {
            return new SerializedPayload(EventTypes.typeOf(type), EventTypes.schemaVersionOf(type),
                    mapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Cannot serialize payload " + type.getName(), e);
        }
    }

    @Override
    public <T extends DomainEvent> T deserialize(SourcedEvent event, Class<T> type) {
        int current = EventTypes.schemaVersionOf(type);
        int stored = event.schemaVersion();
        if (stored > current) {
            throw new SchemaVersionException(event.eventType(), stored, current, "stored version is newer than the running code");
        }
        JsonNode node;
        try {
            node = mapper.readTree(event.payload());
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Malformed payload of event " + event.eventId(), e);
        }
        Map<Integer, EventUpcaster> chain = upcasters.getOrDefault(event.eventType(), Map.of());
        for (int v = stored; v < current; v++) {
            EventUpcaster upcaster = chain.get(v);
            if (upcaster == null) {
                throw new SchemaVersionException(event.eventType(), stored, current, "no upcaster from version " + v);
            }
            try {
                node = upcaster.upcast(node);
            } catch (RuntimeException e) {
                throw new SchemaVersionException(event.eventType(), stored, current, e);
            }
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new SchemaVersionException(event.eventType(), stored, current, e);
        }
    }

    @Override
    public String toEnvelope(SourcedEvent event) {
        ObjectNode root = mapper.createObjectNode();
        root.put("eventId", event.eventId());
        root.put("aggregateType", event.aggregateType());
        root.put("aggregateId", event.aggregateId());
        root.put("version", event.version());
        root.put("eventType", event.eventType());
        root.put("schemaVersion", event.schemaVersion());
        root.put("occurredAt", event.occurredAt().toString());
        root.put("payload", event.payload());
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Cannot write envelope of event " + event.eventId(), e);
        }
    }

    @Override
    public SourcedEvent fromEnvelope(String envelope) {
        try {
            JsonNode root = mapper.readTree(envelope);
            return new SourcedEvent(
                    required(root, "eventId").asText(),
                    required(root, "aggregateType").asText(),
                    required(root, "aggregateId").asText(),
                    required(root, "version").asLong(),
                    required(root, "eventType").asText(),
                    required(root, "payload").asText(),
                    required(root, "schemaVersion").asInt(),
                    Instant.parse(required(root, "occurredAt").asText()));
        } catch (JsonProcessingException | DateTimeParseException e) {
            throw new EventSerializationException("Malformed event envelope", e);
        }
    }

    @Override
    public String serializeState(Object state) {
        try {
            return mapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Cannot serialize state " + state.getClass().getName(), e);
        }
    }

    @Override
    public <S> S deserializeState(String state, Class<S> type) {
        try {
            return mapper.readValue(state, type);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Cannot read state as " + type.getName(), e);
        }
    }

    private static JsonNode required(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) {
            throw new EventSerializationException("Envelope is missing field " + field, null);
        }
        return n;
    }
}
