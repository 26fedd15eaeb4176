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

package com.firefly.consistency.outbox;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What the publisher hands to the broker for one outbox message.
 *
 * @param topic   destination
 * @param key     partitioning key, the aggregate id
 * @param payload serialized event envelope
 * @param headers message id, event type and aggregate coordinates; consumers dedupe on
 *                {@link #HEADER_MESSAGE_ID}
 */
public record OutboundRecord(String topic, String key, String payload, Map<String, String> headers) {

    public static final String HEADER_MESSAGE_ID = "message-id";
    public static final String HEADER_EVENT_TYPE = "event-type";
    public static final String HEADER_AGGREGATE_TYPE = "aggregate-type";
    public static final String HEADER_AGGREGATE_ID = "aggregate-id";

    public OutboundRecord {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static OutboundRecord from(OutboxMessage message) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HEADER_MESSAGE_ID, message.id());
        headers.put(HEADER_EVENT_TYPE, message.eventType());
        headers.put(HEADER_AGGREGATE_TYPE, message.aggregateType());
        headers.put(HEADER_AGGREGATE_ID, message.aggregateId());
        return new OutboundRecord(message.topic(), message.aggregateId(), message.payload(), headers);
    }

    public String messageId() {
        return headers.get(HEADER_MESSAGE_ID);
    }

    public String eventType() {
        return headers.get(HEADER_EVENT_TYPE);
    }
}
