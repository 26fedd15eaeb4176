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

/**
 * Resolves event type names and schema versions of payload classes. Results are cached
 * per class.
 */
public final class EventTypes {
    private EventTypes() {}

    private static final ClassValue<EventType> ANNOTATIONS = new ClassValue<>() {
        @Override
        protected EventType computeValue(Class<?> type) {
            return type.getAnnotation(EventType.class);
        }
    };

    public static String typeOf(Class<?> payloadType) {
        EventType ann = ANNOTATIONS.get(payloadType);
        if (ann != null && !ann.value().isBlank()) {
            return ann.value();
        }
        return payloadType.getSimpleName();
    }

    public static int schemaVersionOf(Class<?> payloadType) {
        EventType ann = ANNOTATIONS.get(payloadType);
        if (ann == null) {
            return 1;
        }
        if (ann.schemaVersion() < 1) {
            throw new IllegalStateException("@EventType schemaVersion must be >= 1 on " + payloadType.getName());
        }
        return ann.schemaVersion();
    }
}
