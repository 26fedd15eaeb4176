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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Migrates the stored JSON of one event type from {@link #fromVersion()} to
 * {@code fromVersion() + 1}. Chains of upcasters bring old payloads to the current
 * schema before they are bound to the payload class.
 */
public interface EventUpcaster {

    String eventType();

    int fromVersion();

    JsonNode upcast(JsonNode payload);
}
