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

import com.firefly.consistency.exception.ConsistencyException;

/**
 * A payload, envelope or snapshot state could not be written or parsed.
 */
public class EventSerializationException extends ConsistencyException {

    public EventSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
