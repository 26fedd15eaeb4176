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

package com.firefly.consistency.exception;

/**
 * A stored payload cannot be brought to the schema version the running code
 * understands. Fatal for the consumer of that event only.
 */
public class SchemaVersionException extends ConsistencyException {
    private final String eventType;
    private final int storedVersion;
    private final int currentVersion;

    public SchemaVersionException(String eventType, int storedVersion, int currentVersion, String reason) {
        super("Cannot read " + eventType + " schema version " + storedVersion
                + " (current " + currentVersion + "): " + reason);
        this.eventType = eventType;
        this.storedVersion = storedVersion;
        this.currentVersion = currentVersion;
    }

    public SchemaVersionException(String eventType, int storedVersion, int currentVersion, Throwable cause) {
        super("Cannot read " + eventType + " schema version " + storedVersion
                + " (current " + currentVersion + "): " + cause.getMessage(), cause);
        this.eventType = eventType;
        this.storedVersion = storedVersion;
        this.currentVersion = currentVersion;
    }

    public String getEventType() { return eventType; }
    public int getStoredVersion() { return storedVersion; }
    public int getCurrentVersion() { return currentVersion; }
}
