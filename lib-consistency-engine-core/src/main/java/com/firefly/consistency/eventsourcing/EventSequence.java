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

import java.util.List;

/**
 * Shape checks shared by event store implementations before anything is written.
 */
public final class EventSequence {
    private EventSequence() {}

    /**
     * Verifies that every event belongs to {@code aggregateId} and that versions run
     * contiguously from {@code expectedVersion + 1}.
     *
     * @throws IllegalArgumentException when the batch is malformed
     */
    public static void validate(String aggregateId, long expectedVersion, List<SourcedEvent> events) {
        long next = expectedVersion + 1;
        for (SourcedEvent e : events) {
            if (!aggregateId.equals(e.aggregateId())) {
                throw new IllegalArgumentException("Event " + e.eventId() + " belongs to aggregate "
                        + e.aggregateId() + ", not " + aggregateId);
            }
            if (e.version() != next) {
                throw new IllegalArgumentException("Event " + e.eventId() + " has version " + e.version()
                        + " but " + next + " was expected");
            }
            next++;
        }
    }
}
