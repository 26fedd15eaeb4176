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
 * Raised only when a caller opts into exception style handling of a
 * {@code ConcurrencyConflict} result, see {@code AppendResult#versionOrThrow()}.
 * The caller is expected to reload the aggregate and retry the whole operation.
 */
public class ConcurrencyConflictException extends ConsistencyException {
    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String aggregateId, long expectedVersion, long actualVersion) {
        super("Concurrency conflict on aggregate " + aggregateId
                + ": expected version " + expectedVersion + " but was " + actualVersion);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getAggregateId() { return aggregateId; }
    public long getExpectedVersion() { return expectedVersion; }
    public long getActualVersion() { return actualVersion; }
}
