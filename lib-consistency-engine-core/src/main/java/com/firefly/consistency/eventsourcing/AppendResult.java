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

import com.firefly.consistency.exception.ConcurrencyConflictException;

import java.util.function.Function;
import java.util.function.LongFunction;

/**
 * Outcome of an append. A conflict is an expected result, not a fault: callers reload
 * the aggregate and retry.
 */
public sealed interface AppendResult permits AppendResult.Appended, AppendResult.ConcurrencyConflict {

    static AppendResult appended(long version) {
        return new Appended(version);
    }

    static AppendResult conflict(String aggregateId, long expectedVersion, long actualVersion) {
        return new ConcurrencyConflict(aggregateId, expectedVersion, actualVersion);
    }

    default boolean isConflict() {
        return this instanceof ConcurrencyConflict;
    }

    /**
     * Returns the new version or throws {@link ConcurrencyConflictException} for callers
     * that prefer exception style handling.
     */
    default long versionOrThrow() {
        if (this instanceof Appended a) {
            return a.version();
        }
        ConcurrencyConflict c = (ConcurrencyConflict) this;
        throw new ConcurrencyConflictException(c.aggregateId(), c.expectedVersion(), c.actualVersion());
    }

    default <T> T fold(LongFunction<T> onAppended, Function<ConcurrencyConflict, T> onConflict) {
        if (this instanceof Appended a) {
            return onAppended.apply(a.version());
        }
        return onConflict.apply((ConcurrencyConflict) this);
    }

    /** The append succeeded; {@code version} is the new current version. */
    record Appended(long version) implements AppendResult {}

    /** The stored version differed from the expected one; nothing was written. */
    record ConcurrencyConflict(String aggregateId, long expectedVersion, long actualVersion) implements AppendResult {}
}
