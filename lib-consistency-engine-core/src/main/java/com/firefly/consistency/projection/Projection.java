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

package com.firefly.consistency.projection;

import com.firefly.consistency.eventsourcing.SourcedEvent;

/**
 * A read model folded from one aggregate's event stream.
 *
 * @param <V> view type; should be immutable so that folds are pure
 */
public interface Projection<V> {

    /** View of an aggregate before any event was applied. */
    V initial(String aggregateId);

    V apply(V view, SourcedEvent event);
}
