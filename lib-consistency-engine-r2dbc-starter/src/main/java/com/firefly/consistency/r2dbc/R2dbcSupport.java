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

package com.firefly.consistency.r2dbc;

import io.r2dbc.spi.Row;
import org.springframework.r2dbc.core.DatabaseClient;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Binding and row helpers shared by the R2DBC stores. Timestamps are stored as
 * {@code TIMESTAMP WITH TIME ZONE} in UTC.
 */
final class R2dbcSupport {
    private R2dbcSupport() {}

    static OffsetDateTime ts(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static Instant instant(Row row, String column) {
        OffsetDateTime value = row.get(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    static long longValue(Row row, String column) {
        Number n = row.get(column, Number.class);
        return n == null ? 0L : n.longValue();
    }

    static DatabaseClient.GenericExecuteSpec bindMaybe(DatabaseClient.GenericExecuteSpec spec,
                                                       String name, Object value, Class<?> type) {
        return value == null ? spec.bindNull(name, type) : spec.bind(name, value);
    }

    static DatabaseClient.GenericExecuteSpec bindTs(DatabaseClient.GenericExecuteSpec spec, String name, Instant value) {
        return bindMaybe(spec, name, ts(value), OffsetDateTime.class);
    }
}
