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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the persisted name and the current schema version of a {@link DomainEvent}
 * payload. Without it the simple class name and schema version 1 are used.
 *
 * Example:
 * <pre>
 * &#64;EventType(value = "ItemAdded", schemaVersion = 2)
 * public record ItemAdded(String sku, int quantity) implements DomainEvent {}
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventType {
    /** Event type tag stored with every event. */
    String value();

    /** Schema version written for new events; bump it together with an upcaster. */
    int schemaVersion() default 1;
}
