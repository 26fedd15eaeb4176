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

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration of the R2DBC stores.
 * <p>
 * Prefix: {@code firefly.consistency.r2dbc}
 */
@ConfigurationProperties(prefix = "firefly.consistency.r2dbc")
public class R2dbcStoreProperties {

    /** Use the R2DBC stores when a {@code ConnectionFactory} bean exists. */
    private boolean enabled = true;

    /** Create the tables on startup with {@code CREATE TABLE IF NOT EXISTS}. */
    private boolean initializeSchema = true;

    /** Classpath location of the schema script. */
    private String schemaLocation = "classpath:db/consistency/schema.sql";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public String getSchemaLocation() {
        return schemaLocation;
    }

    public void setSchemaLocation(String schemaLocation) {
        this.schemaLocation = schemaLocation;
    }
}
