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

package com.firefly.consistency.redis;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings of the Redis saga state store, bound from {@code firefly.consistency.redis}.
 */
@ConfigurationProperties(prefix = "firefly.consistency.redis")
public class RedisStoreProperties {

    /** Whether saga state is kept in Redis. Off unless explicitly enabled. */
    private boolean enabled = false;

    private String host = "localhost";

    private int port = 6379;

    private int database = 0;

    private String password;

    /** Prefix of every key written by the store. */
    private String keyPrefix = "consistency:";

    /** How long finished sagas are kept. {@code null} or zero keeps them forever. */
    private Duration terminalTtl = Duration.ofDays(7);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public int getDatabase() {
        return database;
    }

    public void setDatabase(int database) {
        this.database = database;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public Duration getTerminalTtl() {
        return terminalTtl;
    }

    public void setTerminalTtl(Duration terminalTtl) {
        this.terminalTtl = terminalTtl;
    }
}
