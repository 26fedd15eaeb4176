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

package com.firefly.consistency.config;

import com.firefly.consistency.outbox.OutboxPublisher;
import org.springframework.context.SmartLifecycle;

/**
 * Ties the outbox polling loop to the application context lifecycle.
 */
public class OutboxPublisherLifecycle implements SmartLifecycle {

    private final OutboxPublisher publisher;
    private final boolean autoStart;

    public OutboxPublisherLifecycle(OutboxPublisher publisher, boolean autoStart) {
        this.publisher = publisher;
        this.autoStart = autoStart;
    }

    @Override
    public void start() {
        publisher.start();
    }

    @Override
    public void stop() {
        publisher.stop();
    }

    @Override
    public boolean isRunning() {
        return publisher.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }
}
