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

package com.firefly.consistency.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.firefly.consistency.saga.InMemorySagaStateStore;
import com.firefly.consistency.saga.SagaBuilder;
import com.firefly.consistency.saga.SagaOrchestrator;
import com.firefly.consistency.saga.SagaState;
import com.firefly.consistency.saga.SagaStatus;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SagaLoggerEventsTest {

    @Test
    void logsStepFailureAndCompensationAsJson() {
        Logger logger = (Logger) LoggerFactory.getLogger(SagaLoggerEvents.class);
        Level old = logger.getLevel();
        logger.setLevel(Level.INFO);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            SagaOrchestrator orchestrator = new SagaOrchestrator(new InMemorySagaStateStore(), new SagaLoggerEvents());
            SagaState state = orchestrator.execute(SagaBuilder.saga("Logged")
                    .step("reserve").map(ctx -> "r").compensation(ctx -> Mono.empty()).add()
                    .step("charge").action(ctx -> Mono.error(new IllegalStateException("card \"declined\""))).add()
                    .build(), Map.of()).block();
            assertNotNull(state);
            assertEquals(SagaStatus.COMPENSATED, state.status());

            List<String> messages = appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
            assertTrue(messages.stream().anyMatch(m -> m.contains("\"saga_event\":\"start\"") && m.contains("Logged")));
            assertTrue(messages.stream().anyMatch(m -> m.contains("\"step_failed\"")
                    && m.contains("\"step\":\"charge\"")
                    && m.contains("card \\\"declined\\\"")));
            assertTrue(messages.stream().anyMatch(m -> m.contains("\"compensated\"") && m.contains("\"step\":\"reserve\"")));
            assertTrue(messages.stream().anyMatch(m -> m.contains("\"completed\"") && m.contains("COMPENSATED")));
            assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN));
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(old);
        }
    }
}
