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

package com.firefly.consistency.saga;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Fluent builder for {@link SagaDefinition}.
 *
 * <pre>
 * SagaDefinition checkout = SagaBuilder.saga("Checkout")
 *         .timeout(Duration.ofSeconds(30))
 *         .step("ReserveStock").action(ctx -&gt; inventory.reserve(ctx.get("orderId", String.class)))
 *             .compensation(ctx -&gt; inventory.release(ctx.get("orderId", String.class))).add()
 *         .step("ChargeCard").action(ctx -&gt; payments.charge(...)).retry(2).backoff(Duration.ofMillis(200)).add()
 *         .step("ShipOrder").action(ctx -&gt; shipping.ship(...)).add()
 *         .build();
 * </pre>
 */
public class SagaBuilder {
    private final String name;
    private final List<StepDefinition> steps = new ArrayList<>();
    private final Set<String> names = new HashSet<>();
    private Duration timeout;
    private SagaCallback onCompleted;
    private SagaCallback onCompensated;
    private SagaCallback onFailed;

    private SagaBuilder(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("saga name");
        this.name = name;
    }

    public static SagaBuilder saga(String name) {
        return new SagaBuilder(name);
    }

    public Step step(String stepName) {
        return new Step(stepName);
    }

    /** Wall-clock budget for the whole saga while it is running. */
    public SagaBuilder timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public SagaBuilder onCompleted(SagaCallback callback) { this.onCompleted = callback; return this; }
    public SagaBuilder onCompensated(SagaCallback callback) { this.onCompensated = callback; return this; }
    public SagaBuilder onFailed(SagaCallback callback) { this.onFailed = callback; return this; }

    public SagaDefinition build() {
        return new SagaDefinition(name, steps, timeout, onCompleted, onCompensated, onFailed);
    }

    public class Step {
        private final String stepName;
        private StepHandler handler;
        private CompensationHandler compensation;
        private Duration timeout;
        private int retry;
        private Duration backoff;

        private Step(String stepName) {
            if (stepName == null || stepName.isBlank()) throw new IllegalArgumentException("step name");
            this.stepName = stepName;
        }

        public Step action(StepHandler handler) { this.handler = handler; return this; }

        /** Action without a result. */
        public Step run(Consumer<SagaContext> fn) {
            if (fn == null) throw new IllegalArgumentException("action");
            this.handler = ctx -> Mono.fromRunnable(() -> fn.accept(ctx));
            return this;
        }

        /** Action computing a result synchronously. */
        public <O> Step map(Function<SagaContext, O> fn) {
            if (fn == null) throw new IllegalArgumentException("action");
            this.handler = ctx -> Mono.fromCallable(() -> fn.apply(ctx));
            return this;
        }

        public Step compensation(CompensationHandler compensation) { this.compensation = compensation; return this; }

        public Step timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Step retry(int retry) { this.retry = retry; return this; }
        public Step backoff(Duration backoff) { this.backoff = backoff; return this; }

        public SagaBuilder add() {
            if (handler == null) throw new IllegalStateException("Missing action for step '" + stepName + "'");
            if (!names.add(stepName)) throw new IllegalStateException("Duplicate step name '" + stepName + "' in saga '" + name + "'");
            steps.add(new StepDefinition(stepName, handler, compensation, timeout, retry, backoff));
            return SagaBuilder.this;
        }
    }
}
