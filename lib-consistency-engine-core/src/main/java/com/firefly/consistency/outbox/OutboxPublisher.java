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

package com.firefly.consistency.outbox;

import com.firefly.consistency.exception.DeliveryException;
import com.firefly.consistency.observability.OutboxEvents;
import com.firefly.consistency.util.LogFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drains the outbox to the message broker.
 *
 * <p>Each poll claims a batch under this publisher's id, delivers the messages one by one
 * in creation order and marks them processed. A failed delivery increments the retry count
 * and schedules the next attempt with the {@link BackoffPolicy}; after {@code maxRetries}
 * retries the message becomes a dead letter. Delivery is at-least-once: a crash between
 * the broker ack and {@code markProcessed} leads to a redelivery once the lease expires.
 *
 * <p>Errors never escape the polling loop; they are logged and the next poll proceeds.
 */
public class OutboxPublisher {
    private static final Logger log = LoggerFactory.getLogger(OutboxPublisher.class);

    private final OutboxStore store;
    private final MessageBroker broker;
    private final OutboxPublisherSettings settings;
    private final BackoffPolicy backoff;
    private final OutboxEvents events;
    private final Clock clock;

    private final AtomicLong polls = new AtomicLong();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();
    private final AtomicReference<Instant> lastPollAt = new AtomicReference<>();

    private volatile Disposable subscription;

    public OutboxPublisher(OutboxStore store,
                           MessageBroker broker,
                           OutboxPublisherSettings settings,
                           BackoffPolicy backoff,
                           OutboxEvents events,
                           Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.broker = Objects.requireNonNull(broker, "broker");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.events = events != null ? events : new OutboxEvents() {};
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Starts the background polling loop. Calling it while running has no effect. */
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        log.info(LogFormat.json(
                "outbox_event", "publisher_started",
                "publisher", settings.publisherId(),
                "poll_interval_ms", Long.toString(settings.pollInterval().toMillis()),
                "batch_size", Integer.toString(settings.batchSize())
        ));
        subscription = Mono.defer(this::pollSafely)
                .repeatWhen(r -> r.delayElements(settings.pollInterval()))
                .subscribe(
                        null,
                        ex -> log.error("Outbox publisher {} terminated unexpectedly", settings.publisherId(), ex),
                        () -> log.info("Outbox publisher {} completed", settings.publisherId())
                );
    }

    /** Stops polling. A delivery in flight is cancelled; its claim simply expires. */
    public synchronized void stop() {
        Disposable s = subscription;
        subscription = null;
        if (s != null && !s.isDisposed()) {
            s.dispose();
            log.info(LogFormat.json("outbox_event", "publisher_stopped", "publisher", settings.publisherId()));
        }
    }

    public boolean isRunning() {
        Disposable s = subscription;
        return s != null && !s.isDisposed();
    }

    /**
     * Runs one claim-and-deliver pass.
     *
     * @return number of messages published in this pass
     */
    public Mono<Integer> publishPending() {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            polls.incrementAndGet();
            lastPollAt.set(now);
            return store.claimBatch(settings.publisherId(), settings.batchSize(), settings.leaseDuration(), now)
                    .collectList()
                    .flatMap(batch -> {
                        events.onBatchClaimed(settings.publisherId(), batch.size());
                        return Flux.fromIterable(batch)
                                .concatMap(this::deliver)
                                .filter(Boolean::booleanValue)
                                .count()
                                .map(Long::intValue);
                    });
        });
    }

    /** Requeues up to {@code limit} dead letters so the next polls retry them. */
    public Mono<Integer> retryDeadLetters(int limit) {
        return store.retryDeadLetters(limit)
                .doOnSuccess(n -> events.onDeadLettersRequeued(n == null ? 0 : n));
    }

    public Mono<Boolean> retryDeadLetter(String messageId) {
        return store.retryDeadLetter(messageId)
                .doOnSuccess(ok -> {
                    if (Boolean.TRUE.equals(ok)) {
                        events.onDeadLettersRequeued(1);
                    }
                });
    }

    public Flux<OutboxMessage> deadLetters(int limit) {
        return store.findDeadLetters(limit);
    }

    /** Deletes published messages processed longer than {@code retention} ago. */
    public Mono<Integer> cleanup(Duration retention) {
        return Mono.defer(() -> store.deletePublishedBefore(clock.instant().minus(retention)))
                .doOnSuccess(n -> events.onCleanup(n == null ? 0 : n));
    }

    public OutboxStats stats() {
        return new OutboxStats(settings.publisherId(), isRunning(), polls.get(), published.get(),
                failed.get(), deadLettered.get(), lastPollAt.get());
    }

    public OutboxPublisherSettings settings() {
        return settings;
    }

    private Mono<Integer> pollSafely() {
        return publishPending()
                .onErrorResume(ex -> {
                    log.error(LogFormat.json(
                            "outbox_event", "poll_failed",
                            "publisher", settings.publisherId(),
                            "error_class", LogFormat.errorClass(ex),
                            "error_msg", LogFormat.errorMessage(ex)
                    ), ex);
                    return Mono.just(0);
                });
    }

    private Mono<Boolean> deliver(OutboxMessage message) {
        long started = System.nanoTime();
        return broker.publish(OutboundRecord.from(message))
                .timeout(settings.deliveryTimeout())
                .thenReturn(true)
                .onErrorResume(ex -> recordFailure(message, new DeliveryException(message.id(), message.topic(), ex)))
                .flatMap(delivered -> {
                    if (!delivered) {
                        return Mono.just(false);
                    }
                    return store.markProcessed(message.id(), settings.publisherId(), clock.instant())
                            .map(marked -> {
                                if (marked) {
                                    published.incrementAndGet();
                                    events.onPublished(message, (System.nanoTime() - started) / 1_000_000L);
                                }
                                return marked;
                            });
                });
    }

    private Mono<Boolean> recordFailure(OutboxMessage message, DeliveryException error) {
        failed.incrementAndGet();
        Instant nextAttempt = clock.instant().plus(backoff.delayFor(message.retryCount() + 1));
        return store.markFailed(message.id(), settings.publisherId(), error.getMessage(), nextAttempt, settings.maxRetries())
                .doOnNext(updated -> {
                    if (updated.isDeadLetter()) {
                        deadLettered.incrementAndGet();
                        events.onDeadLettered(updated, error);
                    } else {
                        events.onDeliveryFailed(updated, error, nextAttempt);
                    }
                })
                .thenReturn(false);
    }
}
