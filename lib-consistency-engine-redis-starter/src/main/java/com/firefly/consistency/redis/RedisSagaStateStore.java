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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.consistency.saga.SagaState;
import com.firefly.consistency.saga.SagaStateStore;
import com.firefly.consistency.saga.SagaStatus;
import com.firefly.consistency.util.LogFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Saga state store on Redis.
 *
 * <p>Key layout, all under the configured prefix:
 * <ul>
 *   <li>{@code saga:<id>} the saga state as a JSON document</li>
 *   <li>{@code status:<STATUS>} set of the ids currently in that status</li>
 *   <li>{@code updated} sorted set of all ids scored by last update time</li>
 * </ul>
 * The document is authoritative. Index entries pointing to a missing document or to a
 * document in another status are ignored on read and pruned.
 */
public class RedisSagaStateStore implements SagaStateStore {
    private static final Logger log = LoggerFactory.getLogger(RedisSagaStateStore.class);

    private static final Comparator<SagaState> BY_CREATION =
            Comparator.comparing(SagaState::createdAt).thenComparing(SagaState::sagaId);

    private final ReactiveRedisOperations<String, byte[]> redis;
    private final ObjectMapper mapper;
    private final String prefix;
    private final Duration terminalTtl;

    public RedisSagaStateStore(ReactiveRedisOperations<String, byte[]> redis,
                               ObjectMapper mapper,
                               String keyPrefix,
                               Duration terminalTtl) {
        this.redis = Objects.requireNonNull(redis, "redis");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.prefix = keyPrefix == null ? "" : keyPrefix;
        this.terminalTtl = terminalTtl;
    }

    @Override
    public Mono<Boolean> insert(SagaState state) {
        return Mono.defer(() -> redis.opsForValue().setIfAbsent(sagaKey(state.sagaId()), write(state)))
                .flatMap(inserted -> Boolean.TRUE.equals(inserted)
                        ? index(state, null).thenReturn(true)
                        : Mono.just(false));
    }

    @Override
    public Mono<SagaState> save(SagaState state) {
        return Mono.defer(() -> redis.opsForValue().getAndSet(sagaKey(state.sagaId()), write(state)))
                .map(previous -> Optional.of(read(previous).status()))
                .defaultIfEmpty(Optional.empty())
                .flatMap(previous -> index(state, previous.orElse(null)))
                .thenReturn(state);
    }

    @Override
    public Mono<SagaState> findById(String sagaId) {
        return redis.opsForValue().get(sagaKey(sagaId)).map(this::read);
    }

    @Override
    public Flux<SagaState> findByStatus(Set<SagaStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return Flux.empty();
        }
        return Flux.fromIterable(statuses)
                .concatMap(status -> redis.opsForSet().members(statusKey(status))
                        .map(RedisSagaStateStore::id)
                        .concatMap(id -> findById(id)
                                .filter(state -> state.status() == status)
                                .switchIfEmpty(Mono.defer(() -> pruneStatus(status, id)))))
                .collectSortedList(BY_CREATION)
                .flatMapIterable(list -> list);
    }

    /**
     * Walks the update index newest first. Filters are applied to the documents, so a
     * narrow filter reads more of the index than {@code limit}.
     */
    @Override
    public Flux<SagaState> findRecent(String sagaName, SagaStatus status, int limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        return redis.opsForZSet().reverseRangeByScore(updatedKey(), Range.unbounded())
                .map(RedisSagaStateStore::id)
                .concatMap(id -> findById(id).switchIfEmpty(Mono.defer(() -> pruneUpdated(id))))
                .filter(state -> sagaName == null || sagaName.equals(state.sagaName()))
                .filter(state -> status == null || state.status() == status)
                .take(limit);
    }

    private Mono<Void> index(SagaState state, SagaStatus previous) {
        byte[] member = member(state.sagaId());
        Mono<Long> unlink = previous == null || previous == state.status()
                ? Mono.just(0L)
                : redis.opsForSet().remove(statusKey(previous), member);
        Mono<Boolean> expire = state.isTerminal() && hasTtl()
                ? redis.expire(sagaKey(state.sagaId()), terminalTtl)
                : Mono.just(false);
        return unlink
                .then(redis.opsForSet().add(statusKey(state.status()), member))
                .then(redis.opsForZSet().add(updatedKey(), member, state.updatedAt().toEpochMilli()))
                .then(expire)
                .then();
    }

    private <T> Mono<T> pruneStatus(SagaStatus status, String sagaId) {
        log.debug(LogFormat.json("saga_event", "stale_index_entry", "index", "status:" + status, "saga_id", sagaId));
        return redis.opsForSet().remove(statusKey(status), member(sagaId)).then(Mono.empty());
    }

    private <T> Mono<T> pruneUpdated(String sagaId) {
        log.debug(LogFormat.json("saga_event", "stale_index_entry", "index", "updated", "saga_id", sagaId));
        return redis.opsForZSet().remove(updatedKey(), member(sagaId)).then(Mono.empty());
    }

    private boolean hasTtl() {
        return terminalTtl != null && !terminalTtl.isZero() && !terminalTtl.isNegative();
    }

    String sagaKey(String sagaId) {
        return prefix + "saga:" + sagaId;
    }

    String statusKey(SagaStatus status) {
        return prefix + "status:" + status.name();
    }

    String updatedKey() {
        return prefix + "updated";
    }

    private static byte[] member(String sagaId) {
        return sagaId.getBytes(StandardCharsets.UTF_8);
    }

    private static String id(byte[] member) {
        return new String(member, StandardCharsets.UTF_8);
    }

    private byte[] write(SagaState state) {
        try {
            return mapper.writeValueAsBytes(state);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to serialize saga " + state.sagaId(), e);
        }
    }

    private SagaState read(byte[] document) {
        try {
            return mapper.readValue(document, SagaState.class);
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable saga state document", e);
        }
    }
}
