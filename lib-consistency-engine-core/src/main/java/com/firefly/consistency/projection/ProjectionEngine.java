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

import com.firefly.consistency.eventsourcing.EventStore;
import com.firefly.consistency.eventsourcing.SourcedEvent;
import com.firefly.consistency.util.LogFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Maintains one view per aggregate by folding events in strict version order.
 *
 * <p>Views are rebuilt from the full history on demand, or kept current with
 * {@link #applyIncremental(SourcedEvent)}. An incremental event that skips a version makes
 * the engine rebuild that aggregate from the store instead of folding out of order; an
 * event at or below the last applied version is ignored, which makes redelivery harmless.
 *
 * @param <V> view type
 */
public class ProjectionEngine<V> {
    private static final Logger log = LoggerFactory.getLogger(ProjectionEngine.class);

    private static final int PAGE_SIZE = 500;

    private final String name;
    private final Projection<V> projection;
    private final EventStore eventStore;
    private final Map<String, ViewState<V>> views = new ConcurrentHashMap<>();

    public ProjectionEngine(String name, Projection<V> projection, EventStore eventStore) {
        this.name = Objects.requireNonNull(name, "name");
        this.projection = Objects.requireNonNull(projection, "projection");
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    }

    public String name() {
        return name;
    }

    /**
     * Discards the view of {@code aggregateId} and replays its whole history.
     * Emits nothing (and drops the view) when the aggregate has no events.
     */
    public Mono<V> rebuild(String aggregateId) {
        return eventStore.load(aggregateId)
                .reduce(new ViewState<>(projection.initial(aggregateId), 0L), this::fold)
                .flatMap(state -> {
                    if (state.lastVersion() == 0L) {
                        views.remove(aggregateId);
                        return Mono.empty();
                    }
                    views.put(aggregateId, state);
                    log.debug(LogFormat.json(
                            "projection_event", "rebuilt",
                            "projection", name,
                            "aggregate_id", aggregateId,
                            "version", Long.toString(state.lastVersion())
                    ));
                    return Mono.just(state.view());
                });
    }

    /**
     * Rebuilds every aggregate whose id matches {@code filter} by scanning the global
     * event log. Views of matching aggregates that no longer have events are dropped.
     *
     * @return number of views rebuilt
     */
    public Mono<Integer> rebuild(Predicate<String> filter) {
        Map<String, ViewState<V>> rebuilt = new LinkedHashMap<>();
        return scan(0L, filter, rebuilt).then(Mono.fromSupplier(() -> {
            views.keySet().removeIf(id -> filter.test(id) && !rebuilt.containsKey(id));
            views.putAll(rebuilt);
            log.info(LogFormat.json(
                    "projection_event", "rebuilt_all",
                    "projection", name,
                    "views", Integer.toString(rebuilt.size())
            ));
            return rebuilt.size();
        }));
    }

    /**
     * Folds one newly committed event into its aggregate's view.
     */
    public Mono<V> applyIncremental(SourcedEvent event) {
        return Mono.defer(() -> {
            String id = event.aggregateId();
            boolean[] gap = {false};
            ViewState<V> result = views.compute(id, (key, current) -> {
                long last = current == null ? 0L : current.lastVersion();
                if (event.version() <= last) {
                    return current;
                }
                if (event.version() != last + 1) {
                    gap[0] = true;
                    return current;
                }
                V base = current == null ? projection.initial(id) : current.view();
                return new ViewState<>(projection.apply(base, event), event.version());
            });
            if (gap[0]) {
                log.info(LogFormat.json(
                        "projection_event", "gap_detected",
                        "projection", name,
                        "aggregate_id", id,
                        "last_version", Long.toString(lastVersion(id)),
                        "event_version", Long.toString(event.version())
                ));
                return rebuild(id);
            }
            return Mono.justOrEmpty(result).map(ViewState::view);
        });
    }

    public Optional<V> view(String aggregateId) {
        ViewState<V> s = views.get(aggregateId);
        return s == null ? Optional.empty() : Optional.of(s.view());
    }

    /** Last version folded into the view of {@code aggregateId}, 0 if none. */
    public long lastVersion(String aggregateId) {
        ViewState<V> s = views.get(aggregateId);
        return s == null ? 0L : s.lastVersion();
    }

    public Map<String, V> views() {
        Map<String, V> out = new LinkedHashMap<>();
        views.forEach((id, s) -> out.put(id, s.view()));
        return Collections.unmodifiableMap(out);
    }

    public void reset() {
        views.clear();
    }

    private Mono<Void> scan(long position, Predicate<String> filter, Map<String, ViewState<V>> acc) {
        return eventStore.loadAll(position, PAGE_SIZE)
                .collectList()
                .flatMap(page -> {
                    for (SourcedEvent e : page) {
                        if (filter.test(e.aggregateId())) {
                            ViewState<V> current = acc.computeIfAbsent(e.aggregateId(),
                                    id -> new ViewState<>(projection.initial(id), 0L));
                            acc.put(e.aggregateId(), fold(current, e));
                        }
                    }
                    if (page.size() < PAGE_SIZE) {
                        return Mono.empty();
                    }
                    return scan(position + page.size(), filter, acc);
                });
    }

    private ViewState<V> fold(ViewState<V> state, SourcedEvent event) {
        if (event.version() != state.lastVersion() + 1) {
            throw new IllegalStateException("Event " + event.eventId() + " of " + event.aggregateId()
                    + " has version " + event.version() + " after " + state.lastVersion());
        }
        return new ViewState<>(projection.apply(state.view(), event), event.version());
    }

    private record ViewState<V>(V view, long lastVersion) {}
}
