package io.github.goodees.factstore.core;

/*-
 * #%L
 * factstore
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;

/**
 * Description of one derived piece of state. A fact is a parameterized query over the event log, and a pure fold
 * function that applies the events matched by that query to a context.
 *
 * <p>The query must select columns {@code sequence_number}, {@code event_type} and {@code payload} of the event log
 * and reference its parameters by positional placeholders {@code $1 .. $n}. Several facts are merged into a single
 * statement by {@link io.github.goodees.factstore.core.compose.QueryComposer}, which renumbers the placeholders, so
 * every fact is authored as if it was the only query executed.
 *
 * <p>Facts are created fresh for every command attempt and are never persisted. The identity of a fact is assigned
 * on creation and only needs to be unique among facts composed together.
 *
 * @param <C> type of context the fact folds into
 * @param <E> type of events the fact consumes
 */
public final class Fact<C, E> {
    private static final AtomicLong ID_SEQUENCE = new AtomicLong();

    private final String id;
    private final String sql;
    private final List<Object> params;
    private final BiFunction<C, List<E>, C> applyEvents;

    private Fact(String id, String sql, List<?> params, BiFunction<C, List<E>, C> applyEvents) {
        this.id = Objects.requireNonNull(id, "id");
        this.sql = Objects.requireNonNull(sql, "sql");
        // nulls are legal parameter values, hence no List.copyOf
        this.params = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(params, "params")));
        this.applyEvents = Objects.requireNonNull(applyEvents, "applyEvents");
    }

    /**
     * Create fact with generated identity.
     * @param sql query selecting matching events, using placeholders {@code $1 .. $n}
     * @param applyEvents fold of matched events into context, receives events in ascending sequence order
     * @param params values of placeholders, in order
     * @param <C> type of context
     * @param <E> type of event
     * @return new fact
     */
    public static <C, E> Fact<C, E> of(String sql, BiFunction<C, List<E>, C> applyEvents, Object... params) {
        return new Fact<>(nextId(), sql, Arrays.asList(params), applyEvents);
    }

    public static <C, E> Fact<C, E> of(String sql, List<?> params, BiFunction<C, List<E>, C> applyEvents) {
        return new Fact<>(nextId(), sql, params, applyEvents);
    }

    /**
     * Create fact with identity managed by the caller. Caller is responsible for uniqueness of the ids within single
     * composition.
     */
    public static <C, E> Fact<C, E> withId(String id, String sql, List<?> params,
            BiFunction<C, List<E>, C> applyEvents) {
        return new Fact<>(id, sql, params, applyEvents);
    }

    static String nextId() {
        return "fact-" + ID_SEQUENCE.incrementAndGet();
    }

    public String getId() {
        return id;
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParams() {
        return params;
    }

    /**
     * Fold the events matched by this fact into the context.
     * @param context context before this fact was applied
     * @param events matching events in ascending sequence order, possibly empty
     * @return resulting context
     */
    public C applyEvents(C context, List<E> events) {
        return applyEvents.apply(context, events);
    }

    @Override
    public String toString() {
        return "Fact{" + id + ", params=" + params + "}";
    }
}
