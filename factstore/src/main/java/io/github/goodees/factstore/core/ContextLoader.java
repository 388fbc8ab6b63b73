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

import io.github.goodees.factstore.core.compose.ComposedQuery;
import io.github.goodees.factstore.core.compose.QueryComposer;
import io.github.goodees.factstore.core.store.EventStore;
import io.github.goodees.factstore.core.store.EventStoreException;
import io.github.goodees.factstore.core.store.TaggedEventRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Loads context of a list of facts in single round trip: composes the facts, executes the read and builds the
 * context of its rows.
 *
 * <p>Dependent data, e. g. children of a parent loaded by a first set of facts, are loaded by second call with facts
 * parameterized by the first context. Each load is a separate composition; they are never merged.
 */
public class ContextLoader {
    private static final Logger logger = LoggerFactory.getLogger(ContextLoader.class);

    private final EventStore store;
    private final QueryComposer composer;
    private final ContextBuilder builder;

    public ContextLoader(EventStore store) {
        this(store, new QueryComposer(), new ContextBuilder());
    }

    public ContextLoader(EventStore store, QueryComposer composer, ContextBuilder builder) {
        this.store = store;
        this.composer = composer;
        this.builder = builder;
    }

    /**
     * Load context of the facts.
     * @param facts facts to evaluate, with unique ids
     * @param decoder decoder of payloads
     * @param initial initial context
     * @param <C> type of context
     * @param <E> type of events
     * @return built context with its snapshot boundary
     * @throws EventStoreException when read fails or an event cannot be decoded
     */
    public <C, E> LoadedContext<C> load(List<? extends Fact<C, E>> facts, EventDecoder<E> decoder, C initial)
            throws EventStoreException {
        ComposedQuery query = composer.compose(facts, QueryComposer.Mode.READ);
        List<TaggedEventRow> rows = query.isEmpty() ? Collections.<TaggedEventRow> emptyList() : store.read(query);
        long maxSequence = rows.isEmpty() ? 0 : rows.get(0).getMaxSequenceNumber();
        C context = builder.build(rows, facts, decoder, initial);
        logger.debug("Loaded {} rows of {} facts up to sequence {}", rows.size(), facts.size(), maxSequence);
        return new LoadedContext<>(context, maxSequence, rows.size());
    }
}
