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

import io.github.goodees.factstore.core.store.EventStoreException;
import io.github.goodees.factstore.core.store.TaggedEventRow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes rows of a composed read to the facts that matched them, and folds every fact over its events.
 */
public class ContextBuilder {

    /**
     * Build context out of tagged rows.
     *
     * <p>All rows are decoded before any fact is applied, so a single undecodable row fails the whole build and no
     * fact ever sees a partial history. Events are grouped by fact id in ascending sequence order, a fact with no
     * matching rows receives an empty list. Facts are then applied in the order of {@code facts}, each receiving the
     * context produced by its predecessor.
     *
     * @param rows rows of a composed read of {@code facts}
     * @param facts the facts that were composed, in composition order
     * @param decoder decoder of event payloads
     * @param initial context before the first fact is applied
     * @param <C> type of context
     * @param <E> type of events
     * @return context after all facts were applied
     * @throws EventStoreException with fault {@link EventStoreException.Fault#DECODE_ERROR} when any row cannot be decoded
     * @throws IllegalStateException when a row is tagged with id of a fact not in {@code facts}
     */
    public <C, E> C build(List<TaggedEventRow> rows, List<? extends Fact<C, E>> facts, EventDecoder<E> decoder,
            C initial) throws EventStoreException {
        Map<String, List<E>> eventsByFact = new HashMap<>();
        for (Fact<C, E> fact : facts) {
            eventsByFact.put(fact.getId(), new ArrayList<>());
        }
        List<TaggedEventRow> ordered = new ArrayList<>(rows);
        ordered.sort(Comparator.comparingLong(TaggedEventRow::getSequenceNumber));
        for (TaggedEventRow row : ordered) {
            List<E> events = eventsByFact.get(row.getFactId());
            if (events == null) {
                throw new IllegalStateException("Event " + row.getSequenceNumber() + " is tagged with unknown fact "
                        + row.getFactId());
            }
            events.add(decode(decoder, row));
        }

        C context = initial;
        for (Fact<C, E> fact : facts) {
            context = fact.applyEvents(context, Collections.unmodifiableList(eventsByFact.get(fact.getId())));
        }
        return context;
    }

    private <E> E decode(EventDecoder<E> decoder, TaggedEventRow row) throws EventStoreException {
        try {
            return decoder.decode(row.getEventType(), row.getPayload());
        } catch (DecodeException e) {
            throw EventStoreException.decodeFailed(row.getSequenceNumber(), e);
        }
    }
}
