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

import io.github.goodees.factstore.core.compose.QueryComposer;
import io.github.goodees.factstore.core.store.AppendOutcome;
import io.github.goodees.factstore.core.store.ConsistencyGuard;
import io.github.goodees.factstore.core.store.EventStore;
import io.github.goodees.factstore.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Appends events under optimistic concurrency control.
 *
 * <p>The caller has seen the log up to {@code lastSeenSequence} through some facts. The batch is appended only if
 * no event matching any of the consistency facts was appended since; otherwise nothing is appended and a conflict is
 * reported. There are no locks held between read and append, the sequence number is the only version token.
 */
public class AppendEngine {
    private static final Logger logger = LoggerFactory.getLogger(AppendEngine.class);

    private final EventStore store;
    private final QueryComposer composer;

    public AppendEngine(EventStore store) {
        this(store, new QueryComposer());
    }

    public AppendEngine(EventStore store, QueryComposer composer) {
        this.store = store;
        this.composer = composer;
    }

    /**
     * Append the events, provided the consistency facts did not match anything new.
     *
     * <p>Empty batch succeeds without contacting the store. Empty list of consistency facts means no constraint, and
     * the batch is appended unconditionally.
     *
     * @param events events to append
     * @param encoder encoder of events
     * @param metadata metadata to store with every event
     * @param consistencyFacts facts whose matches would invalidate caller's decision
     * @param lastSeenSequence the sequence number caller's decision is based on
     * @param <E> type of events
     * @return success, or conflict with number of events that appeared since {@code lastSeenSequence}
     * @throws EventStoreException when an event cannot be encoded, or storage fails
     */
    public <E> AppendOutcome append(List<? extends E> events, EventEncoder<E> encoder, Map<String, ?> metadata,
            List<? extends Fact<?, ?>> consistencyFacts, long lastSeenSequence) throws EventStoreException {
        if (events.isEmpty()) {
            return AppendOutcome.success(0);
        }
        List<EncodedEvent> encoded = encode(events, encoder);
        if (consistencyFacts.isEmpty()) {
            logger.debug("Appending {} events without consistency check", encoded.size());
            return store.appendUnconditionally(encoded, metadata);
        }
        ConsistencyGuard guard = new ConsistencyGuard(
            composer.compose(consistencyFacts, QueryComposer.Mode.CONSISTENCY_CHECK),
            composer.composeConflictCount(consistencyFacts, lastSeenSequence), lastSeenSequence);
        AppendOutcome outcome = store.append(guard, encoded, metadata);
        if (outcome.isConflict()) {
            logger.debug("Append of {} events rejected, {} conflicting events after sequence {}", encoded.size(),
                outcome.getMatchedCount(), lastSeenSequence);
        }
        return outcome;
    }

    private <E> List<EncodedEvent> encode(List<? extends E> events, EventEncoder<E> encoder)
            throws EventStoreException {
        List<EncodedEvent> result = new ArrayList<>(events.size());
        for (E event : events) {
            try {
                result.add(encoder.encode(event));
            } catch (RuntimeException e) {
                throw EventStoreException.unsupported(event, e);
            }
        }
        return result;
    }
}
