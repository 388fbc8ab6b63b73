package io.github.goodees.factstore.core.store;

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

import io.github.goodees.factstore.core.EncodedEvent;
import io.github.goodees.factstore.core.compose.ComposedQuery;

import java.util.List;
import java.util.Map;

/**
 * Storage of the single append-only event log. Every appended event gets sequence number from a single, monotonically
 * increasing counter shared by the whole log. Events are never updated nor deleted, and readers only see fully
 * committed batches.
 */
public interface EventStore {
    /**
     * Execute composed read.
     * @param query query composed in {@link io.github.goodees.factstore.core.compose.QueryComposer.Mode#READ} mode
     * @return tagged rows in ascending sequence order
     * @throws EventStoreException when storage cannot be read
     */
    List<TaggedEventRow> read(ComposedQuery query) throws EventStoreException;

    /**
     * Append all events, provided the guard permits current state of the log. Check of the guard and the insert are
     * performed atomically, i. e. no other append may interleave.
     * @param guard consistency condition
     * @param events events to append, in order
     * @param metadata metadata stored with every event
     * @return success, or conflict in which case no event was stored
     * @throws EventStoreException when storage fails, no event was stored then either
     */
    AppendOutcome append(ConsistencyGuard guard, List<EncodedEvent> events, Map<String, ?> metadata)
            throws EventStoreException;

    /**
     * Append all events without any consistency condition.
     * @param events events to append, in order
     * @param metadata metadata stored with every event
     * @return success
     * @throws EventStoreException when storage fails, no event was stored then
     */
    AppendOutcome appendUnconditionally(List<EncodedEvent> events, Map<String, ?> metadata)
            throws EventStoreException;
}
