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

import java.util.Collection;
import java.util.List;

/**
 * Plain sequential access to the event log, for replays and inspection. Command processing does not use it, it reads
 * through composed facts only.
 */
public interface EventLog {
    /**
     * Read all events that were appended after specified sequence number.
     * @param afterSequence 0 stands for entire history
     * @return events in ascending sequence order
     * @throws EventStoreException when storage cannot be read
     */
    List<StoredEvent> readAll(long afterSequence) throws EventStoreException;

    /**
     * Read events of given types that were appended after specified sequence number.
     * @param types type tags to include
     * @param afterSequence 0 stands for entire history
     * @return events in ascending sequence order
     * @throws EventStoreException when storage cannot be read
     */
    List<StoredEvent> readByTypes(Collection<String> types, long afterSequence) throws EventStoreException;
}
