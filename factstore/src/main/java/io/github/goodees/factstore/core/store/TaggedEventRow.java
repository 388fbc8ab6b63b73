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

import org.immutables.value.Value;

/**
 * Row returned by composed read: a stored event, tagged with the fact it matched.
 */
@Value.Immutable
public interface TaggedEventRow {
    String getFactId();

    long getSequenceNumber();

    String getEventType();

    String getPayload();

    /**
     * Maximum sequence number among all rows returned by the same query. It is the same for every row of a result,
     * and serves as freshness boundary for later append.
     * @return maximum sequence number of the composition
     */
    long getMaxSequenceNumber();

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableTaggedEventRow.Builder {

    }
}
