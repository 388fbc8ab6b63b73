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

import io.github.goodees.factstore.core.compose.ComposedQuery;

/**
 * Condition of an append: no event matched by {@link #getCheck()} may have sequence number higher than
 * {@link #getLastSeenSequence()}.
 */
public final class ConsistencyGuard {
    private final ComposedQuery check;
    private final ComposedQuery conflictCount;
    private final long lastSeenSequence;

    /**
     * @param check consistency check composition, returning single column {@code max_sequence_number}
     * @param conflictCount composition counting the conflicting events, returning single column {@code matched_count}
     * @param lastSeenSequence the freshness boundary of caller's snapshot
     */
    public ConsistencyGuard(ComposedQuery check, ComposedQuery conflictCount, long lastSeenSequence) {
        this.check = check;
        this.conflictCount = conflictCount;
        this.lastSeenSequence = lastSeenSequence;
    }

    public ComposedQuery getCheck() {
        return check;
    }

    public ComposedQuery getConflictCount() {
        return conflictCount;
    }

    public long getLastSeenSequence() {
        return lastSeenSequence;
    }

    /**
     * Decide if the current state of the log permits the append.
     * @param currentMaxSequence result of the check query
     * @return true if no matching event is newer than the snapshot
     */
    public boolean permits(long currentMaxSequence) {
        return currentMaxSequence <= lastSeenSequence;
    }

    @Override
    public String toString() {
        return "ConsistencyGuard{lastSeen=" + lastSeenSequence + ", facts=" + check.getFactCount() + "}";
    }
}
