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

/**
 * Result of conditional append. Either all events of the batch were stored, or none of them, because events
 * matching the consistency facts appeared after the caller's snapshot.
 */
public final class AppendOutcome {
    private static final AppendOutcome EMPTY = new AppendOutcome(false, 0);

    private final boolean conflict;
    private final int count;

    private AppendOutcome(boolean conflict, int count) {
        this.conflict = conflict;
        this.count = count;
    }

    public static AppendOutcome success(int appendedCount) {
        return appendedCount == 0 ? EMPTY : new AppendOutcome(false, appendedCount);
    }

    public static AppendOutcome conflict(int matchedCount) {
        if (matchedCount < 1) {
            throw new IllegalArgumentException("Conflict requires at least one matched event, got " + matchedCount);
        }
        return new AppendOutcome(true, matchedCount);
    }

    public boolean isSuccess() {
        return !conflict;
    }

    public boolean isConflict() {
        return conflict;
    }

    /**
     * Number of events stored, 0 for conflict.
     * @return appended count
     */
    public int getAppendedCount() {
        return conflict ? 0 : count;
    }

    /**
     * Number of events matching consistency facts that were appended after the snapshot. At least 1 for
     * conflict, 0 for success.
     * @return matched count
     */
    public int getMatchedCount() {
        return conflict ? count : 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;

        AppendOutcome that = (AppendOutcome) o;
        return conflict == that.conflict && count == that.count;
    }

    @Override
    public int hashCode() {
        return 31 * (conflict ? 1 : 0) + count;
    }

    @Override
    public String toString() {
        return conflict ? "Conflict(" + count + ")" : "Success(" + count + ")";
    }
}
