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

/**
 * Context built from a composed read, together with the snapshot it reflects.
 * @param <C> type of context
 */
public final class LoadedContext<C> {
    private final C context;
    private final long maxSequenceNumber;
    private final int rowCount;

    LoadedContext(C context, long maxSequenceNumber, int rowCount) {
        this.context = context;
        this.maxSequenceNumber = maxSequenceNumber;
        this.rowCount = rowCount;
    }

    public C getContext() {
        return context;
    }

    /**
     * Highest sequence number among events matched by any of the loaded facts, 0 if nothing matched. Pass it to an
     * append as the last seen sequence.
     * @return the snapshot's freshness boundary
     */
    public long getMaxSequenceNumber() {
        return maxSequenceNumber;
    }

    public int getRowCount() {
        return rowCount;
    }

    @Override
    public String toString() {
        return "LoadedContext{maxSequenceNumber=" + maxSequenceNumber + ", rows=" + rowCount + ", context=" + context
                + "}";
    }
}
