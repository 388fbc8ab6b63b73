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

import io.github.goodees.factstore.core.DecodeException;

/**
 * Exception generated when reading or appending events fails. None of the faults is retried by the command
 * executor; optimistic lock conflicts are retried before this exception is ever created.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        OPTIMISTIC_LOCK, TX_ERROR, DECODE_ERROR, PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException retriesExhausted(int attempts, int matchedCount) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Max retries exceeded. Conflicting events were appended "
                + "in each of " + attempts + " attempts, " + matchedCount + " in the last one", null);
    }

    public static EventStoreException storeFailed(int eventCount, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR, "Append of " + eventCount + " events failed. "
                + cause.getMessage(), cause);
    }

    public static EventStoreException readFailed(Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR, "Reading events failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException decodeFailed(long sequenceNumber, DecodeException cause) {
        return new EventStoreException(Fault.DECODE_ERROR, "Event " + sequenceNumber + " could not be decoded. "
                + cause.getMessage(), cause);
    }

    public static EventStoreException missingAppendLock(String lockTable) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Append lock row is missing in table " + lockTable,
            null);
    }

    public static EventStoreException unsupported(Object event, Throwable cause) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported event: " + event, cause);
    }
}
