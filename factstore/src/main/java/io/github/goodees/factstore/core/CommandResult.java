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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of command execution. Whether the command needed retries is not visible.
 * @param <E> type of events
 */
public final class CommandResult<E> {
    public enum Status {
        /**
         * Events were appended.
         */
        ACCEPTED,
        /**
         * Handler rejected the command.
         */
        REJECTED,
        /**
         * Command could not be processed due to storage, decoding, or persistent conflicts.
         */
        FAILED
    }

    private final Status status;
    private final List<E> events;
    private final CommandRejectedException rejection;
    private final EventStoreException failure;

    private CommandResult(Status status, List<E> events, CommandRejectedException rejection,
            EventStoreException failure) {
        this.status = status;
        this.events = events;
        this.rejection = rejection;
        this.failure = failure;
    }

    public static <E> CommandResult<E> accepted(List<? extends E> events) {
        return new CommandResult<E>(Status.ACCEPTED, Collections.unmodifiableList(new ArrayList<E>(events)), null,
            null);
    }

    public static <E> CommandResult<E> rejected(CommandRejectedException rejection) {
        return new CommandResult<E>(Status.REJECTED, Collections.<E> emptyList(),
            Objects.requireNonNull(rejection, "rejection"), null);
    }

    public static <E> CommandResult<E> failed(EventStoreException failure) {
        return new CommandResult<E>(Status.FAILED, Collections.<E> emptyList(), null,
            Objects.requireNonNull(failure, "failure"));
    }

    public Status getStatus() {
        return status;
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    /**
     * Events that were appended.
     * @return appended events, empty unless accepted
     */
    public List<E> getEvents() {
        return events;
    }

    /**
     * @return the rejection, or null unless rejected
     */
    public CommandRejectedException getRejection() {
        return rejection;
    }

    /**
     * @return the failure, or null unless failed
     */
    public EventStoreException getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        switch (status) {
            case ACCEPTED:
                return "Accepted" + events;
            case REJECTED:
                return "Rejected(" + rejection.getMessage() + ")";
            default:
                return "Failed(" + failure.getFault() + ": " + failure.getMessage() + ")";
        }
    }
}
