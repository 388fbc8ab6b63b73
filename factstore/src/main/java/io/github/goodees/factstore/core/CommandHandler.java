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

import java.util.List;

/**
 * Business logic of a single command type. Handlers describe what they need to know as facts, and decide on the
 * events to append based on the context the facts produce.
 *
 * <p>All methods must be free of side effects. The executor calls them again for every attempt when the append
 * conflicts with concurrent commands, and appending the decided events is the only effect of a command.
 *
 * @param <C> type of command
 * @param <X> type of context
 * @param <E> type of events
 */
public interface CommandHandler<C, X, E> {

    /**
     * Context before any fact is applied.
     * @param command the command
     * @return initial context
     */
    X initialContext(C command);

    /**
     * Facts describing the state the decision depends on. Called for every attempt, and should create new facts
     * every time.
     * @param command the command
     * @return facts, applied in list order
     */
    List<Fact<X, E>> facts(C command);

    /**
     * Decide on the events to append.
     * @param command the command
     * @param context context built from {@link #facts(Object)}
     * @return events to append, possibly empty
     * @throws CommandRejectedException when command violates business rules
     */
    List<E> decide(C command, X context) throws CommandRejectedException;

    /**
     * Facts whose new matches invalidate the decision. By default these are the facts the decision was based on.
     * @param command the command
     * @param facts the facts used for loading the context of this attempt
     * @return facts for consistency check, empty for unconditional append
     */
    default List<? extends Fact<?, ?>> consistencyFacts(C command, List<Fact<X, E>> facts) {
        return facts;
    }
}
