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

import io.github.goodees.factstore.core.store.AppendOutcome;
import io.github.goodees.factstore.core.store.EventStore;
import io.github.goodees.factstore.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Entry point for executing commands against the event log.
 *
 * <p>Every attempt performs following steps in the caller's thread:
 * <ol>
 *     <li>Load the context of {@linkplain CommandHandler#facts(Object) handler's facts}. Context is always rebuilt
 *     from scratch, so it is consistent with its own snapshot.</li>
 *     <li>Let the handler {@linkplain CommandHandler#decide(Object, Object) decide} on the events.</li>
 *     <li>Append the events, provided no event matching the
 *     {@linkplain CommandHandler#consistencyFacts(Object, List) consistency facts} appeared since the snapshot.</li>
 * </ol>
 * When append conflicts, the command is attempted again while the retry budget lasts. Rejections by the handler,
 * storage and decoding failures end the execution immediately.
 *
 * @param <E> type of events
 */
public class CommandExecutor<E> {
    private static final Logger logger = LoggerFactory.getLogger(CommandExecutor.class);

    public static final int DEFAULT_RETRY_BUDGET = 3;

    private final ContextLoader loader;
    private final AppendEngine appendEngine;
    private final EventDecoder<E> decoder;
    private final EventEncoder<E> encoder;
    private final int retryBudget;

    public CommandExecutor(EventStore store, EventDecoder<E> decoder, EventEncoder<E> encoder) {
        this(store, decoder, encoder, DEFAULT_RETRY_BUDGET);
    }

    public CommandExecutor(EventStore store, EventDecoder<E> decoder, EventEncoder<E> encoder, int retryBudget) {
        this(new ContextLoader(store), new AppendEngine(store), decoder, encoder, retryBudget);
    }

    public CommandExecutor(ContextLoader loader, AppendEngine appendEngine, EventDecoder<E> decoder,
            EventEncoder<E> encoder, int retryBudget) {
        this.loader = loader;
        this.appendEngine = appendEngine;
        this.decoder = decoder;
        this.encoder = encoder;
        this.retryBudget = checkBudget(retryBudget);
    }

    public <C, X> CommandResult<E> execute(CommandHandler<C, X, E> handler, C command) {
        return execute(handler, command, Collections.<String, Object> emptyMap(), retryBudget);
    }

    public <C, X> CommandResult<E> execute(CommandHandler<C, X, E> handler, C command, Map<String, ?> metadata) {
        return execute(handler, command, metadata, retryBudget);
    }

    /**
     * Execute the command.
     * @param handler business logic of the command
     * @param command the command
     * @param metadata metadata stored with every appended event
     * @param retryBudget number of times the command is attempted again after conflicting append, {@code 0} for
     *                    single attempt
     * @param <C> type of command
     * @param <X> type of context
     * @return accepted events, rejection, or failure
     */
    public <C, X> CommandResult<E> execute(CommandHandler<C, X, E> handler, C command, Map<String, ?> metadata,
            int retryBudget) {
        int retriesLeft = checkBudget(retryBudget);
        int attempt = 0;
        while (true) {
            attempt++;
            AppendOutcome outcome;
            List<E> events;
            try {
                List<Fact<X, E>> facts = handler.facts(command);
                LoadedContext<X> loaded = loader.load(facts, decoder, handler.initialContext(command));
                logger.debug("Attempt {} of {} loaded context at sequence {}", attempt, command,
                    loaded.getMaxSequenceNumber());
                events = handler.decide(command, loaded.getContext());
                outcome = appendEngine.append(events, encoder, metadata, handler.consistencyFacts(command, facts),
                    loaded.getMaxSequenceNumber());
            } catch (CommandRejectedException e) {
                logger.debug("Command {} rejected: {}", command, e.getMessage());
                return CommandResult.rejected(e);
            } catch (EventStoreException e) {
                logger.error("Command {} failed in attempt {}", command, attempt, e);
                return CommandResult.failed(e);
            }

            if (outcome.isSuccess()) {
                return CommandResult.accepted(events);
            }
            if (retriesLeft == 0) {
                logger.warn("Command {} still conflicting after {} attempts, giving up", command, attempt);
                return CommandResult.failed(EventStoreException.retriesExhausted(attempt, outcome.getMatchedCount()));
            }
            retriesLeft--;
            logger.info("Command {} conflicts with {} new events, retrying ({} retries left)", command,
                outcome.getMatchedCount(), retriesLeft);
        }
    }

    public int getRetryBudget() {
        return retryBudget;
    }

    private static int checkBudget(int retryBudget) {
        if (retryBudget < 0) {
            throw new IllegalArgumentException("Retry budget must not be negative, was " + retryBudget);
        }
        return retryBudget;
    }
}
