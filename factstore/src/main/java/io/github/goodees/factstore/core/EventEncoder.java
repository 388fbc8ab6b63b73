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
 * Turns an event into its type tag and payload for storage.
 * @param <E> type of events
 */
@FunctionalInterface
public interface EventEncoder<E> {
    /**
     * Encode an event.
     * @param event the event to store
     * @return the type tag and payload
     * @throws IllegalArgumentException when the event is not supported by this encoder
     */
    EncodedEvent encode(E event);
}
