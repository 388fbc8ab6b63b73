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
 * Turns a stored payload back into an event.
 * @param <E> type of events
 */
@FunctionalInterface
public interface EventDecoder<E> {
    /**
     * Decode a payload.
     * @param type type tag the event was stored with
     * @param payload raw payload
     * @return decoded event, never null
     * @throws DecodeException when the type is not known, or payload cannot be read
     */
    E decode(String type, String payload) throws DecodeException;
}
