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
 * Stored payload could not be turned into an event. Decoding failures are never retried, since the stored data will
 * not change.
 */
public class DecodeException extends Exception {
    private final String type;

    public DecodeException(String type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public String getType() {
        return type;
    }

    public static DecodeException unknownType(String type) {
        return new DecodeException(type, "Unknown event type: " + type, null);
    }

    public static DecodeException malformed(String type, Throwable cause) {
        return new DecodeException(type, "Could not decode event of type " + type + ". " + cause.getMessage(), cause);
    }
}
