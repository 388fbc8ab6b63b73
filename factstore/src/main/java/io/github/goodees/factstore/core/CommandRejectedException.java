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
 * Business rule violation reported by a {@link CommandHandler}. Rejections are deterministic for a given context, so
 * they are returned to the caller immediately and never retried.
 *
 * <p>Handlers may subclass it to carry structured reasons.
 */
public class CommandRejectedException extends Exception {

    public CommandRejectedException(String message) {
        super(message);
    }

    public CommandRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
