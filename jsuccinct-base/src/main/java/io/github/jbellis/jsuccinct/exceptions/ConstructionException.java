/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jbellis.jsuccinct.exceptions;

/**
 * Thrown when a builder is asked to accept input that would break the invariants of the structure
 * it builds: a decreasing or out-of-bound Elias-Fano value, more values than the declared capacity,
 * or an append width outside [0, 64].
 * <p>
 * Builders validate before they mutate, so the builder that threw is unchanged and remains usable.
 */
public class ConstructionException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a ConstructionException with the specified detail message.
     *
     * @param message the detail message
     */
    public ConstructionException(String message) {
        super(message);
    }
}
