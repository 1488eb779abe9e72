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

/**
 * Provides custom exception types used throughout JSuccinct.
 * <p>
 * Query methods report positions or ranks outside the valid domain with the standard
 * {@link java.lang.IndexOutOfBoundsException}, and I/O failures of the underlying reader or writer
 * surface unchanged as {@link java.io.IOException}. This package holds the one error condition that
 * has no standard counterpart:
 *
 * <ul>
 *   <li>{@link io.github.jbellis.jsuccinct.exceptions.ConstructionException} - an unchecked
 *       exception thrown by builders when an append or set would violate the invariants of the
 *       structure being built. The builder is left exactly as it was before the rejected call.</li>
 * </ul>
 *
 * <h2>Exception Handling Example</h2>
 * <pre>{@code
 * EliasFanoIndexBuilder builder = new EliasFanoIndexBuilder(100, 10_000);
 * builder.add(42);
 * try {
 *     builder.add(7); // decreasing
 * } catch (ConstructionException e) {
 *     // builder still holds [42] and accepts further values
 * }
 * }</pre>
 *
 * @see io.github.jbellis.jsuccinct.exceptions.ConstructionException
 */
package io.github.jbellis.jsuccinct.exceptions;
