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
 * Word-level bit operations and small helpers shared by the bit structures.
 * <ul>
 *   <li>{@link io.github.jbellis.jsuccinct.util.BitUtil} - popcount, rank and select within a word,
 *       bit reversal.</li>
 *   <li>{@link io.github.jbellis.jsuccinct.util.MathUtil} - integer logarithms and rounding.</li>
 *   <li>{@link io.github.jbellis.jsuccinct.util.Accountable} and
 *       {@link io.github.jbellis.jsuccinct.util.RamUsageEstimator} - heap usage estimates.</li>
 * </ul>
 */
package io.github.jbellis.jsuccinct.util;
