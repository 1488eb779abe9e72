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

package io.github.jbellis.jsuccinct.bits;

/**
 * Read-only access to a fixed-length sequence of bits.
 * <p>
 * Positions are 0-based. Implementations are immutable, so a single instance may be
 * queried from any number of threads.
 */
public interface Bits {
    /**
     * @return the number of bits in the sequence
     */
    long size();

    /**
     * Returns the value of the bit at {@code pos}.
     *
     * @param pos position, in [0, size())
     * @return <code>true</code> if the bit is set, <code>false</code> otherwise.
     * @throws IndexOutOfBoundsException if {@code pos} is negative or not smaller than {@link #size()}
     */
    boolean getBit(long pos);
}
