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
 * Bits that also answer rank and select queries, so plain and compressed indexes are interchangeable.
 * <p>
 * Rank counts bits strictly before a cutoff: {@code rankSetBits(p)} is the number of set bits in
 * [0, p). Select is 0-indexed: {@code selectSetBits(k)} is the position of the set bit preceded by
 * exactly {@code k} set bits. For every valid {@code k}, {@code rankSetBits(selectSetBits(k)) == k},
 * and likewise for unset bits.
 */
public interface RankSelectBits extends Bits {
    /**
     * @return the number of set bits
     */
    long setBitsCount();

    /**
     * @return the number of unset bits, i.e. {@code size() - setBitsCount()}
     */
    long unsetBitsCount();

    /**
     * @param cutoff exclusive end position, in [0, size()]
     * @return the number of set bits in [0, cutoff)
     * @throws IndexOutOfBoundsException if cutoff is outside [0, size()]
     */
    long rankSetBits(long cutoff);

    /**
     * @param cutoff exclusive end position, in [0, size()]
     * @return the number of unset bits in [0, cutoff)
     * @throws IndexOutOfBoundsException if cutoff is outside [0, size()]
     */
    long rankUnsetBits(long cutoff);

    /**
     * @param k 0-based index among the set bits, in [0, setBitsCount())
     * @return the position of the k-th set bit
     * @throws IndexOutOfBoundsException if k is outside [0, setBitsCount())
     */
    long selectSetBits(long k);

    /**
     * @param k 0-based index among the unset bits, in [0, unsetBitsCount())
     * @return the position of the k-th unset bit
     * @throws IndexOutOfBoundsException if k is outside [0, unsetBitsCount())
     */
    long selectUnsetBits(long k);
}
