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

import io.github.jbellis.jsuccinct.util.MathUtil;

/**
 * Binomial coefficients C(n, k) for n, k in [0, 63], and the bit widths of RRR offsets derived from them.
 * Computed once, on first use, by Pascal's recurrence.
 */
final class BinomialTable {
    private BinomialTable() {
    }

    private static final class Holder {
        static final long[][] COUNTS = new long[RRRCompressedBitIndex.BLOCK_SIZE + 1][RRRCompressedBitIndex.BLOCK_SIZE + 1];
        static final int[] OFFSET_BITS = new int[RRRCompressedBitIndex.BLOCK_SIZE + 1];

        static {
            for (int n = 0; n < COUNTS.length; n++) {
                COUNTS[n][0] = 1;
                for (int k = 1; k <= n; k++) {
                    COUNTS[n][k] = COUNTS[n - 1][k - 1] + COUNTS[n - 1][k];
                }
            }
            for (int k = 0; k < OFFSET_BITS.length; k++) {
                OFFSET_BITS[k] = MathUtil.bitsToEnumerate(COUNTS[RRRCompressedBitIndex.BLOCK_SIZE][k]);
            }
        }
    }

    /**
     * @return C(n, k), the number of n-bit patterns with k bits set; 0 when k > n
     */
    static long classCount(int n, int k) {
        return Holder.COUNTS[n][k];
    }

    /**
     * @return the number of bits needed for the offset of a block of class {@code k}
     */
    static int classBitOffset(int k) {
        return Holder.OFFSET_BITS[k];
    }
}
