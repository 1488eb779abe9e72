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

package io.github.jbellis.jsuccinct.util;

/**
 * Utility methods for integer arithmetic on sizes and bounds.
 */
public class MathUtil {
    /** Private constructor to prevent instantiation. */
    private MathUtil() {
    }

    /**
     * Returns floor(log2(value)).
     *
     * @param value a positive value
     * @return the index of the highest set bit of {@code value}
     */
    public static int floorLog2(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("log2 is undefined for " + value);
        }
        return Long.SIZE - 1 - Long.numberOfLeadingZeros(value);
    }

    /**
     * Returns the number of bits needed to write any value in [0, count), i.e. ceil(log2(count)).
     * A single possible value needs no bits at all.
     *
     * @param count number of distinct values, at least 1
     */
    public static int bitsToEnumerate(long count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Cannot enumerate " + count + " values");
        }
        return count == 1 ? 0 : Long.SIZE - Long.numberOfLeadingZeros(count - 1);
    }

    /**
     * Returns ceil(dividend / divisor) for non-negative dividend and positive divisor.
     */
    public static long divideRoundUp(long dividend, long divisor) {
        return (dividend + divisor - 1) / divisor;
    }
}
