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

import io.github.jbellis.jsuccinct.exceptions.ConstructionException;
import io.github.jbellis.jsuccinct.util.BitUtil;
import io.github.jbellis.jsuccinct.util.MathUtil;
import org.agrona.collections.LongArrayList;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accumulates a non-decreasing sequence of values for an {@link EliasFanoIndex}. The number of values
 * and their upper bound are declared up front, since they fix the split between low and high bits.
 * <p>
 * Values added so far can be read back with {@link #get(long)}, {@link #indexOf(long)} and
 * {@link #contains(long)} before the index is built.
 * <p>
 * Not thread-safe.
 */
public class EliasFanoIndexBuilder {
    private static final Logger LOG = Logger.getLogger(EliasFanoIndexBuilder.class.getName());

    /** Values per recorded high-bit position. */
    private static final int SELECT_SAMPLE_RATE = 512;

    private final long capacity;
    private final long upperBound;
    private final int lowBitsCount;
    private final long lowBitsMask;
    private final long highBitsSize;

    private final BitSequenceBuilder lowBits;
    private final SuccinctBitIndexBuilder highBits;
    // position in highBits of every SELECT_SAMPLE_RATE-th value
    private final LongArrayList selectSamples = new LongArrayList();
    private long count;
    private long lastValue;

    /**
     * @param size the maximum number of values that will be added
     * @param upperBound the largest value that will be added
     */
    public EliasFanoIndexBuilder(long size, long upperBound) {
        if (size < 0) {
            throw new IllegalArgumentException("Negative size " + size);
        }
        if (upperBound < 0) {
            throw new IllegalArgumentException("Negative upper bound " + upperBound);
        }
        this.capacity = size;
        this.upperBound = upperBound;
        this.lowBitsCount = size == 0 || upperBound / size == 0 ? 0 : MathUtil.floorLog2(upperBound / size);
        this.lowBitsMask = BitUtil.mask(lowBitsCount);
        // an empty index needs no bucket terminators, whatever the bound
        this.highBitsSize = size == 0 ? 0 : size + (upperBound >>> lowBitsCount) + 1;
        this.lowBits = new BitSequenceBuilder(size * lowBitsCount);
        this.highBits = new SuccinctBitIndexBuilder(highBitsSize);
    }

    /**
     * Appends {@code value}.
     *
     * @throws ConstructionException if {@code value} is smaller than the previous value (or negative),
     *     larger than the upper bound, or if the declared number of values has already been added.
     *     The builder is unchanged in that case.
     */
    public void add(long value) {
        if (value < lastValue) {
            throw new ConstructionException("Value " + value + " is smaller than the previous value " + lastValue);
        }
        if (value > upperBound) {
            throw new ConstructionException("Value " + value + " exceeds the upper bound " + upperBound);
        }
        if (count >= capacity) {
            throw new ConstructionException("Cannot add more than " + capacity + " values");
        }
        long highPosition = count + (value >>> lowBitsCount);
        lowBits.addBits(value & lowBitsMask, lowBitsCount);
        highBits.set(highPosition);
        if (count % SELECT_SAMPLE_RATE == 0) {
            selectSamples.addLong(highPosition);
        }
        lastValue = value;
        count++;
    }

    /**
     * @return the number of values added so far
     */
    public long size() {
        return count;
    }

    /**
     * @return the maximum number of values this builder accepts
     */
    public long capacity() {
        return capacity;
    }

    public long upperBound() {
        return upperBound;
    }

    /**
     * @return the last value added, or -1 if none has been
     */
    public long lastValue() {
        return count == 0 ? -1 : lastValue;
    }

    /**
     * @param i index of a value added so far, in [0, size())
     * @return the i-th value
     * @throws IndexOutOfBoundsException if i is outside [0, size())
     */
    public long get(long i) {
        if (i < 0 || i >= count) {
            throw new IndexOutOfBoundsException("Index " + i + " out of bounds for " + count + " values");
        }
        long low = lowBits.fetchBits(i * lowBitsCount, lowBitsCount);
        return ((highPosition(i) - i) << lowBitsCount) | low;
    }

    /**
     * @return the index of the first added value equal to {@code value}, or -1 if there is none
     */
    public long indexOf(long value) {
        long lo = 0;
        long hi = count;
        while (lo < hi) {
            long mid = (lo + hi) >>> 1;
            if (get(mid) < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo < count && get(lo) == value ? lo : -1;
    }

    public boolean contains(long value) {
        return indexOf(value) >= 0;
    }

    /**
     * Finds the set bit of value {@code i} by scanning forward from the nearest sample.
     */
    private long highPosition(long i) {
        long pos = selectSamples.getLong((int) (i / SELECT_SAMPLE_RATE));
        long remaining = i % SELECT_SAMPLE_RATE;
        long end = highBits.size();
        while (true) {
            int length = (int) Math.min(BitUtil.WORD_BITS, end - pos);
            long chunk = highBits.fetchBits(pos, length) << (BitUtil.WORD_BITS - length);
            int ones = BitUtil.popCount(chunk);
            if (remaining < ones) {
                return pos + BitUtil.select(chunk, (int) remaining);
            }
            remaining -= ones;
            pos += length;
        }
    }

    public void clear() {
        selectSamples.clear();
        lowBits.clear();
        highBits.clear();
        highBits.addUnsetBits(highBitsSize);
        count = 0;
        lastValue = 0;
    }

    /**
     * @return an index over the values added so far
     */
    public EliasFanoIndex build() {
        var index = new EliasFanoIndex(lowBitsCount, count, lowBits.build(), highBits.build());
        if (LOG.isLoggable(Level.FINE)) {
            LOG.log(Level.FINE, "Built Elias-Fano index of {0} values (capacity {1}, upper bound {2}) with {3} low bits, {4} bytes",
                    new Object[]{count, capacity, upperBound, lowBitsCount, index.ramBytesUsed()});
        }
        return index;
    }
}
