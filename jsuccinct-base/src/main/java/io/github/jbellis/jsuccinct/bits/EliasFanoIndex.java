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

import io.github.jbellis.jsuccinct.disk.IndexWriter;
import io.github.jbellis.jsuccinct.disk.RandomAccessReader;
import io.github.jbellis.jsuccinct.disk.ReaderSupplierFactory;
import io.github.jbellis.jsuccinct.util.Accountable;
import io.github.jbellis.jsuccinct.util.BitUtil;
import io.github.jbellis.jsuccinct.util.RamUsageEstimator;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An immutable Elias-Fano encoding of a non-decreasing sequence of non-negative longs.
 * <p>
 * Each value is split at {@link #lowBitsCount()} bits. The low parts are packed at fixed width in a
 * {@link BitSequence}. The high parts are written in unary into a {@link SuccinctBitIndex}: value
 * {@code i} sets bit {@code high + i}, so the unset bits act as bucket terminators and value {@code i}
 * can be recovered with one select. The whole sequence takes about {@code 2 + log2(upperBound / size)}
 * bits per value.
 * <p>
 * Build instances with {@link EliasFanoIndexBuilder}.
 */
public class EliasFanoIndex implements SerializableBits, Accountable {
    private static final long SHALLOW_SIZE = RamUsageEstimator.shallowSizeOf(2, 2, 1);

    private final int lowBitsCount;
    private final long lowBitsMask;
    private final long size;
    private final BitSequence lowBits;
    private final SuccinctBitIndex highBits;

    EliasFanoIndex(int lowBitsCount, long size, BitSequence lowBits, SuccinctBitIndex highBits) {
        this.lowBitsCount = lowBitsCount;
        this.lowBitsMask = BitUtil.mask(lowBitsCount);
        this.size = size;
        this.lowBits = lowBits;
        this.highBits = highBits;
    }

    /**
     * @return the number of values
     */
    public long size() {
        return size;
    }

    public int lowBitsCount() {
        return lowBitsCount;
    }

    public long lowBitsMask() {
        return lowBitsMask;
    }

    /**
     * @param i index of the value, in [0, size())
     * @return the i-th value
     * @throws IndexOutOfBoundsException if i is outside [0, size())
     */
    public long get(long i) {
        if (i < 0 || i >= size) {
            throw new IndexOutOfBoundsException("Index " + i + " out of bounds for " + size + " values");
        }
        long high = highBits.selectSetBits(i) - i;
        return (high << lowBitsCount) | lowPart(i);
    }

    /**
     * Tests membership by scanning the values that share the high part of {@code value}. This costs
     * time proportional to the size of that bucket, which is small for evenly spread values but is
     * not constant.
     */
    public boolean contains(long value) {
        return indexOf(value) >= 0;
    }

    /**
     * @return the index of the first occurrence of {@code value}, or -1 if it is absent
     */
    public long indexOf(long value) {
        if (size == 0 || value < 0) {
            return -1;
        }
        long high = value >>> lowBitsCount;
        // one unset bit terminates each bucket; past the last one there are no values
        if (high >= highBits.unsetBitsCount()) {
            return -1;
        }
        long low = value & lowBitsMask;
        long begin = high == 0 ? 0 : highBits.selectUnsetBits(high - 1) - (high - 1);
        long end = highBits.selectUnsetBits(high) - high;
        for (long i = begin; i < end; i++) {
            long candidate = lowPart(i);
            if (candidate == low) {
                return i;
            }
            if (candidate > low) {
                return -1;
            }
        }
        return -1;
    }

    private long lowPart(long i) {
        return lowBits.fetchBits(i * lowBitsCount, lowBitsCount);
    }

    @Override
    public long ramBytesUsed() {
        return SHALLOW_SIZE + lowBits.ramBytesUsed() + highBits.ramBytesUsed();
    }

    @Override
    public void write(IndexWriter out) throws IOException {
        out.writeInt(lowBitsCount);
        out.writeLong(lowBitsMask);
        out.writeLong(size);
        lowBits.write(out);
        highBits.write(out);
    }

    @Override
    public long serializedSize() {
        return Integer.BYTES + 2L * Long.BYTES + lowBits.serializedSize() + highBits.serializedSize();
    }

    public static EliasFanoIndex load(RandomAccessReader in) throws IOException {
        int lowBitsCount = in.readInt();
        if (lowBitsCount < 0 || lowBitsCount >= BitUtil.WORD_BITS) {
            throw new IOException("Invalid low bit count " + lowBitsCount);
        }
        long lowBitsMask = in.readLong();
        if (lowBitsMask != BitUtil.mask(lowBitsCount)) {
            throw new IOException("Low bit mask " + Long.toHexString(lowBitsMask) + " does not match " + lowBitsCount + " low bits");
        }
        long size = in.readLong();
        if (size < 0) {
            throw new IOException("Invalid value count " + size);
        }
        BitSequence lowBits = BitSequence.load(in);
        if (lowBits.size() != size * lowBitsCount) {
            throw new IOException("Expected " + size * lowBitsCount + " low bits but found " + lowBits.size());
        }
        SuccinctBitIndex highBits = SuccinctBitIndex.load(in);
        if (highBits.setBitsCount() != size) {
            throw new IOException("Expected " + size + " high bits set but found " + highBits.setBitsCount());
        }
        return new EliasFanoIndex(lowBitsCount, size, lowBits, highBits);
    }

    public static EliasFanoIndex load(Path path) throws IOException {
        try (var supplier = ReaderSupplierFactory.open(path); var reader = supplier.get()) {
            return load(reader);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EliasFanoIndex)) {
            return false;
        }
        EliasFanoIndex that = (EliasFanoIndex) o;
        return lowBitsCount == that.lowBitsCount
                && size == that.size
                && lowBits.equals(that.lowBits)
                && highBits.equals(that.highBits);
    }

    @Override
    public int hashCode() {
        int h = 31 * lowBitsCount + Long.hashCode(size);
        h = 31 * h + lowBits.hashCode();
        return 31 * h + highBits.hashCode();
    }

    @Override
    public String toString() {
        return "EliasFanoIndex(size=" + size + ", lowBitsCount=" + lowBitsCount + ")";
    }
}
