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
import io.github.jbellis.jsuccinct.util.MathUtil;
import io.github.jbellis.jsuccinct.util.RamUsageEstimator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * An immutable bit sequence with a two-level index for constant-time rank and near-constant-time select.
 * <p>
 * Words are grouped into large blocks of {@link #BLOCK_RATE} words ({@link #LARGE_BLOCK_SIZE} bits).
 * For each large block we keep the number of set bits before it. Rank looks up the sample of the
 * large block, popcounts at most {@code BLOCK_RATE - 1} whole words and ranks inside the last word.
 * Select binary-searches the samples, then scans at most {@code BLOCK_RATE} words.
 * Unset-bit samples are not stored: the number of unset bits before large block {@code i} is
 * {@code i * LARGE_BLOCK_SIZE - ranks[i]}.
 */
public class SuccinctBitIndex implements RankSelectBits, SerializableBits, Accountable {
    /** Words per large block. */
    public static final int BLOCK_RATE = 8;

    /** Bits per large block. */
    public static final int LARGE_BLOCK_SIZE = BLOCK_RATE * BitUtil.WORD_BITS;

    private static final int LOG2_LARGE_BLOCK_SIZE = 9;
    private static final long MAX_SERIALIZED_SIZE = 0xFFFFFFFFL;
    private static final long SHALLOW_SIZE = RamUsageEstimator.shallowSizeOf(2, 2, 0);

    private final long size;
    private final long setBitsCount;
    private final long[] words;
    private final long[] ranks;

    /**
     * Indexes {@code words}, which must hold exactly {@code BitUtil.wordsFor(size)} words with
     * zeros past {@code size}. The array is not copied.
     */
    SuccinctBitIndex(long size, long[] words) {
        assert words.length == BitUtil.wordsFor(size);
        this.size = size;
        this.words = words;
        this.ranks = new long[(int) MathUtil.divideRoundUp(words.length, BLOCK_RATE)];
        long count = 0;
        for (int i = 0; i < words.length; i++) {
            if (i % BLOCK_RATE == 0) {
                ranks[i / BLOCK_RATE] = count;
            }
            count += BitUtil.popCount(words[i]);
        }
        this.setBitsCount = count;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public long setBitsCount() {
        return setBitsCount;
    }

    @Override
    public long unsetBitsCount() {
        return size - setBitsCount;
    }

    @Override
    public boolean getBit(long pos) {
        BitSequence.checkPosition(pos, size);
        return BitSequence.getBit(words, pos);
    }

    @Override
    public long rankSetBits(long cutoff) {
        BitSequence.checkCutoff(cutoff, size);
        if (cutoff == 0) {
            return 0;
        }
        long last = cutoff - 1;
        int largeBlock = (int) (last >>> LOG2_LARGE_BLOCK_SIZE);
        int word = (int) (last >>> BitUtil.LOG2_WORD_BITS);
        long rank = ranks[largeBlock];
        for (int i = largeBlock * BLOCK_RATE; i < word; i++) {
            rank += BitUtil.popCount(words[i]);
        }
        return rank + BitUtil.rank(words[word], (int) (last & (BitUtil.WORD_BITS - 1)) + 1);
    }

    @Override
    public long rankUnsetBits(long cutoff) {
        BitSequence.checkCutoff(cutoff, size);
        if (cutoff == 0) {
            return 0;
        }
        long last = cutoff - 1;
        int largeBlock = (int) (last >>> LOG2_LARGE_BLOCK_SIZE);
        int word = (int) (last >>> BitUtil.LOG2_WORD_BITS);
        long rank = unsetSample(largeBlock);
        for (int i = largeBlock * BLOCK_RATE; i < word; i++) {
            rank += BitUtil.popCount(~words[i]);
        }
        return rank + BitUtil.rank(~words[word], (int) (last & (BitUtil.WORD_BITS - 1)) + 1);
    }

    @Override
    public long selectSetBits(long k) {
        if (k < 0 || k >= setBitsCount) {
            throw new IndexOutOfBoundsException("Set bit " + k + " out of bounds for " + setBitsCount + " set bits");
        }
        // last large block whose sample does not exceed k
        int lo = 0;
        int hi = ranks.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (ranks[mid] <= k) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        long remaining = k - ranks[lo];
        int i = lo * BLOCK_RATE;
        while (true) {
            int count = BitUtil.popCount(words[i]);
            if (remaining < count) {
                break;
            }
            remaining -= count;
            i++;
        }
        return ((long) i << BitUtil.LOG2_WORD_BITS) + BitUtil.select(words[i], (int) remaining);
    }

    @Override
    public long selectUnsetBits(long k) {
        long unsetBitsCount = unsetBitsCount();
        if (k < 0 || k >= unsetBitsCount) {
            throw new IndexOutOfBoundsException("Unset bit " + k + " out of bounds for " + unsetBitsCount + " unset bits");
        }
        int lo = 0;
        int hi = ranks.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (unsetSample(mid) <= k) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        // padding past size counts as unset here, but only after every real position
        long remaining = k - unsetSample(lo);
        int i = lo * BLOCK_RATE;
        while (true) {
            int count = BitUtil.popCount(~words[i]);
            if (remaining < count) {
                break;
            }
            remaining -= count;
            i++;
        }
        return ((long) i << BitUtil.LOG2_WORD_BITS) + BitUtil.select(~words[i], (int) remaining);
    }

    private long unsetSample(int largeBlock) {
        return ((long) largeBlock << LOG2_LARGE_BLOCK_SIZE) - ranks[largeBlock];
    }

    /**
     * @return the indexed bits as a plain sequence, sharing storage with this index
     */
    public BitSequence toBitSequence() {
        return new BitSequence(size, words);
    }

    @Override
    public long ramBytesUsed() {
        return SHALLOW_SIZE + RamUsageEstimator.sizeOf(words) + RamUsageEstimator.sizeOf(ranks);
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if the size does not fit the unsigned 32-bit header
     */
    @Override
    public void write(IndexWriter out) throws IOException {
        if (size > MAX_SERIALIZED_SIZE) {
            throw new IllegalStateException("Cannot serialize " + size + " bits; the format is limited to " + MAX_SERIALIZED_SIZE);
        }
        out.writeInt((int) size);
        out.writeInt((int) setBitsCount);
        out.writeInt(words.length);
        out.writeLongs(words, words.length);
        out.writeInt(ranks.length);
        out.writeLongs(ranks, ranks.length);
    }

    @Override
    public long serializedSize() {
        return 4L * Integer.BYTES + (long) Long.BYTES * (words.length + ranks.length);
    }

    public static SuccinctBitIndex load(RandomAccessReader in) throws IOException {
        long size = Integer.toUnsignedLong(in.readInt());
        long setBitsCount = Integer.toUnsignedLong(in.readInt());
        if (setBitsCount > size) {
            throw new IOException("Set bit count " + setBitsCount + " exceeds size " + size);
        }
        long[] words = BitSequence.readWords(in, size);
        int rankCount = in.readInt();
        if (rankCount != MathUtil.divideRoundUp(words.length, BLOCK_RATE)) {
            throw new IOException("Invalid rank sample count " + rankCount + " for " + words.length + " words");
        }
        long[] ranks = new long[rankCount];
        in.readFully(ranks);
        // count and samples must agree with the words
        SuccinctBitIndex index = new SuccinctBitIndex(size, words);
        if (index.setBitsCount != setBitsCount) {
            throw new IOException("Header claims " + setBitsCount + " set bits but the words hold " + index.setBitsCount);
        }
        if (!Arrays.equals(index.ranks, ranks)) {
            throw new IOException("Rank samples do not match the words");
        }
        return index;
    }

    public static SuccinctBitIndex load(Path path) throws IOException {
        try (var supplier = ReaderSupplierFactory.open(path); var reader = supplier.get()) {
            return load(reader);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SuccinctBitIndex)) {
            return false;
        }
        SuccinctBitIndex that = (SuccinctBitIndex) o;
        return setBitsCount == that.setBitsCount && toBitSequence().equals(that.toBitSequence());
    }

    @Override
    public int hashCode() {
        return toBitSequence().hashCode();
    }

    @Override
    public String toString() {
        return "SuccinctBitIndex(size=" + size + ", setBits=" + setBitsCount + ")";
    }
}
