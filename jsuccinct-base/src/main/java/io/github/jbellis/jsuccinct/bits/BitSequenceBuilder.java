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
import org.agrona.collections.LongArrayList;

/**
 * Accumulates bits for a {@link BitSequence}. Positions may be set or unset in any order; the
 * sequence grows to cover the highest position touched. Appends go to the current end.
 * <p>
 * Not thread-safe.
 */
public class BitSequenceBuilder implements BitsBuilder {
    private static final int MIN_INITIAL_WORDS = 16;

    private final LongArrayList words;
    private long size;

    public BitSequenceBuilder() {
        this(0);
    }

    /**
     * @param capacityBits number of bits to reserve storage for; the builder starts empty regardless
     */
    public BitSequenceBuilder(long capacityBits) {
        if (capacityBits < 0) {
            throw new IllegalArgumentException("Negative capacity " + capacityBits);
        }
        words = new LongArrayList(Math.max(MIN_INITIAL_WORDS, BitUtil.wordsFor(capacityBits)), 0L);
    }

    /**
     * Creates a builder holding a copy of {@code source}, ready to be extended.
     */
    public BitSequenceBuilder(BitSequence source) {
        this(source.size());
        for (long word : source.words) {
            words.addLong(word);
        }
        size = source.size();
    }

    @Override
    public long size() {
        return size;
    }

    /**
     * Sets the bit at {@code pos}, growing the sequence to {@code pos + 1} bits if needed.
     */
    public void set(long pos) {
        checkNonNegative(pos);
        ensureSize(pos + 1);
        int index = (int) (pos >>> BitUtil.LOG2_WORD_BITS);
        words.setLong(index, words.getLong(index) | bitMask(pos));
    }

    /**
     * Unsets the bit at {@code pos}, growing the sequence to {@code pos + 1} bits if needed.
     */
    public void unset(long pos) {
        checkNonNegative(pos);
        ensureSize(pos + 1);
        int index = (int) (pos >>> BitUtil.LOG2_WORD_BITS);
        words.setLong(index, words.getLong(index) & ~bitMask(pos));
    }

    public void add(boolean bit) {
        long pos = size;
        ensureSize(pos + 1);
        if (bit) {
            int index = (int) (pos >>> BitUtil.LOG2_WORD_BITS);
            words.setLong(index, words.getLong(index) | bitMask(pos));
        }
    }

    /**
     * Appends the {@code count} low bits of {@code bits}, most significant first. Bits of {@code bits}
     * above {@code count} are ignored.
     *
     * @param count number of bits to append, in [0, 64]
     * @throws ConstructionException if count is outside [0, 64]
     */
    public void addBits(long bits, int count) {
        if (count < 0 || count > BitUtil.WORD_BITS) {
            throw new ConstructionException("Cannot append " + count + " bits; count must be in [0, 64]");
        }
        if (count == 0) {
            return;
        }
        bits &= BitUtil.mask(count);
        long pos = size;
        ensureSize(pos + count);
        int index = (int) (pos >>> BitUtil.LOG2_WORD_BITS);
        int offset = (int) (pos & (BitUtil.WORD_BITS - 1));
        if (offset + count <= BitUtil.WORD_BITS) {
            words.setLong(index, words.getLong(index) | (bits << (BitUtil.WORD_BITS - offset - count)));
        } else {
            int rightCount = offset + count - BitUtil.WORD_BITS;
            words.setLong(index, words.getLong(index) | (bits >>> rightCount));
            words.setLong(index + 1, words.getLong(index + 1) | (bits << (BitUtil.WORD_BITS - rightCount)));
        }
    }

    /**
     * Appends {@code count} set bits.
     */
    public void addSetBits(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Negative bit count " + count);
        }
        while (count > 0) {
            int chunk = (int) Math.min(count, BitUtil.WORD_BITS);
            addBits(-1L, chunk);
            count -= chunk;
        }
    }

    /**
     * Appends {@code count} unset bits.
     */
    public void addUnsetBits(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Negative bit count " + count);
        }
        ensureSize(size + count);
    }

    /**
     * Appends every byte of {@code bytes}, each most significant bit first.
     */
    public void addBytes(byte[] bytes) {
        for (byte b : bytes) {
            addBits(b & 0xffL, Byte.SIZE);
        }
    }

    public boolean getBit(long pos) {
        BitSequence.checkPosition(pos, size);
        int index = (int) (pos >>> BitUtil.LOG2_WORD_BITS);
        return (words.getLong(index) & bitMask(pos)) != 0;
    }

    /**
     * Same as {@link BitSequence#fetchBits(long, int)}, over the bits accumulated so far.
     */
    public long fetchBits(long pos, int count) {
        BitSequence.checkFetch(pos, count);
        long wordIndex = pos >>> BitUtil.LOG2_WORD_BITS;
        if (wordIndex >= words.size()) {
            return 0;
        }
        long right = wordIndex + 1 < words.size() ? words.getLong((int) wordIndex + 1) : 0;
        return BitSequence.extract(words.getLong((int) wordIndex), right, (int) (pos & (BitUtil.WORD_BITS - 1)), count);
    }

    @Override
    public void clear() {
        words.clear();
        size = 0;
    }

    public BitSequence build() {
        return new BitSequence(size, words.toLongArray());
    }

    @Override
    public BitSequence buildBits() {
        return build();
    }

    @Override
    public SuccinctBitIndex buildSuccinctBits() {
        return SuccinctBitIndexBuilder.index(build());
    }

    @Override
    public RRRCompressedBitIndex buildCompressedBits() {
        return RRRCompressedBitIndexBuilder.compress(build());
    }

    // bits past size are zero, so growing only has to append zero words
    private void ensureSize(long newSize) {
        if (newSize <= size) {
            return;
        }
        int needed = BitUtil.wordsFor(newSize);
        while (words.size() < needed) {
            words.addLong(0L);
        }
        size = newSize;
    }

    private static long bitMask(long pos) {
        return 1L << (BitUtil.WORD_BITS - 1 - (pos & (BitUtil.WORD_BITS - 1)));
    }

    private static void checkNonNegative(long pos) {
        if (pos < 0) {
            throw new IndexOutOfBoundsException("Negative position " + pos);
        }
    }
}
