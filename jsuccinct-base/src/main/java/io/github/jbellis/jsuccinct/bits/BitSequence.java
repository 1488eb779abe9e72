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
 * An immutable, packed sequence of bits.
 * <p>
 * Bits are stored in {@code long} words, most significant bit first: position 0 is the top bit of
 * word 0. Bits of the trailing word at positions {@code >= size()} are always zero.
 * <p>
 * Build instances with {@link BitSequenceBuilder}.
 */
public class BitSequence implements Bits, SerializableBits, Accountable {
    private static final long SHALLOW_SIZE = RamUsageEstimator.shallowSizeOf(1, 1, 0);

    private final long size;
    // exactly BitUtil.wordsFor(size) words
    final long[] words;

    BitSequence(long size, long[] words) {
        assert words.length == BitUtil.wordsFor(size) : words.length + " words for " + size + " bits";
        this.size = size;
        this.words = words;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public boolean getBit(long pos) {
        checkPosition(pos, size);
        return getBit(words, pos);
    }

    static boolean getBit(long[] words, long pos) {
        return ((words[(int) (pos >>> BitUtil.LOG2_WORD_BITS)] >>> (BitUtil.WORD_BITS - 1 - (pos & (BitUtil.WORD_BITS - 1)))) & 1L) != 0;
    }

    /**
     * Returns {@code count} bits starting at {@code pos}, right-aligned: the bit at {@code pos} ends up
     * in position {@code count - 1} of the result. Positions past the stored words read as zero.
     *
     * @param pos first position to fetch, non-negative
     * @param count number of bits, in [0, 64]
     */
    public long fetchBits(long pos, int count) {
        checkFetch(pos, count);
        return fetch(words, pos, count);
    }

    /**
     * Fetches up to one word of bits from a packed word array, reading zeros past its end.
     */
    static long fetch(long[] words, long pos, int count) {
        long wordIndex = pos >>> BitUtil.LOG2_WORD_BITS;
        if (wordIndex >= words.length) {
            return 0;
        }
        long right = wordIndex + 1 < words.length ? words[(int) wordIndex + 1] : 0;
        return extract(words[(int) wordIndex], right, (int) (pos & (BitUtil.WORD_BITS - 1)), count);
    }

    /**
     * Extracts {@code count} bits starting {@code offset} bits into {@code left}, continuing into {@code right}
     * when the run crosses the word boundary. The left part is shifted over the right one.
     */
    static long extract(long left, long right, int offset, int count) {
        if (offset + count <= BitUtil.WORD_BITS) {
            return (left >>> (BitUtil.WORD_BITS - offset - count)) & BitUtil.mask(count);
        }
        int rightCount = offset + count - BitUtil.WORD_BITS;
        return ((left & BitUtil.mask(BitUtil.WORD_BITS - offset)) << rightCount) | (right >>> (BitUtil.WORD_BITS - rightCount));
    }

    /**
     * @return the number of backing words
     */
    public int wordCount() {
        return words.length;
    }

    /**
     * @return backing word {@code i}, bits past {@link #size()} being zero
     */
    public long word(int i) {
        if (i < 0 || i >= words.length) {
            throw new IndexOutOfBoundsException("Word " + i + " out of bounds for " + words.length + " words");
        }
        return words[i];
    }

    /**
     * @return the number of set bits, computed on each call
     */
    public long popCount() {
        long count = 0;
        for (long word : words) {
            count += BitUtil.popCount(word);
        }
        return count;
    }

    @Override
    public long ramBytesUsed() {
        return SHALLOW_SIZE + RamUsageEstimator.sizeOf(words);
    }

    @Override
    public void write(IndexWriter out) throws IOException {
        out.writeLong(size);
        out.writeInt(words.length);
        out.writeLongs(words, words.length);
    }

    @Override
    public long serializedSize() {
        return Long.BYTES + Integer.BYTES + (long) Long.BYTES * words.length;
    }

    public static BitSequence load(RandomAccessReader in) throws IOException {
        long size = in.readLong();
        long[] words = readWords(in, size);
        return new BitSequence(size, words);
    }

    public static BitSequence load(Path path) throws IOException {
        try (var supplier = ReaderSupplierFactory.open(path); var reader = supplier.get()) {
            return load(reader);
        }
    }

    /**
     * Reads a word count followed by that many words, checking the count against {@code size}.
     * Stray bits past {@code size} in the trailing word are cleared.
     */
    static long[] readWords(RandomAccessReader in, long size) throws IOException {
        if (size < 0 || size > (long) Integer.MAX_VALUE * BitUtil.WORD_BITS) {
            throw new IOException("Invalid bit count " + size);
        }
        int wordCount = in.readInt();
        if (wordCount != BitUtil.wordsFor(size)) {
            throw new IOException("Expected " + BitUtil.wordsFor(size) + " words for " + size + " bits but found " + wordCount);
        }
        long[] words = new long[wordCount];
        in.readFully(words);
        clearTrailingBits(words, size);
        return words;
    }

    static void clearTrailingBits(long[] words, long size) {
        int used = (int) (size & (BitUtil.WORD_BITS - 1));
        if (used != 0) {
            words[words.length - 1] &= ~BitUtil.mask(BitUtil.WORD_BITS - used);
        }
    }

    static void checkPosition(long pos, long size) {
        if (pos < 0 || pos >= size) {
            throw new IndexOutOfBoundsException("Position " + pos + " out of bounds for size " + size);
        }
    }

    static void checkCutoff(long cutoff, long size) {
        if (cutoff < 0 || cutoff > size) {
            throw new IndexOutOfBoundsException("Cutoff " + cutoff + " out of bounds for size " + size);
        }
    }

    static void checkFetch(long pos, int count) {
        if (count < 0 || count > BitUtil.WORD_BITS) {
            throw new IllegalArgumentException("Cannot fetch " + count + " bits; count must be in [0, 64]");
        }
        if (pos < 0) {
            throw new IndexOutOfBoundsException("Negative position " + pos);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BitSequence)) {
            return false;
        }
        BitSequence that = (BitSequence) o;
        if (size != that.size) {
            return false;
        }
        for (int i = 0; i < words.length; i++) {
            if (maskedWord(i) != that.maskedWord(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = Long.hashCode(size);
        for (int i = 0; i < words.length; i++) {
            h = 31 * h + Long.hashCode(maskedWord(i));
        }
        return h;
    }

    private long maskedWord(int i) {
        long used = size - (long) i * BitUtil.WORD_BITS;
        return used >= BitUtil.WORD_BITS ? words[i] : words[i] & ~BitUtil.mask(BitUtil.WORD_BITS - (int) used);
    }

    @Override
    public String toString() {
        return "BitSequence(size=" + size + ", words=" + words.length + ")";
    }
}
