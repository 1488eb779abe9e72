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
 * Word-level bit twiddling shared by all bit structures.
 * <p>
 * Every structure in this library stores bits in {@code long} words, most significant bit first:
 * bit position {@code p} lives in word {@code p / WORD_BITS} at bit {@code WORD_BITS - 1 - p % WORD_BITS}.
 * The rank and select helpers here follow the same convention, counting from the most significant end.
 */
public final class BitUtil {
    /** Number of bits in a storage word. */
    public static final int WORD_BITS = Long.SIZE;

    /** log2 of {@link #WORD_BITS}, for turning bit positions into word indexes. */
    public static final int LOG2_WORD_BITS = 6;

    private static final long M1 = 0x5555555555555555L;
    private static final long M2 = 0x3333333333333333L;
    private static final long M4 = 0x0f0f0f0f0f0f0f0fL;
    private static final long M8 = 0x00ff00ff00ff00ffL;
    private static final long M16 = 0x0000ffff0000ffffL;
    private static final long M32 = 0x00000000ffffffffL;

    private BitUtil() {
    }

    /**
     * Byte-reversal table, computed on first use. The holder idiom gives lazy, one-time,
     * thread-safe initialization.
     */
    private static final class ReverseTable {
        static final byte[] TABLE = new byte[256];

        static {
            for (int i = 0; i < 256; i++) {
                int r = 0;
                for (int b = 0; b < Byte.SIZE; b++) {
                    if ((i & (1 << b)) != 0) {
                        r |= 1 << (Byte.SIZE - 1 - b);
                    }
                }
                TABLE[i] = (byte) r;
            }
        }
    }

    /**
     * Returns the number of set bits in {@code word}.
     */
    public static int popCount(long word) {
        return Long.bitCount(word);
    }

    /**
     * @return a mask with the {@code bits} least significant bits set, for {@code bits} in [0, 64]
     */
    public static long mask(int bits) {
        return bits == WORD_BITS ? -1L : (1L << bits) - 1;
    }

    /**
     * Returns {@code value} with its 8 bits in reverse order.
     */
    public static byte reverseByte(byte value) {
        return ReverseTable.TABLE[value & 0xff];
    }

    /**
     * Returns {@code word} with its bits in reverse order, composed from the byte-reversal table.
     */
    public static long reverseBits(long word) {
        byte[] table = ReverseTable.TABLE;
        long result = 0;
        for (int i = 0; i < Long.BYTES; i++) {
            result = (result << Byte.SIZE) | (table[(int) (word & 0xff)] & 0xffL);
            word >>>= Byte.SIZE;
        }
        return result;
    }

    /**
     * Counts the set bits among the {@code cutoff} most significant bits of {@code word}.
     *
     * @param cutoff number of leading bits to consider, in [0, 64]
     */
    public static int rank(long word, int cutoff) {
        return rank(word, cutoff, WORD_BITS);
    }

    /**
     * Counts the set bits among the {@code cutoff} most significant bits of a {@code blockSize}-bit
     * value stored in the low bits of {@code value}. Bits above {@code blockSize} must be zero.
     *
     * @param cutoff number of leading bits of the block to consider, in [0, blockSize]
     * @param blockSize width of the block, in [1, 64]
     */
    public static int rank(long value, int cutoff, int blockSize) {
        if (cutoff == 0) {
            return 0;
        }
        return Long.bitCount(value >>> (blockSize - cutoff));
    }

    /**
     * Returns the position, counted from the most significant bit, of the {@code k}-th (0-indexed)
     * set bit of {@code word}.
     * <p>
     * If {@code k} is not smaller than the number of set bits, the last bit position
     * ({@code WORD_BITS - 1}) is returned rather than failing. Callers must validate {@code k}
     * against a known count first.
     */
    public static int select(long word, int k) {
        return selectFromLsb(reverseBits(word), k);
    }

    /**
     * Returns the position, counted from the least significant bit, of the {@code k}-th (0-indexed)
     * set bit of {@code word}. Same out-of-range behavior as {@link #select(long, int)}.
     * <p>
     * Counts set bits in parallel at granularities 2, 4, 8, 16, 32 and 64, then descends the
     * partial sums to the target bit.
     */
    public static int selectFromLsb(long word, int k) {
        long pop2 = ((word >>> 1) & M1) + (word & M1);
        long pop4 = ((pop2 >>> 2) & M2) + (pop2 & M2);
        long pop8 = ((pop4 >>> 4) & M4) + (pop4 & M4);
        long pop16 = ((pop8 >>> 8) & M8) + (pop8 & M8);
        long pop32 = ((pop16 >>> 16) & M16) + (pop16 & M16);
        long pop64 = ((pop32 >>> 32) & M32) + (pop32 & M32);

        if (k >= pop64) {
            return WORD_BITS - 1;
        }

        // 1-based rank of the wanted bit
        long remaining = k + 1L;
        int pos = 0;
        long count;

        count = pop32 & 0xffffffffL;
        if (remaining > count) { remaining -= count; pos += 32; }
        count = (pop16 >>> pos) & 0xffffL;
        if (remaining > count) { remaining -= count; pos += 16; }
        count = (pop8 >>> pos) & 0xffL;
        if (remaining > count) { remaining -= count; pos += 8; }
        count = (pop4 >>> pos) & 0xfL;
        if (remaining > count) { remaining -= count; pos += 4; }
        count = (pop2 >>> pos) & 0x3L;
        if (remaining > count) { remaining -= count; pos += 2; }
        count = (word >>> pos) & 0x1L;
        if (remaining > count) { pos += 1; }
        return pos;
    }

    /**
     * @return the number of words needed to hold {@code bits} bits
     */
    public static int wordsFor(long bits) {
        return Math.toIntExact((bits + WORD_BITS - 1) >>> LOG2_WORD_BITS);
    }
}
