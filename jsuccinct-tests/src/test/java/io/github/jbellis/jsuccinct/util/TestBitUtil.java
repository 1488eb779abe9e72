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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

public class TestBitUtil extends RandomizedTest {
    @Test
    public void testReverseBits() {
        assertEquals(Long.MIN_VALUE, BitUtil.reverseBits(1L));
        assertEquals(0L, BitUtil.reverseBits(0L));
        assertEquals(-1L, BitUtil.reverseBits(-1L));
        assertEquals((byte) 0x80, BitUtil.reverseByte((byte) 0x01));
        assertEquals((byte) 0x0f, BitUtil.reverseByte((byte) 0xf0));
        for (int i = 0; i < 1000; i++) {
            long word = getRandom().nextLong();
            assertEquals(Long.reverse(word), BitUtil.reverseBits(word));
        }
    }

    @Test
    public void testRankCountsFromMostSignificantBit() {
        long word = 0b1011L << 60;
        assertEquals(0, BitUtil.rank(word, 0));
        assertEquals(1, BitUtil.rank(word, 1));
        assertEquals(1, BitUtil.rank(word, 2));
        assertEquals(3, BitUtil.rank(word, 4));
        assertEquals(3, BitUtil.rank(word, 64));
        assertEquals(64, BitUtil.rank(-1L, 64));

        // 63-bit block with its first position in bit 62
        long block = 1L << 62 | 1L;
        assertEquals(1, BitUtil.rank(block, 1, 63));
        assertEquals(1, BitUtil.rank(block, 62, 63));
        assertEquals(2, BitUtil.rank(block, 63, 63));
    }

    @Test
    public void testSelectMatchesLinearScan() {
        for (int i = 0; i < 1000; i++) {
            long word = getRandom().nextLong();
            int k = 0;
            for (int pos = 0; pos < 64; pos++) {
                if ((word & (1L << (63 - pos))) != 0) {
                    assertEquals(pos, BitUtil.select(word, k));
                    assertEquals(k, BitUtil.rank(word, pos));
                    k++;
                }
            }
            k = 0;
            for (int pos = 0; pos < 64; pos++) {
                if ((word & (1L << pos)) != 0) {
                    assertEquals(pos, BitUtil.selectFromLsb(word, k++));
                }
            }
        }
    }

    @Test
    public void testSelectPastPopCountReturnsLastPosition() {
        assertEquals(63, BitUtil.select(0L, 0));
        assertEquals(63, BitUtil.select(Long.MIN_VALUE, 1));
        assertEquals(0, BitUtil.select(Long.MIN_VALUE, 0));
        assertEquals(63, BitUtil.select(-1L, 63));
    }

    @Test
    public void testMaskAndWords() {
        assertEquals(0L, BitUtil.mask(0));
        assertEquals(1L, BitUtil.mask(1));
        assertEquals(Long.MAX_VALUE, BitUtil.mask(63));
        assertEquals(-1L, BitUtil.mask(64));
        assertEquals(0, BitUtil.wordsFor(0));
        assertEquals(1, BitUtil.wordsFor(1));
        assertEquals(1, BitUtil.wordsFor(64));
        assertEquals(2, BitUtil.wordsFor(65));
    }

    @Test
    public void testMathUtil() {
        assertEquals(0, MathUtil.floorLog2(1));
        assertEquals(6, MathUtil.floorLog2(100));
        assertEquals(62, MathUtil.floorLog2(Long.MAX_VALUE));
        assertThrows(IllegalArgumentException.class, () -> MathUtil.floorLog2(0));

        assertEquals(0, MathUtil.bitsToEnumerate(1));
        assertEquals(1, MathUtil.bitsToEnumerate(2));
        assertEquals(2, MathUtil.bitsToEnumerate(3));
        assertEquals(2, MathUtil.bitsToEnumerate(4));
        assertEquals(3, MathUtil.bitsToEnumerate(5));

        assertEquals(0, MathUtil.divideRoundUp(0, 63));
        assertEquals(1, MathUtil.divideRoundUp(63, 63));
        assertEquals(2, MathUtil.divideRoundUp(64, 63));
    }
}
