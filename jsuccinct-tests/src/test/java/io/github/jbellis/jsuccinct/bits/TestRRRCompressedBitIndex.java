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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import io.github.jbellis.jsuccinct.TestUtil;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestRRRCompressedBitIndex extends RandomizedTest {
    @Test
    public void testBitsAcrossBlockBoundary() {
        var builder = new RRRCompressedBitIndexBuilder();
        builder.set(0);
        builder.set(64);
        var compressed = builder.build();
        var plain = builder.buildSuccinctBits();
        assertEquals(65, compressed.size());
        assertTrue(compressed.getBit(0));
        assertTrue(compressed.getBit(64));
        for (int i = 0; i < 65; i++) {
            assertEquals(plain.getBit(i), compressed.getBit(i));
            if (i != 0 && i != 64) {
                assertFalse(compressed.getBit(i));
            }
        }
        assertEquals(64, compressed.selectSetBits(1));
        assertEquals(1, compressed.rankSetBits(64));
        assertEquals(2, compressed.rankSetBits(65));
    }

    @Test
    public void testMatchesPlainIndex() {
        for (double density : new double[]{0.0, 0.001, 0.1, 0.5, 0.9, 0.999, 1.0}) {
            boolean[] expected = TestUtil.randomBits(getRandom(), 10_000, density);
            var bits = TestUtil.toSequence(expected);
            var compressed = RRRCompressedBitIndexBuilder.compress(bits);
            var plain = SuccinctBitIndexBuilder.index(bits);
            TestUtil.assertMatches(expected, compressed);
            for (long cutoff = 0; cutoff <= bits.size(); cutoff++) {
                assertEquals(plain.rankSetBits(cutoff), compressed.rankSetBits(cutoff));
                assertEquals(plain.rankUnsetBits(cutoff), compressed.rankUnsetBits(cutoff));
            }
            for (long k = 0; k < plain.setBitsCount(); k++) {
                assertEquals(plain.selectSetBits(k), compressed.selectSetBits(k));
            }
            for (long k = 0; k < plain.unsetBitsCount(); k++) {
                assertEquals(plain.selectUnsetBits(k), compressed.selectUnsetBits(k));
            }
        }
    }

    @Test
    public void testUniformSuperBlocks() {
        // runs longer than a super-block exercise the sample-only shortcuts
        boolean[] expected = TestUtil.randomRuns(getRandom(), 30_000, 6000);
        TestUtil.assertMatches(expected, RRRCompressedBitIndexBuilder.compress(TestUtil.toSequence(expected)));
    }

    @Test
    public void testPartialTrailingBlocks() {
        for (int size : new int[]{1, 2, 62, 63, 64, 125, 126, 127, 2015, 2016, 2017, 4033}) {
            for (double density : new double[]{0.0, 0.5, 1.0}) {
                boolean[] expected = TestUtil.randomBits(getRandom(), size, density);
                var bits = TestUtil.toSequence(expected);
                var compressed = RRRCompressedBitIndexBuilder.compress(bits);
                TestUtil.assertMatches(expected, compressed);
                assertEquals(bits, compressed.decompress());
            }
        }
    }

    @Test
    public void testEmpty() {
        var compressed = new RRRCompressedBitIndexBuilder().build();
        assertEquals(0, compressed.size());
        assertEquals(0, compressed.rankSetBits(0));
        assertEquals(0, compressed.decompress().size());
        TestUtil.assertSelectOutOfBounds(compressed);
    }

    @Test
    public void testEncodeDecode() {
        assertEquals(0, RRRCompressedBitIndex.encode(0, 0));
        assertEquals(0, RRRCompressedBitIndex.encode(Long.MAX_VALUE, 63));
        assertEquals(Long.MAX_VALUE, RRRCompressedBitIndex.decode(0, 63));
        // the lowest pattern of a class is its set bits packed at the end
        assertEquals(0, RRRCompressedBitIndex.encode(0b111, 3));
        assertEquals(BinomialTable.classCount(63, 1) - 1, RRRCompressedBitIndex.encode(1L << 62, 1));

        for (int i = 0; i < 10_000; i++) {
            long block = getRandom().nextLong() >>> 1;
            if (randomBoolean()) {
                block &= getRandom().nextLong();
            }
            int blockClass = Long.bitCount(block);
            long offset = RRRCompressedBitIndex.encode(block, blockClass);
            assertTrue(offset < BinomialTable.classCount(63, blockClass));
            assertEquals(0, offset >>> BinomialTable.classBitOffset(blockClass));
            assertEquals(block, RRRCompressedBitIndex.decode(offset, blockClass));
        }
    }

    @Test
    public void testBinomialTable() {
        assertEquals(1, BinomialTable.classCount(0, 0));
        assertEquals(0, BinomialTable.classCount(3, 4));
        assertEquals(63, BinomialTable.classCount(63, 1));
        assertEquals(1953, BinomialTable.classCount(63, 2));
        assertEquals(916312070471295267L, BinomialTable.classCount(63, 31));
        assertEquals(0, BinomialTable.classBitOffset(0));
        assertEquals(0, BinomialTable.classBitOffset(63));
        assertEquals(6, BinomialTable.classBitOffset(1));
        assertEquals(60, BinomialTable.classBitOffset(31));
    }

    @Test
    public void testSparseInputCompresses() {
        var builder = new RRRCompressedBitIndexBuilder();
        builder.addUnsetBits(100_000);
        for (int i = 0; i < 100; i++) {
            builder.set(getRandom().nextInt(100_000));
        }
        var compressed = builder.build();
        var plain = builder.buildSuccinctBits();
        assertTrue(compressed.ramBytesUsed() < plain.ramBytesUsed());
        assertEquals(plain.setBitsCount(), compressed.setBitsCount());
        for (long k = 0; k < plain.setBitsCount(); k++) {
            assertEquals(plain.selectSetBits(k), compressed.selectSetBits(k));
        }
    }

    @Test
    public void testSelectPastEndThrows() {
        var builder = new RRRCompressedBitIndexBuilder();
        builder.addBits(0b1010, 4);
        var compressed = builder.build();
        assertEquals(2, compressed.selectSetBits(1));
        assertThrows(IndexOutOfBoundsException.class, () -> compressed.selectSetBits(2));
        assertEquals(3, compressed.selectUnsetBits(1));
        assertThrows(IndexOutOfBoundsException.class, () -> compressed.selectUnsetBits(2));
    }
}
