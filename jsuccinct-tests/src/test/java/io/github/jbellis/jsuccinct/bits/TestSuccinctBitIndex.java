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
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestSuccinctBitIndex extends RandomizedTest {
    @Test
    public void testRandomDensities() {
        for (double density : new double[]{0.0, 0.01, 0.5, 0.99, 1.0}) {
            boolean[] expected = TestUtil.randomBits(getRandom(), randomIntBetween(0, 5000), density);
            TestUtil.assertMatches(expected, SuccinctBitIndexBuilder.index(TestUtil.toSequence(expected)));
        }
    }

    @Test
    public void testLargeBlockBoundaries() {
        // sizes around multiples of the 512-bit sample interval
        for (int size : new int[]{1, 63, 64, 65, 511, 512, 513, 1024, 1025}) {
            boolean[] expected = TestUtil.randomBits(getRandom(), size, 0.3);
            TestUtil.assertMatches(expected, SuccinctBitIndexBuilder.index(TestUtil.toSequence(expected)));
        }
    }

    @Test
    public void testRuns() {
        boolean[] expected = TestUtil.randomRuns(getRandom(), 20_000, 2000);
        TestUtil.assertMatches(expected, SuccinctBitIndexBuilder.index(TestUtil.toSequence(expected)));
    }

    @Test
    public void testRankOfSelect() {
        boolean[] expected = TestUtil.randomBits(getRandom(), 10_000, 0.2);
        var index = SuccinctBitIndexBuilder.index(TestUtil.toSequence(expected));
        for (long k = 0; k < index.setBitsCount(); k++) {
            assertEquals(k, index.rankSetBits(index.selectSetBits(k)));
            assertTrue(index.getBit(index.selectSetBits(k)));
        }
        for (long k = 0; k < index.unsetBitsCount(); k++) {
            assertEquals(k, index.rankUnsetBits(index.selectUnsetBits(k)));
        }
    }

    @Test
    public void testEmpty() {
        var index = new SuccinctBitIndexBuilder().build();
        assertEquals(0, index.size());
        assertEquals(0, index.rankSetBits(0));
        assertEquals(0, index.rankUnsetBits(0));
        TestUtil.assertSelectOutOfBounds(index);
    }

    @Test
    public void testPresizedBuilder() {
        var builder = new SuccinctBitIndexBuilder(1000);
        assertEquals(1000, builder.size());
        builder.set(10);
        builder.set(999);
        var index = builder.build();
        assertEquals(1000, index.size());
        assertEquals(2, index.setBitsCount());
        assertEquals(1, index.rankSetBits(999));
        assertEquals(999, index.selectSetBits(1));
        assertEquals(11, index.selectUnsetBits(10));
        assertThrows(IndexOutOfBoundsException.class, () -> index.selectSetBits(2));
    }

    @Test
    public void testToBitSequence() {
        boolean[] expected = TestUtil.randomBits(getRandom(), randomIntBetween(0, 2000), 0.5);
        var bits = TestUtil.toSequence(expected);
        var index = SuccinctBitIndexBuilder.index(bits);
        assertEquals(bits, index.toBitSequence());
        assertEquals(index, SuccinctBitIndexBuilder.index(index.toBitSequence()));
    }
}
