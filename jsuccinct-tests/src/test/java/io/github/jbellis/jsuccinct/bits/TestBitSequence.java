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
import io.github.jbellis.jsuccinct.exceptions.ConstructionException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestBitSequence extends RandomizedTest {
    @Test
    public void testSetAndUnset() {
        var builder = new BitSequenceBuilder();
        builder.set(5);
        assertEquals(6, builder.size());
        assertTrue(builder.getBit(5));
        assertFalse(builder.getBit(4));

        builder.set(130);
        assertEquals(131, builder.size());
        assertTrue(builder.getBit(130));
        builder.unset(5);
        assertFalse(builder.getBit(5));

        // unset past the end still grows the sequence
        builder.unset(200);
        assertEquals(201, builder.size());
        assertFalse(builder.getBit(200));

        var bits = builder.build();
        assertEquals(201, bits.size());
        assertEquals(4, bits.wordCount());
        assertEquals(1, bits.popCount());
        assertTrue(bits.getBit(130));
        assertFalse(bits.getBit(5));
        assertThrows(IndexOutOfBoundsException.class, () -> bits.getBit(201));
        assertThrows(IndexOutOfBoundsException.class, () -> bits.getBit(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> builder.set(-1));
    }

    @Test
    public void testRandomSetUnset() {
        int size = randomIntBetween(1, 5000);
        boolean[] expected = new boolean[size];
        var builder = new BitSequenceBuilder(size);
        builder.addUnsetBits(size);
        for (int i = 0; i < 10_000; i++) {
            int pos = getRandom().nextInt(size);
            if (getRandom().nextBoolean()) {
                builder.set(pos);
                expected[pos] = true;
                assertTrue(builder.getBit(pos));
            } else {
                builder.unset(pos);
                expected[pos] = false;
                assertFalse(builder.getBit(pos));
            }
        }
        assertEquals(TestUtil.toSequence(expected), builder.build());
    }

    @Test
    public void testAddBitsMostSignificantFirst() {
        var builder = new BitSequenceBuilder();
        builder.addBits(0b101, 3);
        assertTrue(builder.getBit(0));
        assertFalse(builder.getBit(1));
        assertTrue(builder.getBit(2));

        // bits above count are ignored
        builder.addBits(0xF0, 4);
        assertEquals(7, builder.size());
        assertEquals(0, builder.fetchBits(3, 4));
    }

    @Test
    public void testAddBitsAcrossWordBoundary() {
        var builder = new BitSequenceBuilder();
        builder.addUnsetBits(60);
        builder.addBits(0xABCDL, 16);
        assertEquals(76, builder.size());
        assertEquals(0xABCDL, builder.fetchBits(60, 16));
        assertEquals(0xAL, builder.fetchBits(60, 4));
        assertEquals(0xBCDL, builder.fetchBits(64, 12));

        var bits = builder.build();
        assertEquals(0xABCDL, bits.fetchBits(60, 16));
        assertEquals(0xAL, bits.word(0));
        assertEquals(0xBCDL << 52, bits.word(1));
    }

    @Test
    public void testAddBitsRandom() {
        var builder = new BitSequenceBuilder();
        int n = randomIntBetween(1, 500);
        long[] values = new long[n];
        int[] counts = new int[n];
        long[] positions = new long[n];
        for (int i = 0; i < n; i++) {
            counts[i] = randomIntBetween(0, 64);
            values[i] = getRandom().nextLong() & (counts[i] == 64 ? -1L : (1L << counts[i]) - 1);
            positions[i] = builder.size();
            builder.addBits(values[i], counts[i]);
        }
        var bits = builder.build();
        for (int i = 0; i < n; i++) {
            assertEquals(values[i], bits.fetchBits(positions[i], counts[i]));
            assertEquals(values[i], builder.fetchBits(positions[i], counts[i]));
        }
    }

    @Test
    public void testFetchBits() {
        var builder = new BitSequenceBuilder();
        builder.addBits(-1L, 64);
        builder.addBits(0x5L, 3);
        var bits = builder.build();
        assertEquals(-1L, bits.fetchBits(0, 64));
        assertEquals(0, bits.fetchBits(10, 0));
        assertEquals(0b1110L, bits.fetchBits(62, 4));
        // reads past the stored words are zero
        assertEquals(0, bits.fetchBits(1000, 10));
        assertEquals(0b101L << 61, bits.fetchBits(64, 64));
        assertThrows(IllegalArgumentException.class, () -> bits.fetchBits(0, 65));
        assertThrows(IllegalArgumentException.class, () -> bits.fetchBits(0, -1));
    }

    @Test
    public void testFetchAcrossWordsMatchesModel() {
        boolean[] expected = TestUtil.randomBits(getRandom(), randomIntBetween(1, 400), 0.5);
        var bits = TestUtil.toSequence(expected);
        var builder = new BitSequenceBuilder(bits);
        for (int i = 0; i < 1000; i++) {
            long pos = randomIntBetween(0, expected.length + 70);
            int count = randomIntBetween(0, 64);
            long model = 0;
            for (int j = 0; j < count; j++) {
                long p = pos + j;
                model = (model << 1) | (p < expected.length && expected[(int) p] ? 1 : 0);
            }
            assertEquals(model, bits.fetchBits(pos, count));
            assertEquals(model, builder.fetchBits(pos, count));
        }
    }

    @Test
    public void testRejectedAddLeavesBuilderUnchanged() {
        var builder = new BitSequenceBuilder();
        builder.addBits(0b11, 2);
        assertThrows(ConstructionException.class, () -> builder.addBits(1, 65));
        assertThrows(ConstructionException.class, () -> builder.addBits(1, -1));
        assertEquals(2, builder.size());
        builder.add(false);
        assertEquals(0b110L, builder.fetchBits(0, 3));
    }

    @Test
    public void testAddSetAndUnsetBits() {
        var builder = new BitSequenceBuilder();
        builder.addSetBits(100);
        builder.addUnsetBits(50);
        builder.addSetBits(3);
        var bits = builder.build();
        assertEquals(153, bits.size());
        assertEquals(103, bits.popCount());
        assertTrue(bits.getBit(99));
        assertFalse(bits.getBit(100));
        assertFalse(bits.getBit(149));
        assertTrue(bits.getBit(150));
        assertThrows(IllegalArgumentException.class, () -> builder.addSetBits(-1));
    }

    @Test
    public void testAddBytes() {
        var builder = new BitSequenceBuilder();
        builder.addBytes(new byte[]{(byte) 0x80, 0x01, (byte) 0xff});
        assertEquals(24, builder.size());
        assertTrue(builder.getBit(0));
        assertFalse(builder.getBit(1));
        assertTrue(builder.getBit(15));
        assertEquals(0xff, builder.fetchBits(16, 8));
    }

    @Test
    public void testEqualityIgnoresBitsPastSize() {
        var a = new BitSequenceBuilder();
        a.addBits(0b1011, 4);
        var b = new BitSequenceBuilder();
        b.addBits(0b10111, 5);
        b.clear();
        b.addBits(0b1011, 4);
        assertEquals(a.build(), b.build());
        assertEquals(a.build().hashCode(), b.build().hashCode());

        b.add(false);
        assertNotEquals(a.build(), b.build());
    }

    @Test
    public void testCopyConstructor() {
        boolean[] expected = TestUtil.randomBits(getRandom(), randomIntBetween(0, 300), 0.5);
        var source = TestUtil.toSequence(expected);
        var builder = new BitSequenceBuilder(source);
        assertEquals(source, builder.build());
        builder.add(true);
        assertEquals(source.size() + 1, builder.size());
        assertTrue(builder.getBit(source.size()));
    }

    @Test
    public void testClearAllowsReuse() {
        var builder = new BitSequenceBuilder();
        builder.addSetBits(70);
        builder.clear();
        assertEquals(0, builder.size());
        builder.addUnsetBits(70);
        assertEquals(0, builder.build().popCount());
    }
}
