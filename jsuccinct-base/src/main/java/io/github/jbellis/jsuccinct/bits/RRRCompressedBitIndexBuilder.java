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

import io.github.jbellis.jsuccinct.util.MathUtil;
import org.agrona.collections.LongArrayList;

import java.util.logging.Level;
import java.util.logging.Logger;

import static io.github.jbellis.jsuccinct.bits.RRRCompressedBitIndex.BITS_PER_CLASS;
import static io.github.jbellis.jsuccinct.bits.RRRCompressedBitIndex.BLOCK_SIZE;
import static io.github.jbellis.jsuccinct.bits.RRRCompressedBitIndex.SUPER_BLOCK_FACTOR;

/**
 * Accumulates bits for an {@link RRRCompressedBitIndex}. Bits are kept uncompressed until
 * {@link #build()}, which encodes them in one pass.
 * <p>
 * Setting the system property {@code jsuccinct.rrr.verify} to {@code true} makes every build decode
 * all blocks again and compare them with the input, throwing {@link AssertionError} on a mismatch.
 * <p>
 * Not thread-safe.
 */
public class RRRCompressedBitIndexBuilder implements BitsBuilder {
    private static final Logger LOG = Logger.getLogger(RRRCompressedBitIndexBuilder.class.getName());

    static final boolean VERIFY_ENCODING = Boolean.getBoolean("jsuccinct.rrr.verify");

    private final BitSequenceBuilder bits;

    public RRRCompressedBitIndexBuilder() {
        bits = new BitSequenceBuilder();
    }

    /**
     * @param capacityBits number of bits to reserve storage for
     */
    public RRRCompressedBitIndexBuilder(long capacityBits) {
        bits = new BitSequenceBuilder(capacityBits);
    }

    /**
     * Compresses an existing sequence.
     */
    public static RRRCompressedBitIndex compress(BitSequence source) {
        long size = source.size();
        long blockCount = MathUtil.divideRoundUp(size, BLOCK_SIZE);

        var classValues = new BitSequenceBuilder(blockCount * BITS_PER_CLASS);
        var offsetValues = new BitSequenceBuilder();
        var rankSamples = new LongArrayList();
        var offsetSamples = new LongArrayList();
        long rank = 0;
        long offsetBits = 0;
        for (long block = 0; block < blockCount; block++) {
            if (block % SUPER_BLOCK_FACTOR == 0) {
                rankSamples.addLong(rank);
                offsetSamples.addLong(offsetBits);
            }
            long bits = blockAt(source, block);
            int blockClass = Long.bitCount(bits);
            classValues.addBits(blockClass, BITS_PER_CLASS);
            int width = BinomialTable.classBitOffset(blockClass);
            offsetValues.addBits(RRRCompressedBitIndex.encode(bits, blockClass), width);
            rank += blockClass;
            offsetBits += width;
        }
        rankSamples.addLong(rank);
        offsetSamples.addLong(offsetBits);

        var index = new RRRCompressedBitIndex(size,
                                              rank,
                                              classValues.build(),
                                              offsetValues.build(),
                                              sample(rankSamples, rank),
                                              sample(offsetSamples, offsetBits));
        if (VERIFY_ENCODING) {
            index.verifyEncoding(source);
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.log(Level.FINE, "Compressed {0} bits ({1} set) into {2} blocks: {3} class bits, {4} offset bits, {5} bytes",
                    new Object[]{size, rank, blockCount, blockCount * BITS_PER_CLASS, offsetBits, index.ramBytesUsed()});
        }
        return index;
    }

    /**
     * Returns block {@code block} of {@code source} in the low 63 bits of a long, first position in bit 62.
     * A trailing partial block is padded with zeros on the right.
     */
    static long blockAt(BitSequence source, long block) {
        long pos = block * BLOCK_SIZE;
        int length = (int) Math.min(BLOCK_SIZE, source.size() - pos);
        return source.fetchBits(pos, length) << (BLOCK_SIZE - length);
    }

    private static EliasFanoIndex sample(LongArrayList samples, long upperBound) {
        var builder = new EliasFanoIndexBuilder(samples.size(), upperBound);
        for (int i = 0; i < samples.size(); i++) {
            builder.add(samples.getLong(i));
        }
        return builder.build();
    }

    public void set(long pos) {
        bits.set(pos);
    }

    public void unset(long pos) {
        bits.unset(pos);
    }

    public void add(boolean bit) {
        bits.add(bit);
    }

    public void addBits(long value, int count) {
        bits.addBits(value, count);
    }

    public void addSetBits(long count) {
        bits.addSetBits(count);
    }

    public void addUnsetBits(long count) {
        bits.addUnsetBits(count);
    }

    public void addBytes(byte[] bytes) {
        bits.addBytes(bytes);
    }

    public boolean getBit(long pos) {
        return bits.getBit(pos);
    }

    public long fetchBits(long pos, int count) {
        return bits.fetchBits(pos, count);
    }

    @Override
    public long size() {
        return bits.size();
    }

    @Override
    public void clear() {
        bits.clear();
    }

    public RRRCompressedBitIndex build() {
        return compress(bits.build());
    }

    @Override
    public BitSequence buildBits() {
        return bits.build();
    }

    @Override
    public SuccinctBitIndex buildSuccinctBits() {
        return SuccinctBitIndexBuilder.index(bits.build());
    }

    @Override
    public RRRCompressedBitIndex buildCompressedBits() {
        return build();
    }
}
