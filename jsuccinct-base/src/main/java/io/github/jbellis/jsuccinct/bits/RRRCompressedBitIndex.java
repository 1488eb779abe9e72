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

/**
 * An immutable, entropy-compressed bit sequence answering rank and select without decompressing it
 * (Raman, Raman and Rao).
 * <p>
 * The bits are cut into blocks of {@link #BLOCK_SIZE} bits. Each block is stored as its class, the
 * number of set bits in it, at {@link #BITS_PER_CLASS} bits, plus its offset, the rank of the block's
 * bit pattern among all patterns of that class, at {@code ceil(log2(C(63, class)))} bits. Blocks that
 * are all zeros or all ones have no offset. Sparse or dense sequences therefore take much less than
 * one bit per position.
 * <p>
 * Every {@link #SUPER_BLOCK_FACTOR} blocks, and once more after the last block, the number of set bits
 * so far and the number of offset bits so far are sampled into two {@link EliasFanoIndex} instances.
 * A query decodes one super-block sample, scans at most {@code SUPER_BLOCK_FACTOR} classes and decodes
 * at most one block. Super-blocks that are entirely unset or entirely set are answered from the
 * samples alone.
 * <p>
 * Build instances with {@link RRRCompressedBitIndexBuilder}.
 */
public class RRRCompressedBitIndex implements RankSelectBits, SerializableBits, Accountable {
    /** Bits per block. */
    public static final int BLOCK_SIZE = 63;

    /** Bits used to store the class of a block. */
    public static final int BITS_PER_CLASS = 6;

    /** Blocks per super-block. */
    public static final int SUPER_BLOCK_FACTOR = 32;

    /** Bits per super-block. */
    public static final int SUPER_BLOCK_SIZE = BLOCK_SIZE * SUPER_BLOCK_FACTOR;

    private static final long FULL_BLOCK = BitUtil.mask(BLOCK_SIZE);
    private static final long SHALLOW_SIZE = RamUsageEstimator.shallowSizeOf(4, 2, 0);

    private final long size;
    private final long setBitsCount;
    private final BitSequence classValues;
    private final BitSequence offsetValues;
    private final EliasFanoIndex rankSamples;
    private final EliasFanoIndex offsetPositionSamples;

    RRRCompressedBitIndex(long size,
                          long setBitsCount,
                          BitSequence classValues,
                          BitSequence offsetValues,
                          EliasFanoIndex rankSamples,
                          EliasFanoIndex offsetPositionSamples)
    {
        this.size = size;
        this.setBitsCount = setBitsCount;
        this.classValues = classValues;
        this.offsetValues = offsetValues;
        this.rankSamples = rankSamples;
        this.offsetPositionSamples = offsetPositionSamples;
    }

    /**
     * Returns the offset of {@code block} among all 63-bit patterns with {@code blockClass} set bits.
     * Positions are scanned from the most significant (bit 62) down; each set bit at position {@code i}
     * adds C(i, remaining set bits).
     *
     * @param block a 63-bit pattern in the low bits of the long
     * @param blockClass the number of set bits in {@code block}
     */
    public static long encode(long block, int blockClass) {
        long offset = 0;
        for (int i = BLOCK_SIZE - 1; i >= 0 && blockClass > 0; i--) {
            if (((block >>> i) & 1L) != 0) {
                offset += BinomialTable.classCount(i, blockClass);
                blockClass--;
            }
        }
        return offset;
    }

    /**
     * Inverse of {@link #encode(long, int)}.
     */
    public static long decode(long offset, int blockClass) {
        long block = 0;
        for (int i = BLOCK_SIZE - 1; i >= 0 && blockClass > 0; i--) {
            long count = BinomialTable.classCount(i, blockClass);
            if (offset >= count) {
                block |= 1L << i;
                offset -= count;
                blockClass--;
            }
        }
        return block;
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
        long block = pos / BLOCK_SIZE;
        long superBlock = block / SUPER_BLOCK_FACTOR;
        long rank = rankSamples.get(superBlock);
        long delta = rankSamples.get(superBlock + 1) - rank;
        if (delta == 0) {
            return false;
        }
        if (delta == superBlockLength(superBlock)) {
            return true;
        }
        long offsetPosition = offsetPositionSamples.get(superBlock);
        for (long b = superBlock * SUPER_BLOCK_FACTOR; b < block; b++) {
            offsetPosition += BinomialTable.classBitOffset(classOf(b));
        }
        long bits = blockBits(classOf(block), offsetPosition);
        return ((bits >>> (BLOCK_SIZE - 1 - pos % BLOCK_SIZE)) & 1L) != 0;
    }

    @Override
    public long rankSetBits(long cutoff) {
        BitSequence.checkCutoff(cutoff, size);
        if (cutoff == size) {
            return setBitsCount;
        }
        long block = cutoff / BLOCK_SIZE;
        long superBlock = block / SUPER_BLOCK_FACTOR;
        long rank = rankSamples.get(superBlock);
        long delta = rankSamples.get(superBlock + 1) - rank;
        if (delta == 0) {
            return rank;
        }
        long superBlockStart = superBlock * SUPER_BLOCK_SIZE;
        if (delta == superBlockLength(superBlock)) {
            return rank + cutoff - superBlockStart;
        }
        long offsetPosition = offsetPositionSamples.get(superBlock);
        for (long b = superBlock * SUPER_BLOCK_FACTOR; b < block; b++) {
            int blockClass = classOf(b);
            rank += blockClass;
            offsetPosition += BinomialTable.classBitOffset(blockClass);
        }
        int inBlock = (int) (cutoff % BLOCK_SIZE);
        if (inBlock == 0) {
            return rank;
        }
        long bits = blockBits(classOf(block), offsetPosition);
        return rank + BitUtil.rank(bits, inBlock, BLOCK_SIZE);
    }

    @Override
    public long rankUnsetBits(long cutoff) {
        return cutoff - rankSetBits(cutoff);
    }

    @Override
    public long selectSetBits(long k) {
        if (k < 0 || k >= setBitsCount) {
            throw new IndexOutOfBoundsException("Set bit " + k + " out of bounds for " + setBitsCount + " set bits");
        }
        // last super-block whose sample does not exceed k
        long lo = 0;
        long hi = superBlockCount() - 1;
        while (lo < hi) {
            long mid = (lo + hi + 1) >>> 1;
            if (rankSamples.get(mid) <= k) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        long superBlock = lo;
        long rank = rankSamples.get(superBlock);
        long remaining = k - rank;
        long superBlockStart = superBlock * SUPER_BLOCK_SIZE;
        if (rankSamples.get(superBlock + 1) - rank == superBlockLength(superBlock)) {
            return superBlockStart + remaining;
        }
        long offsetPosition = offsetPositionSamples.get(superBlock);
        long block = superBlock * SUPER_BLOCK_FACTOR;
        while (true) {
            int blockClass = classOf(block);
            if (remaining < blockClass) {
                break;
            }
            remaining -= blockClass;
            offsetPosition += BinomialTable.classBitOffset(blockClass);
            block++;
        }
        long bits = blockBits(classOf(block), offsetPosition);
        // left-align the 63-bit block in the word
        return block * BLOCK_SIZE + BitUtil.select(bits << 1, (int) remaining);
    }

    @Override
    public long selectUnsetBits(long k) {
        long unsetBitsCount = unsetBitsCount();
        if (k < 0 || k >= unsetBitsCount) {
            throw new IndexOutOfBoundsException("Unset bit " + k + " out of bounds for " + unsetBitsCount + " unset bits");
        }
        long lo = 0;
        long hi = superBlockCount() - 1;
        while (lo < hi) {
            long mid = (lo + hi + 1) >>> 1;
            if (unsetSample(mid) <= k) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        long superBlock = lo;
        long unset = unsetSample(superBlock);
        long remaining = k - unset;
        long superBlockStart = superBlock * SUPER_BLOCK_SIZE;
        if (unsetSample(superBlock + 1) - unset == superBlockLength(superBlock)) {
            return superBlockStart + remaining;
        }
        // a trailing partial block counts its padding as unset, but the target always comes first
        long offsetPosition = offsetPositionSamples.get(superBlock);
        long block = superBlock * SUPER_BLOCK_FACTOR;
        while (true) {
            int blockClass = classOf(block);
            int zeros = BLOCK_SIZE - blockClass;
            if (remaining < zeros) {
                break;
            }
            remaining -= zeros;
            offsetPosition += BinomialTable.classBitOffset(blockClass);
            block++;
        }
        long bits = blockBits(classOf(block), offsetPosition);
        return block * BLOCK_SIZE + BitUtil.select(~(bits << 1), (int) remaining);
    }

    /**
     * @return the uncompressed bits
     */
    public BitSequence decompress() {
        var builder = new BitSequenceBuilder(size);
        long offsetPosition = 0;
        long blockCount = blockCount();
        for (long block = 0; block < blockCount; block++) {
            int blockClass = classOf(block);
            long bits = blockBits(blockClass, offsetPosition);
            offsetPosition += BinomialTable.classBitOffset(blockClass);
            int length = (int) Math.min(BLOCK_SIZE, size - block * BLOCK_SIZE);
            builder.addBits(bits >>> (BLOCK_SIZE - length), length);
        }
        return builder.build();
    }

    /**
     * Re-derives every block from the compressed form and compares it with {@code source}.
     *
     * @throws AssertionError on the first block whose class, offset or bits do not match
     */
    void verifyEncoding(BitSequence source) {
        long offsetPosition = 0;
        long blockCount = blockCount();
        for (long block = 0; block < blockCount; block++) {
            long expected = RRRCompressedBitIndexBuilder.blockAt(source, block);
            int blockClass = classOf(block);
            if (blockClass != Long.bitCount(expected)) {
                throw new AssertionError("Block " + block + " has class " + blockClass + " but " + Long.bitCount(expected) + " set bits");
            }
            int width = BinomialTable.classBitOffset(blockClass);
            long offset = offsetValues.fetchBits(offsetPosition, width);
            if (offset != encode(expected, blockClass)) {
                throw new AssertionError("Block " + block + " has offset " + offset + " but encodes to " + encode(expected, blockClass));
            }
            long bits = blockBits(blockClass, offsetPosition);
            if (bits != expected) {
                throw new AssertionError("Block " + block + " decodes to " + Long.toHexString(bits) + " instead of " + Long.toHexString(expected));
            }
            offsetPosition += width;
        }
        if (offsetPosition != offsetValues.size()) {
            throw new AssertionError("Offsets use " + offsetPosition + " bits but " + offsetValues.size() + " are stored");
        }
    }

    private int classOf(long block) {
        return (int) classValues.fetchBits(block * BITS_PER_CLASS, BITS_PER_CLASS);
    }

    private long blockBits(int blockClass, long offsetPosition) {
        if (blockClass == 0) {
            return 0;
        }
        if (blockClass == BLOCK_SIZE) {
            return FULL_BLOCK;
        }
        long offset = offsetValues.fetchBits(offsetPosition, BinomialTable.classBitOffset(blockClass));
        return decode(offset, blockClass);
    }

    private long unsetSample(long superBlock) {
        return Math.min(superBlock * SUPER_BLOCK_SIZE, size) - rankSamples.get(superBlock);
    }

    private long superBlockLength(long superBlock) {
        return Math.min(SUPER_BLOCK_SIZE, size - superBlock * SUPER_BLOCK_SIZE);
    }

    private long blockCount() {
        return MathUtil.divideRoundUp(size, BLOCK_SIZE);
    }

    private long superBlockCount() {
        return MathUtil.divideRoundUp(size, SUPER_BLOCK_SIZE);
    }

    @Override
    public long ramBytesUsed() {
        return SHALLOW_SIZE
                + classValues.ramBytesUsed()
                + offsetValues.ramBytesUsed()
                + rankSamples.ramBytesUsed()
                + offsetPositionSamples.ramBytesUsed();
    }

    @Override
    public void write(IndexWriter out) throws IOException {
        out.writeLong(size);
        out.writeLong(setBitsCount);
        classValues.write(out);
        offsetValues.write(out);
        rankSamples.write(out);
        offsetPositionSamples.write(out);
    }

    @Override
    public long serializedSize() {
        return 2L * Long.BYTES
                + classValues.serializedSize()
                + offsetValues.serializedSize()
                + rankSamples.serializedSize()
                + offsetPositionSamples.serializedSize();
    }

    public static RRRCompressedBitIndex load(RandomAccessReader in) throws IOException {
        long size = in.readLong();
        long setBitsCount = in.readLong();
        if (size < 0 || setBitsCount < 0 || setBitsCount > size) {
            throw new IOException("Invalid header: " + setBitsCount + " set bits in " + size);
        }
        BitSequence classValues = BitSequence.load(in);
        long blockCount = MathUtil.divideRoundUp(size, BLOCK_SIZE);
        if (classValues.size() != blockCount * BITS_PER_CLASS) {
            throw new IOException("Expected " + blockCount + " block classes but found " + classValues.size() + " class bits");
        }
        BitSequence offsetValues = BitSequence.load(in);
        EliasFanoIndex rankSamples = EliasFanoIndex.load(in);
        EliasFanoIndex offsetPositionSamples = EliasFanoIndex.load(in);
        long sampleCount = MathUtil.divideRoundUp(size, SUPER_BLOCK_SIZE) + 1;
        if (rankSamples.size() != sampleCount || offsetPositionSamples.size() != sampleCount) {
            throw new IOException("Expected " + sampleCount + " super-block samples but found "
                    + rankSamples.size() + " and " + offsetPositionSamples.size());
        }
        var index = new RRRCompressedBitIndex(size, setBitsCount, classValues, offsetValues, rankSamples, offsetPositionSamples);
        index.checkSamples();
        return index;
    }

    /**
     * Walks all block classes and offsets once, checking them against the header and the super-block samples.
     */
    private void checkSamples() throws IOException {
        long rank = 0;
        long offsetPosition = 0;
        long blockCount = blockCount();
        for (long block = 0; block < blockCount; block++) {
            if (block % SUPER_BLOCK_FACTOR == 0) {
                checkSample(block / SUPER_BLOCK_FACTOR, rank, offsetPosition);
            }
            int blockClass = classOf(block);
            int length = (int) Math.min(BLOCK_SIZE, size - block * BLOCK_SIZE);
            if (blockClass > length) {
                throw new IOException("Block " + block + " has class " + blockClass + " but only " + length + " bits");
            }
            int width = BinomialTable.classBitOffset(blockClass);
            if (offsetPosition + width > offsetValues.size()) {
                throw new IOException("Offset of block " + block + " runs past " + offsetValues.size() + " offset bits");
            }
            if (width > 0) {
                long offset = offsetValues.fetchBits(offsetPosition, width);
                if (offset >= BinomialTable.classCount(BLOCK_SIZE, blockClass)) {
                    throw new IOException("Block " + block + " has offset " + offset + " outside class " + blockClass);
                }
                if ((decode(offset, blockClass) & BitUtil.mask(BLOCK_SIZE - length)) != 0) {
                    throw new IOException("Block " + block + " has bits past the end of the sequence");
                }
            }
            rank += blockClass;
            offsetPosition += width;
        }
        checkSample(superBlockCount(), rank, offsetPosition);
        if (rank != setBitsCount) {
            throw new IOException("Header claims " + setBitsCount + " set bits but the blocks hold " + rank);
        }
        if (offsetPosition != offsetValues.size()) {
            throw new IOException("Blocks use " + offsetPosition + " offset bits but " + offsetValues.size() + " are stored");
        }
    }

    private void checkSample(long superBlock, long rank, long offsetPosition) throws IOException {
        if (rankSamples.get(superBlock) != rank || offsetPositionSamples.get(superBlock) != offsetPosition) {
            throw new IOException("Samples of super-block " + superBlock + " do not match its blocks");
        }
    }

    public static RRRCompressedBitIndex load(Path path) throws IOException {
        try (var supplier = ReaderSupplierFactory.open(path); var reader = supplier.get()) {
            return load(reader);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RRRCompressedBitIndex)) {
            return false;
        }
        RRRCompressedBitIndex that = (RRRCompressedBitIndex) o;
        return size == that.size
                && setBitsCount == that.setBitsCount
                && classValues.equals(that.classValues)
                && offsetValues.equals(that.offsetValues);
    }

    @Override
    public int hashCode() {
        int h = Long.hashCode(size);
        h = 31 * h + classValues.hashCode();
        return 31 * h + offsetValues.hashCode();
    }

    @Override
    public String toString() {
        return "RRRCompressedBitIndex(size=" + size + ", setBits=" + setBitsCount + ", compressedBits="
                + (classValues.size() + offsetValues.size()) + ")";
    }
}
