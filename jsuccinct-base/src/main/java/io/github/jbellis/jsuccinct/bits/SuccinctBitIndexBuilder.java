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

/**
 * Accumulates bits for a {@link SuccinctBitIndex}. The rank samples are computed once, by {@link #build()}.
 * <p>
 * Not thread-safe.
 */
public class SuccinctBitIndexBuilder implements BitsBuilder {
    private final BitSequenceBuilder bits;

    public SuccinctBitIndexBuilder() {
        bits = new BitSequenceBuilder();
    }

    /**
     * Creates a builder that already holds {@code size} unset bits, to be set by position.
     */
    public SuccinctBitIndexBuilder(long size) {
        bits = new BitSequenceBuilder(size);
        bits.addUnsetBits(size);
    }

    /**
     * Indexes an existing sequence. The result shares storage with {@code bits}.
     */
    public static SuccinctBitIndex index(BitSequence bits) {
        return new SuccinctBitIndex(bits.size(), bits.words);
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

    public SuccinctBitIndex build() {
        return index(bits.build());
    }

    @Override
    public BitSequence buildBits() {
        return bits.build();
    }

    @Override
    public SuccinctBitIndex buildSuccinctBits() {
        return build();
    }

    @Override
    public RRRCompressedBitIndex buildCompressedBits() {
        return RRRCompressedBitIndexBuilder.compress(bits.build());
    }
}
