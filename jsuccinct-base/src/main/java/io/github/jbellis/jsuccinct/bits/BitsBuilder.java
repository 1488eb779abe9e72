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
 * A mutable accumulator of bits that can be finalised into any of the immutable bit structures.
 * Builders are single-owner and not thread-safe; each build call leaves the builder unchanged,
 * so it can keep growing or be {@link #clear() cleared} and reused.
 */
public interface BitsBuilder {
    /**
     * @return the bits accumulated so far as a plain packed sequence
     */
    BitSequence buildBits();

    /**
     * @return the bits accumulated so far with a rank/select index
     */
    SuccinctBitIndex buildSuccinctBits();

    /**
     * @return the bits accumulated so far, RRR-compressed with a rank/select index
     */
    RRRCompressedBitIndex buildCompressedBits();

    /**
     * @return the number of bits accumulated so far
     */
    long size();

    /**
     * Discards all accumulated bits.
     */
    void clear();
}
