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

/**
 * Succinct bit structures: packed bit sequences, rank/select indexes over them, and Elias-Fano
 * encoded integer sequences.
 *
 * <h2>Structures</h2>
 * <ul>
 *   <li>{@link io.github.jbellis.jsuccinct.bits.BitSequence} - plain packed bits, most significant
 *       bit of each {@code long} word first.</li>
 *   <li>{@link io.github.jbellis.jsuccinct.bits.SuccinctBitIndex} - the same bits plus one rank
 *       sample per 512 bits, for fast rank and select.</li>
 *   <li>{@link io.github.jbellis.jsuccinct.bits.RRRCompressedBitIndex} - block-wise (class, offset)
 *       compression that still answers rank and select; best for sparse or dense bits.</li>
 *   <li>{@link io.github.jbellis.jsuccinct.bits.EliasFanoIndex} - a non-decreasing sequence of
 *       longs in about {@code 2 + log2(upperBound / size)} bits per value. Also used for the
 *       super-block samples of the RRR index.</li>
 * </ul>
 * Both indexes implement {@link io.github.jbellis.jsuccinct.bits.RankSelectBits}, so callers can
 * switch between the plain and the compressed form.
 *
 * <h2>Lifecycle</h2>
 * Structures are produced by builders ({@link io.github.jbellis.jsuccinct.bits.BitsBuilder}
 * implementations and {@link io.github.jbellis.jsuccinct.bits.EliasFanoIndexBuilder}), are
 * immutable once built, and may then be queried from any number of threads.
 * <pre>{@code
 * var builder = new BitSequenceBuilder();
 * builder.addBits(0b1011, 4);
 * builder.addUnsetBits(60);
 * builder.set(100);
 * RankSelectBits bits = builder.buildCompressedBits();
 * long ones = bits.rankSetBits(64);     // 3
 * long third = bits.selectSetBits(3);   // 100
 * }</pre>
 *
 * <h2>Serialization</h2>
 * Every structure implements {@link io.github.jbellis.jsuccinct.bits.SerializableBits} and has static
 * {@code load} methods reading from a {@link io.github.jbellis.jsuccinct.disk.RandomAccessReader} or a
 * file. All integers are big-endian.
 */
package io.github.jbellis.jsuccinct.bits;
