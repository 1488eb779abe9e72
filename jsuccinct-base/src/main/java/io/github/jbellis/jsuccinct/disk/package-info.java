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
 * Provides low-level I/O abstractions for reading and writing binary data.
 *
 * <h2>Readers</h2>
 * <ul>
 *   <li>{@link io.github.jbellis.jsuccinct.disk.RandomAccessReader} - Interface for reading data
 *       with seek capability. Designed for sequential reads after seeking to a position.</li>
 *   <li>{@link io.github.jbellis.jsuccinct.disk.ReaderSupplier} - Creates
 *       {@code RandomAccessReader} instances, one per thread, since readers are stateful.</li>
 *   <li>{@link io.github.jbellis.jsuccinct.disk.ReaderSupplierFactory} - The recommended entry point
 *       for opening files: memory-mapped via
 *       {@link io.github.jbellis.jsuccinct.disk.MappedChunkReader}, or
 *       {@link io.github.jbellis.jsuccinct.disk.SimpleReader} where mapping is unavailable.</li>
 *   <li>{@link io.github.jbellis.jsuccinct.disk.ByteBufferReader} - Reader backed by a
 *       {@code ByteBuffer}, useful for in-memory data.</li>
 * </ul>
 *
 * <h2>Writers</h2>
 * <ul>
 *   <li>{@link io.github.jbellis.jsuccinct.disk.IndexWriter} - Sequential writing with position tracking.</li>
 *   <li>{@link io.github.jbellis.jsuccinct.disk.SimpleWriter} - Buffered file writer.</li>
 *   <li>{@link io.github.jbellis.jsuccinct.disk.ByteBufferIndexWriter} - Writer backed by a
 *       {@code ByteBuffer}.</li>
 * </ul>
 *
 * <h2>Usage Pattern</h2>
 * <pre>{@code
 * try (ReaderSupplier readerSupplier = ReaderSupplierFactory.open(path);
 *      RandomAccessReader reader = readerSupplier.get()) {
 *     reader.seek(offset);
 *     SuccinctBitIndex index = SuccinctBitIndex.load(reader);
 * }
 * }</pre>
 * All multi-byte values are big-endian. Truncated input surfaces as {@link java.io.EOFException}.
 */
package io.github.jbellis.jsuccinct.disk;
