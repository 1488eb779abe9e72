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

package io.github.jbellis.jsuccinct.disk;

import java.io.IOException;

/**
 * Positioned, big-endian reads of serialized bit structures.
 * <p>
 * Structures are loaded by seeking to their first byte and reading forward, so readers keep a
 * position and are not thread-safe. Get one reader per thread from a {@link ReaderSupplier}.
 * Any read that runs past {@link #length()} throws {@link java.io.EOFException}.
 */
public interface RandomAccessReader extends AutoCloseable {
    /**
     * Moves to byte {@code offset}, in [0, length()].
     */
    void seek(long offset) throws IOException;

    long getPosition() throws IOException;

    int readInt() throws IOException;

    long readLong() throws IOException;

    /**
     * Fills {@code bytes} completely.
     */
    void readFully(byte[] bytes) throws IOException;

    /**
     * Fills {@code values} completely, eight bytes per element. Bit sequences read their words
     * with this, so implementations should avoid a per-element call.
     */
    void readFully(long[] values) throws IOException;

    @Override
    void close() throws IOException;

    /**
     * @return total number of readable bytes
     */
    long length() throws IOException;
}
