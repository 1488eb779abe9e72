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

import java.io.Closeable;
import java.io.DataOutput;
import java.io.IOException;

/**
 * A sequential {@link DataOutput} that knows how far it has written. Multi-byte values are written
 * big-endian, following the {@code DataOutput} contract, whatever the byte order of the host.
 */
public interface IndexWriter extends DataOutput, Closeable {
    /**
     * @return the number of bytes written since this writer was created
     * @throws IOException if an I/O error occurs
     */
    long position() throws IOException;

    /**
     * Writes the first {@code count} elements of {@code values} as big-endian longs.
     *
     * @param values the values to write
     * @param count the number of leading elements to write
     * @throws IOException if an I/O error occurs
     */
    default void writeLongs(long[] values, int count) throws IOException {
        for (int i = 0; i < count; i++) {
            writeLong(values[i]);
        }
    }
}
