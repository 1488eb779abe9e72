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
import io.github.jbellis.jsuccinct.disk.SimpleWriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A structure with a binary form. Every implementation also offers a static {@code load(RandomAccessReader)}
 * that reads back exactly what {@link #write(IndexWriter)} wrote, and a static {@code load(Path)}.
 */
public interface SerializableBits {
    /**
     * Writes this structure at the writer's current position.
     * @param out the writer
     * @throws IOException if the writer fails
     */
    void write(IndexWriter out) throws IOException;

    /**
     * Writes this structure to a new file, replacing any existing file at {@code path}.
     * @param path the file to write
     * @throws IOException if the file cannot be written
     */
    default void write(Path path) throws IOException {
        try (var out = new SimpleWriter(path)) {
            write(out);
        }
    }

    /**
     * @return the number of bytes {@link #write(IndexWriter)} writes
     */
    long serializedSize();
}
