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
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;

/**
 * An unmapped RandomAccessReader over a RandomAccessFile, for file systems that do not support mapping.
 */
public class SimpleReader implements RandomAccessReader {
    private final RandomAccessFile raf;

    public SimpleReader(Path path) throws IOException {
        raf = new RandomAccessFile(path.toFile(), "r");
    }

    @Override
    public void seek(long offset) throws IOException {
        raf.seek(offset);
    }

    @Override
    public long getPosition() throws IOException {
        return raf.getFilePointer();
    }

    @Override
    public int readInt() throws IOException {
        return raf.readInt();
    }

    @Override
    public long readLong() throws IOException {
        return raf.readLong();
    }

    @Override
    public void readFully(byte[] bytes) throws IOException {
        raf.readFully(bytes);
    }

    @Override
    public void readFully(long[] values) throws IOException {
        byte[] tmp = new byte[Math.multiplyExact(values.length, Long.BYTES)];
        raf.readFully(tmp);
        ByteBuffer.wrap(tmp).order(ByteOrder.BIG_ENDIAN).asLongBuffer().get(values);
    }

    @Override
    public void close() throws IOException {
        raf.close();
    }

    @Override
    public long length() throws IOException {
        return raf.length();
    }

    public static class Supplier implements ReaderSupplier {
        private final Path path;

        public Supplier(Path path) {
            this.path = path;
        }

        @Override
        public RandomAccessReader get() throws IOException {
            return new SimpleReader(path);
        }
    }
}
