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

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * A RandomAccessReader that memory-maps its file one chunk at a time, so files larger than
 * the maximum mapping size can be read. All readers from one Supplier share the channel.
 */
public class MappedChunkReader implements RandomAccessReader {
    private static final long CHUNK_SIZE = Integer.MAX_VALUE; // ~2GB
    private final FileChannel channel;
    private final long fileSize;
    private long position;

    private ByteBuffer currentBuffer;
    private long currentChunkStart;

    public MappedChunkReader(FileChannel channel) throws IOException {
        this.channel = channel;
        this.fileSize = channel.size();
        this.position = 0;
        mapChunk(0);
    }

    public static class Supplier implements ReaderSupplier {
        private final FileChannel channel;

        public Supplier(Path path) throws IOException {
            this.channel = FileChannel.open(path, StandardOpenOption.READ);
        }

        @Override
        public RandomAccessReader get() throws IOException {
            return new MappedChunkReader(channel);
        }

        @Override
        public void close() throws IOException {
            channel.close();
        }
    }

    private void mapChunk(long chunkStart) throws IOException {
        long size = Math.min(CHUNK_SIZE, fileSize - chunkStart);
        currentBuffer = channel.map(FileChannel.MapMode.READ_ONLY, chunkStart, size).order(ByteOrder.BIG_ENDIAN);
        currentChunkStart = chunkStart;
    }

    private void ensureAvailable(int size) throws IOException {
        if (position + size > fileSize) {
            throw new EOFException("Needed " + size + " bytes at position " + position + " of a " + fileSize + " byte file");
        }
        if (position < currentChunkStart || position + size > currentChunkStart + currentBuffer.capacity()) {
            mapChunk(position);
        }
        currentBuffer.position((int) (position - currentChunkStart));
    }

    @Override
    public void seek(long offset) throws EOFException {
        if (offset < 0 || offset > fileSize) {
            throw new EOFException("Cannot seek to " + offset + " in a " + fileSize + " byte file");
        }
        this.position = offset;
    }

    @Override
    public long getPosition() {
        return position;
    }

    @Override
    public int readInt() throws IOException {
        ensureAvailable(Integer.BYTES);
        int v = currentBuffer.getInt();
        position += Integer.BYTES;
        return v;
    }

    @Override
    public long readLong() throws IOException {
        ensureAvailable(Long.BYTES);
        long v = currentBuffer.getLong();
        position += Long.BYTES;
        return v;
    }

    @Override
    public void readFully(byte[] b) throws IOException {
        if (position + b.length > fileSize) {
            throw new EOFException("Needed " + b.length + " bytes at position " + position + " of a " + fileSize + " byte file");
        }
        int offset = 0;
        while (offset < b.length) {
            ensureAvailable(1);
            int toRead = Math.min(b.length - offset, currentBuffer.remaining());
            currentBuffer.get(b, offset, toRead);
            offset += toRead;
            position += toRead;
        }
    }

    @Override
    public void readFully(long[] values) throws IOException {
        byte[] tmp = new byte[Math.multiplyExact(values.length, Long.BYTES)];
        readFully(tmp);
        ByteBuffer.wrap(tmp).order(ByteOrder.BIG_ENDIAN).asLongBuffer().get(values);
    }

    @Override
    public long length() {
        return fileSize;
    }

    @Override
    public void close() {
        // Channel is managed by Supplier
    }
}
