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

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Serializes structures into a ByteBuffer instead of a file. Output is big-endian whatever the
 * order of the buffer passed in, so the bytes match what {@link SimpleWriter} produces.
 * <p>
 * Not thread-safe.
 */
public class ByteBufferIndexWriter implements IndexWriter {
    private final ByteBuffer buffer;
    private final int start;

    /**
     * Writes into {@code buffer} from its current position on, advancing that position.
     */
    public ByteBufferIndexWriter(ByteBuffer buffer) {
        this.buffer = buffer.order(ByteOrder.BIG_ENDIAN);
        this.start = buffer.position();
    }

    /**
     * @param capacity size of the buffer in bytes
     * @param direct whether to allocate the buffer off-heap
     */
    public static ByteBufferIndexWriter create(int capacity, boolean direct) {
        ByteBuffer buffer = direct ? ByteBuffer.allocateDirect(capacity) : ByteBuffer.allocate(capacity);
        return new ByteBufferIndexWriter(buffer);
    }

    /**
     * @return a read-only big-endian view of everything written since construction or the last {@link #reset()}
     */
    public ByteBuffer getWrittenData() {
        ByteBuffer view = buffer.duplicate();
        view.limit(buffer.position()).position(start);
        return view.slice().asReadOnlyBuffer().order(ByteOrder.BIG_ENDIAN);
    }

    /**
     * Discards what was written so the buffer can be filled again.
     */
    public void reset() {
        buffer.position(start);
    }

    @Override
    public long position() {
        return buffer.position() - start;
    }

    @Override
    public void close() {
        // the buffer belongs to the caller
    }

    @Override
    public void writeLong(long v) {
        buffer.putLong(v);
    }

    @Override
    public void writeLongs(long[] values, int count) {
        buffer.asLongBuffer().put(values, 0, count);
        buffer.position(buffer.position() + count * Long.BYTES);
    }

    @Override
    public void writeInt(int v) {
        buffer.putInt(v);
    }

    @Override
    public void writeShort(int v) {
        buffer.putShort((short) v);
    }

    @Override
    public void writeChar(int v) {
        buffer.putChar((char) v);
    }

    @Override
    public void writeByte(int v) {
        buffer.put((byte) v);
    }

    @Override
    public void writeBoolean(boolean v) {
        writeByte(v ? 1 : 0);
    }

    @Override
    public void writeFloat(float v) {
        writeInt(Float.floatToIntBits(v));
    }

    @Override
    public void writeDouble(double v) {
        writeLong(Double.doubleToLongBits(v));
    }

    @Override
    public void write(int b) {
        writeByte(b);
    }

    @Override
    public void write(byte[] b) {
        write(b, 0, b.length);
    }

    @Override
    public void write(byte[] b, int off, int len) {
        buffer.put(b, off, len);
    }

    @Override
    public void writeBytes(String s) {
        s.chars().forEach(this::writeByte);
    }

    @Override
    public void writeChars(String s) {
        s.chars().forEach(this::writeChar);
    }

    @Override
    public void writeUTF(String s) throws IOException {
        var encoded = new ByteArrayOutputStream();
        new DataOutputStream(encoded).writeUTF(s);
        write(encoded.toByteArray());
    }
}
