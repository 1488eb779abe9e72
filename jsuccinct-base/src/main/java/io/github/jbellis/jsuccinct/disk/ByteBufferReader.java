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
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * A RandomAccessReader over a ByteBuffer, for data that is already in memory
 * (for example what a {@link ByteBufferIndexWriter} produced).
 */
public class ByteBufferReader implements RandomAccessReader {
    protected final ByteBuffer bb;

    public ByteBufferReader(ByteBuffer sourceBB) {
        bb = sourceBB.duplicate().order(ByteOrder.BIG_ENDIAN);
    }

    @Override
    public void seek(long offset) throws EOFException {
        if (offset < 0 || offset > bb.limit()) {
            throw new EOFException("Cannot seek to " + offset + " in a buffer of " + bb.limit() + " bytes");
        }
        bb.position(Math.toIntExact(offset));
    }

    @Override
    public long getPosition() {
        return bb.position();
    }

    @Override
    public int readInt() throws EOFException {
        ensureRemaining(Integer.BYTES);
        return bb.getInt();
    }

    @Override
    public long readLong() throws EOFException {
        ensureRemaining(Long.BYTES);
        return bb.getLong();
    }

    @Override
    public void readFully(byte[] bytes) throws EOFException {
        ensureRemaining(bytes.length);
        bb.get(bytes);
    }

    @Override
    public void readFully(long[] values) throws EOFException {
        ensureRemaining((long) values.length * Long.BYTES);
        bb.asLongBuffer().get(values);
        bb.position(bb.position() + values.length * Long.BYTES);
    }

    private void ensureRemaining(long bytes) throws EOFException {
        if (bb.remaining() < bytes) {
            throw new EOFException("Needed " + bytes + " bytes at position " + bb.position()
                    + " but only " + bb.remaining() + " remain");
        }
    }

    @Override
    public void close() {
        // the buffer belongs to the caller
    }

    @Override
    public long length() {
        return bb.limit();
    }
}
