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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

/**
 * Every reader implementation must read back what the writers wrote, and report truncation.
 */
public class TestReaders extends RandomizedTest {
    private Path testDirectory;
    private Path testFilePath;
    private long[] longs;
    private byte[] bytes;

    @Before
    public void setUp() throws IOException {
        testDirectory = Files.createTempDirectory("test_readers");
        testFilePath = testDirectory.resolve("test_file");
        longs = new long[randomIntBetween(0, 100)];
        for (int i = 0; i < longs.length; i++) {
            longs[i] = getRandom().nextLong();
        }
        bytes = new byte[randomIntBetween(0, 20)];
        getRandom().nextBytes(bytes);
        try (var writer = new SimpleWriter(testFilePath)) {
            write(writer);
            assertEquals(expectedLength(), writer.position());
        }
    }

    @After
    public void tearDown() throws IOException {
        Files.deleteIfExists(testFilePath);
        Files.deleteIfExists(testDirectory);
    }

    private void write(IndexWriter writer) throws IOException {
        writer.writeInt(longs.length);
        writer.writeLongs(longs, longs.length);
        writer.write(bytes);
        writer.writeLong(-1L);
    }

    private long expectedLength() {
        return Integer.BYTES + (long) Long.BYTES * longs.length + bytes.length + Long.BYTES;
    }

    private void assertReadsBack(RandomAccessReader reader) throws IOException {
        assertEquals(expectedLength(), reader.length());
        assertEquals(longs.length, reader.readInt());
        long[] readLongs = new long[longs.length];
        reader.readFully(readLongs);
        assertArrayEquals(longs, readLongs);
        byte[] readBytes = new byte[bytes.length];
        reader.readFully(readBytes);
        assertArrayEquals(bytes, readBytes);
        assertEquals(-1L, reader.readLong());
        assertEquals(expectedLength(), reader.getPosition());
        assertThrows(EOFException.class, reader::readInt);

        reader.seek(0);
        assertEquals(longs.length, reader.readInt());
    }

    @Test
    public void testSimpleWriterPositionIsFilePosition() throws IOException {
        Path path = testDirectory.resolve("positions");
        try (var writer = new SimpleWriter(path)) {
            assertEquals(0, writer.position());
            writer.writeLongs(longs, longs.length);
            assertEquals((long) Long.BYTES * longs.length, writer.position());
            assertEquals(writer.position(), Files.size(path));
            writer.writeInt(7);
            long position = writer.position();
            assertEquals((long) Long.BYTES * longs.length + Integer.BYTES, position);
            assertEquals(position, Files.size(path));
        } finally {
            Files.deleteIfExists(path);
        }
    }

    @Test
    public void testMappedChunkReader() throws IOException {
        try (var supplier = new MappedChunkReader.Supplier(testFilePath);
             var reader = supplier.get()) {
            assertReadsBack(reader);
        }
    }

    @Test
    public void testSimpleReader() throws IOException {
        try (var supplier = new SimpleReader.Supplier(testFilePath);
             var reader = supplier.get()) {
            assertReadsBack(reader);
        }
    }

    @Test
    public void testByteBufferReader() throws IOException {
        var writer = ByteBufferIndexWriter.create((int) expectedLength(), randomBoolean());
        write(writer);
        ByteBuffer data = writer.getWrittenData();
        try (var reader = new ByteBufferReader(data)) {
            assertReadsBack(reader);
        }
        assertArrayEquals(Files.readAllBytes(testFilePath), toArray(data));
    }

    private static byte[] toArray(ByteBuffer buffer) {
        byte[] array = new byte[buffer.remaining()];
        buffer.duplicate().get(array);
        return array;
    }

    @Test
    public void testFactory() throws IOException {
        try (var supplier = ReaderSupplierFactory.open(testFilePath)) {
            // readers from one supplier are independent
            try (var first = supplier.get(); var second = supplier.get()) {
                first.seek(Integer.BYTES);
                assertReadsBack(second);
                assertEquals(Integer.BYTES, first.getPosition());
            }
        }
        assertThrows(NoSuchFileException.class, () -> ReaderSupplierFactory.open(testDirectory.resolve("missing")));
    }
}
