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

package io.github.jbellis.jsuccinct.util;

/**
 * Estimates the shallow size of objects and arrays on a 64-bit JVM with compressed oops,
 * which is the HotSpot default for heaps below 32 GB.
 */
public final class RamUsageEstimator {
    /** Size of an object reference. */
    public static final int NUM_BYTES_OBJECT_REF = 4;

    /** Size of an object header. */
    public static final int NUM_BYTES_OBJECT_HEADER = 12;

    /** Size of an array header, including the length field. */
    public static final int NUM_BYTES_ARRAY_HEADER = 16;

    /** Objects are aligned to this many bytes. */
    public static final int NUM_BYTES_OBJECT_ALIGNMENT = 8;

    private RamUsageEstimator() {
    }

    /**
     * Aligns an object size to the next multiple of {@link #NUM_BYTES_OBJECT_ALIGNMENT}.
     */
    public static long alignObjectSize(long size) {
        size += NUM_BYTES_OBJECT_ALIGNMENT - 1L;
        return size - (size % NUM_BYTES_OBJECT_ALIGNMENT);
    }

    /**
     * Returns the size in bytes of a {@code long[]}.
     */
    public static long sizeOf(long[] arr) {
        return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) Long.BYTES * arr.length);
    }

    /**
     * Returns the shallow size of an object with the given number of reference, long and int fields.
     */
    public static long shallowSizeOf(int refFields, int longFields, int intFields) {
        return alignObjectSize(NUM_BYTES_OBJECT_HEADER
                + (long) refFields * NUM_BYTES_OBJECT_REF
                + (long) longFields * Long.BYTES
                + (long) intFields * Integer.BYTES);
    }
}
