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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.jbellis.jsuccinct.TestUtil;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertTrue;

/**
 * Built structures are immutable, so concurrent readers must all see the same answers.
 */
@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestConcurrentQueries extends RandomizedTest {
    private static final int NUM_THREADS = 8;
    private static final int QUERIES = 5_000;

    @Test
    public void testConcurrentRankSelect() throws Exception {
        boolean[] bits = TestUtil.randomBits(getRandom(), 50_000, 0.3);
        var sequence = TestUtil.toSequence(bits);
        var plain = SuccinctBitIndexBuilder.index(sequence);
        var compressed = RRRCompressedBitIndexBuilder.compress(sequence);
        long seed = getRandom().nextLong();

        long[] expected = runQueries(plain, compressed, seed);

        ExecutorService executor = Executors.newFixedThreadPool(NUM_THREADS);
        CyclicBarrier barrier = new CyclicBarrier(NUM_THREADS);
        List<Future<long[]>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < NUM_THREADS; t++) {
                futures.add(executor.submit(() -> {
                    barrier.await();
                    return runQueries(plain, compressed, seed);
                }));
            }
            for (Future<long[]> future : futures) {
                assertArrayEquals(expected, future.get());
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(1, TimeUnit.MINUTES));
        }
    }

    private static long[] runQueries(RankSelectBits plain, RankSelectBits compressed, long seed) {
        Random random = new Random(seed);
        long[] results = new long[QUERIES * 4];
        for (int i = 0; i < QUERIES; i++) {
            long cutoff = (long) (random.nextDouble() * (plain.size() + 1));
            long k = (long) (random.nextDouble() * plain.setBitsCount());
            results[4 * i] = plain.rankSetBits(cutoff);
            results[4 * i + 1] = compressed.rankUnsetBits(cutoff);
            results[4 * i + 2] = plain.selectSetBits(k);
            results[4 * i + 3] = compressed.selectSetBits(k);
        }
        return results;
    }
}
