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

package io.github.flagvector.bits;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.logging.Logger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Tests the flag vectors when many threads read, write and lock bits of the same words.
 */
@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestFlagVectorConcurrency extends RandomizedTest {
    private static final Logger LOG = Logger.getLogger(TestFlagVectorConcurrency.class.getName());

    /** Thread count for the stress tests, configurable via tests.flagvector.threads */
    private static final int NUM_THREADS = Integer.getInteger("tests.flagvector.threads", Math.max(4, Runtime.getRuntime().availableProcessors()));

    private ExecutorService executor;

    @Before
    public void setUp() {
        executor = Executors.newFixedThreadPool(NUM_THREADS);
    }

    @After
    public void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(10, TimeUnit.SECONDS);
    }

    /**
     * Runs {@code task} on every pool thread at once, released together by a barrier, and rethrows
     * the first failure.
     */
    private void runConcurrently(ThreadTask task) throws Exception {
        CyclicBarrier barrier = new CyclicBarrier(NUM_THREADS);
        List<Future<?>> futures = new ArrayList<>();
        long seed = getRandom().nextLong();
        for (int t = 0; t < NUM_THREADS; t++) {
            final int threadId = t;
            futures.add(executor.submit(() -> {
                Random random = new Random(seed + threadId);
                barrier.await();
                task.run(threadId, random);
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get();
        }
    }

    @FunctionalInterface
    private interface ThreadTask {
        void run(int threadId, Random random) throws Exception;
    }

    @Test
    public void testExactlyOneTryLockWins() throws Exception {
        int size = 1024;
        var flags = new LongFlagVector(size);
        var winners = new AtomicIntegerArray(size);

        runConcurrently((threadId, random) -> {
            // every thread visits every bit once, from a different starting point
            int start = random.nextInt(size);
            for (int k = 0; k < size; k++) {
                int i = (start + k) % size;
                if (flags.tryLock(i)) {
                    winners.incrementAndGet(i);
                }
            }
        });

        for (int i = 0; i < size; i++) {
            assertEquals("bit " + i, 1, winners.get(i));
            assertTrue(flags.get(i));
        }
    }

    @Test
    public void testBitsOfASharedWordAreIndependent() throws Exception {
        assertBitIndependence(new LongFlagVector(64 * 2));
        assertBitIndependence(new IntFlagVector(32 * 3));
    }

    /**
     * Each thread owns the bits congruent to its id modulo the thread count, so every word is shared
     * by all threads. A thread mutating its own bits must always read back exactly what it wrote.
     */
    private void assertBitIndependence(AtomicFlagVector<?> flags) throws Exception {
        int iterations = 20_000;
        AtomicInteger errors = new AtomicInteger();

        runConcurrently((threadId, random) -> {
            int owned = (flags.size() - threadId + NUM_THREADS - 1) / NUM_THREADS;
            if (owned <= 0) {
                return;
            }
            boolean[] expected = new boolean[flags.size()];
            for (int n = 0; n < iterations; n++) {
                int i = threadId + NUM_THREADS * random.nextInt(owned);
                switch (random.nextInt(4)) {
                    case 0:
                        flags.set(i);
                        expected[i] = true;
                        break;
                    case 1:
                        flags.unset(i);
                        expected[i] = false;
                        break;
                    case 2:
                        if (flags.tryLock(i) == expected[i]) {
                            errors.incrementAndGet();
                        }
                        expected[i] = true;
                        break;
                    default:
                        flags.unlock(i);
                        expected[i] = false;
                        break;
                }
                if (flags.get(i) != expected[i]) {
                    errors.incrementAndGet();
                }
            }
            for (int i = threadId; i < flags.size(); i += NUM_THREADS) {
                if (flags.get(i) != expected[i]) {
                    errors.incrementAndGet();
                }
            }
        });

        assertEquals("Expected no interference between bits of " + flags, 0, errors.get());
    }

    @Test
    public void testLockGivesMutualExclusion() throws Exception {
        int buckets = 4;
        int iterations = 10_000;
        var locks = new LongFlagVector(buckets);
        long[] counters = new long[buckets]; // plain fields, guarded by the bit locks
        var increments = new AtomicLongArray(buckets);

        runConcurrently((threadId, random) -> {
            for (int n = 0; n < iterations; n++) {
                int b = random.nextInt(buckets);
                locks.lock(b);
                try {
                    counters[b]++;
                } finally {
                    locks.unlock(b);
                }
                increments.incrementAndGet(b);
            }
        });

        long total = 0;
        for (int b = 0; b < buckets; b++) {
            assertEquals("bucket " + b, increments.get(b), counters[b]);
            assertFalse(locks.get(b));
            total += counters[b];
        }
        assertEquals((long) NUM_THREADS * iterations, total);
    }

    @Test
    public void testScopedLockGivesMutualExclusion() throws Exception {
        int iterations = 5_000;
        var locks = new IntFlagVector(33);
        int[] counter = new int[1];

        runConcurrently((threadId, random) -> {
            for (int n = 0; n < iterations; n++) {
                try (var held = locks.lockScoped(32)) {
                    counter[0]++;
                }
            }
        });

        assertEquals(NUM_THREADS * iterations, counter[0]);
    }

    @Test
    public void testSetPublishesPriorWrites() throws Exception {
        int size = 50_000;
        int[] payload = new int[size];
        var ready = new LongFlagVector(size);
        AtomicInteger errors = new AtomicInteger();

        runConcurrently((threadId, random) -> {
            if (threadId == 0) {
                for (int i = 0; i < size; i++) {
                    payload[i] = i * 31 + 7;
                    ready.set(i);
                }
            } else {
                for (int i = 0; i < size; i++) {
                    while (!ready.get(i)) {
                        Thread.onSpinWait();
                    }
                    if (payload[i] != i * 31 + 7) {
                        errors.incrementAndGet();
                    }
                }
            }
        });

        assertEquals(0, errors.get());
    }

    @Test
    public void testLockWaitsForUnlock() throws Exception {
        var flags = new LongFlagVector(10);
        flags.lock(5);
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean acquired = new AtomicBoolean();

        Future<?> waiter = executor.submit(() -> {
            started.countDown();
            flags.lock(5);
            acquired.set(true);
            flags.unlock(5);
        });

        started.await();
        Thread.sleep(50);
        assertFalse("lock must not be acquired while held", acquired.get());
        // neighbours of a held bit stay usable
        assertTrue(flags.tryLock(4));
        assertTrue(flags.tryLock(6));

        flags.unlock(5);
        waiter.get(10, TimeUnit.SECONDS);
        assertTrue(acquired.get());
        assertFalse(flags.get(5));
    }

    @Test
    public void testBoundedWaitByPollingTryLock() throws Exception {
        var flags = new LongFlagVector(1);
        flags.lock(0);

        Future<Boolean> attempt = executor.submit(() -> tryLockWithin(flags, 0, 20, TimeUnit.MILLISECONDS));
        assertFalse(attempt.get(10, TimeUnit.SECONDS));

        flags.unlock(0);
        attempt = executor.submit(() -> tryLockWithin(flags, 0, 10, TimeUnit.SECONDS));
        assertTrue(attempt.get(10, TimeUnit.SECONDS));
        assertTrue(flags.get(0));
    }

    private static boolean tryLockWithin(AtomicFlagVector<?> flags, int i, long timeout, TimeUnit unit) {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (!flags.tryLock(i)) {
            if (System.nanoTime() - deadline > 0) {
                LOG.fine("gave up waiting for bit " + i);
                return false;
            }
            Thread.onSpinWait();
        }
        return true;
    }
}
