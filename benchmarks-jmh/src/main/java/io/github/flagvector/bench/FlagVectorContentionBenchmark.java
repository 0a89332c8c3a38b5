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
package io.github.flagvector.bench;

import io.github.flagvector.bits.LongFlagVector;
import org.openjdk.jmh.annotations.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Benchmark of bit operations under multi-threaded contention.
 * <p>
 * With {@code layout=SAME_WORD} every thread works on its own bit but all those bits share one
 * word, so each compare-and-exchange competes with unrelated bits. {@code SPREAD} gives every
 * thread a word of its own, and {@code SAME_BIT} makes all threads fight over a single lock.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1)
@Warmup(iterations = 2)
@Measurement(iterations = 3)
@Threads(4)
public class FlagVectorContentionBenchmark {
    private static final Logger log = LoggerFactory.getLogger(FlagVectorContentionBenchmark.class);

    /** How the bits used by different threads are placed in the vector. */
    public enum Layout { SAME_WORD, SPREAD, SAME_BIT }

    /**
     * Creates a new benchmark instance.
     * <p>
     * This constructor is invoked by JMH and should not be called directly.
     */
    public FlagVectorContentionBenchmark() {
    }

    /** Number of bits in the vector. */
    @Param({"4096", "1048576"})
    private int size;

    @Param({"SAME_WORD", "SPREAD", "SAME_BIT"})
    private Layout layout;

    private LongFlagVector flags;
    private final AtomicInteger threadIds = new AtomicInteger();

    /**
     * Allocates the vector shared by all benchmark threads.
     */
    @Setup(Level.Trial)
    public void setup() {
        flags = new LongFlagVector(size);
        threadIds.set(0);
        log.info("Benchmarking {} with layout {} ({} bytes)", flags, layout, flags.ramBytesUsed());
    }

    /**
     * The bit a benchmark thread works on, chosen once per thread according to the layout.
     */
    @State(Scope.Thread)
    public static class ThreadBit {
        int index;

        /**
         * Creates a new thread state; invoked by JMH.
         */
        public ThreadBit() {
        }

        /**
         * Picks this thread's bit.
         * @param bench the shared benchmark state
         */
        @Setup(Level.Trial)
        public void setup(FlagVectorContentionBenchmark bench) {
            int threadId = bench.threadIds.getAndIncrement();
            switch (bench.layout) {
                case SAME_WORD:
                    index = threadId % LongFlagVector.BITS_PER_WORD;
                    break;
                case SPREAD:
                    // a cache line of words apart
                    index = (threadId * 8 * LongFlagVector.BITS_PER_WORD) % bench.size;
                    break;
                default:
                    index = 0;
            }
        }
    }

    @Benchmark
    public boolean setThenGet(ThreadBit bit) {
        flags.set(bit.index);
        boolean set = flags.get(bit.index);
        flags.unset(bit.index);
        return set;
    }

    @Benchmark
    public void lockUnlock(ThreadBit bit) {
        flags.lock(bit.index);
        flags.unlock(bit.index);
    }

    @Benchmark
    public boolean tryLockUnlock(ThreadBit bit) {
        boolean locked = flags.tryLock(bit.index);
        if (locked) {
            flags.unlock(bit.index);
        }
        return locked;
    }
}
