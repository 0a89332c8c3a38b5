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

import io.github.flagvector.annotations.VisibleForTesting;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A fixed-capacity vector of single-bit flags that may be read, set, cleared and locked
 * concurrently by any number of threads without a mutex.
 * <p>
 * Bits are packed into machine words. A bit index maps to a word by division and to a position
 * inside that word by remainder, and every per-bit operation acts on exactly one word through a
 * single atomic primitive (a load, a bitwise read-modify-write, or a compare-and-exchange loop).
 * Subclasses fix the word width; see {@link LongFlagVector} and {@link IntFlagVector}.
 * <p>
 * The same bit doubles as a spin lock: 1 means locked, 0 means unlocked. {@link #tryLock(int)}
 * transitions a bit from 0 to 1 atomically, {@link #lock(int)} spins until it does, and
 * {@link #unlock(int)} clears it. The lock is unfair, unchecked and not reentrant.
 * <p>
 * Memory ordering: {@link #set(int)} and {@link #unlock(int)} have release semantics, while
 * {@link #get(int)} and a successful {@link #tryLock(int)} have acquire semantics. Writes made by a
 * thread before it sets (or locks) bit {@code i} are therefore visible to any thread that later
 * observes bit {@code i} as set. Nothing is ordered across different bits beyond that.
 * <p>
 * Every per-bit operation throws {@link IndexOutOfBoundsException} for an index outside
 * {@code [0, size())}. Structural operations ({@link #reset(int)}, {@link #swap}, {@link #transferFrom})
 * are not thread-safe: the caller must guarantee that no other thread is using either vector, and
 * must publish the vector safely afterwards.
 *
 * @param <V> the concrete vector type, so that storage is only exchanged between vectors of one word width
 */
public abstract class AtomicFlagVector<V extends AtomicFlagVector<V>> implements Bits, Accountable {
    private static final Logger LOG = Logger.getLogger(AtomicFlagVector.class.getName());

    /**
     * Whether {@link #lock(int)} issues {@link Thread#onSpinWait()} between failed attempts,
     * configurable via the flagvector.lock.spin_hint system property
     */
    @VisibleForTesting
    static final boolean SPIN_HINT = Boolean.parseBoolean(System.getProperty("flagvector.lock.spin_hint", "true"));

    static {
        LOG.log(Level.CONFIG, "flagvector.lock.spin_hint={0}", SPIN_HINT);
    }

    /** Number of addressable bits. */
    protected int size;

    /**
     * Creates a vector of the given logical size. Storage is owned by the subclass.
     * @param size the number of addressable bits
     */
    protected AtomicFlagVector(int size) {
        this.size = checkBitCount(size);
    }

    /**
     * Returns the number of addressable bits.
     * @return the number of bits in this vector
     */
    public final int size() {
        return size;
    }

    /**
     * Returns the number of words backing this vector.
     * @return the word count, {@code ceil(size() / bitsPerWord())}
     */
    public abstract int wordCount();

    /**
     * Returns the width in bits of a backing word.
     * @return 32 or 64
     */
    public abstract int bitsPerWord();

    /**
     * Returns whether bit {@code i} is set, using a single acquire load of its word.
     *
     * @param i the bit index
     * @return {@code true} if the bit is set (or locked)
     * @throws IndexOutOfBoundsException if {@code i} is not in {@code [0, size())}
     */
    @Override
    public abstract boolean get(int i);

    /**
     * Sets bit {@code i} to 1 with release semantics. Idempotent.
     *
     * @param i the bit index
     * @throws IndexOutOfBoundsException if {@code i} is not in {@code [0, size())}
     */
    public abstract void set(int i);

    /**
     * Sets bit {@code i} to 0 with release semantics. Idempotent.
     *
     * @param i the bit index
     * @throws IndexOutOfBoundsException if {@code i} is not in {@code [0, size())}
     */
    public abstract void unset(int i);

    /**
     * Attempts to transition bit {@code i} from 0 to 1.
     * <p>
     * Changes to other bits of the same word do not make this fail; only observing bit {@code i}
     * itself already set does.
     *
     * @param i the bit index
     * @return {@code true} iff this call set the bit
     * @throws IndexOutOfBoundsException if {@code i} is not in {@code [0, size())}
     */
    public abstract boolean tryLock(int i);

    /**
     * Spins until this thread locks bit {@code i}. There is no timeout, backoff or fairness;
     * callers that need a bounded wait should poll {@link #tryLock(int)} themselves.
     *
     * @param i the bit index
     * @throws IndexOutOfBoundsException if {@code i} is not in {@code [0, size())}
     */
    public void lock(int i) {
        while (!tryLock(i)) {
            if (SPIN_HINT) {
                Thread.onSpinWait();
            }
        }
    }

    /**
     * Unlocks bit {@code i}. Equivalent to {@link #unset(int)}; whether the caller held the lock
     * is not checked.
     *
     * @param i the bit index
     * @throws IndexOutOfBoundsException if {@code i} is not in {@code [0, size())}
     */
    public void unlock(int i) {
        unset(i);
    }

    /**
     * Locks bit {@code i} and returns a handle that unlocks it on close, for use in
     * try-with-resources blocks.
     *
     * @param i the bit index
     * @return the held lock
     */
    public FlagLock lockScoped(int i) {
        lock(i);
        return new FlagLock(this, i);
    }

    /**
     * Like {@link #lockScoped(int)}, but gives up immediately if the bit is held.
     *
     * @param i the bit index
     * @return the held lock, or {@code null} if bit {@code i} was already set
     */
    public FlagLock tryLockScoped(int i) {
        return tryLock(i) ? new FlagLock(this, i) : null;
    }

    /**
     * Discards the current storage and reallocates room for {@code bitCount} bits, all zero.
     * Not thread-safe.
     *
     * @param bitCount the new number of bits
     * @throws IllegalArgumentException if {@code bitCount} is negative
     */
    public abstract void reset(int bitCount);

    /**
     * Exchanges size and storage with {@code other} in constant time. Not thread-safe.
     *
     * @param other the vector to swap with
     */
    public abstract void swap(V other);

    /**
     * Takes over the size and storage of {@code source} in constant time, leaving {@code source}
     * with size 0 and no words. Any storage this vector held is released. Not thread-safe.
     *
     * @param source the vector to move from
     */
    public abstract void transferFrom(V source);

    /**
     * Returns an independent copy of this vector. Each word is read with one acquire load, but no
     * consistency is guaranteed across words while other threads are writing.
     *
     * @return the copy
     */
    public abstract V copy();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(size=" + size + ", words=" + wordCount() + ")";
    }

    /**
     * Checks that {@code i} is a valid bit index.
     * @param i the bit index
     * @return {@code i}
     */
    protected final int checkIndex(int i) {
        return Objects.checkIndex(i, size);
    }

    static int checkBitCount(int bitCount) {
        if (bitCount < 0) {
            throw new IllegalArgumentException("bit count must be non-negative: " + bitCount);
        }
        return bitCount;
    }

    /**
     * Number of words of width {@code 1 << log2BitsPerWord} needed to hold {@code bitCount} bits.
     */
    @VisibleForTesting
    static int wordsFor(int bitCount, int log2BitsPerWord) {
        return bitCount == 0 ? 0 : ((bitCount - 1) >>> log2BitsPerWord) + 1;
    }

    /**
     * Logical size of a vector built from {@code wordCount} words.
     */
    @VisibleForTesting
    static int bitsFor(int wordCount, int log2BitsPerWord) {
        if (wordCount > (Integer.MAX_VALUE >>> log2BitsPerWord)) {
            throw new IllegalArgumentException(wordCount + " words of " + (1 << log2BitsPerWord)
                                               + " bits exceed the maximum vector size of " + Integer.MAX_VALUE + " bits");
        }
        return wordCount << log2BitsPerWord;
    }

    static void logReallocation(Class<?> type, int bitCount, int wordCount) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("%s: allocated %d words for %d bits", type.getSimpleName(), wordCount, bitCount));
        }
    }
}
