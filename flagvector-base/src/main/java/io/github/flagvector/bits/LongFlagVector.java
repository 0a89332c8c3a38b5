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

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Arrays;
import java.util.Objects;

/**
 * An {@link AtomicFlagVector} packing bits into 64-bit words. This is the default word width.
 * <p>
 * Bit {@code i} lives in word {@code i >>> 6} at position {@code i & 63}, so a {@code long[]}
 * produced by {@link #toWords()} (or accepted by {@link #ofWords(long...)}) uses the same
 * little-endian-within-word layout as {@link java.util.BitSet#toLongArray()}.
 */
public final class LongFlagVector extends AtomicFlagVector<LongFlagVector> {
    /** Number of bits in a backing word. */
    public static final int BITS_PER_WORD = Long.SIZE;

    private static final int LOG2_BITS_PER_WORD = 6;
    private static final long[] EMPTY = new long[0];

    // object header + size + reference, plus the array header
    private static final long BASE_RAM_BYTES_USED = 32 + 16;

    private static final VarHandle WORDS = MethodHandles.arrayElementVarHandle(long[].class);

    private long[] words;

    /**
     * Creates an empty vector.
     */
    public LongFlagVector() {
        this(0);
    }

    /**
     * Creates a vector of {@code bitCount} bits, all unset.
     *
     * @param bitCount the number of bits
     * @throws IllegalArgumentException if {@code bitCount} is negative
     */
    public LongFlagVector(int bitCount) {
        super(bitCount);
        this.words = allocate(bitCount);
    }

    private LongFlagVector(long[] words, int bitCount) {
        super(bitCount);
        this.words = words;
    }

    /**
     * Creates a vector holding a copy of the given words. Bit values are taken verbatim and the
     * resulting size is {@code words.length * 64}.
     *
     * @param words pre-packed words
     * @return the new vector
     */
    public static LongFlagVector ofWords(long... words) {
        Objects.requireNonNull(words, "words");
        return ofWords(words, 0, words.length);
    }

    /**
     * Creates a vector holding a copy of {@code words[from, to)}.
     *
     * @param words pre-packed words
     * @param from first word to copy, inclusive
     * @param to last word to copy, exclusive
     * @return the new vector, of size {@code (to - from) * 64}
     * @throws IndexOutOfBoundsException if the range is not within {@code words}
     * @throws IllegalArgumentException if the range holds more than {@link Integer#MAX_VALUE} bits
     */
    public static LongFlagVector ofWords(long[] words, int from, int to) {
        Objects.requireNonNull(words, "words");
        Objects.checkFromToIndex(from, to, words.length);
        int bitCount = bitsFor(to - from, LOG2_BITS_PER_WORD);
        var copy = Arrays.copyOfRange(words, from, to);
        logReallocation(LongFlagVector.class, bitCount, copy.length);
        return new LongFlagVector(copy, bitCount);
    }

    /**
     * Moves the storage of {@code source} into a new vector, leaving {@code source} empty.
     *
     * @param source the vector to move from
     * @return a vector with the original size and bits of {@code source}
     */
    public static LongFlagVector moveOf(LongFlagVector source) {
        var target = new LongFlagVector();
        target.transferFrom(source);
        return target;
    }

    /**
     * Returns the index of the word holding bit {@code i}.
     * @param i a bit index
     * @return {@code i / 64}
     */
    public static int wordIndex(int i) {
        return i >>> LOG2_BITS_PER_WORD;
    }

    /**
     * Returns the single-bit mask selecting bit {@code i} within its word.
     * @param i a bit index
     * @return {@code 1L << (i % 64)}
     */
    public static long bitMask(int i) {
        // shifts only use the low 6 bits of the distance
        return 1L << i;
    }

    @Override
    public int wordCount() {
        return words.length;
    }

    @Override
    public int bitsPerWord() {
        return BITS_PER_WORD;
    }

    @Override
    public boolean get(int i) {
        checkIndex(i);
        long word = (long) WORDS.getAcquire(words, wordIndex(i));
        return (word & bitMask(i)) != 0;
    }

    @Override
    public void set(int i) {
        checkIndex(i);
        WORDS.getAndBitwiseOrRelease(words, wordIndex(i), bitMask(i));
    }

    @Override
    public void unset(int i) {
        checkIndex(i);
        WORDS.getAndBitwiseAndRelease(words, wordIndex(i), ~bitMask(i));
    }

    @Override
    public boolean tryLock(int i) {
        checkIndex(i);
        long[] array = words;
        int wordIndex = wordIndex(i);
        long mask = bitMask(i);
        long oldValue = (long) WORDS.getAcquire(array, wordIndex);
        while ((oldValue & mask) == 0) {
            long witness = (long) WORDS.compareAndExchange(array, wordIndex, oldValue, oldValue | mask);
            if (witness == oldValue) {
                return true;
            }
            // another bit of the word changed, or this one was taken
            oldValue = witness;
        }
        return false;
    }

    @Override
    public void reset(int bitCount) {
        checkBitCount(bitCount);
        words = EMPTY;
        size = bitCount;
        words = allocate(bitCount);
    }

    @Override
    public void swap(LongFlagVector other) {
        if (other == this) {
            return;
        }
        int otherSize = other.size;
        long[] otherWords = other.words;
        other.size = size;
        other.words = words;
        size = otherSize;
        words = otherWords;
    }

    @Override
    public void transferFrom(LongFlagVector source) {
        if (source == this) {
            return;
        }
        size = source.size;
        words = source.words;
        source.size = 0;
        source.words = EMPTY;
    }

    @Override
    public LongFlagVector copy() {
        return new LongFlagVector(toWords(), size);
    }

    /**
     * Returns a snapshot of the backing words, one acquire load per word. Bits past {@link #size()}
     * in the last word are included as stored.
     *
     * @return a new array of {@link #wordCount()} words
     */
    public long[] toWords() {
        long[] array = words;
        long[] snapshot = new long[array.length];
        for (int w = 0; w < array.length; w++) {
            snapshot[w] = (long) WORDS.getAcquire(array, w);
        }
        return snapshot;
    }

    @Override
    public long ramBytesUsed() {
        return BASE_RAM_BYTES_USED + (long) Long.BYTES * words.length;
    }

    private static long[] allocate(int bitCount) {
        int wordCount = wordsFor(bitCount, LOG2_BITS_PER_WORD);
        logReallocation(LongFlagVector.class, bitCount, wordCount);
        return wordCount == 0 ? EMPTY : new long[wordCount];
    }
}
