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
 * An {@link AtomicFlagVector} packing bits into 32-bit words.
 * <p>
 * Narrower words halve the number of logically unrelated bits that contend on the same
 * compare-and-exchange, at the price of twice as many words for the same size.
 */
public final class IntFlagVector extends AtomicFlagVector<IntFlagVector> {
    /** Number of bits in a backing word. */
    public static final int BITS_PER_WORD = Integer.SIZE;

    private static final int LOG2_BITS_PER_WORD = 5;
    private static final int[] EMPTY = new int[0];
    private static final long BASE_RAM_BYTES_USED = 32 + 16;

    private static final VarHandle WORDS = MethodHandles.arrayElementVarHandle(int[].class);

    private int[] words;

    /**
     * Creates an empty vector.
     */
    public IntFlagVector() {
        this(0);
    }

    /**
     * Creates a vector of {@code bitCount} bits, all unset.
     *
     * @param bitCount the number of bits
     * @throws IllegalArgumentException if {@code bitCount} is negative
     */
    public IntFlagVector(int bitCount) {
        super(bitCount);
        this.words = allocate(bitCount);
    }

    private IntFlagVector(int[] words, int bitCount) {
        super(bitCount);
        this.words = words;
    }

    /**
     * Creates a vector holding a copy of the given words, of size {@code words.length * 32}.
     *
     * @param words pre-packed words
     * @return the new vector
     */
    public static IntFlagVector ofWords(int... words) {
        Objects.requireNonNull(words, "words");
        return ofWords(words, 0, words.length);
    }

    /**
     * Creates a vector holding a copy of {@code words[from, to)}.
     *
     * @param words pre-packed words
     * @param from first word to copy, inclusive
     * @param to last word to copy, exclusive
     * @return the new vector, of size {@code (to - from) * 32}
     * @throws IndexOutOfBoundsException if the range is not within {@code words}
     * @throws IllegalArgumentException if the range holds more than {@link Integer#MAX_VALUE} bits
     */
    public static IntFlagVector ofWords(int[] words, int from, int to) {
        Objects.requireNonNull(words, "words");
        Objects.checkFromToIndex(from, to, words.length);
        int bitCount = bitsFor(to - from, LOG2_BITS_PER_WORD);
        var copy = Arrays.copyOfRange(words, from, to);
        logReallocation(IntFlagVector.class, bitCount, copy.length);
        return new IntFlagVector(copy, bitCount);
    }

    /**
     * Moves the storage of {@code source} into a new vector, leaving {@code source} empty.
     *
     * @param source the vector to move from
     * @return a vector with the original size and bits of {@code source}
     */
    public static IntFlagVector moveOf(IntFlagVector source) {
        var target = new IntFlagVector();
        target.transferFrom(source);
        return target;
    }

    /**
     * @param i a bit index
     * @return {@code i / 32}
     */
    public static int wordIndex(int i) {
        return i >>> LOG2_BITS_PER_WORD;
    }

    /**
     * @param i a bit index
     * @return {@code 1 << (i % 32)}
     */
    public static int bitMask(int i) {
        return 1 << i;
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
        int word = (int) WORDS.getAcquire(words, wordIndex(i));
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
        int[] array = words;
        int wordIndex = wordIndex(i);
        int mask = bitMask(i);
        int oldValue = (int) WORDS.getAcquire(array, wordIndex);
        while ((oldValue & mask) == 0) {
            int witness = (int) WORDS.compareAndExchange(array, wordIndex, oldValue, oldValue | mask);
            if (witness == oldValue) {
                return true;
            }
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
    public void swap(IntFlagVector other) {
        if (other == this) {
            return;
        }
        int otherSize = other.size;
        int[] otherWords = other.words;
        other.size = size;
        other.words = words;
        size = otherSize;
        words = otherWords;
    }

    @Override
    public void transferFrom(IntFlagVector source) {
        if (source == this) {
            return;
        }
        size = source.size;
        words = source.words;
        source.size = 0;
        source.words = EMPTY;
    }

    @Override
    public IntFlagVector copy() {
        return new IntFlagVector(toWords(), size);
    }

    /**
     * Returns a snapshot of the backing words, one acquire load per word.
     *
     * @return a new array of {@link #wordCount()} words
     */
    public int[] toWords() {
        int[] array = words;
        int[] snapshot = new int[array.length];
        for (int w = 0; w < array.length; w++) {
            snapshot[w] = (int) WORDS.getAcquire(array, w);
        }
        return snapshot;
    }

    @Override
    public long ramBytesUsed() {
        return BASE_RAM_BYTES_USED + (long) Integer.BYTES * words.length;
    }

    private static int[] allocate(int bitCount) {
        int wordCount = wordsFor(bitCount, LOG2_BITS_PER_WORD);
        logReallocation(IntFlagVector.class, bitCount, wordCount);
        return wordCount == 0 ? EMPTY : new int[wordCount];
    }
}
