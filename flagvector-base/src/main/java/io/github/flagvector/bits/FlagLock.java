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

/**
 * A held bit lock of an {@link AtomicFlagVector}, released by {@link #close()}.
 * <pre>{@code
 * try (var held = buckets.lockScoped(bucket)) {
 *     // exclusive access to the bucket
 * }
 * }</pre>
 * Closing more than once unlocks only the first time. A FlagLock is meant to be closed by the
 * thread that acquired it.
 */
public final class FlagLock implements AutoCloseable {
    private final AtomicFlagVector<?> vector;
    private final int index;
    private boolean released;

    FlagLock(AtomicFlagVector<?> vector, int index) {
        this.vector = vector;
        this.index = index;
    }

    /**
     * Returns the index of the locked bit.
     * @return the bit index
     */
    public int index() {
        return index;
    }

    /**
     * Returns whether {@link #close()} has already released the bit.
     * @return {@code true} once released
     */
    public boolean isReleased() {
        return released;
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            vector.unlock(index);
        }
    }

    @Override
    public String toString() {
        return "FlagLock(index=" + index + (released ? ", released" : "") + ")";
    }
}
