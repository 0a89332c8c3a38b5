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
 * Read-only access to a sequence of bits.
 * <p>
 * Lets code that only tests membership accept an {@link AtomicFlagVector} without being able to
 * set or lock its bits, or a constant stand-in when every (or no) element should match.
 */
public interface Bits {
    /** A Bits instance where all bits are set. */
    Bits ALL = new MatchAllBits();

    /** A Bits instance where no bits are set. */
    Bits NONE = new MatchNoBits();

    /**
     * Returns the value of the bit with the specified <code>index</code>.
     *
     * @param index the bit index
     * @return <code>true</code> if the bit is set, <code>false</code> otherwise.
     */
    boolean get(int index);

    /**
     * A Bits implementation where all bits are set.
     */
    class MatchAllBits implements Bits {
        /** Creates a MatchAllBits instance. */
        public MatchAllBits() {}

        @Override
        public boolean get(int index) {
            return true;
        }
    }

    /**
     * A Bits implementation where no bits are set.
     */
    class MatchNoBits implements Bits {
        /** Creates a MatchNoBits instance. */
        public MatchNoBits() {}

        @Override
        public boolean get(int index) {
            return false;
        }
    }
}
