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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestWordArithmetic {
    @Test
    public void testWordsFor() {
        assertEquals(0, AtomicFlagVector.wordsFor(0, 6));
        assertEquals(1, AtomicFlagVector.wordsFor(1, 6));
        assertEquals(1, AtomicFlagVector.wordsFor(64, 6));
        assertEquals(2, AtomicFlagVector.wordsFor(65, 6));
        assertEquals(3, AtomicFlagVector.wordsFor(130, 6));
        assertEquals(5, AtomicFlagVector.wordsFor(130, 5));
        assertEquals(1 << 25, AtomicFlagVector.wordsFor(Integer.MAX_VALUE, 6));
        assertEquals(1 << 26, AtomicFlagVector.wordsFor(Integer.MAX_VALUE, 5));
    }

    @Test
    public void testBitsFor() {
        assertEquals(0, AtomicFlagVector.bitsFor(0, 6));
        assertEquals(192, AtomicFlagVector.bitsFor(3, 6));
        assertEquals(96, AtomicFlagVector.bitsFor(3, 5));
        assertEquals(Integer.MAX_VALUE - 63, AtomicFlagVector.bitsFor(Integer.MAX_VALUE >>> 6, 6));
        assertThrows(IllegalArgumentException.class, () -> AtomicFlagVector.bitsFor((Integer.MAX_VALUE >>> 6) + 1, 6));
        assertThrows(IllegalArgumentException.class, () -> AtomicFlagVector.bitsFor(1 << 26, 5));
    }

    @Test
    public void testSpinHintDefault() {
        if (System.getProperty("flagvector.lock.spin_hint") == null) {
            assertTrue(AtomicFlagVector.SPIN_HINT);
        }
    }
}
