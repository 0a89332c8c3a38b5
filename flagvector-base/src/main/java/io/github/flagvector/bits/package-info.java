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

/**
 * Lock-free vectors of single-bit flags.
 * <p>
 * {@link io.github.flagvector.bits.AtomicFlagVector} packs bits into machine words and updates
 * each bit with a single atomic operation on its word, so that any number of threads may read,
 * set, clear, and lock individual bits concurrently. Two word widths are provided:
 * <ul>
 *   <li>{@link io.github.flagvector.bits.LongFlagVector} - 64-bit words, the default</li>
 *   <li>{@link io.github.flagvector.bits.IntFlagVector} - 32-bit words</li>
 * </ul>
 * A bit used as a lock costs one bit of memory, which makes a flag vector suitable for guarding
 * millions of small elements (graph nodes, hash buckets) where an object lock per element would
 * not be affordable.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * LongFlagVector visited = new LongFlagVector(nodeCount);
 * // any thread
 * if (visited.tryLock(node)) {
 *     // first visitor of node
 * }
 *
 * LongFlagVector bucketLocks = new LongFlagVector(bucketCount);
 * try (var held = bucketLocks.lockScoped(bucket)) {
 *     buckets[bucket].add(entry);
 * }
 * }</pre>
 *
 * <p>Structural changes ({@code reset}, {@code swap}, {@code transferFrom}) are not thread-safe
 * and must only happen while a single thread owns the vector.
 */
package io.github.flagvector.bits;
