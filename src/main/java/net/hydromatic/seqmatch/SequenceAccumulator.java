/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.seqmatch;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Strategy that decides whether a destination item and a source item
 * correspond, and folds each corresponding pair into a result.
 *
 * <p>A null tracker means "absent": {@code (dest, null)} is a destination
 * item that corresponds to zero source items, {@code (null, src)} the
 * reverse, and {@code (null, null)} the end of both sequences.
 *
 * <p>Implementations must be persistent: {@link #accumulate} and {@link
 * #copy} return a new accumulator and leave {@code this} unchanged. {@link
 * SequenceMatcher} relies on this when it explores several branches from the
 * same state; it never undoes anything.
 *
 * @param <D> Destination item type
 * @param <S> Source item type
 * @param <V> Type of the accumulated value
 * @param <A> Concrete accumulator type
 */
public interface SequenceAccumulator<
    D, S, V, A extends SequenceAccumulator<D, S, V, A>> {
  /** Returns the value accumulated so far. */
  V value();

  /**
   * Returns whether a destination item and a source item (either of which may
   * be absent) can be paired. Must not have side effects.
   */
  boolean matches(
      @Nullable MatchTracker<D> dest, @Nullable MatchTracker<S> src);

  /** Returns an accumulator that has folded in a pair. */
  A accumulate(@Nullable MatchTracker<D> dest, @Nullable MatchTracker<S> src);

  /** Returns a copy of this accumulator. */
  A copy();

  /**
   * Returns the part of this accumulator's state that {@link #matches} reads.
   *
   * <p>Used as part of the key when {@link SequenceMatcher} memoizes rejected
   * states. The default, a constant, is correct if {@code matches} does not
   * depend on {@link #value()}.
   */
  default Object matchState() {
    return "";
  }
}

// End SequenceAccumulator.java
