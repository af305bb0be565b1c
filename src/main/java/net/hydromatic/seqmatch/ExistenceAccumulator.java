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

import java.util.function.BiPredicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Accumulator whose value is whether the walk paired anything.
 *
 * <p>The value becomes true as soon as a corresponding pair is folded in, and
 * stays true. {@link SequenceMatcher#matches} seeds it with true when both
 * sequences are empty, because the empty walk is a match.
 *
 * @param <D> Destination item type
 * @param <S> Source item type
 */
public final class ExistenceAccumulator<D, S>
    extends PredicateAccumulator<D, S, Boolean, ExistenceAccumulator<D, S>> {
  private final boolean value;

  private ExistenceAccumulator(
      BiPredicate<? super D, ? super S> destMatchesSrc, boolean value) {
    super(destMatchesSrc);
    this.value = value;
  }

  /** Creates an accumulator whose value is initially false. */
  public static <D, S> ExistenceAccumulator<D, S> create(
      BiPredicate<? super D, ? super S> destMatchesSrc) {
    return new ExistenceAccumulator<>(destMatchesSrc, false);
  }

  /** Creates an accumulator with a given initial value. */
  public static <D, S> ExistenceAccumulator<D, S> create(
      BiPredicate<? super D, ? super S> destMatchesSrc, boolean value) {
    return new ExistenceAccumulator<>(destMatchesSrc, value);
  }

  @Override
  public Boolean value() {
    return value;
  }

  /**
   * {@inheritDoc}
   *
   * <p>The engine folds a pair after it has counted the pairing, so an item
   * that matches once has no more matches by then; therefore this method
   * tests {@link #compatible} rather than {@link #matches}.
   */
  @Override
  public ExistenceAccumulator<D, S> accumulate(
      @Nullable MatchTracker<D> dest, @Nullable MatchTracker<S> src) {
    if (value || !compatible(dest, src)) {
      return copy();
    }
    return new ExistenceAccumulator<>(destMatchesSrc, true);
  }

  @Override
  public ExistenceAccumulator<D, S> copy() {
    return new ExistenceAccumulator<>(destMatchesSrc, value);
  }

  @Override
  public String toString() {
    return Boolean.toString(value);
  }
}

// End ExistenceAccumulator.java
