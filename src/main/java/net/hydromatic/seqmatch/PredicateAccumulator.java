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

import static java.util.Objects.requireNonNull;

import java.util.function.BiPredicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Accumulator whose notion of correspondence is a predicate on the values of
 * a destination item and a source item.
 *
 * @param <D> Destination item type
 * @param <S> Source item type
 * @param <V> Type of the accumulated value
 * @param <A> Concrete accumulator type
 */
public abstract class PredicateAccumulator<
        D, S, V, A extends PredicateAccumulator<D, S, V, A>>
    implements SequenceAccumulator<D, S, V, A> {
  protected final BiPredicate<? super D, ? super S> destMatchesSrc;

  protected PredicateAccumulator(
      BiPredicate<? super D, ? super S> destMatchesSrc) {
    this.destMatchesSrc = requireNonNull(destMatchesSrc);
  }

  /**
   * {@inheritDoc}
   *
   * <p>Two present items match if both may be paired again and the predicate
   * holds for their values. An item matches absence if it is skippable. The
   * end of both sequences matches.
   */
  @Override
  public boolean matches(
      @Nullable MatchTracker<D> dest, @Nullable MatchTracker<S> src) {
    if (dest != null && src != null) {
      return dest.hasMoreMatches()
          && src.hasMoreMatches()
          && destMatchesSrc.test(dest.item(), src.item());
    }
    return compatible(dest, src);
  }

  /**
   * Returns whether two items may correspond, ignoring how many times they
   * have been paired so far.
   */
  protected boolean compatible(
      @Nullable MatchTracker<D> dest, @Nullable MatchTracker<S> src) {
    if (dest == null) {
      return src == null || src.isSkippable();
    }
    if (src == null) {
      return dest.isSkippable();
    }
    return destMatchesSrc.test(dest.item(), src.item());
  }
}

// End PredicateAccumulator.java
