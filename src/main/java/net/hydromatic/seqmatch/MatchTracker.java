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

import java.util.function.Function;

/**
 * Progress of one walk over a {@link QuantifiedItem}: how many elements of
 * the other sequence the item has been paired with so far.
 *
 * <p>Immutable. {@link #matched()} returns a new tracker; the engine never
 * changes a tracker in place, so a tracker can be shared by sibling branches
 * of the search.
 *
 * @param <T> Item type
 */
public final class MatchTracker<T> {
  public final QuantifiedItem<T> quantifiedItem;
  public final int matchesCounter;

  private MatchTracker(QuantifiedItem<T> quantifiedItem, int matchesCounter) {
    this.quantifiedItem = requireNonNull(quantifiedItem);
    this.matchesCounter = matchesCounter;
  }

  /** Creates a tracker that has not matched anything yet. */
  public static <T> MatchTracker<T> of(QuantifiedItem<T> quantifiedItem) {
    return new MatchTracker<>(quantifiedItem, 0);
  }

  /** Returns the wrapped value. */
  public T item() {
    return quantifiedItem.item;
  }

  /** Returns whether the item may be paired at least once more. */
  public boolean hasMoreMatches() {
    return quantifiedItem.maxMatches == null
        || matchesCounter < quantifiedItem.maxMatches;
  }

  /** Returns whether the item may be paired with zero elements. */
  public boolean isSkippable() {
    return quantifiedItem.isSkippable();
  }

  /** Returns whether the item has been paired at least its minimum. */
  public boolean isSatisfied() {
    return matchesCounter >= quantifiedItem.minMatches;
  }

  /** Returns a tracker that has been paired once more than this. */
  public MatchTracker<T> matched() {
    return new MatchTracker<>(quantifiedItem, matchesCounter + 1);
  }

  @Override
  public String toString() {
    return describe(String::valueOf);
  }

  /**
   * Renders this tracker; for example "x*.[2]" is an item "x*" that has been
   * paired twice. The counter is omitted for items that match at most once.
   */
  public String describe(Function<? super T, String> toStr) {
    final StringBuilder buf =
        quantifiedItem.describeTo(new StringBuilder(), toStr);
    final Integer maxMatches = quantifiedItem.maxMatches;
    if (maxMatches == null || maxMatches > 1) {
      buf.append(".[").append(matchesCounter).append(']');
    }
    return buf.toString();
  }
}

// End MatchTracker.java
