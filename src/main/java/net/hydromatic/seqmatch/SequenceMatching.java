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

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entry points for matching sequences of quantified items, using the default
 * {@link SequenceMatcher}.
 */
public class SequenceMatching {
  private SequenceMatching() {}

  /**
   * Returns whether two sequences can be aligned so that every pair of
   * corresponding items satisfies a predicate.
   *
   * @see SequenceMatcher#matches
   */
  public static <D, S> boolean matches(
      List<QuantifiedItem<D>> destSequence,
      List<QuantifiedItem<S>> srcSequence,
      BiPredicate<? super D, ? super S> destMatchesSrc) {
    return SequenceMatcher.create()
        .matches(destSequence, srcSequence, destMatchesSrc);
  }

  /**
   * Aligns two sequences and returns the source items corresponding to each
   * destination item.
   *
   * @see SequenceMatcher#matchGroups
   */
  public static <D, S> Optional<List<DestItemMatches<D, S>>> matchGroups(
      List<QuantifiedItem<D>> destSequence,
      List<QuantifiedItem<S>> srcSequence,
      BiPredicate<? super D, ? super S> destMatchesSrc) {
    return SequenceMatcher.create()
        .matchGroups(destSequence, srcSequence, destMatchesSrc);
  }

  /**
   * Aligns two sequences and returns the items they have in common.
   *
   * @see SequenceMatcher#commonSequence
   */
  public static <D, S, C> Optional<List<QuantifiedItem<C>>> commonSequence(
      List<QuantifiedItem<D>> destSequence,
      List<QuantifiedItem<S>> srcSequence,
      BiFunction<
              @Nullable QuantifiedItem<D>,
              @Nullable QuantifiedItem<S>,
              @Nullable QuantifiedItem<C>>
          getCommon) {
    return SequenceMatcher.create()
        .commonSequence(destSequence, srcSequence, getCommon);
  }

  /**
   * Returns a predicate that remembers the result of a given predicate for
   * each pair of arguments.
   *
   * <p>The search may test the same pair many times along different paths; if
   * the predicate is expensive (for example, a test of whether one type is
   * assignable to another), wrap it with this method. The cache lives as long
   * as the returned predicate and is not thread-safe.
   */
  public static <D, S> BiPredicate<D, S> memoize(
      BiPredicate<? super D, ? super S> predicate) {
    requireNonNull(predicate);
    final Table<D, S, Boolean> cache = HashBasedTable.create();
    return (dest, src) -> {
      Boolean b = cache.get(dest, src);
      if (b == null) {
        b = predicate.test(dest, src);
        cache.put(dest, src, b);
      }
      return b;
    };
  }
}

// End SequenceMatching.java
