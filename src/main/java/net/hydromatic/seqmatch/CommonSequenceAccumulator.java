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
import static net.hydromatic.seqmatch.util.Static.last;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.BiFunction;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Accumulator that builds the sequence of items common to two sequences.
 *
 * <p>A caller-supplied function computes the common item of each pair (or
 * returns null if there is none, in which case the pair does not match).
 * Consecutive equal common items that are repeated are emitted once; for
 * example, {@code [int, int, int]} against {@code [int*]} has common sequence
 * {@code [int*]}, not {@code [int*, int*, int*]}.
 *
 * @param <D> Destination item type
 * @param <S> Source item type
 * @param <C> Common item type
 */
public final class CommonSequenceAccumulator<D, S, C>
    implements SequenceAccumulator<
        D, S, List<QuantifiedItem<C>>, CommonSequenceAccumulator<D, S, C>> {
  private final BiFunction<
          @Nullable QuantifiedItem<D>,
          @Nullable QuantifiedItem<S>,
          @Nullable QuantifiedItem<C>>
      getCommon;
  private final ImmutableList<QuantifiedItem<C>> items;

  private CommonSequenceAccumulator(
      BiFunction<
              @Nullable QuantifiedItem<D>,
              @Nullable QuantifiedItem<S>,
              @Nullable QuantifiedItem<C>>
          getCommon,
      ImmutableList<QuantifiedItem<C>> items) {
    this.getCommon = requireNonNull(getCommon);
    this.items = requireNonNull(items);
  }

  /** Creates an empty accumulator. */
  public static <D, S, C> CommonSequenceAccumulator<D, S, C> create(
      BiFunction<
              @Nullable QuantifiedItem<D>,
              @Nullable QuantifiedItem<S>,
              @Nullable QuantifiedItem<C>>
          getCommon) {
    return new CommonSequenceAccumulator<>(getCommon, ImmutableList.of());
  }

  private @Nullable QuantifiedItem<C> common(
      @Nullable MatchTracker<D> dest, @Nullable MatchTracker<S> src) {
    return getCommon.apply(
        dest == null ? null : dest.quantifiedItem,
        src == null ? null : src.quantifiedItem);
  }

  @Override
  public ImmutableList<QuantifiedItem<C>> value() {
    return items;
  }

  @Override
  public boolean matches(
      @Nullable MatchTracker<D> dest, @Nullable MatchTracker<S> src) {
    return common(dest, src) != null;
  }

  @Override
  public CommonSequenceAccumulator<D, S, C> accumulate(
      @Nullable MatchTracker<D> dest, @Nullable MatchTracker<S> src) {
    final @Nullable QuantifiedItem<C> common = common(dest, src);
    if (common == null
        || !items.isEmpty()
            && common.isRepeated()
            && last(items).isRepeated()
            && last(items).equals(common)) {
      return copy();
    }
    return new CommonSequenceAccumulator<>(
        getCommon,
        ImmutableList.<QuantifiedItem<C>>builder()
            .addAll(items)
            .add(common)
            .build());
  }

  @Override
  public CommonSequenceAccumulator<D, S, C> copy() {
    return new CommonSequenceAccumulator<>(getCommon, items);
  }

  @Override
  public String toString() {
    return "[" + Joiner.on(';').join(items) + "]";
  }
}

// End CommonSequenceAccumulator.java
