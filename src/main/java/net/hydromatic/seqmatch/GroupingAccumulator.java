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

import static net.hydromatic.seqmatch.util.Static.last;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.BiPredicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Accumulator that records which source items correspond to each destination
 * item.
 *
 * <p>The value is a list of {@link DestItemMatches}, in destination order. A
 * destination item that is paired several times in a row (a repeated item
 * staying put) gets one group holding all of its source items. A destination
 * item that corresponds to nothing gets a group with no source items. A source
 * item that corresponds to nothing leaves no trace.
 *
 * <p>For example, if {@code *Ds} and {@code D} are matched against {@code V}
 * and {@code *Vs}, the groups might be {@code *Ds == [V]} and {@code D ==
 * [*Vs]}; a caller uses them to decide which part of each variadic source
 * item binds to each destination item.
 *
 * @param <D> Destination item type
 * @param <S> Source item type
 */
public final class GroupingAccumulator<D, S>
    extends PredicateAccumulator<
        D, S, List<DestItemMatches<D, S>>, GroupingAccumulator<D, S>> {
  private final ImmutableList<DestItemMatches<D, S>> groups;

  private GroupingAccumulator(
      BiPredicate<? super D, ? super S> destMatchesSrc,
      ImmutableList<DestItemMatches<D, S>> groups) {
    super(destMatchesSrc);
    this.groups = groups;
  }

  /** Creates an accumulator with no groups. */
  public static <D, S> GroupingAccumulator<D, S> create(
      BiPredicate<? super D, ? super S> destMatchesSrc) {
    return new GroupingAccumulator<>(destMatchesSrc, ImmutableList.of());
  }

  @Override
  public ImmutableList<DestItemMatches<D, S>> value() {
    return groups;
  }

  @Override
  public GroupingAccumulator<D, S> accumulate(
      @Nullable MatchTracker<D> dest, @Nullable MatchTracker<S> src) {
    if (dest == null) {
      // A source item that matches zero destination items is dropped.
      return copy();
    }
    final @Nullable DestItemMatches<D, S> lastGroup =
        groups.isEmpty() ? null : last(groups);
    final boolean sameItem =
        lastGroup != null && lastGroup.destItem == dest.quantifiedItem;
    if (src == null) {
      // The destination item matches zero source items. It needs a group,
      // unless it has been paired already and therefore has one.
      if (sameItem && dest.matchesCounter > 0) {
        return copy();
      }
      return append(
          DestItemMatches.of(dest.quantifiedItem, ImmutableList.of()));
    }
    // The tracker has already counted this pairing, so a counter greater than
    // one means the item is staying put and extends its group.
    if (sameItem && dest.matchesCounter > 1) {
      return new GroupingAccumulator<>(
          destMatchesSrc,
          ImmutableList.<DestItemMatches<D, S>>builder()
              .addAll(groups.subList(0, groups.size() - 1))
              .add(lastGroup.plus(src.quantifiedItem))
              .build());
    }
    return append(
        DestItemMatches.of(
            dest.quantifiedItem, ImmutableList.of(src.quantifiedItem)));
  }

  private GroupingAccumulator<D, S> append(DestItemMatches<D, S> group) {
    return new GroupingAccumulator<>(
        destMatchesSrc,
        ImmutableList.<DestItemMatches<D, S>>builder()
            .addAll(groups)
            .add(group)
            .build());
  }

  /**
   * {@inheritDoc}
   *
   * <p>The groups are immutable, so the copy shares them.
   */
  @Override
  public GroupingAccumulator<D, S> copy() {
    return new GroupingAccumulator<>(destMatchesSrc, groups);
  }

  @Override
  public String toString() {
    return "{" + Joiner.on(';').join(groups) + "}";
  }
}

// End GroupingAccumulator.java
