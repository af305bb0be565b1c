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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.Objects;
import java.util.function.Function;

/**
 * A destination item and the source items that correspond to it in a walk.
 *
 * <p>The list of source items is empty if the destination item corresponds
 * to nothing.
 *
 * @param <D> Destination item type
 * @param <S> Source item type
 */
public final class DestItemMatches<D, S> {
  public final QuantifiedItem<D> destItem;
  public final ImmutableList<QuantifiedItem<S>> matchedSrcItems;

  DestItemMatches(
      QuantifiedItem<D> destItem,
      ImmutableList<QuantifiedItem<S>> matchedSrcItems) {
    this.destItem = requireNonNull(destItem);
    this.matchedSrcItems = requireNonNull(matchedSrcItems);
  }

  /** Creates a DestItemMatches. */
  public static <D, S> DestItemMatches<D, S> of(
      QuantifiedItem<D> destItem, Iterable<QuantifiedItem<S>> matchedSrcItems) {
    return new DestItemMatches<>(
        destItem, ImmutableList.copyOf(matchedSrcItems));
  }

  /** Returns a copy with one more source item. */
  DestItemMatches<D, S> plus(QuantifiedItem<S> srcItem) {
    return new DestItemMatches<>(
        destItem,
        ImmutableList.<QuantifiedItem<S>>builder()
            .addAll(matchedSrcItems)
            .add(srcItem)
            .build());
  }

  @Override
  public int hashCode() {
    return Objects.hash(destItem, matchedSrcItems);
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof DestItemMatches
            && destItem.equals(((DestItemMatches<?, ?>) obj).destItem)
            && matchedSrcItems.equals(
                ((DestItemMatches<?, ?>) obj).matchedSrcItems);
  }

  @Override
  public String toString() {
    return describe(String::valueOf, String::valueOf);
  }

  /** Renders this as, for example, "B* == [x;y]". */
  public String describe(
      Function<? super D, String> destStr, Function<? super S, String> srcStr) {
    final StringBuilder buf = destItem.describeTo(new StringBuilder(), destStr);
    buf.append(" == [");
    Joiner.on(';')
        .appendTo(buf,
            Lists.transform(matchedSrcItems, item -> item.describe(srcStr)));
    return buf.append(']').toString();
  }
}

// End DestItemMatches.java
