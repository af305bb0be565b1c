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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A value annotated with the number of times it may correspond to elements of
 * another sequence.
 *
 * <p>The quantifier {@code (minMatches, maxMatches)} plays the role of a
 * regular-expression quantifier: {@code {1,1}} is a plain item, {@code {0,}}
 * is {@code *}, {@code {1,}} is {@code +} and {@code {0,1}} is {@code ?}. A
 * null {@code maxMatches} means unbounded.
 *
 * <p>Instances are immutable. Two items are {@link #equals equal} if their
 * values and quantifiers are equal; the engine and the grouping accumulator
 * use identity where they need to tell two occurrences of the same value
 * apart.
 *
 * @param <T> Item type
 */
public final class QuantifiedItem<T> {
  public final T item;
  public final int minMatches;
  public final @Nullable Integer maxMatches;

  private QuantifiedItem(T item, int minMatches, @Nullable Integer maxMatches) {
    this.item = requireNonNull(item, "item");
    this.minMatches = minMatches;
    this.maxMatches = maxMatches;
    checkArgument(minMatches >= 0, "negative minMatches: %s", minMatches);
    checkArgument(
        maxMatches == null || minMatches <= maxMatches,
        "minMatches %s greater than maxMatches %s",
        minMatches,
        maxMatches);
  }

  /** Creates an item with a given quantifier. */
  public static <T> QuantifiedItem<T> of(
      T item, int minMatches, @Nullable Integer maxMatches) {
    return new QuantifiedItem<>(item, minMatches, maxMatches);
  }

  /** Creates an item that matches exactly once, {@code {1,1}}. */
  public static <T> QuantifiedItem<T> one(T item) {
    return new QuantifiedItem<>(item, 1, 1);
  }

  /** Creates an item that matches zero or once, {@code {0,1}}. */
  public static <T> QuantifiedItem<T> optional(T item) {
    return new QuantifiedItem<>(item, 0, 1);
  }

  /** Creates an item that matches zero or more times, {@code {0,}}. */
  public static <T> QuantifiedItem<T> zeroOrMore(T item) {
    return new QuantifiedItem<>(item, 0, null);
  }

  /** Creates an item that matches one or more times, {@code {1,}}. */
  public static <T> QuantifiedItem<T> oneOrMore(T item) {
    return new QuantifiedItem<>(item, 1, null);
  }

  /** Creates an item that matches between zero and {@code n} times. */
  public static <T> QuantifiedItem<T> atMost(T item, int n) {
    return new QuantifiedItem<>(item, 0, n);
  }

  /**
   * Returns whether this item may correspond to more than one element, or is
   * optional.
   *
   * <p>True if {@code maxMatches} is unbounded or greater than 1, or if it is
   * 1 and {@code minMatches} is 0.
   */
  public boolean isRepeated() {
    return maxMatches == null
        || maxMatches > 1
        || (maxMatches == 1 && minMatches == 0);
  }

  /** Returns whether this item may correspond to zero elements. */
  public boolean isSkippable() {
    return minMatches <= 0;
  }

  /** Returns a copy of this item with a different value. */
  public <T2> QuantifiedItem<T2> withItem(T2 item) {
    return new QuantifiedItem<>(item, minMatches, maxMatches);
  }

  @Override
  public int hashCode() {
    return Objects.hash(item, minMatches, maxMatches);
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof QuantifiedItem
            && item.equals(((QuantifiedItem<?>) obj).item)
            && minMatches == ((QuantifiedItem<?>) obj).minMatches
            && Objects.equals(maxMatches, ((QuantifiedItem<?>) obj).maxMatches);
  }

  @Override
  public String toString() {
    return describe(String::valueOf);
  }

  /**
   * Renders this item, using a given function to render the value.
   *
   * <p>For example, if the value renders as "x", returns "x" for {@code
   * {1,1}}, "x*" for {@code {0,}}, "x+" for {@code {1,}}, "x?" for {@code
   * {0,1}}, and "x{2:5}" or "x{2:}" otherwise.
   */
  public String describe(Function<? super T, String> toStr) {
    return describeTo(new StringBuilder(), toStr).toString();
  }

  /** Renders this item to a builder. */
  public StringBuilder describeTo(
      StringBuilder buf, Function<? super T, String> toStr) {
    buf.append(toStr.apply(item));
    if (maxMatches == null) {
      switch (minMatches) {
        case 0:
          return buf.append('*');
        case 1:
          return buf.append('+');
        default:
          return buf.append('{').append(minMatches).append(":}");
      }
    }
    if (minMatches == 1 && maxMatches == 1) {
      return buf;
    }
    if (minMatches == 0 && maxMatches == 1) {
      return buf.append('?');
    }
    return buf.append('{')
        .append(minMatches)
        .append(':')
        .append(maxMatches)
        .append('}');
  }
}

// End QuantifiedItem.java
