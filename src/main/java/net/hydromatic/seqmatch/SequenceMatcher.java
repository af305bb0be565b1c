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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Searches for a walk that aligns two sequences of quantified items.
 *
 * <p>Each sequence is an automaton: an item that matches once is a single
 * forward edge, a repeated item is a self-loop plus a forward edge, and a
 * skippable item adds an edge that jumps over it. A state is a pair of
 * positions {@code (i, j)}, one in each sequence. The search starts before
 * the first item of both sequences and succeeds when it reaches the end of
 * both at the same time.
 *
 * <p>Consider {@code [B, S]} versus {@code [d*, B, S]}. The second automaton
 * has a skip edge over {@code d*}, so the walk {@code (B, B), (S, S)} exists
 * and {@code d*} corresponds to zero destination items:
 *
 * <pre>{@code
 *   E0      B       S      E
 * ----->()----->()----->()----->
 *       ..
 *       || d*
 *   E0  v|  B       S      E
 * -.--->()----.>()----->()----->
 *   \......../
 *       skip
 * }</pre>
 *
 * <p>The search is depth-first and returns the first walk found. Staying on
 * a repeated item is tried before advancing, so quantifiers are greedy. The
 * accumulator is copied at every branch, so a rejected branch is simply
 * dropped.
 *
 * <p>Instances are immutable and may be shared between threads; each call to
 * {@link #traverse} has its own state.
 */
public class SequenceMatcher {
  private static final SequenceMatcher DEFAULT =
      new SequenceMatcher(Tracers.nullTracer(), false, 0);

  private final Tracer tracer;
  private final boolean memoize;
  private final int stepLimit;

  private SequenceMatcher(Tracer tracer, boolean memoize, int stepLimit) {
    this.tracer = requireNonNull(tracer);
    this.memoize = memoize;
    this.stepLimit = stepLimit;
    checkArgument(stepLimit >= 0, "negative stepLimit: %s", stepLimit);
  }

  /**
   * Returns a matcher with default settings: no tracing, no memoization, no
   * step limit.
   */
  public static SequenceMatcher create() {
    return DEFAULT;
  }

  /** Returns a matcher configured by a map of properties. */
  public static SequenceMatcher create(Map<MatchProp, Object> map) {
    final Tracer tracer =
        MatchProp.TRACE.booleanValue(map)
            ? Tracers.printTracer(System.err)
            : Tracers.nullTracer();
    return new SequenceMatcher(
        tracer,
        MatchProp.MEMOIZE.booleanValue(map),
        MatchProp.STEP_LIMIT.intValue(map));
  }

  /** Returns a matcher that reports its progress to a tracer. */
  public SequenceMatcher withTracer(Tracer tracer) {
    return tracer == this.tracer
        ? this
        : new SequenceMatcher(tracer, memoize, stepLimit);
  }

  /** Returns a matcher that does or does not memoize rejected states. */
  public SequenceMatcher withMemoize(boolean memoize) {
    return memoize == this.memoize
        ? this
        : new SequenceMatcher(tracer, memoize, stepLimit);
  }

  /**
   * Returns a matcher that throws {@link StepLimitExceededException} after a
   * given number of steps; 0 means no limit.
   */
  public SequenceMatcher withStepLimit(int stepLimit) {
    return stepLimit == this.stepLimit
        ? this
        : new SequenceMatcher(tracer, memoize, stepLimit);
  }

  public Tracer tracer() {
    return tracer;
  }

  public boolean memoize() {
    return memoize;
  }

  public int stepLimit() {
    return stepLimit;
  }

  /**
   * Returns whether two sequences can be aligned so that every pair of
   * corresponding items satisfies a predicate.
   */
  public <D, S> boolean matches(
      List<QuantifiedItem<D>> destSequence,
      List<QuantifiedItem<S>> srcSequence,
      BiPredicate<? super D, ? super S> destMatchesSrc) {
    final ExistenceAccumulator<D, S> acc =
        ExistenceAccumulator.create(
            destMatchesSrc, destSequence.isEmpty() && srcSequence.isEmpty());
    return traverse(destSequence, srcSequence, acc)
        .map(ExistenceAccumulator::value)
        .orElse(false);
  }

  /**
   * Aligns two sequences and returns, for each destination item in order, the
   * source items it corresponds to; or empty if the sequences cannot be
   * aligned.
   */
  public <D, S> Optional<List<DestItemMatches<D, S>>> matchGroups(
      List<QuantifiedItem<D>> destSequence,
      List<QuantifiedItem<S>> srcSequence,
      BiPredicate<? super D, ? super S> destMatchesSrc) {
    return traverse(
            destSequence,
            srcSequence,
            GroupingAccumulator.<D, S>create(destMatchesSrc))
        .map(GroupingAccumulator::value);
  }

  /**
   * Aligns two sequences and returns the sequence of items that they have in
   * common; or empty if the sequences cannot be aligned.
   *
   * <p>{@code getCommon} receives each pair of corresponding items (either of
   * which may be null) and returns their common item, or null if they have
   * none.
   */
  public <D, S, C> Optional<List<QuantifiedItem<C>>> commonSequence(
      List<QuantifiedItem<D>> destSequence,
      List<QuantifiedItem<S>> srcSequence,
      BiFunction<
              @Nullable QuantifiedItem<D>,
              @Nullable QuantifiedItem<S>,
              @Nullable QuantifiedItem<C>>
          getCommon) {
    return traverse(
            destSequence,
            srcSequence,
            CommonSequenceAccumulator.create(getCommon))
        .map(CommonSequenceAccumulator::value);
  }

  /**
   * Searches for a walk over two sequences of items, and returns the
   * accumulator at the end of the first walk found; or empty if there is no
   * walk.
   */
  public <D, S, A extends SequenceAccumulator<D, S, ?, A>>
      Optional<A> traverse(
          List<QuantifiedItem<D>> destSequence,
          List<QuantifiedItem<S>> srcSequence,
          A acc) {
    return traverseTrackers(trackers(destSequence), trackers(srcSequence), acc);
  }

  /**
   * Searches for a walk over two sequences of trackers, and returns the
   * accumulator at the end of the first walk found; or empty if there is no
   * walk.
   */
  public <D, S, A extends SequenceAccumulator<D, S, ?, A>>
      Optional<A> traverseTrackers(
          List<MatchTracker<D>> destTrackers,
          List<MatchTracker<S>> srcTrackers,
          A acc) {
    final Walk<D, S, A> walk =
        new Walk<D, S, A>(
            ImmutableList.copyOf(destTrackers),
            ImmutableList.copyOf(srcTrackers));
    tracer.onStart(walk.dest, walk.src);
    final Optional<A> result =
        Optional.ofNullable(walk.step(-1, -1, null, null, acc, 0));
    tracer.onFinish(walk.dest, walk.src, result);
    return result;
  }

  private static <T> ImmutableList<MatchTracker<T>> trackers(
      List<QuantifiedItem<T>> items) {
    final ImmutableList.Builder<MatchTracker<T>> b = ImmutableList.builder();
    items.forEach(item -> b.add(MatchTracker.of(item)));
    return b.build();
  }

  /**
   * Positions that one side may move to.
   *
   * <p>From position {@code k}, whose tracker has just been paired: stay at
   * {@code k} if the item may be paired again; move to {@code k + 1} if the
   * item has been paired at least its minimum number of times; and, for each
   * skippable item that follows, jump over it too. Staying comes first; that
   * makes matching greedy.
   */
  private static <T> List<Integer> moves(
      int k,
      @Nullable MatchTracker<T> tracker,
      List<MatchTracker<T>> trackers) {
    final List<Integer> moves = new ArrayList<>(3);
    if (tracker != null && tracker.hasMoreMatches()) {
      moves.add(k);
    }
    if (tracker == null || tracker.isSatisfied()) {
      moves.add(k + 1);
      for (int n = k + 1;
          n < trackers.size() - 1 && trackers.get(n).isSkippable();
          n++) {
        moves.add(n + 1);
      }
    }
    return moves;
  }

  private static <T> @Nullable MatchTracker<T> at(
      List<MatchTracker<T>> trackers, int k) {
    return k < trackers.size() ? trackers.get(k) : null;
  }

  private static int counter(@Nullable MatchTracker<?> tracker) {
    return tracker == null ? -1 : tracker.matchesCounter;
  }

  /**
   * State of one traversal: the two sequences, the number of steps taken, and
   * the states known to have no walk.
   *
   * @param <D> Destination item type
   * @param <S> Source item type
   * @param <A> Accumulator type
   */
  private class Walk<D, S, A extends SequenceAccumulator<D, S, ?, A>> {
    final ImmutableList<MatchTracker<D>> dest;
    final ImmutableList<MatchTracker<S>> src;
    final @Nullable Set<List<Object>> rejected;
    int stepCount;

    Walk(
        ImmutableList<MatchTracker<D>> dest,
        ImmutableList<MatchTracker<S>> src) {
      this.dest = dest;
      this.src = src;
      this.rejected = memoize ? new HashSet<>() : null;
    }

    /**
     * Takes a step from state {@code (i, j)}, with trackers {@code a} and
     * {@code b} at those positions (null if past the end), and returns the
     * accumulator of the first walk from here, or null if there is none.
     */
    @Nullable A step(
        int i,
        int j,
        @Nullable MatchTracker<D> a,
        @Nullable MatchTracker<S> b,
        A acc,
        int depth) {
      if (stepLimit > 0 && ++stepCount > stepLimit) {
        throw new StepLimitExceededException(stepLimit);
      }
      if (rejected == null) {
        return step2(i, j, a, b, acc, depth);
      }
      final List<Object> key =
          ImmutableList.of(i, j, counter(a), counter(b), acc.matchState());
      if (rejected.contains(key)) {
        tracer.onReject(depth, Rejection.MEMOIZED);
        return null;
      }
      final @Nullable A result = step2(i, j, a, b, acc, depth);
      if (result == null) {
        rejected.add(key);
      }
      return result;
    }

    private @Nullable A step2(
        int i,
        int j,
        @Nullable MatchTracker<D> a,
        @Nullable MatchTracker<S> b,
        A acc,
        int depth) {
      tracer.onStep(depth, i, j, a, b);

      if (i >= 0 && j >= 0) {
        if (a == null && b == null) {
          tracer.onAccept(depth);
          return acc;
        }

        if (a == null) {
          // The destination has ended. The source item may only be consumed
          // as a zero-occurrence match.
          if (!b.isSkippable()) {
            tracer.onReject(depth, Rejection.DEST_ENDED);
            return null;
          }
          if (!acc.matches(null, b)) {
            tracer.onReject(depth, Rejection.ZERO_SRC_REJECTED);
            return null;
          }
          tracer.onZero(depth, null, b);
          return step(
              i,
              j + 1,
              null,
              at(src, j + 1),
              acc.accumulate(null, b),
              depth + 1);
        }

        if (b == null) {
          if (!a.isSkippable()) {
            tracer.onReject(depth, Rejection.SRC_ENDED);
            return null;
          }
          if (!acc.matches(a, null)) {
            tracer.onReject(depth, Rejection.ZERO_DEST_REJECTED);
            return null;
          }
          tracer.onZero(depth, a, null);
          return step(
              i + 1,
              j,
              at(dest, i + 1),
              null,
              acc.accumulate(a, null),
              depth + 1);
        }

        if (!acc.matches(a, b)) {
          tracer.onReject(depth, Rejection.MISMATCH);
          return null;
        }
      }

      final @Nullable MatchTracker<D> a2 = a == null ? null : a.matched();
      final @Nullable MatchTracker<S> b2 = b == null ? null : b.matched();
      final List<Integer> destMoves = moves(i, a2, dest);
      final List<Integer> srcMoves = moves(j, b2, src);

      final List<Move> candidates = new ArrayList<>();
      for (int i2 : destMoves) {
        for (int j2 : srcMoves) {
          if (i2 != i || j2 != j) {
            candidates.add(new Move(i2, j2));
          }
        }
      }
      tracer.onCandidates(depth, candidates);

      for (Move move : candidates) {
        A acc2 = acc;
        if (i >= 0 && j >= 0) {
          acc2 = acc2.accumulate(a2, b2);
        }
        // Items jumped over by a skip edge correspond to nothing.
        for (int k = i + 1; k < move.destIndex; k++) {
          acc2 = acc2.accumulate(dest.get(k), null);
        }
        for (int k = j + 1; k < move.srcIndex; k++) {
          acc2 = acc2.accumulate(null, src.get(k));
        }
        final @Nullable MatchTracker<D> nextA =
            move.destIndex == i ? a2 : at(dest, move.destIndex);
        final @Nullable MatchTracker<S> nextB =
            move.srcIndex == j ? b2 : at(src, move.srcIndex);
        final @Nullable A result =
            step(move.destIndex, move.srcIndex, nextA, nextB, acc2, depth + 1);
        if (result != null) {
          return result;
        }
      }
      tracer.onReject(depth, Rejection.NO_CANDIDATES);
      return null;
    }
  }

  /** A move to a pair of positions. */
  public static final class Move {
    public final int destIndex;
    public final int srcIndex;

    public Move(int destIndex, int srcIndex) {
      this.destIndex = destIndex;
      this.srcIndex = srcIndex;
    }

    @Override
    public int hashCode() {
      return Objects.hash(destIndex, srcIndex);
    }

    @Override
    public boolean equals(Object obj) {
      return this == obj
          || obj instanceof Move
              && destIndex == ((Move) obj).destIndex
              && srcIndex == ((Move) obj).srcIndex;
    }

    @Override
    public String toString() {
      return "(" + destIndex + ", " + srcIndex + ")";
    }
  }

  /** Reason why a state has no walk. */
  public enum Rejection {
    DEST_ENDED("dest terminated but src is not skippable"),
    SRC_ENDED("src terminated but dest is not skippable"),
    ZERO_SRC_REJECTED("dest terminated and src is skippable but not accepted"),
    ZERO_DEST_REJECTED("src terminated and dest is skippable but not accepted"),
    MISMATCH("dest and src do not match"),
    NO_CANDIDATES("no match in any next step"),
    MEMOIZED("state previously rejected");

    public final String description;

    Rejection(String description) {
      this.description = description;
    }
  }

  /**
   * Called on various events during a traversal.
   *
   * <p>The depth is the recursion depth of the search, and is for display
   * only.
   */
  public interface Tracer {
    void onStart(
        List<? extends MatchTracker<?>> dest,
        List<? extends MatchTracker<?>> src);

    void onStep(
        int depth,
        int i,
        int j,
        @Nullable MatchTracker<?> dest,
        @Nullable MatchTracker<?> src);

    void onCandidates(int depth, List<Move> moves);

    /** Called when an item is consumed as corresponding to zero items. */
    void onZero(
        int depth,
        @Nullable MatchTracker<?> dest,
        @Nullable MatchTracker<?> src);

    void onAccept(int depth);

    void onReject(int depth, Rejection rejection);

    void onFinish(
        List<? extends MatchTracker<?>> dest,
        List<? extends MatchTracker<?>> src,
        Optional<?> result);
  }
}

// End SequenceMatcher.java
