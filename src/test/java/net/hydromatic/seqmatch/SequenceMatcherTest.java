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

import static net.hydromatic.seqmatch.QuantifiedItem.one;
import static net.hydromatic.seqmatch.QuantifiedItem.zeroOrMore;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.BiPredicate;
import net.hydromatic.seqmatch.SequenceMatcher.Move;
import net.hydromatic.seqmatch.SequenceMatcher.Rejection;
import net.hydromatic.seqmatch.SequenceMatcher.Tracer;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests {@link SequenceMatcher}. */
public class SequenceMatcherTest {
  private static final BiPredicate<String, String> EQUAL = String::equals;

  /** A destination sequence that cannot match {@link #NO_Y} but takes many
   * steps to find out. */
  private static final List<QuantifiedItem<String>> X_STAR_Y =
      ImmutableList.of(zeroOrMore("x"), zeroOrMore("x"), zeroOrMore("x"),
          zeroOrMore("x"), one("y"));

  private static final List<QuantifiedItem<String>> NO_Y =
      ImmutableList.of(one("x"), one("x"), one("x"), one("x"), one("x"));

  @Test void testCreate() {
    final SequenceMatcher matcher = SequenceMatcher.create();
    assertThat(matcher.memoize(), is(false));
    assertThat(matcher.stepLimit(), is(0));
    assertThat(matcher.withMemoize(false), sameInstance(matcher));
    assertThat(matcher.withMemoize(true).memoize(), is(true));
    assertThat(matcher.withStepLimit(100).stepLimit(), is(100));
    assertThrows(IllegalArgumentException.class,
        () -> matcher.withStepLimit(-1));
  }

  @Test void testCreateFromProperties() {
    final Properties properties = new Properties();
    properties.setProperty("seqmatch.memoize", "true");
    properties.setProperty("seqmatch.stepLimit", "50");
    properties.setProperty("unrelated", "x");
    final Map<MatchProp, Object> map = MatchProp.fromProperties(properties);
    assertThat(map.size(), is(2));
    final SequenceMatcher matcher = SequenceMatcher.create(map);
    assertThat(matcher.memoize(), is(true));
    assertThat(matcher.stepLimit(), is(50));

    // Properties not set have their default value
    assertThat(MatchProp.TRACE.booleanValue(map), is(false));
  }

  @Test void testProp() {
    assertThat(MatchProp.lookup("stepLimit"), is(MatchProp.STEP_LIMIT));
    assertThat(MatchProp.lookup("STEP_LIMIT"), is(MatchProp.STEP_LIMIT));
    assertThrows(IllegalArgumentException.class,
        () -> MatchProp.lookup("noSuchProperty"));
    assertThat(MatchProp.BY_CAMEL_NAME,
        hasToString("[MEMOIZE, STEP_LIMIT, TRACE]"));

    final Properties properties = new Properties();
    properties.setProperty("seqmatch.memoize", "maybe");
    assertThrows(IllegalArgumentException.class,
        () -> MatchProp.fromProperties(properties));

    final Map<MatchProp, Object> map =
        MatchProp.fromProperties(new Properties());
    MatchProp.MEMOIZE.setLenient(map, "1");
    assertThat(MatchProp.MEMOIZE.booleanValue(map), is(true));
    MatchProp.MEMOIZE.set(map, null);
    assertThat(MatchProp.MEMOIZE.booleanValue(map), is(false));
    assertThrows(IllegalArgumentException.class,
        () -> MatchProp.STEP_LIMIT.set(map, "10"));
    assertThrows(IllegalArgumentException.class,
        () -> MatchProp.STEP_LIMIT.set(map, -3));
    assertThrows(IllegalArgumentException.class,
        () -> MatchProp.STEP_LIMIT.setLenient(map, "ten"));
    assertThrows(IllegalArgumentException.class,
        () -> MatchProp.STEP_LIMIT.booleanValue(map));
  }

  /** Tests that memoization gives the same answers and takes fewer steps. */
  @Test void testMemoize() {
    final SequenceMatcher matcher = SequenceMatcher.create();
    final CountingTracer tracer0 = new CountingTracer();
    final CountingTracer tracer1 = new CountingTracer();
    assertThat(
        matcher.withTracer(tracer0).matches(X_STAR_Y, NO_Y, EQUAL),
        is(false));
    assertThat(
        matcher.withTracer(tracer1).withMemoize(true)
            .matches(X_STAR_Y, NO_Y, EQUAL),
        is(false));
    assertThat(tracer0.memoHitCount, is(0));
    assertThat(tracer1.memoHitCount, greaterThan(0));
    assertThat(tracer1.stepCount, lessThan(tracer0.stepCount));

    // Same groups with and without memoization
    final List<QuantifiedItem<String>> src =
        ImmutableList.of(one("x"), one("x"), one("y"));
    final Optional<List<DestItemMatches<String, String>>> groups0 =
        matcher.matchGroups(X_STAR_Y, src, EQUAL);
    final Optional<List<DestItemMatches<String, String>>> groups1 =
        matcher.withMemoize(true).matchGroups(X_STAR_Y, src, EQUAL);
    assertThat(groups0.isPresent(), is(true));
    assertThat(groups1, is(groups0));
    assertThat(groups0.get(),
        hasToString("[x* == [x;x], x* == [], x* == [], x* == [], y == [y]]"));
  }

  @Test void testStepLimit() {
    final SequenceMatcher matcher = SequenceMatcher.create().withStepLimit(10);
    final StepLimitExceededException e =
        assertThrows(StepLimitExceededException.class,
            () -> matcher.matches(X_STAR_Y, NO_Y, EQUAL));
    assertThat(e.stepLimit(), is(10));

    // A simple match completes within the limit
    assertThat(matcher.matches(ImmutableList.of(one("a")),
            ImmutableList.of(one("a")), EQUAL),
        is(true));
  }

  /** Tests that an item whose minimum is 2 must be paired at least twice. */
  @Test void testMinimum() {
    final List<QuantifiedItem<String>> dest =
        ImmutableList.of(QuantifiedItem.of("X", 2, 3));
    final BiPredicate<String, String> predicate = String::equalsIgnoreCase;
    final SequenceMatcher matcher = SequenceMatcher.create();
    assertThat(matcher.matches(dest, xs(1), predicate), is(false));
    assertThat(matcher.matches(dest, xs(2), predicate), is(true));
    assertThat(matcher.matches(dest, xs(3), predicate), is(true));
    assertThat(matcher.matches(dest, xs(4), predicate), is(false));
    assertThat(matcher.matchGroups(dest, xs(3), predicate).get(),
        hasToString("[X{2:3} == [x;x;x]]"));
  }

  private static List<QuantifiedItem<String>> xs(int n) {
    final ImmutableList.Builder<QuantifiedItem<String>> b =
        ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      b.add(one("x"));
    }
    return b.build();
  }

  @Test void testPrintTracer() {
    final StringWriter sw = new StringWriter();
    final SequenceMatcher matcher =
        SequenceMatcher.create()
            .withTracer(Tracers.printTracer(new PrintWriter(sw)));
    assertThat(matcher.matches(ImmutableList.of(one("a")),
            ImmutableList.of(one("a")), EQUAL),
        is(true));
    final List<String> expected =
        Arrays.asList("[seqmatch] [a] ==?== [a]",
            "[seqmatch] step(-1: <end>, -1: <end>)",
            "[seqmatch] * steps: (0, 0)",
            "[seqmatch] -step(0: a, 0: a)",
            "[seqmatch] -* steps: (1, 1)",
            "[seqmatch] --step(1: <end>, 1: <end>)",
            "[seqmatch] --[ACCEPT] both terminated",
            "[seqmatch] [a] ==?== [a] ==> true");
    assertThat(Arrays.asList(sw.toString().split("\\R")), is(expected));
  }

  @Test void testPrintTracerReject() {
    final StringWriter sw = new StringWriter();
    final SequenceMatcher matcher =
        SequenceMatcher.create()
            .withTracer(
                Tracers.printTracer(new PrintWriter(sw), o -> "<" + o + ">",
                    o -> "'" + o + "'"));
    final Optional<List<DestItemMatches<String, String>>> groups =
        matcher.matchGroups(ImmutableList.of(zeroOrMore("a")),
            ImmutableList.of(one("b")), EQUAL);
    assertThat(groups.isPresent(), is(false));
    final List<String> expected =
        Arrays.asList("[seqmatch] [<a>*.[0]] ==?== [<b>]",
            "[seqmatch] step(-1: <end>, -1: <end>)",
            "[seqmatch] * steps: (0, 0)",
            "[seqmatch] -step(0: <a>*.[0], 0: 'b')",
            "[seqmatch] -[REJECT] dest and src do not match",
            "[seqmatch] [REJECT] no match in any next step",
            "[seqmatch] [<a>*.[0]] ==?== ['b'] ==> none");
    assertThat(Arrays.asList(sw.toString().split("\\R")), is(expected));
  }

  @Test void testPrintTracerToStream() {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final SequenceMatcher matcher =
        SequenceMatcher.create().withTracer(Tracers.printTracer(out));
    assertThat(matcher.matches(ImmutableList.of(zeroOrMore("a")),
            ImmutableList.of(), EQUAL),
        is(true));
    final List<String> lines =
        Arrays.asList(out.toString(StandardCharsets.UTF_8).split("\\R"));
    assertThat(lines.get(0), is("[seqmatch] [a*.[0]] ==?== []"));
    assertThat(lines.get(lines.size() - 1),
        is("[seqmatch] [a*.[0]] ==?== [] ==> true"));
  }

  /** Tests that the {@code trace} property makes the matcher write to
   * standard error. */
  @Test void testTraceProperty() {
    final Map<MatchProp, Object> map = new EnumMap<>(MatchProp.class);
    MatchProp.TRACE.set(map, true);
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final PrintStream savedErr = System.err;
    final SequenceMatcher matcher;
    try {
      System.setErr(new PrintStream(out, true, StandardCharsets.UTF_8));
      matcher = SequenceMatcher.create(map);
    } finally {
      System.setErr(savedErr);
    }
    assertThat(matcher.matches(ImmutableList.of(one("a")),
            ImmutableList.of(one("a")), EQUAL),
        is(true));
    final String s = out.toString(StandardCharsets.UTF_8);
    assertThat(s, startsWith("[seqmatch] [a] ==?== [a]"));
    assertThat(s, containsString("[ACCEPT] both terminated"));

    // Without the property, nothing is written
    assertThat(SequenceMatcher.create(new EnumMap<>(MatchProp.class)).tracer(),
        sameInstance(Tracers.nullTracer()));
  }

  @Test void testFromSystemProperties() {
    System.setProperty("seqmatch.stepLimit", "25");
    System.setProperty("seqmatch.memoize", "true");
    try {
      final Map<MatchProp, Object> map = MatchProp.fromSystemProperties();
      assertThat(MatchProp.STEP_LIMIT.intValue(map), is(25));
      assertThat(MatchProp.MEMOIZE.booleanValue(map), is(true));
      assertThat(MatchProp.TRACE.booleanValue(map), is(false));
      final SequenceMatcher matcher = SequenceMatcher.create(map);
      assertThat(matcher.stepLimit(), is(25));
      assertThat(matcher.memoize(), is(true));
    } finally {
      System.clearProperty("seqmatch.stepLimit");
      System.clearProperty("seqmatch.memoize");
    }
    assertThat(MatchProp.fromSystemProperties().isEmpty(), is(true));
  }

  /** Tests that accumulators are persistent: accumulating leaves the
   * original unchanged. */
  @Test void testPersistentAccumulator() {
    final MatchTracker<String> a = MatchTracker.of(zeroOrMore("a"));
    final MatchTracker<String> b = MatchTracker.of(one("a"));
    final GroupingAccumulator<String, String> acc0 =
        GroupingAccumulator.create(EQUAL);
    final GroupingAccumulator<String, String> acc1 =
        acc0.accumulate(a.matched(), b.matched());
    final GroupingAccumulator<String, String> acc2 =
        acc1.accumulate(a.matched().matched(), b.matched());
    final GroupingAccumulator<String, String> acc2b =
        acc1.accumulate(a, null);
    assertThat(acc0.value(), empty());
    assertThat(acc1.value(), hasToString("[a* == [a]]"));
    assertThat(acc2.value(), hasToString("[a* == [a;a]]"));
    assertThat(acc2b.value(), hasToString("[a* == [a], a* == []]"));
    assertThat(acc2.copy().value(), is(acc2.value()));
    assertThat(acc2, hasToString("{a* == [a;a]}"));
    assertThat(acc2b, hasToString("{a* == [a];a* == []}"));

    // A source item that matches nothing is not recorded
    assertThat(acc2.accumulate(null, b).value(), is(acc2.value()));

    final ExistenceAccumulator<String, String> e0 =
        ExistenceAccumulator.create(EQUAL);
    final ExistenceAccumulator<String, String> e1 =
        e0.accumulate(a.matched(), b.matched());
    assertThat(e0.value(), is(false));
    assertThat(e1.value(), is(true));
    assertThat(e1.accumulate(null, b).value(), is(true));
  }

  /** Tests the traversal with an accumulator defined here, which counts the
   * pairs in the walk and refuses walks with more than a given number. */
  @Test void testCustomAccumulator() {
    final List<QuantifiedItem<String>> dest =
        ImmutableList.of(zeroOrMore("x"), zeroOrMore("x"));
    final List<QuantifiedItem<String>> src = xs(4);
    final SequenceMatcher matcher = SequenceMatcher.create();
    final Optional<PairCounter> result =
        matcher.traverse(dest, src, new PairCounter(10, 0));
    assertThat(result.isPresent(), is(true));
    assertThat(result.get().value(), is(4));

    // With at most 3 pairs, the walk is impossible
    assertThat(matcher.traverse(dest, src, new PairCounter(3, 0)).isPresent(),
        is(false));
    assertThat(
        matcher.withMemoize(true)
            .traverse(dest, src, new PairCounter(3, 0))
            .isPresent(),
        is(false));
  }

  /** Accumulator that counts pairs of present items, and matches only while
   * the count is below a limit. */
  private static class PairCounter
      implements SequenceAccumulator<String, String, Integer, PairCounter> {
    final int limit;
    final int count;

    PairCounter(int limit, int count) {
      this.limit = limit;
      this.count = count;
    }

    @Override public Integer value() {
      return count;
    }

    @Override public boolean matches(@Nullable MatchTracker<String> dest,
        @Nullable MatchTracker<String> src) {
      if (dest != null && src != null) {
        return count < limit && dest.hasMoreMatches()
            && src.hasMoreMatches()
            && dest.item().equals(src.item());
      }
      return dest == null ? src == null || src.isSkippable()
          : src == null && dest.isSkippable();
    }

    @Override public PairCounter accumulate(@Nullable MatchTracker<String> dest,
        @Nullable MatchTracker<String> src) {
      return dest != null && src != null
          ? new PairCounter(limit, count + 1)
          : copy();
    }

    @Override public PairCounter copy() {
      return new PairCounter(limit, count);
    }

    /** {@link #matches} depends on the count. */
    @Override public Object matchState() {
      return count;
    }

    @Override public String toString() {
      return Integer.toString(count);
    }
  }

  /** Tracer that counts steps and memoized rejections. */
  private static class CountingTracer implements Tracer {
    int stepCount;
    int memoHitCount;

    @Override public void onStart(List<? extends MatchTracker<?>> dest,
        List<? extends MatchTracker<?>> src) {
    }

    @Override public void onStep(int depth, int i, int j,
        @Nullable MatchTracker<?> dest, @Nullable MatchTracker<?> src) {
      ++stepCount;
    }

    @Override public void onCandidates(int depth, List<Move> moves) {
    }

    @Override public void onZero(int depth, @Nullable MatchTracker<?> dest,
        @Nullable MatchTracker<?> src) {
    }

    @Override public void onAccept(int depth) {
    }

    @Override public void onReject(int depth, Rejection rejection) {
      if (rejection == Rejection.MEMOIZED) {
        ++memoHitCount;
      }
    }

    @Override public void onFinish(List<? extends MatchTracker<?>> dest,
        List<? extends MatchTracker<?>> src, Optional<?> result) {
    }
  }
}

// End SequenceMatcherTest.java
