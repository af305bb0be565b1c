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
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import net.hydromatic.seqmatch.SequenceMatcher.Move;
import net.hydromatic.seqmatch.SequenceMatcher.Rejection;
import net.hydromatic.seqmatch.SequenceMatcher.Tracer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of {@link SequenceMatcher.Tracer}. */
public class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer nullTracer() {
    return NullTracer.INSTANCE;
  }

  /** Returns a tracer that writes debugging messages to a writer. */
  public static Tracer printTracer(PrintWriter w) {
    return new PrintTracer(w, String::valueOf, String::valueOf);
  }

  /**
   * Returns a tracer that writes debugging messages to a writer, rendering
   * destination and source item values using the given functions.
   */
  public static Tracer printTracer(
      PrintWriter w,
      Function<Object, String> destStr,
      Function<Object, String> srcStr) {
    return new PrintTracer(w, destStr, srcStr);
  }

  /** Returns a tracer that writes debugging messages to a stream. */
  public static Tracer printTracer(OutputStream stream) {
    return printTracer(
        new PrintWriter(
            new OutputStreamWriter(stream, StandardCharsets.UTF_8)));
  }

  /** Implementation of {@link Tracer} that does nothing. */
  private static class NullTracer implements Tracer {
    static final NullTracer INSTANCE = new NullTracer();

    @Override
    public void onStart(
        List<? extends MatchTracker<?>> dest,
        List<? extends MatchTracker<?>> src) {}

    @Override
    public void onStep(
        int depth,
        int i,
        int j,
        @Nullable MatchTracker<?> dest,
        @Nullable MatchTracker<?> src) {}

    @Override
    public void onCandidates(int depth, List<Move> moves) {}

    @Override
    public void onZero(
        int depth,
        @Nullable MatchTracker<?> dest,
        @Nullable MatchTracker<?> src) {}

    @Override
    public void onAccept(int depth) {}

    @Override
    public void onReject(int depth, Rejection rejection) {}

    @Override
    public void onFinish(
        List<? extends MatchTracker<?>> dest,
        List<? extends MatchTracker<?>> src,
        Optional<?> result) {}
  }

  /**
   * Implementation of {@link Tracer} that writes to a given {@link
   * PrintWriter}.
   *
   * <p>Each line starts with "[seqmatch] " followed by one "-" per level of
   * recursion. Each line is built in its own buffer and written by one call
   * to {@link PrintWriter#println(Object)}.
   */
  private static class PrintTracer implements Tracer {
    private final PrintWriter w;
    private final Function<Object, String> destStr;
    private final Function<Object, String> srcStr;

    PrintTracer(
        PrintWriter w,
        Function<Object, String> destStr,
        Function<Object, String> srcStr) {
      this.w = requireNonNull(w);
      this.destStr = requireNonNull(destStr);
      this.srcStr = requireNonNull(srcStr);
    }

    private static StringBuilder line(int depth) {
      return new StringBuilder("[seqmatch] ")
          .append(Strings.repeat("-", depth));
    }

    private void flush(StringBuilder b) {
      w.println(b);
      w.flush();
    }

    private static String describe(
        @Nullable MatchTracker<?> tracker, Function<Object, String> toStr) {
      return tracker == null ? "<end>" : tracker.describe(toStr);
    }

    private static StringBuilder describe(
        StringBuilder b,
        List<? extends MatchTracker<?>> trackers,
        Function<Object, String> toStr) {
      b.append('[');
      Joiner.on(';')
          .appendTo(b, Lists.transform(trackers, t -> describe(t, toStr)));
      return b.append(']');
    }

    private StringBuilder describe(
        StringBuilder b,
        List<? extends MatchTracker<?>> dest,
        List<? extends MatchTracker<?>> src) {
      describe(b, dest, destStr).append(" ==?== ");
      return describe(b, src, srcStr);
    }

    @Override
    public void onStart(
        List<? extends MatchTracker<?>> dest,
        List<? extends MatchTracker<?>> src) {
      flush(describe(line(0), dest, src));
    }

    @Override
    public void onStep(
        int depth,
        int i,
        int j,
        @Nullable MatchTracker<?> dest,
        @Nullable MatchTracker<?> src) {
      flush(
          line(depth)
              .append("step(")
              .append(i)
              .append(": ")
              .append(describe(dest, destStr))
              .append(", ")
              .append(j)
              .append(": ")
              .append(describe(src, srcStr))
              .append(')'));
    }

    @Override
    public void onCandidates(int depth, List<Move> moves) {
      final StringBuilder b = line(depth).append("* steps:");
      for (int i = 0; i < moves.size(); i++) {
        b.append(i > 0 ? ", " : " ").append(moves.get(i));
      }
      flush(b);
    }

    @Override
    public void onZero(
        int depth,
        @Nullable MatchTracker<?> dest,
        @Nullable MatchTracker<?> src) {
      if (dest == null) {
        flush(
            line(depth)
                .append("* dest terminated; src ")
                .append(describe(src, srcStr))
                .append(" matches zero"));
      } else {
        flush(
            line(depth)
                .append("* src terminated; dest ")
                .append(describe(dest, destStr))
                .append(" matches zero"));
      }
    }

    @Override
    public void onAccept(int depth) {
      flush(line(depth).append("[ACCEPT] both terminated"));
    }

    @Override
    public void onReject(int depth, Rejection rejection) {
      flush(line(depth).append("[REJECT] ").append(rejection.description));
    }

    @Override
    public void onFinish(
        List<? extends MatchTracker<?>> dest,
        List<? extends MatchTracker<?>> src,
        Optional<?> result) {
      flush(
          describe(line(0), dest, src)
              .append(" ==> ")
              .append(result.isPresent() ? result.get() : "none"));
    }
  }
}

// End Tracers.java
