// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.covassembly.report;

import com.google.auto.value.AutoValue;
import java.util.Locale;
import javax.annotation.Nullable;

/** Aggregate line counts of a file, a session or a whole report. Always derived, never merged. */
@AutoValue
public abstract class ReportTotals {

  private static final ReportTotals EMPTY = create(0, 0, 0, 0, 0, 0, 0, 0, 0);

  public abstract int files();

  public abstract int lines();

  public abstract int hits();

  public abstract int misses();

  public abstract int partials();

  public abstract int branches();

  public abstract int methods();

  public abstract int sessions();

  public abstract int complexity();

  public static ReportTotals create(
      int files,
      int lines,
      int hits,
      int misses,
      int partials,
      int branches,
      int methods,
      int sessions,
      int complexity) {
    return new AutoValue_ReportTotals(
        files, lines, hits, misses, partials, branches, methods, sessions, complexity);
  }

  public static ReportTotals empty() {
    return EMPTY;
  }

  /** Totals of a single file's lines. */
  public static ReportTotals ofLines(Iterable<ReportLine> lines) {
    int count = 0;
    int hits = 0;
    int misses = 0;
    int partials = 0;
    int branches = 0;
    int methods = 0;
    int complexity = 0;
    for (ReportLine line : lines) {
      count++;
      if (line.coverage().isHit()) {
        hits++;
      } else if (line.coverage().isPartial()) {
        partials++;
      } else {
        misses++;
      }
      if (line.type() == CoverageType.BRANCH) {
        branches++;
      } else if (line.type() == CoverageType.METHOD) {
        methods++;
      }
      if (line.complexity() != null) {
        complexity += line.complexity();
      }
    }
    return create(
        count > 0 ? 1 : 0, count, hits, misses, partials, branches, methods, 0, complexity);
  }

  public ReportTotals plus(ReportTotals other) {
    return create(
        files() + other.files(),
        lines() + other.lines(),
        hits() + other.hits(),
        misses() + other.misses(),
        partials() + other.partials(),
        branches() + other.branches(),
        methods() + other.methods(),
        sessions() + other.sessions(),
        complexity() + other.complexity());
  }

  public ReportTotals withSessions(int sessions) {
    return create(
        files(), lines(), hits(), misses(), partials(), branches(), methods(), sessions,
        complexity());
  }

  /** Percentage of fully hit lines with five decimals, e.g. {@code "66.66667"}; null if empty. */
  @Nullable
  public String coverage() {
    if (lines() == 0) {
      return null;
    }
    return String.format(Locale.ROOT, "%.5f", hits() * 100.0 / lines());
  }
}
