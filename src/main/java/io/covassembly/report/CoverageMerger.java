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

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.Math.max;
import static java.lang.Math.min;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * Merge rules for coverage observations.
 *
 * <p>Two observations of the same execution (one session) are combined with {@link
 * #mergeWithinSession}: counts take the larger value. Observations from distinct sessions are
 * combined with {@link #mergeAcrossSessions}: counts add up. In both cases booleans OR together and
 * branch ratios keep the best covered/total pair, so merging never lowers coverage.
 */
public final class CoverageMerger {

  private CoverageMerger() {}

  public static CoverageValue mergeWithinSession(CoverageValue first, CoverageValue second) {
    return merge(first, second, /* sumHits= */ false);
  }

  public static CoverageValue mergeAcrossSessions(CoverageValue first, CoverageValue second) {
    return merge(first, second, /* sumHits= */ true);
  }

  /** Folds {@code values} with {@link #mergeWithinSession}. */
  public static CoverageValue mergeAllWithinSession(Collection<CoverageValue> values) {
    checkArgument(!values.isEmpty(), "Nothing to merge");
    Iterator<CoverageValue> iterator = values.iterator();
    CoverageValue merged = iterator.next();
    while (iterator.hasNext()) {
      merged = mergeWithinSession(merged, iterator.next());
    }
    return merged;
  }

  private static CoverageValue merge(CoverageValue first, CoverageValue second, boolean sumHits) {
    if (first.equals(second) && first.kind() != CoverageValue.Kind.HITS) {
      return first;
    }
    if (first.kind() == CoverageValue.Kind.BRANCH && second.kind() == CoverageValue.Kind.BRANCH) {
      long total = max(first.total(), second.total());
      return CoverageValue.ofBranches(min(max(first.hits(), second.hits()), total), total);
    }
    // A branch ratio carries more detail than a count, keep it.
    if (first.kind() == CoverageValue.Kind.BRANCH) {
      return first;
    }
    if (second.kind() == CoverageValue.Kind.BRANCH) {
      return second;
    }
    if (first.kind() == CoverageValue.Kind.BOOLEAN && second.kind() == CoverageValue.Kind.BOOLEAN) {
      return CoverageValue.ofBoolean(first.hits() > 0 || second.hits() > 0);
    }
    long hits = sumHits ? first.hits() + second.hits() : max(first.hits(), second.hits());
    return CoverageValue.ofHits(hits);
  }

  /**
   * Reconciles the missing branch ids of two observations of a line. A branch stays missing only
   * if every observation that lists missing branches misses it: a branch covered in any merged
   * report is no longer missing.
   *
   * @return null if neither observation lists missing branches
   */
  @Nullable
  public static ImmutableList<String> mergeMissingBranches(
      @Nullable List<String> first, @Nullable List<String> second) {
    if (first == null) {
      return second == null ? null : ImmutableList.copyOf(second);
    }
    if (second == null) {
      return ImmutableList.copyOf(first);
    }
    Set<String> kept = new HashSet<>(second);
    ImmutableList.Builder<String> merged = ImmutableList.builder();
    for (String branch : new LinkedHashSet<>(first)) {
      if (kept.contains(branch)) {
        merged.add(branch);
      }
    }
    return merged.build();
  }

  /**
   * Recomputes a branch ratio from the list of branches still missing. Values that are not branch
   * ratios, or a null list, are returned unchanged.
   */
  public static CoverageValue applyMissingBranches(
      CoverageValue value, @Nullable List<String> missingBranches) {
    if (value.kind() != CoverageValue.Kind.BRANCH || missingBranches == null) {
      return value;
    }
    long missing = min(ImmutableSet.copyOf(missingBranches).size(), value.total());
    return CoverageValue.ofBranches(value.total() - missing, value.total());
  }

  /**
   * Aggregates the per-session values of a line into the value exposed for reporting.
   *
   * <p>When every session that reports a branch ratio also lists its missing branches, the ratio
   * is recomputed from the branches missed by all of them.
   */
  static CoverageValue aggregateSessions(List<LineSession> sessions) {
    checkArgument(!sessions.isEmpty(), "A line needs at least one session");
    CoverageValue merged = null;
    List<String> missing = null;
    boolean allBranchesListed = true;
    boolean anyBranch = false;
    for (LineSession session : sessions) {
      merged =
          merged == null ? session.coverage() : mergeAcrossSessions(merged, session.coverage());
      if (session.coverage().kind() == CoverageValue.Kind.BRANCH) {
        anyBranch = true;
        if (session.missingBranches() == null) {
          allBranchesListed = false;
        } else {
          missing =
              missing == null
                  ? session.missingBranches()
                  : mergeMissingBranches(missing, session.missingBranches());
        }
      }
    }
    if (anyBranch && allBranchesListed) {
      return applyMissingBranches(merged, missing);
    }
    return merged;
  }

  /**
   * Merges the partial coverage spans observed for one line into the minimal ordered list of
   * non-overlapping spans.
   *
   * <pre>
   *       | . . . . . |
   *  in:      0+          (2, null, 0)
   *  in:    1   1         (1, 3, 1), (4, 5, 1)
   *  in:          0 0     (4, 6, 0)
   * out:    1 1 0 1 0+    [1, 3, 1], [3, 4, 0], [4, 5, 1], [5, null, 0]
   * </pre>
   *
   * @return the merged spans, or null if the input describes no column at all
   */
  @Nullable
  public static ImmutableList<PartialSpan> combinePartials(List<PartialSpan> partials) {
    if (partials.size() == 1) {
      return ImmutableList.copyOf(partials);
    }
    TreeMap<Integer, List<CoverageValue>> columns = new TreeMap<>();
    Set<Integer> closedColumns = new HashSet<>();
    for (PartialSpan span : partials) {
      if (!span.isOpenEnded()) {
        for (int column = span.firstColumn(); column < span.end(); column++) {
          columns.computeIfAbsent(column, c -> new ArrayList<>()).add(span.value());
          closedColumns.add(column);
        }
      }
    }

    int lastColumn = columns.isEmpty() ? 0 : columns.lastKey() + 1;
    for (PartialSpan span : partials) {
      if (span.isOpenEnded()) {
        lastColumn = max(lastColumn, span.firstColumn());
      }
    }
    List<CoverageValue> endOfLine = new ArrayList<>();
    for (PartialSpan span : partials) {
      if (span.isOpenEnded()) {
        for (int column = span.firstColumn(); column < lastColumn; column++) {
          columns.computeIfAbsent(column, c -> new ArrayList<>()).add(span.value());
        }
        endOfLine.add(span.value());
      }
    }

    List<Run> runs = collapse(columns);
    if (!endOfLine.isEmpty()) {
      if (!runs.isEmpty() && runs.get(0).isLeadingColumn() && !closedColumns.contains(0)) {
        endOfLine.add(runs.remove(0).value);
      }
      CoverageValue endOfLineValue = mergeAllWithinSession(endOfLine);
      Run last = runs.isEmpty() ? null : runs.get(runs.size() - 1);
      if (last != null && last.end == lastColumn && last.value.equals(endOfLineValue)) {
        last.end = null;
      } else {
        runs.add(new Run(lastColumn, null, endOfLineValue));
      }
    }
    if (runs.isEmpty()) {
      return null;
    }
    ImmutableList.Builder<PartialSpan> merged = ImmutableList.builder();
    for (Run run : runs) {
      merged.add(PartialSpan.create(run.start, run.end, run.value));
    }
    return merged.build();
  }

  /** Groups adjacent columns with an equal merged value into runs. */
  @VisibleForTesting
  static List<Run> collapse(TreeMap<Integer, List<CoverageValue>> columns) {
    List<Run> runs = new ArrayList<>();
    Run current = null;
    for (Entry<Integer, List<CoverageValue>> column : columns.entrySet()) {
      CoverageValue value = mergeAllWithinSession(column.getValue());
      if (current != null
          && current.end.intValue() == column.getKey()
          && current.value.equals(value)) {
        current.end = column.getKey() + 1;
      } else {
        current = new Run(column.getKey(), column.getKey() + 1, value);
        runs.add(current);
      }
    }
    return runs;
  }

  /** A mutable span used while collapsing columns. */
  @VisibleForTesting
  static final class Run {
    final int start;
    Integer end;
    final CoverageValue value;

    Run(int start, @Nullable Integer end, CoverageValue value) {
      this.start = start;
      this.end = end;
      this.value = value;
    }

    boolean isLeadingColumn() {
      return start == 0 && end != null && end == 1;
    }
  }
}
