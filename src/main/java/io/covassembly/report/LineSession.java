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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/** One session's contribution to a line. */
@AutoValue
public abstract class LineSession {

  public abstract int sessionId();

  public abstract CoverageValue coverage();

  /** Ids of the branches this session did not cover, if the tool reports them. */
  @Nullable
  public abstract ImmutableList<String> missingBranches();

  @Nullable
  public abstract ImmutableList<PartialSpan> partials();

  @Nullable
  public abstract Integer complexity();

  public static LineSession create(int sessionId, CoverageValue coverage) {
    return create(sessionId, coverage, null, null, null);
  }

  public static LineSession create(
      int sessionId,
      CoverageValue coverage,
      @Nullable List<String> missingBranches,
      @Nullable List<PartialSpan> partials,
      @Nullable Integer complexity) {
    checkArgument(sessionId >= 0, "Session ids are non-negative: %s", sessionId);
    return new AutoValue_LineSession(
        sessionId,
        coverage,
        missingBranches == null ? null : ImmutableList.copyOf(missingBranches),
        partials == null ? null : ImmutableList.copyOf(partials),
        complexity);
  }

  /**
   * Merges two observations of the same line made by the same session.
   *
   * <p>Counts take the larger value, partial spans are combined column by column and a branch is
   * missing only if both observations miss it.
   */
  static LineSession merge(LineSession first, LineSession second) {
    checkArgument(
        first.sessionId() == second.sessionId(),
        "Cannot merge sessions %s and %s",
        first.sessionId(),
        second.sessionId());
    ImmutableList<String> missing =
        CoverageMerger.mergeMissingBranches(first.missingBranches(), second.missingBranches());
    CoverageValue coverage = CoverageMerger.mergeWithinSession(first.coverage(), second.coverage());
    if (first.missingBranches() != null && second.missingBranches() != null) {
      coverage = CoverageMerger.applyMissingBranches(coverage, missing);
    } else if (missing != null && coverage.isHit()) {
      missing = ImmutableList.of();
    }
    return new AutoValue_LineSession(
        first.sessionId(),
        coverage,
        missing,
        mergePartials(first.partials(), second.partials()),
        maxOrNull(first.complexity(), second.complexity()));
  }

  @Nullable
  private static ImmutableList<PartialSpan> mergePartials(
      @Nullable List<PartialSpan> first, @Nullable List<PartialSpan> second) {
    if (first == null || second == null) {
      return first == null ? copyOrNull(second) : copyOrNull(first);
    }
    return CoverageMerger.combinePartials(
        ImmutableList.<PartialSpan>builder().addAll(first).addAll(second).build());
  }

  @Nullable
  private static ImmutableList<PartialSpan> copyOrNull(@Nullable List<PartialSpan> partials) {
    return partials == null ? null : ImmutableList.copyOf(partials);
  }

  @Nullable
  static Integer maxOrNull(@Nullable Integer first, @Nullable Integer second) {
    if (first == null) {
      return second;
    }
    return second == null ? first : Math.max(first, second);
  }
}
