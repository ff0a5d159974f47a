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
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Ordering;
import java.util.Collection;
import java.util.Comparator;
import javax.annotation.Nullable;

/**
 * Associates a line, a session and the set of test labels that were running when the line was
 * covered. Label ids refer to the owning report's {@link LabelsIndex}.
 */
@AutoValue
public abstract class CoverageDatapoint {

  static final Comparator<CoverageDatapoint> ORDER =
      Comparator.comparingInt(CoverageDatapoint::sessionId)
          .thenComparing(
              CoverageDatapoint::labelIds, Ordering.<Integer>natural().lexicographical())
          .thenComparing(dp -> dp.coverage().toString());

  public abstract int sessionId();

  public abstract CoverageValue coverage();

  /** Branch or method; null for a plain line. */
  @Nullable
  public abstract CoverageType coverageType();

  public abstract ImmutableSortedSet<Integer> labelIds();

  public static CoverageDatapoint create(
      int sessionId,
      CoverageValue coverage,
      @Nullable CoverageType coverageType,
      Collection<Integer> labelIds) {
    checkArgument(!labelIds.isEmpty(), "A datapoint needs at least one label");
    return new AutoValue_CoverageDatapoint(
        sessionId,
        coverage,
        CoverageType.normalize(coverageType),
        ImmutableSortedSet.copyOf(labelIds));
  }

  /** Whether {@code other} describes the same session and label set. */
  boolean sameKey(CoverageDatapoint other) {
    return sessionId() == other.sessionId() && labelIds().equals(other.labelIds());
  }

  static CoverageDatapoint merge(CoverageDatapoint first, CoverageDatapoint second) {
    checkArgument(first.sameKey(second), "Datapoints %s and %s differ", first, second);
    return new AutoValue_CoverageDatapoint(
        first.sessionId(),
        CoverageMerger.mergeWithinSession(first.coverage(), second.coverage()),
        CoverageType.dominant(first.coverageType(), second.coverageType()),
        first.labelIds());
  }

  CoverageDatapoint withLabelIds(Collection<Integer> labelIds) {
    return create(sessionId(), coverage(), coverageType(), labelIds);
  }
}
