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
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * Coverage of one source line, merged over every session that observed it.
 *
 * <p>Instances are immutable; every mutation returns a new line.
 */
@AutoValue
public abstract class ReportLine {

  /** The aggregate across sessions. Used for reporting only, never merged back into a session. */
  public abstract CoverageValue coverage();

  /** Branch or method; null for a plain line. */
  @Nullable
  public abstract CoverageType type();

  /** One entry per contributing session, ordered by session id. */
  public abstract ImmutableList<LineSession> sessions();

  /**
   * Label datapoints, ordered by session and label ids. Null when labels are not tracked for this
   * line, which is not the same as an empty list.
   */
  @Nullable
  public abstract ImmutableList<CoverageDatapoint> datapoints();

  @Nullable
  public abstract Integer complexity();

  public static ReportLine create(@Nullable CoverageType type, LineSession... sessions) {
    return create(type, ImmutableList.copyOf(sessions), null);
  }

  /**
   * Creates a line from its sessions and datapoints. Sessions with the same id and datapoints with
   * the same session and label set are merged.
   */
  public static ReportLine create(
      @Nullable CoverageType type,
      Collection<LineSession> sessions,
      @Nullable Collection<CoverageDatapoint> datapoints) {
    checkArgument(!sessions.isEmpty(), "A line needs at least one session");
    TreeMap<Integer, LineSession> byId = new TreeMap<>();
    for (LineSession session : sessions) {
      byId.merge(session.sessionId(), session, LineSession::merge);
    }
    ImmutableList<LineSession> merged = ImmutableList.copyOf(byId.values());
    Integer complexity = null;
    for (LineSession session : merged) {
      complexity = LineSession.maxOrNull(complexity, session.complexity());
    }
    return new AutoValue_ReportLine(
        CoverageMerger.aggregateSessions(merged),
        CoverageType.normalize(type),
        merged,
        datapoints == null ? null : normalize(datapoints),
        complexity);
  }

  private static ImmutableList<CoverageDatapoint> normalize(
      Collection<CoverageDatapoint> datapoints) {
    List<CoverageDatapoint> merged = new ArrayList<>();
    for (CoverageDatapoint datapoint : datapoints) {
      int existing = indexOfKey(merged, datapoint);
      if (existing < 0) {
        merged.add(datapoint);
      } else {
        merged.set(existing, CoverageDatapoint.merge(merged.get(existing), datapoint));
      }
    }
    merged.sort(CoverageDatapoint.ORDER);
    return ImmutableList.copyOf(merged);
  }

  private static int indexOfKey(List<CoverageDatapoint> datapoints, CoverageDatapoint key) {
    for (int i = 0; i < datapoints.size(); i++) {
      if (datapoints.get(i).sameKey(key)) {
        return i;
      }
    }
    return -1;
  }

  /** Merges two observations of the same line. Commutative and associative. */
  public static ReportLine merge(ReportLine first, ReportLine second) {
    List<LineSession> sessions = new ArrayList<>(first.sessions());
    sessions.addAll(second.sessions());
    List<CoverageDatapoint> datapoints = null;
    if (first.datapoints() != null || second.datapoints() != null) {
      datapoints = new ArrayList<>();
      if (first.datapoints() != null) {
        datapoints.addAll(first.datapoints());
      }
      if (second.datapoints() != null) {
        datapoints.addAll(second.datapoints());
      }
    }
    return create(CoverageType.dominant(first.type(), second.type()), sessions, datapoints);
  }

  @Nullable
  public LineSession session(int sessionId) {
    for (LineSession session : sessions()) {
      if (session.sessionId() == sessionId) {
        return session;
      }
    }
    return null;
  }

  /**
   * Drops every contribution of the given sessions.
   *
   * @return the remaining line, or null if no session is left
   */
  @Nullable
  ReportLine withoutSessions(Set<Integer> sessionIds) {
    ImmutableList<LineSession> kept =
        sessions().stream()
            .filter(s -> !sessionIds.contains(s.sessionId()))
            .collect(toImmutableList());
    if (kept.size() == sessions().size()) {
      return this;
    }
    if (kept.isEmpty()) {
      return null;
    }
    ImmutableList<CoverageDatapoint> datapoints =
        datapoints() == null
            ? null
            : datapoints().stream()
                .filter(dp -> !sessionIds.contains(dp.sessionId()))
                .collect(toImmutableList());
    return create(type(), kept, datapoints);
  }

  /**
   * Drops the datapoints of {@code sessionIds} whose label set is contained in {@code labelIds}. A
   * session that had datapoints on this line and has none left stops contributing to it.
   *
   * @return the remaining line, or null if no session is left
   */
  @Nullable
  ReportLine withoutLabels(Set<Integer> sessionIds, Set<Integer> labelIds) {
    if (datapoints() == null || datapoints().isEmpty()) {
      return this;
    }
    ImmutableList<CoverageDatapoint> kept =
        datapoints().stream()
            .filter(
                dp -> !sessionIds.contains(dp.sessionId()) || !labelIds.containsAll(dp.labelIds()))
            .collect(toImmutableList());
    if (kept.size() == datapoints().size()) {
      return this;
    }
    Set<Integer> hadDatapoints =
        datapoints().stream().map(CoverageDatapoint::sessionId).collect(toImmutableSet());
    Set<Integer> stillHave =
        kept.stream().map(CoverageDatapoint::sessionId).collect(toImmutableSet());
    ImmutableList<LineSession> sessions =
        sessions().stream()
            .filter(
                s ->
                    !sessionIds.contains(s.sessionId())
                        || !hadDatapoints.contains(s.sessionId())
                        || stillHave.contains(s.sessionId()))
            .collect(toImmutableList());
    if (sessions.isEmpty()) {
      return null;
    }
    return create(type(), sessions, kept);
  }

  /** Rewrites label ids through {@code mapping}; ids absent from the mapping are kept. */
  ReportLine withRemappedLabels(Map<Integer, Integer> mapping) {
    if (datapoints() == null || datapoints().isEmpty() || mapping.isEmpty()) {
      return this;
    }
    ImmutableList<CoverageDatapoint> remapped =
        datapoints().stream()
            .map(
                dp ->
                    dp.withLabelIds(
                        dp.labelIds().stream()
                            .map(id -> mapping.getOrDefault(id, id))
                            .collect(toImmutableList())))
            .collect(toImmutableList());
    return create(type(), sessions(), remapped);
  }

  /** The label ids this line's datapoints attribute to {@code sessionId}. */
  ImmutableSet<Integer> labelIds(int sessionId) {
    if (datapoints() == null) {
      return ImmutableSet.of();
    }
    return datapoints().stream()
        .filter(dp -> dp.sessionId() == sessionId)
        .flatMap(dp -> dp.labelIds().stream())
        .collect(toImmutableSet());
  }

  /** Every label id referenced by this line's datapoints. */
  ImmutableSet<Integer> labelIds() {
    if (datapoints() == null) {
      return ImmutableSet.of();
    }
    return datapoints().stream()
        .flatMap(dp -> dp.labelIds().stream())
        .collect(toImmutableSet());
  }
}
