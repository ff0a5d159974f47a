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

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * A coverage report: files keyed by canonical path, the sessions that contributed to them and the
 * index of the test labels their datapoints refer to.
 *
 * <p>A report is mutable. Transactions that must leave a report untouched on failure work on a
 * {@link #copy()}.
 */
public final class Report {

  private final TreeMap<String, ReportFile> files;
  private final TreeMap<Integer, Session> sessions;
  @Nullable private LabelsIndex labelsIndex;
  private int nextSessionId;

  public Report() {
    files = new TreeMap<>();
    sessions = new TreeMap<>();
    labelsIndex = null;
    nextSessionId = 0;
  }

  /** Returns a deep copy of this report. */
  public Report copy() {
    Report copy = new Report();
    for (ReportFile file : files.values()) {
      copy.files.put(file.name(), file.copy());
    }
    copy.sessions.putAll(sessions);
    copy.labelsIndex = labelsIndex == null ? null : labelsIndex.copy();
    copy.nextSessionId = nextSessionId;
    return copy;
  }

  /** Adds a file, merging its lines into any file already recorded under the same path. */
  public void append(ReportFile file) {
    files.merge(file.name(), file.copy(), ReportFile::merge);
  }

  /**
   * Merges the files of {@code other} into this report. Sessions and labels of {@code other} are
   * not carried over; label ids of {@code other} must already refer to this report's index.
   */
  public void merge(Report other) {
    for (ReportFile file : other.files.values()) {
      append(file);
    }
  }

  public SortedMap<String, ReportFile> files() {
    return Collections.unmodifiableSortedMap(files);
  }

  @Nullable
  public ReportFile file(String name) {
    return files.get(name);
  }

  public boolean isEmpty() {
    return files.isEmpty();
  }

  public SortedMap<Integer, Session> sessions() {
    return Collections.unmodifiableSortedMap(sessions);
  }

  @Nullable
  public Session session(int id) {
    return sessions.get(id);
  }

  /**
   * The id the next added session will get. Ids are never reused, even after the session holding
   * the largest one is deleted.
   */
  public int nextSessionId() {
    return sessions.isEmpty() ? nextSessionId : Math.max(nextSessionId, sessions.lastKey() + 1);
  }

  /** Restores the persisted high-water mark of session ids. */
  public void setNextSessionId(int nextSessionId) {
    checkArgument(nextSessionId >= 0, "Session ids are non-negative: %s", nextSessionId);
    this.nextSessionId = nextSessionId;
  }

  /** Adds a session under the next free id and returns it with that id. */
  public Session addSession(Session session) {
    return putSession(session.withId(nextSessionId()));
  }

  /**
   * Adds a session under its own id.
   *
   * @throws IllegalArgumentException if the id is unassigned or already taken
   */
  public Session putSession(Session session) {
    checkArgument(session.id() >= 0, "Session %s has no id", session);
    checkArgument(
        !sessions.containsKey(session.id()), "Session id %s is already taken", session.id());
    sessions.put(session.id(), session);
    nextSessionId = Math.max(nextSessionId, session.id() + 1);
    return session;
  }

  /** Replaces the metadata of a session already present in this report. */
  public void updateSession(Session session) {
    checkArgument(sessions.containsKey(session.id()), "Unknown session %s", session.id());
    sessions.put(session.id(), session);
  }

  /** Removes the sessions and every line contribution they made. Files left empty are dropped. */
  public void deleteSessions(Collection<Integer> sessionIds) {
    if (sessionIds.isEmpty()) {
      return;
    }
    nextSessionId = nextSessionId();
    Set<Integer> ids = ImmutableSet.copyOf(sessionIds);
    sessions.keySet().removeAll(ids);
    Iterator<ReportFile> it = files.values().iterator();
    while (it.hasNext()) {
      ReportFile file = it.next();
      file.deleteSessions(ids);
      if (file.isEmpty()) {
        it.remove();
      }
    }
  }

  /**
   * Removes the datapoints of {@code sessionIds} whose label set is contained in {@code labelIds},
   * along with line contributions left without datapoints. Files left empty are dropped.
   */
  public void deleteLabels(Collection<Integer> sessionIds, Collection<Integer> labelIds) {
    if (sessionIds.isEmpty() || labelIds.isEmpty()) {
      return;
    }
    Set<Integer> sessionSet = ImmutableSet.copyOf(sessionIds);
    Set<Integer> labelSet = ImmutableSet.copyOf(labelIds);
    Iterator<ReportFile> it = files.values().iterator();
    while (it.hasNext()) {
      ReportFile file = it.next();
      file.deleteLabels(sessionSet, labelSet);
      if (file.isEmpty()) {
        it.remove();
      }
    }
  }

  @Nullable
  public LabelsIndex labelsIndex() {
    return labelsIndex;
  }

  public void setLabelsIndex(@Nullable LabelsIndex labelsIndex) {
    this.labelsIndex = labelsIndex;
  }

  /** Rewrites label ids in every datapoint; ids absent from {@code mapping} are kept. */
  public void remapLabels(Map<Integer, Integer> mapping) {
    if (mapping.isEmpty()) {
      return;
    }
    for (ReportFile file : files.values()) {
      file.remapLabels(mapping);
    }
  }

  /** Label ids the session's datapoints refer to, without the placeholder. */
  public ImmutableSet<Integer> labelIdsForSession(int sessionId) {
    ImmutableSet.Builder<Integer> ids = ImmutableSet.builder();
    for (ReportFile file : files.values()) {
      for (ReportLine line : file.lineValues()) {
        ids.addAll(line.labelIds(sessionId));
      }
    }
    return withoutPlaceholder(ids.build());
  }

  /** Every label id referenced by a datapoint, without the placeholder. */
  public ImmutableSet<Integer> allLabelIds() {
    ImmutableSet.Builder<Integer> ids = ImmutableSet.builder();
    for (ReportFile file : files.values()) {
      for (ReportLine line : file.lineValues()) {
        ids.addAll(line.labelIds());
      }
    }
    return withoutPlaceholder(ids.build());
  }

  /** Session ids referenced by some line, whether or not the session itself is known. */
  public ImmutableSet<Integer> lineSessionIds() {
    ImmutableSet.Builder<Integer> ids = ImmutableSet.builder();
    for (ReportFile file : files.values()) {
      ids.addAll(file.sessionIds());
    }
    return ids.build();
  }

  private static ImmutableSet<Integer> withoutPlaceholder(ImmutableSet<Integer> ids) {
    if (!ids.contains(SpecialLabels.PLACEHOLDER_ID)) {
      return ids;
    }
    ImmutableSet.Builder<Integer> filtered = ImmutableSet.builder();
    for (int id : ids) {
      if (id != SpecialLabels.PLACEHOLDER_ID) {
        filtered.add(id);
      }
    }
    return filtered.build();
  }

  public ReportTotals totals() {
    ReportTotals totals = ReportTotals.empty();
    for (ReportFile file : files.values()) {
      totals = totals.plus(file.totals());
    }
    return totals.withSessions(sessions.size());
  }

  @Override
  public String toString() {
    return "Report{files=" + files.keySet() + ", sessions=" + sessions.keySet() + "}";
  }
}
