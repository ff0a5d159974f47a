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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import javax.annotation.Nullable;

/** Coverage of a single source file, keyed by line number. */
public final class ReportFile {

  private final String name;
  private final TreeMap<Integer, ReportLine> lines;

  public ReportFile(String name) {
    this.name = checkNotNull(name);
    this.lines = new TreeMap<>();
  }

  private ReportFile(ReportFile other) {
    this.name = other.name;
    this.lines = new TreeMap<>(other.lines);
  }

  public String name() {
    return name;
  }

  /** Returns a copy that can be mutated without affecting this file. Lines are immutable. */
  public ReportFile copy() {
    return new ReportFile(this);
  }

  /**
   * Adds a line, merging it with any line already recorded at the same number.
   *
   * @throws IllegalArgumentException if {@code lineNumber} is not positive
   */
  public void append(int lineNumber, ReportLine line) {
    checkArgument(lineNumber >= 1, "Line numbers start at 1, got %s", lineNumber);
    lines.merge(lineNumber, line, ReportLine::merge);
  }

  @Nullable
  public ReportLine line(int lineNumber) {
    return lines.get(lineNumber);
  }

  public SortedMap<Integer, ReportLine> lines() {
    return Collections.unmodifiableSortedMap(lines);
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }

  public ReportTotals totals() {
    return ReportTotals.ofLines(lines.values());
  }

  /**
   * Merges {@code source} into {@code target} and returns {@code target}. Used as the remapping
   * function when several reports contribute to the same file.
   */
  static ReportFile merge(ReportFile target, ReportFile source) {
    checkArgument(
        target.name.equals(source.name),
        "Cannot merge %s into %s",
        source.name,
        target.name);
    for (Entry<Integer, ReportLine> entry : source.lines.entrySet()) {
      target.append(entry.getKey(), entry.getValue());
    }
    return target;
  }

  void deleteSessions(Set<Integer> sessionIds) {
    rewriteLines(line -> line.withoutSessions(sessionIds));
  }

  void deleteLabels(Set<Integer> sessionIds, Set<Integer> labelIds) {
    rewriteLines(line -> line.withoutLabels(sessionIds, labelIds));
  }

  void remapLabels(Map<Integer, Integer> mapping) {
    rewriteLines(line -> line.withRemappedLabels(mapping));
  }

  /** Every session id contributing to some line of this file. */
  ImmutableSet<Integer> sessionIds() {
    ImmutableSet.Builder<Integer> ids = ImmutableSet.builder();
    for (ReportLine line : lines.values()) {
      for (LineSession session : line.sessions()) {
        ids.add(session.sessionId());
      }
    }
    return ids.build();
  }

  Collection<ReportLine> lineValues() {
    return lines.values();
  }

  private void rewriteLines(UnaryOperator<ReportLine> rewrite) {
    Iterator<Entry<Integer, ReportLine>> it = lines.entrySet().iterator();
    while (it.hasNext()) {
      Entry<Integer, ReportLine> entry = it.next();
      ReportLine rewritten = rewrite.apply(entry.getValue());
      if (rewritten == null) {
        it.remove();
      } else if (rewritten != entry.getValue()) {
        entry.setValue(rewritten);
      }
    }
  }

  @Override
  public String toString() {
    return name + lines;
  }
}
