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

package io.covassembly.builder;

import com.google.common.collect.ImmutableList;
import io.covassembly.report.CoverageDatapoint;
import io.covassembly.report.CoverageType;
import io.covassembly.report.CoverageValue;
import io.covassembly.report.LineSession;
import io.covassembly.report.PartialSpan;
import io.covassembly.report.ReportFile;
import io.covassembly.report.ReportLine;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import javax.annotation.Nullable;

/** Collects the lines of one source file. */
public final class FileBuilder {

  private final ReportBuilderSession session;
  private final ReportFile file;

  FileBuilder(ReportBuilderSession session, String path) {
    this.session = session;
    this.file = new ReportFile(path);
  }

  public String path() {
    return file.name();
  }

  public FileBuilder append(int lineNumber, CoverageValue value) {
    return append(lineNumber, value, null, null, null, null, null);
  }

  /**
   * Records an observation of a line. Appending to a line seen before merges the observations.
   *
   * @param labelHints groups of labels that covered the line; each distinct non-empty group yields
   *     one datapoint. Ignored when labels are not tracked.
   * @throws IllegalArgumentException if {@code lineNumber} is not positive
   */
  public FileBuilder append(
      int lineNumber,
      CoverageValue value,
      @Nullable CoverageType type,
      @Nullable List<PartialSpan> partials,
      @Nullable List<String> missingBranches,
      @Nullable Integer complexity,
      @Nullable List<List<LabelHint>> labelHints) {
    if (lineNumber < 1) {
      throw new IllegalArgumentException(
          "Line numbers start at 1, got " + lineNumber + " in " + file.name());
    }
    int sessionId = session.sessionId();
    LineSession lineSession =
        LineSession.create(sessionId, value, missingBranches, partials, complexity);
    List<CoverageDatapoint> datapoints = null;
    if (session.supportsLabels()) {
      datapoints = new ArrayList<>();
      for (Set<Integer> group : labelGroups(labelHints)) {
        datapoints.add(CoverageDatapoint.create(sessionId, value, type, group));
      }
    }
    file.append(lineNumber, ReportLine.create(type, ImmutableList.of(lineSession), datapoints));
    return this;
  }

  private Set<Set<Integer>> labelGroups(@Nullable List<List<LabelHint>> labelHints) {
    Set<Set<Integer>> groups = new LinkedHashSet<>();
    if (labelHints == null) {
      return groups;
    }
    for (List<LabelHint> hints : labelHints) {
      Set<Integer> ids = new TreeSet<>();
      for (LabelHint hint : hints) {
        ids.add(session.labelId(hint));
      }
      if (!ids.isEmpty()) {
        groups.add(ids);
      }
    }
    return groups;
  }

  /** Adds the collected lines to the session's report. Files without lines are dropped. */
  public ReportFile finish() {
    session.addFile(file);
    return file;
  }
}
