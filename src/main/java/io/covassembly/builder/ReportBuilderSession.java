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
import com.google.common.collect.ImmutableSet;
import io.covassembly.paths.BasePathAwarePathResolver;
import io.covassembly.report.LabelsIndex;
import io.covassembly.report.Report;
import io.covassembly.report.ReportFile;
import io.covassembly.report.SpecialLabels;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Builds the report of a single uploaded file. Not thread safe; files of an upload built in
 * parallel each get their own session.
 */
public final class ReportBuilderSession {

  private final ReportBuilder builder;
  private final String uploadedFileName;
  private final BasePathAwarePathResolver pathResolver;
  private final ImmutableList<String> basesToTry;
  private final Report report = new Report();
  @Nullable private final LabelsIndex labelsIndex;
  private final Map<String, Optional<String>> resolvedPaths = new HashMap<>();
  private final Set<String> rejectedPaths = new LinkedHashSet<>();

  ReportBuilderSession(ReportBuilder builder, String uploadedFileName, List<String> basesToTry) {
    this.builder = builder;
    this.uploadedFileName = uploadedFileName;
    this.basesToTry = ImmutableList.copyOf(basesToTry);
    this.pathResolver = builder.pathResolver().forUploadedFile(uploadedFileName);
    this.labelsIndex = builder.supportsLabels() ? LabelsIndex.create() : null;
  }

  public String uploadedFileName() {
    return uploadedFileName;
  }

  public int sessionId() {
    return builder.sessionId();
  }

  public boolean supportsLabels() {
    return labelsIndex != null;
  }

  /** Resolves a path found in the uploaded file. Results are cached for the session. */
  public Optional<String> resolvePath(String rawPath) {
    Optional<String> result =
        resolvedPaths.computeIfAbsent(rawPath, path -> pathResolver.resolve(path, basesToTry));
    if (!result.isPresent()) {
      rejectedPaths.add(rawPath);
    }
    return result;
  }

  /**
   * Starts building the coverage of the file at {@code rawPath}, or returns empty if the path does
   * not belong in the report.
   */
  public Optional<FileBuilder> createFile(String rawPath) {
    return resolvePath(rawPath).map(path -> new FileBuilder(this, path));
  }

  /**
   * Returns the session-local id of {@code label}, registering it if needed. The empty label is
   * the all-labels placeholder.
   *
   * @throws IllegalStateException if labels are not tracked
   */
  public int registerLabel(String label) {
    if (labelsIndex == null) {
      throw new IllegalStateException("Labels are not tracked for this upload");
    }
    if (label.isEmpty()) {
      return SpecialLabels.PLACEHOLDER_ID;
    }
    return labelsIndex.idFor(label);
  }

  /** Resolves a hint to a session-local label id. */
  int labelId(LabelHint hint) {
    if (hint.id() != null) {
      if (labelsIndex == null || !labelsIndex.containsId(hint.id())) {
        throw new IllegalArgumentException("Unknown label id " + hint.id());
      }
      return hint.id();
    }
    return registerLabel(hint.label() == null ? "" : hint.label());
  }

  void addFile(ReportFile file) {
    if (!file.isEmpty()) {
      report.append(file);
    }
  }

  /** Raw paths of this file that were rejected. */
  public ImmutableSet<String> rejectedPaths() {
    return ImmutableSet.copyOf(rejectedPaths);
  }

  /**
   * The report of the uploaded file. When labels are tracked, its index holds the labels
   * registered with this session.
   */
  public Report output() {
    Report output = report.copy();
    output.setLabelsIndex(labelsIndex == null ? null : labelsIndex.copy());
    return output;
  }
}
