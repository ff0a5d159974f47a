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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import io.covassembly.config.AssemblyContext;
import io.covassembly.paths.PathResolver;
import java.util.List;

/**
 * Entry point for turning decoded coverage into reports. One builder serves one upload: every
 * line it produces is attributed to the upload's session.
 */
public final class ReportBuilder {

  private final int sessionId;
  private final PathResolver pathResolver;
  private final boolean supportsLabels;

  private ReportBuilder(int sessionId, PathResolver pathResolver, boolean supportsLabels) {
    this.sessionId = sessionId;
    this.pathResolver = pathResolver;
    this.supportsLabels = supportsLabels;
  }

  /**
   * Creates a builder for the session {@code sessionId}. Test labels are tracked when some flag
   * carries forward by labels.
   */
  public static ReportBuilder create(
      AssemblyContext context, int sessionId, PathResolver pathResolver) {
    return new ReportBuilder(
        sessionId, pathResolver, context.carryforwardRules().usesLabels());
  }

  @VisibleForTesting
  static ReportBuilder create(int sessionId, PathResolver pathResolver, boolean supportsLabels) {
    return new ReportBuilder(sessionId, pathResolver, supportsLabels);
  }

  public int sessionId() {
    return sessionId;
  }

  public boolean supportsLabels() {
    return supportsLabels;
  }

  public PathResolver pathResolver() {
    return pathResolver;
  }

  /** Starts building the report of one uploaded file. */
  public ReportBuilderSession createSession(String uploadedFileName) {
    return createSession(uploadedFileName, ImmutableList.of());
  }

  /**
   * Starts building the report of one uploaded file whose relative paths may also be relative to
   * one of {@code basesToTry}.
   */
  public ReportBuilderSession createSession(String uploadedFileName, List<String> basesToTry) {
    return new ReportBuilderSession(this, uploadedFileName, basesToTry);
  }
}
