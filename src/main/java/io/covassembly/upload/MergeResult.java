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

package io.covassembly.upload;

import com.google.auto.value.AutoValue;
import io.covassembly.report.Report;
import io.covassembly.report.Session;

/** The outcome of merging one upload into a report. */
@AutoValue
public abstract class MergeResult {

  /** The merged report. The report passed to the engine is left untouched. */
  public abstract Report report();

  /** The session created for the upload. */
  public abstract Session session();

  public abstract SessionAdjustmentResult sessionAdjustment();

  static MergeResult create(
      Report report, Session session, SessionAdjustmentResult sessionAdjustment) {
    return new AutoValue_MergeResult(report, session, sessionAdjustment);
  }
}
