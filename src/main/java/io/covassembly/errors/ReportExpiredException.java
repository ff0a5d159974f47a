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

package io.covassembly.errors;

import java.time.Instant;

/**
 * The uploaded file declares a generation timestamp older than the configured maximum report age.
 * Aborts processing of that single file only.
 */
public class ReportExpiredException extends ReportProcessingException {

  private final Instant timestamp;

  public ReportExpiredException(Instant timestamp, String filename) {
    super("Report " + filename + " expired " + timestamp, filename);
    this.timestamp = timestamp;
  }

  public Instant timestamp() {
    return timestamp;
  }
}
