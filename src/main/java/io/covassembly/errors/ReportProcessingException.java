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

import javax.annotation.Nullable;

/**
 * Base class for the checked conditions raised while turning an upload into a report.
 *
 * <p>Subclasses that concern a single uploaded file carry its name so the caller can drop that
 * file and keep merging the rest of the upload.
 */
public class ReportProcessingException extends Exception {

  @Nullable private final String filename;

  public ReportProcessingException(String message, @Nullable String filename) {
    super(message);
    this.filename = filename;
  }

  public ReportProcessingException(String message, @Nullable String filename, Throwable cause) {
    super(message, cause);
    this.filename = filename;
  }

  /** The uploaded file the condition refers to, or null if it concerns the whole upload. */
  @Nullable
  public String filename() {
    return filename;
  }
}
