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

/**
 * A decoder found a structural violation in an uploaded file, e.g. a coverage line missing its
 * trailing count field. Only that file's contribution is dropped.
 */
public class CorruptInputException extends ReportProcessingException {

  public CorruptInputException(String filename, String detail) {
    super("Corrupt coverage input in " + filename + ": " + detail, filename);
  }

  public CorruptInputException(String filename, String detail, Throwable cause) {
    super("Corrupt coverage input in " + filename + ": " + detail, filename, cause);
  }
}
