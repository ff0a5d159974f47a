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

/** How a session came to be part of a report. */
public enum SessionType {
  /** Coverage uploaded for this commit. */
  UPLOADED("uploaded"),
  /** Coverage reused from an ancestor commit for a flag that was not uploaded again. */
  CARRIEDFORWARD("carriedforward");

  private final String code;

  SessionType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static SessionType fromCode(String code) {
    for (SessionType type : values()) {
      if (type.code.equals(code)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown session type: " + code);
  }
}
