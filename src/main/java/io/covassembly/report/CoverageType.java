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

import javax.annotation.Nullable;

/** What kind of source construct a line's coverage describes. */
public enum CoverageType {
  LINE(null),
  BRANCH("b"),
  METHOD("m");

  @Nullable private final String code;

  CoverageType(@Nullable String code) {
    this.code = code;
  }

  /** The short code stored in serialized reports; null for plain lines. */
  @Nullable
  public String code() {
    return code;
  }

  /** Returns the type for a serialized code; a null or unknown code is a plain line. */
  public static CoverageType fromCode(@Nullable String code) {
    if (code != null) {
      for (CoverageType type : values()) {
        if (code.equals(type.code)) {
          return type;
        }
      }
    }
    return LINE;
  }

  /** Plain lines are kept untyped, the same way they are stored. */
  @Nullable
  static CoverageType normalize(@Nullable CoverageType type) {
    return type == LINE ? null : type;
  }

  /** Branch beats method beats line when two observations of a line disagree. */
  @Nullable
  static CoverageType dominant(@Nullable CoverageType first, @Nullable CoverageType second) {
    if (first == null) {
      return second;
    }
    if (second == null) {
      return first;
    }
    return first.rank() >= second.rank() ? first : second;
  }

  private int rank() {
    switch (this) {
      case BRANCH:
        return 2;
      case METHOD:
        return 1;
      case LINE:
        return 0;
    }
    throw new AssertionError(this);
  }
}
