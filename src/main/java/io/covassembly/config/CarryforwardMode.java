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

package io.covassembly.config;

import com.google.common.base.Ascii;

/** How much of a carried-forward session a new upload with the same flag replaces. */
public enum CarryforwardMode {
  /** The new upload replaces the carried-forward session entirely. */
  ALL,
  /** The new upload replaces only the test labels it ran again. */
  LABELS;

  /**
   * Parses {@code "all"} or {@code "labels"}, ignoring case.
   *
   * @throws IllegalArgumentException for any other value
   */
  public static CarryforwardMode parse(String value) {
    switch (Ascii.toLowerCase(value.trim())) {
      case "all":
        return ALL;
      case "labels":
        return LABELS;
      default:
        throw new IllegalArgumentException(
            "Unknown carryforward mode '" + value + "', expected 'all' or 'labels'");
    }
  }
}
