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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/**
 * Coverage observed for one line or column range.
 *
 * <p>A value is one of:
 *
 * <ul>
 *   <li>a hit count ({@code 3});
 *   <li>a branch ratio ({@code "1/2"}), where {@code hits()} is the number of covered branches
 *       and {@code total()} the number of branches;
 *   <li>a boolean ({@code true}), for tools that only report whether a line ran.
 * </ul>
 */
@AutoValue
public abstract class CoverageValue {

  /** The shape of a coverage value. */
  public enum Kind {
    HITS,
    BRANCH,
    BOOLEAN
  }

  private static final CoverageValue TRUE = new AutoValue_CoverageValue(Kind.BOOLEAN, 1, 0);
  private static final CoverageValue FALSE = new AutoValue_CoverageValue(Kind.BOOLEAN, 0, 0);

  public abstract Kind kind();

  /** Hit count, number of covered branches, or 1/0 for a boolean. */
  public abstract long hits();

  /** Number of branches; always zero unless {@code kind()} is {@link Kind#BRANCH}. */
  public abstract long total();

  public static CoverageValue ofHits(long hits) {
    checkArgument(hits >= 0, "Hit count must be non-negative: %s", hits);
    return new AutoValue_CoverageValue(Kind.HITS, hits, 0);
  }

  public static CoverageValue ofBranches(long covered, long total) {
    checkArgument(
        0 <= covered && covered <= total, "Invalid branch ratio %s/%s", covered, total);
    return new AutoValue_CoverageValue(Kind.BRANCH, covered, total);
  }

  public static CoverageValue ofBoolean(boolean value) {
    return value ? TRUE : FALSE;
  }

  /**
   * Parses the textual form produced by {@link #toString()}: {@code "12"}, {@code "1/2"}, {@code
   * "true"} or {@code "false"}.
   *
   * @throws IllegalArgumentException if the text is none of these
   */
  public static CoverageValue parse(String text) {
    String value = text.trim();
    if (value.equals("true") || value.equals("false")) {
      return ofBoolean(Boolean.parseBoolean(value));
    }
    int slash = value.indexOf('/');
    try {
      if (slash >= 0) {
        return ofBranches(
            Long.parseLong(value.substring(0, slash)), Long.parseLong(value.substring(slash + 1)));
      }
      return ofHits(Long.parseLong(value));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a coverage value: " + text, e);
    }
  }

  /** Whether the line is fully covered. A {@code "0/0"} branch ratio is not. */
  public boolean isHit() {
    switch (kind()) {
      case BRANCH:
        return total() > 0 && hits() == total();
      case HITS:
      case BOOLEAN:
        return hits() > 0;
    }
    throw new AssertionError(kind());
  }

  /** Whether only some of the branches were covered. */
  public boolean isPartial() {
    return kind() == Kind.BRANCH && hits() > 0 && hits() < total();
  }

  public boolean isMiss() {
    return !isHit() && !isPartial();
  }

  @Override
  public final String toString() {
    switch (kind()) {
      case BRANCH:
        return hits() + "/" + total();
      case BOOLEAN:
        return Boolean.toString(hits() > 0);
      case HITS:
        return Long.toString(hits());
    }
    throw new AssertionError(kind());
  }
}
