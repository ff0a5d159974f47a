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
import javax.annotation.Nullable;

/**
 * Coverage of a column range of one line: {@code [start, end)} where a null start means "from the
 * beginning of the line" and a null end means "to the end of the line".
 */
@AutoValue
public abstract class PartialSpan {

  @Nullable
  public abstract Integer start();

  @Nullable
  public abstract Integer end();

  public abstract CoverageValue value();

  public static PartialSpan create(
      @Nullable Integer start, @Nullable Integer end, CoverageValue value) {
    checkArgument(start == null || start >= 0, "Column must be non-negative: %s", start);
    checkArgument(
        start == null || end == null || start <= end, "Span ends before it starts: %s-%s", start,
        end);
    return new AutoValue_PartialSpan(start, end, value);
  }

  public static PartialSpan create(@Nullable Integer start, @Nullable Integer end, long hits) {
    return create(start, end, CoverageValue.ofHits(hits));
  }

  /** The first column covered by this span. */
  int firstColumn() {
    return start() == null ? 0 : start();
  }

  boolean isOpenEnded() {
    return end() == null;
  }
}
