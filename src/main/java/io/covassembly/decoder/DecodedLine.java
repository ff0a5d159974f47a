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

package io.covassembly.decoder;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import io.covassembly.builder.LabelHint;
import io.covassembly.report.CoverageType;
import io.covassembly.report.CoverageValue;
import io.covassembly.report.PartialSpan;
import java.util.List;
import javax.annotation.Nullable;

/** One line observation produced by a decoder, before its path is resolved. */
@AutoValue
public abstract class DecodedLine {

  /** The path exactly as it appears in the uploaded file. */
  public abstract String rawPath();

  public abstract int lineNumber();

  public abstract CoverageValue value();

  @Nullable
  public abstract CoverageType type();

  @Nullable
  public abstract ImmutableList<PartialSpan> partials();

  @Nullable
  public abstract ImmutableList<String> missingBranches();

  @Nullable
  public abstract Integer complexity();

  /** Groups of test labels that covered the line; null when the format carries no labels. */
  @Nullable
  public abstract ImmutableList<ImmutableList<LabelHint>> labelHints();

  public static DecodedLine create(String rawPath, int lineNumber, CoverageValue value) {
    return builder(rawPath, lineNumber, value).build();
  }

  public static Builder builder(String rawPath, int lineNumber, CoverageValue value) {
    return new AutoValue_DecodedLine.Builder()
        .setRawPath(rawPath)
        .setLineNumber(lineNumber)
        .setValue(value);
  }

  /** Label hint groups in the shape {@link io.covassembly.builder.FileBuilder} accepts. */
  @Nullable
  public List<List<LabelHint>> labelHintGroups() {
    return labelHints() == null ? null : ImmutableList.<List<LabelHint>>copyOf(labelHints());
  }

  /** Builder for {@link DecodedLine}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setRawPath(String rawPath);

    public abstract Builder setLineNumber(int lineNumber);

    public abstract Builder setValue(CoverageValue value);

    public abstract Builder setType(@Nullable CoverageType type);

    public abstract Builder setPartials(@Nullable ImmutableList<PartialSpan> partials);

    public abstract Builder setMissingBranches(
        @Nullable ImmutableList<String> missingBranches);

    public abstract Builder setComplexity(@Nullable Integer complexity);

    public abstract Builder setLabelHints(
        @Nullable ImmutableList<ImmutableList<LabelHint>> labelHints);

    public abstract DecodedLine build();
  }
}
