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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Everything report assembly needs to know about its environment. Built once per process and
 * passed to the components that need it.
 */
@AutoValue
public abstract class AssemblyContext {

  static final int DEFAULT_PARSE_PARALLELISM = 8;

  /** Path rewrite rules, {@code pattern::replacement}. */
  public abstract ImmutableList<String> fixes();

  /** Path patterns left out of every upload. */
  public abstract ImmutableList<String> ignore();

  /** Include and {@code !}-prefixed exclude patterns applied to every upload. */
  public abstract ImmutableList<String> paths();

  public abstract CarryforwardRules carryforwardRules();

  /** Skips table of contents resolution of uploaded paths. */
  public abstract boolean disableDefaultPathFixes();

  /** Reports older than this are rejected; null accepts reports of any age. */
  @Nullable
  public abstract Duration maxReportAge();

  public abstract int parseParallelism();

  public abstract Clock clock();

  public abstract AssemblyCounters counters();

  public static Builder builder() {
    return new AutoValue_AssemblyContext.Builder()
        .setFixes(ImmutableList.of())
        .setIgnore(ImmutableList.of())
        .setPaths(ImmutableList.of())
        .setCarryforwardRules(CarryforwardRules.none())
        .setDisableDefaultPathFixes(false)
        .setParseParallelism(DEFAULT_PARSE_PARALLELISM)
        .setClock(Clock.systemUTC())
        .setCounters(new AssemblyCounters());
  }

  /** A context with default settings. */
  public static AssemblyContext defaults() {
    return builder().build();
  }

  /** Builder for {@link AssemblyContext}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFixes(List<String> fixes);

    public abstract Builder setIgnore(List<String> ignore);

    public abstract Builder setPaths(List<String> paths);

    public abstract Builder setCarryforwardRules(CarryforwardRules rules);

    public abstract Builder setDisableDefaultPathFixes(boolean disable);

    public abstract Builder setMaxReportAge(@Nullable Duration maxReportAge);

    public abstract Builder setParseParallelism(int parallelism);

    public abstract Builder setClock(Clock clock);

    public abstract Builder setCounters(AssemblyCounters counters);

    abstract AssemblyContext autoBuild();

    public AssemblyContext build() {
      AssemblyContext context = autoBuild();
      checkArgument(
          context.parseParallelism() >= 1,
          "Parse parallelism must be positive: %s",
          context.parseParallelism());
      checkArgument(
          context.maxReportAge() == null || !context.maxReportAge().isNegative(),
          "Maximum report age must not be negative");
      return context;
    }
  }
}
