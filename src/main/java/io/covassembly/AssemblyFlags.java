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

package io.covassembly;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.beust.jcommander.converters.IParameterSplitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.covassembly.config.AssemblyContext;
import io.covassembly.config.CarryforwardMode;
import io.covassembly.config.CarryforwardRules;
import io.covassembly.config.FlagConfiguration;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import javax.annotation.Nullable;

@Parameters(separators = "= ", optionPrefixes = "--")
class AssemblyFlags {
  private static final Logger logger = Logger.getLogger(AssemblyFlags.class.getName());

  /** Flag name that configures the rule of flags without their own {@code --carryforward_flag}. */
  static final String DEFAULT_FLAG_RULE = "*";

  @Nullable
  @Parameter(names = "--previous_report_json")
  private String previousReportJson;

  @Nullable
  @Parameter(names = "--previous_report_chunks")
  private String previousReportChunks;

  @Parameter(names = "--coverage_file", splitter = WholeValueSplitter.class)
  private List<String> coverageFiles;

  @Nullable
  @Parameter(names = "--toc_file")
  private String tocFile;

  /** A file of {@code KEY=VALUE} lines describing the CI environment of the upload. */
  @Nullable
  @Parameter(names = "--env_file")
  private String envFile;

  @Parameter(names = "--base_path", splitter = WholeValueSplitter.class)
  private List<String> basePaths;

  @Parameter(names = "--upload_flag", splitter = WholeValueSplitter.class)
  private List<String> uploadFlags;

  @Nullable
  @Parameter(names = "--session_name")
  private String sessionName;

  @Parameter(names = "--fix", splitter = WholeValueSplitter.class)
  private List<String> fixes;

  @Parameter(names = "--ignore", splitter = WholeValueSplitter.class)
  private List<String> ignore;

  @Parameter(names = "--path", splitter = WholeValueSplitter.class)
  private List<String> paths;

  /** {@code name=all} or {@code name=labels}; {@code *=...} sets the rule of unnamed flags. */
  @Parameter(names = "--carryforward_flag", splitter = WholeValueSplitter.class)
  private List<String> carryforwardFlags;

  @Parameter(names = "--disable_default_path_fixes", arity = 1)
  private boolean disableDefaultPathFixes;

  @Nullable
  @Parameter(names = "--max_report_age_hours")
  private Long maxReportAgeHours;

  @Nullable
  @Parameter(names = "--parse_parallelism")
  private Integer parseParallelism;

  @Parameter(names = "--output_report_json")
  private String outputReportJson;

  @Parameter(names = "--output_report_chunks")
  private String outputReportChunks;

  @Nullable
  String previousReportJson() {
    return previousReportJson;
  }

  @Nullable
  String previousReportChunks() {
    return previousReportChunks;
  }

  boolean hasPreviousReport() {
    return previousReportJson != null;
  }

  List<String> coverageFiles() {
    return orEmpty(coverageFiles);
  }

  @Nullable
  String tocFile() {
    return tocFile;
  }

  @Nullable
  String envFile() {
    return envFile;
  }

  List<String> basePaths() {
    return orEmpty(basePaths);
  }

  List<String> uploadFlags() {
    return orEmpty(uploadFlags);
  }

  @Nullable
  String sessionName() {
    return sessionName;
  }

  String outputReportJson() {
    return outputReportJson;
  }

  String outputReportChunks() {
    return outputReportChunks;
  }

  /** Builds the assembly context these flags describe. */
  AssemblyContext toContext() {
    AssemblyContext.Builder context =
        AssemblyContext.builder()
            .setFixes(orEmpty(fixes))
            .setIgnore(orEmpty(ignore))
            .setPaths(orEmpty(paths))
            .setCarryforwardRules(carryforwardRules(orEmpty(carryforwardFlags)))
            .setDisableDefaultPathFixes(disableDefaultPathFixes);
    if (maxReportAgeHours != null) {
      context.setMaxReportAge(Duration.ofHours(maxReportAgeHours));
    }
    if (parseParallelism != null) {
      context.setParseParallelism(parseParallelism);
    }
    return context.build();
  }

  static CarryforwardRules carryforwardRules(List<String> values) {
    Map<String, FlagConfiguration> flags = new LinkedHashMap<>();
    FlagConfiguration defaultRule = FlagConfiguration.notCarriedForward();
    for (String value : values) {
      int separator = value.lastIndexOf('=');
      if (separator <= 0) {
        throw new IllegalArgumentException(
            "--carryforward_flag expects name=all or name=labels, got: " + value);
      }
      String name = value.substring(0, separator);
      FlagConfiguration rule =
          FlagConfiguration.carriedForward(CarryforwardMode.parse(value.substring(separator + 1)));
      if (name.equals(DEFAULT_FLAG_RULE)) {
        defaultRule = rule;
      } else if (flags.put(name, rule) != null) {
        logger.warning("Overriding carryforward rule of flag " + name);
      }
    }
    return CarryforwardRules.create(ImmutableMap.copyOf(flags), defaultRule);
  }

  private static List<String> orEmpty(@Nullable List<String> values) {
    return values == null ? ImmutableList.of() : values;
  }

  static AssemblyFlags parseFlags(String... args) {
    AssemblyFlags flags = new AssemblyFlags();
    JCommander jCommander = new JCommander(flags);
    jCommander.setAllowParameterOverwriting(true);
    try {
      jCommander.parse(args);
    } catch (ParameterException e) {
      throw new IllegalArgumentException("Error parsing args: " + e.getMessage(), e);
    }
    if ((flags.previousReportJson == null) != (flags.previousReportChunks == null)) {
      throw new IllegalArgumentException(
          "previous_report_json and previous_report_chunks must be given together.");
    }
    if (flags.coverageFiles().isEmpty()) {
      throw new IllegalArgumentException("At least one coverage_file should be specified.");
    }
    if (flags.outputReportJson == null || flags.outputReportChunks == null) {
      throw new IllegalArgumentException(
          "output_report_json and output_report_chunks must be specified.");
    }
    if (flags.parseParallelism != null && flags.parseParallelism < 1) {
      throw new IllegalArgumentException("parse_parallelism must be positive.");
    }
    if (flags.maxReportAgeHours != null && flags.maxReportAgeHours < 0) {
      throw new IllegalArgumentException("max_report_age_hours must not be negative.");
    }
    // Fails fast on malformed carryforward rules.
    carryforwardRules(flags.carryforwardFlags());
    return flags;
  }

  private List<String> carryforwardFlags() {
    return orEmpty(carryforwardFlags);
  }

  /** Keeps values containing commas, such as regular expressions, in one piece. */
  public static final class WholeValueSplitter implements IParameterSplitter {
    @Override
    public List<String> split(String value) {
      return ImmutableList.of(value);
    }
  }
}
