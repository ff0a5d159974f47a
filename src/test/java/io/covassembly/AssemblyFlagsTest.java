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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import io.covassembly.config.AssemblyContext;
import io.covassembly.config.CarryforwardMode;
import io.covassembly.config.CarryforwardRules;
import java.time.Duration;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AssemblyFlagsTest {

  @Test
  public void parseFlagsTestMinimal() {
    AssemblyFlags flags =
        AssemblyFlags.parseFlags(
            "--coverage_file=lcov.info",
            "--output_report_json=report.json",
            "--output_report_chunks=chunks.txt");

    assertThat(flags.coverageFiles()).containsExactly("lcov.info");
    assertThat(flags.outputReportJson()).isEqualTo("report.json");
    assertThat(flags.outputReportChunks()).isEqualTo("chunks.txt");
    assertThat(flags.hasPreviousReport()).isFalse();
    assertThat(flags.tocFile()).isNull();
    assertThat(flags.uploadFlags()).isEmpty();
    assertThat(flags.basePaths()).isEmpty();

    AssemblyContext context = flags.toContext();
    assertThat(context.fixes()).isEmpty();
    assertThat(context.maxReportAge()).isNull();
    assertThat(context.disableDefaultPathFixes()).isFalse();
  }

  @Test
  public void parseFlagsTestEverything() {
    AssemblyFlags flags =
        AssemblyFlags.parseFlags(
            "--previous_report_json=old.json",
            "--previous_report_chunks=old.txt",
            "--coverage_file=a.info",
            "--coverage_file",
            "b.info",
            "--toc_file=toc.txt",
            "--env_file=env.txt",
            "--base_path=/ci/work",
            "--upload_flag=unit",
            "--upload_flag=py3",
            "--session_name=job 7",
            "--fix=^build/::src/",
            "--ignore=^vendor/(a|b),c",
            "--path=^src/",
            "--disable_default_path_fixes=true",
            "--max_report_age_hours=12",
            "--parse_parallelism=3",
            "--output_report_json=report.json",
            "--output_report_chunks=chunks.txt");

    assertThat(flags.previousReportJson()).isEqualTo("old.json");
    assertThat(flags.previousReportChunks()).isEqualTo("old.txt");
    assertThat(flags.coverageFiles()).containsExactly("a.info", "b.info").inOrder();
    assertThat(flags.tocFile()).isEqualTo("toc.txt");
    assertThat(flags.envFile()).isEqualTo("env.txt");
    assertThat(flags.basePaths()).containsExactly("/ci/work");
    assertThat(flags.uploadFlags()).containsExactly("unit", "py3").inOrder();
    assertThat(flags.sessionName()).isEqualTo("job 7");

    AssemblyContext context = flags.toContext();
    assertThat(context.fixes()).containsExactly("^build/::src/");
    assertThat(context.ignore()).containsExactly("^vendor/(a|b),c");
    assertThat(context.paths()).containsExactly("^src/");
    assertThat(context.disableDefaultPathFixes()).isTrue();
    assertThat(context.maxReportAge()).isEqualTo(Duration.ofHours(12));
    assertThat(context.parseParallelism()).isEqualTo(3);
  }

  @Test
  public void parseFlagsTestCarryforwardRules() {
    AssemblyFlags flags =
        AssemblyFlags.parseFlags(
            "--coverage_file=lcov.info",
            "--carryforward_flag=unit=all",
            "--carryforward_flag=integration=labels",
            "--output_report_json=report.json",
            "--output_report_chunks=chunks.txt");

    CarryforwardRules rules = flags.toContext().carryforwardRules();
    assertThat(rules.forFlag("unit").carryforwardMode()).isEqualTo(CarryforwardMode.ALL);
    assertThat(rules.forFlag("integration").carryforwardMode())
        .isEqualTo(CarryforwardMode.LABELS);
    assertThat(rules.isCarriedForward("docs")).isFalse();
    assertThat(rules.usesLabels()).isTrue();
  }

  @Test
  public void carryforwardRulesTestDefaultRule() {
    CarryforwardRules rules = AssemblyFlags.carryforwardRules(ImmutableList.of("*=labels"));

    assertThat(rules.flags()).isEmpty();
    assertThat(rules.isCarriedForward("anything")).isTrue();
    assertThat(rules.forFlag("anything").carryforwardMode()).isEqualTo(CarryforwardMode.LABELS);
  }

  @Test
  public void parseFlagsTestMissingCoverageFile() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            AssemblyFlags.parseFlags(
                "--output_report_json=report.json", "--output_report_chunks=chunks.txt"));
  }

  @Test
  public void parseFlagsTestMissingOutput() {
    assertThrows(
        IllegalArgumentException.class,
        () -> AssemblyFlags.parseFlags("--coverage_file=lcov.info", "--output_report_json=r"));
  }

  @Test
  public void parseFlagsTestPreviousReportNeedsBothDocuments() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            AssemblyFlags.parseFlags(
                "--previous_report_json=old.json",
                "--coverage_file=lcov.info",
                "--output_report_json=report.json",
                "--output_report_chunks=chunks.txt"));
  }

  @Test
  public void parseFlagsTestBadCarryforwardRule() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            AssemblyFlags.parseFlags(
                "--coverage_file=lcov.info",
                "--carryforward_flag=unit=sometimes",
                "--output_report_json=report.json",
                "--output_report_chunks=chunks.txt"));
    assertThrows(
        IllegalArgumentException.class,
        () -> AssemblyFlags.carryforwardRules(ImmutableList.of("unit")));
  }

  @Test
  public void parseFlagsTestNonPositiveParallelism() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            AssemblyFlags.parseFlags(
                "--coverage_file=lcov.info",
                "--parse_parallelism=0",
                "--output_report_json=report.json",
                "--output_report_chunks=chunks.txt"));
  }

  @Test
  public void parseFlagsTestUnknownFlag() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            AssemblyFlags.parseFlags(
                "--coverage_file=lcov.info",
                "--no_such_flag=1",
                "--output_report_json=report.json",
                "--output_report_chunks=chunks.txt"));
  }
}
