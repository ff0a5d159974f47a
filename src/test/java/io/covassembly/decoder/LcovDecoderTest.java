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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import io.covassembly.errors.CorruptInputException;
import io.covassembly.report.CoverageType;
import io.covassembly.report.CoverageValue;
import java.time.Clock;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LcovDecoderTest {

  private static final String TRACEFILE =
      Joiner.on('\n')
          .join(
              "TN:",
              "SF:file.js",
              "FNDA:76,jsx",
              "FN:76,(anonymous_1)",
              "removed",
              "DA:0,skipped",
              "DA:null,skipped",
              "DA:1,1,46ba21aa66ea047aced7130c2760d7d4",
              "DA:=,=",
              "BRDA:0,1,0,1",
              "BRDA:1,1,0,1",
              "BRDA:1,1,1,1",
              "end_of_record",
              "",
              "TN:",
              "SF:empty.js",
              "FNF:0",
              "FNH:0",
              "DA:0,1",
              "LF:1",
              "LH:1",
              "end_of_record",
              "",
              "TN:",
              "SF:file.ts",
              "DA:2,1",
              "BRDA:1,1,0,1",
              "end_of_record",
              "",
              "TN:",
              "SF:file.cpp",
              "FN:2,not_hit",
              "FN:3,_Zalkfjeo",
              "FN:4,_Gsabebra",
              "FNDA:1,_ln1_is_skipped",
              "FNDA:,not_hit",
              "DA:1,1",
              "DA:3,4",
              "DA:77,0",
              "BRDA:2,1,0,1",
              "BRDA:2,1,1,-",
              "BRDA:2,1,3,0",
              "BRDA:5,1,0,1",
              "BRDA:5,1,1,1",
              "BRDA:77,3,0,0",
              "BRDA:77,3,1,0",
              "BRDA:77,4,0,0",
              "BRDA:77,4,1,0",
              "end_of_record",
              "");

  private final LcovDecoder decoder = new LcovDecoder();
  private final DecoderContext context = new DecoderContext(Clock.systemUTC(), null);

  @Test
  public void testMatches() {
    assertThat(decoder.matches("hello\nend_of_record\n", "hello", "a.info")).isTrue();
    assertThat(decoder.matches(TRACEFILE, "TN:", "lcov.info")).isTrue();
    assertThat(decoder.matches("hello_end_of_record", "hello_end_of_record", "a")).isFalse();
    assertThat(decoder.matches("", "", "a")).isFalse();
  }

  @Test
  public void testDecode() throws Exception {
    ImmutableList<DecodedLine> lines = decoder.decode(TRACEFILE, "lcov.info", context);

    assertThat(lines)
        .containsExactly(
            DecodedLine.create("file.js", 1, CoverageValue.ofHits(1)),
            DecodedLine.create("file.ts", 2, CoverageValue.ofHits(1)),
            DecodedLine.create("file.cpp", 1, CoverageValue.ofHits(1)),
            DecodedLine.create("file.cpp", 77, CoverageValue.ofHits(0)),
            DecodedLine.builder("file.cpp", 2, CoverageValue.ofBranches(1, 3))
                .setType(CoverageType.METHOD)
                .setMissingBranches(ImmutableList.of("1:1", "1:3"))
                .build(),
            DecodedLine.builder("file.cpp", 5, CoverageValue.ofBranches(2, 2))
                .setType(CoverageType.BRANCH)
                .build(),
            DecodedLine.builder("file.cpp", 77, CoverageValue.ofBranches(0, 4))
                .setType(CoverageType.BRANCH)
                .setMissingBranches(ImmutableList.of("3:0", "3:1", "4:0", "4:1"))
                .build())
        .inOrder();
  }

  @Test
  public void testNegativeCountsAreMisses() throws Exception {
    String tracefile = "SF:file.js\nDA:1,1\nDA:2,0\nDA:3,-1\nDA:4,-20\nend_of_record\n";

    assertThat(decoder.decode(tracefile, "lcov.info", context))
        .containsExactly(
            DecodedLine.create("file.js", 1, CoverageValue.ofHits(1)),
            DecodedLine.create("file.js", 2, CoverageValue.ofHits(0)),
            DecodedLine.create("file.js", 3, CoverageValue.ofHits(0)),
            DecodedLine.create("file.js", 4, CoverageValue.ofHits(0)))
        .inOrder();
  }

  @Test
  public void testRepeatedLinesKeepHighestCount() throws Exception {
    String tracefile = "SF:a.c\nDA:1,2\nDA:1,5\nDA:1,3\nend_of_record\n";

    assertThat(decoder.decode(tracefile, "lcov.info", context))
        .containsExactly(DecodedLine.create("a.c", 1, CoverageValue.ofHits(5)));
  }

  @Test
  public void testMissingExecutionCountIsCorrupt() {
    CorruptInputException e =
        assertThrows(
            CorruptInputException.class,
            () -> decoder.decode("SF:a.c\nDA:1\nend_of_record\n", "broken.info", context));

    assertThat(e.filename()).isEqualTo("broken.info");
  }

  @Test
  public void testInvalidCountIsCorrupt() {
    assertThrows(
        CorruptInputException.class,
        () -> decoder.decode("SF:a.c\nDA:1,x\nend_of_record\n", "broken.info", context));
  }
}
