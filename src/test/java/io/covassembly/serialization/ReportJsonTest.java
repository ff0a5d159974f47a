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

package io.covassembly.serialization;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.covassembly.errors.CorruptInputException;
import io.covassembly.report.CoverageDatapoint;
import io.covassembly.report.CoverageType;
import io.covassembly.report.CoverageValue;
import io.covassembly.report.LabelsIndex;
import io.covassembly.report.LineSession;
import io.covassembly.report.PartialSpan;
import io.covassembly.report.Report;
import io.covassembly.report.ReportFile;
import io.covassembly.report.ReportLine;
import io.covassembly.report.ReportTotals;
import io.covassembly.report.Session;
import io.covassembly.report.SessionType;
import java.io.ByteArrayOutputStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ReportJsonWriter} and {@link ReportJsonReader}. */
@RunWith(JUnit4.class)
public class ReportJsonTest {

  private static Report sampleReport() {
    Report report = new Report();
    report.putSession(
        Session.builder()
            .setId(0)
            .setSessionType(SessionType.CARRIEDFORWARD)
            .setFlags(ImmutableList.of("unit"))
            .setName("nightly")
            .setEnv(ImmutableMap.of("A", "1", "B", "2"))
            .setTotals(ReportTotals.create(1, 2, 1, 1, 0, 0, 0, 1, 0))
            .build());
    report.putSession(
        Session.builder()
            .setId(2)
            .setProvider("github-actions")
            .setBuildCode("118")
            .setJob("tests")
            .setBuildUrl("https://ci.example.com/118")
            .build());
    report.setNextSessionId(5);
    report.setLabelsIndex(LabelsIndex.fromMap(ImmutableMap.of(1, "test_a", 2, "test_b")));

    ReportFile source = new ReportFile("src/a.py");
    source.append(
        1,
        ReportLine.create(
            null,
            LineSession.create(0, CoverageValue.ofHits(3)),
            LineSession.create(2, CoverageValue.ofHits(0))));
    source.append(
        4,
        ReportLine.create(
            CoverageType.BRANCH,
            ImmutableList.of(
                LineSession.create(
                    2, CoverageValue.ofBranches(1, 2), ImmutableList.of("0:1"), null, null)),
            null));
    source.append(
        7,
        ReportLine.create(
            null,
            ImmutableList.of(
                LineSession.create(
                    0,
                    CoverageValue.ofHits(1),
                    null,
                    ImmutableList.of(PartialSpan.create(1, 3, 1), PartialSpan.create(3, null, 0)),
                    2)),
            null));
    report.append(source);

    ReportFile labelled = new ReportFile("lib/b.py");
    labelled.append(
        2,
        ReportLine.create(
            CoverageType.METHOD,
            ImmutableList.of(LineSession.create(2, CoverageValue.ofHits(1))),
            ImmutableList.of(
                CoverageDatapoint.create(
                    2, CoverageValue.ofHits(1), CoverageType.METHOD, ImmutableList.of(1, 2)),
                CoverageDatapoint.create(2, CoverageValue.ofHits(1), null, ImmutableList.of(1)))));
    report.append(labelled);
    return report;
  }

  private static Report roundTrip(Report report) throws Exception {
    ByteArrayOutputStream summary = new ByteArrayOutputStream();
    ByteArrayOutputStream chunks = new ByteArrayOutputStream();
    ReportJsonWriter.write(report, summary, chunks);
    return ReportJsonReader.read(
        "stored",
        new String(summary.toByteArray(), UTF_8),
        new String(chunks.toByteArray(), UTF_8));
  }

  @Test
  public void testRoundTripKeepsEverything() throws Exception {
    Report original = sampleReport();

    Report restored = roundTrip(original);

    assertThat(restored.sessions()).isEqualTo(original.sessions());
    assertThat(restored.nextSessionId()).isEqualTo(5);
    assertThat(restored.labelsIndex()).isEqualTo(original.labelsIndex());
    assertThat(restored.files().keySet()).containsExactly("lib/b.py", "src/a.py").inOrder();
    for (ReportFile file : original.files().values()) {
      assertThat(restored.file(file.name()).lines()).isEqualTo(file.lines());
    }
    assertThat(restored.totals()).isEqualTo(original.totals());
  }

  @Test
  public void testPlainLineTypeRoundTrips() throws Exception {
    Report original = new Report();
    original.putSession(Session.builder().setId(0).build());
    original.setLabelsIndex(LabelsIndex.fromMap(ImmutableMap.of(1, "test_a")));
    ReportFile file = new ReportFile("a.py");
    file.append(
        3,
        ReportLine.create(
            CoverageType.LINE,
            ImmutableList.of(LineSession.create(0, CoverageValue.ofHits(1))),
            ImmutableList.of(
                CoverageDatapoint.create(
                    0, CoverageValue.ofHits(1), CoverageType.LINE, ImmutableList.of(1)))));
    original.append(file);

    Report restored = roundTrip(original);

    assertThat(restored.file("a.py").lines()).isEqualTo(original.file("a.py").lines());
    assertThat(restored.file("a.py").line(3).datapoints().get(0))
        .isEqualTo(
            CoverageDatapoint.create(
                0, CoverageValue.ofHits(1), CoverageType.LINE, ImmutableList.of(1)));
  }

  @Test
  public void testEmptyReport() throws Exception {
    Report restored = roundTrip(new Report());

    assertThat(restored.isEmpty()).isTrue();
    assertThat(restored.sessions()).isEmpty();
    assertThat(restored.labelsIndex()).isNull();
  }

  @Test
  public void testChunkLayout() {
    Report report = new Report();
    ReportFile file = new ReportFile("a.py");
    file.append(2, ReportLine.create(null, LineSession.create(0, CoverageValue.ofHits(1))));
    file.append(3, ReportLine.create(null, LineSession.create(0, CoverageValue.ofHits(0))));
    report.append(file);

    assertThat(ReportJsonWriter.chunks(report))
        .isEqualTo("{}\n\n[1,null,[[0,1]]]\n[0,null,[[0,0]]]");
  }

  @Test
  public void testMalformedSummary() {
    CorruptInputException e =
        assertThrows(
            CorruptInputException.class, () -> ReportJsonReader.read("stored", "{files", "{}\n"));

    assertThat(e.filename()).isEqualTo("stored");
  }

  @Test
  public void testMissingChunk() {
    assertThrows(
        CorruptInputException.class,
        () -> ReportJsonReader.read("stored", "{\"files\": {\"a.py\": [3, {}]}}", "{}\n[1]"));
  }

  @Test
  public void testChunksWithoutHeader() {
    assertThrows(
        CorruptInputException.class,
        () -> ReportJsonReader.read("stored", "{\"files\": {\"a.py\": [0, {}]}}", "[1,null,[]]"));
  }
}
