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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ReportTest {

  private static ReportFile file(String name, int sessionId, int... lines) {
    ReportFile file = new ReportFile(name);
    for (int line : lines) {
      file.append(
          line, ReportLine.create(null, LineSession.create(sessionId, CoverageValue.ofHits(1))));
    }
    return file;
  }

  private static ReportLine labelledLine(int sessionId, int... labelIds) {
    ImmutableList.Builder<CoverageDatapoint> datapoints = ImmutableList.builder();
    for (int labelId : labelIds) {
      datapoints.add(
          CoverageDatapoint.create(
              sessionId, CoverageValue.ofHits(1), null, ImmutableList.of(labelId)));
    }
    return ReportLine.create(
        null,
        ImmutableList.of(LineSession.create(sessionId, CoverageValue.ofHits(1))),
        datapoints.build());
  }

  @Test
  public void testSessionIdsAreNeverReused() {
    Report report = new Report();
    assertThat(report.addSession(Session.builder().build()).id()).isEqualTo(0);
    assertThat(report.addSession(Session.builder().build()).id()).isEqualTo(1);

    report.deleteSessions(ImmutableList.of(1));

    assertThat(report.nextSessionId()).isEqualTo(2);
    assertThat(report.addSession(Session.builder().build()).id()).isEqualTo(2);
  }

  @Test
  public void testPutSessionRejectsTakenId() {
    Report report = new Report();
    report.putSession(Session.builder().setId(3).build());

    assertThrows(
        IllegalArgumentException.class,
        () -> report.putSession(Session.builder().setId(3).build()));
    assertThrows(
        IllegalArgumentException.class, () -> report.putSession(Session.builder().build()));
    assertThat(report.nextSessionId()).isEqualTo(4);
  }

  @Test
  public void testAppendMergesFilesWithSamePath() {
    Report report = new Report();
    report.append(file("a.py", 0, 1, 2));
    report.append(file("a.py", 1, 2, 3));

    ReportFile merged = report.file("a.py");
    assertThat(merged.lines().keySet()).containsExactly(1, 2, 3).inOrder();
    assertThat(merged.line(2).coverage()).isEqualTo(CoverageValue.ofHits(2));
  }

  @Test
  public void testCopyIsIndependent() {
    Report report = new Report();
    report.append(file("a.py", 0, 1));
    Report copy = report.copy();

    copy.append(file("a.py", 0, 5));
    copy.append(file("b.py", 0, 1));

    assertThat(report.files().keySet()).containsExactly("a.py");
    assertThat(report.file("a.py").lines().keySet()).containsExactly(1);
  }

  @Test
  public void testDeleteSessionsDropsEmptyFiles() {
    Report report = new Report();
    report.putSession(Session.builder().setId(0).build());
    report.putSession(Session.builder().setId(1).build());
    report.append(file("a.py", 0, 1));
    report.append(file("b.py", 1, 1));
    report.append(file("b.py", 0, 2));

    report.deleteSessions(ImmutableList.of(0));

    assertThat(report.files().keySet()).containsExactly("b.py");
    assertThat(report.file("b.py").lines().keySet()).containsExactly(1);
    assertThat(report.sessions().keySet()).containsExactly(1);
    assertThat(report.lineSessionIds()).containsExactly(1);
  }

  @Test
  public void testDeleteLabelsKeepsOtherLabels() {
    Report report = new Report();
    ReportFile file = new ReportFile("a.py");
    file.append(1, labelledLine(0, 1, 2));
    file.append(2, labelledLine(0, 1));
    report.append(file);

    report.deleteLabels(ImmutableList.of(0), ImmutableList.of(1));

    ReportFile remaining = report.file("a.py");
    assertThat(remaining.lines().keySet()).containsExactly(1);
    assertThat(remaining.line(1).datapoints())
        .containsExactly(
            CoverageDatapoint.create(0, CoverageValue.ofHits(1), null, ImmutableList.of(2)));
    assertThat(report.labelIdsForSession(0)).containsExactly(2);
  }

  @Test
  public void testDeleteLabelsOfOtherSessionsIsNoop() {
    Report report = new Report();
    ReportFile file = new ReportFile("a.py");
    file.append(1, labelledLine(0, 1));
    report.append(file);

    report.deleteLabels(ImmutableList.of(5), ImmutableList.of(1));
    report.deleteLabels(ImmutableList.of(0), ImmutableList.of());

    assertThat(report.allLabelIds()).containsExactly(1);
  }

  @Test
  public void testRemapLabels() {
    Report report = new Report();
    ReportFile file = new ReportFile("a.py");
    file.append(1, labelledLine(0, 1, 2));
    report.append(file);

    report.remapLabels(ImmutableMap.of(1, 7));

    assertThat(report.allLabelIds()).containsExactly(2, 7);
  }

  @Test
  public void testTotals() {
    Report report = new Report();
    report.putSession(Session.builder().setId(0).build());
    ReportFile file = new ReportFile("a.py");
    file.append(1, ReportLine.create(null, LineSession.create(0, CoverageValue.ofHits(1))));
    file.append(2, ReportLine.create(null, LineSession.create(0, CoverageValue.ofHits(0))));
    file.append(
        3,
        ReportLine.create(
            CoverageType.BRANCH, LineSession.create(0, CoverageValue.ofBranches(1, 2))));
    report.append(file);

    ReportTotals totals = report.totals();

    assertThat(totals).isEqualTo(ReportTotals.create(1, 3, 1, 1, 1, 1, 0, 1, 0));
    assertThat(totals.coverage()).isEqualTo("33.33333");
  }
}
