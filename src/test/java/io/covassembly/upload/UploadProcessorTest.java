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

package io.covassembly.upload;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.covassembly.config.AssemblyContext;
import io.covassembly.decoder.DecodedLine;
import io.covassembly.decoder.DecoderContext;
import io.covassembly.decoder.DecoderRegistry;
import io.covassembly.decoder.LanguageDecoder;
import io.covassembly.decoder.LcovDecoder;
import io.covassembly.errors.EmptyUploadException;
import io.covassembly.errors.ReportExpiredException;
import io.covassembly.report.CoverageType;
import io.covassembly.report.CoverageValue;
import io.covassembly.report.Report;
import io.covassembly.report.ReportFile;
import io.covassembly.report.Session;
import io.covassembly.report.SessionType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class UploadProcessorTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private static final String CPP_TRACEFILE =
      "SF:file.cpp\n"
          + "FN:2,not_hit\n"
          + "DA:1,1\n"
          + "BRDA:2,1,0,1\n"
          + "BRDA:2,1,1,-\n"
          + "BRDA:2,1,3,0\n"
          + "BRDA:5,1,0,1\n"
          + "BRDA:5,1,1,1\n"
          + "end_of_record\n";

  /**
   * Reads files made of a {@code timestamp: <instant>} line followed by the name of a single
   * covered file.
   */
  private static final class TimestampedDecoder implements LanguageDecoder {
    private static final String PREFIX = "timestamp: ";

    @Override
    public String name() {
      return "timestamped";
    }

    @Override
    public boolean matches(String content, String firstLine, String filename) {
      return firstLine.startsWith(PREFIX);
    }

    @Override
    public ImmutableList<DecodedLine> decode(
        String content, String filename, DecoderContext context) throws ReportExpiredException {
      List<String> lines = Splitter.on('\n').trimResults().splitToList(content);
      context.checkNotExpired(
          Instant.parse(lines.get(0).substring(PREFIX.length())), filename);
      return ImmutableList.of(DecodedLine.create(lines.get(1), 1, CoverageValue.ofHits(1)));
    }
  }

  /** Emits an observation for line 0, which no report accepts. */
  private static final class LineZeroDecoder implements LanguageDecoder {
    @Override
    public String name() {
      return "line-zero";
    }

    @Override
    public boolean matches(String content, String firstLine, String filename) {
      return firstLine.equals("line zero");
    }

    @Override
    public ImmutableList<DecodedLine> decode(
        String content, String filename, DecoderContext context) {
      return ImmutableList.of(DecodedLine.create("z.py", 0, CoverageValue.ofHits(1)));
    }
  }

  private static String timestamped(Instant timestamp, String coveredFile) {
    return "timestamp: " + timestamp + "\n" + coveredFile + "\n";
  }

  private static UploadProcessor processor(AssemblyContext context) {
    return new UploadProcessor(context, DecoderRegistry.withDefaults());
  }

  @Test
  public void testMergesLcovUpload() throws Exception {
    AssemblyContext context = AssemblyContext.defaults();
    Report previous = new Report();
    previous.putSession(Session.builder().setId(0).build());

    UploadProcessingResult result =
        processor(context)
            .process(
                previous,
                RawUpload.create(ImmutableList.of(UploadedFile.create("lcov.info", CPP_TRACEFILE))),
                Session.builder().build());

    assertThat(result.errors()).isEmpty();
    Report merged = result.mergeResult().report();
    assertThat(merged.files().keySet()).containsExactly("file.cpp");
    ReportFile file = merged.file("file.cpp");
    assertThat(file.line(1).coverage()).isEqualTo(CoverageValue.ofHits(1));
    assertThat(file.line(1).session(1).coverage()).isEqualTo(CoverageValue.ofHits(1));
    assertThat(file.line(2).type()).isEqualTo(CoverageType.METHOD);
    assertThat(file.line(2).session(1).missingBranches()).containsExactly("1:1", "1:3").inOrder();
    assertThat(file.line(5).type()).isEqualTo(CoverageType.BRANCH);
    assertThat(file.line(5).coverage()).isEqualTo(CoverageValue.ofBranches(2, 2));
    assertThat(result.mergeResult().session().id()).isEqualTo(1);
    assertThat(result.mergeResult().session().sessionType()).isEqualTo(SessionType.UPLOADED);
    assertThat(context.counters().decodedFiles()).isEqualTo(1);
    assertThat(context.counters().mergedUploads()).isEqualTo(1);
  }

  @Test
  public void testBadFilesAreReportedAndSkipped() throws Exception {
    AssemblyContext context =
        AssemblyContext.builder()
            .setClock(Clock.fixed(NOW, ZoneOffset.UTC))
            .setMaxReportAge(Duration.ofHours(12))
            .setParseParallelism(4)
            .build();
    DecoderRegistry decoders =
        new DecoderRegistry(ImmutableList.of(new TimestampedDecoder(), new LcovDecoder()));
    RawUpload upload =
        RawUpload.create(
            ImmutableList.of(
                UploadedFile.create(
                    "old.txt", timestamped(NOW.minus(Duration.ofHours(13)), "o.py")),
                UploadedFile.create("broken.info", "SF:a.c\nDA:1\nend_of_record\n"),
                UploadedFile.create("good.info", "SF:a.c\nDA:1,1\nend_of_record\n"),
                UploadedFile.create(
                    "fresh.txt", timestamped(NOW.minus(Duration.ofHours(1)), "f.py")),
                UploadedFile.create("notes.xml", "<coverage/>"),
                UploadedFile.create("empty.info", "")));

    UploadProcessingResult result =
        new UploadProcessor(context, decoders)
            .process(new Report(), upload, Session.builder().build());

    assertThat(result.errors()).hasSize(2);
    assertThat(result.errors().get(0).filename()).isEqualTo("old.txt");
    assertThat(result.errors().get(0).kind()).isEqualTo(FileError.Kind.EXPIRED);
    assertThat(result.errors().get(1).filename()).isEqualTo("broken.info");
    assertThat(result.errors().get(1).kind()).isEqualTo(FileError.Kind.CORRUPT);
    assertThat(result.mergeResult().report().files().keySet()).containsExactly("a.c", "f.py");
    assertThat(context.counters().decodedFiles()).isEqualTo(2);
    assertThat(context.counters().expiredFiles()).isEqualTo(1);
    assertThat(context.counters().corruptFiles()).isEqualTo(1);
    assertThat(context.counters().unrecognizedFiles()).isEqualTo(1);
  }

  @Test
  public void testJsonReportSupersedesItsLcovCopy() {
    AssemblyContext context = AssemblyContext.defaults();
    RawUpload upload =
        RawUpload.create(
            ImmutableList.of(
                UploadedFile.create("coverage/coverage.json", "{}"),
                UploadedFile.create("coverage/coverage.lcov", CPP_TRACEFILE)));

    assertThrows(
        EmptyUploadException.class,
        () -> processor(context).process(new Report(), upload, Session.builder().build()));
    assertThat(context.counters().decodedFiles()).isEqualTo(0);
    assertThat(context.counters().mergedUploads()).isEqualTo(0);
  }

  @Test
  public void testSessionCarriesTemplateAndEnvironment() throws Exception {
    RawUpload upload =
        RawUpload.create(
            ImmutableList.of(UploadedFile.create("lcov.info", CPP_TRACEFILE)),
            null,
            "CI=true\nOS=linux\nnot an assignment\n",
            ImmutableList.of());
    Session template =
        Session.builder().setFlags(ImmutableList.of("unit")).setName("job-1").build();

    Session session =
        processor(AssemblyContext.defaults())
            .process(new Report(), upload, template)
            .mergeResult()
            .session();

    assertThat(session.id()).isEqualTo(0);
    assertThat(session.flags()).containsExactly("unit");
    assertThat(session.name()).isEqualTo("job-1");
    assertThat(session.env()).containsExactly("CI", "true", "OS", "linux").inOrder();
    assertThat(session.totals().files()).isEqualTo(1);
  }

  @Test
  public void testTocResolvesAndFiltersPaths() throws Exception {
    AssemblyContext context = AssemblyContext.defaults();
    RawUpload upload =
        RawUpload.create(
            ImmutableList.of(
                UploadedFile.create(
                    "lcov.info",
                    "SF:file.cpp\nDA:1,1\nend_of_record\nSF:unknown.c\nDA:1,1\nend_of_record\n")),
            "src/file.cpp\nlib/other.c\n",
            null,
            ImmutableList.of());

    Report merged =
        processor(context)
            .process(new Report(), upload, Session.builder().build())
            .mergeResult()
            .report();

    assertThat(merged.files().keySet()).containsExactly("src/file.cpp");
    assertThat(context.counters().rejectedPaths()).isEqualTo(1);
  }

  @Test
  public void testEnvironmentParsing() {
    RawUpload upload =
        RawUpload.create(
            ImmutableList.of(), null, "A=1\n B = 2 \nC=x=y\nnothing\n", ImmutableList.of());

    assertThat(upload.envMap()).isEqualTo(ImmutableMap.of("A", "1", "B ", " 2", "C", "x=y"));
    assertThat(RawUpload.create(ImmutableList.of()).envMap()).isEmpty();
  }

  @Test
  public void testFileFailingAtRuntimeDoesNotAbortUpload() throws Exception {
    AssemblyContext context = AssemblyContext.builder().setParseParallelism(4).build();
    DecoderRegistry decoders =
        new DecoderRegistry(ImmutableList.of(new LineZeroDecoder(), new LcovDecoder()));
    RawUpload upload =
        RawUpload.create(
            ImmutableList.of(
                UploadedFile.create("good.info", "SF:a.c\nDA:1,1\nend_of_record\n"),
                UploadedFile.create("bad.txt", "line zero\n")));

    UploadProcessingResult result =
        new UploadProcessor(context, decoders)
            .process(new Report(), upload, Session.builder().build());

    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0).filename()).isEqualTo("bad.txt");
    assertThat(result.errors().get(0).kind()).isEqualTo(FileError.Kind.CORRUPT);
    assertThat(result.mergeResult().report().files().keySet()).containsExactly("a.c");
    assertThat(result.mergeResult().session().id()).isEqualTo(0);
    assertThat(context.counters().decodedFiles()).isEqualTo(1);
    assertThat(context.counters().corruptFiles()).isEqualTo(1);
  }
}
